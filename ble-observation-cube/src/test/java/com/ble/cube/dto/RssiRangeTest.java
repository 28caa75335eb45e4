package com.ble.cube.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RssiRangeTest {

    @Test
    void of_shouldAcceptFullByteDomain() {
        RssiRange range = RssiRange.of(-128, 127);

        assertThat(range.min()).isEqualTo(Byte.MIN_VALUE);
        assertThat(range.max()).isEqualTo(Byte.MAX_VALUE);
    }

    @Test
    void of_shouldRejectMaxAboveByteDomain() {
        assertThatThrownBy(() -> RssiRange.of(-128, 128))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max 128");
    }

    @Test
    void of_shouldRejectMinBelowByteDomain() {
        assertThatThrownBy(() -> RssiRange.of(-129, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("min -129");
    }

    @Test
    void of_shouldKeepInvertedBoundsAsGiven() {
        RssiRange range = RssiRange.of(-40, -90);

        assertThat(range.min()).isEqualTo((byte) -40);
        assertThat(range.max()).isEqualTo((byte) -90);
    }
}
