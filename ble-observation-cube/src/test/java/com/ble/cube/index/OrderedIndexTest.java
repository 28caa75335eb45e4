package com.ble.cube.index;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OrderedIndexTest {

    private RssiIndex rssiIndex;
    private TimestampIndex timeIndex;

    @BeforeEach
    void setUp() {
        rssiIndex = new RssiIndex();
        // ids: 0 -> -50, 1 -> -70, 2 -> -90, 3 -> -50, 4 -> -70
        rssiIndex.add((byte) -50, 0);
        rssiIndex.add((byte) -70, 1);
        rssiIndex.add((byte) -90, 2);
        rssiIndex.add((byte) -50, 3);
        rssiIndex.add((byte) -70, 4);

        timeIndex = new TimestampIndex();
        timeIndex.add(300L, 0);
        timeIndex.add(100L, 1);
        timeIndex.add(200L, 2);
        timeIndex.add(100L, 3);
    }

    @Test
    void range_shouldGroupByAscendingKeyThenInsertionOrder() {
        assertThat(rssiIndex.range((byte) -90, (byte) -50)).containsExactly(2, 1, 4, 0, 3);
        assertThat(timeIndex.range(100L, 200L)).containsExactly(1, 3, 2);
    }

    @Test
    void range_shouldIncludeBothEndpoints() {
        assertThat(rssiIndex.range((byte) -80, (byte) -60)).containsExactly(1, 4);
        assertThat(rssiIndex.range((byte) -70, (byte) -70)).containsExactly(1, 4);
    }

    @Test
    void range_shouldBeEmpty_whenBoundsInverted() {
        assertThat(rssiIndex.range((byte) -50, (byte) -90)).isEmpty();
        assertThat(timeIndex.range(300L, 100L)).isEmpty();
    }

    @Test
    void exclusiveAndInclusiveThresholds() {
        assertThat(rssiIndex.greaterThan((byte) -70)).containsExactly(0, 3);
        assertThat(rssiIndex.greaterOrEqual((byte) -70)).containsExactly(1, 4, 0, 3);
        assertThat(rssiIndex.lessThan((byte) -70)).containsExactly(2);
        assertThat(rssiIndex.lessOrEqual((byte) -70)).containsExactly(2, 1, 4);
        assertThat(timeIndex.greaterThan(100L)).containsExactly(2, 0);
        assertThat(timeIndex.lessThan(300L)).containsExactly(1, 3, 2);
    }

    @Test
    void greaterThan_shouldBeEmptyAtTopOfDomain() {
        rssiIndex.add(Byte.MAX_VALUE, 5);
        timeIndex.add(Long.MAX_VALUE, 4);

        assertThat(rssiIndex.greaterThan(Byte.MAX_VALUE)).isEmpty();
        assertThat(rssiIndex.greaterOrEqual(Byte.MAX_VALUE)).containsExactly(5);
        assertThat(timeIndex.greaterThan(Long.MAX_VALUE)).isEmpty();
    }

    @Test
    void lessThan_shouldBeEmptyAtBottomOfDomain() {
        rssiIndex.add(Byte.MIN_VALUE, 5);

        assertThat(rssiIndex.lessThan(Byte.MIN_VALUE)).isEmpty();
        assertThat(rssiIndex.lessOrEqual(Byte.MIN_VALUE)).containsExactly(5);
        assertThat(timeIndex.lessThan(Long.MIN_VALUE)).isEmpty();
    }

    @Test
    void exact_shouldReturnEmpty_whenKeyUnknown() {
        assertThat(rssiIndex.exact((byte) -10)).isEmpty();
        assertThat(timeIndex.exact(999L)).isEmpty();
        assertThat(timeIndex.exact(100L)).containsExactly(1, 3);
        assertThat(rssiIndex.distinctKeys()).isEqualTo(3);
    }
}
