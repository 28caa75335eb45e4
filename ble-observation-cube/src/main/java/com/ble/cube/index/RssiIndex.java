package com.ble.cube.index;

import java.util.Collections;
import java.util.List;

/**
 * Signal-strength index over the signed 8-bit dBm domain.
 *
 * <p>The exclusive scans are bounded by the domain: nothing lies above {@link Byte#MAX_VALUE} or
 * below {@link Byte#MIN_VALUE}, so those thresholds yield empty results instead of wrapping.
 */
public class RssiIndex extends OrderedIndex<Byte> {

    public void add(byte rssi, int recordId) {
        super.add(rssi, recordId);
    }

    @Override
    public List<Integer> greaterThan(Byte threshold) {
        if (threshold == Byte.MAX_VALUE) {
            return Collections.emptyList();
        }
        return greaterOrEqual((byte) (threshold + 1));
    }

    @Override
    public List<Integer> lessThan(Byte threshold) {
        if (threshold == Byte.MIN_VALUE) {
            return Collections.emptyList();
        }
        return lessOrEqual((byte) (threshold - 1));
    }
}
