package com.ble.cube.index;

/** Timestamp index; the unit is whatever the caller inserts. */
public class TimestampIndex extends OrderedIndex<Long> {

    public void add(long timestamp, int recordId) {
        super.add(timestamp, recordId);
    }
}
