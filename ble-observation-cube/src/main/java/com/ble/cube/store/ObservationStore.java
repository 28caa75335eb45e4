package com.ble.cube.store;

import com.ble.cube.dto.BleObservation;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only arena of observations. A record's identifier is its position in insertion order,
 * starting at 0. Identifiers are never reused and records are never replaced.
 */
public class ObservationStore {

    private final ArrayList<BleObservation> records;

    public ObservationStore() {
        this.records = new ArrayList<>();
    }

    public ObservationStore(int expectedRecords) {
        this.records = new ArrayList<>(Math.max(0, expectedRecords));
    }

    /**
     * Appends the observation.
     *
     * @return the identifier assigned to it
     */
    public int append(@NonNull BleObservation observation) {
        int recordId = records.size();
        records.add(observation);
        return recordId;
    }

    /** Absent when the identifier is outside {@code [0, size())}. */
    public Optional<BleObservation> get(int recordId) {
        if (recordId < 0 || recordId >= records.size()) {
            return Optional.empty();
        }
        return Optional.of(records.get(recordId));
    }

    /**
     * Resolves identifiers to records in the given order. Identifiers the store does not hold are
     * skipped.
     */
    public List<BleObservation> resolve(List<Integer> recordIds) {
        List<BleObservation> resolved = new ArrayList<>(recordIds.size());
        for (int recordId : recordIds) {
            get(recordId).ifPresent(resolved::add);
        }
        return resolved;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
