package com.ble.cube.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Sorted mapping from a key to the identifiers of every record with that key value.
 *
 * <p>Range results are grouped by ascending key and, within a key, listed in insertion order.
 * Bounds are inclusive unless the method says otherwise. An inverted range is empty.
 *
 * @param <K> the indexed field type
 */
public class OrderedIndex<K extends Comparable<K>> {

    private final NavigableMap<K, List<Integer>> buckets = new TreeMap<>();

    public void add(K key, int recordId) {
        buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(recordId);
    }

    public List<Integer> exact(K key) {
        List<Integer> bucket = buckets.get(key);
        return bucket == null ? Collections.emptyList() : Collections.unmodifiableList(bucket);
    }

    /** Keys in {@code [min, max]}. */
    public List<Integer> range(K min, K max) {
        if (min.compareTo(max) > 0) {
            return Collections.emptyList();
        }
        return flatten(buckets.subMap(min, true, max, true).values());
    }

    /** Keys strictly greater than the threshold. */
    public List<Integer> greaterThan(K threshold) {
        return flatten(buckets.tailMap(threshold, false).values());
    }

    public List<Integer> greaterOrEqual(K threshold) {
        return flatten(buckets.tailMap(threshold, true).values());
    }

    /** Keys strictly less than the threshold. */
    public List<Integer> lessThan(K threshold) {
        return flatten(buckets.headMap(threshold, false).values());
    }

    public List<Integer> lessOrEqual(K threshold) {
        return flatten(buckets.headMap(threshold, true).values());
    }

    public int distinctKeys() {
        return buckets.size();
    }

    private static List<Integer> flatten(Collection<List<Integer>> matchingBuckets) {
        List<Integer> recordIds = new ArrayList<>();
        for (List<Integer> bucket : matchingBuckets) {
            recordIds.addAll(bucket);
        }
        return recordIds;
    }
}
