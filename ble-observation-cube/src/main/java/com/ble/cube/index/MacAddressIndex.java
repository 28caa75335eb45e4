package com.ble.cube.index;

import com.ble.cube.dto.MacAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Unordered mapping from hardware address to the identifiers of every record carrying it.
 * Buckets keep identifiers in insertion order.
 */
public class MacAddressIndex {

    private static final Logger logger = LoggerFactory.getLogger(MacAddressIndex.class);

    private final Map<MacAddress, List<Integer>> buckets;

    public MacAddressIndex() {
        this.buckets = new HashMap<>();
    }

    public MacAddressIndex(int expectedDistinctMacs) {
        this.buckets = new HashMap<>(Math.max(16, (int) (expectedDistinctMacs / 0.75f) + 1));
    }

    public void add(MacAddress mac, int recordId) {
        buckets.computeIfAbsent(mac, key -> {
            logger.debug("New MAC bucket for {}", key);
            return new ArrayList<>();
        }).add(recordId);
    }

    /** Identifiers for the address in insertion order, empty when the address is unknown. */
    public List<Integer> lookup(MacAddress mac) {
        List<Integer> bucket = buckets.get(mac);
        return bucket == null ? Collections.emptyList() : Collections.unmodifiableList(bucket);
    }

    /**
     * Every distinct address, sorted lexicographically by unsigned byte value. The order is produced
     * by sorting, never by the map's iteration order.
     */
    public List<MacAddress> sortedKeys() {
        List<MacAddress> keys = new ArrayList<>(buckets.keySet());
        Collections.sort(keys);
        return keys;
    }

    public int distinctKeys() {
        return buckets.size();
    }
}
