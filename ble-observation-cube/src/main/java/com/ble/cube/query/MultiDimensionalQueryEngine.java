package com.ble.cube.query;

import com.ble.cube.dto.GeoRadius;
import com.ble.cube.dto.MultiDimensionalQuery;
import com.ble.cube.dto.RssiRange;
import com.ble.cube.dto.TimeRange;
import com.ble.cube.index.MacAddressIndex;
import com.ble.cube.index.RssiIndex;
import com.ble.cube.index.TimestampIndex;
import com.ble.cube.spatial.SpatialIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves a {@link MultiDimensionalQuery} to record identifiers.
 *
 * <p>The starting candidates are the MAC bucket when a MAC filter is given, otherwise every
 * identifier in the store. The candidates are then narrowed, in the fixed order RSSI, timestamp,
 * geo radius, to those present in each dimension's independently computed match set. Narrowing
 * never reorders, so the result keeps the order of the starting candidates.
 */
public class MultiDimensionalQueryEngine {

    private static final Logger logger = LoggerFactory.getLogger(MultiDimensionalQueryEngine.class);

    private final MacAddressIndex macIndex;
    private final RssiIndex rssiIndex;
    private final TimestampIndex timeIndex;
    private final SpatialIndex geoIndex;

    public MultiDimensionalQueryEngine(
            MacAddressIndex macIndex,
            RssiIndex rssiIndex,
            TimestampIndex timeIndex,
            SpatialIndex geoIndex) {
        this.macIndex = macIndex;
        this.rssiIndex = rssiIndex;
        this.timeIndex = timeIndex;
        this.geoIndex = geoIndex;
    }

    /**
     * @param query the filters to apply
     * @param recordCount number of records in the store; bounds the full scan
     * @return matching identifiers
     */
    public List<Integer> resolve(MultiDimensionalQuery query, int recordCount) {
        List<Integer> candidates = startingCandidates(query, recordCount);

        if (query.rssiRange().isPresent()) {
            RssiRange range = query.rssiRange().get();
            candidates = retainPresent(candidates, rssiIndex.range(range.min(), range.max()));
            logger.debug("After RSSI {}..{}: {} candidates", range.min(), range.max(), candidates.size());
        }

        if (query.timeRange().isPresent()) {
            TimeRange range = query.timeRange().get();
            candidates = retainPresent(candidates, timeIndex.range(range.start(), range.end()));
            logger.debug("After time {}..{}: {} candidates", range.start(), range.end(), candidates.size());
        }

        if (query.geoRadius().isPresent()) {
            GeoRadius circle = query.geoRadius().get();
            candidates = retainPresent(
                    candidates,
                    geoIndex.withinRadius(circle.latitude(), circle.longitude(), circle.radiusMeters()));
            logger.debug("After geo radius {}m: {} candidates", circle.radiusMeters(), candidates.size());
        }

        return candidates;
    }

    private List<Integer> startingCandidates(MultiDimensionalQuery query, int recordCount) {
        if (query.mac().isPresent()) {
            return new ArrayList<>(macIndex.lookup(query.mac().get()));
        }
        List<Integer> all = new ArrayList<>(recordCount);
        for (int recordId = 0; recordId < recordCount; recordId++) {
            all.add(recordId);
        }
        return all;
    }

    private static List<Integer> retainPresent(List<Integer> candidates, List<Integer> dimensionMatches) {
        if (candidates.isEmpty()) {
            return candidates;
        }
        Set<Integer> matchSet = new HashSet<>(dimensionMatches);
        List<Integer> retained = new ArrayList<>(Math.min(candidates.size(), matchSet.size()));
        for (Integer recordId : candidates) {
            if (matchSet.contains(recordId)) {
                retained.add(recordId);
            }
        }
        return retained;
    }
}
