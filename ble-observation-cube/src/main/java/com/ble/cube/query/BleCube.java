package com.ble.cube.query;

import com.ble.cube.dto.BleObservation;
import com.ble.cube.dto.CubeStatistics;
import com.ble.cube.dto.GeoVertex;
import com.ble.cube.dto.MacAddress;
import com.ble.cube.dto.MultiDimensionalQuery;
import com.ble.cube.index.MacAddressIndex;
import com.ble.cube.index.RssiIndex;
import com.ble.cube.index.TimestampIndex;
import com.ble.cube.spatial.SpatialIndex;
import com.ble.cube.store.ObservationStore;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * In-memory four-dimensional index of BLE observations keyed by hardware address, signal strength,
 * timestamp and position.
 *
 * <p>The {@link ObservationStore} holds the only copy of each record. Every index stores record
 * identifiers, and each identifier in the store sits in exactly one bucket of each flat index and in
 * one spatial entry. {@link #insert} is the only mutation and the indices are never handed out.</p>
 *
 * <p><strong>Indexed Dimensions:</strong></p>
 * <ul>
 *   <li><strong>MAC address:</strong> exact lookup in insertion order, sorted key listing</li>
 *   <li><strong>RSSI:</strong> exact, inclusive range and strict or inclusive thresholds</li>
 *   <li><strong>Timestamp:</strong> exact, inclusive range, strictly after and strictly before</li>
 *   <li><strong>Position:</strong> haversine radius, bounding box and polygon</li>
 * </ul>
 *
 * <p><strong>Result Ordering:</strong></p>
 * <ul>
 *   <li>Flat index results follow ascending key, then insertion order within a key</li>
 *   <li>Spatial results follow ascending record identifier</li>
 *   <li>{@link #queryMulti} keeps the order of its starting candidate list</li>
 * </ul>
 *
 * <p>Not thread-safe. Writers must be serialized by the caller, and reads may only run concurrently
 * while no insert is in progress.</p>
 */
public class BleCube implements ObservationQueries {

    private final ObservationStore records;
    private final MacAddressIndex macIndex;
    private final RssiIndex rssiIndex = new RssiIndex();
    private final TimestampIndex timeIndex = new TimestampIndex();
    private final SpatialIndex geoIndex = new SpatialIndex();
    private final MultiDimensionalQueryEngine multiQueryEngine;

    public BleCube() {
        this(new ObservationStore(), new MacAddressIndex());
    }

    private BleCube(ObservationStore records, MacAddressIndex macIndex) {
        this.records = records;
        this.macIndex = macIndex;
        this.multiQueryEngine = new MultiDimensionalQueryEngine(macIndex, rssiIndex, timeIndex, geoIndex);
    }

    /**
     * Creates a cube with preallocated room. The hints only affect allocation.
     *
     * @param expectedRecords expected number of observations
     * @param expectedDistinctMacs expected number of distinct hardware addresses
     */
    public static BleCube withCapacity(int expectedRecords, int expectedDistinctMacs) {
        return new BleCube(new ObservationStore(expectedRecords), new MacAddressIndex(expectedDistinctMacs));
    }

    /**
     * Appends the observation and threads its identifier into every index.
     *
     * @return the identifier, equal to the number of records inserted before it
     */
    public int insert(@NonNull BleObservation observation) {
        int recordId = records.append(observation);
        macIndex.add(observation.getMac(), recordId);
        rssiIndex.add(observation.getRssi(), recordId);
        timeIndex.add(observation.getTimestamp(), recordId);
        geoIndex.add(observation.getLatitude(), observation.getLongitude(), recordId);
        return recordId;
    }

    /**
     * Inserts each observation in iteration order.
     *
     * @return the assigned identifiers, in the same order
     */
    public List<Integer> insertAll(@NonNull Collection<BleObservation> observations) {
        List<Integer> recordIds = new ArrayList<>(observations.size());
        for (BleObservation observation : observations) {
            recordIds.add(insert(observation));
        }
        return recordIds;
    }

    @Override
    public Optional<BleObservation> get(int recordId) {
        return records.get(recordId);
    }

    @Override
    public int size() {
        return records.size();
    }

    @Override
    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Summarizes the cube from the index key counts without touching the stored records.
     *
     * @return record count plus the number of distinct MACs, RSSI values and timestamps
     */
    @Override
    public CubeStatistics statistics() {
        return new CubeStatistics(
                records.size(), macIndex.distinctKeys(), rssiIndex.distinctKeys(), timeIndex.distinctKeys());
    }

    // ===== MAC ADDRESS =====

    @Override
    public List<BleObservation> queryMac(MacAddress mac) {
        return records.resolve(macIndex.lookup(mac));
    }

    @Override
    public List<MacAddress> getAllMacs() {
        return macIndex.sortedKeys();
    }

    // ===== RSSI =====

    @Override
    public List<BleObservation> queryRssi(byte rssi) {
        return records.resolve(rssiIndex.exact(rssi));
    }

    @Override
    public List<BleObservation> queryRssiRange(byte min, byte max) {
        return records.resolve(rssiIndex.range(min, max));
    }

    @Override
    public List<BleObservation> queryRssiGt(byte threshold) {
        return records.resolve(rssiIndex.greaterThan(threshold));
    }

    @Override
    public List<BleObservation> queryRssiGte(byte threshold) {
        return records.resolve(rssiIndex.greaterOrEqual(threshold));
    }

    @Override
    public List<BleObservation> queryRssiLt(byte threshold) {
        return records.resolve(rssiIndex.lessThan(threshold));
    }

    @Override
    public List<BleObservation> queryRssiLte(byte threshold) {
        return records.resolve(rssiIndex.lessOrEqual(threshold));
    }

    // ===== TIMESTAMP =====

    @Override
    public List<BleObservation> queryTimestamp(long timestamp) {
        return records.resolve(timeIndex.exact(timestamp));
    }

    @Override
    public List<BleObservation> queryTimeRange(long start, long end) {
        return records.resolve(timeIndex.range(start, end));
    }

    @Override
    public List<BleObservation> queryTimeAfter(long timestamp) {
        return records.resolve(timeIndex.greaterThan(timestamp));
    }

    @Override
    public List<BleObservation> queryTimeBefore(long timestamp) {
        return records.resolve(timeIndex.lessThan(timestamp));
    }

    // ===== GEOLOCATION =====

    @Override
    public List<BleObservation> queryGeoRadius(double latitude, double longitude, double radiusMeters) {
        return records.resolve(geoIndex.withinRadius(latitude, longitude, radiusMeters));
    }

    @Override
    public List<BleObservation> queryGeoBbox(double minLat, double minLon, double maxLat, double maxLon) {
        return records.resolve(geoIndex.withinBox(minLat, minLon, maxLat, maxLon));
    }

    @Override
    public List<BleObservation> queryGeoPolygon(List<GeoVertex> vertices) {
        return records.resolve(geoIndex.withinPolygon(vertices));
    }

    // ===== MULTI-DIMENSIONAL =====

    /**
     * Resolves a conjunctive query. The MAC filter, when present, picks the starting candidates;
     * otherwise every record is a candidate. RSSI, time and radius filters then narrow that list.
     *
     * @param query the filters to apply; unset filters match everything
     * @return matching records in starting candidate order
     */
    @Override
    public List<BleObservation> queryMulti(@NonNull MultiDimensionalQuery query) {
        return records.resolve(multiQueryEngine.resolve(query, records.size()));
    }
}
