package com.ble.cube.query;

import com.ble.cube.dto.BleObservation;
import com.ble.cube.dto.CubeStatistics;
import com.ble.cube.dto.GeoVertex;
import com.ble.cube.dto.MacAddress;
import com.ble.cube.dto.MultiDimensionalQuery;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of an observation cube. Nothing reachable through this interface mutates state, and
 * repeated calls against an unchanged cube return equal results.
 *
 * <p>Unknown keys and out-of-range identifiers produce empty results, never exceptions. Results of
 * the flat-index queries are grouped by ascending key and, within a key, by insertion order. Spatial
 * results are in ascending identifier order.
 */
public interface ObservationQueries {

    Optional<BleObservation> get(int recordId);

    int size();

    boolean isEmpty();

    CubeStatistics statistics();

    // ===== MAC ADDRESS =====

    /** Every observation of the address, in insertion order. */
    List<BleObservation> queryMac(MacAddress mac);

    /** Distinct addresses, sorted by unsigned byte order. */
    List<MacAddress> getAllMacs();

    // ===== RSSI =====

    List<BleObservation> queryRssi(byte rssi);

    /** Inclusive {@code [min, max]}. */
    List<BleObservation> queryRssiRange(byte min, byte max);

    List<BleObservation> queryRssiGt(byte threshold);

    List<BleObservation> queryRssiGte(byte threshold);

    List<BleObservation> queryRssiLt(byte threshold);

    List<BleObservation> queryRssiLte(byte threshold);

    // ===== TIMESTAMP =====

    List<BleObservation> queryTimestamp(long timestamp);

    /** Inclusive {@code [start, end]}. */
    List<BleObservation> queryTimeRange(long start, long end);

    /** Strictly after. */
    List<BleObservation> queryTimeAfter(long timestamp);

    /** Strictly before. */
    List<BleObservation> queryTimeBefore(long timestamp);

    // ===== GEOLOCATION =====

    List<BleObservation> queryGeoRadius(double latitude, double longitude, double radiusMeters);

    List<BleObservation> queryGeoBbox(double minLat, double minLon, double maxLat, double maxLon);

    /** Empty for fewer than three vertices. */
    List<BleObservation> queryGeoPolygon(List<GeoVertex> vertices);

    // ===== MULTI-DIMENSIONAL =====

    /**
     * Conjunction of the filters present in the query, in identifier order of the starting candidate
     * set (the MAC bucket, or every record when no MAC filter is given).
     */
    List<BleObservation> queryMulti(MultiDimensionalQuery query);
}
