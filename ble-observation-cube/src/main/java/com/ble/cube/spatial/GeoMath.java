package com.ble.cube.spatial;

import com.ble.cube.dto.GeoVertex;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

/**
 * Geometry helpers for the spatial queries.
 *
 * <p>Coordinates are handled as (latitude, longitude) pairs throughout. In JTS envelopes latitude is
 * the x axis and longitude is the y axis.
 */
public final class GeoMath {

    /** Mean earth radius used by the haversine distance. */
    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    /**
     * Meters per degree used to turn a radius into a square search envelope. Applied to latitude and
     * longitude alike, so the envelope does not widen with latitude.
     */
    public static final double METERS_PER_DEGREE = 111_000.0;

    /** Minimum vertex count of a polygon query. */
    public static final int MIN_POLYGON_VERTICES = 3;

    private GeoMath() {}

    /**
     * Great-circle distance in meters between two points given in degrees.
     */
    public static double haversineMeters(double lat1, double lon1, double lat2, double lon2) {
        double lat1Rad = Math.toRadians(lat1);
        double lat2Rad = Math.toRadians(lat2);
        double deltaLat = Math.toRadians(lat2 - lat1);
        double deltaLon = Math.toRadians(lon2 - lon1);

        double sinHalfLat = Math.sin(deltaLat / 2);
        double sinHalfLon = Math.sin(deltaLon / 2);
        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_METERS * c;
    }

    /**
     * Square envelope of half-side {@code radiusMeters / METERS_PER_DEGREE} degrees around the center.
     * Coarse pre-filter only; callers refine candidates with {@link #haversineMeters}.
     */
    public static Envelope radiusEnvelope(double latitude, double longitude, double radiusMeters) {
        double radiusDegrees = radiusMeters / METERS_PER_DEGREE;
        return new Envelope(
                latitude - radiusDegrees, latitude + radiusDegrees,
                longitude - radiusDegrees, longitude + radiusDegrees);
    }

    /** Axis-aligned envelope; corners may be given in either order. */
    public static Envelope boxEnvelope(double minLat, double minLon, double maxLat, double maxLon) {
        return new Envelope(minLat, maxLat, minLon, maxLon);
    }

    /** Smallest envelope holding every vertex. */
    public static Envelope polygonEnvelope(List<GeoVertex> polygon) {
        Envelope envelope = new Envelope();
        for (GeoVertex vertex : polygon) {
            envelope.expandToInclude(vertex.latitude(), vertex.longitude());
        }
        return envelope;
    }

    /**
     * Ray-casting containment test. Casts a ray from the point along the latitude axis and flips the
     * inside flag at every edge it crosses. Assumes a simple polygon; the answer for repeated vertices
     * or zero-length edges is not defined.
     */
    public static boolean pointInPolygon(double lat, double lon, List<GeoVertex> polygon) {
        boolean inside = false;
        int n = polygon.size();

        for (int i = 0, j = n - 1; i < n; j = i++) {
            GeoVertex vi = polygon.get(i);
            GeoVertex vj = polygon.get(j);

            if ((vi.longitude() > lon) != (vj.longitude() > lon)) {
                double crossingLat = (vj.latitude() - vi.latitude()) * (lon - vi.longitude())
                        / (vj.longitude() - vi.longitude()) + vi.latitude();
                if (lat < crossingLat) {
                    inside = !inside;
                }
            }
        }

        return inside;
    }
}
