package com.ble.cube.spatial;

import com.ble.cube.dto.GeoVertex;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.quadtree.Quadtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Point index over (latitude, longitude) backed by a JTS {@link Quadtree}.
 *
 * <p>Latitude is stored on the envelope's x axis and longitude on its y axis. The quadtree accepts
 * inserts after it has been queried, so the index grows alongside the cube.</p>
 *
 * <p><strong>Query Pipeline:</strong></p>
 * <ul>
 *   <li><strong>Envelope search:</strong> the quadtree returns every item in the nodes the search
 *       envelope touches</li>
 *   <li><strong>Containment:</strong> items outside the envelope itself are dropped</li>
 *   <li><strong>Refinement:</strong> haversine distance for radius queries, ray casting for
 *       polygons, none for boxes</li>
 * </ul>
 *
 * <p>All queries return record identifiers in ascending order.</p>
 */
public class SpatialIndex {

    private static final Logger logger = LoggerFactory.getLogger(SpatialIndex.class);

    private final Quadtree tree = new Quadtree();
    private int entryCount;

    /**
     * Adds a point entry tagged with its record identifier.
     *
     * @param latitude latitude in degrees
     * @param longitude longitude in degrees
     * @param recordId identifier of the record at this position
     */
    public void add(double latitude, double longitude, int recordId) {
        GeoPointEntry entry = new GeoPointEntry(latitude, longitude, recordId);
        tree.insert(new Envelope(latitude, latitude, longitude, longitude), entry);
        entryCount++;
    }

    /**
     * Finds records within {@code radiusMeters} (inclusive) of the center by haversine distance.
     *
     * <p>Candidates come from a square envelope of {@code radiusMeters / 111000} degrees on both
     * axes, so at high latitudes or very large radii some points inside the circle are missed.</p>
     *
     * @param latitude center latitude in degrees
     * @param longitude center longitude in degrees
     * @param radiusMeters search radius in meters
     * @return matching record identifiers in ascending order
     */
    public List<Integer> withinRadius(double latitude, double longitude, double radiusMeters) {
        List<GeoPointEntry> candidates = locate(GeoMath.radiusEnvelope(latitude, longitude, radiusMeters));
        List<Integer> matches = new ArrayList<>(candidates.size());
        for (GeoPointEntry entry : candidates) {
            double distance = GeoMath.haversineMeters(latitude, longitude, entry.latitude(), entry.longitude());
            if (distance <= radiusMeters) {
                matches.add(entry.recordId());
            }
        }
        logger.debug("Radius query kept {} of {} envelope candidates", matches.size(), candidates.size());
        return sorted(matches);
    }

    /**
     * Finds records inside the box, edges included. Corners may be given in either order.
     *
     * @return matching record identifiers in ascending order
     */
    public List<Integer> withinBox(double minLat, double minLon, double maxLat, double maxLon) {
        List<GeoPointEntry> candidates = locate(GeoMath.boxEnvelope(minLat, minLon, maxLat, maxLon));
        List<Integer> matches = new ArrayList<>(candidates.size());
        for (GeoPointEntry entry : candidates) {
            matches.add(entry.recordId());
        }
        return sorted(matches);
    }

    /**
     * Finds records inside the polygon by ray casting, pre-filtered by the polygon's bounding box.
     *
     * @param polygon vertices in order; the ring closes implicitly
     * @return matching record identifiers in ascending order, or empty for a null polygon or one
     *     with fewer than three vertices
     */
    public List<Integer> withinPolygon(List<GeoVertex> polygon) {
        if (polygon == null || polygon.size() < GeoMath.MIN_POLYGON_VERTICES) {
            return Collections.emptyList();
        }
        List<GeoPointEntry> candidates = locate(GeoMath.polygonEnvelope(polygon));
        List<Integer> matches = new ArrayList<>(candidates.size());
        for (GeoPointEntry entry : candidates) {
            if (GeoMath.pointInPolygon(entry.latitude(), entry.longitude(), polygon)) {
                matches.add(entry.recordId());
            }
        }
        logger.debug("Polygon query kept {} of {} envelope candidates", matches.size(), candidates.size());
        return sorted(matches);
    }

    /** Number of point entries added. */
    int size() {
        return entryCount;
    }

    @SuppressWarnings("unchecked")
    private List<GeoPointEntry> locate(Envelope searchEnvelope) {
        List<GeoPointEntry> nodeItems = tree.query(searchEnvelope);
        List<GeoPointEntry> contained = new ArrayList<>(nodeItems.size());
        for (GeoPointEntry entry : nodeItems) {
            if (searchEnvelope.covers(entry.latitude(), entry.longitude())) {
                contained.add(entry);
            }
        }
        return contained;
    }

    private static List<Integer> sorted(List<Integer> recordIds) {
        Collections.sort(recordIds);
        return recordIds;
    }
}
