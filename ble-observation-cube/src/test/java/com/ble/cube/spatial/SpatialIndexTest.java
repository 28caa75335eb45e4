package com.ble.cube.spatial;

import static org.assertj.core.api.Assertions.assertThat;

import com.ble.cube.dto.GeoVertex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

class SpatialIndexTest {

    private SpatialIndex index;

    @BeforeEach
    void setUp() {
        index = new SpatialIndex();
        index.add(37.7749, -122.4194, 0); // San Francisco
        index.add(37.8044, -122.2712, 1); // Oakland
        index.add(37.7750, -122.4195, 2); // next to San Francisco
        index.add(40.7128, -74.0060, 3); // New York
    }

    @Test
    void withinRadius_shouldRefineEnvelopeCandidatesByDistance() {
        assertThat(index.withinRadius(37.7749, -122.4194, 10_000)).containsExactly(0, 2);
        assertThat(index.withinRadius(37.7749, -122.4194, 20_000)).containsExactly(0, 1, 2);
    }

    @Test
    void withinRadius_shouldGrowMonotonicallyWithRadius() {
        List<Integer> previous = List.of();
        for (double radius : new double[] {0, 5, 1_000, 13_000, 14_000, 50_000, 6_000_000}) {
            List<Integer> current = index.withinRadius(37.7749, -122.4194, radius);
            assertThat(current).containsAll(previous);
            previous = current;
        }
        assertThat(previous).containsExactly(0, 1, 2, 3);
    }

    @Test
    void withinRadius_shouldIncludePointAtCenterForZeroRadius() {
        assertThat(index.withinRadius(40.7128, -74.0060, 0)).containsExactly(3);
    }

    @Test
    void withinBox_shouldIncludeEdgesAndAcceptEitherCornerOrder() {
        assertThat(index.withinBox(37.7749, -122.4194, 37.8044, -122.2712)).containsExactly(0, 1);
        assertThat(index.withinBox(37.8044, -122.2712, 37.7749, -122.4194)).containsExactly(0, 1);
        assertThat(index.withinBox(0, 0, 1, 1)).isEmpty();
    }

    @Test
    void withinPolygon_shouldRequireThreeVertices() {
        List<GeoVertex> segment = List.of(new GeoVertex(37.0, -123.0), new GeoVertex(38.0, -122.0));

        assertThat(index.withinPolygon(segment)).isEmpty();
        assertThat(index.withinPolygon(List.of())).isEmpty();
        assertThat(index.withinPolygon(null)).isEmpty();
    }

    @Test
    void withinPolygon_shouldKeepOnlyContainedPoints() {
        // Triangle over the bay: its bounding box holds both cities, the triangle only San Francisco.
        List<GeoVertex> triangle = List.of(
                new GeoVertex(37.70, -122.50),
                new GeoVertex(37.90, -122.50),
                new GeoVertex(37.70, -122.20));

        assertThat(index.withinPolygon(triangle)).containsExactly(0, 2);
    }

    @Test
    void size_shouldCountEntries() {
        assertThat(index.size()).isEqualTo(4);
    }
}
