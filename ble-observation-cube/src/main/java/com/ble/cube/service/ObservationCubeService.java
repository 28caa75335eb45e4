package com.ble.cube.service;

import com.ble.cube.config.CubeProperties;
import com.ble.cube.dto.BleObservation;
import com.ble.cube.dto.MultiDimensionalQuery;
import com.ble.cube.metrics.CubeMetrics;
import com.ble.cube.query.BleCube;
import com.ble.cube.query.ObservationQueries;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Single writer of the application's observation cube.
 *
 * <p>Ingestion goes through this service; everyone else gets the cube through
 * {@link #queries()}, which exposes no mutation. No locking is done here: callers that ingest from
 * several threads must serialize those calls, and must not read while an ingest is running.
 */
@Slf4j
@Service
public class ObservationCubeService {

    private final BleCube cube;
    private final CubeMetrics metrics;
    private final CubeProperties properties;

    public ObservationCubeService(BleCube cube, CubeMetrics metrics, CubeProperties properties) {
        this.cube = cube;
        this.metrics = metrics;
        this.properties = properties;
    }

    /** @return the identifier assigned to the observation */
    public int ingest(@NonNull BleObservation observation) {
        int recordId = cube.insert(observation);
        metrics.recordInserted(1);
        log.debug("Ingested observation {} from {}", recordId, observation.getMac());
        return recordId;
    }

    /** @return the identifiers assigned, in iteration order */
    public List<Integer> ingestAll(@NonNull Collection<BleObservation> observations) {
        if (observations.isEmpty()) {
            return List.of();
        }
        List<Integer> recordIds = cube.insertAll(observations);
        metrics.recordInserted(recordIds.size());
        log.info("Ingested batch of {} observations (ids {}..{}), cube size {}",
                recordIds.size(), recordIds.get(0), recordIds.get(recordIds.size() - 1), cube.size());
        return recordIds;
    }

    public List<BleObservation> query(@NonNull MultiDimensionalQuery query) {
        if (query.isUnfiltered()) {
            log.debug("Multi-dimensional query has no filters, scanning all {} observations", cube.size());
        }
        List<BleObservation> results = metrics.timeMultiQuery(() -> cube.queryMulti(query));
        if (properties.logQueries()) {
            log.info("Multi-dimensional query {} matched {} of {} observations", query, results.size(), cube.size());
        } else {
            log.debug("Multi-dimensional query {} matched {} of {} observations", query, results.size(), cube.size());
        }
        return results;
    }

    /** Read-only view of the cube. */
    public ObservationQueries queries() {
        return cube;
    }
}
