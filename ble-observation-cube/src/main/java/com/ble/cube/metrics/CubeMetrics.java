package com.ble.cube.metrics;

import com.ble.cube.query.ObservationQueries;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer instrumentation for the observation cube.
 *
 * <p>Counters and timers are updated by {@code ObservationCubeService}; the gauges read the cube's
 * read-only view each time the registry is scraped.</p>
 *
 * <p><strong>Metric Categories:</strong></p>
 * <ul>
 *   <li><strong>Ingestion:</strong> {@code ble.cube.observations.inserted.total}, observations
 *       inserted since startup</li>
 *   <li><strong>Cube State:</strong> {@code ble.cube.observations.size} for records held and
 *       {@code ble.cube.macs.distinct} for distinct hardware addresses</li>
 *   <li><strong>Query Performance:</strong> {@code ble.cube.query.multi.duration}, latency of
 *       multi-dimensional queries</li>
 * </ul>
 */
@Component
public class CubeMetrics {

    private final Counter insertedCounter;
    private final Timer multiQueryTimer;

    public CubeMetrics(MeterRegistry meterRegistry, ObservationQueries cube) {
        this.insertedCounter = Counter.builder("ble.cube.observations.inserted.total")
                .description("Total number of observations inserted into the cube")
                .register(meterRegistry);

        this.multiQueryTimer = Timer.builder("ble.cube.query.multi.duration")
                .description("Time taken to resolve multi-dimensional queries")
                .register(meterRegistry);

        Gauge.builder("ble.cube.observations.size", cube, ObservationQueries::size)
                .description("Number of observations currently held")
                .register(meterRegistry);

        Gauge.builder("ble.cube.macs.distinct", cube, c -> c.statistics().distinctMacCount())
                .description("Number of distinct hardware addresses observed")
                .register(meterRegistry);
    }

    /**
     * Records inserted observations.
     *
     * @param count number of observations just inserted
     */
    public void recordInserted(int count) {
        insertedCounter.increment(count);
    }

    /**
     * Runs a multi-dimensional query and records its duration, including when it throws.
     *
     * @param query the query to run
     * @return whatever the query returns
     */
    public <T> T timeMultiQuery(Supplier<T> query) {
        long start = System.nanoTime();
        try {
            return query.get();
        } finally {
            multiQueryTimer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        }
    }
}
