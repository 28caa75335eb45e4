package com.ble.cube.config;

import com.ble.cube.query.BleCube;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the cube and its metrics registry.
 */
@Configuration
@EnableConfigurationProperties(CubeProperties.class)
public class BleCubeConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(BleCubeConfiguration.class);

    @Bean
    public BleCube bleCube(CubeProperties properties) {
        logger.info("Creating observation cube (expected records: {}, expected distinct MACs: {})",
                properties.expectedRecords(), properties.expectedDistinctMacs());
        if (properties.expectedRecords() == 0 && properties.expectedDistinctMacs() == 0) {
            return new BleCube();
        }
        return BleCube.withCapacity(properties.expectedRecords(), properties.expectedDistinctMacs());
    }

    /**
     * Fallback registry for contexts without actuator. An application-provided registry takes
     * precedence.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry simpleMeterRegistry() {
        return new SimpleMeterRegistry();
    }
}
