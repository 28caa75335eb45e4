package com.ble.cube.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;

/**
 * Configuration properties for the observation cube. Maps to the {@code ble.cube} section in
 * application.yml.
 *
 * <p>The capacity hints only size the initial allocations; they never limit how many observations
 * the cube accepts.
 */
@ConfigurationProperties(prefix = "ble.cube")
@Validated
public record CubeProperties(
        @Min(value = 0, message = "Expected records cannot be negative")
                @DefaultValue("0")
                int expectedRecords,
        @Min(value = 0, message = "Expected distinct MACs cannot be negative")
                @DefaultValue("0")
                int expectedDistinctMacs,

        /** Log every multi-dimensional query at INFO instead of DEBUG. */
        @DefaultValue("false") boolean logQueries) {}
