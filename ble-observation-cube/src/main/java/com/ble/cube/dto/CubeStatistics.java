package com.ble.cube.dto;

/**
 * Point-in-time counts over the cube's store and indices.
 */
public record CubeStatistics(
        int recordCount,
        int distinctMacCount,
        int distinctRssiCount,
        int distinctTimestampCount) {}
