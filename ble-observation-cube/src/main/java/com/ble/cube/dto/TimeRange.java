package com.ble.cube.dto;

/** Inclusive timestamp range {@code [start, end]}. */
public record TimeRange(long start, long end) {}
