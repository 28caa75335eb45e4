package com.ble.cube.dto;

/** Circle on the earth's surface: center in degrees, radius in meters. */
public record GeoRadius(double latitude, double longitude, double radiusMeters) {}
