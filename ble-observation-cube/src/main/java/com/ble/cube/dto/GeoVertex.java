package com.ble.cube.dto;

/** Polygon vertex in degrees. */
public record GeoVertex(double latitude, double longitude) {}
