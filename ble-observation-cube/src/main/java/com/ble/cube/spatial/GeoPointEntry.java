package com.ble.cube.spatial;

/** A point in the spatial index, tagged with the record it belongs to. */
record GeoPointEntry(double latitude, double longitude, int recordId) {}
