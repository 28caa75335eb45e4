package com.ble.cube.dto;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single BLE beacon observation.
 *
 * <p>Values are stored exactly as given. Signal strength, timestamp and coordinates are not checked
 * against any physical range; implausible values are indexed like any other.
 */
@Value
@Builder
public class BleObservation {

    /** Received signal strength in dBm. */
    byte rssi;

    @NonNull
    MacAddress mac;

    /** Caller-defined unit (seconds, milliseconds or microseconds since the epoch). */
    long timestamp;

    /** Degrees. */
    double latitude;

    /** Degrees. */
    double longitude;
}
