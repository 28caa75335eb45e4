package com.ble.cube.dto;

/** Inclusive signal-strength range {@code [min, max]} in dBm. */
public record RssiRange(byte min, byte max) {

    /**
     * Builds a range from {@code int} bounds.
     *
     * @throws IllegalArgumentException if either bound lies outside {@code [-128, 127]}
     */
    public static RssiRange of(int min, int max) {
        return new RssiRange(toRssi(min, "min"), toRssi(max, "max"));
    }

    private static byte toRssi(int value, String bound) {
        if (value < Byte.MIN_VALUE || value > Byte.MAX_VALUE) {
            throw new IllegalArgumentException(
                    "RSSI " + bound + " " + value + " outside [" + Byte.MIN_VALUE + ", " + Byte.MAX_VALUE + "]");
        }
        return (byte) value;
    }
}
