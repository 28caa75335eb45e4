package com.ble.cube.dto;

import com.ble.cube.exception.InvalidMacAddressException;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Immutable 6-byte hardware address of a BLE transmitter.
 *
 * <p>Addresses order lexicographically over their bytes, each byte compared as an unsigned value,
 * so {@code 00:..} sorts before {@code 7F:..} which sorts before {@code 80:..}. Text form is
 * upper-case, colon-separated hex ({@code AA:BB:CC:DD:EE:FF}).
 */
public final class MacAddress implements Comparable<MacAddress> {

    /** Number of octets in a hardware address. */
    public static final int LENGTH = 6;

    private static final Pattern MAC_PATTERN =
            Pattern.compile("^[0-9A-Fa-f]{2}([:-][0-9A-Fa-f]{2}){5}$");

    private final byte[] octets;

    private MacAddress(byte[] octets) {
        this.octets = octets;
    }

    /**
     * Creates an address from exactly six raw bytes. The array is copied.
     *
     * @param octets address bytes, most significant first
     * @return the address
     * @throws InvalidMacAddressException if the array is null or not six bytes long
     */
    public static MacAddress of(byte[] octets) {
        if (octets == null || octets.length != LENGTH) {
            throw new InvalidMacAddressException(
                    "MAC address must have exactly " + LENGTH + " bytes, got "
                            + (octets == null ? "null" : octets.length));
        }
        return new MacAddress(octets.clone());
    }

    /**
     * Convenience factory taking the six octets as ints (0..255), e.g. {@code of(0xAA, 0xBB, ...)}.
     */
    public static MacAddress of(int... octets) {
        if (octets == null || octets.length != LENGTH) {
            throw new InvalidMacAddressException(
                    "MAC address must have exactly " + LENGTH + " octets, got "
                            + (octets == null ? "null" : octets.length));
        }
        byte[] bytes = new byte[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            if (octets[i] < 0 || octets[i] > 0xFF) {
                throw new InvalidMacAddressException("Octet out of range at position " + i + ": " + octets[i]);
            }
            bytes[i] = (byte) octets[i];
        }
        return new MacAddress(bytes);
    }

    /**
     * Parses {@code AA:BB:CC:DD:EE:FF} or {@code AA-BB-CC-DD-EE-FF}, case-insensitive.
     *
     * @throws InvalidMacAddressException if the text is not a well-formed address
     */
    public static MacAddress parse(String text) {
        if (text == null || !MAC_PATTERN.matcher(text.trim()).matches()) {
            throw new InvalidMacAddressException("Malformed MAC address: " + text);
        }
        String[] parts = text.trim().split("[:-]");
        byte[] bytes = new byte[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            bytes[i] = (byte) Integer.parseInt(parts[i], 16);
        }
        return new MacAddress(bytes);
    }

    /** @return a copy of the address bytes */
    byte[] toBytes() {
        return octets.clone();
    }

    @Override
    public int compareTo(MacAddress other) {
        return Arrays.compareUnsigned(octets, other.octets);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MacAddress)) {
            return false;
        }
        return Arrays.equals(octets, ((MacAddress) o).octets);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(octets);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(17);
        for (int i = 0; i < LENGTH; i++) {
            if (i > 0) {
                sb.append(':');
            }
            sb.append(String.format(Locale.ROOT, "%02X", octets[i] & 0xFF));
        }
        return sb.toString();
    }
}
