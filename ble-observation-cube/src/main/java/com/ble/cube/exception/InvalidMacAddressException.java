package com.ble.cube.exception;

/**
 * Exception thrown when a hardware address cannot be built from the supplied bytes or text.
 */
public class InvalidMacAddressException extends RuntimeException {

    public InvalidMacAddressException(String message) {
        super(message);
    }

    public InvalidMacAddressException(String message, Throwable cause) {
        super(message, cause);
    }
}
