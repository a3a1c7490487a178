package com.devicehub.bus;

/**
 * Thrown when a message cannot be delivered or a reply does not arrive.
 */
public class BusException extends Exception {

    public BusException(String message) {
        super(message);
    }

    public BusException(String message, Throwable cause) {
        super(message, cause);
    }
}
