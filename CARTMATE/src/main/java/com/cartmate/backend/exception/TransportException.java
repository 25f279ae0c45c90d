package com.cartmate.backend.exception;

/**
 * Failure writing to a client transport. Treated by the gateway as an implicit disconnect.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
