package com.cartmate.backend.exception;

/**
 * A message whose content does not match its declared kind or request type.
 */
public class InvalidMessageException extends RuntimeException {

    public InvalidMessageException(String message) {
        super(message);
    }
}
