package com.cartmate.backend.exception;

import lombok.Getter;

/**
 * Transport-level failure handing a message to the bus. Triggers the sender's
 * retry with backoff.
 */
@Getter
public class DeliveryException extends RuntimeException {

    private final String messageId;
    private final String receiver;

    public DeliveryException(String messageId, String receiver, String message) {
        super(message);
        this.messageId = messageId;
        this.receiver = receiver;
    }

    public DeliveryException(String messageId, String receiver, String message, Throwable cause) {
        super(message, cause);
        this.messageId = messageId;
        this.receiver = receiver;
    }
}
