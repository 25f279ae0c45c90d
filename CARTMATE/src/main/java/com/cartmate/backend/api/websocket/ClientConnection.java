package com.cartmate.backend.api.websocket;

import reactor.core.publisher.Mono;

/**
 * Outbound side of one client transport.
 */
public interface ClientConnection {

    String getId();

    /**
     * Writes one text frame. Fails with a {@link com.cartmate.backend.exception.TransportException}
     * when the transport can no longer accept frames.
     */
    Mono<Void> send(String payload);

    Mono<Void> close();

    boolean isOpen();
}
