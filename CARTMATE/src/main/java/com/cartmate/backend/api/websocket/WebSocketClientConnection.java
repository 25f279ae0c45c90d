package com.cartmate.backend.api.websocket;

import com.cartmate.backend.exception.TransportException;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * {@link ClientConnection} backed by a WebFlux session. Frames are buffered in a sink that the
 * handler drains into {@link WebSocketSession#send}.
 */
public class WebSocketClientConnection implements ClientConnection {

    private final WebSocketSession session;
    private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();

    public WebSocketClientConnection(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public Mono<Void> send(String payload) {
        return Mono.defer(() -> {
            Sinks.EmitResult result;
            synchronized (outbound) {
                result = outbound.tryEmitNext(payload);
            }
            return result.isSuccess()
                    ? Mono.<Void>empty()
                    : Mono.<Void>error(new TransportException("Connection " + getId() + " rejected frame: " + result));
        });
    }

    @Override
    public Mono<Void> close() {
        synchronized (outbound) {
            outbound.tryEmitComplete();
        }
        return session.close();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    public Flux<String> outbound() {
        return outbound.asFlux();
    }
}
