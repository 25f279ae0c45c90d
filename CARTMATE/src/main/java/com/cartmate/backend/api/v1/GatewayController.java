package com.cartmate.backend.api.v1;

import com.cartmate.backend.a2a.A2aMessageBus;
import com.cartmate.backend.api.websocket.WebSocketGateway;
import com.cartmate.backend.api.websocket.error.ConnectionErrorHandler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/gateway")
@Tag(name = "Gateway", description = "WebSocket gateway statistics")
public class GatewayController {

    private final WebSocketGateway gateway;
    private final A2aMessageBus messageBus;
    private final ConnectionErrorHandler errorHandler;

    public GatewayController(WebSocketGateway gateway, A2aMessageBus messageBus,
                             ConnectionErrorHandler errorHandler) {
        this.gateway = gateway;
        this.messageBus = messageBus;
        this.errorHandler = errorHandler;
    }

    @GetMapping("/stats")
    @Operation(summary = "Gateway statistics", description = "Connections, message bus and error statistics")
    @ApiResponse(responseCode = "200", description = "Statistics retrieved")
    public Mono<Map<String, Object>> getStats() {
        return Mono.fromSupplier(() -> {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("connections", gateway.getStats());
            stats.put("message_bus", messageBus.getStats());
            stats.put("errors", errorHandler.getErrorStats());
            return stats;
        });
    }
}
