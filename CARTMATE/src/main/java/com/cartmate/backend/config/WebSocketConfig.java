package com.cartmate.backend.config;

import com.cartmate.backend.api.websocket.BackchannelWebSocketHandler;
import com.cartmate.backend.api.websocket.ChatWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps the chat and backchannel WebSocket endpoints.
 */
@Configuration
public class WebSocketConfig {

    @Bean
    public WebSocketHandlerAdapter handlerAdapter() {
        return new WebSocketHandlerAdapter();
    }

    @Bean
    public HandlerMapping webSocketHandlerMapping(CartmateProperties properties,
                                                  ChatWebSocketHandler chatHandler,
                                                  BackchannelWebSocketHandler backchannelHandler) {
        Map<String, WebSocketHandler> map = new HashMap<>();
        map.put(properties.getGateway().getChatPath(), chatHandler);
        map.put(properties.getGateway().getBackchannelPath(), backchannelHandler);

        SimpleUrlHandlerMapping handlerMapping = new SimpleUrlHandlerMapping();
        handlerMapping.setOrder(1);
        handlerMapping.setUrlMap(map);
        return handlerMapping;
    }
}
