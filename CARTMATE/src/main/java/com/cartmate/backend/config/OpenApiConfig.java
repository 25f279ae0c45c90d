package com.cartmate.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the CartMate backend.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI cartmateOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("CartMate API")
                        .description("""
                                CartMate - conversational shopping assistant backend.
                                
                                Chat runs over WebSocket (`/ws/chat`, `/ws/backchannel`); these endpoints
                                expose agent and gateway status for operators.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("/").description("Current server"),
                        new Server().url("http://localhost:8000").description("Local development")
                ));
    }
}
