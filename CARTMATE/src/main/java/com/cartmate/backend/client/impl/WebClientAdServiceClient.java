package com.cartmate.backend.client.impl;

import com.cartmate.backend.client.AdServiceClient;
import com.cartmate.backend.config.CartmateProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * WebClient-based implementation of AdServiceClient.
 */
@Component
@Slf4j
public class WebClientAdServiceClient implements AdServiceClient {

    private final WebClient webClient;
    private final CartmateProperties.ClientProperties.ServiceClientProperties config;
    private final boolean stubMode;

    public WebClientAdServiceClient(CartmateProperties properties, WebClient.Builder webClientBuilder) {
        this.config = properties.getClients().getAds();
        this.stubMode = config.getBaseUrl() == null || config.getBaseUrl().isBlank();

        if (!stubMode) {
            this.webClient = webClientBuilder.clone()
                    .baseUrl(config.getBaseUrl())
                    .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                    .build();
        } else {
            this.webClient = null;
            log.warn("Ad client running in stub mode - no actual service connection");
        }
    }

    @Override
    @CircuitBreaker(name = "ads")
    public Flux<Ad> getAds(List<String> contextKeys) {
        if (stubMode) {
            return Flux.empty();
        }

        return webClient.get()
                .uri(builder -> builder.path("/api/v1/ads").queryParam("context_keys", contextKeys).build())
                .retrieve()
                .bodyToFlux(Ad.class)
                .timeout(config.getTimeout())
                .doOnError(e -> log.error("Failed to get ads for {}: {}", contextKeys, e.getMessage()));
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return Mono.just(!stubMode);
    }
}
