package com.cartmate.backend.client;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client interface for the ad service.
 */
public interface AdServiceClient {

    /**
     * @param contextKeys categories or keywords to match; empty for random ads
     */
    Flux<Ad> getAds(List<String> contextKeys);

    Mono<Boolean> isAvailable();

    record Ad(String redirectUrl, String text) {
    }
}
