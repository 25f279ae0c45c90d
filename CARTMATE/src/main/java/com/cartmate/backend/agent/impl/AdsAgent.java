package com.cartmate.backend.agent.impl;

import com.cartmate.backend.agent.AgentRuntime;
import com.cartmate.backend.agent.BaseAgent;
import com.cartmate.backend.client.AdServiceClient;
import com.cartmate.backend.domain.model.A2aRequest;
import com.cartmate.backend.domain.model.payload.AdQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.cartmate.backend.domain.model.FrontendNotification.NotificationType.AGENT_ACTION;
import static com.cartmate.backend.domain.model.FrontendNotification.NotificationType.AGENT_THINKING;

/**
 * Fetches contextual ads for the chat sidebar.
 */
@Component
@Slf4j
public class AdsAgent extends BaseAgent {

    public static final String AGENT_ID = "ads_001";
    public static final String AGENT_TYPE = "ads";

    private final AdServiceClient adClient;

    public AdsAgent(AgentRuntime runtime, AdServiceClient adClient) {
        super(AGENT_ID, AGENT_TYPE, "Ads Agent", List.of("get_ads", "contextual_ads", "random_ads"), runtime);
        this.adClient = adClient;
    }

    @Override
    protected Mono<Boolean> handleRequest(A2aRequest request) {
        return switch (request.getRequestType()) {
            case GET_ADS -> getAds(request, request.payloadAs(AdQuery.class));
            default -> rejectUnsupported(request);
        };
    }

    private Mono<Boolean> getAds(A2aRequest request, AdQuery query) {
        return adClient.isAvailable().flatMap(available -> {
            if (!available) {
                return failRequest(request, "Ad service unavailable");
            }
            return notifyRequester(request, AGENT_THINKING, "Fetching ads...")
                    .then(adClient.getAds(query.contextKeys())
                            .map(ad -> {
                                Map<String, Object> entry = new LinkedHashMap<>();
                                entry.put("redirect_url", ad.redirectUrl());
                                entry.put("text", ad.text());
                                return entry;
                            })
                            .collectList())
                    .flatMap(ads -> {
                        log.info("Fetched {} ads for context {}", ads.size(), query.contextKeys());
                        Map<String, Object> data = new LinkedHashMap<>();
                        data.put("ads", ads);
                        data.put("context_keys", query.contextKeys());
                        return notifyRequester(request, AGENT_ACTION, "Fetched " + ads.size() + " ad(s)")
                                .then(reply(request, data));
                    })
                    .onErrorResume(e -> failRequest(request, "Error fetching ads: " + e.getMessage()));
        });
    }
}
