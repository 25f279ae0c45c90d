package com.cartmate.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * CartMate - conversational shopping assistant backend.
 *
 * <p>Chat clients talk to an orchestrator agent over WebSocket. The orchestrator delegates to
 * worker agents (product discovery, cart, checkout, price comparison, ads) over the in-process
 * A2A message bus, and agent activity is mirrored to a backchannel socket.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class CartmateApplication {

    public static void main(String[] args) {
        SpringApplication.run(CartmateApplication.class, args);
    }
}
