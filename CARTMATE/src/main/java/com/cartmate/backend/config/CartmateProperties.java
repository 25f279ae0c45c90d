package com.cartmate.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the CartMate backend.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "cartmate")
public class CartmateProperties {

    @Valid
    private A2aProperties a2a = new A2aProperties();
    @Valid
    private GatewayProperties gateway = new GatewayProperties();
    @Valid
    private ErrorProperties errors = new ErrorProperties();
    @Valid
    private SessionProperties session = new SessionProperties();
    @Valid
    private MemoryProperties memory = new MemoryProperties();
    @Valid
    private PersonalizationProperties personalization = new PersonalizationProperties();
    private StorageProperties storage = new StorageProperties();
    private ClientProperties clients = new ClientProperties();

    @Data
    public static class A2aProperties {
        @Min(1)
        private int directChannelCapacity = 100;
        @Min(0)
        private int maxRetries = 3;
        private Duration retryBackoffBase = Duration.ofSeconds(2);
        private Duration ackTimeout = Duration.ofSeconds(30);
        @NotBlank
        private String broadcastChannel = "a2a_messages";
        @NotBlank
        private String agentChannelPrefix = "agent:";
        @NotBlank
        private String registryKeyPrefix = "a2a:agent:";
    }

    @Data
    public static class GatewayProperties {
        private String chatPath = "/ws/chat";
        private String backchannelPath = "/ws/backchannel";
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        @Min(0)
        private int maxQueuedMessagesPerSession = 50;
    }

    @Data
    public static class ErrorProperties {
        @Min(1)
        private int maxErrorHistory = 50;
        private Duration rateLimitWindow = Duration.ofSeconds(60);
        @Min(1)
        private int rateLimitMaxMessages = 100;
        @Valid
        private ReconnectionProperties reconnection = new ReconnectionProperties();

        @Data
        public static class ReconnectionProperties {
            @Min(0)
            private int maxAttempts = 5;
            private Duration initialDelay = Duration.ofSeconds(1);
            private Duration maxDelay = Duration.ofSeconds(30);
            @DecimalMin("1.0")
            private double backoffMultiplier = 2.0;
            private boolean jitter = true;
        }
    }

    @Data
    public static class SessionProperties {
        private Duration ttl = Duration.ofHours(1);
        @NotBlank
        private String keyPrefix = "session:";
    }

    @Data
    public static class MemoryProperties {
        @Min(1)
        private int maxHistory = 50;
        @Min(1)
        private int contextWindow = 20;
        private Duration ttl = Duration.ofHours(24);
        @NotBlank
        private String keyPrefix = "conversation:";
    }

    @Data
    public static class PersonalizationProperties {
        private Duration ttl = Duration.ofHours(24);
        @NotBlank
        private String keyPrefix = "personalization:";
    }

    @Data
    public static class StorageProperties {
        private String type = "in-memory"; // in-memory, redis
    }

    @Data
    public static class ClientProperties {
        private ServiceClientProperties catalog = new ServiceClientProperties();
        private ServiceClientProperties cart = new ServiceClientProperties();
        private ServiceClientProperties checkout = new ServiceClientProperties();
        private ServiceClientProperties ads = new ServiceClientProperties();

        @Data
        public static class ServiceClientProperties {
            private String baseUrl;
            private Duration timeout = Duration.ofSeconds(10);
        }
    }
}
