package com.cartmate.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Time sources for the agent runtime and the gateway. Agents consume their channels and
 * arm retry, ack and reconnection timers on {@code a2aScheduler}.
 */
@Configuration
public class A2aConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler a2aScheduler() {
        return Schedulers.newParallel("a2a", Math.max(2, Runtime.getRuntime().availableProcessors()));
    }
}
