package com.chimera.config;

import com.chimera.event.EventSink;
import com.chimera.event.LoggingEventSink;
import com.chimera.messaging.LoggingOutboundMessenger;
import com.chimera.messaging.OutboundMessenger;
import com.chimera.resilience.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Shared collaborators of the generation pipeline.
 * The event sink and messenger defaults are replaced by any application-provided bean.
 */
@Slf4j
@Configuration
public class GenerationConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * The single breaker for the configured provider endpoint.
     */
    @Bean
    public CircuitBreaker providerCircuitBreaker(ChimeraProperties properties, Clock clock) {
        ChimeraProperties.CircuitBreakerConfig config = properties.getCircuitBreaker();
        String name = properties.getProvider().getName() + "_api";
        log.info("Circuit breaker '{}': threshold={}, recovery={}",
                name, config.getFailureThreshold(), config.getRecoveryTimeout());
        return new CircuitBreaker(name, config.getFailureThreshold(), config.getRecoveryTimeout(), clock);
    }

    /**
     * Single thread draining telemetry events, off the request path.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler eventScheduler() {
        return Schedulers.newSingle("chimera-events", true);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventSink eventSink() {
        return new LoggingEventSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public OutboundMessenger outboundMessenger() {
        return new LoggingOutboundMessenger();
    }
}
