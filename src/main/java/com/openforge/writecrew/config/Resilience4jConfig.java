package com.openforge.writecrew.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * One named instance guards the usage ledger:
 *   • "usageLedger"  : asynchronous append of committed usage to the database
 *
 * Ledger writes happen after the agent's edit is already applied, so a
 * failing database must never reach the caller.  The retry absorbs short
 * hiccups; the breaker stops hammering a dead database and lets the
 * reconciliation sweep in UsageLedgerWriter pick the entries up later.
 */
@Configuration
public class Resilience4jConfig {

    public static final String USAGE_LEDGER = "usageLedger";

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 20 writes fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(20)
                .failureRateThreshold(50)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(USAGE_LEDGER);
        return registry;
    }

    @Bean
    public CircuitBreaker usageLedgerCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(USAGE_LEDGER);
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                // exponential back-off: 200 ms → 400 ms → 800 ms
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(200), 2.0))
                .retryExceptions(TransientDataAccessException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(USAGE_LEDGER);
        return registry;
    }

    @Bean
    public Retry usageLedgerRetry(RetryRegistry registry) {
        return registry.retry(USAGE_LEDGER);
    }
}
