package com.openforge.writecrew.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.writecrew.document.CollaborationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Core infrastructure beans:
 *  - collaborationExecutor → runs agent actions and usage-ledger writes off the request thread
 *  - approvalScheduler     → owns every approval expiry timer
 *  - Clock                 → single time source for windows, expiries and snapshots (tests swap it)
 *  - Jackson ObjectMapper  → Java time as ISO-8601, tolerant deserialization
 */
@Configuration
public class AppConfig {

    /**
     * Named "collaborationExecutor" so it is injected by name next to the
     * broker's own executors registered by the STOMP configuration.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService collaborationExecutor(CollaborationProperties properties) {
        return Executors.newFixedThreadPool(
                properties.executorThreads(),
                new CustomizableThreadFactory("collab-"));
    }

    /**
     * Approval timers. A small pool is enough: each task only flips a
     * status and completes a future.
     */
    @Bean
    public ThreadPoolTaskScheduler approvalScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("approval-expiry-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared ObjectMapper for REST and persisted JSON:
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (clients can add fields without breaking us)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Password encoder used for user registration & login.
     */
    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
