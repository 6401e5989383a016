package com.pushcast.dispatcher.config;

import com.pushcast.dispatcher.store.RetryPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Shared beans for the scheduling core.
 *
 * Every time-dependent component takes the Clock bean instead of calling
 * Instant.now(), so tests can pin or advance time.
 */
@Configuration
public class DispatcherConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy(
            @Value("${pushcast.retry.max-attempts:5}")     int maxAttempts,
            @Value("${pushcast.retry.base-backoff:PT30S}") Duration baseBackoff,
            @Value("${pushcast.retry.max-backoff:PT30M}")  Duration maxBackoff) {
        return new RetryPolicy(maxAttempts, baseBackoff, maxBackoff);
    }
}
