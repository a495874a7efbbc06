package com.taodividends.backend.config;

import com.taodividends.backend.exception.UpstreamUnavailableException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ClientResilienceConfig {

    @Bean
    public CircuitBreaker chainCircuitBreaker(
            @Value("${clients.resilience.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${clients.resilience.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${clients.resilience.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .recordExceptions(UpstreamUnavailableException.class)
                .build();
        return CircuitBreaker.of("chain", config);
    }

    /**
     * Retry for the synchronous dividend lookup. Kept short because a request thread waits on it.
     */
    @Bean
    public Retry chainQueryRetry(
            @Value("${clients.resilience.query-retry.max-attempts:3}") int maxAttempts,
            @Value("${clients.resilience.query-retry.base-delay-ms:200}") long baseDelayMs,
            @Value("${clients.resilience.query-retry.jitter-factor:0.2}") double jitterFactor
    ) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(baseDelayMs),
                2.0,
                jitterFactor
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .retryExceptions(UpstreamUnavailableException.class)
                .build();
        return Retry.of("chain-query", config);
    }

    /**
     * Retry for the background trade steps (post search, scoring, submission).
     */
    @Bean
    public Retry tradeStepRetry(TaoProperties taoProperties,
                                @Value("${clients.resilience.trade-retry.jitter-factor:0.2}") double jitterFactor) {
        TaoProperties.Trade trade = taoProperties.getTrade();
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                trade.getRetryBaseDelay(),
                2.0,
                jitterFactor
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(trade.getMaxAttempts())
                .intervalFunction(intervalFunction)
                .retryExceptions(UpstreamUnavailableException.class)
                .build();
        return Retry.of("trade-step", config);
    }
}
