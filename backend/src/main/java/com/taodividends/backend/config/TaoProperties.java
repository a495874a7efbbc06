package com.taodividends.backend.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "tao")
@Data
@Validated
public class TaoProperties {

    @Min(0)
    private int defaultNetuid = 18;

    @NotBlank
    private String defaultHotkey;

    // Hotkeys reported in the batch view of a subnet; subnets without an entry are listed from the chain.
    private Map<Integer, List<String>> knownHotkeys = new HashMap<>();

    private Cache cache = new Cache();

    private Trade trade = new Trade();

    @Data
    public static class Cache {
        @NotNull
        private Duration ttl = Duration.ofSeconds(120);

        private String keyPrefix = "";
    }

    @Data
    public static class Trade {
        @NotNull
        private Duration lockTtl = Duration.ofMinutes(10);

        @NotNull
        private Duration taskTimeout = Duration.ofMinutes(5);

        // Upper bound on one submission including retries; a SUBMITTING task is only swept after
        // taskTimeout plus this budget.
        @NotNull
        private Duration submissionBudget = Duration.ofMinutes(2);

        @Positive
        private BigDecimal unitAmount = BigDecimal.ONE;

        @Positive
        private BigDecimal maxAmount = new BigDecimal("5");

        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration retryBaseDelay = Duration.ofSeconds(2);

        @NotNull
        private Duration recoveryGrace = Duration.ofSeconds(30);

        @Min(1)
        private int maxPosts = 10;
    }

    @AssertTrue(message = "tao.trade.task-timeout plus tao.trade.submission-budget must be shorter than tao.trade.lock-ttl")
    public boolean isTaskTimeoutWithinLockTtl() {
        return trade.getTaskTimeout().plus(trade.getSubmissionBudget()).compareTo(trade.getLockTtl()) < 0;
    }
}
