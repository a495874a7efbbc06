package com.taodividends.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "trade_tasks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
public class TradeTask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "task_id", nullable = false, unique = true, length = 64)
    private String taskId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private TradeTaskKind kind;

    @Column(nullable = false)
    private Integer netuid;

    @Column(nullable = false, length = 64)
    private String hotkey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private TradeTaskState state = TradeTaskState.PENDING;

    @Column(name = "requested_at", nullable = false)
    private Instant requestedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "sentiment_score")
    private Double sentimentScore;

    @Column(name = "posts_count")
    private Integer postsCount;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private StakeDirection direction;

    @Column(precision = 38, scale = 9)
    private BigDecimal amount;

    @Column(name = "tx_hash", length = 128)
    private String txHash;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private TradeOutcome outcome;

    @Column(length = 2000)
    private String error;

    @Column(nullable = false)
    @Builder.Default
    private int attempts = 0;

    @Version
    private Long version;

    /**
     * Move to {@code newState}, stamping the lifecycle timestamps.
     * @throws IllegalStateException if the lifecycle does not allow the move
     */
    public void transitionTo(TradeTaskState newState, Instant now) {
        if (!state.canTransitionTo(newState)) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s -> %s for task %s", state, newState, taskId));
        }
        TradeTaskState previous = this.state;
        this.state = newState;
        this.updatedAt = now;
        if (previous == TradeTaskState.PENDING) {
            this.startedAt = now;
        }
        if (newState.isTerminal()) {
            this.completedAt = now;
        }
        log.debug("Trade task transition taskId={} from={} to={}", taskId, previous, newState);
    }

    public void assignDirection(StakeDirection newDirection, BigDecimal newAmount) {
        if (direction != null) {
            throw new IllegalStateException("Direction already decided for task " + taskId);
        }
        this.direction = newDirection;
        this.amount = newAmount;
    }

    public void fail(TradeOutcome reason, String message, Instant now) {
        transitionTo(TradeTaskState.FAILED, now);
        this.outcome = reason;
        this.error = truncate(message);
    }

    public void confirm(String hash, Instant now) {
        transitionTo(TradeTaskState.CONFIRMED, now);
        this.outcome = TradeOutcome.CONFIRMED;
        this.txHash = hash;
    }

    /**
     * Keeps the hash of a submission that the chain confirmed after the sweeper had already failed
     * the task as uncertain. The terminal state itself does not change.
     */
    public void recordLateConfirmation(String hash, Instant now) {
        if (outcome != TradeOutcome.SUBMISSION_UNCERTAIN) {
            throw new IllegalStateException("Task " + taskId + " is not awaiting reconciliation (" + outcome + ")");
        }
        this.txHash = hash;
        this.updatedAt = now;
    }

    static String truncate(String message) {
        if (message == null || message.length() <= 2000) {
            return message;
        }
        return message.substring(0, 2000);
    }
}
