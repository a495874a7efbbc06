package com.taodividends.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "stake_transactions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StakeTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Null for direct stake/unstake calls.
    @Column(name = "task_id", unique = true, length = 64)
    private String taskId;

    @Column(nullable = false)
    private Integer netuid;

    @Column(nullable = false, length = 64)
    private String hotkey;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation_type", nullable = false, length = 32)
    private StakeDirection operationType;

    @Column(nullable = false, precision = 38, scale = 9)
    private BigDecimal amount;

    @Column(name = "tx_hash", length = 128)
    private String txHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Status status;

    @Column(length = 2000)
    private String error;

    @Column(name = "sentiment_score")
    private Double sentimentScore;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Origin origin;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void settle(Status finalStatus, String hash, String message, Instant now) {
        if (status != Status.SUBMITTED) {
            throw new IllegalStateException("Stake transaction " + id + " already settled as " + status);
        }
        this.status = finalStatus;
        this.txHash = hash;
        this.error = TradeTask.truncate(message);
        this.updatedAt = now;
    }

    public void confirmLate(String hash, String note, Instant now) {
        if (status != Status.FAILED) {
            throw new IllegalStateException("Stake transaction " + id + " is " + status + ", not FAILED");
        }
        this.status = Status.CONFIRMED;
        this.txHash = hash;
        this.error = TradeTask.truncate(note);
        this.updatedAt = now;
    }

    public enum Status {
        SUBMITTED,
        CONFIRMED,
        FAILED
    }

    public enum Origin {
        SENTIMENT,
        DIRECT
    }
}
