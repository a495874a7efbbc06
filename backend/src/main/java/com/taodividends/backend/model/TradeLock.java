package com.taodividends.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * One row per (netuid, hotkey) with a trade in flight. The primary key is the lock.
 */
@Entity
@Table(name = "trade_locks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeLock implements Persistable<String> {

    @Id
    @Column(name = "lock_key", nullable = false, length = 96)
    private String lockKey;

    @Column(nullable = false)
    private Integer netuid;

    @Column(nullable = false, length = 64)
    private String hotkey;

    @Column(name = "holder_id", nullable = false, length = 96)
    private String holderId;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    // Forces an INSERT on save so a duplicate key surfaces as a constraint violation instead of a merge.
    @Transient
    @Builder.Default
    private boolean fresh = true;

    @Override
    public String getId() {
        return lockKey;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.fresh = false;
    }
}
