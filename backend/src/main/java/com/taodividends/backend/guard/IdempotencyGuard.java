package com.taodividends.backend.guard;

import com.taodividends.backend.config.TaoProperties;
import com.taodividends.backend.model.TradeKey;
import com.taodividends.backend.model.TradeLock;
import com.taodividends.backend.repository.TradeLockRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * Per-account trade lock backed by the primary key of {@code trade_locks}.
 * <p>
 * Acquisition is a plain insert: the database decides the winner, so two processes racing on the
 * same key cannot both succeed. Locks carry an expiry as a safety net against a holder that never
 * releases; an expired lock is removed with a conditional delete and the insert is tried once more.
 * Every operation commits on its own, independent of any transaction the caller has open.
 */
@Slf4j
@Component
public class IdempotencyGuard {

    private final TradeLockRepository tradeLockRepository;
    private final TransactionTemplate transactionTemplate;
    private final TaoProperties taoProperties;
    private final Clock clock;

    public IdempotencyGuard(TradeLockRepository tradeLockRepository,
                            PlatformTransactionManager transactionManager,
                            TaoProperties taoProperties,
                            Clock clock) {
        this.tradeLockRepository = tradeLockRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.taoProperties = taoProperties;
        this.clock = clock;
    }

    public boolean tryAcquire(TradeKey key, String holderId) {
        if (insert(key, holderId)) {
            return true;
        }
        Instant now = clock.instant();
        Integer reclaimed = transactionTemplate.execute(status -> tradeLockRepository.deleteExpired(key.lockKey(), now));
        if (reclaimed == null || reclaimed == 0) {
            log.debug("Trade lock {} held, denied to {}", key.lockKey(), holderId);
            return false;
        }
        log.warn("Reclaimed expired trade lock {}", key.lockKey());
        return insert(key, holderId);
    }

    /**
     * Removes the lock only if {@code holderId} still owns it.
     * @return whether a lock was removed
     */
    public boolean release(TradeKey key, String holderId) {
        Integer removed = transactionTemplate.execute(
                status -> tradeLockRepository.deleteByLockKeyAndHolder(key.lockKey(), holderId));
        boolean released = removed != null && removed > 0;
        if (released) {
            log.debug("Released trade lock {} held by {}", key.lockKey(), holderId);
        } else {
            log.warn("Trade lock {} was not held by {} at release", key.lockKey(), holderId);
        }
        return released;
    }

    public boolean isHeld(TradeKey key) {
        Instant now = clock.instant();
        Boolean held = transactionTemplate.execute(status -> tradeLockRepository.findById(key.lockKey())
                .map(lock -> lock.getExpiresAt().isAfter(now))
                .orElse(false));
        return Boolean.TRUE.equals(held);
    }

    private boolean insert(TradeKey key, String holderId) {
        Instant now = clock.instant();
        TradeLock lock = TradeLock.builder()
                .lockKey(key.lockKey())
                .netuid(key.netuid())
                .hotkey(key.hotkey())
                .holderId(holderId)
                .acquiredAt(now)
                .expiresAt(now.plus(taoProperties.getTrade().getLockTtl()))
                .fresh(true)
                .build();
        try {
            transactionTemplate.executeWithoutResult(status -> tradeLockRepository.saveAndFlush(lock));
            log.debug("Acquired trade lock {} for {}", key.lockKey(), holderId);
            return true;
        } catch (DataIntegrityViolationException | PessimisticLockingFailureException e) {
            // Another contender inserted (or is inserting) the same key.
            return false;
        }
    }
}
