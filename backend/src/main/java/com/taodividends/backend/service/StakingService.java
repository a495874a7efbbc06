package com.taodividends.backend.service;

import com.taodividends.backend.client.ChainClient;
import com.taodividends.backend.client.StakeReceipt;
import com.taodividends.backend.dto.StakeOperationResponse;
import com.taodividends.backend.dto.StakeRequest;
import com.taodividends.backend.exception.BadRequestException;
import com.taodividends.backend.exception.ConflictException;
import com.taodividends.backend.guard.IdempotencyGuard;
import com.taodividends.backend.model.DividendQuery;
import com.taodividends.backend.model.StakeDirection;
import com.taodividends.backend.model.StakeTransaction;
import com.taodividends.backend.model.TradeKey;
import com.taodividends.backend.repository.StakeTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Direct stake and unstake calls. They skip sentiment scoring but share the per-account trade lock
 * with the background trades, so a direct call never overlaps a sentiment trade on the same account.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StakingService {

    private final DividendQueryDispatcher dividendQueryDispatcher;
    private final IdempotencyGuard idempotencyGuard;
    private final ChainClient chainClient;
    private final StakeTransactionRepository stakeTransactionRepository;
    private final Clock clock;

    public StakeOperationResponse stake(StakeRequest request) {
        return execute(StakeDirection.STAKE, request);
    }

    public StakeOperationResponse unstake(StakeRequest request) {
        return execute(StakeDirection.UNSTAKE, request);
    }

    private StakeOperationResponse execute(StakeDirection direction, StakeRequest request) {
        if (request.getAmount() == null || request.getAmount().signum() <= 0) {
            throw new BadRequestException("amount must be positive");
        }
        BigDecimal amount = request.getAmount().setScale(9, RoundingMode.HALF_UP);
        DividendQuery target = dividendQueryDispatcher.resolve(request.getNetuid(), request.getHotkey());
        TradeKey key = target.tradeKey();
        String holderId = "direct-" + UUID.randomUUID();
        if (!idempotencyGuard.tryAcquire(key, holderId)) {
            throw new ConflictException("A trade is already in flight for " + key.lockKey());
        }

        StakeReceipt receipt;
        try {
            receipt = chainClient.submit(direction, key.netuid(), key.hotkey(), amount, holderId);
        } catch (RuntimeException e) {
            log.warn("Direct {} failed for {}: {}", direction.pathSegment(), key.lockKey(), e.getMessage());
            try {
                recordThenRelease(direction, key, holderId, amount, StakeTransaction.Status.FAILED, null,
                        e.getMessage());
            } catch (RuntimeException recordFailure) {
                e.addSuppressed(recordFailure);
            }
            throw e;
        }
        recordThenRelease(direction, key, holderId, amount, StakeTransaction.Status.CONFIRMED, receipt.txHash(), null);
        log.info("Direct {} confirmed for {} amount={} txHash={}",
                direction.pathSegment(), key.lockKey(), amount, receipt.txHash());
        return StakeOperationResponse.builder()
                .netuid(key.netuid())
                .hotkey(key.hotkey())
                .amount(amount)
                .operationType(direction.name().toLowerCase(Locale.ROOT))
                .txHash(receipt.txHash())
                .success(true)
                .build();
    }

    // The lock is released only once the outcome is stored; a failed write leaves it held.
    private void recordThenRelease(StakeDirection direction, TradeKey key, String holderId, BigDecimal amount,
                                   StakeTransaction.Status status, String txHash, String error) {
        try {
            record(direction, key, amount, status, txHash, error);
        } catch (RuntimeException e) {
            log.error("Recording direct {} for {} failed (status {}, txHash {}); trade lock kept for reconciliation",
                    direction.pathSegment(), key.lockKey(), status, txHash, e);
            throw e;
        }
        idempotencyGuard.release(key, holderId);
    }

    private void record(StakeDirection direction, TradeKey key, BigDecimal amount, StakeTransaction.Status status,
                        String txHash, String error) {
        Instant now = clock.instant();
        stakeTransactionRepository.save(StakeTransaction.builder()
                .netuid(key.netuid())
                .hotkey(key.hotkey())
                .operationType(direction)
                .amount(amount)
                .txHash(txHash)
                .status(status)
                .error(error != null && error.length() > 2000 ? error.substring(0, 2000) : error)
                .origin(StakeTransaction.Origin.DIRECT)
                .createdAt(now)
                .updatedAt(now)
                .build());
    }
}
