package com.taodividends.backend.orchestrator;

import com.taodividends.backend.guard.IdempotencyGuard;
import com.taodividends.backend.model.StakeTransaction;
import com.taodividends.backend.model.TradeKey;
import com.taodividends.backend.model.TradeOutcome;
import com.taodividends.backend.model.TradeTask;
import com.taodividends.backend.repository.StakeTransactionRepository;
import com.taodividends.backend.repository.TradeTaskRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * Writes the terminal state of a trade task and its stake transaction together, then frees the
 * account's trade lock. The lock is released only after that write commits; if the write fails
 * the lock stays until an operator reconciles or it expires.
 * <p>
 * A confirmation arriving for a task the sweeper already failed as uncertain is not dropped: its
 * hash is kept on the task and the transaction is marked confirmed.
 */
@Slf4j
@Component
public class TradeTaskCompleter {

    static final String LATE_CONFIRMATION_NOTE = "confirmed after the task was failed as SUBMISSION_UNCERTAIN";

    private final TradeTaskRepository tradeTaskRepository;
    private final StakeTransactionRepository stakeTransactionRepository;
    private final IdempotencyGuard idempotencyGuard;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public TradeTaskCompleter(TradeTaskRepository tradeTaskRepository,
                              StakeTransactionRepository stakeTransactionRepository,
                              IdempotencyGuard idempotencyGuard,
                              PlatformTransactionManager transactionManager,
                              MeterRegistry meterRegistry,
                              Clock clock) {
        this.tradeTaskRepository = tradeTaskRepository;
        this.stakeTransactionRepository = stakeTransactionRepository;
        this.idempotencyGuard = idempotencyGuard;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public boolean confirm(String taskId, String txHash) {
        return complete(taskId, TradeOutcome.CONFIRMED, null, txHash);
    }

    public boolean fail(String taskId, TradeOutcome outcome, String message) {
        return complete(taskId, outcome, message, null);
    }

    private boolean complete(String taskId, TradeOutcome outcome, String message, String txHash) {
        TradeKey key;
        try {
            key = transactionTemplate.execute(status -> write(taskId, outcome, message, txHash));
        } catch (RuntimeException e) {
            log.error("Terminal write failed for trade task {} (outcome {}); trade lock kept for reconciliation",
                    taskId, outcome, e);
            return false;
        }
        if (key == null) {
            return false;
        }
        Counter.builder("trade_tasks_completed_total")
                .tag("outcome", outcome.name())
                .register(meterRegistry)
                .increment();
        idempotencyGuard.release(key, taskId);
        log.info("Trade task finished taskId={} outcome={} txHash={} error={}", taskId, outcome, txHash, message);
        return true;
    }

    private TradeKey write(String taskId, TradeOutcome outcome, String message, String txHash) {
        TradeTask task = tradeTaskRepository.findByTaskId(taskId)
                .orElseThrow(() -> new IllegalStateException("Trade task " + taskId + " disappeared"));
        if (task.getState().isTerminal()
                && outcome == TradeOutcome.CONFIRMED
                && task.getOutcome() == TradeOutcome.SUBMISSION_UNCERTAIN) {
            reconcileLateConfirmation(task, txHash);
            return null;
        }
        if (task.getState().isTerminal()) {
            log.warn("Trade task {} already {} ({}); dropping {}", taskId, task.getState(), task.getOutcome(), outcome);
            return null;
        }
        Instant now = clock.instant();
        if (outcome == TradeOutcome.CONFIRMED) {
            task.confirm(txHash, now);
        } else {
            task.fail(outcome, message, now);
        }
        tradeTaskRepository.saveAndFlush(task);

        stakeTransactionRepository.findByTaskId(taskId)
                .filter(tx -> tx.getStatus() == StakeTransaction.Status.SUBMITTED)
                .ifPresent(tx -> {
                    if (outcome == TradeOutcome.CONFIRMED) {
                        tx.settle(StakeTransaction.Status.CONFIRMED, txHash, null, now);
                    } else {
                        tx.settle(StakeTransaction.Status.FAILED, null, message, now);
                    }
                    stakeTransactionRepository.saveAndFlush(tx);
                });
        return new TradeKey(task.getNetuid(), task.getHotkey());
    }

    private void reconcileLateConfirmation(TradeTask task, String txHash) {
        Instant now = clock.instant();
        task.recordLateConfirmation(txHash, now);
        tradeTaskRepository.saveAndFlush(task);
        stakeTransactionRepository.findByTaskId(task.getTaskId())
                .filter(tx -> tx.getStatus() == StakeTransaction.Status.FAILED)
                .ifPresent(tx -> {
                    tx.confirmLate(txHash, LATE_CONFIRMATION_NOTE, now);
                    stakeTransactionRepository.saveAndFlush(tx);
                });
        log.warn("Trade task {} confirmed by the chain after it was swept as uncertain; txHash={} recorded",
                task.getTaskId(), txHash);
    }
}
