package com.taodividends.backend.orchestrator;

import com.taodividends.backend.model.TradeTask;
import com.taodividends.backend.model.TradeTaskState;
import com.taodividends.backend.repository.TradeTaskRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Fire-and-forget entry point of the orchestrator. The {@code trade_tasks} row is the durable
 * queue entry; the in-memory executor is only the fast path, and anything it drops is picked
 * up again by {@link TradeTaskRecoveryPoller}.
 * <p>
 * A task id sits in the executor at most once: dispatching an id that is still queued or running
 * in this process is a no-op.
 */
@Slf4j
@Service
public class TradeTaskDispatcher {

    private final TradeTaskRepository tradeTaskRepository;
    private final TradeTaskWorker tradeTaskWorker;
    private final Executor tradeTaskExecutor;
    private final Set<String> queuedTaskIds = ConcurrentHashMap.newKeySet();

    public TradeTaskDispatcher(TradeTaskRepository tradeTaskRepository,
                               TradeTaskWorker tradeTaskWorker,
                               @Qualifier("tradeTaskExecutor") Executor tradeTaskExecutor) {
        this.tradeTaskRepository = tradeTaskRepository;
        this.tradeTaskWorker = tradeTaskWorker;
        this.tradeTaskExecutor = tradeTaskExecutor;
    }

    @Transactional
    public TradeTask submit(TradeTaskCommand command) {
        TradeTask task = TradeTask.builder()
                .taskId(command.taskId())
                .kind(command.kind())
                .netuid(command.key().netuid())
                .hotkey(command.key().hotkey())
                .state(TradeTaskState.PENDING)
                .requestedAt(command.requestedAt())
                .updatedAt(command.requestedAt())
                .build();
        tradeTaskRepository.save(task);
        log.info("Trade task queued taskId={} kind={} lockKey={}", command.taskId(), command.kind(),
                command.key().lockKey());

        String taskId = command.taskId();
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            // Only hand off after commit; otherwise the worker may not find the row.
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(taskId);
                }
            });
        } else {
            dispatch(taskId);
        }
        return task;
    }

    /**
     * @return false when the task was already queued here or the executor rejected it
     */
    public boolean dispatch(String taskId) {
        if (!queuedTaskIds.add(taskId)) {
            log.debug("Trade task {} already queued; dispatch skipped", taskId);
            return false;
        }
        try {
            tradeTaskExecutor.execute(() -> {
                try {
                    tradeTaskWorker.process(taskId);
                } finally {
                    queuedTaskIds.remove(taskId);
                }
            });
            return true;
        } catch (TaskRejectedException e) {
            queuedTaskIds.remove(taskId);
            log.warn("Trade task executor saturated; taskId={} stays PENDING for recovery", taskId);
            return false;
        }
    }
}
