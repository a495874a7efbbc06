package com.taodividends.backend.orchestrator;

import com.taodividends.backend.config.TaoProperties;
import com.taodividends.backend.model.TradeTask;
import com.taodividends.backend.model.TradeTaskState;
import com.taodividends.backend.repository.TradeTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Re-dispatches tasks that were persisted but never picked up: executor rejections and tasks
 * queued in memory when the process stopped. Tasks still waiting in this process's executor are
 * skipped by the dispatcher.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TradeTaskRecoveryPoller {

    private final TradeTaskRepository tradeTaskRepository;
    private final TradeTaskDispatcher tradeTaskDispatcher;
    private final TaoProperties taoProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${tao.trade.recovery-interval-ms:30000}",
            initialDelayString = "${tao.trade.recovery-initial-delay-ms:30000}")
    public void recoverPendingTasks() {
        Instant cutoff = clock.instant().minus(taoProperties.getTrade().getRecoveryGrace());
        List<TradeTask> stale = tradeTaskRepository.findByStateAndRequestedAtBefore(TradeTaskState.PENDING, cutoff);
        if (stale.isEmpty()) {
            return;
        }
        long redispatched = stale.stream()
                .filter(task -> tradeTaskDispatcher.dispatch(task.getTaskId()))
                .count();
        if (redispatched > 0) {
            log.info("Re-dispatched {} of {} pending trade task(s)", redispatched, stale.size());
        }
    }
}
