package com.taodividends.backend.orchestrator;

import com.taodividends.backend.config.TaoProperties;
import com.taodividends.backend.model.TradeOutcome;
import com.taodividends.backend.model.TradeTask;
import com.taodividends.backend.model.TradeTaskState;
import com.taodividends.backend.repository.TradeTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Fails tasks that outlived their deadline and frees their lock. A task stuck in SUBMITTING may or
 * may not have reached the chain, so it is failed as uncertain and never re-submitted. Such a task
 * gets the submission budget on top of its deadline, since the worker may start a submission right
 * before the deadline and still be waiting on the chain.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TradeTaskSweeper {

    static final String UNCERTAIN_MESSAGE =
            "deadline passed while submitting; chain outcome unknown, reconcile against the chain";

    private static final EnumSet<TradeTaskState> NON_TERMINAL = EnumSet.of(
            TradeTaskState.PENDING, TradeTaskState.SCORING, TradeTaskState.DECIDING, TradeTaskState.SUBMITTING);

    private final TradeTaskRepository tradeTaskRepository;
    private final TradeTaskCompleter tradeTaskCompleter;
    private final TaoProperties taoProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${tao.trade.sweeper-interval-ms:60000}",
            initialDelayString = "${tao.trade.sweeper-initial-delay-ms:60000}")
    public void sweepStuckTasks() {
        TaoProperties.Trade trade = taoProperties.getTrade();
        Instant now = clock.instant();
        Instant cutoff = now.minus(trade.getTaskTimeout());
        Instant submittingCutoff = cutoff.minus(trade.getSubmissionBudget());
        List<TradeTask> stuck = tradeTaskRepository.findByStateInAndRequestedAtBefore(NON_TERMINAL, cutoff);
        stuck.stream()
                .filter(task -> task.getState() != TradeTaskState.SUBMITTING
                        || task.getRequestedAt().isBefore(submittingCutoff))
                .forEach(this::expire);
    }

    private void expire(TradeTask task) {
        MDC.put("taskId", task.getTaskId());
        try {
            boolean written = task.getState() == TradeTaskState.SUBMITTING
                    ? tradeTaskCompleter.fail(task.getTaskId(), TradeOutcome.SUBMISSION_UNCERTAIN, UNCERTAIN_MESSAGE)
                    : tradeTaskCompleter.fail(task.getTaskId(), TradeOutcome.TIMED_OUT,
                            "deadline passed in state " + task.getState());
            if (written) {
                log.warn("Sweeper failed stuck trade task taskId={} state={}", task.getTaskId(), task.getState());
            }
        } finally {
            MDC.remove("taskId");
        }
    }
}
