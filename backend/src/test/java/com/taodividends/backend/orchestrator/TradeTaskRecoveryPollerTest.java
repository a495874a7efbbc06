package com.taodividends.backend.orchestrator;

import com.taodividends.backend.config.TaoProperties;
import com.taodividends.backend.model.TradeTask;
import com.taodividends.backend.model.TradeTaskState;
import com.taodividends.backend.repository.TradeTaskRepository;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TradeTaskRecoveryPollerTest {

    private final Instant now = Instant.parse("2025-01-01T00:10:00Z");
    private final TradeTaskRepository tradeTaskRepository = mock(TradeTaskRepository.class);
    private final TradeTaskDispatcher dispatcher = mock(TradeTaskDispatcher.class);
    private final TradeTaskRecoveryPoller poller = new TradeTaskRecoveryPoller(tradeTaskRepository, dispatcher,
            new TaoProperties(), Clock.fixed(now, ZoneOffset.UTC));

    @Test
    void redispatchesPendingTasksOlderThanGrace() {
        when(tradeTaskRepository.findByStateAndRequestedAtBefore(TradeTaskState.PENDING, now.minusSeconds(30)))
                .thenReturn(List.of(TradeTask.builder().taskId("task-1").build(),
                        TradeTask.builder().taskId("task-2").build()));
        when(dispatcher.dispatch("task-1")).thenReturn(true);
        when(dispatcher.dispatch("task-2")).thenReturn(true);

        poller.recoverPendingTasks();

        verify(dispatcher).dispatch("task-1");
        verify(dispatcher).dispatch("task-2");
    }

    @Test
    void taskStillQueuedIsNotRedispatched() {
        List<Runnable> held = new ArrayList<>();
        TradeTaskDispatcher realDispatcher = new TradeTaskDispatcher(tradeTaskRepository,
                mock(TradeTaskWorker.class), held::add);
        TradeTaskRecoveryPoller recoveryPoller = new TradeTaskRecoveryPoller(tradeTaskRepository, realDispatcher,
                new TaoProperties(), Clock.fixed(now, ZoneOffset.UTC));
        when(tradeTaskRepository.findByStateAndRequestedAtBefore(TradeTaskState.PENDING, now.minusSeconds(30)))
                .thenReturn(List.of(TradeTask.builder().taskId("task-1").build()));

        recoveryPoller.recoverPendingTasks();
        recoveryPoller.recoverPendingTasks();
        recoveryPoller.recoverPendingTasks();

        assertThat(held).hasSize(1);
    }

    @Test
    void nothingToRecover() {
        when(tradeTaskRepository.findByStateAndRequestedAtBefore(TradeTaskState.PENDING, now.minusSeconds(30)))
                .thenReturn(List.of());

        poller.recoverPendingTasks();

        verifyNoInteractions(dispatcher);
    }
}
