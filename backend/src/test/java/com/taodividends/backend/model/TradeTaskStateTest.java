package com.taodividends.backend.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TradeTaskStateTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    void lifecycleMovesForwardOneStepAtATime() {
        assertThat(TradeTaskState.PENDING.canTransitionTo(TradeTaskState.SCORING)).isTrue();
        assertThat(TradeTaskState.SCORING.canTransitionTo(TradeTaskState.DECIDING)).isTrue();
        assertThat(TradeTaskState.DECIDING.canTransitionTo(TradeTaskState.SUBMITTING)).isTrue();
        assertThat(TradeTaskState.SUBMITTING.canTransitionTo(TradeTaskState.CONFIRMED)).isTrue();

        assertThat(TradeTaskState.PENDING.canTransitionTo(TradeTaskState.SUBMITTING)).isFalse();
        assertThat(TradeTaskState.SCORING.canTransitionTo(TradeTaskState.CONFIRMED)).isFalse();
        assertThat(TradeTaskState.SUBMITTING.canTransitionTo(TradeTaskState.PENDING)).isFalse();
    }

    @Test
    void everyLiveStateMayFail() {
        for (TradeTaskState state : TradeTaskState.values()) {
            assertThat(state.canTransitionTo(TradeTaskState.FAILED)).isEqualTo(!state.isTerminal());
        }
    }

    @Test
    void terminalStatesAreFinal() {
        for (TradeTaskState target : TradeTaskState.values()) {
            assertThat(TradeTaskState.CONFIRMED.canTransitionTo(target)).isFalse();
            assertThat(TradeTaskState.FAILED.canTransitionTo(target)).isFalse();
        }
    }

    @Test
    void transitionStampsTimestamps() {
        TradeTask task = TradeTask.builder().taskId("task-1").requestedAt(T0).build();

        task.transitionTo(TradeTaskState.SCORING, T0.plusSeconds(1));
        task.fail(TradeOutcome.NO_SENTIMENT_DATA, "no posts", T0.plusSeconds(2));

        assertThat(task.getStartedAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(task.getCompletedAt()).isEqualTo(T0.plusSeconds(2));
        assertThat(task.getOutcome()).isEqualTo(TradeOutcome.NO_SENTIMENT_DATA);
    }

    @Test
    void finishedTaskRejectsFurtherTransitions() {
        TradeTask task = TradeTask.builder().taskId("task-1").state(TradeTaskState.SUBMITTING).build();
        task.confirm("0xabc", T0);

        assertThatThrownBy(() -> task.fail(TradeOutcome.TIMED_OUT, "late", T0))
                .isInstanceOf(IllegalStateException.class);
        assertThat(task.getOutcome()).isEqualTo(TradeOutcome.CONFIRMED);
    }

    @Test
    void directionIsDecidedOnce() {
        TradeTask task = TradeTask.builder().taskId("task-1").build();
        task.assignDirection(StakeDirection.STAKE, BigDecimal.ONE);

        assertThatThrownBy(() -> task.assignDirection(StakeDirection.UNSTAKE, BigDecimal.ONE))
                .isInstanceOf(IllegalStateException.class);
        assertThat(task.getDirection()).isEqualTo(StakeDirection.STAKE);
    }

    @Test
    void longErrorsAreTruncated() {
        TradeTask task = TradeTask.builder().taskId("task-1").build();
        task.fail(TradeOutcome.INTERNAL_ERROR, "x".repeat(5000), T0);

        assertThat(task.getError()).hasSize(2000);
    }

    @Test
    void settledStakeTransactionCannotBeSettledAgain() {
        StakeTransaction tx = StakeTransaction.builder().status(StakeTransaction.Status.SUBMITTED).build();
        tx.settle(StakeTransaction.Status.CONFIRMED, "0x1", null, T0);

        assertThatThrownBy(() -> tx.settle(StakeTransaction.Status.FAILED, null, "again", T0))
                .isInstanceOf(IllegalStateException.class);
    }
}
