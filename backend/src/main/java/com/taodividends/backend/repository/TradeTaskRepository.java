package com.taodividends.backend.repository;

import com.taodividends.backend.model.TradeTask;
import com.taodividends.backend.model.TradeTaskState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TradeTaskRepository extends JpaRepository<TradeTask, Long> {
    Optional<TradeTask> findByTaskId(String taskId);

    List<TradeTask> findByStateAndRequestedAtBefore(TradeTaskState state, Instant requestedAt);

    List<TradeTask> findByStateInAndRequestedAtBefore(Collection<TradeTaskState> states, Instant requestedAt);

    long countByState(TradeTaskState state);
}
