package com.taodividends.backend.service;

import com.taodividends.backend.dto.TradeTaskResponse;
import com.taodividends.backend.exception.NotFoundException;
import com.taodividends.backend.model.TradeTask;
import com.taodividends.backend.repository.TradeTaskRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class TradeTaskService {

    private final TradeTaskRepository tradeTaskRepository;

    @Transactional(readOnly = true)
    public TradeTaskResponse getTask(String taskId) {
        TradeTask task = tradeTaskRepository.findByTaskId(taskId)
                .orElseThrow(() -> new NotFoundException("Trade task not found: " + taskId));
        return TradeTaskResponse.builder()
                .taskId(task.getTaskId())
                .kind(task.getKind().name())
                .netuid(task.getNetuid())
                .hotkey(task.getHotkey())
                .state(task.getState().name())
                .outcome(task.getOutcome() == null ? null : task.getOutcome().name())
                .sentimentScore(task.getSentimentScore())
                .postsCount(task.getPostsCount())
                .direction(task.getDirection() == null ? null : task.getDirection().name())
                .amount(task.getAmount())
                .txHash(task.getTxHash())
                .error(task.getError())
                .attempts(task.getAttempts())
                .requestedAt(task.getRequestedAt())
                .startedAt(task.getStartedAt())
                .completedAt(task.getCompletedAt())
                .build();
    }
}
