package com.taodividends.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerHealthResponse {
    private String status;
    private int activeWorkers;
    private int poolSize;
    private int maxPoolSize;
    private int queuedTasks;
    private int remainingQueueCapacity;
    private long completedTasks;
    private long pendingTradeTasks;
    private long inFlightTradeTasks;
}
