package com.taodividends.backend.orchestrator;

import com.taodividends.backend.dto.WorkerHealthResponse;
import com.taodividends.backend.model.TradeTaskState;
import com.taodividends.backend.repository.TradeTaskRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.concurrent.ThreadPoolExecutor;

@Service
public class WorkerHealthService {

    private final ThreadPoolTaskExecutor tradeTaskExecutor;
    private final TradeTaskRepository tradeTaskRepository;

    public WorkerHealthService(@Qualifier("tradeTaskExecutor") ThreadPoolTaskExecutor tradeTaskExecutor,
                               TradeTaskRepository tradeTaskRepository) {
        this.tradeTaskExecutor = tradeTaskExecutor;
        this.tradeTaskRepository = tradeTaskRepository;
    }

    public WorkerHealthResponse snapshot() {
        ThreadPoolExecutor pool = tradeTaskExecutor.getThreadPoolExecutor();
        boolean running = !pool.isShutdown();
        return WorkerHealthResponse.builder()
                .status(running ? "UP" : "DOWN")
                .activeWorkers(pool.getActiveCount())
                .poolSize(pool.getPoolSize())
                .maxPoolSize(pool.getMaximumPoolSize())
                .queuedTasks(pool.getQueue().size())
                .remainingQueueCapacity(pool.getQueue().remainingCapacity())
                .completedTasks(pool.getCompletedTaskCount())
                .pendingTradeTasks(tradeTaskRepository.countByState(TradeTaskState.PENDING))
                .inFlightTradeTasks(tradeTaskRepository.countByState(TradeTaskState.SCORING)
                        + tradeTaskRepository.countByState(TradeTaskState.DECIDING)
                        + tradeTaskRepository.countByState(TradeTaskState.SUBMITTING))
                .build();
    }
}
