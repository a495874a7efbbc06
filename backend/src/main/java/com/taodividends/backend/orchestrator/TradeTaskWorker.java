package com.taodividends.backend.orchestrator;

import com.taodividends.backend.client.ChainClient;
import com.taodividends.backend.client.StakeReceipt;
import com.taodividends.backend.config.TaoProperties;
import com.taodividends.backend.model.SentimentAnalysis;
import com.taodividends.backend.model.StakeTransaction;
import com.taodividends.backend.model.TradeOutcome;
import com.taodividends.backend.model.TradeTask;
import com.taodividends.backend.model.TradeTaskState;
import com.taodividends.backend.repository.SentimentAnalysisRepository;
import com.taodividends.backend.repository.StakeTransactionRepository;
import com.taodividends.backend.repository.TradeTaskRepository;
import com.taodividends.backend.service.SentimentResult;
import com.taodividends.backend.service.SentimentService;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * Runs one trade task from PENDING to a terminal state.
 * <p>
 * Each state change is committed before the next external call, so a crash leaves the task in the
 * last state it reached. A task is claimed with an optimistic-version update; a second delivery of
 * the same task id loses the claim and does nothing.
 */
@Slf4j
@Component
public class TradeTaskWorker {

    static final String NEUTRAL_MESSAGE = "neutral sentiment, no action";

    private final TradeTaskRepository tradeTaskRepository;
    private final StakeTransactionRepository stakeTransactionRepository;
    private final SentimentAnalysisRepository sentimentAnalysisRepository;
    private final SentimentService sentimentService;
    private final TradeDecisionPolicy tradeDecisionPolicy;
    private final ChainClient chainClient;
    private final TradeTaskCompleter tradeTaskCompleter;
    private final Retry tradeStepRetry;
    private final TaoProperties taoProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public TradeTaskWorker(TradeTaskRepository tradeTaskRepository,
                           StakeTransactionRepository stakeTransactionRepository,
                           SentimentAnalysisRepository sentimentAnalysisRepository,
                           SentimentService sentimentService,
                           TradeDecisionPolicy tradeDecisionPolicy,
                           ChainClient chainClient,
                           TradeTaskCompleter tradeTaskCompleter,
                           @Qualifier("tradeStepRetry") Retry tradeStepRetry,
                           TaoProperties taoProperties,
                           PlatformTransactionManager transactionManager,
                           Clock clock) {
        this.tradeTaskRepository = tradeTaskRepository;
        this.stakeTransactionRepository = stakeTransactionRepository;
        this.sentimentAnalysisRepository = sentimentAnalysisRepository;
        this.sentimentService = sentimentService;
        this.tradeDecisionPolicy = tradeDecisionPolicy;
        this.chainClient = chainClient;
        this.tradeTaskCompleter = tradeTaskCompleter;
        this.tradeStepRetry = tradeStepRetry;
        this.taoProperties = taoProperties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public void process(String taskId) {
        MDC.put("taskId", taskId);
        try {
            TradeTask task = claim(taskId);
            if (task == null) {
                return;
            }
            switch (task.getKind()) {
                case SENTIMENT_TRADE -> runSentimentTrade(task);
            }
        } catch (RuntimeException e) {
            log.error("Trade task {} aborted unexpectedly", taskId, e);
            tradeTaskCompleter.fail(taskId, TradeOutcome.INTERNAL_ERROR, "internal error: " + e.getMessage());
        } finally {
            MDC.remove("taskId");
        }
    }

    private TradeTask claim(String taskId) {
        try {
            return transactionTemplate.execute(status -> {
                TradeTask task = tradeTaskRepository.findByTaskId(taskId).orElse(null);
                if (task == null) {
                    log.warn("Trade task {} not found", taskId);
                    return null;
                }
                if (task.getState() != TradeTaskState.PENDING) {
                    log.info("Trade task {} already {}; duplicate delivery ignored", taskId, task.getState());
                    return null;
                }
                task.transitionTo(TradeTaskState.SCORING, clock.instant());
                task.setAttempts(task.getAttempts() + 1);
                return tradeTaskRepository.saveAndFlush(task);
            });
        } catch (ObjectOptimisticLockingFailureException e) {
            log.info("Trade task {} claimed by another worker", taskId);
            return null;
        }
    }

    private void runSentimentTrade(TradeTask task) {
        String taskId = task.getTaskId();
        Instant deadline = deadlineOf(task);
        if (isPast(deadline)) {
            tradeTaskCompleter.fail(taskId, TradeOutcome.TIMED_OUT, "deadline passed before scoring");
            return;
        }

        SentimentResult sentiment;
        try {
            sentiment = sentimentService.analyze(task.getNetuid(), task.getHotkey());
        } catch (RuntimeException e) {
            log.warn("Sentiment unavailable for task {}: {}", taskId, e.getMessage());
            tradeTaskCompleter.fail(taskId, TradeOutcome.SENTIMENT_UNAVAILABLE, "sentiment unavailable: " + e.getMessage());
            return;
        }
        if (!sentiment.hasData()) {
            tradeTaskCompleter.fail(taskId, TradeOutcome.NO_SENTIMENT_DATA, "no posts found for subnet " + task.getNetuid());
            return;
        }

        TradeDecision decision = tradeDecisionPolicy.decide(sentiment.score());
        recordDecision(taskId, sentiment, decision);
        if (!decision.isActionable()) {
            tradeTaskCompleter.fail(taskId, TradeOutcome.NEUTRAL_SENTIMENT, NEUTRAL_MESSAGE);
            return;
        }
        if (isPast(deadline)) {
            tradeTaskCompleter.fail(taskId, TradeOutcome.TIMED_OUT, "deadline passed before submission");
            return;
        }

        markSubmitting(taskId, sentiment, decision);
        StakeReceipt receipt;
        try {
            receipt = Retry.decorateSupplier(tradeStepRetry, () -> chainClient.submit(decision.direction(),
                    task.getNetuid(), task.getHotkey(), decision.amount(), taskId)).get();
        } catch (RuntimeException e) {
            log.warn("Submission failed for task {}: {}", taskId, e.getMessage());
            tradeTaskCompleter.fail(taskId, TradeOutcome.SUBMISSION_FAILED, e.getMessage());
            return;
        }
        tradeTaskCompleter.confirm(taskId, receipt.txHash());
    }

    private void recordDecision(String taskId, SentimentResult sentiment, TradeDecision decision) {
        transactionTemplate.executeWithoutResult(status -> {
            Instant now = clock.instant();
            TradeTask task = load(taskId);
            task.transitionTo(TradeTaskState.DECIDING, now);
            task.setSentimentScore(sentiment.score());
            task.setPostsCount(sentiment.postsCount());
            task.assignDirection(decision.direction(), decision.amount());
            tradeTaskRepository.saveAndFlush(task);

            sentimentAnalysisRepository.save(SentimentAnalysis.builder()
                    .taskId(taskId)
                    .netuid(sentiment.netuid())
                    .hotkey(sentiment.hotkey())
                    .score(sentiment.score())
                    .rawScore(sentiment.rawScore())
                    .postsCount(sentiment.postsCount())
                    .direction(decision.direction())
                    .amount(decision.amount())
                    .postsText(sentiment.postsText())
                    .analyzedAt(now)
                    .build());
        });
        log.info("Trade decision taskId={} score={} direction={} amount={}",
                taskId, sentiment.score(), decision.direction(), decision.amount());
    }

    private void markSubmitting(String taskId, SentimentResult sentiment, TradeDecision decision) {
        transactionTemplate.executeWithoutResult(status -> {
            Instant now = clock.instant();
            TradeTask task = load(taskId);
            task.transitionTo(TradeTaskState.SUBMITTING, now);
            tradeTaskRepository.saveAndFlush(task);

            stakeTransactionRepository.save(StakeTransaction.builder()
                    .taskId(taskId)
                    .netuid(task.getNetuid())
                    .hotkey(task.getHotkey())
                    .operationType(decision.direction())
                    .amount(decision.amount())
                    .status(StakeTransaction.Status.SUBMITTED)
                    .sentimentScore(sentiment.score())
                    .origin(StakeTransaction.Origin.SENTIMENT)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
        });
    }

    private TradeTask load(String taskId) {
        return tradeTaskRepository.findByTaskId(taskId)
                .orElseThrow(() -> new IllegalStateException("Trade task " + taskId + " disappeared"));
    }

    Instant deadlineOf(TradeTask task) {
        return task.getRequestedAt().plus(taoProperties.getTrade().getTaskTimeout());
    }

    private boolean isPast(Instant deadline) {
        return !clock.instant().isBefore(deadline);
    }
}
