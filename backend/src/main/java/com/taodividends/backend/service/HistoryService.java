package com.taodividends.backend.service;

import com.taodividends.backend.dto.DividendRecordResponse;
import com.taodividends.backend.dto.SentimentAnalysisResponse;
import com.taodividends.backend.dto.StakeTransactionResponse;
import com.taodividends.backend.exception.BadRequestException;
import com.taodividends.backend.model.DividendRecord;
import com.taodividends.backend.model.SentimentAnalysis;
import com.taodividends.backend.model.StakeDirection;
import com.taodividends.backend.model.StakeTransaction;
import com.taodividends.backend.repository.DividendRecordRepository;
import com.taodividends.backend.repository.OffsetLimitRequest;
import com.taodividends.backend.repository.SentimentAnalysisRepository;
import com.taodividends.backend.repository.StakeTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

/**
 * Filtered, newest-first reads over the append-only history tables.
 */
@Service
@RequiredArgsConstructor
public class HistoryService {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    private final DividendRecordRepository dividendRecordRepository;
    private final StakeTransactionRepository stakeTransactionRepository;
    private final SentimentAnalysisRepository sentimentAnalysisRepository;

    @Transactional(readOnly = true)
    public List<DividendRecordResponse> listDividends(Integer netuid, String hotkey, Integer limit, Integer offset) {
        Specification<DividendRecord> spec = Specification.<DividendRecord>where(equal("netuid", netuid))
                .and(equal("hotkey", hotkey));
        return dividendRecordRepository.findAll(spec, page(limit, offset, "observedAt"))
                .map(this::toResponse)
                .getContent();
    }

    @Transactional(readOnly = true)
    public List<StakeTransactionResponse> listTransactions(Integer netuid, String hotkey, String operationType,
                                                           Integer limit, Integer offset) {
        Specification<StakeTransaction> spec = Specification.<StakeTransaction>where(equal("netuid", netuid))
                .and(equal("hotkey", hotkey))
                .and(equal("operationType", parseOperationType(operationType)));
        return stakeTransactionRepository.findAll(spec, page(limit, offset, "createdAt"))
                .map(this::toResponse)
                .getContent();
    }

    @Transactional(readOnly = true)
    public List<SentimentAnalysisResponse> listSentimentAnalyses(Integer netuid, Integer limit, Integer offset) {
        Specification<SentimentAnalysis> spec = Specification.where(equal("netuid", netuid));
        return sentimentAnalysisRepository.findAll(spec, page(limit, offset, "analyzedAt"))
                .map(this::toResponse)
                .getContent();
    }

    static StakeDirection parseOperationType(String operationType) {
        if (operationType == null || operationType.isBlank()) {
            return null;
        }
        return switch (operationType.trim().toLowerCase(Locale.ROOT)) {
            case "stake" -> StakeDirection.STAKE;
            case "unstake" -> StakeDirection.UNSTAKE;
            default -> throw new BadRequestException("operation_type must be 'stake' or 'unstake'");
        };
    }

    private OffsetLimitRequest page(Integer limit, Integer offset, String timestampField) {
        int resolvedLimit = limit != null ? limit : DEFAULT_LIMIT;
        int resolvedOffset = offset != null ? offset : 0;
        if (resolvedLimit < 1 || resolvedLimit > MAX_LIMIT) {
            throw new BadRequestException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (resolvedOffset < 0) {
            throw new BadRequestException("offset must not be negative");
        }
        Sort newestFirst = Sort.by(Sort.Order.desc(timestampField), Sort.Order.desc("id"));
        return new OffsetLimitRequest(resolvedOffset, resolvedLimit, newestFirst);
    }

    private static <T> Specification<T> equal(String attribute, Object value) {
        if (value == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get(attribute), value);
    }

    private DividendRecordResponse toResponse(DividendRecord record) {
        return DividendRecordResponse.builder()
                .id(record.getId())
                .netuid(record.getNetuid())
                .hotkey(record.getHotkey())
                .dividend(record.getDividend())
                .source(record.getSource())
                .observedAt(record.getObservedAt())
                .build();
    }

    private StakeTransactionResponse toResponse(StakeTransaction tx) {
        return StakeTransactionResponse.builder()
                .id(tx.getId())
                .taskId(tx.getTaskId())
                .netuid(tx.getNetuid())
                .hotkey(tx.getHotkey())
                .operationType(tx.getOperationType().name().toLowerCase(Locale.ROOT))
                .amount(tx.getAmount())
                .txHash(tx.getTxHash())
                .status(tx.getStatus().name())
                .error(tx.getError())
                .sentimentScore(tx.getSentimentScore())
                .origin(tx.getOrigin().name())
                .createdAt(tx.getCreatedAt())
                .updatedAt(tx.getUpdatedAt())
                .build();
    }

    private SentimentAnalysisResponse toResponse(SentimentAnalysis analysis) {
        return SentimentAnalysisResponse.builder()
                .id(analysis.getId())
                .taskId(analysis.getTaskId())
                .netuid(analysis.getNetuid())
                .hotkey(analysis.getHotkey())
                .score(analysis.getScore())
                .rawScore(analysis.getRawScore())
                .postsCount(analysis.getPostsCount())
                .operationType(analysis.getDirection() == null ? null
                        : analysis.getDirection().name().toLowerCase(Locale.ROOT))
                .stakeAmount(analysis.getAmount())
                .analyzedAt(analysis.getAnalyzedAt())
                .build();
    }
}
