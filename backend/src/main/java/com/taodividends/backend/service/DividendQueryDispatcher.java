package com.taodividends.backend.service;

import com.taodividends.backend.cache.CacheLookup;
import com.taodividends.backend.cache.DividendCacheService;
import com.taodividends.backend.client.ChainClient;
import com.taodividends.backend.config.TaoProperties;
import com.taodividends.backend.dto.DividendBatchResponse;
import com.taodividends.backend.dto.DividendResponse;
import com.taodividends.backend.exception.BadRequestException;
import com.taodividends.backend.guard.IdempotencyGuard;
import com.taodividends.backend.model.DividendQuery;
import com.taodividends.backend.model.TradeKey;
import com.taodividends.backend.orchestrator.SentimentTradeCommand;
import com.taodividends.backend.orchestrator.TradeTaskDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Synchronous request path for dividend lookups. Reads through the cache and, when asked to trade,
 * starts at most one background trade per account without waiting for it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DividendQueryDispatcher {

    static final int MAX_HOTKEY_LENGTH = 64;
    private static final Pattern HOTKEY_PATTERN = Pattern.compile("^[A-Za-z0-9]+$");

    private final DividendCacheService dividendCacheService;
    private final IdempotencyGuard idempotencyGuard;
    private final TradeTaskDispatcher tradeTaskDispatcher;
    private final ChainClient chainClient;
    private final TaoProperties taoProperties;
    private final Clock clock;

    /**
     * Resolves omitted parameters to the configured defaults and validates the result.
     */
    public DividendQuery resolve(Integer netuid, String hotkey) {
        int resolvedNetuid = netuid != null ? netuid : taoProperties.getDefaultNetuid();
        String resolvedHotkey = hotkey != null ? hotkey : taoProperties.getDefaultHotkey();
        DividendQuery query = new DividendQuery(resolvedNetuid, resolvedHotkey);
        validate(query);
        return query;
    }

    public DividendResponse handle(DividendQuery query, boolean tradeRequested) {
        validate(query);
        CacheLookup lookup = dividendCacheService.getOrFetch(query);

        String taskId = null;
        if (tradeRequested) {
            taskId = triggerTrade(query.tradeKey());
        }
        return DividendResponse.builder()
                .netuid(query.netuid())
                .hotkey(query.hotkey())
                .dividend(lookup.value())
                .cached(lookup.cached())
                .stakeTxTriggered(taskId != null)
                .txHash(null)
                .taskId(taskId)
                .build();
    }

    public DividendBatchResponse handleBatch(int netuid, boolean tradeRequested) {
        validateNetuid(netuid);
        List<String> hotkeys = knownHotkeys(netuid);
        List<DividendResponse> dividends = new ArrayList<>();
        BigInteger total = BigInteger.ZERO;
        boolean allCached = true;
        boolean anyTriggered = false;
        for (String hotkey : hotkeys) {
            DividendResponse single = handle(new DividendQuery(netuid, hotkey), tradeRequested);
            dividends.add(single);
            total = total.add(single.getDividend());
            allCached &= single.isCached();
            anyTriggered |= single.isStakeTxTriggered();
        }
        return DividendBatchResponse.builder()
                .netuid(netuid)
                .dividends(dividends)
                .cached(!dividends.isEmpty() && allCached)
                .stakeTxTriggered(anyTriggered)
                .totalDividend(total)
                .build();
    }

    public void evict(DividendQuery query) {
        validate(query);
        dividendCacheService.evict(query);
    }

    private String triggerTrade(TradeKey key) {
        String taskId = UUID.randomUUID().toString();
        if (!idempotencyGuard.tryAcquire(key, taskId)) {
            log.info("Trade already in flight for {}; not triggering another", key.lockKey());
            return null;
        }
        try {
            tradeTaskDispatcher.submit(new SentimentTradeCommand(taskId, key, clock.instant()));
        } catch (RuntimeException e) {
            idempotencyGuard.release(key, taskId);
            throw e;
        }
        return taskId;
    }

    private List<String> knownHotkeys(int netuid) {
        List<String> configured = taoProperties.getKnownHotkeys().get(netuid);
        List<String> hotkeys = configured != null && !configured.isEmpty() ? configured : chainClient.listHotkeys(netuid);
        List<String> usable = new ArrayList<>();
        for (String hotkey : hotkeys) {
            if (hotkey != null && hotkey.length() <= MAX_HOTKEY_LENGTH && HOTKEY_PATTERN.matcher(hotkey).matches()) {
                usable.add(hotkey);
            } else {
                log.warn("Skipping malformed hotkey '{}' listed for subnet {}", hotkey, netuid);
            }
        }
        return usable;
    }

    private void validate(DividendQuery query) {
        validateNetuid(query.netuid());
        validateHotkey(query.hotkey());
    }

    private void validateNetuid(int netuid) {
        if (netuid < 0) {
            throw new BadRequestException("netuid must be a non-negative integer");
        }
    }

    private void validateHotkey(String hotkey) {
        if (hotkey == null || hotkey.isBlank()) {
            throw new BadRequestException("hotkey must not be blank");
        }
        if (hotkey.length() > MAX_HOTKEY_LENGTH) {
            throw new BadRequestException("hotkey must be at most " + MAX_HOTKEY_LENGTH + " characters");
        }
        if (!HOTKEY_PATTERN.matcher(hotkey).matches()) {
            throw new BadRequestException("hotkey must be alphanumeric");
        }
    }
}
