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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DividendQueryDispatcherTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private DividendCacheService cacheService;
    private IdempotencyGuard guard;
    private TradeTaskDispatcher tradeTaskDispatcher;
    private ChainClient chainClient;
    private TaoProperties taoProperties;
    private DividendQueryDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        cacheService = mock(DividendCacheService.class);
        guard = mock(IdempotencyGuard.class);
        tradeTaskDispatcher = mock(TradeTaskDispatcher.class);
        chainClient = mock(ChainClient.class);
        taoProperties = new TaoProperties();
        taoProperties.setDefaultHotkey("5Default");
        dispatcher = new DividendQueryDispatcher(cacheService, guard, tradeTaskDispatcher, chainClient,
                taoProperties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void tradeRequestReturnsImmediatelyWithTask() {
        DividendQuery query = new DividendQuery(18, "H1");
        when(cacheService.getOrFetch(query)).thenReturn(new CacheLookup(BigInteger.valueOf(123456789), false));
        when(guard.tryAcquire(eq(new TradeKey(18, "H1")), anyString())).thenReturn(true);

        DividendResponse response = dispatcher.handle(query, true);

        assertThat(response.getNetuid()).isEqualTo(18);
        assertThat(response.getHotkey()).isEqualTo("H1");
        assertThat(response.getDividend()).isEqualTo(BigInteger.valueOf(123456789));
        assertThat(response.isCached()).isFalse();
        assertThat(response.isStakeTxTriggered()).isTrue();
        assertThat(response.getTxHash()).isNull();
        assertThat(response.getTaskId()).isNotBlank();

        ArgumentCaptor<SentimentTradeCommand> command = ArgumentCaptor.forClass(SentimentTradeCommand.class);
        verify(tradeTaskDispatcher).submit(command.capture());
        assertThat(command.getValue().taskId()).isEqualTo(response.getTaskId());
        assertThat(command.getValue().key()).isEqualTo(new TradeKey(18, "H1"));
        assertThat(command.getValue().requestedAt()).isEqualTo(NOW);
    }

    @Test
    void tradeAlreadyInFlightIsNotTriggeredAgain() {
        DividendQuery query = new DividendQuery(18, "H1");
        when(cacheService.getOrFetch(query)).thenReturn(new CacheLookup(BigInteger.ONE, true));
        when(guard.tryAcquire(any(), anyString())).thenReturn(false);

        DividendResponse response = dispatcher.handle(query, true);

        assertThat(response.isCached()).isTrue();
        assertThat(response.isStakeTxTriggered()).isFalse();
        assertThat(response.getTaskId()).isNull();
        verifyNoInteractions(tradeTaskDispatcher);
    }

    @Test
    void plainLookupNeverTouchesLock() {
        DividendQuery query = new DividendQuery(18, "H1");
        when(cacheService.getOrFetch(query)).thenReturn(new CacheLookup(BigInteger.ONE, false));

        DividendResponse response = dispatcher.handle(query, false);

        assertThat(response.isStakeTxTriggered()).isFalse();
        verifyNoInteractions(guard, tradeTaskDispatcher);
    }

    @Test
    void failedSubmitReleasesLock() {
        DividendQuery query = new DividendQuery(18, "H1");
        when(cacheService.getOrFetch(query)).thenReturn(new CacheLookup(BigInteger.ONE, false));
        when(guard.tryAcquire(any(), anyString())).thenReturn(true);
        when(tradeTaskDispatcher.submit(any())).thenThrow(new IllegalStateException("db down"));

        assertThatThrownBy(() -> dispatcher.handle(query, true)).isInstanceOf(IllegalStateException.class);

        ArgumentCaptor<String> holder = ArgumentCaptor.forClass(String.class);
        verify(guard).tryAcquire(eq(new TradeKey(18, "H1")), holder.capture());
        verify(guard).release(new TradeKey(18, "H1"), holder.getValue());
    }

    @Test
    void resolveFillsDefaults() {
        assertThat(dispatcher.resolve(null, null)).isEqualTo(new DividendQuery(18, "5Default"));
        assertThat(dispatcher.resolve(3, null)).isEqualTo(new DividendQuery(3, "5Default"));
    }

    @Test
    void invalidInputIsRejectedBeforeAnyLookup() {
        assertThatThrownBy(() -> dispatcher.handle(new DividendQuery(-1, "H1"), false))
                .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> dispatcher.handle(new DividendQuery(18, " "), false))
                .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> dispatcher.handle(new DividendQuery(18, "a".repeat(65)), false))
                .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> dispatcher.handle(new DividendQuery(18, "H1;drop"), false))
                .isInstanceOf(BadRequestException.class);
        verifyNoInteractions(cacheService, guard, tradeTaskDispatcher);
    }

    @Test
    void batchAggregatesKnownHotkeys() {
        taoProperties.getKnownHotkeys().put(18, List.of("H1", "H2"));
        when(cacheService.getOrFetch(new DividendQuery(18, "H1"))).thenReturn(new CacheLookup(BigInteger.TEN, true));
        when(cacheService.getOrFetch(new DividendQuery(18, "H2"))).thenReturn(new CacheLookup(BigInteger.TWO, false));

        DividendBatchResponse batch = dispatcher.handleBatch(18, false);

        assertThat(batch.getDividends()).extracting(DividendResponse::getHotkey).containsExactly("H1", "H2");
        assertThat(batch.getTotalDividend()).isEqualTo(BigInteger.valueOf(12));
        assertThat(batch.isCached()).isFalse();
        assertThat(batch.isStakeTxTriggered()).isFalse();
        verifyNoInteractions(chainClient);
    }

    @Test
    void batchFallsBackToChainListingAndSkipsMalformedHotkeys() {
        when(chainClient.listHotkeys(7)).thenReturn(List.of("H1", "not valid!"));
        when(cacheService.getOrFetch(new DividendQuery(7, "H1"))).thenReturn(new CacheLookup(BigInteger.ONE, true));

        DividendBatchResponse batch = dispatcher.handleBatch(7, false);

        assertThat(batch.getDividends()).hasSize(1);
        assertThat(batch.isCached()).isTrue();
        verify(cacheService, never()).getOrFetch(new DividendQuery(7, "not valid!"));
    }

    @Test
    void emptyBatchIsNotCached() {
        when(chainClient.listHotkeys(7)).thenReturn(List.of());

        DividendBatchResponse batch = dispatcher.handleBatch(7, true);

        assertThat(batch.getDividends()).isEmpty();
        assertThat(batch.isCached()).isFalse();
        assertThat(batch.getTotalDividend()).isEqualTo(BigInteger.ZERO);
    }
}
