package com.taodividends.backend.cache;

import com.taodividends.backend.client.ChainClient;
import com.taodividends.backend.config.TaoProperties;
import com.taodividends.backend.model.DividendQuery;
import com.taodividends.backend.model.DividendRecord;
import com.taodividends.backend.repository.DividendRecordRepository;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Read-through cache for dividend lookups.
 * <p>
 * Concurrent misses on the same fingerprint share one chain call: the first caller fetches,
 * the others wait for its result. Each distinct fetch appends one row to the dividend history.
 */
@Slf4j
@Service
public class DividendCacheService {

    static final String SOURCE_CHAIN = "chain";

    private final DividendCacheStore store;
    private final ChainClient chainClient;
    private final DividendRecordRepository dividendRecordRepository;
    private final Retry chainQueryRetry;
    private final TaoProperties taoProperties;
    private final Clock clock;
    private final Counter hitCounter;
    private final Counter missCounter;
    private final ConcurrentMap<String, CompletableFuture<BigInteger>> inFlight = new ConcurrentHashMap<>();

    public DividendCacheService(DividendCacheStore store,
                                ChainClient chainClient,
                                DividendRecordRepository dividendRecordRepository,
                                @Qualifier("chainQueryRetry") Retry chainQueryRetry,
                                TaoProperties taoProperties,
                                Clock clock,
                                MeterRegistry meterRegistry) {
        this.store = store;
        this.chainClient = chainClient;
        this.dividendRecordRepository = dividendRecordRepository;
        this.chainQueryRetry = chainQueryRetry;
        this.taoProperties = taoProperties;
        this.clock = clock;
        this.hitCounter = Counter.builder("dividend_cache_hits_total").register(meterRegistry);
        this.missCounter = Counter.builder("dividend_cache_misses_total").register(meterRegistry);
    }

    public CacheLookup getOrFetch(DividendQuery query) {
        String fingerprint = DividendFingerprint.of(query);
        Optional<BigInteger> fresh = readFresh(fingerprint);
        if (fresh.isPresent()) {
            hitCounter.increment();
            return new CacheLookup(fresh.get(), true);
        }

        CompletableFuture<BigInteger> mine = new CompletableFuture<>();
        CompletableFuture<BigInteger> leader = inFlight.putIfAbsent(fingerprint, mine);
        if (leader != null) {
            missCounter.increment();
            log.debug("Joining in-flight fetch for {}", fingerprint);
            return new CacheLookup(await(leader), false);
        }

        try {
            // A previous leader may have filled the cache between our read and our registration.
            Optional<BigInteger> filled = readFresh(fingerprint);
            if (filled.isPresent()) {
                mine.complete(filled.get());
                hitCounter.increment();
                return new CacheLookup(filled.get(), true);
            }
            missCounter.increment();
            BigInteger value = fetchAndStore(query, fingerprint);
            mine.complete(value);
            return new CacheLookup(value, false);
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(fingerprint, mine);
        }
    }

    public void evict(DividendQuery query) {
        String fingerprint = DividendFingerprint.of(query);
        store.evict(fingerprint);
        log.info("Evicted cached dividend {}", fingerprint);
    }

    private Optional<BigInteger> readFresh(String fingerprint) {
        Instant now = clock.instant();
        return store.get(fingerprint)
                .filter(entry -> !entry.isExpired(now))
                .map(CachedDividend::value);
    }

    private BigInteger fetchAndStore(DividendQuery query, String fingerprint) {
        BigInteger value = Retry.decorateSupplier(chainQueryRetry,
                () -> chainClient.fetchDividend(query.netuid(), query.hotkey())).get();
        Instant now = clock.instant();
        dividendRecordRepository.save(DividendRecord.builder()
                .netuid(query.netuid())
                .hotkey(query.hotkey())
                .dividend(value)
                .source(SOURCE_CHAIN)
                .observedAt(now)
                .build());

        Duration ttl = taoProperties.getCache().getTtl();
        try {
            store.put(fingerprint, new CachedDividend(value, now, now.plus(ttl)), ttl);
        } catch (RuntimeException e) {
            log.warn("Could not cache dividend {}: {}", fingerprint, e.getMessage());
        }
        log.info("Fetched dividend netuid={} hotkey={} value={}", query.netuid(), query.hotkey(), value);
        return value;
    }

    private BigInteger await(CompletableFuture<BigInteger> leader) {
        try {
            return leader.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
