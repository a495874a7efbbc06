package com.taodividends.backend.guard;

import com.taodividends.backend.config.TaoProperties;
import com.taodividends.backend.model.TradeKey;
import com.taodividends.backend.repository.TradeLockRepository;
import com.taodividends.backend.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class IdempotencyGuardTest {

    private static final TradeKey KEY = new TradeKey(18, "H1");

    @Autowired
    private TradeLockRepository tradeLockRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private MutableClock clock;
    private IdempotencyGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        guard = new IdempotencyGuard(tradeLockRepository, transactionManager, new TaoProperties(), clock);
    }

    @AfterEach
    void cleanUp() {
        tradeLockRepository.deleteAll();
    }

    @Test
    void secondAcquireIsDeniedWhileHeld() {
        assertThat(guard.tryAcquire(KEY, "task-1")).isTrue();
        assertThat(guard.tryAcquire(KEY, "task-2")).isFalse();
        assertThat(guard.isHeld(KEY)).isTrue();
        assertThat(tradeLockRepository.findById("18:H1")).get()
                .extracting(lock -> lock.getHolderId())
                .isEqualTo("task-1");
    }

    @Test
    void locksAreIndependentPerAccount() {
        assertThat(guard.tryAcquire(KEY, "task-1")).isTrue();
        assertThat(guard.tryAcquire(new TradeKey(18, "H2"), "task-2")).isTrue();
        assertThat(guard.tryAcquire(new TradeKey(19, "H1"), "task-3")).isTrue();
    }

    @Test
    void releaseByOwnerFreesTheKey() {
        guard.tryAcquire(KEY, "task-1");

        assertThat(guard.release(KEY, "task-1")).isTrue();

        assertThat(guard.isHeld(KEY)).isFalse();
        assertThat(guard.tryAcquire(KEY, "task-2")).isTrue();
    }

    @Test
    void releaseByAnotherHolderIsIgnored() {
        guard.tryAcquire(KEY, "task-1");

        assertThat(guard.release(KEY, "task-2")).isFalse();

        assertThat(guard.isHeld(KEY)).isTrue();
    }

    @Test
    void expiredLockIsReclaimed() {
        guard.tryAcquire(KEY, "task-1");
        clock.advance(Duration.ofMinutes(10));

        assertThat(guard.isHeld(KEY)).isFalse();
        assertThat(guard.tryAcquire(KEY, "task-2")).isTrue();
        assertThat(guard.release(KEY, "task-1")).isFalse();
        assertThat(guard.release(KEY, "task-2")).isTrue();
    }

    @Test
    void lockNotYetExpiredIsNotReclaimed() {
        guard.tryAcquire(KEY, "task-1");
        clock.advance(Duration.ofMinutes(9));

        assertThat(guard.tryAcquire(KEY, "task-2")).isFalse();
    }

    @Test
    void concurrentContendersGetExactlyOneLock() throws Exception {
        int contenders = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                String holder = "task-" + i;
                Callable<Boolean> attempt = () -> {
                    start.await();
                    return guard.tryAcquire(KEY, holder);
                };
                results.add(pool.submit(attempt));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
