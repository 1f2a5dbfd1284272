package com.liquidityledger.amm;

import com.liquidityledger.domain.Pool;
import com.liquidityledger.domain.SwapRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PoolBookTest {

    private final PoolBook poolBook = new PoolBook();

    private static Pool pool(String id) {
        Pool pool = new Pool();
        pool.setId(id);
        return pool;
    }

    private static SwapRecord swap(String poolId) {
        return new SwapRecord(poolId + "-swap", poolId, "trader", "USDC", "ETH", BigDecimal.TEN, BigDecimal.ONE,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.TEN,
                Instant.parse("2025-03-01T00:00:00Z"));
    }

    @Test
    @DisplayName("a swap recorded before the pool's history exists is kept")
    void swapRecordedAheadOfHistoryIsKept() {
        poolBook.appendSwap(swap("p1"));

        assertThat(poolBook.add(pool("p1"))).isTrue();

        assertThat(poolBook.swapsOf("p1")).hasSize(1);
        assertThat(poolBook.swapCount()).isEqualTo(1);
    }

    @Test
    void duplicatePoolKeepsHistory() {
        poolBook.add(pool("p1"));
        poolBook.appendSwap(swap("p1"));

        assertThat(poolBook.add(pool("p1"))).isFalse();
        assertThat(poolBook.swapsOf("p1")).hasSize(1);
        assertThat(poolBook.swapsOf("unknown")).isEmpty();
    }

    @Test
    @DisplayName("swaps racing pool registration never fail")
    void swapsRacingRegistration() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> tasks = new ArrayList<>();
        try {
            for (int i = 0; i < 200; i++) {
                String poolId = "p" + i;
                tasks.add(executor.submit(() -> {
                    start.await();
                    poolBook.add(pool(poolId));
                    return null;
                }));
                tasks.add(executor.submit(() -> {
                    start.await();
                    poolBook.appendSwap(swap(poolId));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> task : tasks) {
                task.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(poolBook.all()).hasSize(200);
        assertThat(poolBook.swapCount()).isEqualTo(200);
    }
}
