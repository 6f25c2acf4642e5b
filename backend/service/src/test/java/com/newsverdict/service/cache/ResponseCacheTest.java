package com.newsverdict.service.cache;

import com.newsverdict.sources.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseCacheTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-02-09T20:00:00Z"), ZoneOffset.UTC);
    private final ResponseCache<String> cache = new ResponseCache<>(clock);

    @Test
    void entryIsServedUntilJustBeforeExpiry() {
        cache.put("k", "v", Duration.ofSeconds(10));

        clock.advance(Duration.ofMillis(9_999));
        assertEquals(Optional.of("v"), cache.get("k"));

        clock.advance(Duration.ofMillis(1));
        assertEquals(Optional.empty(), cache.get("k"));
    }

    @Test
    void defaultTtlIsFiveMinutes() {
        cache.put("k", "v");

        clock.advance(Duration.ofMinutes(4));
        assertTrue(cache.get("k").isPresent());
        clock.advance(Duration.ofMinutes(1));
        assertTrue(cache.get("k").isEmpty());
        assertEquals(ResponseCache.DEFAULT_TTL, cache.defaultTtl());
    }

    @Test
    void getOrComputeLoadsOnceWhileFresh() {
        AtomicInteger loads = new AtomicInteger();

        assertEquals("value-1", cache.getOrCompute("k", () -> "value-" + loads.incrementAndGet()));
        assertEquals("value-1", cache.getOrCompute("k", () -> "value-" + loads.incrementAndGet()));
        assertEquals(1, loads.get());

        clock.advance(Duration.ofMinutes(5));
        assertEquals("value-2", cache.getOrCompute("k", () -> "value-" + loads.incrementAndGet()));
    }

    @Test
    void failedLoadIsNotCached() {
        assertThrows(IllegalStateException.class, () -> cache.getOrCompute("k", () -> {
            throw new IllegalStateException("upstream down");
        }));

        assertTrue(cache.get("k").isEmpty());
        assertEquals("recovered", cache.getOrCompute("k", () -> "recovered"));
    }

    @Test
    void concurrentCallersForOneKeyShareOneLoad() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            Future<?>[] futures = new Future<?>[8];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = executor.submit(() -> {
                    start.await();
                    return cache.getOrCompute("shared", () -> {
                        loads.incrementAndGet();
                        return "v";
                    });
                });
            }
            start.countDown();
            for (Future<?> future : futures) {
                assertEquals("v", future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, loads.get());
    }

    @Test
    void slowLoadDoesNotHoldUpAKeyWithTheSameHash() throws Exception {
        assertEquals("Aa".hashCode(), "BB".hashCode());
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<String> slow = executor.submit(() -> cache.getOrCompute("fetch:Aa", () -> {
                loading.countDown();
                await(release);
                return "slow";
            }));
            assertTrue(loading.await(5, TimeUnit.SECONDS));

            Future<String> fast = executor.submit(() -> cache.getOrCompute("fetch:BB", () -> "fast"));
            assertEquals("fast", fast.get(2, TimeUnit.SECONDS));
            assertEquals(Optional.empty(), cache.get("fetch:Aa"));

            release.countDown();
            assertEquals("slow", slow.get(5, TimeUnit.SECONDS));
            assertEquals(Optional.of("slow"), cache.get("fetch:Aa"));
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void waitersOnAFailedLoadSeeTheSameFailure() throws Exception {
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<String> owner = executor.submit(() -> cache.getOrCompute("k", () -> {
                loading.countDown();
                await(release);
                throw new IllegalStateException("upstream down");
            }));
            assertTrue(loading.await(5, TimeUnit.SECONDS));
            Future<String> waiter = executor.submit(() -> cache.getOrCompute("k", () -> "unused"));
            Thread.sleep(100);
            release.countDown();

            ExecutionException ownerFailure = assertThrows(ExecutionException.class, () -> owner.get(5, TimeUnit.SECONDS));
            ExecutionException waiterFailure = assertThrows(ExecutionException.class, () -> waiter.get(5, TimeUnit.SECONDS));
            assertTrue(ownerFailure.getCause() instanceof IllegalStateException);
            assertEquals("upstream down", waiterFailure.getCause().getMessage());
            assertTrue(cache.get("k").isEmpty());
            assertEquals("recovered", cache.getOrCompute("k", () -> "recovered"));
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void sizeIsBoundedAndInvalidateAllClears() {
        ResponseCache<String> small = new ResponseCache<>(clock, Duration.ofMinutes(1), 2);
        for (int i = 0; i < 10; i++) {
            small.put("k" + i, "v" + i);
        }

        assertTrue(small.size() <= 2, "size was " + small.size());
        small.invalidateAll();
        assertEquals(0, small.size());
    }

    @Test
    void rejectsNonPositiveTtl() {
        assertThrows(IllegalArgumentException.class, () -> cache.put("k", "v", Duration.ZERO));
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
