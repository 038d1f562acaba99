package com.questrail.delay;

import com.questrail.delay.observability.NullDelayObservabilitySink;
import com.questrail.delay.time.DeterministicScheduler;
import com.questrail.delay.time.ManualMonotonicClock;
import com.questrail.delay.time.ScheduledExecutorScheduler;
import com.questrail.delay.time.SystemMonotonicClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PostponableDelayConcurrencyTest
 * -----------------------------------------------------------------------------
 * Many handles postponing from many threads at once.
 */
class PostponableDelayConcurrencyTest {

    private static final int THREADS = 8;

    @Test
    void concurrentPostponesSettleOnTheLargestAcceptedTarget() throws Exception {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        DeterministicScheduler scheduler = new DeterministicScheduler(clock);
        long initialTarget = 1_000;
        PostponableDelay delay = PostponableDelay.arm(initialTarget, clock, scheduler);

        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Long>> results = new ArrayList<>();
        try {
            for (int i = 0; i < THREADS; i++) {
                PostponableDelayHandle handle = delay.handle();
                results.add(pool.submit(() -> {
                    start.await();
                    long maxAccepted = Long.MIN_VALUE;
                    for (int n = 0; n < 5_000; n++) {
                        long requested = ThreadLocalRandom.current().nextLong(0, 1_000_000);
                        PostponeResponse response = handle.postpone(requested);
                        assertNotEquals(PostponeResponse.ALREADY_RESOLVED, response);
                        if (response == PostponeResponse.OK) {
                            assertTrue(requested >= initialTarget);
                            maxAccepted = Math.max(maxAccepted, requested);
                        }
                    }
                    return maxAccepted;
                }));
            }
            start.countDown();

            long expected = initialTarget;
            for (Future<Long> result : results) {
                expected = Math.max(expected, result.get(10, TimeUnit.SECONDS));
            }
            assertEquals(expected, delay.targetNanos());

            clock.advanceToNanos(expected - 1);
            scheduler.runDueTasks();
            assertFalse(delay.isResolved());

            clock.advanceToNanos(expected);
            scheduler.runDueTasks();
            assertTrue(delay.isResolved());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void postponesRacingResolutionNeverResolveEarly() throws Exception {
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        try {
            SystemMonotonicClock clock = SystemMonotonicClock.INSTANCE;
            PostponableDelay delay = PostponableDelay.arm(
                    clock.nowNanos() + TimeUnit.MILLISECONDS.toNanos(5),
                    clock,
                    new ScheduledExecutorScheduler(timer, clock),
                    NullDelayObservabilitySink.INSTANCE,
                    Instant::now);

            AtomicLong resolvedAt = new AtomicLong();
            CompletableFuture<Void> recorded = delay.completion()
                    .thenRun(() -> resolvedAt.set(clock.nowNanos()))
                    .toCompletableFuture();

            AtomicLong maxAccepted = new AtomicLong(delay.targetNanos());
            AtomicBoolean revertedAfterResolution = new AtomicBoolean(false);
            long stopPostponingAt = clock.nowNanos() + TimeUnit.MILLISECONDS.toNanos(60);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> workers = new ArrayList<>();

            for (int i = 0; i < THREADS; i++) {
                PostponableDelayHandle handle = delay.handle();
                workers.add(pool.submit(() -> {
                    start.await();
                    boolean sawResolved = false;
                    while (clock.nowNanos() - stopPostponingAt < 0) {
                        long requested = clock.nowNanos()
                                + ThreadLocalRandom.current().nextLong(TimeUnit.MILLISECONDS.toNanos(3));
                        PostponeResponse response = handle.postpone(requested);
                        if (response == PostponeResponse.OK) {
                            maxAccepted.accumulateAndGet(requested, Math::max);
                            if (sawResolved) {
                                revertedAfterResolution.set(true);
                            }
                        } else if (response == PostponeResponse.ALREADY_RESOLVED) {
                            sawResolved = true;
                        } else if (sawResolved) {
                            revertedAfterResolution.set(true);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();

            for (Future<?> worker : workers) {
                worker.get(10, TimeUnit.SECONDS);
            }
            recorded.get(5, TimeUnit.SECONDS);

            assertTrue(delay.isResolved());
            assertFalse(revertedAfterResolution.get(), "A handle saw the delay un-resolve");
            assertTrue(resolvedAt.get() - maxAccepted.get() >= 0,
                    "Resolved before the largest accepted target");
            assertEquals(PostponeResponse.ALREADY_RESOLVED, delay.handle().postpone(clock.nowNanos()));
        } finally {
            pool.shutdownNow();
            timer.shutdownNow();
        }
    }
}
