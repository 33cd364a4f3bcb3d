/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.todostore.lock;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CompatMutex}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Exclusion between threads, between tasks, and across the two</li>
 *   <li>Timeouts that never leave the caller owning the mutex</li>
 *   <li>Lazy scheduler start, shutdown and restart</li>
 *   <li>Close and cancellation cleanup</li>
 * </ul>
 */
class CompatMutexTest {

    private static final Duration SHORT = Duration.ofMillis(100);
    private static final Duration LONG = Duration.ofSeconds(10);

    private final CompatMutex mutex = new CompatMutex("test-mutex");

    @AfterEach
    void tearDown() {
        mutex.close();
    }

    /** Holds the mutex on a background thread until the returned latch is released. */
    private CountDownLatch holdOnOtherThread() throws InterruptedException {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch releaseSignal = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            try (CompatMutex.Permit permit = mutex.acquire(LONG)) {
                held.countDown();
                releaseSignal.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "holder");
        holder.start();
        assertTrue(held.await(5, TimeUnit.SECONDS));
        return releaseSignal;
    }

    // ========================================================================
    // Blocking domain
    // ========================================================================

    @Nested
    @DisplayName("Blocking domain")
    class BlockingTests {

        @Test
        void testAcquireUncontended() throws Exception {
            assertFalse(mutex.isLocked());

            try (CompatMutex.Permit permit = mutex.acquire(SHORT)) {
                assertTrue(mutex.isLocked());
                assertEquals(CompatMutex.Domain.THREAD, permit.owner().domain());
                assertEquals(Thread.currentThread().getName(), permit.owner().label());
                assertEquals(permit.owner(), mutex.owner().orElseThrow());
            }

            assertFalse(mutex.isLocked());
            assertTrue(mutex.owner().isEmpty());
        }

        @Test
        void testReentrantAcquire_Throws() throws Exception {
            try (CompatMutex.Permit ignored = mutex.acquire(SHORT)) {
                IllegalStateException e = assertThrows(IllegalStateException.class, () -> mutex.acquire(SHORT));
                assertTrue(e.getMessage().contains("not reentrant"));
                assertTrue(mutex.isLocked());
            }
        }

        @Test
        void testTimeout_CallerNeverOwns() throws Exception {
            CountDownLatch release = holdOnOtherThread();
            try {
                LockTimeoutException e = assertThrows(LockTimeoutException.class, () -> mutex.acquire(SHORT));

                assertEquals(SHORT, e.timeout());
                assertEquals("holder", mutex.owner().orElseThrow().label());
                assertEquals(0, mutex.queueLength());
                assertEquals(1, mutex.stats().timeouts());
            } finally {
                release.countDown();
            }

            // the failed waiter left no trace behind
            try (CompatMutex.Permit permit = mutex.acquire(LONG)) {
                assertEquals(Thread.currentThread().getName(), permit.owner().label());
            }
        }

        @Test
        void testTimedOutWaiter_DoesNotDisturbOthers() throws Exception {
            CountDownLatch release = holdOnOtherThread();
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<Boolean> patient = pool.submit(() -> {
                    try (CompatMutex.Permit ignored = mutex.acquire(LONG)) {
                        return true;
                    }
                });
                Future<?> impatient = pool.submit(() -> mutex.acquire(SHORT));

                ExecutionException e = assertThrows(ExecutionException.class, () -> impatient.get(5, TimeUnit.SECONDS));
                assertInstanceOf(LockTimeoutException.class, e.getCause());

                release.countDown();
                assertTrue(patient.get(5, TimeUnit.SECONDS));
            } finally {
                release.countDown();
                pool.shutdownNow();
            }
        }

        @Test
        void testRelease_Twice_IsNoOp() throws Exception {
            CompatMutex.Permit permit = mutex.acquire(SHORT);
            permit.close();
            permit.close();

            assertFalse(mutex.isLocked());
        }

        @Test
        void testRelease_ForeignPermit_Throws() throws Exception {
            try (CompatMutex other = new CompatMutex("other");
                 CompatMutex.Permit foreign = other.acquire(SHORT);
                 CompatMutex.Permit mine = mutex.acquire(SHORT)) {
                assertThrows(IllegalStateException.class, () -> mutex.release(foreign));
                assertTrue(mutex.isLocked());
                assertEquals(mine.owner(), mutex.owner().orElseThrow());
            }
        }

        @Test
        void testInterruptedWaiter_LeavesQueue() throws Exception {
            CountDownLatch release = holdOnOtherThread();
            AtomicReference<Throwable> outcome = new AtomicReference<>();
            Thread waiter = new Thread(() -> {
                try {
                    mutex.acquire(LONG).close();
                } catch (Throwable e) {
                    outcome.set(e);
                }
            });
            try {
                waiter.start();
                while (mutex.queueLength() == 0) {
                    Thread.sleep(5);
                }
                waiter.interrupt();
                waiter.join(5000);

                assertInstanceOf(InterruptedException.class, outcome.get());
                assertEquals(0, mutex.queueLength());
            } finally {
                release.countDown();
            }
        }
    }

    // ========================================================================
    // Cooperative domain
    // ========================================================================

    @Nested
    @DisplayName("Cooperative domain")
    class AsyncTests {

        @Test
        void testAcquireAsync_Uncontended() throws Exception {
            CompatMutex.Permit permit = mutex.acquireAsync(SHORT).get(5, TimeUnit.SECONDS);

            assertEquals(CompatMutex.Domain.TASK, permit.owner().domain());
            assertTrue(mutex.isLocked());
            permit.close();
            assertFalse(mutex.isLocked());
        }

        @Test
        void testGrant_DeliveredOnSchedulerThread() throws Exception {
            CountDownLatch release = holdOnOtherThread();
            CompletableFuture<Boolean> onLoop;
            try {
                onLoop = mutex.acquireAsync(LONG).thenApply(permit -> {
                    boolean loop = mutex.scheduler().isSchedulerThread();
                    permit.close();
                    return loop;
                });
                assertFalse(onLoop.isDone());
            } finally {
                release.countDown();
            }
            assertTrue(onLoop.get(5, TimeUnit.SECONDS));
        }

        @Test
        void testAsyncTimeout_CallerNeverOwns() throws Exception {
            CountDownLatch release = holdOnOtherThread();
            try {
                CompletableFuture<CompatMutex.Permit> future = mutex.acquireAsync(SHORT);

                ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
                assertInstanceOf(LockTimeoutException.class, e.getCause());
                assertEquals("holder", mutex.owner().orElseThrow().label());
                assertEquals(0, mutex.queueLength());
            } finally {
                release.countDown();
            }
        }

        @Test
        void testCancelledRequest_IsWithdrawn() throws Exception {
            CountDownLatch release = holdOnOtherThread();
            try {
                CompletableFuture<CompatMutex.Permit> future = mutex.acquireAsync(LONG);
                assertEquals(1, mutex.queueLength());

                future.cancel(false);

                assertEquals(0, mutex.queueLength());
            } finally {
                release.countDown();
            }
            try (CompatMutex.Permit ignored = mutex.acquire(LONG)) {
                assertTrue(mutex.isLocked());
            }
        }

        @Test
        void testBlockingAcquireOnSchedulerThread_Throws() throws Exception {
            CompletableFuture<Throwable> result = new CompletableFuture<>();
            mutex.scheduler().execute(() -> {
                try {
                    mutex.acquire(SHORT).close();
                    result.complete(null);
                } catch (Throwable e) {
                    result.complete(e);
                }
            });

            assertInstanceOf(IllegalStateException.class, result.get(5, TimeUnit.SECONDS));
            assertFalse(mutex.isLocked());
        }

        @Test
        void testOwnScheduler_ReceivesGrant() throws Exception {
            try (TaskScheduler own = new TaskScheduler("own-loop")) {
                CountDownLatch release = holdOnOtherThread();
                CompletableFuture<String> thread;
                try {
                    thread = mutex.acquireAsync(LONG, own).thenApply(permit -> {
                        permit.close();
                        return Thread.currentThread().getName();
                    });
                } finally {
                    release.countDown();
                }
                assertEquals("own-loop", thread.get(5, TimeUnit.SECONDS));
                assertFalse(mutex.hasScheduler());
            }
        }

        @Test
        void testClose_DetachesFromOwnScheduler() throws Exception {
            try (TaskScheduler own = new TaskScheduler("own-loop")) {
                mutex.acquireAsync(LONG, own).get(5, TimeUnit.SECONDS).close();
                assertEquals(1, own.resourceCount());

                mutex.close();

                assertEquals(0, own.resourceCount());
                assertFalse(own.isClosed());
                CompletableFuture<String> ran = new CompletableFuture<>();
                own.execute(() -> ran.complete(Thread.currentThread().getName()));
                assertEquals("own-loop", ran.get(5, TimeUnit.SECONDS));
            }
        }
    }

    // ========================================================================
    // Mixed domains
    // ========================================================================

    @Test
    void testThreadsAndTasks_ExcludeEachOther() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger overlaps = new AtomicInteger();
        AtomicInteger entries = new AtomicInteger();
        Runnable critical = () -> {
            if (inside.incrementAndGet() != 1) {
                overlaps.incrementAndGet();
            }
            entries.incrementAndGet();
            inside.decrementAndGet();
        };

        List<CompletableFuture<Void>> tasks = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            tasks.add(mutex.acquireAsync(LONG).thenAccept(permit -> {
                try (permit) {
                    critical.run();
                }
            }));
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> threads = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            threads.add(pool.submit(() -> {
                for (int i = 0; i < 25; i++) {
                    try (CompatMutex.Permit ignored = mutex.acquire(LONG)) {
                        critical.run();
                    }
                }
                return null;
            }));
        }

        for (Future<?> f : threads) {
            f.get(30, TimeUnit.SECONDS);
        }
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);
        pool.shutdown();

        assertEquals(0, overlaps.get());
        assertEquals(200, entries.get());
        assertEquals(200, mutex.stats().totalWaits());
        assertFalse(mutex.isLocked());
    }

    // ========================================================================
    // Scheduler lifecycle
    // ========================================================================

    @Nested
    @DisplayName("Scheduler lifecycle")
    class SchedulerTests {

        @Test
        void testSchedulerCreatedLazily() throws Exception {
            assertFalse(mutex.hasScheduler());

            mutex.acquireAsync(SHORT).get(5, TimeUnit.SECONDS).close();

            assertTrue(mutex.hasScheduler());
        }

        @Test
        void testConcurrentFirstUse_SharesOneScheduler() throws Exception {
            int callers = 16;
            CyclicBarrier barrier = new CyclicBarrier(callers);
            Set<TaskScheduler> seen = ConcurrentHashMap.newKeySet();
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    barrier.await();
                    seen.add(mutex.scheduler());
                    return null;
                }));
            }
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
            pool.shutdown();

            assertEquals(1, seen.size());
        }

        @Test
        void testShutdown_CancelsWaitingTasks_AndRestarts() throws Exception {
            CountDownLatch release = holdOnOtherThread();
            TaskScheduler first = mutex.scheduler();
            CompletableFuture<CompatMutex.Permit> waiting;
            try {
                waiting = mutex.acquireAsync(LONG);
                assertEquals(1, first.resourceCount());

                mutex.shutdownScheduler();

                assertThrows(CancellationException.class, () -> waiting.get(5, TimeUnit.SECONDS));
                assertTrue(first.isClosed());
                assertFalse(mutex.hasScheduler());
                assertEquals(0, mutex.queueLength());
            } finally {
                release.countDown();
            }

            CompatMutex.Permit permit = mutex.acquireAsync(LONG).get(5, TimeUnit.SECONDS);
            assertNotSame(first, mutex.scheduler());
            permit.close();
            assertFalse(mutex.isLocked());
        }

        @Test
        void testClose_FailsWaiters_AndRefusesNewCallers() throws Exception {
            CountDownLatch release = holdOnOtherThread();
            CompletableFuture<CompatMutex.Permit> task = mutex.acquireAsync(LONG);
            AtomicReference<Throwable> threadOutcome = new AtomicReference<>();
            Thread waiter = new Thread(() -> {
                try {
                    mutex.acquire(LONG);
                } catch (Throwable e) {
                    threadOutcome.set(e);
                }
            });
            try {
                waiter.start();
                while (mutex.queueLength() < 2) {
                    Thread.sleep(5);
                }

                mutex.close();
                waiter.join(5000);

                assertInstanceOf(IllegalStateException.class, threadOutcome.get());
                ExecutionException e = assertThrows(ExecutionException.class, () -> task.get(5, TimeUnit.SECONDS));
                assertInstanceOf(IllegalStateException.class, e.getCause());
                assertThrows(IllegalStateException.class, () -> mutex.acquire(SHORT));
                assertTrue(mutex.acquireAsync(SHORT).isCompletedExceptionally());
            } finally {
                release.countDown();
            }
        }
    }

    // ========================================================================
    // Stats
    // ========================================================================

    @Test
    void testUnboundedTimeout_WaitsForRelease() throws Exception {
        Duration forever = Duration.ofSeconds(Long.MAX_VALUE);
        CountDownLatch release = holdOnOtherThread();
        CompletableFuture<Void> task = mutex.acquireAsync(forever).thenAccept(CompatMutex.Permit::close);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> blocking = pool.submit(() -> {
                mutex.acquire(forever).close();
                return null;
            });
            while (mutex.queueLength() < 2) {
                Thread.sleep(5);
            }
            assertFalse(task.isDone());
            release.countDown();

            task.get(5, TimeUnit.SECONDS);
            blocking.get(5, TimeUnit.SECONDS);
            assertFalse(mutex.isLocked());
            assertEquals(0, mutex.stats().timeouts());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void testStats_AverageWait() throws Exception {
        assertEquals(LockStats.EMPTY, mutex.stats());
        assertEquals(Duration.ZERO, mutex.stats().averageWait());

        mutex.acquire(SHORT).close();
        mutex.acquire(SHORT).close();

        LockStats stats = mutex.stats();
        assertEquals(2, stats.totalWaits());
        assertEquals(0, stats.timeouts());
        assertTrue(stats.maxWait().compareTo(stats.averageWait()) >= 0);
    }
}
