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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * A cooperative scheduler: one background run-loop thread executing short
 * tasks and timers in order.
 * <p>
 * Tasks running here must never block on I/O or on a lock; they chain
 * continuations instead. Submitting work is thread-safe, so any thread may
 * hand a task to the loop with {@link #execute(Runnable)}.
 * <p>
 * <b>Owned resources:</b> components that need per-scheduler state register
 * it with {@link #resource(Object, Supplier)}. The scheduler owns those
 * objects and closes them when it is closed, so nothing keyed by a
 * discarded scheduler outlives it.
 */
public final class TaskScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TaskScheduler.class);

    private static final long TERMINATION_WAIT_MS = 1000;

    private final String name;
    private final ScheduledThreadPoolExecutor executor;
    private final ConcurrentMap<Object, AutoCloseable> resources = new ConcurrentHashMap<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile Thread loopThread;

    public TaskScheduler(String name) {
        this.name = name;
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        LOG.debug("Scheduler {} created", name);
    }

    /** The scheduler's name, also used for its thread. */
    public String name() {
        return name;
    }

    /**
     * Queues a task on the run loop.
     *
     * @throws RejectedExecutionException if the scheduler is closed
     */
    public void execute(Runnable task) {
        executor.execute(task);
    }

    /**
     * Runs a task on the run loop after {@code delay}.
     *
     * @throws RejectedExecutionException if the scheduler is closed
     */
    public ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        return executor.schedule(task, Timeouts.nanos(delay), TimeUnit.NANOSECONDS);
    }

    /** Whether the calling thread is this scheduler's run-loop thread. */
    public boolean isSchedulerThread() {
        return Thread.currentThread() == loopThread;
    }

    public boolean isClosed() {
        return stopped.get();
    }

    /**
     * Returns the resource registered under {@code key}, creating it on first use.
     * <p>
     * Double-checked: the fast path reads the registry; on a miss a candidate is
     * built and published with {@code putIfAbsent}. A thread that loses the race
     * adopts the winner's instance and closes its own candidate, so an instance
     * that is already in use is never replaced.
     *
     * @throws IllegalStateException if the scheduler is closed
     */
    public <T extends AutoCloseable> T resource(Object key, Supplier<T> factory) {
        AutoCloseable existing = resources.get(key);
        if (existing != null) {
            return cast(existing);
        }
        if (stopped.get()) {
            throw new IllegalStateException("Scheduler " + name + " is closed");
        }
        T candidate = factory.get();
        AutoCloseable winner = resources.putIfAbsent(key, candidate);
        if (winner != null) {
            LOG.trace("Scheduler {} adopting existing resource for {}", name, key);
            closeQuietly(candidate);
            return cast(winner);
        }
        if (stopped.get()) {
            // lost a race with close(); the teardown snapshot may have missed us
            resources.remove(key, candidate);
            closeQuietly(candidate);
            throw new IllegalStateException("Scheduler " + name + " is closed");
        }
        return candidate;
    }

    /**
     * Drops the registration of {@code resource} under {@code key} without
     * closing it, for an owner that is going away before the scheduler.
     *
     * @return whether that exact instance was registered
     */
    public boolean detach(Object key, AutoCloseable resource) {
        return resources.remove(key, resource);
    }

    /** Number of live owned resources. */
    public int resourceCount() {
        return resources.size();
    }

    /**
     * Stops the run loop and closes every owned resource.
     * <p>
     * The loop thread is interrupted rather than polled, so it exits promptly.
     * Pending timers are discarded. Idempotent.
     */
    @Override
    public void close() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        LOG.debug("Stopping scheduler {}", name);
        executor.shutdownNow();

        // snapshot: closing one resource may cause others to deregister
        List<AutoCloseable> owned = List.copyOf(resources.values());
        resources.clear();
        for (AutoCloseable resource : owned) {
            closeQuietly(resource);
        }

        if (!isSchedulerThread()) {
            try {
                if (!executor.awaitTermination(TERMINATION_WAIT_MS, TimeUnit.MILLISECONDS)) {
                    LOG.warn("Scheduler {} did not stop within {} ms", name, TERMINATION_WAIT_MS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        LOG.debug("Scheduler {} stopped", name);
    }

    @SuppressWarnings("unchecked")
    private static <T> T cast(AutoCloseable resource) {
        return (T) resource;
    }

    private void closeQuietly(AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            LOG.warn("Error closing resource of scheduler {}: {}", name, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "TaskScheduler{" + name + (stopped.get() ? ", closed" : "") + '}';
    }
}
