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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutual exclusion shared by blocking threads and cooperatively scheduled tasks.
 * <p>
 * Threads call {@link #acquire(Duration)} and block. Tasks call
 * {@link #acquireAsync(Duration)} and chain on the returned future, which
 * completes on a {@link TaskScheduler} run loop; the run loop itself never
 * blocks. Both paths queue in one waiter list, so a thread and a task can
 * never hold the mutex at the same time.
 * <p>
 * <b>States:</b> the mutex is either unlocked or held by exactly one
 * {@link Permit}. A waiter moves from waiting to either granted or timed out,
 * decided under the internal state lock, so a timed-out caller never owns
 * the mutex and a granted caller always does.
 * <p>
 * <b>Scheduler:</b> the default scheduler is created on the first async
 * acquisition and stopped by {@link #shutdownScheduler()} or {@link #close()};
 * a later async acquisition starts a fresh one. Callers may also bring their
 * own scheduler via {@link #acquireAsync(Duration, TaskScheduler)}.
 * <p>
 * Not reentrant: a thread that re-acquires a mutex it holds gets an
 * {@link IllegalStateException} instead of a deadlock.
 */
public final class CompatMutex implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CompatMutex.class);

    private static final AtomicLong TASK_IDS = new AtomicLong();

    private final String name;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final Deque<Waiter> waiters = new ArrayDeque<>();   // guarded by stateLock
    private Permit holder;                                      // guarded by stateLock
    private boolean closed;                                     // guarded by stateLock

    private final Object schedulerInit = new Object();
    private volatile TaskScheduler scheduler;

    private final WaitStats stats = new WaitStats();

    /** Registrations on every scheduler this mutex has delivered to. */
    private final Set<SchedulerBinding> bindings = ConcurrentHashMap.newKeySet();

    public CompatMutex(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    // ========================================================================
    // Blocking domain
    // ========================================================================

    /**
     * Blocks until the mutex is held by the calling thread or {@code timeout} elapses.
     *
     * @return the permit; close it to release
     * @throws LockTimeoutException  if the wait budget elapsed; the caller does not own the mutex
     * @throws IllegalStateException if called on this mutex's scheduler thread, re-entered by
     *                               the holding thread, or the mutex is closed
     * @throws InterruptedException  if interrupted while waiting; the caller does not own the mutex
     */
    public Permit acquire(Duration timeout) throws InterruptedException {
        TaskScheduler s = scheduler;
        if (s != null && s.isSchedulerThread()) {
            throw new IllegalStateException(
                    "Blocking acquire of " + name + " on its scheduler thread would deadlock; use acquireAsync");
        }

        Owner owner = Owner.thread(Thread.currentThread());
        Waiter waiter = new Waiter(owner, null);
        Permit immediate = null;

        stateLock.lock();
        try {
            ensureOpen();
            if (holder != null && holder.owner().sameContext(owner)) {
                throw new IllegalStateException(name + " is not reentrant; already held by " + owner);
            }
            if (holder == null && waiters.isEmpty()) {
                immediate = grantLocked(waiter);
            } else {
                waiters.addLast(waiter);
            }
        } finally {
            stateLock.unlock();
        }

        if (immediate != null) {
            LOG.trace("{} acquired uncontended by {}", name, owner);
            return immediate;
        }

        LOG.trace("{} contended, {} waiting", name, owner);
        try {
            return waiter.future.get(Timeouts.nanos(timeout), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            return expireBlocking(waiter, timeout);
        } catch (InterruptedException e) {
            abandon(waiter);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Acquisition of " + name + " failed", cause);
        }
    }

    // ========================================================================
    // Cooperative domain
    // ========================================================================

    /**
     * Queues an acquisition on the default scheduler.
     *
     * @see #acquireAsync(Duration, TaskScheduler)
     */
    public CompletableFuture<Permit> acquireAsync(Duration timeout) {
        stateLock.lock();
        try {
            if (closed) {
                return CompletableFuture.failedFuture(new IllegalStateException(name + " is closed"));
            }
        } finally {
            stateLock.unlock();
        }
        return acquireAsync(timeout, scheduler());
    }

    /**
     * Queues an acquisition whose result is delivered on {@code on}'s run loop.
     * <p>
     * The future completes with a {@link Permit}, or exceptionally with
     * {@link LockTimeoutException} if {@code timeout} elapses first.
     * Cancelling the future withdraws the request; if the grant already
     * happened the permit is released on the caller's behalf.
     */
    public CompletableFuture<Permit> acquireAsync(Duration timeout, TaskScheduler on) {
        SchedulerBinding binding;
        try {
            binding = on.resource(this, () -> new SchedulerBinding(this, on));
        } catch (IllegalStateException e) {
            return CompletableFuture.failedFuture(e);
        }
        bindings.add(binding);

        Owner owner = Owner.task(TASK_IDS.incrementAndGet());
        Waiter waiter = new Waiter(owner, binding);
        Permit immediate = null;

        stateLock.lock();
        try {
            if (closed) {
                detach(binding);
                return CompletableFuture.failedFuture(new IllegalStateException(name + " is closed"));
            }
            binding.track(waiter);
            if (holder == null && waiters.isEmpty()) {
                immediate = grantLocked(waiter);
            } else {
                waiters.addLast(waiter);
            }
        } finally {
            stateLock.unlock();
        }

        waiter.future.whenComplete((permit, error) -> {
            if (error instanceof CancellationException) {
                abandon(waiter);
            }
        });

        if (immediate != null) {
            deliver(waiter, immediate);
            return waiter.future;
        }

        LOG.trace("{} contended, {} queued on {}", name, owner, on.name());
        try {
            waiter.timeoutTask = on.schedule(() -> expireAsync(waiter, timeout), timeout);
        } catch (RejectedExecutionException e) {
            abandon(waiter);
            waiter.future.completeExceptionally(new CancellationException("Scheduler " + on.name() + " is closed"));
        }
        return waiter.future;
    }

    // ========================================================================
    // Release
    // ========================================================================

    /**
     * Releases the mutex held by {@code permit} and hands it to the next waiter.
     * <p>
     * Safe from any thread. A waiting task is woken through its scheduler's
     * {@link TaskScheduler#execute}, never by completing it on the releasing
     * thread. Releasing an already released permit is a no-op.
     *
     * @throws IllegalStateException if {@code permit} is not the current holder
     */
    public void release(Permit permit) {
        Waiter next = null;
        Permit nextPermit = null;

        stateLock.lock();
        try {
            if (permit.released) {
                return;
            }
            if (holder != permit) {
                throw new IllegalStateException(permit + " does not hold " + name);
            }
            permit.released = true;
            holder = null;
            Waiter candidate;
            while ((candidate = waiters.pollFirst()) != null) {
                if (candidate.status == Status.WAITING) {
                    next = candidate;
                    nextPermit = grantLocked(candidate);
                    break;
                }
            }
        } finally {
            stateLock.unlock();
        }

        LOG.trace("{} released by {}", name, permit.owner());
        if (next != null) {
            deliver(next, nextPermit);
        }
    }

    // ========================================================================
    // Introspection
    // ========================================================================

    public boolean isLocked() {
        stateLock.lock();
        try {
            return holder != null;
        } finally {
            stateLock.unlock();
        }
    }

    /** Current holder, if any. */
    public Optional<Owner> owner() {
        stateLock.lock();
        try {
            return holder == null ? Optional.empty() : Optional.of(holder.owner());
        } finally {
            stateLock.unlock();
        }
    }

    /** Number of callers currently waiting. */
    public int queueLength() {
        stateLock.lock();
        try {
            return waiters.size();
        } finally {
            stateLock.unlock();
        }
    }

    /** Contention statistics snapshot. */
    public LockStats stats() {
        return stats.snapshot();
    }

    // ========================================================================
    // Scheduler lifecycle
    // ========================================================================

    /**
     * Returns the default scheduler, creating it on first use.
     * <p>
     * Double-checked: concurrent first callers all receive the one instance
     * published by the winner.
     */
    public TaskScheduler scheduler() {
        TaskScheduler s = scheduler;
        if (s == null || s.isClosed()) {
            synchronized (schedulerInit) {
                s = scheduler;
                if (s == null || s.isClosed()) {
                    s = new TaskScheduler(name + "-scheduler");
                    scheduler = s;
                    LOG.debug("{} started scheduler {}", name, s.name());
                }
            }
        }
        return s;
    }

    /** Whether a default scheduler is currently running. */
    public boolean hasScheduler() {
        TaskScheduler s = scheduler;
        return s != null && !s.isClosed();
    }

    /**
     * Stops the default scheduler. Tasks still waiting on it are cancelled.
     */
    public void shutdownScheduler() {
        TaskScheduler s;
        synchronized (schedulerInit) {
            s = scheduler;
            scheduler = null;
        }
        if (s != null) {
            s.close();
        }
    }

    /**
     * Closes the mutex: pending waiters fail with {@link IllegalStateException},
     * new acquisitions are refused, the default scheduler is stopped, and
     * registrations on caller-supplied schedulers are dropped.
     * A current holder may still release.
     */
    @Override
    public void close() {
        List<Waiter> pending;
        stateLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            pending = new ArrayList<>(waiters);
            waiters.clear();
            for (Waiter w : pending) {
                w.status = Status.CANCELLED;
            }
        } finally {
            stateLock.unlock();
        }
        for (Waiter w : pending) {
            w.future.completeExceptionally(new IllegalStateException(name + " is closed"));
        }
        shutdownScheduler();
        // schedulers supplied by callers outlive the mutex
        for (SchedulerBinding binding : List.copyOf(bindings)) {
            detach(binding);
        }
        LOG.debug("{} closed, {} waiters cancelled", name, pending.size());
    }

    // ========================================================================
    // Internals
    // ========================================================================

    private void detach(SchedulerBinding binding) {
        bindings.remove(binding);
        binding.scheduler.detach(this, binding);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException(name + " is closed");
        }
    }

    /** Must hold stateLock. */
    private Permit grantLocked(Waiter waiter) {
        Permit permit = new Permit(this, waiter.owner);
        holder = permit;
        waiter.status = Status.GRANTED;
        waiter.permit = permit;
        stats.recordGrant(System.nanoTime() - waiter.enqueuedNanos);
        return permit;
    }

    private void deliver(Waiter waiter, Permit permit) {
        if (waiter.binding == null) {
            waiter.future.complete(permit);
            return;
        }
        ScheduledFuture<?> timeoutTask = waiter.timeoutTask;
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
        }
        try {
            waiter.binding.dispatch(() -> {
                if (!waiter.settled.compareAndSet(false, true)) {
                    return;
                }
                waiter.binding.untrack(waiter);
                if (!waiter.future.complete(permit)) {
                    // requester cancelled after the grant
                    release(permit);
                }
            });
        } catch (RejectedExecutionException e) {
            if (waiter.settled.compareAndSet(false, true)) {
                LOG.debug("{} grant to {} rejected, scheduler closed", name, waiter.owner);
                waiter.binding.untrack(waiter);
                release(permit);
                waiter.future.completeExceptionally(
                        new CancellationException("Scheduler " + waiter.binding.scheduler.name() + " is closed"));
            }
        }
    }

    private Permit expireBlocking(Waiter waiter, Duration timeout) {
        Permit granted = null;
        stateLock.lock();
        try {
            if (waiter.status == Status.WAITING) {
                waiters.remove(waiter);
                waiter.status = Status.TIMED_OUT;
                stats.recordTimeout(System.nanoTime() - waiter.enqueuedNanos);
            } else if (waiter.status == Status.GRANTED) {
                granted = waiter.permit;
            }
        } finally {
            stateLock.unlock();
        }
        if (granted != null) {
            // the grant won the race against the deadline
            return granted;
        }
        LOG.debug("{} timed out after {} ms for {}", name, timeout.toMillis(), waiter.owner);
        throw new LockTimeoutException(
                "Timed out after " + timeout.toMillis() + " ms waiting for " + name, timeout);
    }

    private void expireAsync(Waiter waiter, Duration timeout) {
        boolean expired = false;
        stateLock.lock();
        try {
            if (waiter.status == Status.WAITING) {
                waiters.remove(waiter);
                waiter.status = Status.TIMED_OUT;
                stats.recordTimeout(System.nanoTime() - waiter.enqueuedNanos);
                expired = true;
            }
        } finally {
            stateLock.unlock();
        }
        if (expired) {
            waiter.binding.untrack(waiter);
            LOG.debug("{} timed out after {} ms for {}", name, timeout.toMillis(), waiter.owner);
            waiter.future.completeExceptionally(new LockTimeoutException(
                    "Timed out after " + timeout.toMillis() + " ms waiting for " + name, timeout));
        }
    }

    /**
     * Withdraws a waiter that gave up. If it was granted in the meantime,
     * the grant is released so the mutex passes on.
     */
    private void abandon(Waiter waiter) {
        Permit toRelease = null;
        stateLock.lock();
        try {
            if (waiter.status == Status.WAITING) {
                waiters.remove(waiter);
                waiter.status = Status.CANCELLED;
            } else if (waiter.status == Status.GRANTED) {
                toRelease = waiter.permit;
            }
        } finally {
            stateLock.unlock();
        }
        if (waiter.binding != null) {
            waiter.binding.untrack(waiter);
        }
        if (toRelease != null) {
            release(toRelease);
        }
    }

    /**
     * Withdraws a task whose scheduler is closing. A grant that was dispatched
     * but never ran on the loop is released.
     */
    private void withdraw(Waiter waiter, String reason) {
        boolean cancel = false;
        Permit toRelease = null;
        stateLock.lock();
        try {
            if (waiter.status == Status.WAITING) {
                waiters.remove(waiter);
                waiter.status = Status.CANCELLED;
                cancel = true;
            } else if (waiter.status == Status.GRANTED && waiter.settled.compareAndSet(false, true)) {
                toRelease = waiter.permit;
                cancel = true;
            }
        } finally {
            stateLock.unlock();
        }
        if (toRelease != null) {
            release(toRelease);
        }
        if (cancel) {
            waiter.future.completeExceptionally(new CancellationException(reason));
        }
    }

    // ========================================================================
    // Types
    // ========================================================================

    /** Execution domains that can hold the mutex. */
    public enum Domain {
        THREAD,
        TASK
    }

    /**
     * Identity of a holder: a thread id or a task sequence number.
     */
    public record Owner(Domain domain, long id, String label) {

        static Owner thread(Thread thread) {
            return new Owner(Domain.THREAD, thread.getId(), thread.getName());
        }

        static Owner task(long taskId) {
            return new Owner(Domain.TASK, taskId, "task-" + taskId);
        }

        boolean sameContext(Owner other) {
            return domain == other.domain && id == other.id;
        }

        @Override
        public String toString() {
            return domain.name().toLowerCase() + ":" + label;
        }
    }

    /**
     * Proof of ownership. Closing the permit releases the mutex.
     */
    public static final class Permit implements AutoCloseable {
        private final CompatMutex mutex;
        private final Owner owner;
        private boolean released;   // guarded by mutex.stateLock

        private Permit(CompatMutex mutex, Owner owner) {
            this.mutex = mutex;
            this.owner = owner;
        }

        public Owner owner() {
            return owner;
        }

        @Override
        public void close() {
            mutex.release(this);
        }

        @Override
        public String toString() {
            return "Permit{" + mutex.name + ", " + owner + '}';
        }
    }

    private enum Status {
        WAITING,
        GRANTED,
        TIMED_OUT,
        CANCELLED
    }

    private static final class Waiter {
        final Owner owner;
        final SchedulerBinding binding;
        final long enqueuedNanos = System.nanoTime();
        final CompletableFuture<Permit> future = new CompletableFuture<>();
        final AtomicBoolean settled = new AtomicBoolean(false);
        volatile ScheduledFuture<?> timeoutTask;
        Status status = Status.WAITING;     // guarded by stateLock
        Permit permit;                      // guarded by stateLock

        Waiter(Owner owner, SchedulerBinding binding) {
            this.owner = owner;
            this.binding = binding;
        }
    }

    /**
     * This mutex's state on one scheduler, owned by that scheduler.
     * <p>
     * Routes grants onto the scheduler's loop and, when the scheduler closes,
     * withdraws the tasks still waiting through it.
     */
    private static final class SchedulerBinding implements AutoCloseable {
        private final CompatMutex mutex;
        private final TaskScheduler scheduler;
        private final Set<Waiter> pending = ConcurrentHashMap.newKeySet();

        SchedulerBinding(CompatMutex mutex, TaskScheduler scheduler) {
            this.mutex = mutex;
            this.scheduler = scheduler;
        }

        void track(Waiter waiter) {
            pending.add(waiter);
        }

        void untrack(Waiter waiter) {
            pending.remove(waiter);
        }

        void dispatch(Runnable task) {
            scheduler.execute(task);
        }

        @Override
        public void close() {
            mutex.bindings.remove(this);
            for (Waiter waiter : List.copyOf(pending)) {
                mutex.withdraw(waiter, "Scheduler " + scheduler.name() + " is closed");
            }
            pending.clear();
        }
    }

    /**
     * Contention counters; every update and read synchronizes on this object.
     */
    private static final class WaitStats {
        private long totalWaits;
        private long totalWaitNanos;
        private long maxWaitNanos;
        private long timeouts;

        synchronized void recordGrant(long waitNanos) {
            record(waitNanos);
        }

        synchronized void recordTimeout(long waitNanos) {
            record(waitNanos);
            timeouts++;
        }

        private void record(long waitNanos) {
            totalWaits++;
            totalWaitNanos += waitNanos;
            maxWaitNanos = Math.max(maxWaitNanos, waitNanos);
        }

        synchronized LockStats snapshot() {
            return new LockStats(totalWaits, Duration.ofNanos(totalWaitNanos), Duration.ofNanos(maxWaitNanos), timeouts);
        }
    }
}
