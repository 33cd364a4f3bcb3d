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

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Shared acquire/release loop for the {@link FileChannel}-based locks.
 * <p>
 * Subclasses decide how the lock file is opened and how long to back off
 * between attempts; the lock call itself is always
 * {@code tryLock(0, LOCK_RANGE, false)}.
 */
abstract class NativePlatformLock implements PlatformLock {

    private static final Logger LOG = LoggerFactory.getLogger(NativePlatformLock.class);

    @Override
    public LockHandle acquire(Path path, Duration timeout) throws IOException {
        long startNanos = System.nanoTime();
        long budget = Timeouts.nanos(timeout);
        long deadline = startNanos + budget;

        Directories.ensureParent(path);

        try {
            if (!PathGuards.tryAcquire(path, budget)) {
                LOG.debug("Lock on {} held elsewhere in this JVM, gave up after {}", path, timeout);
                throw new LockTimeoutException(
                        "Could not acquire lock on " + path + " after " + timeout.toMillis() + " ms", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for lock on " + path);
        }

        FileChannel channel = null;
        try {
            channel = openLockFile(path);
            int attempt = 0;
            while (true) {
                FileLock lock = tryLockOnce(channel);
                if (lock != null) {
                    long waitedMs = (System.nanoTime() - startNanos) / 1_000_000;
                    LOG.debug("Lock acquired on {} ({}) after {} attempts, {} ms", path, mode(), attempt + 1, waitedMs);
                    return new LockHandle(this, path, channel, lock);
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    LOG.debug("Lock on {} held by another process, gave up after {} attempts", path, attempt + 1);
                    throw new LockTimeoutException(
                            "Could not acquire lock on " + path + " after " + timeout.toMillis() + " ms", timeout);
                }
                long pause = Math.min(backoffNanos(attempt++), remaining);
                Thread.sleep(pause / 1_000_000, (int) (pause % 1_000_000));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(path, channel);
            throw new InterruptedIOException("Interrupted while waiting for lock on " + path);
        } catch (IOException | RuntimeException e) {
            abandon(path, channel);
            throw e;
        }
    }

    @Override
    public void release(LockHandle handle) {
        if (!handle.markReleased()) {
            LOG.trace("Lock on {} already released", handle.path());
            return;
        }
        try {
            FileLock lock = handle.fileLock();
            if (lock != null && lock.isValid()) {
                lock.release();
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock on {}: {}", handle.path(), e.getMessage());
        }
        try {
            handle.channel().close();
        } catch (IOException e) {
            LOG.warn("Could not close lock channel for {}: {}", handle.path(), e.getMessage());
        } finally {
            PathGuards.release(handle.path());
        }
        LOG.debug("Lock released on {} after {} us", handle.path(), handle.heldNanos() / 1000);
    }

    /**
     * Opens (creating if needed) the lock file for writing.
     */
    protected abstract FileChannel openLockFile(Path path) throws IOException;

    /**
     * Pause before retry number {@code attempt} (zero-based), in nanoseconds.
     */
    protected abstract long backoffNanos(int attempt);

    private FileLock tryLockOnce(FileChannel channel) throws IOException {
        try {
            return channel.tryLock(0, LOCK_RANGE, false);
        } catch (OverlappingFileLockException e) {
            // PathGuards should make this unreachable; treat as contention
            return null;
        }
    }

    private void abandon(Path path, FileChannel channel) {
        if (channel != null) {
            try {
                channel.close();
            } catch (IOException e) {
                LOG.warn("Could not close lock channel for {}: {}", path, e.getMessage());
            }
        }
        PathGuards.release(path);
    }
}
