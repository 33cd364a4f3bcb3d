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

import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A live lock on one file, scoped to a single critical section.
 * <p>
 * Closing the handle releases the lock. A handle is not reusable.
 */
public final class LockHandle implements AutoCloseable {

    private final PlatformLock issuer;
    private final Path path;
    private final FileChannel channel;
    private final FileLock fileLock;
    private final long acquiredAtNanos;
    private final AtomicBoolean released = new AtomicBoolean(false);

    LockHandle(PlatformLock issuer, Path path, FileChannel channel, FileLock fileLock) {
        this.issuer = issuer;
        this.path = path;
        this.channel = channel;
        this.fileLock = fileLock;
        this.acquiredAtNanos = System.nanoTime();
    }

    /** The locked file. */
    public Path path() {
        return path;
    }

    /** The exclusion mode of the lock that issued this handle. */
    public PlatformLock.Mode mode() {
        return issuer.mode();
    }

    /** Length of the locked region, or zero for a degraded handle. */
    public long lockedRange() {
        return fileLock != null ? fileLock.size() : 0L;
    }

    /** Whether the handle still holds its lock. */
    public boolean isValid() {
        if (released.get()) {
            return false;
        }
        return fileLock == null || fileLock.isValid();
    }

    /**
     * Whether this handle locks {@code other}, compared by normalized absolute path.
     */
    public boolean covers(Path other) {
        return path.toAbsolutePath().normalize().equals(other.toAbsolutePath().normalize());
    }

    long heldNanos() {
        return System.nanoTime() - acquiredAtNanos;
    }

    FileChannel channel() {
        return channel;
    }

    FileLock fileLock() {
        return fileLock;
    }

    /** Marks the handle released; returns false if it already was. */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public void close() {
        issuer.release(this);
    }

    @Override
    public String toString() {
        return "LockHandle{path=" + path + ", mode=" + issuer.mode() + ", valid=" + isValid() + '}';
    }
}
