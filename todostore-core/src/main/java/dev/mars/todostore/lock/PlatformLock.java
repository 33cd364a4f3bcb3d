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

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Whole-file, cross-process exclusive lock.
 * <p>
 * Implementations lock a fixed {@link #LOCK_RANGE} starting at offset zero
 * rather than the current file size, so the locked region still covers the
 * file after it grows.
 * <p>
 * Within one JVM at most one {@link LockHandle} is open for a given path at
 * any instant; across processes the operating system enforces the same.
 * The degraded implementation weakens the cross-process half of that
 * guarantee and is only selected when explicitly permitted.
 *
 * @see PlatformCapabilities
 */
public interface PlatformLock {

    /** Length of the locked region. Never derived from the file size. */
    long LOCK_RANGE = Long.MAX_VALUE;

    /** How a lock implementation enforces exclusion. */
    enum Mode {
        /** Advisory fcntl-class lock; cooperating processes are excluded. */
        POSIX_ADVISORY,
        /** Mandatory range lock; all processes are excluded. */
        WINDOWS_MANDATORY,
        /** Marker-file protocol without an OS lock. */
        DEGRADED
    }

    /**
     * Acquires the lock on {@code path}, creating the file and its parent
     * directories if needed.
     *
     * @param path    the lock file
     * @param timeout maximum time to wait
     * @return the live handle; close it (or pass it to {@link #release}) to unlock
     * @throws LockTimeoutException if the lock was not obtained in time
     * @throws IOException          if the lock file cannot be opened or locked
     */
    LockHandle acquire(Path path, Duration timeout) throws IOException;

    /**
     * Releases a handle obtained from this lock. Releasing twice is a no-op.
     */
    void release(LockHandle handle);

    /** The exclusion mode of this implementation. */
    Mode mode();

    /**
     * Selects the implementation for the given platform.
     *
     * @throws LockUnavailableException if native locking is missing and the
     *                                  insecure fallback is not permitted
     */
    static PlatformLock create(PlatformCapabilities capabilities) {
        if (capabilities.nativeLocking()) {
            return capabilities.osFamily() == PlatformCapabilities.OsFamily.WINDOWS
                    ? new WindowsPlatformLock()
                    : new PosixPlatformLock(capabilities.posixPermissions());
        }
        if (capabilities.strictLocking()) {
            throw new LockUnavailableException(
                    "Native file locking is not available on this platform and strict locking is enabled");
        }
        if (!capabilities.allowInsecureLocking()) {
            throw new LockUnavailableException(
                    "Native file locking is not available on this platform. Set todostore.allowInsecureLocking=true "
                            + "(or TODOSTORE_ALLOW_INSECURE_LOCKING=true) to run with reduced cross-process safety");
        }
        return new DegradedPlatformLock();
    }
}
