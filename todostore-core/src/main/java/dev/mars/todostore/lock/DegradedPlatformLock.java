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
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Fallback used only when no native lock works and insecure mode was
 * explicitly allowed.
 * <p>
 * Exclusion inside this JVM is as strong as the native locks. Across
 * processes it relies on atomically creating a {@code .held} marker next to
 * the lock file; the marker records the owner's pid so a marker left behind
 * by a dead process is reclaimed. The pid is written to a temporary file
 * first and the marker is published as a hard link to it, so a marker never
 * exists without its pid. Where hard links are not supported the marker is
 * created and filled in place, and an unreadable marker older than
 * {@link #MARKER_WRITE_GRACE} is treated as abandoned. Processes that ignore
 * the marker are not excluded.
 */
public final class DegradedPlatformLock implements PlatformLock {

    private static final Logger LOG = LoggerFactory.getLogger(DegradedPlatformLock.class);

    private static final String MARKER_SUFFIX = ".held";
    private static final long POLL_INTERVAL_MS = 10;

    /** How long a marker without a readable pid may be mid-write. */
    static final Duration MARKER_WRITE_GRACE = Duration.ofMillis(200);

    public DegradedPlatformLock() {
        LOG.warn("Running WITHOUT native file locking: cross-process exclusion relies on marker files only");
    }

    @Override
    public Mode mode() {
        return Mode.DEGRADED;
    }

    @Override
    public LockHandle acquire(Path path, Duration timeout) throws IOException {
        long budget = Timeouts.nanos(timeout);
        long deadline = System.nanoTime() + budget;
        Directories.ensureParent(path);

        try {
            if (!PathGuards.tryAcquire(path, budget)) {
                throw new LockTimeoutException(
                        "Could not acquire lock on " + path + " after " + timeout.toMillis() + " ms", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for lock on " + path);
        }

        Path marker = markerFor(path);
        byte[] pid = Long.toString(ProcessHandle.current().pid()).getBytes(StandardCharsets.US_ASCII);
        try {
            while (true) {
                if (publish(marker, pid)) {
                    LOG.debug("Degraded lock acquired on {}", path);
                    return new LockHandle(this, path, null, null);
                }
                if (reclaimIfStale(marker)) {
                    continue;
                }
                if (System.nanoTime() - deadline >= 0) {
                    throw new LockTimeoutException(
                            "Could not acquire lock on " + path + " after " + timeout.toMillis() + " ms", timeout);
                }
                TimeUnit.MILLISECONDS.sleep(POLL_INTERVAL_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            PathGuards.release(path);
            throw new InterruptedIOException("Interrupted while waiting for lock on " + path);
        } catch (IOException | RuntimeException e) {
            PathGuards.release(path);
            throw e;
        }
    }

    @Override
    public void release(LockHandle handle) {
        if (!handle.markReleased()) {
            return;
        }
        try {
            Files.deleteIfExists(markerFor(handle.path()));
            LOG.debug("Degraded lock released on {}", handle.path());
        } catch (IOException e) {
            LOG.warn("Could not remove lock marker for {}: {}", handle.path(), e.getMessage());
        } finally {
            PathGuards.release(handle.path());
        }
    }

    static Path markerFor(Path path) {
        return path.resolveSibling(path.getFileName() + MARKER_SUFFIX);
    }

    /**
     * Creates the marker holding {@code pid}.
     *
     * @return false if another owner's marker is in place
     */
    private static boolean publish(Path marker, byte[] pid) throws IOException {
        Path tmp = Files.createTempFile(marker.toAbsolutePath().getParent(), "." + marker.getFileName() + ".", ".tmp");
        try {
            Files.write(tmp, pid);
            Files.createLink(marker, tmp);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (UnsupportedOperationException | FileSystemException e) {
            LOG.debug("Hard link for {} not possible ({}), creating marker in place", marker, e.getMessage());
            return createInPlace(marker, pid);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static boolean createInPlace(Path marker, byte[] pid) throws IOException {
        try {
            Files.write(marker, pid, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }

    private boolean reclaimIfStale(Path marker) throws IOException {
        String content;
        FileTime modified;
        try {
            modified = Files.getLastModifiedTime(marker);
            content = Files.readString(marker, StandardCharsets.US_ASCII).trim();
        } catch (NoSuchFileException e) {
            return true;
        }
        long ownerPid;
        try {
            ownerPid = Long.parseLong(content);
        } catch (NumberFormatException e) {
            if (modified.toInstant().plus(MARKER_WRITE_GRACE).isAfter(Instant.now())) {
                // an in-place owner may be between create and write
                return false;
            }
            LOG.warn("Reclaiming lock marker {} with unreadable owner '{}'", marker, content);
            Files.deleteIfExists(marker);
            return true;
        }
        boolean alive = ProcessHandle.of(ownerPid).map(ProcessHandle::isAlive).orElse(false);
        if (alive) {
            return false;
        }
        LOG.warn("Reclaiming lock marker {} left by dead process {}", marker, ownerPid);
        Files.deleteIfExists(marker);
        return true;
    }
}
