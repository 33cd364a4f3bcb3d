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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Tests for {@link PlatformLock} selection and the lock implementations.
 */
class PlatformLockTest {

    private static final Duration SHORT = Duration.ofMillis(100);
    private static final Duration LONG = Duration.ofSeconds(5);

    @TempDir
    Path tempDir;

    private static PlatformCapabilities caps(boolean nativeLocking, boolean strict, boolean allowInsecure) {
        return new PlatformCapabilities(PlatformCapabilities.OsFamily.POSIX, nativeLocking, false, strict, allowInsecure);
    }

    // ========================================================================
    // Selection
    // ========================================================================

    @Nested
    @DisplayName("Implementation selection")
    class SelectionTests {

        @Test
        void testNativeLocking_SelectsOsImplementation() {
            assertEquals(PlatformLock.Mode.POSIX_ADVISORY, PlatformLock.create(caps(true, false, false)).mode());

            PlatformCapabilities windows = new PlatformCapabilities(
                    PlatformCapabilities.OsFamily.WINDOWS, true, false, false, false);
            assertEquals(PlatformLock.Mode.WINDOWS_MANDATORY, PlatformLock.create(windows).mode());
        }

        @Test
        void testNoNativeLocking_FailsSafeByDefault() {
            LockUnavailableException e = assertThrows(LockUnavailableException.class,
                    () -> PlatformLock.create(caps(false, false, false)));
            assertTrue(e.getMessage().contains("TODOSTORE_ALLOW_INSECURE_LOCKING"));
        }

        @Test
        void testNoNativeLocking_InsecureAllowed_Degrades() {
            PlatformLock lock = PlatformLock.create(caps(false, false, true));

            assertInstanceOf(DegradedPlatformLock.class, lock);
            assertEquals(PlatformLock.Mode.DEGRADED, lock.mode());
        }

        @Test
        void testStrictLocking_OverridesInsecureToggle() {
            assertThrows(LockUnavailableException.class, () -> PlatformLock.create(caps(false, true, true)));
        }

        @Test
        void testDetect_FindsNativeLocking() throws Exception {
            Path lockDir = tempDir.resolve("detect");
            PlatformCapabilities detected = PlatformCapabilities.detect(lockDir, false, false);

            assertTrue(detected.nativeLocking());
            assertTrue(Files.isDirectory(lockDir));
            try (var files = Files.list(lockDir)) {
                assertEquals(0, files.count(), "scratch file left behind");
            }
            assertFalse(detected.withNativeLocking(false).nativeLocking());
        }
    }

    // ========================================================================
    // Native lock
    // ========================================================================

    @Nested
    @DisplayName("Native lock")
    class NativeTests {

        private PlatformLock nativeLock() throws Exception {
            PlatformLock lock = PlatformLock.create(PlatformCapabilities.detect(tempDir, false, false));
            assumeTrue(lock.mode() != PlatformLock.Mode.DEGRADED, "no native locking here");
            return lock;
        }

        @Test
        void testAcquire_CreatesLockFileAndParents() throws Exception {
            Path lockPath = tempDir.resolve("a/b/todo.json.lock");

            try (LockHandle handle = nativeLock().acquire(lockPath, SHORT)) {
                assertTrue(handle.isValid());
                assertTrue(Files.exists(lockPath));
                assertEquals(PlatformLock.LOCK_RANGE, handle.lockedRange());
                assertTrue(handle.covers(tempDir.resolve("a/./b/todo.json.lock")));
            }
        }

        @Test
        void testRelease_InvalidatesHandle_AndIsIdempotent() throws Exception {
            PlatformLock lock = nativeLock();
            LockHandle handle = lock.acquire(tempDir.resolve("x.lock"), SHORT);

            lock.release(handle);
            lock.release(handle);
            handle.close();

            assertFalse(handle.isValid());
        }

        @Test
        void testUnboundedTimeout_Acquires() throws Exception {
            try (LockHandle handle = nativeLock().acquire(tempDir.resolve("forever.lock"),
                    Duration.ofSeconds(Long.MAX_VALUE))) {
                assertTrue(handle.isValid());
            }
        }

        @Test
        void testSecondHolder_TimesOut() throws Exception {
            PlatformLock lock = nativeLock();
            Path lockPath = tempDir.resolve("contended.lock");

            try (LockHandle ignored = lock.acquire(lockPath, SHORT)) {
                CompletableFuture<Throwable> other = CompletableFuture.supplyAsync(() -> {
                    try (LockHandle h = lock.acquire(lockPath, SHORT)) {
                        return null;
                    } catch (Throwable e) {
                        return e;
                    }
                });
                assertInstanceOf(LockTimeoutException.class, other.get(5, TimeUnit.SECONDS));
            }

            try (LockHandle again = lock.acquire(lockPath, SHORT)) {
                assertTrue(again.isValid());
            }
        }

        @Test
        void testTwoInstancesOnOnePath_Exclude() throws Exception {
            PlatformLock first = nativeLock();
            PlatformLock second = nativeLock();
            Path lockPath = tempDir.resolve("shared.lock");

            LockHandle held = first.acquire(lockPath, SHORT);
            CompletableFuture<LockHandle> waiting = CompletableFuture.supplyAsync(() -> {
                try {
                    return second.acquire(lockPath, LONG);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            });
            Thread.sleep(50);
            assertFalse(waiting.isDone());

            held.close();
            try (LockHandle next = waiting.get(5, TimeUnit.SECONDS)) {
                assertTrue(next.isValid());
            }
        }

        @Test
        void testParentIsAFile_ReportedClearly() throws Exception {
            Path blocker = tempDir.resolve("not-a-dir");
            Files.writeString(blocker, "x");

            NotDirectoryException e = assertThrows(NotDirectoryException.class,
                    () -> nativeLock().acquire(blocker.resolve("todo.json.lock"), SHORT));
            assertTrue(e.getMessage().contains("not-a-dir"));
        }
    }

    // ========================================================================
    // Backoff
    // ========================================================================

    @Test
    void testWindowsBackoff_BoundedWithJitter() {
        WindowsPlatformLock lock = new WindowsPlatformLock();
        for (int attempt = 0; attempt < 50; attempt++) {
            long pause = lock.backoffNanos(attempt);
            assertTrue(pause >= TimeUnit.MILLISECONDS.toNanos(5), "attempt " + attempt + ": " + pause);
            assertTrue(pause <= TimeUnit.MILLISECONDS.toNanos(500), "attempt " + attempt + ": " + pause);
        }
    }

    @Test
    void testPosixBackoff_Fixed() {
        PosixPlatformLock lock = new PosixPlatformLock();
        assertEquals(lock.backoffNanos(0), lock.backoffNanos(20));
    }

    // ========================================================================
    // Degraded lock
    // ========================================================================

    @Nested
    @DisplayName("Degraded lock")
    class DegradedTests {

        private final DegradedPlatformLock lock = new DegradedPlatformLock();

        @Test
        void testMarkerLifecycle() throws Exception {
            Path lockPath = tempDir.resolve("todo.json.lock");
            Path marker = DegradedPlatformLock.markerFor(lockPath);

            try (LockHandle handle = lock.acquire(lockPath, SHORT)) {
                assertTrue(handle.isValid());
                assertEquals(PlatformLock.Mode.DEGRADED, handle.mode());
                assertEquals(String.valueOf(ProcessHandle.current().pid()),
                        Files.readString(marker, StandardCharsets.US_ASCII));
            }

            assertFalse(Files.exists(marker));
        }

        @Test
        void testLiveMarker_Blocks() throws Exception {
            Path lockPath = tempDir.resolve("live.lock");
            Files.writeString(DegradedPlatformLock.markerFor(lockPath),
                    String.valueOf(ProcessHandle.current().pid()), StandardCharsets.US_ASCII);

            assertThrows(LockTimeoutException.class, () -> lock.acquire(lockPath, SHORT));
        }

        @Test
        void testStaleMarker_Reclaimed() throws Exception {
            Path lockPath = tempDir.resolve("stale.lock");
            Files.writeString(DegradedPlatformLock.markerFor(lockPath), String.valueOf(Long.MAX_VALUE),
                    StandardCharsets.US_ASCII);

            try (LockHandle handle = lock.acquire(lockPath, SHORT)) {
                assertTrue(handle.isValid());
            }
        }

        @Test
        void testEmptyOldMarker_Reclaimed() throws Exception {
            Path lockPath = tempDir.resolve("empty.lock");
            Path marker = DegradedPlatformLock.markerFor(lockPath);
            Files.createFile(marker);
            Files.setLastModifiedTime(marker, FileTime.from(Instant.now().minusSeconds(60)));

            try (LockHandle handle = lock.acquire(lockPath, Duration.ofMillis(500))) {
                assertTrue(handle.isValid());
                assertEquals(String.valueOf(ProcessHandle.current().pid()),
                        Files.readString(marker, StandardCharsets.US_ASCII));
            }
        }

        @Test
        void testFreshEmptyMarker_ReclaimedAfterGrace() throws Exception {
            Path lockPath = tempDir.resolve("fresh.lock");
            Files.createFile(DegradedPlatformLock.markerFor(lockPath));

            try (LockHandle handle = lock.acquire(lockPath, Duration.ofSeconds(5))) {
                assertTrue(handle.isValid());
            }
        }

        @Test
        void testAcquire_LeavesNoTempFiles() throws Exception {
            Path lockPath = tempDir.resolve("clean.lock");

            try (LockHandle ignored = lock.acquire(lockPath, SHORT)) {
                try (var entries = Files.list(tempDir)) {
                    assertTrue(entries.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
                }
            }
        }

        @Test
        void testUnboundedTimeout_Acquires() throws Exception {
            try (LockHandle handle = lock.acquire(tempDir.resolve("forever.lock"), Duration.ofSeconds(Long.MAX_VALUE))) {
                assertTrue(handle.isValid());
            }
        }
    }
}
