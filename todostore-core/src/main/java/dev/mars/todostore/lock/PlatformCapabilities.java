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
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * What the running platform offers for file locking, decided once at startup.
 * <p>
 * Produced by {@link #detect(Path, boolean, boolean)} and handed to
 * {@link PlatformLock#create(PlatformCapabilities)}. Nothing in the lock layer
 * reads environment variables or system properties after this value exists.
 *
 * @param osFamily             the operating system family
 * @param nativeLocking        whether {@link FileChannel#tryLock} works in the lock directory
 * @param posixPermissions     whether the default file system supports the "posix" attribute view
 * @param strictLocking        missing native locking is a hard error, even if insecure mode is allowed
 * @param allowInsecureLocking missing native locking may fall back to {@link DegradedPlatformLock}
 */
public record PlatformCapabilities(
        OsFamily osFamily,
        boolean nativeLocking,
        boolean posixPermissions,
        boolean strictLocking,
        boolean allowInsecureLocking
) {

    private static final Logger LOG = LoggerFactory.getLogger(PlatformCapabilities.class);

    /** Operating system families with distinct locking protocols. */
    public enum OsFamily {
        POSIX,
        WINDOWS
    }

    /**
     * Detects what the platform supports.
     * <p>
     * Native locking is tested by locking a scratch file in {@code lockDir},
     * which is created if missing.
     *
     * @param lockDir              directory on the file system that will hold the lock file
     * @param strictLocking        see {@link #strictLocking()}
     * @param allowInsecureLocking see {@link #allowInsecureLocking()}
     * @throws IOException if the lock directory or scratch file cannot be created
     */
    public static PlatformCapabilities detect(Path lockDir, boolean strictLocking, boolean allowInsecureLocking)
            throws IOException {
        OsFamily os = System.getProperty("os.name", "").toLowerCase().contains("win")
                ? OsFamily.WINDOWS
                : OsFamily.POSIX;
        boolean posix = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");

        Files.createDirectories(lockDir);
        boolean nativeLocking = supportsNativeLocking(lockDir);

        PlatformCapabilities caps = new PlatformCapabilities(os, nativeLocking, posix, strictLocking, allowInsecureLocking);
        LOG.debug("Detected platform capabilities: {}", caps);
        return caps;
    }

    /**
     * Returns a copy with the native locking flag replaced.
     */
    public PlatformCapabilities withNativeLocking(boolean available) {
        return new PlatformCapabilities(osFamily, available, posixPermissions, strictLocking, allowInsecureLocking);
    }

    private static boolean supportsNativeLocking(Path dir) throws IOException {
        Path scratch = Files.createTempFile(dir, ".lock-check-", ".tmp");
        try (FileChannel ch = FileChannel.open(scratch, StandardOpenOption.WRITE)) {
            FileLock lock = ch.tryLock(0, PlatformLock.LOCK_RANGE, false);
            if (lock == null) {
                // Someone else locked a file nobody knows about yet; the primitive itself works.
                return true;
            }
            lock.release();
            return true;
        } catch (UnsupportedOperationException | IOException e) {
            LOG.warn("Native file locking unavailable in {}: {}", dir, e.getMessage());
            return false;
        } finally {
            Files.deleteIfExists(scratch);
        }
    }
}
