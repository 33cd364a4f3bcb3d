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
import java.nio.channels.FileChannel;
import java.nio.file.LinkOption;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * POSIX lock: an exclusive fcntl record lock over {@link #LOCK_RANGE}.
 * <p>
 * The lock is advisory, so only processes that also lock the file are
 * excluded. The lock file is created owner read/write only and is never
 * opened through a symlink.
 */
public final class PosixPlatformLock extends NativePlatformLock {

    private static final long POLL_INTERVAL_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

    private static final FileAttribute<Set<PosixFilePermission>> OWNER_ONLY =
            PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------"));

    private final boolean posixPermissions;

    public PosixPlatformLock() {
        this(true);
    }

    PosixPlatformLock(boolean posixPermissions) {
        this.posixPermissions = posixPermissions;
    }

    @Override
    public Mode mode() {
        return Mode.POSIX_ADVISORY;
    }

    @Override
    protected FileChannel openLockFile(Path path) throws IOException {
        Set<OpenOption> options = Set.of(
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                LinkOption.NOFOLLOW_LINKS);
        return posixPermissions
                ? FileChannel.open(path, options, OWNER_ONLY)
                : FileChannel.open(path, options);
    }

    @Override
    protected long backoffNanos(int attempt) {
        return POLL_INTERVAL_NANOS;
    }
}
