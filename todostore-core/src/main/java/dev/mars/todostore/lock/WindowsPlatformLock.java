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
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Windows lock: a mandatory LockFileEx range lock over {@link #LOCK_RANGE}.
 * <p>
 * The JDK maps {@link FileChannel#tryLock} to {@code LockFileEx} on Windows,
 * which the kernel enforces against every process, cooperating or not.
 * Contended attempts back off exponentially with jitter, capped at
 * {@link #MAX_BACKOFF_NANOS}.
 */
public final class WindowsPlatformLock extends NativePlatformLock {

    static final long BASE_BACKOFF_NANOS = TimeUnit.MILLISECONDS.toNanos(10);
    static final long MAX_BACKOFF_NANOS = TimeUnit.MILLISECONDS.toNanos(500);

    @Override
    public Mode mode() {
        return Mode.WINDOWS_MANDATORY;
    }

    @Override
    protected FileChannel openLockFile(Path path) throws IOException {
        return FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
    }

    @Override
    protected long backoffNanos(int attempt) {
        long ceiling = BASE_BACKOFF_NANOS << Math.min(attempt, 6);
        ceiling = Math.min(ceiling, MAX_BACKOFF_NANOS);
        // full jitter
        return Math.min(MAX_BACKOFF_NANOS, BASE_BACKOFF_NANOS / 2 + ThreadLocalRandom.current().nextLong(ceiling));
    }
}
