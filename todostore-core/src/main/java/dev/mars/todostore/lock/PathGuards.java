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

import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * JVM-wide exclusion per lock path.
 * <p>
 * OS file locks are held per process, and closing any channel on a file may
 * drop every lock this JVM holds on it. Only the holder of the path's guard
 * may therefore open a channel on the lock file. A semaphore rather than a
 * thread-owned lock, because handles are released from whichever thread
 * finishes the critical section.
 */
final class PathGuards {

    private static final ConcurrentMap<Path, Semaphore> GUARDS = new ConcurrentHashMap<>();

    private PathGuards() {
    }

    static Path key(Path path) {
        return path.toAbsolutePath().normalize();
    }

    static boolean tryAcquire(Path path, long timeoutNanos) throws InterruptedException {
        Semaphore guard = GUARDS.computeIfAbsent(key(path), k -> new Semaphore(1));
        return guard.tryAcquire(Math.max(0L, timeoutNanos), TimeUnit.NANOSECONDS);
    }

    static void release(Path path) {
        Semaphore guard = GUARDS.get(key(path));
        if (guard != null) {
            guard.release();
        }
    }
}
