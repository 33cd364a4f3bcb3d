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

import java.time.Duration;

/**
 * Thrown when a lock is not acquired within its time budget.
 * <p>
 * Used for both {@link CompatMutex} and {@link PlatformLock} timeouts, from
 * blocking threads and from scheduled tasks alike. A caller that receives this
 * exception does not own the lock.
 */
public class LockTimeoutException extends RuntimeException {

    private final Duration timeout;

    public LockTimeoutException(String message, Duration timeout) {
        super(message);
        this.timeout = timeout;
    }

    /** The wait budget that elapsed. */
    public Duration timeout() {
        return timeout;
    }
}
