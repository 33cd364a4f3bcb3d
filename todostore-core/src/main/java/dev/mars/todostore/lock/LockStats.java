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
 * Read-only snapshot of {@link CompatMutex} contention.
 *
 * @param totalWaits    completed acquisition attempts, granted or timed out
 * @param totalWaitTime summed time spent waiting across those attempts
 * @param maxWait       longest single wait
 * @param timeouts      attempts that ended in {@link LockTimeoutException}
 */
public record LockStats(long totalWaits, Duration totalWaitTime, Duration maxWait, long timeouts) {

    public static final LockStats EMPTY = new LockStats(0, Duration.ZERO, Duration.ZERO, 0);

    /** Mean wait per attempt, zero when nothing was recorded. */
    public Duration averageWait() {
        return totalWaits == 0 ? Duration.ZERO : totalWaitTime.dividedBy(totalWaits);
    }
}
