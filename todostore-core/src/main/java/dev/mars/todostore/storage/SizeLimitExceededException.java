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
package dev.mars.todostore.storage;

import java.nio.file.Path;

/**
 * A read or write would exceed the configured document size cap.
 */
public class SizeLimitExceededException extends StorageException {

    private final long limit;
    private final long actual;

    /**
     * @param path   the document involved
     * @param limit  the cap in bytes
     * @param actual bytes seen; for reads this is a lower bound, as reading stops past the cap
     */
    public SizeLimitExceededException(Path path, long limit, long actual) {
        super(String.format("Document %s too large (%d bytes > %d byte limit)", path, actual, limit));
        this.limit = limit;
        this.actual = actual;
    }

    public long limit() {
        return limit;
    }

    public long actual() {
        return actual;
    }
}
