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
import java.util.Optional;

/**
 * The document is not valid JSON or does not match the schema.
 * <p>
 * The file is left untouched. When a backup exists its path is carried here
 * and named in the message, so the caller can inspect it or
 * {@link TodoStore#restore(Path) restore} from it.
 */
public class CorruptionException extends StorageException {

    private final Path source;
    private final String detail;
    private final Path latestBackup;

    public CorruptionException(Path source, String detail) {
        this(source, detail, null, null);
    }

    public CorruptionException(Path source, String detail, Throwable cause) {
        this(source, detail, null, cause);
    }

    private CorruptionException(Path source, String detail, Path latestBackup, Throwable cause) {
        super(buildMessage(source, detail, latestBackup), cause);
        this.source = source;
        this.detail = detail;
        this.latestBackup = latestBackup;
    }

    /**
     * Returns a copy naming {@code backup} as the restore candidate.
     */
    public CorruptionException withLatestBackup(Optional<Path> backup) {
        if (backup.isEmpty()) {
            return this;
        }
        CorruptionException copy = new CorruptionException(source, detail, backup.get(), getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public Path source() {
        return source;
    }

    /** What was wrong, without the path prefix. */
    public String detail() {
        return detail;
    }

    public Optional<Path> latestBackup() {
        return Optional.ofNullable(latestBackup);
    }

    private static String buildMessage(Path source, String detail, Path latestBackup) {
        String message = "Corrupt document " + source + ": " + detail;
        return latestBackup == null ? message : message + " (latest backup: " + latestBackup + ")";
    }
}
