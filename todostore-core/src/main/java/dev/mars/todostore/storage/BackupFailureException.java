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
 * A backup copy could not be made.
 * <p>
 * Never fails a save: the writer logs it and records it on the store, see
 * {@link TodoStore#lastBackupFailure()}. Only an explicit
 * {@link TodoStore#backup()} request throws it.
 */
public class BackupFailureException extends StorageException {

    private final Path target;

    public BackupFailureException(Path target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    /** The document that was being backed up. */
    public Path target() {
        return target;
    }
}
