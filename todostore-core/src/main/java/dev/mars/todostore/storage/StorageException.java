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

import java.io.IOException;
import java.nio.file.AccessDeniedException;

/**
 * Exception thrown when storage operations fail.
 * <p>
 * Subclasses mark the failures callers commonly branch on; anything else is a
 * plain {@code StorageException} wrapping the underlying {@link IOException}.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Wraps an I/O failure, mapping permission errors to {@link PermissionDeniedException}.
     */
    public static StorageException wrap(String message, IOException cause) {
        if (cause instanceof AccessDeniedException) {
            return new PermissionDeniedException(message + ": permission denied (" + cause.getMessage() + ")", cause);
        }
        return new StorageException(message + ": " + cause.getMessage(), cause);
    }
}
