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
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;

/**
 * Parent directory handling shared by the lock and storage layers.
 */
public final class Directories {

    private Directories() {
    }

    /**
     * Ensures the parent directory of {@code file} exists.
     * <p>
     * Creation tolerates directories that already exist, including ones
     * created concurrently by another process. A path component that exists
     * as a regular file is reported as {@link NotDirectoryException}.
     *
     * @param file the file whose parent must exist
     * @throws IOException if the directory cannot be created
     */
    public static void ensureParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (FileAlreadyExistsException e) {
            // createDirectories only reports this when a component is not a directory
            Path blocker = firstNonDirectory(parent);
            throw new NotDirectoryException(
                    (blocker != null ? blocker : parent) + " exists as a file, not a directory. Cannot use " + file);
        }
    }

    private static Path firstNonDirectory(Path dir) {
        for (Path p = dir; p != null; p = p.getParent()) {
            if (Files.exists(p, LinkOption.NOFOLLOW_LINKS) && !Files.isDirectory(p)) {
                return p;
            }
        }
        return null;
    }
}
