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
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.Objects;

/**
 * Identity of one version of a file on disk.
 * <p>
 * Every save renames a fresh temp file over the target, so the file key
 * (inode on POSIX) changes with each version; size and mtime cover platforms
 * that report no file key.
 */
record FileStamp(boolean exists, long size, FileTime lastModified, Object fileKey) {

    static final FileStamp ABSENT = new FileStamp(false, 0, FileTime.fromMillis(0), null);

    static FileStamp of(Path path) throws IOException {
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            return new FileStamp(true, attrs.size(), attrs.lastModifiedTime(), attrs.fileKey());
        } catch (NoSuchFileException e) {
            return ABSENT;
        }
    }

    /** Same version, as far as the file system can tell. */
    boolean matches(FileStamp other) {
        return other != null
                && exists == other.exists
                && size == other.size
                && lastModified.equals(other.lastModified)
                && Objects.equals(fileKey, other.fileKey);
    }
}
