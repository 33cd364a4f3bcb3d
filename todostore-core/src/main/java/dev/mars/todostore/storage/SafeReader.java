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

import dev.mars.todostore.lock.LockHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;
import java.util.Set;

/**
 * Reads a whole document without following symlinks and without trusting a
 * prior size check.
 * <p>
 * The file is opened with {@link LinkOption#NOFOLLOW_LINKS}; a symlink is
 * rejected rather than dereferenced. Reading stops once one byte more than the
 * cap has arrived, and the size decision is made on the bytes actually read,
 * so a file that grows after any stat is still caught.
 */
public final class SafeReader {

    private static final Logger LOG = LoggerFactory.getLogger(SafeReader.class);

    private static final int CHUNK_SIZE = 64 * 1024;

    /** Largest cap a reader accepts; the document is returned as one array. */
    public static final long MAX_SUPPORTED_BYTES = Integer.MAX_VALUE - 8;

    private final long maxBytes;

    /**
     * @param maxBytes the largest accepted document, in bytes
     */
    public SafeReader(long maxBytes) {
        if (maxBytes < 0 || maxBytes > MAX_SUPPORTED_BYTES) {
            throw new IllegalArgumentException("maxBytes must be between 0 and " + MAX_SUPPORTED_BYTES + ": " + maxBytes);
        }
        this.maxBytes = maxBytes;
    }

    public long maxBytes() {
        return maxBytes;
    }

    /**
     * Reads {@code path} while {@code lock} is held.
     *
     * @return the bytes, or empty if the file does not exist
     * @throws SymlinkRejectedException    if {@code path} is a symlink
     * @throws SizeLimitExceededException  if more than {@link #maxBytes()} bytes were read
     * @throws IllegalStateException       if {@code lock} is no longer held
     * @throws IOException                 on any other I/O failure
     */
    public Optional<byte[]> read(LockHandle lock, Path path) throws IOException {
        if (!lock.isValid()) {
            throw new IllegalStateException("Reading " + path + " requires a held lock, got " + lock);
        }

        SeekableByteChannel channel;
        try {
            channel = Files.newByteChannel(path, Set.<OpenOption>of(StandardOpenOption.READ, LinkOption.NOFOLLOW_LINKS));
        } catch (NoSuchFileException e) {
            LOG.debug("No document at {}, treating as empty", path);
            return Optional.empty();
        } catch (IOException e) {
            // O_NOFOLLOW on a link fails with ELOOP, reported as a plain IOException on some JDKs
            if (Files.isSymbolicLink(path)) {
                LOG.error("Refusing to follow symlink at {}", path);
                throw new SymlinkRejectedException(path);
            }
            throw e;
        }

        try (channel) {
            rejectIfLink(path);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ByteBuffer buf = ByteBuffer.allocate(CHUNK_SIZE);
            long total = 0;
            while (true) {
                long remaining = maxBytes - total;
                buf.clear();
                buf.limit(remaining >= CHUNK_SIZE ? CHUNK_SIZE : (int) remaining + 1);
                int n = channel.read(buf);
                if (n < 0) {
                    break;
                }
                total += n;
                if (total > maxBytes) {
                    LOG.error("Document {} exceeds {} byte limit", path, maxBytes);
                    throw new SizeLimitExceededException(path, maxBytes, total);
                }
                out.write(buf.array(), 0, n);
            }
            LOG.trace("Read {} bytes from {}", total, path);
            return Optional.of(out.toByteArray());
        }
    }

    /**
     * Where the platform opens the link itself instead of failing, refuse it here.
     */
    private static void rejectIfLink(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        if (attrs.isSymbolicLink()) {
            LOG.error("Refusing to follow symlink at {}", path);
            throw new SymlinkRejectedException(path);
        }
    }
}
