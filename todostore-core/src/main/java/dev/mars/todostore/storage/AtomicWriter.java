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

import dev.mars.todostore.lock.Directories;
import dev.mars.todostore.lock.LockHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Replaces a document so that readers see either the old or the new bytes, never a mix.
 * <p>
 * Write protocol:
 * <ol>
 *   <li>reject payloads over the size limit</li>
 *   <li>create missing parent directories</li>
 *   <li>optionally back up the current document (failure is logged, not fatal)</li>
 *   <li>write the payload to an owner-only temp file in the same directory</li>
 *   <li>fsync the temp file</li>
 *   <li>rename it over the target ({@code ATOMIC_MOVE})</li>
 *   <li>fsync the directory so the rename is durable</li>
 * </ol>
 * If anything before the rename fails, the target is untouched and the temp file is removed.
 */
public final class AtomicWriter {

    private static final Logger LOG = LoggerFactory.getLogger(AtomicWriter.class);

    private static final String TMP_SUFFIX = ".tmp";

    /**
     * Fault injection point between the temp file being durable and the rename.
     */
    @FunctionalInterface
    interface WriteHook {
        WriteHook NONE = tmp -> { };

        void beforeRename(Path tmp) throws IOException;
    }

    /**
     * Result of a successful write.
     *
     * @param target        the replaced document
     * @param bytes         payload size
     * @param backup        backup made before the replace, if any
     * @param backupFailure why the backup was skipped, if it failed
     */
    public record WriteOutcome(
            Path target,
            int bytes,
            Optional<Path> backup,
            Optional<BackupFailureException> backupFailure
    ) {
    }

    private final long maxBytes;
    private final boolean posixPermissions;
    private final boolean syncEnabled;
    private final boolean windows;
    private final WriteHook hook;

    public AtomicWriter(long maxBytes, boolean posixPermissions, boolean syncEnabled, boolean windows) {
        this(maxBytes, posixPermissions, syncEnabled, windows, WriteHook.NONE);
    }

    AtomicWriter(long maxBytes, boolean posixPermissions, boolean syncEnabled, boolean windows, WriteHook hook) {
        this.maxBytes = maxBytes;
        this.posixPermissions = posixPermissions;
        this.syncEnabled = syncEnabled;
        this.windows = windows;
        this.hook = Objects.requireNonNull(hook, "hook");
    }

    /**
     * Writes without a backup.
     */
    public WriteOutcome write(LockHandle lock, Path target, byte[] payload) throws IOException {
        return write(lock, target, payload, null);
    }

    /**
     * Atomically replaces {@code target} with {@code payload}.
     *
     * @param backups chain to snapshot the current document into first, or {@code null} for none
     * @throws SizeLimitExceededException if the payload is larger than the limit
     * @throws IllegalStateException      if {@code lock} is no longer held
     * @throws IOException                if the document could not be replaced
     */
    public WriteOutcome write(LockHandle lock, Path target, byte[] payload, BackupChain backups) throws IOException {
        if (!lock.isValid()) {
            throw new IllegalStateException("Writing " + target + " requires a held lock, got " + lock);
        }
        if (payload.length > maxBytes) {
            LOG.error("Refusing to write {} bytes to {}: limit is {}", payload.length, target, maxBytes);
            throw new SizeLimitExceededException(target, maxBytes, payload.length);
        }

        Directories.ensureParent(target);
        Path dir = target.toAbsolutePath().getParent();

        Optional<Path> backup = Optional.empty();
        Optional<BackupFailureException> backupFailure = Optional.empty();
        if (backups != null) {
            try {
                backup = backups.snapshot(lock);
            } catch (BackupFailureException e) {
                LOG.warn("Continuing without backup: {}", e.getMessage());
                backupFailure = Optional.of(e);
            }
        }

        Path tmp = OwnerOnlyFiles.createTempFile(dir, "." + target.getFileName() + ".", TMP_SUFFIX, posixPermissions);
        try {
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buf = ByteBuffer.wrap(payload);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                if (syncEnabled) {
                    ch.force(true);
                    LOG.trace("Synced temp file {}", tmp);
                }
            }

            hook.beforeRename(tmp);

            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            LOG.trace("Atomic rename: {} -> {}", tmp, target);
        } catch (IOException | RuntimeException e) {
            discard(tmp);
            throw e;
        }

        if (syncEnabled) {
            syncDirectory(dir);
        }

        LOG.debug("Wrote {} bytes to {}", payload.length, target);
        return new WriteOutcome(target, payload.length, backup, backupFailure);
    }

    private void discard(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }

    /**
     * Makes the rename durable. Not supported on Windows, where it is skipped.
     */
    private void syncDirectory(Path dir) {
        if (windows) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }
        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }
}
