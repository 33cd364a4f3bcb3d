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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Bounded chain of previous document versions.
 * <p>
 * Backups live next to the document as {@code <name>.bak.<NNNNNN>}, where the
 * suffix is a sequence number one above the highest existing one. At most
 * {@code retention} backups are kept; the oldest go first.
 * <pre>
 * data/
 *  ├─ todo.json              // current document
 *  ├─ todo.json.lock         // cross-process lock file
 *  ├─ todo.json.bak.000007   // oldest kept
 *  ├─ todo.json.bak.000008
 *  └─ todo.json.bak.000009   // state before the last save
 * </pre>
 */
public final class BackupChain {

    private static final Logger LOG = LoggerFactory.getLogger(BackupChain.class);

    private static final String INFIX = ".bak.";

    private final Path target;
    private final int retention;
    private final SafeReader reader;
    private final boolean posixPermissions;
    private final boolean syncEnabled;

    /**
     * @param target           the document being backed up
     * @param retention        maximum number of backups kept, at least 1
     * @param reader           reads the current document (symlink and size checks apply)
     * @param posixPermissions create backups with an owner-only POSIX mode
     * @param syncEnabled      fsync each backup
     */
    public BackupChain(Path target, int retention, SafeReader reader, boolean posixPermissions, boolean syncEnabled) {
        if (retention < 1) {
            throw new IllegalArgumentException("retention must be >= 1: " + retention);
        }
        this.target = target;
        this.retention = retention;
        this.reader = reader;
        this.posixPermissions = posixPermissions;
        this.syncEnabled = syncEnabled;
    }

    /**
     * Copies the current document into the chain and rotates out the excess.
     *
     * @return the new backup, or empty if there is no document yet
     * @throws BackupFailureException if the copy could not be made
     */
    public Optional<Path> snapshot(LockHandle lock) {
        Path backup = null;
        try {
            Optional<byte[]> current = reader.read(lock, target);
            if (current.isEmpty()) {
                LOG.trace("No document at {}, nothing to back up", target);
                return Optional.empty();
            }

            Path next = pathFor(highestSequence() + 1);
            try (FileChannel ch = OwnerOnlyFiles.createNew(next, posixPermissions)) {
                backup = next;
                ByteBuffer buf = ByteBuffer.wrap(current.get());
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                if (syncEnabled) {
                    ch.force(true);
                }
            }
            LOG.debug("Backed up {} to {} ({} bytes)", target, backup, current.get().length);
        } catch (IOException | StorageException e) {
            deletePartial(backup);
            throw new BackupFailureException(target, "Failed to back up " + target + ": " + e.getMessage(), e);
        }

        rotate();
        return Optional.of(backup);
    }

    /**
     * Lists backups, oldest first.
     */
    public List<Path> list() throws IOException {
        Path dir = directory();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<Path> backups = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir,
                p -> sequenceOf(p) >= 0 && Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS))) {
            for (Path p : stream) {
                backups.add(p);
            }
        }
        backups.sort(Comparator.comparingLong(this::sequenceOf));
        return backups;
    }

    /**
     * The most recent backup, if any. Listing errors are logged and reported as none.
     */
    public Optional<Path> latest() {
        try {
            List<Path> backups = list();
            return backups.isEmpty() ? Optional.empty() : Optional.of(backups.get(backups.size() - 1));
        } catch (IOException e) {
            LOG.warn("Could not list backups of {}: {}", target, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Sequence number encoded in a backup file name, or -1 if {@code p} is not a backup of this document.
     */
    long sequenceOf(Path p) {
        String name = p.getFileName().toString();
        String prefix = target.getFileName() + INFIX;
        if (!name.startsWith(prefix) || name.length() == prefix.length()) {
            return -1;
        }
        String digits = name.substring(prefix.length());
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) {
                return -1;
            }
        }
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private Path pathFor(long sequence) {
        return target.resolveSibling(String.format("%s%s%06d", target.getFileName(), INFIX, sequence));
    }

    private long highestSequence() throws IOException {
        long highest = 0;
        for (Path p : list()) {
            highest = Math.max(highest, sequenceOf(p));
        }
        return highest;
    }

    private void rotate() {
        try {
            List<Path> backups = list();
            int excess = backups.size() - retention;
            for (int i = 0; i < excess; i++) {
                Files.deleteIfExists(backups.get(i));
                LOG.debug("Rotated out backup {}", backups.get(i));
            }
        } catch (IOException e) {
            LOG.warn("Backup rotation for {} failed: {}", target, e.getMessage());
        }
    }

    private void deletePartial(Path backup) {
        if (backup == null) {
            return;
        }
        try {
            Files.deleteIfExists(backup);
        } catch (IOException e) {
            LOG.warn("Could not remove partial backup {}: {}", backup, e.getMessage());
        }
    }

    private Path directory() {
        Path parent = target.toAbsolutePath().getParent();
        return parent != null ? parent : target.toAbsolutePath();
    }
}
