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

import dev.mars.todostore.lock.LockStats;
import dev.mars.todostore.lock.LockTimeoutException;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * Persistent task list shared by threads, cooperative tasks and other processes.
 * <p>
 * Every operation that changes the list runs as one load-modify-save cycle
 * under both the in-process mutex and the cross-process file lock, so two
 * callers can never compute a change from the same snapshot.
 * <p>
 * <b>Errors:</b> all failures are unchecked. {@link LockTimeoutException}
 * means the caller never owned the lock; {@link CorruptionException} leaves
 * the file untouched; a failed save never leaves a partially written file.
 * Async variants complete exceptionally with the same types.
 *
 * @see FileTodoStore
 */
public interface TodoStore extends Closeable {

    // ========================================================================
    // Whole document
    // ========================================================================

    /**
     * Reads the current list. A missing file reads as an empty list.
     *
     * @return an unmodifiable snapshot
     */
    List<Todo> load();

    /**
     * Replaces the list, backing up the previous version if backups are enabled.
     *
     * @throws IllegalArgumentException if two records share an id
     */
    void save(List<Todo> todos);

    /**
     * Replaces the list.
     *
     * @param backup whether to copy the previous version into the backup chain first
     */
    void save(List<Todo> todos, boolean backup);

    // ========================================================================
    // Records
    // ========================================================================

    Optional<Todo> get(int id);

    /**
     * Appends a new open record under the smallest unused id.
     *
     * @throws IllegalArgumentException if {@code text} is blank
     */
    Todo add(String text);

    /**
     * @param dueDate {@code YYYY-MM-DD}, or null for none
     */
    Todo add(String text, String dueDate);

    /**
     * Replaces record {@code id} with {@code change.apply(current)}.
     *
     * @return the stored record
     * @throws TodoNotFoundException    if there is no such record
     * @throws IllegalArgumentException if {@code change} alters the id
     */
    Todo update(int id, UnaryOperator<Todo> change);

    Todo markDone(int id);

    Todo rename(int id, String text);

    /**
     * Removes record {@code id}. Its id becomes available for reuse.
     *
     * @return the removed record
     * @throws TodoNotFoundException if there is no such record
     */
    Todo delete(int id);

    // ========================================================================
    // Backups
    // ========================================================================

    /**
     * Copies the current file into the backup chain.
     *
     * @return the new backup, or empty if nothing has been saved yet
     * @throws BackupFailureException if the copy failed
     */
    Optional<Path> backup();

    /** Backups, oldest first. */
    List<Path> listBackups();

    /**
     * Replaces the list with the content of {@code backup}, backing up the current file first.
     *
     * @return the restored list
     * @throws CorruptionException if {@code backup} is not a valid document
     */
    List<Todo> restore(Path backup);

    /**
     * The most recent backup failure of a save, cleared by the next successful backup.
     */
    Optional<BackupFailureException> lastBackupFailure();

    // ========================================================================
    // Async
    // ========================================================================

    CompletableFuture<List<Todo>> loadAsync();

    CompletableFuture<Void> saveAsync(List<Todo> todos);

    CompletableFuture<Todo> addAsync(String text);

    CompletableFuture<Todo> updateAsync(int id, UnaryOperator<Todo> change);

    CompletableFuture<Todo> deleteAsync(int id);

    // ========================================================================
    // Introspection
    // ========================================================================

    /** Contention statistics of the in-process mutex. */
    LockStats lockStats();

    /**
     * Whether the in-memory copy is known not to match the file,
     * because a save is in flight or the last one failed.
     */
    boolean isDirty();

    /**
     * Releases all resources. Operations after close fail with {@link IllegalStateException}.
     */
    @Override
    void close();
}
