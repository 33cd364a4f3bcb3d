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

import dev.mars.todostore.lock.CompatMutex;
import dev.mars.todostore.lock.Directories;
import dev.mars.todostore.lock.LockHandle;
import dev.mars.todostore.lock.LockStats;
import dev.mars.todostore.lock.PlatformCapabilities;
import dev.mars.todostore.lock.PlatformLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Single-file JSON implementation of {@link TodoStore}.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data/
 *  ├─ todo.json              // JSON array of records (atomic replace)
 *  ├─ todo.json.lock         // cross-process lock, never renamed
 *  └─ todo.json.bak.NNNNNN   // bounded backup chain
 * </pre>
 * <p>
 * <b>Locking:</b> each operation first takes the in-process {@link CompatMutex},
 * then the {@link PlatformLock} on the sidecar lock file, and holds both until
 * the cycle is complete. The lock is on a sidecar because every save replaces
 * the document's inode.
 * <p>
 * <b>Cache:</b> the last loaded or saved list is kept with the {@link FileStamp}
 * it was read at. {@link #load()} serves it while the stamp is unchanged;
 * mutations always re-read from disk. The cache and dirty flag have their own
 * monitor, so reading them never waits on file I/O.
 * <p>
 * <b>Async:</b> async operations queue on the mutex's scheduler and run their
 * file I/O on a dedicated daemon thread, never on the scheduler thread.
 */
public final class FileTodoStore implements TodoStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileTodoStore.class);

    private static final Duration CLOSE_GRACE = Duration.ofSeconds(5);

    private final TodoStoreConfig config;
    private final Path dbPath;
    private final Path lockPath;
    private final Duration lockTimeout;

    private final CompatMutex mutex;
    private final PlatformLock platformLock;
    private final DocumentCodec codec = new DocumentCodec();
    private final SafeReader reader;
    private final AtomicWriter writer;
    private final BackupChain backups;

    /** File I/O for async operations. */
    private final ExecutorService ioExecutor;

    private final Object cacheGuard = new Object();
    private List<Todo> cached;                              // guarded by cacheGuard
    private FileStamp cachedStamp;                          // guarded by cacheGuard
    private boolean dirty;                                  // guarded by cacheGuard
    private BackupFailureException lastBackupFailure;       // guarded by cacheGuard

    private volatile boolean closed;

    /**
     * Creates a store with configuration loaded from system properties,
     * environment variables, properties file, or defaults.
     *
     * @see TodoStoreConfig
     */
    public FileTodoStore() {
        this(TodoStoreConfig.load());
    }

    /**
     * Creates a store, probing the platform for native locking.
     *
     * @throws dev.mars.todostore.lock.LockUnavailableException if native locking is missing
     *         and the insecure fallback is not allowed
     * @throws StorageException if the data directory cannot be prepared
     */
    public FileTodoStore(TodoStoreConfig config) {
        this(config, detect(config));
    }

    /**
     * Creates a store for an already detected platform.
     */
    public FileTodoStore(TodoStoreConfig config, PlatformCapabilities capabilities) {
        this(config, capabilities, AtomicWriter.WriteHook.NONE);
    }

    FileTodoStore(TodoStoreConfig config, PlatformCapabilities capabilities, AtomicWriter.WriteHook hook) {
        this.config = config;
        this.dbPath = config.dbPath().toAbsolutePath();
        this.lockPath = config.lockPath().toAbsolutePath();
        this.lockTimeout = config.lockTimeout();

        this.platformLock = PlatformLock.create(capabilities);
        this.reader = new SafeReader(config.maxDocumentSizeBytes());
        this.writer = new AtomicWriter(config.maxDocumentSizeBytes(), capabilities.posixPermissions(),
                config.syncEnabled(), capabilities.osFamily() == PlatformCapabilities.OsFamily.WINDOWS, hook);
        this.backups = new BackupChain(dbPath, config.backupCount(), reader,
                capabilities.posixPermissions(), config.syncEnabled());
        this.mutex = new CompatMutex("todostore[" + dbPath.getFileName() + "]");
        this.ioExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "todostore-io");
            t.setDaemon(true);
            return t;
        });

        LOG.info("FileTodoStore opened: path={}, lockMode={}, backups={}, maxSize={} bytes",
                dbPath, platformLock.mode(), config.backupEnabled() ? config.backupCount() : "off",
                config.maxDocumentSizeBytes());
        if (!config.syncEnabled()) {
            LOG.warn("FileTodoStore created with fsync DISABLED. Do NOT use in production!");
        }
    }

    private static PlatformCapabilities detect(TodoStoreConfig config) {
        Path lock = config.lockPath().toAbsolutePath();
        try {
            Directories.ensureParent(lock);
            return PlatformCapabilities.detect(lock.getParent(), config.strictLocking(), config.allowInsecureLocking());
        } catch (IOException e) {
            LOG.error("Cannot prepare data directory for {}: {}", config.dbPath(), e.getMessage());
            throw StorageException.wrap("Cannot prepare data directory for " + config.dbPath(), e);
        }
    }

    public TodoStoreConfig config() {
        return config;
    }

    public Path path() {
        return dbPath;
    }

    public PlatformLock.Mode lockMode() {
        return platformLock.mode();
    }

    // ========================================================================
    // Whole document
    // ========================================================================

    @Override
    public List<Todo> load() {
        return locked("load", Cycle::readCached);
    }

    @Override
    public void save(List<Todo> todos) {
        save(todos, config.backupEnabled());
    }

    @Override
    public void save(List<Todo> todos, boolean backup) {
        List<Todo> snapshot = List.copyOf(todos);
        locked("save", cycle -> {
            cycle.write(snapshot, backup);
            return null;
        });
    }

    // ========================================================================
    // Records
    // ========================================================================

    @Override
    public Optional<Todo> get(int id) {
        return load().stream().filter(t -> t.id() == id).findFirst();
    }

    @Override
    public Todo add(String text) {
        return add(text, null);
    }

    @Override
    public Todo add(String text, String dueDate) {
        return mutate("add", appending(text, dueDate));
    }

    @Override
    public Todo update(int id, UnaryOperator<Todo> change) {
        return mutate("update", replacing(id, change));
    }

    @Override
    public Todo markDone(int id) {
        return update(id, Todo::markDone);
    }

    @Override
    public Todo rename(int id, String text) {
        return update(id, t -> t.rename(text));
    }

    @Override
    public Todo delete(int id) {
        return mutate("delete", removing(id));
    }

    // ========================================================================
    // Backups
    // ========================================================================

    @Override
    public Optional<Path> backup() {
        return locked("backup", cycle -> backups.snapshot(cycle.lock));
    }

    @Override
    public List<Path> listBackups() {
        return locked("listBackups", cycle -> backups.list());
    }

    @Override
    public List<Todo> restore(Path backup) {
        Path source = backup.toAbsolutePath();
        return locked("restore", cycle -> {
            byte[] bytes = reader.read(cycle.lock, source)
                    .orElseThrow(() -> new StorageException("Backup " + source + " does not exist"));
            List<Todo> restored = codec.decode(bytes, source);
            cycle.write(restored, true);
            LOG.info("Restored {} todos from {}", restored.size(), source);
            return Collections.unmodifiableList(restored);
        });
    }

    @Override
    public Optional<BackupFailureException> lastBackupFailure() {
        synchronized (cacheGuard) {
            return Optional.ofNullable(lastBackupFailure);
        }
    }

    // ========================================================================
    // Async
    // ========================================================================

    @Override
    public CompletableFuture<List<Todo>> loadAsync() {
        return lockedAsync("load", Cycle::readCached);
    }

    @Override
    public CompletableFuture<Void> saveAsync(List<Todo> todos) {
        List<Todo> snapshot = List.copyOf(todos);
        boolean backup = config.backupEnabled();
        return lockedAsync("save", cycle -> {
            cycle.write(snapshot, backup);
            return null;
        });
    }

    @Override
    public CompletableFuture<Todo> addAsync(String text) {
        return lockedAsync("add", cycle -> cycle.apply(appending(text, null)));
    }

    @Override
    public CompletableFuture<Todo> updateAsync(int id, UnaryOperator<Todo> change) {
        return lockedAsync("update", cycle -> cycle.apply(replacing(id, change)));
    }

    @Override
    public CompletableFuture<Todo> deleteAsync(int id) {
        return lockedAsync("delete", cycle -> cycle.apply(removing(id)));
    }

    // ========================================================================
    // Introspection
    // ========================================================================

    @Override
    public LockStats lockStats() {
        return mutex.stats();
    }

    @Override
    public boolean isDirty() {
        synchronized (cacheGuard) {
            return dirty;
        }
    }

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Store already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        LOG.info("Closing FileTodoStore at: {}", dbPath);

        ioExecutor.shutdown();
        try {
            if (!ioExecutor.awaitTermination(CLOSE_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("I/O still running after {}; abandoning it", CLOSE_GRACE);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for pending I/O on {}", dbPath);
        }
        mutex.close();
        LOG.info("FileTodoStore closed");
    }

    // ========================================================================
    // Mutations
    // ========================================================================

    /**
     * Outcome of a change: the list to persist and the value returned to the caller.
     */
    private record Mutation<T>(List<Todo> next, T result) {
    }

    private static Function<List<Todo>, Mutation<Todo>> appending(String text, String dueDate) {
        return current -> {
            Todo todo = Todo.create(IdAllocator.nextId(current), text);
            if (dueDate != null) {
                todo = todo.withDueDate(dueDate);
            }
            List<Todo> next = new ArrayList<>(current);
            next.add(todo);
            return new Mutation<>(next, todo);
        };
    }

    private static Function<List<Todo>, Mutation<Todo>> replacing(int id, UnaryOperator<Todo> change) {
        return current -> {
            List<Todo> next = new ArrayList<>(current);
            int index = indexOf(next, id);
            Todo updated = change.apply(next.get(index));
            if (updated == null || updated.id() != id) {
                throw new IllegalArgumentException("Update of todo #" + id + " must keep its id, got " + updated);
            }
            next.set(index, updated);
            return new Mutation<>(next, updated);
        };
    }

    private static Function<List<Todo>, Mutation<Todo>> removing(int id) {
        return current -> {
            List<Todo> next = new ArrayList<>(current);
            Todo removed = next.remove(indexOf(next, id));
            return new Mutation<>(next, removed);
        };
    }

    private static int indexOf(List<Todo> todos, int id) {
        for (int i = 0; i < todos.size(); i++) {
            if (todos.get(i).id() == id) {
                return i;
            }
        }
        throw new TodoNotFoundException(id);
    }

    private <T> T mutate(String operation, Function<List<Todo>, Mutation<T>> change) {
        return locked(operation, cycle -> cycle.apply(change));
    }

    // ========================================================================
    // Lock cycles
    // ========================================================================

    @FunctionalInterface
    private interface CycleBody<T> {
        T run(Cycle cycle) throws IOException;
    }

    /**
     * Runs {@code body} holding the mutex (blocking domain) and the file lock.
     */
    private <T> T locked(String operation, CycleBody<T> body) {
        ensureOpen();
        CompatMutex.Permit permit;
        try {
            permit = mutex.acquire(lockTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted waiting to " + operation + " " + dbPath, e);
        }
        try (permit) {
            return underFileLock(operation, body);
        }
    }

    /**
     * Runs {@code body} after an async mutex grant, on the I/O thread.
     * The permit is released when the I/O completes, however it completes.
     */
    private <T> CompletableFuture<T> lockedAsync(String operation, CycleBody<T> body) {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Store " + dbPath + " is closed"));
        }
        return mutex.acquireAsync(lockTimeout).thenCompose(permit -> {
            CompletableFuture<T> io;
            try {
                io = CompletableFuture.supplyAsync(() -> underFileLock(operation, body), ioExecutor);
            } catch (RejectedExecutionException e) {
                permit.close();
                return CompletableFuture.failedFuture(new IllegalStateException("Store " + dbPath + " is closed", e));
            }
            return io.whenComplete((result, error) -> permit.close());
        });
    }

    private <T> T underFileLock(String operation, CycleBody<T> body) {
        LOG.debug("{} on {}", operation, dbPath);
        try (LockHandle lock = platformLock.acquire(lockPath, lockTimeout)) {
            return body.run(new Cycle(lock));
        } catch (IOException e) {
            LOG.error("Failed to {} {}: {}", operation, dbPath, e.getMessage());
            throw StorageException.wrap("Failed to " + operation + " " + dbPath, e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Store " + dbPath + " is closed");
        }
    }

    /**
     * File access for one locked cycle.
     */
    private final class Cycle {

        private final LockHandle lock;

        Cycle(LockHandle lock) {
            this.lock = lock;
        }

        /** The current list, from the cache if the file has not changed since it was filled. */
        List<Todo> readCached() throws IOException {
            if (config.cacheEnabled()) {
                FileStamp stamp = FileStamp.of(dbPath);
                synchronized (cacheGuard) {
                    if (!dirty && cached != null && stamp.matches(cachedStamp)) {
                        LOG.trace("Cache hit for {}", dbPath);
                        return cached;
                    }
                }
            }
            return readFresh();
        }

        /** The current list, read and validated from disk. */
        List<Todo> readFresh() throws IOException {
            FileStamp stamp = FileStamp.of(dbPath);
            Optional<byte[]> bytes = reader.read(lock, dbPath);
            List<Todo> todos;
            if (bytes.isEmpty()) {
                todos = List.of();
            } else {
                try {
                    todos = Collections.unmodifiableList(codec.decode(bytes.get(), dbPath));
                } catch (CorruptionException e) {
                    CorruptionException withBackup = e.withLatestBackup(backups.latest());
                    LOG.error("{}", withBackup.getMessage());
                    throw withBackup;
                }
            }
            commit(todos, stamp);
            return todos;
        }

        <T> T apply(Function<List<Todo>, Mutation<T>> change) throws IOException {
            Mutation<T> mutation = change.apply(readFresh());
            write(mutation.next(), config.backupEnabled());
            return mutation.result();
        }

        void write(List<Todo> todos, boolean backup) throws IOException {
            byte[] payload = codec.encode(todos);
            synchronized (cacheGuard) {
                dirty = true;
            }
            AtomicWriter.WriteOutcome outcome = writer.write(lock, dbPath, payload, backup ? backups : null);
            synchronized (cacheGuard) {
                if (outcome.backupFailure().isPresent()) {
                    lastBackupFailure = outcome.backupFailure().get();
                } else if (outcome.backup().isPresent()) {
                    lastBackupFailure = null;
                }
            }
            commit(Collections.unmodifiableList(new ArrayList<>(todos)), FileStamp.of(dbPath));
            LOG.debug("Saved {} todos ({} bytes) to {}", todos.size(), outcome.bytes(), dbPath);
        }

        private void commit(List<Todo> todos, FileStamp stamp) {
            synchronized (cacheGuard) {
                cached = todos;
                cachedStamp = stamp;
                dirty = false;
            }
        }
    }
}
