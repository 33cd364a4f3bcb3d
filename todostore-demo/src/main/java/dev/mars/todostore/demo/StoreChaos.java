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
package dev.mars.todostore.demo;

import dev.mars.todostore.lock.LockStats;
import dev.mars.todostore.storage.CorruptionException;
import dev.mars.todostore.storage.FileTodoStore;
import dev.mars.todostore.storage.SizeLimitExceededException;
import dev.mars.todostore.storage.SymlinkRejectedException;
import dev.mars.todostore.storage.Todo;
import dev.mars.todostore.storage.TodoStoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Chaos testing for the todo store.
 * <p>
 * Throws the scenarios the store must survive at a real file system:
 * <ul>
 *   <li>Thread storms adding and updating concurrently</li>
 *   <li>Threads and async tasks mixed on one store</li>
 *   <li>Several store instances on one file</li>
 *   <li>Child JVMs racing {@code add()} on one file</li>
 *   <li>Corrupt, oversized and symlinked documents</li>
 *   <li>Backup rotation and restore</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build
 * mvn package -pl todostore-demo -am
 *
 * # Run all chaos tests
 * java -cp "todostore-demo/target/*" dev.mars.todostore.demo.StoreChaos
 *
 * # Run one group
 * java -cp "todostore-demo/target/*" dev.mars.todostore.demo.StoreChaos concurrent
 * java -cp "todostore-demo/target/*" dev.mars.todostore.demo.StoreChaos process
 * java -cp "todostore-demo/target/*" dev.mars.todostore.demo.StoreChaos corruption
 * java -cp "todostore-demo/target/*" dev.mars.todostore.demo.StoreChaos backup
 * </pre>
 * The {@code worker} argument is used internally for the child processes.
 *
 * @see FileTodoStore
 */
public class StoreChaos {

    private static final Logger LOG = LoggerFactory.getLogger(StoreChaos.class);

    private static final String WORKER = "worker";

    private final Path baseDir;
    private final AtomicInteger testsPassed = new AtomicInteger(0);
    private final AtomicInteger testsFailed = new AtomicInteger(0);

    public StoreChaos(Path baseDir) {
        this.baseDir = baseDir;
    }

    public static void main(String[] args) throws Exception {
        if (args.length > 0 && WORKER.equals(args[0])) {
            runWorker(Path.of(args[1]), Integer.parseInt(args[2]));
            return;
        }

        System.out.println("+---------------------------------------------------------------+");
        System.out.println("|                TODO STORE CHAOS SUITE                         |");
        System.out.println("+---------------------------------------------------------------+");
        System.out.println();

        Path chaosDir = Files.createTempDirectory("todostore-chaos-");
        System.out.println("Chaos directory: " + chaosDir.toAbsolutePath());

        StoreChaos chaos = new StoreChaos(chaosDir);
        String testFilter = args.length > 0 ? args[0].toLowerCase() : "all";

        try {
            switch (testFilter) {
                case "concurrent" -> chaos.runConcurrencyTests();
                case "process" -> chaos.runProcessTests();
                case "corruption" -> chaos.runCorruptionTests();
                case "backup" -> chaos.runBackupTests();
                case "all" -> {
                    chaos.runConcurrencyTests();
                    chaos.runProcessTests();
                    chaos.runCorruptionTests();
                    chaos.runBackupTests();
                }
                default -> {
                    System.err.println("Unknown test filter: " + testFilter);
                    System.err.println("Available: concurrent, process, corruption, backup, all");
                    System.exit(1);
                }
            }
        } finally {
            System.out.println();
            System.out.println("+---------------------------------------------------------------+");
            System.out.printf("|  RESULTS: %d passed, %d failed%n", chaos.testsPassed.get(), chaos.testsFailed.get());
            System.out.println("+---------------------------------------------------------------+");
            deleteRecursively(chaosDir);
        }

        System.exit(chaos.testsFailed.get() > 0 ? 1 : 0);
    }

    // =========================================================================
    // CONCURRENCY CHAOS
    // =========================================================================

    private void runConcurrencyTests() {
        printSection("CONCURRENCY CHAOS");

        chaosTest("Add storm (50 threads x 20 adds)", this::addStorm);
        chaosTest("Counter increments lose no update (20 threads)", this::noLostUpdates);
        chaosTest("Threads and async tasks on one store", this::mixedDomains);
        chaosTest("Four store instances on one file", this::sharedFileInstances);
    }

    private void addStorm() throws Exception {
        int threads = 50;
        int perThread = 20;
        try (FileTodoStore store = newStore("add-storm")) {
            List<Todo> added = hammer(threads, perThread, (t, i) -> store.add("t" + t + "-" + i));
            verifyIds(store.load(), threads * perThread);
            if (added.size() != threads * perThread) {
                throw new AssertionError("Expected " + threads * perThread + " adds, got " + added.size());
            }
        }
    }

    private void noLostUpdates() throws Exception {
        int threads = 20;
        int perThread = 25;
        try (FileTodoStore store = newStore("counter")) {
            int id = store.add("0").id();
            hammer(threads, perThread, (t, i) ->
                    store.update(id, todo -> todo.rename(String.valueOf(Integer.parseInt(todo.text()) + 1))));
            String value = store.get(id).orElseThrow().text();
            if (Integer.parseInt(value) != threads * perThread) {
                throw new AssertionError("Lost updates: counter is " + value + ", expected " + threads * perThread);
            }
        }
    }

    private void mixedDomains() throws Exception {
        try (FileTodoStore store = newStore("mixed")) {
            List<CompletableFuture<Todo>> tasks = IntStream.range(0, 200)
                    .mapToObj(i -> store.addAsync("task-" + i))
                    .collect(Collectors.toList());
            hammer(10, 20, (t, i) -> store.add("thread-" + t + "-" + i));
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).get(60, TimeUnit.SECONDS);
            verifyIds(store.load(), 400);
        }
    }

    private void sharedFileInstances() throws Exception {
        Path db = createTestDir("instances").resolve("todo.json");
        List<FileTodoStore> stores = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                stores.add(new FileTodoStore(config(db)));
            }
            hammer(stores.size(), 50, (t, i) -> stores.get(t).add("store-" + t + "-" + i));
            verifyIds(stores.get(0).load(), 200);
        } finally {
            stores.forEach(FileTodoStore::close);
        }
    }

    // =========================================================================
    // MULTI-PROCESS CHAOS
    // =========================================================================

    private void runProcessTests() {
        printSection("MULTI-PROCESS CHAOS");

        chaosTest("Child JVMs racing add() (4 processes x 25 adds)", this::processRace);
    }

    private void processRace() throws Exception {
        int processes = 4;
        int perProcess = 25;
        Path db = createTestDir("processes").resolve("todo.json");
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        String classpath = System.getProperty("java.class.path");

        List<Process> children = new ArrayList<>();
        for (int p = 0; p < processes; p++) {
            children.add(new ProcessBuilder(java, "-cp", classpath, StoreChaos.class.getName(),
                    WORKER, db.toString(), String.valueOf(perProcess))
                    .redirectErrorStream(true)
                    .start());
        }

        Set<Integer> reported = new HashSet<>();
        for (Process child : children) {
            try (BufferedReader out = new BufferedReader(
                    new InputStreamReader(child.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = out.readLine()) != null) {
                    if (line.startsWith("id=") && !reported.add(Integer.parseInt(line.substring(3)))) {
                        throw new AssertionError("Two processes were handed id " + line.substring(3));
                    }
                }
            }
            if (!child.waitFor(120, TimeUnit.SECONDS)) {
                child.destroyForcibly();
                throw new AssertionError("Worker " + child.pid() + " did not finish");
            }
            if (child.exitValue() != 0) {
                throw new AssertionError("Worker " + child.pid() + " exited with " + child.exitValue());
            }
        }

        try (FileTodoStore store = new FileTodoStore(config(db))) {
            verifyIds(store.load(), processes * perProcess);
        }
    }

    private static void runWorker(Path db, int count) {
        try (FileTodoStore store = new FileTodoStore(config(db))) {
            for (int i = 0; i < count; i++) {
                Todo todo = store.add("pid-" + ProcessHandle.current().pid() + "-" + i);
                System.out.println("id=" + todo.id());
            }
        } catch (RuntimeException e) {
            LOG.error("Worker on {} failed", db, e);
            System.exit(2);
        }
    }

    // =========================================================================
    // CORRUPTION CHAOS
    // =========================================================================

    private void runCorruptionTests() {
        printSection("CORRUPTION CHAOS");

        chaosTest("Garbage document is reported, not overwritten", this::garbageDocument);
        chaosTest("Truncated document names the latest backup", this::truncatedDocument);
        chaosTest("Oversized document is rejected", this::oversizedDocument);
        chaosTest("Symlinked document is refused", this::symlinkedDocument);
        chaosTest("Stray temp file is ignored", this::strayTempFile);
    }

    private void garbageDocument() throws Exception {
        Path db = createTestDir("garbage").resolve("todo.json");
        byte[] garbage = {0x00, (byte) 0xFF, 0x13, 0x37, '{', '['};
        Files.write(db, garbage);
        try (FileTodoStore store = new FileTodoStore(config(db))) {
            expect(CorruptionException.class, store::load);
            expect(CorruptionException.class, () -> store.add("must not land"));
        }
        if (!Arrays.equals(garbage, Files.readAllBytes(db))) {
            throw new AssertionError("Corrupt document was modified");
        }
    }

    private void truncatedDocument() throws Exception {
        Path db = createTestDir("truncated").resolve("todo.json");
        try (FileTodoStore store = new FileTodoStore(config(db))) {
            store.add("one");
            store.add("two");
            byte[] full = Files.readAllBytes(db);
            Files.write(db, Arrays.copyOf(full, full.length / 2));

            CorruptionException e = expect(CorruptionException.class, store::load);
            if (e.latestBackup().isEmpty() || !e.getMessage().contains(e.latestBackup().get().toString())) {
                throw new AssertionError("Corruption message does not name a backup: " + e.getMessage());
            }
            List<Todo> restored = store.restore(e.latestBackup().get());
            if (restored.size() != 1 || !restored.get(0).text().equals("one")) {
                throw new AssertionError("Unexpected restore result: " + restored);
            }
        }
    }

    private void oversizedDocument() throws Exception {
        Path db = createTestDir("oversized").resolve("todo.json");
        TodoStoreConfig config = TodoStoreConfig.builder()
                .dbPath(db)
                .syncEnabled(false)
                .maxDocumentSizeBytes(1024)
                .build();
        String big = "[" + "{\"id\":1,\"text\":\"" + "x".repeat(4096) + "\"}" + "]";
        Files.writeString(db, big);
        try (FileTodoStore store = new FileTodoStore(config)) {
            expect(SizeLimitExceededException.class, store::load);
        }
    }

    private void symlinkedDocument() throws Exception {
        Path dir = createTestDir("symlink");
        Path real = dir.resolve("real.json");
        Files.writeString(real, "[]");
        Path db = dir.resolve("todo.json");
        try {
            Files.createSymbolicLink(db, real);
        } catch (UnsupportedOperationException | IOException e) {
            System.out.print("(symlinks unsupported, skipped) ");
            return;
        }
        try (FileTodoStore store = new FileTodoStore(config(db))) {
            expect(SymlinkRejectedException.class, store::load);
        }
    }

    private void strayTempFile() throws Exception {
        Path db = createTestDir("stray").resolve("todo.json");
        try (FileTodoStore store = new FileTodoStore(config(db))) {
            store.add("kept");
            Files.writeString(db.resolveSibling(".todo.json.12345.tmp"), "[{\"id\":1,\"te");
            List<Todo> todos = store.load();
            if (todos.size() != 1 || !todos.get(0).text().equals("kept")) {
                throw new AssertionError("Stray temp file leaked into the document: " + todos);
            }
        }
    }

    // =========================================================================
    // BACKUP CHAOS
    // =========================================================================

    private void runBackupTests() {
        printSection("BACKUP CHAOS");

        chaosTest("Backup chain stays bounded (20 saves, keep 3)", this::boundedChain);
        chaosTest("Lock stats count every acquisition", this::lockStatsUnderContention);
    }

    private void boundedChain() throws Exception {
        Path db = createTestDir("chain").resolve("todo.json");
        try (FileTodoStore store = new FileTodoStore(config(db))) {
            for (int i = 0; i < 20; i++) {
                store.add("save " + i);
            }
            List<Path> backups = store.listBackups();
            if (backups.size() != 3) {
                throw new AssertionError("Expected 3 backups, found " + backups);
            }
            for (int i = 0; i < backups.size(); i++) {
                int records = new String(Files.readAllBytes(backups.get(i)), StandardCharsets.UTF_8)
                        .split("\"id\"", -1).length - 1;
                if (records != 17 + i) {
                    throw new AssertionError("Backup " + backups.get(i) + " holds " + records + " records");
                }
            }
        }
    }

    private void lockStatsUnderContention() throws Exception {
        try (FileTodoStore store = newStore("stats")) {
            hammer(8, 10, (t, i) -> store.add("x"));
            LockStats stats = store.lockStats();
            if (stats.totalWaits() < 80) {
                throw new AssertionError("Expected at least 80 acquisitions: " + stats);
            }
            if (stats.timeouts() != 0) {
                throw new AssertionError("Unexpected timeouts: " + stats);
            }
        }
    }

    // =========================================================================
    // UTILITIES
    // =========================================================================

    @FunctionalInterface
    private interface Step<T> {
        T run(int thread, int iteration) throws Exception;
    }

    /**
     * Runs {@code step} from {@code threads} threads released together and
     * fails if any invocation threw.
     */
    private static <T> List<T> hammer(int threads, int perThread, Step<T> step) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        ConcurrentLinkedQueue<T> results = new ConcurrentLinkedQueue<>();
        ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();

        for (int t = 0; t < threads; t++) {
            final int thread = t;
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        results.add(step.run(thread, i));
                    }
                } catch (Throwable e) {
                    errors.add(e);
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        boolean finished = done.await(120, TimeUnit.SECONDS);
        executor.shutdownNow();
        if (!finished) {
            throw new AssertionError("Threads did not finish in time");
        }
        if (!errors.isEmpty()) {
            AssertionError failure = new AssertionError(errors.size() + " threads failed");
            errors.forEach(failure::addSuppressed);
            throw failure;
        }
        return new ArrayList<>(results);
    }

    private static void verifyIds(List<Todo> todos, int expected) {
        if (todos.size() != expected) {
            throw new AssertionError("Expected " + expected + " todos, found " + todos.size());
        }
        List<Integer> ids = todos.stream().map(Todo::id).sorted(Comparator.naturalOrder()).collect(Collectors.toList());
        for (int i = 0; i < ids.size(); i++) {
            if (ids.get(i) != i + 1) {
                throw new AssertionError("Ids are not 1.." + expected + ": first mismatch at " + ids.get(i));
            }
        }
    }

    private static <E extends Throwable> E expect(Class<E> type, ChaosTestRunnable action) {
        try {
            action.run();
        } catch (Throwable e) {
            if (type.isInstance(e)) {
                return type.cast(e);
            }
            throw new AssertionError("Expected " + type.getSimpleName() + " but got " + e, e);
        }
        throw new AssertionError("Expected " + type.getSimpleName() + " but nothing was thrown");
    }

    private FileTodoStore newStore(String name) throws IOException {
        return new FileTodoStore(config(createTestDir(name).resolve("todo.json")));
    }

    private static TodoStoreConfig config(Path db) {
        return TodoStoreConfig.builder()
                .dbPath(db)
                .syncEnabled(false)
                .lockTimeoutMs(60_000)
                .build();
    }

    private void printSection(String name) {
        System.out.println();
        System.out.println("+---------------------------------------------------------------+");
        System.out.printf("|  %-61s|%n", name);
        System.out.println("+---------------------------------------------------------------+");
    }

    private void chaosTest(String name, ChaosTestRunnable test) {
        System.out.printf("  %-55s ", name);
        try {
            test.run();
            System.out.println("[PASS]");
            testsPassed.incrementAndGet();
        } catch (Throwable e) {
            System.out.println("[FAIL]");
            System.err.println("    Error: " + e.getMessage());
            e.printStackTrace(System.err);
            testsFailed.incrementAndGet();
        }
    }

    private Path createTestDir(String name) throws IOException {
        Path dir = baseDir.resolve(name + "-" + System.nanoTime());
        Files.createDirectories(dir);
        return dir;
    }

    private static void deleteRecursively(Path path) {
        try {
            if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
                try (var stream = Files.list(path)) {
                    stream.forEach(StoreChaos::deleteRecursively);
                }
            }
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not clean up {}: {}", path, e.getMessage());
        }
    }

    @FunctionalInterface
    interface ChaosTestRunnable {
        void run() throws Exception;
    }
}
