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
import dev.mars.todostore.storage.FileTodoStore;
import dev.mars.todostore.storage.Todo;
import dev.mars.todostore.storage.TodoStoreConfig;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

/**
 * Demo entry point for the todo store.
 * <p>
 * Walks through the store's basic operations:
 * <ul>
 *   <li>Loading the existing list</li>
 *   <li>Adding records from a thread and from an async task</li>
 *   <li>Completing a record</li>
 *   <li>Listing the backup chain</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link TodoStoreConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (document path only)</li>
 *   <li>System properties: {@code -Dtodostore.dbPath=/path/todo.json -Dtodostore.backupCount=5 ...}</li>
 *   <li>Environment variables: {@code TODOSTORE_DB_PATH, TODOSTORE_BACKUP_COUNT, ...}</li>
 *   <li>Properties file: {@code todostore.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl todostore-demo -am
 *
 * # Run against the default document
 * java -cp "todostore-demo/target/*" dev.mars.todostore.demo.StoreDemo
 *
 * # Run against a specific document
 * java -cp "todostore-demo/target/*" dev.mars.todostore.demo.StoreDemo /tmp/demo/todo.json
 * </pre>
 *
 * @see TodoStoreConfig
 */
public class StoreDemo {

    public static void main(String[] args) {
        System.out.println("+---------------------------------------+");
        System.out.println("|          Todo Store Demo              |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        TodoStoreConfig config = args.length > 0 && !args[0].isBlank()
                ? TodoStoreConfig.builder().dbPath(args[0]).build()
                : TodoStoreConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        try (FileTodoStore store = new FileTodoStore(config)) {
            System.out.println("[OK] Store opened at: " + store.path() + " (lock mode " + store.lockMode() + ")");

            List<Todo> existing = store.load();
            System.out.println("[OK] Loaded " + existing.size() + " existing todos");
            if (!existing.isEmpty()) {
                System.out.println("\n  Last todos in list:");
                int start = Math.max(0, existing.size() - 3);
                for (Todo todo : existing.subList(start, existing.size())) {
                    printTodo(todo);
                }
            }

            Todo first = store.add("Write the quarterly report", LocalDate.now().plusDays(7).toString());
            Todo second = store.addAsync("Book the team offsite").join();
            System.out.println("\n[OK] Added #" + first.id() + " (blocking) and #" + second.id() + " (async)");

            Todo done = store.markDone(first.id());
            System.out.println("[OK] Completed #" + done.id());

            System.out.println("\n  Current list:");
            for (Todo todo : store.load()) {
                printTodo(todo);
            }

            List<Path> backups = store.listBackups();
            System.out.println("\n[OK] " + backups.size() + " backups kept (limit " + config.backupCount() + ")");
            for (Path backup : backups) {
                System.out.println("    " + backup.getFileName());
            }
            store.lastBackupFailure().ifPresent(e ->
                    System.out.println("[WARN] Last backup failed: " + e.getMessage()));

            LockStats stats = store.lockStats();
            System.out.printf("%n[OK] Lock stats: %d acquisitions, max wait %d ms, %d timeouts%n",
                    stats.totalWaits(), stats.maxWait().toMillis(), stats.timeouts());

            System.out.println("\n+---------------------------------------+");
            System.out.println("|  Demo complete!                       |");
            System.out.println("|  Run again to see ids reused/grown.   |");
            System.out.println("+---------------------------------------+");
        }
    }

    private static void printTodo(Todo todo) {
        System.out.printf("    [%s] #%d %s%s%n",
                todo.done() ? "x" : " ",
                todo.id(),
                todo.text(),
                todo.dueDate() != null ? " (due " + todo.dueDate() + ")" : "");
    }
}
