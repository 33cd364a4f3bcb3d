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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TodoStoreConfig} value resolution.
 */
class TodoStoreConfigTest {

    private final Map<String, String> env = new HashMap<>();
    private final Properties file = new Properties();

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(TodoStoreConfig.PROP_DB_PATH);
        System.clearProperty(TodoStoreConfig.PROP_BACKUP_COUNT);
        System.clearProperty(TodoStoreConfig.PROP_LOCK_TIMEOUT_MS);
        System.clearProperty(TodoStoreConfig.PROP_SYNC_ENABLED);
    }

    private TodoStoreConfig.Builder builder() {
        return TodoStoreConfig.builder(env::get, file);
    }

    @Test
    void testDefaults() {
        TodoStoreConfig config = builder().build();

        assertEquals(Path.of(".todo.json"), config.dbPath());
        assertTrue(config.backupEnabled());
        assertEquals(3, config.backupCount());
        assertEquals(10L * 1024 * 1024, config.maxDocumentSizeBytes());
        assertEquals(Duration.ofSeconds(30), config.lockTimeout());
        assertTrue(config.syncEnabled());
        assertTrue(config.cacheEnabled());
        assertFalse(config.strictLocking());
        assertFalse(config.allowInsecureLocking());
    }

    @Test
    void testXdgDataHome_UsedForDefaultPath() {
        env.put("XDG_DATA_HOME", "/home/someone/.local/share");

        assertEquals(Path.of("/home/someone/.local/share", "todostore", "todo.json"), builder().build().dbPath());
    }

    @Test
    void testBlankXdgDataHome_Ignored() {
        env.put("XDG_DATA_HOME", "  ");

        assertEquals(Path.of(".todo.json"), builder().build().dbPath());
    }

    @Test
    void testLockPath_IsSidecar() {
        TodoStoreConfig config = builder().dbPath("/data/todo.json").build();

        assertEquals(Path.of("/data/todo.json.lock"), config.lockPath());
    }

    @Test
    void testPriority_FileBelowEnvironment() {
        file.setProperty("todostore.backupCount", "5");
        assertEquals(5, builder().build().backupCount());

        env.put("TODOSTORE_BACKUP_COUNT", "7");
        assertEquals(7, builder().build().backupCount());
    }

    @Test
    void testPriority_SystemPropertyAboveEnvironment() {
        env.put("TODOSTORE_DB_PATH", "/env/todo.json");
        System.setProperty("todostore.dbPath", "/sys/todo.json");

        assertEquals(Path.of("/sys/todo.json"), builder().build().dbPath());
    }

    @Test
    void testPriority_ProgrammaticWins() {
        System.setProperty("todostore.lockTimeoutMs", "100");
        env.put("TODOSTORE_LOCK_TIMEOUT_MS", "200");

        TodoStoreConfig config = builder().lockTimeout(Duration.ofMillis(300)).build();

        assertEquals(300, config.lockTimeoutMs());
    }

    @Test
    void testBooleanFromEnvironment() {
        env.put("TODOSTORE_SYNC_ENABLED", "false");
        env.put("TODOSTORE_ALLOW_INSECURE_LOCKING", "true");

        TodoStoreConfig config = builder().build();

        assertFalse(config.syncEnabled());
        assertTrue(config.allowInsecureLocking());
    }

    @Test
    void testInvalidNumber_FallsThrough() {
        System.setProperty("todostore.backupCount", "lots");
        assertEquals(3, builder().build().backupCount());

        env.put("TODOSTORE_BACKUP_COUNT", "4");
        assertEquals(4, builder().build().backupCount());
    }

    @Test
    void testOutOfRange_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> builder().backupCount(0).build());
        assertThrows(IllegalArgumentException.class, () -> builder().maxDocumentSizeBytes(0).build());
        assertThrows(IllegalArgumentException.class, () -> builder().lockTimeoutMs(-1).build());
    }

    @Test
    void testUpperBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> builder().maxDocumentSizeBytes(Long.MAX_VALUE).build());
        assertThrows(IllegalArgumentException.class,
                () -> builder().maxDocumentSizeBytes(SafeReader.MAX_SUPPORTED_BYTES + 1).build());
        assertThrows(IllegalArgumentException.class,
                () -> builder().lockTimeoutMs(Long.MAX_VALUE).build());

        TodoStoreConfig largest = builder()
                .maxDocumentSizeBytes(SafeReader.MAX_SUPPORTED_BYTES)
                .lockTimeoutMs(TodoStoreConfig.MAX_LOCK_TIMEOUT_MS)
                .build();
        assertEquals(SafeReader.MAX_SUPPORTED_BYTES, largest.maxDocumentSizeBytes());
        assertEquals(TodoStoreConfig.MAX_LOCK_TIMEOUT_MS, largest.lockTimeout().toMillis());
    }

    @Test
    void testZeroTimeout_Allowed() {
        assertEquals(Duration.ZERO, builder().lockTimeoutMs(0).build().lockTimeout());
    }
}
