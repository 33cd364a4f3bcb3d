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
/**
 * Locking for a file shared by threads, scheduled tasks and processes.
 * <p>
 * {@link dev.mars.todostore.lock.PlatformLock} excludes other processes with
 * the operating system's file lock (advisory on POSIX, mandatory on Windows).
 * {@link dev.mars.todostore.lock.CompatMutex} excludes other callers in the
 * same JVM, whether they block a thread or wait on a
 * {@link dev.mars.todostore.lock.TaskScheduler}. Both raise
 * {@link dev.mars.todostore.lock.LockTimeoutException} when their budget runs out.
 */
package dev.mars.todostore.lock;
