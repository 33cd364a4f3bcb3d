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
 * Crash-consistent JSON task list storage.
 * <ul>
 *   <li>{@link dev.mars.todostore.storage.TodoStore} - The store interface</li>
 *   <li>{@link dev.mars.todostore.storage.FileTodoStore} - Single-file implementation</li>
 *   <li>{@link dev.mars.todostore.storage.SafeReader} - Bounded, symlink-refusing reads</li>
 *   <li>{@link dev.mars.todostore.storage.AtomicWriter} - Temp file, fsync, rename</li>
 *   <li>{@link dev.mars.todostore.storage.BackupChain} - Bounded previous versions</li>
 *   <li>{@link dev.mars.todostore.storage.IdAllocator} - Smallest unused id</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Whole-cycle locking:</b> load, change and save run under one lock hold</li>
 *   <li><b>Never torn:</b> the document is replaced by rename, never rewritten in place</li>
 *   <li><b>Fail loudly:</b> a corrupt document is reported, never overwritten</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * data/
 *  ├─ todo.json              // JSON array of records (atomic replace)
 *  ├─ todo.json.lock         // cross-process lock file
 *  └─ todo.json.bak.NNNNNN   // previous versions, oldest deleted first
 * </pre>
 *
 * @see dev.mars.todostore.storage.TodoStore
 */
package dev.mars.todostore.storage;
