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

import java.util.BitSet;
import java.util.Collection;

/**
 * Gap-filling id allocation.
 * <p>
 * The next id is always recomputed from the records themselves; there is no
 * stored counter that could drift from them. Callers must hold the store's
 * mutex across load, allocate, append and save, otherwise two callers can
 * allocate from the same snapshot.
 */
public final class IdAllocator {

    private IdAllocator() {
    }

    /**
     * Returns the smallest positive integer not used as an id.
     * <p>
     * {@code {}} gives 1, {@code {1,3,5}} gives 2, {@code {1,2,3}} gives 4.
     */
    public static int nextId(Collection<Todo> todos) {
        int n = todos.size();
        // among n ids at most n fit in [1, n], so the answer is at most n + 1
        BitSet used = new BitSet(n + 2);
        for (Todo todo : todos) {
            int id = todo.id();
            if (id >= 1 && id <= n) {
                used.set(id);
            }
        }
        return used.nextClearBit(1);
    }
}
