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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link IdAllocator}.
 */
class IdAllocatorTest {

    private static List<Todo> withIds(int... ids) {
        return Arrays.stream(ids).mapToObj(id -> Todo.create(id, "t" + id)).collect(Collectors.toList());
    }

    static Stream<Arguments> idSets() {
        return Stream.of(
                Arguments.of(new int[]{}, 1),
                Arguments.of(new int[]{1}, 2),
                Arguments.of(new int[]{1, 2, 3}, 4),
                Arguments.of(new int[]{1, 3, 5}, 2),
                Arguments.of(new int[]{2, 3}, 1),
                Arguments.of(new int[]{5, 1, 4, 2}, 3),
                Arguments.of(new int[]{1000}, 1),
                Arguments.of(new int[]{-1, 0, 1}, 2)
        );
    }

    @ParameterizedTest
    @MethodSource("idSets")
    void testNextId_SmallestUnused(int[] ids, int expected) {
        assertEquals(expected, IdAllocator.nextId(withIds(ids)));
    }

    @Test
    void testGapsFilledInOrder() {
        List<Todo> todos = new ArrayList<>(withIds(IntStream.rangeClosed(1, 10).toArray()));
        todos.removeIf(t -> t.id() == 3 || t.id() == 7);

        int first = IdAllocator.nextId(todos);
        todos.add(Todo.create(first, "refill"));
        int second = IdAllocator.nextId(todos);
        todos.add(Todo.create(second, "refill"));

        assertEquals(3, first);
        assertEquals(7, second);
        assertEquals(11, IdAllocator.nextId(todos));
    }

    @Test
    void testLargeContiguousSet() {
        assertEquals(10_001, IdAllocator.nextId(withIds(IntStream.rangeClosed(1, 10_000).toArray())));
    }
}
