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

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts between the on-disk JSON array and a list of {@link Todo}.
 * <p>
 * The format is a bare UTF-8 JSON array of record objects: no envelope, no
 * stored id counter. Decoding validates the schema and the uniqueness of ids
 * and reports every violation as {@link CorruptionException}.
 */
public final class DocumentCodec {

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    /**
     * Serializes the records in order.
     *
     * @throws IllegalArgumentException if two records share an id
     */
    public byte[] encode(List<Todo> todos) {
        Set<Integer> seen = new HashSet<>();
        for (Todo todo : todos) {
            if (!seen.add(todo.id())) {
                throw new IllegalArgumentException("Duplicate todo id " + todo.id());
            }
        }
        try {
            return mapper.writeValueAsBytes(todos);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize " + todos.size() + " todos", e);
        }
    }

    /**
     * Parses and validates a document.
     *
     * @param bytes  the raw file content
     * @param source the file, for error messages
     * @throws CorruptionException if the bytes are not a valid document
     */
    public List<Todo> decode(byte[] bytes, Path source) {
        JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (JsonProcessingException e) {
            JsonLocation loc = e.getLocation();
            String where = loc != null ? " at line " + loc.getLineNr() + ", column " + loc.getColumnNr() : "";
            throw new CorruptionException(source, "invalid JSON" + where + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CorruptionException(source, "unreadable JSON: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new CorruptionException(source, "document is empty");
        }
        if (!root.isArray()) {
            throw new CorruptionException(source, "document must be a JSON array, found " + root.getNodeType());
        }

        List<Todo> todos = new ArrayList<>(root.size());
        Set<Integer> ids = new HashSet<>();
        int index = 0;
        for (JsonNode item : root) {
            Todo todo = decodeRecord(item, index, source);
            if (!ids.add(todo.id())) {
                throw new CorruptionException(source, "duplicate id " + todo.id() + " at index " + index);
            }
            todos.add(todo);
            index++;
        }
        return todos;
    }

    private Todo decodeRecord(JsonNode item, int index, Path source) {
        if (!item.isObject()) {
            throw new CorruptionException(source, "item " + index + " is not an object");
        }
        JsonNode id = item.get("id");
        if (id == null) {
            throw new CorruptionException(source, "item " + index + ": missing required field 'id'");
        }
        if (!id.isIntegralNumber() || !id.canConvertToInt()) {
            throw new CorruptionException(source, "item " + index + ": 'id' must be an integer, found " + id);
        }
        JsonNode text = item.get("text");
        if (text == null) {
            throw new CorruptionException(source, "item " + index + ": missing required field 'text'");
        }
        if (!text.isTextual()) {
            throw new CorruptionException(source, "item " + index + ": 'text' must be a string, found " + text);
        }
        return new Todo(
                id.intValue(),
                text.textValue(),
                decodeDone(item.get("done"), index, source),
                decodeDueDate(item.get("due_date"), index, source),
                optionalText(item, "created_at", index, source),
                optionalText(item, "updated_at", index, source));
    }

    private static boolean decodeDone(JsonNode done, int index, Path source) {
        if (done == null || done.isNull()) {
            return false;
        }
        if (done.isBoolean()) {
            return done.booleanValue();
        }
        if (done.isIntegralNumber() && (done.intValue() == 0 || done.intValue() == 1) && done.canConvertToInt()) {
            return done.intValue() == 1;
        }
        throw new CorruptionException(source,
                "item " + index + ": 'done' must be a boolean (true/false) or 0/1, found " + done);
    }

    private static String decodeDueDate(JsonNode due, int index, Path source) {
        if (due == null || due.isNull() || (due.isTextual() && due.textValue().isEmpty())) {
            return null;
        }
        if (!due.isTextual()) {
            throw new CorruptionException(source, "item " + index + ": 'due_date' must be a string, found " + due);
        }
        try {
            Todo.validateDueDate(due.textValue());
        } catch (IllegalArgumentException e) {
            throw new CorruptionException(source, "item " + index + ": " + e.getMessage());
        }
        return due.textValue();
    }

    private static String optionalText(JsonNode item, String field, int index, Path source) {
        JsonNode node = item.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new CorruptionException(source, "item " + index + ": '" + field + "' must be a string, found " + node);
        }
        return node.textValue();
    }
}
