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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One task list entry.
 * <p>
 * Immutable: every change returns a new instance with {@code updated_at}
 * refreshed. Persisted with snake_case field names.
 *
 * @param id        unique within the document, positive, not necessarily contiguous
 * @param text      the task text
 * @param done      completion flag
 * @param dueDate   optional due date, {@code YYYY-MM-DD}
 * @param createdAt ISO-8601 creation instant
 * @param updatedAt ISO-8601 instant of the last change
 */
@JsonPropertyOrder({"id", "text", "done", "due_date", "created_at", "updated_at"})
public record Todo(
        @JsonProperty("id") int id,
        @JsonProperty("text") String text,
        @JsonProperty("done") boolean done,
        @JsonProperty("due_date") String dueDate,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("updated_at") String updatedAt
) {

    static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    public Todo {
        Objects.requireNonNull(text, "text");
        if (createdAt == null || createdAt.isEmpty()) {
            createdAt = now();
        }
        if (updatedAt == null || updatedAt.isEmpty()) {
            updatedAt = createdAt;
        }
    }

    /**
     * Creates a new, open todo stamped with the current time.
     *
     * @throws IllegalArgumentException if {@code text} is blank
     */
    public static Todo create(int id, String text) {
        return new Todo(id, requireText(text), false, null, null, null);
    }

    public Todo markDone() {
        return new Todo(id, text, true, dueDate, createdAt, now());
    }

    public Todo markUndone() {
        return new Todo(id, text, false, dueDate, createdAt, now());
    }

    /**
     * @throws IllegalArgumentException if {@code newText} is blank
     */
    public Todo rename(String newText) {
        return new Todo(id, requireText(newText), done, dueDate, createdAt, now());
    }

    /**
     * @param date {@code YYYY-MM-DD}, or null to clear
     * @throws IllegalArgumentException if the date is malformed or not a real date
     */
    public Todo withDueDate(String date) {
        if (date != null) {
            validateDueDate(date);
        }
        return new Todo(id, text, done, date, createdAt, now());
    }

    /** Same record under a different id; timestamps unchanged. */
    public Todo withId(int newId) {
        return new Todo(newId, text, done, dueDate, createdAt, updatedAt);
    }

    /** Open and due before {@code today}. */
    public boolean isOverdue(LocalDate today) {
        if (dueDate == null || done) {
            return false;
        }
        return LocalDate.parse(dueDate).isBefore(today);
    }

    static void validateDueDate(String date) {
        if (!ISO_DATE.matcher(date).matches()) {
            throw new IllegalArgumentException("Invalid date format: '" + date + "'. Expected YYYY-MM-DD");
        }
        try {
            LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date: '" + date + "'", e);
        }
    }

    private static String requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Todo text cannot be empty");
        }
        return text.strip();
    }

    private static String now() {
        return Instant.now().atOffset(ZoneOffset.UTC).toString();
    }

    @Override
    public String toString() {
        String shown = text.length() > 50 ? text.substring(0, 47) + "..." : text;
        return "Todo(id=" + id + ", text='" + shown + "', done=" + done + ")";
    }
}
