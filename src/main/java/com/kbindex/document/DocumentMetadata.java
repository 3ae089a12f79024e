package com.kbindex.document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record DocumentMetadata(
        String title,
        String description,
        String author,
        List<String> tags,
        Instant createdAt,
        Instant updatedAt,
        Map<String, Object> extras) {

    public static final String DEFAULT_TITLE = "Untitled Document";

    static final String TITLE = "title";
    static final String DESCRIPTION = "description";
    static final String AUTHOR = "author";
    static final String TAGS = "tags";
    static final String CREATED_AT = "createdAt";
    static final String UPDATED_AT = "updatedAt";

    public DocumentMetadata {
        title = title == null || title.isBlank() ? DEFAULT_TITLE : title;
        tags = tags == null ? List.of() : tags.stream().filter(Objects::nonNull).toList();
        extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public static DocumentMetadata untitled() {
        return new DocumentMetadata(null, null, null, List.of(), null, null, Map.of());
    }

    public static DocumentMetadata of(String title, String description, String author, List<String> tags) {
        return new DocumentMetadata(title, description, author, tags, null, null, Map.of());
    }

    public DocumentMetadata withTimestamps(Instant newCreatedAt, Instant newUpdatedAt) {
        return new DocumentMetadata(title, description, author, tags, newCreatedAt, newUpdatedAt, extras);
    }

    public static DocumentMetadata fromMap(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return untitled();
        }
        Map<String, Object> extras = new LinkedHashMap<>();
        String title = null;
        String description = null;
        String author = null;
        List<String> tags = List.of();
        Instant createdAt = null;
        Instant updatedAt = null;

        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            switch (key) {
                case TITLE -> title = asText(value);
                case DESCRIPTION -> description = asText(value);
                case AUTHOR -> author = asText(value);
                case TAGS -> tags = asTags(value);
                case CREATED_AT -> {
                    createdAt = asInstant(value);
                    if (createdAt == null && value != null) {
                        extras.put(key, value);
                    }
                }
                case UPDATED_AT -> {
                    updatedAt = asInstant(value);
                    if (updatedAt == null && value != null) {
                        extras.put(key, value);
                    }
                }
                default -> extras.put(key, value);
            }
        }
        return new DocumentMetadata(title, description, author, tags, createdAt, updatedAt, extras);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(TITLE, title);
        if (description != null) {
            values.put(DESCRIPTION, description);
        }
        if (author != null) {
            values.put(AUTHOR, author);
        }
        if (!tags.isEmpty()) {
            values.put(TAGS, new ArrayList<>(tags));
        }
        if (createdAt != null) {
            values.put(CREATED_AT, Timestamps.format(createdAt));
        }
        if (updatedAt != null) {
            values.put(UPDATED_AT, Timestamps.format(updatedAt));
        }
        extras.forEach(values::putIfAbsent);
        return values;
    }

    private static String asText(Object value) {
        return value == null ? null : value.toString();
    }

    private static List<String> asTags(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().filter(Objects::nonNull).map(Object::toString).toList();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Arrays.stream(text.split(",")).map(String::strip).filter(tag -> !tag.isEmpty()).toList();
        }
        return List.of();
    }

    private static Instant asInstant(Object value) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof String text) {
            return Timestamps.parse(text).orElse(null);
        }
        return null;
    }
}
