package com.kbindex.document;

import java.util.Locale;

public enum DocumentCategory {
    REFERENCE_DOC("stdlib", "stdlib", "reference-doc"),
    PROJECT_SPEC("spec", "specs", "project-spec");

    private final String id;
    private final String directoryName;
    private final String alias;

    DocumentCategory(String id, String directoryName, String alias) {
        this.id = id;
        this.directoryName = directoryName;
        this.alias = alias;
    }

    public String id() {
        return id;
    }

    public String directoryName() {
        return directoryName;
    }

    public static DocumentCategory fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Document category must not be blank");
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (DocumentCategory category : values()) {
            if (category.id.equals(normalized) || category.alias.equals(normalized)
                    || category.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown document category: " + value);
    }

    @Override
    public String toString() {
        return id;
    }
}
