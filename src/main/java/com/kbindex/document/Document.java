package com.kbindex.document;

public record Document(DocumentCategory category, String path, String content, DocumentMetadata metadata) {

    public Document {
        if (category == null) {
            throw new IllegalArgumentException("category must not be null");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        content = content == null ? "" : content;
        metadata = metadata == null ? DocumentMetadata.untitled() : metadata;
    }

    public String location() {
        return category.id() + "://" + path;
    }
}
