package com.kbindex.index;

import com.kbindex.document.DocumentCategory;

public record ScanError(DocumentCategory category, String path, String message) {

    public String location() {
        return path == null ? category.id() + "://" : category.id() + "://" + path;
    }

    @Override
    public String toString() {
        return location() + ": " + message;
    }
}
