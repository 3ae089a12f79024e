package com.kbindex.index;

import com.kbindex.document.DocumentCategory;

public record DocumentKey(DocumentCategory category, String path) {

    @Override
    public String toString() {
        return category.id() + "://" + path;
    }
}
