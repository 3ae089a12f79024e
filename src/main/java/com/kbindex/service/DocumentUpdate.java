package com.kbindex.service;

import java.util.List;

public record DocumentUpdate(String content, String title, String description, String author, List<String> tags) {

    public static DocumentUpdate content(String content) {
        return new DocumentUpdate(content, null, null, null, null);
    }

    public boolean isEmpty() {
        return content == null && !touchesMetadata();
    }

    public boolean touchesMetadata() {
        return title != null || description != null || author != null || tags != null;
    }
}
