package com.kbindex.search;

import java.util.List;

import com.kbindex.document.Document;

public record SearchResult(Document document, List<String> matches) {

    public SearchResult {
        matches = matches == null ? List.of() : List.copyOf(matches);
    }
}
