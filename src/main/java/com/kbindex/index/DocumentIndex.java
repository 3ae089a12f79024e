package com.kbindex.index;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.kbindex.document.Document;
import com.kbindex.document.DocumentCategory;
import com.kbindex.search.SearchFilters;
import com.kbindex.search.SearchResult;

public interface DocumentIndex {

    default void upsert(Document document) {
        upsert(document, null);
    }

    /**
     * Inserts or replaces the record for the document's (category, path), its tags and its search projection.
     *
     * @param sourceModifiedAt modification time of the source file as observed by the caller, or null if unknown
     */
    void upsert(Document document, Instant sourceModifiedAt);

    boolean remove(DocumentCategory category, String path);

    Map<DocumentKey, IndexEntry> metadataSnapshot();

    List<SearchResult> search(String query, SearchFilters filters);

    long count();
}
