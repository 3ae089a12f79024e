package com.kbindex.document;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface DocumentStore {

    /**
     * Lists document paths of a category, optionally restricted to one subcategory directory.
     *
     * @throws IOException when the category cannot be enumerated; an empty list always means "no documents"
     */
    List<String> list(DocumentCategory category, String subpath) throws IOException;

    Optional<Document> read(DocumentCategory category, String path) throws IOException;

    Instant lastModified(DocumentCategory category, String path) throws IOException;

    void write(Document document) throws IOException;

    List<String> listSubcategories(DocumentCategory category) throws IOException;

    void ensureStructure() throws IOException;
}
