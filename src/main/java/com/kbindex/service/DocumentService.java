package com.kbindex.service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbindex.document.Document;
import com.kbindex.document.DocumentCategory;
import com.kbindex.document.DocumentMetadata;
import com.kbindex.document.DocumentStore;
import com.kbindex.index.DocumentIndex;

public class DocumentService {
    private static final Logger log = LoggerFactory.getLogger(DocumentService.class);
    private static final String DOCUMENT_EXTENSION = ".md";

    private final DocumentStore store;
    private final DocumentIndex index;
    private final Clock clock;

    public DocumentService(DocumentStore store, DocumentIndex index) {
        this(store, index, Clock.systemUTC());
    }

    DocumentService(DocumentStore store, DocumentIndex index, Clock clock) {
        this.store = store;
        this.index = index;
        this.clock = clock;
    }

    public Document create(DocumentCategory category, String subcategory, String name, String content,
            DocumentMetadata metadata) throws IOException {
        String path = documentPath(category, subcategory, name);
        if (store.read(category, path).isPresent()) {
            throw new IllegalStateException("Document already exists at " + category.id() + "://" + path);
        }
        Instant now = clock.instant();
        DocumentMetadata stamped = (metadata == null ? DocumentMetadata.untitled() : metadata).withTimestamps(now, now);
        Document created = persist(new Document(category, path, content, stamped));
        log.info("Created document {}", created.location());
        return created;
    }

    public Document update(DocumentCategory category, String path, DocumentUpdate update) throws IOException {
        Document existing = store.read(category, path)
                .orElseThrow(() -> new IllegalArgumentException("Document not found at " + category.id() + "://" + path));
        if (update == null || update.isEmpty()) {
            return existing;
        }
        DocumentMetadata current = existing.metadata();
        Instant now = clock.instant();
        DocumentMetadata metadata = new DocumentMetadata(
                update.title() != null ? update.title() : current.title(),
                update.description() != null ? update.description() : current.description(),
                update.author() != null ? update.author() : current.author(),
                update.tags() != null ? update.tags() : current.tags(),
                current.createdAt() != null ? current.createdAt() : now,
                now,
                current.extras());
        String content = update.content() != null ? update.content() : existing.content();
        Document updated = persist(new Document(category, existing.path(), content, metadata));
        log.info("Updated document {}", updated.location());
        return updated;
    }

    public Optional<Document> get(DocumentCategory category, String path) throws IOException {
        return store.read(category, path);
    }

    public List<String> list(DocumentCategory category, String subcategory) throws IOException {
        return store.list(category, subcategory);
    }

    public List<String> listSubcategories(DocumentCategory category) throws IOException {
        return store.listSubcategories(category);
    }

    public boolean remove(DocumentCategory category, String path) {
        // index record only; the file stays in the store
        return index.remove(category, path);
    }

    private Document persist(Document document) throws IOException {
        store.write(document);
        Instant modified = store.lastModified(document.category(), document.path());
        index.upsert(document, modified);
        return document;
    }

    static String documentPath(DocumentCategory category, String subcategory, String name) {
        if (subcategory == null || subcategory.isBlank()) {
            throw new IllegalArgumentException(category == DocumentCategory.REFERENCE_DOC
                    ? "Language is required for reference documents"
                    : "Project is required for spec documents");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Document name must not be blank");
        }
        String fileName = name.strip();
        if (!fileName.endsWith(DOCUMENT_EXTENSION)) {
            fileName = fileName + DOCUMENT_EXTENSION;
        }
        return subcategory.strip() + "/" + fileName;
    }
}
