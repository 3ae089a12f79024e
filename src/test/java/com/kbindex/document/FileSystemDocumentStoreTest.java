package com.kbindex.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemDocumentStoreTest {

    @TempDir
    Path tempDir;

    private FileSystemDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemDocumentStore(tempDir);
    }

    @Test
    void shouldListMarkdownFilesRecursivelyInSortedOrder() throws Exception {
        Path stdlib = tempDir.resolve("stdlib");
        Files.createDirectories(stdlib.resolve("python/builtins"));
        Files.createDirectories(stdlib.resolve("javascript"));
        Files.writeString(stdlib.resolve("python/list.md"), "lists");
        Files.writeString(stdlib.resolve("python/builtins/len.md"), "len");
        Files.writeString(stdlib.resolve("javascript/array.md"), "arrays");
        Files.writeString(stdlib.resolve("javascript/notes.txt"), "ignored");

        assertEquals(List.of("javascript/array.md", "python/builtins/len.md", "python/list.md"),
                store.list(DocumentCategory.REFERENCE_DOC, null));
        assertEquals(List.of("python/builtins/len.md", "python/list.md"),
                store.list(DocumentCategory.REFERENCE_DOC, "python"));
        assertEquals(List.of(), store.list(DocumentCategory.REFERENCE_DOC, "rust"));
        assertEquals(List.of("javascript", "python"), store.listSubcategories(DocumentCategory.REFERENCE_DOC));
    }

    @Test
    void shouldFailListingWhenCategoryDirectoryIsMissing() {
        assertThrows(NoSuchFileException.class, () -> store.list(DocumentCategory.PROJECT_SPEC, null));
    }

    @Test
    void shouldWriteAndReadDocumentsWithFrontmatter() throws Exception {
        store.ensureStructure();
        Document document = new Document(DocumentCategory.PROJECT_SPEC, "billing/api.md", "GET /invoices\n",
                DocumentMetadata.of("Billing API", "Invoice endpoints", "ops", List.of("http")));

        store.write(document);

        assertTrue(Files.isRegularFile(tempDir.resolve("specs/billing/api.md")));
        assertEquals(document, store.read(DocumentCategory.PROJECT_SPEC, "billing/api.md").orElseThrow());
        assertEquals(List.of("billing"), store.listSubcategories(DocumentCategory.PROJECT_SPEC));
    }

    @Test
    void shouldReturnEmptyWhenDocumentIsAbsent() throws Exception {
        store.ensureStructure();

        assertTrue(store.read(DocumentCategory.REFERENCE_DOC, "go/missing.md").isEmpty());
    }

    @Test
    void shouldRejectPathsOutsideTheCategory() {
        assertThrows(IllegalArgumentException.class,
                () -> store.read(DocumentCategory.REFERENCE_DOC, "../specs/secret.md"));
        assertThrows(IllegalArgumentException.class,
                () -> store.write(new Document(DocumentCategory.PROJECT_SPEC, "../../outside.md", "x", null)));
    }
}
