package com.kbindex.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.kbindex.document.Document;
import com.kbindex.document.DocumentCategory;
import com.kbindex.document.DocumentMetadata;
import com.kbindex.index.IndexDatabase;
import com.kbindex.index.SqliteDocumentIndex;
import com.kbindex.runtime.AppConfig;

class DocumentSearchTest {

    @TempDir
    Path tempDir;

    private IndexDatabase database;
    private SqliteDocumentIndex index;

    @BeforeEach
    void setUp() {
        database = new IndexDatabase(tempDir.resolve("search.db"), new AppConfig.IndexConfig());
        database.initialize();
        index = new SqliteDocumentIndex(database);
        index.upsert(document(DocumentCategory.REFERENCE_DOC, "js/array.md", "Array Methods", "map filter reduce",
                List.of("arrays")));
        index.upsert(document(DocumentCategory.REFERENCE_DOC, "py/list.md", "List Operations", "append extend",
                List.of("lists")));
        index.upsert(document(DocumentCategory.PROJECT_SPEC, "proj1/api.md", "Users API", "GET POST users",
                List.of("http")));
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void shouldFindSingleTermMatch() {
        assertEquals(List.of("js/array.md"), paths(index.search("map", SearchFilters.none())));
    }

    @Test
    void shouldListCategoryOrderedByTitleForWildcard() {
        List<SearchResult> results = index.search("*", new SearchFilters(DocumentCategory.REFERENCE_DOC, null, false));

        assertEquals(List.of("js/array.md", "py/list.md"), paths(results));
        assertEquals(paths(results), paths(index.search("", new SearchFilters(DocumentCategory.REFERENCE_DOC, null, false))));
    }

    @Test
    void shouldMatchTermsAcrossTitleAndContent() {
        assertEquals(List.of("proj1/api.md"), paths(index.search("users api", SearchFilters.none())));
    }

    @Test
    void shouldRequireEveryTermToMatch() {
        index.upsert(document(DocumentCategory.REFERENCE_DOC, "js/map.md", "Map Objects", "map keys to values",
                List.of()));

        assertEquals(List.of("js/array.md"), paths(index.search("map filter", SearchFilters.none())));
        assertTrue(index.search("map append", SearchFilters.none()).isEmpty());
    }

    @Test
    void shouldMatchTagsAndIgnoreCase() {
        assertEquals(List.of("proj1/api.md"), paths(index.search("HTTP", SearchFilters.none())));
        assertEquals(List.of("js/array.md"), paths(index.search("MaP", SearchFilters.none())));
    }

    @Test
    void shouldComposeCategoryAndSubcategoryFilters() {
        index.upsert(document(DocumentCategory.PROJECT_SPEC, "proj10/api.md", "Other API", "GET orders", List.of()));
        index.upsert(document(DocumentCategory.REFERENCE_DOC, "proj1/notes.md", "Stray Notes", "GET", List.of()));

        List<SearchResult> results = index.search("*", new SearchFilters(DocumentCategory.PROJECT_SPEC, "project1", false));
        assertTrue(results.isEmpty());

        results = index.search("*", new SearchFilters(DocumentCategory.PROJECT_SPEC, "proj1", false));
        assertEquals(List.of("proj1/api.md"), paths(results));

        results = index.search("get", new SearchFilters(null, "proj1/", false));
        assertEquals(List.of("proj1/notes.md", "proj1/api.md"), paths(results));
    }

    @Test
    void shouldSuppressBodiesWithoutChangingResults() {
        index.upsert(document(DocumentCategory.REFERENCE_DOC, "js/set.md", "Set Basics", "add has delete, unlike map",
                List.of()));

        List<SearchResult> without = index.search("map", SearchFilters.none());
        List<SearchResult> with = index.search("map", SearchFilters.withContent());

        assertEquals(paths(with), paths(without));
        assertTrue(without.stream().allMatch(result -> result.document().content().isEmpty()));
        assertTrue(without.stream().allMatch(result -> result.matches().isEmpty()));
        assertTrue(with.stream().noneMatch(result -> result.document().content().isEmpty()));
        assertTrue(with.stream().noneMatch(result -> result.matches().isEmpty()));
    }

    @Test
    void shouldRankTitleMatchesFirst() {
        index.upsert(document(DocumentCategory.REFERENCE_DOC, "go/aaa.md", "Aardvark", "mentions reduce once",
                List.of()));
        index.upsert(document(DocumentCategory.REFERENCE_DOC, "go/reduce.md", "Reduce Patterns", "folding values",
                List.of()));

        List<SearchResult> results = index.search("reduce", SearchFilters.none());

        assertEquals(List.of("go/reduce.md", "go/aaa.md", "js/array.md"), paths(results));
    }

    @Test
    void shouldReturnNothingForUnknownTerm() {
        assertTrue(index.search("kubernetes", SearchFilters.none()).isEmpty());
    }

    private static List<String> paths(List<SearchResult> results) {
        return results.stream().map(result -> result.document().path()).toList();
    }

    private static Document document(DocumentCategory category, String path, String title, String content,
            List<String> tags) {
        return new Document(category, path, content, DocumentMetadata.of(title, null, null, tags));
    }
}
