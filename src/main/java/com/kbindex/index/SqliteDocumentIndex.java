package com.kbindex.index;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.kbindex.document.Document;
import com.kbindex.document.DocumentCategory;
import com.kbindex.document.DocumentMetadata;
import com.kbindex.document.Timestamps;
import com.kbindex.search.MatchHighlighter;
import com.kbindex.search.SearchFilters;
import com.kbindex.search.SearchQuery;
import com.kbindex.search.SearchResult;

public class SqliteDocumentIndex implements DocumentIndex {
    private static final Logger log = LoggerFactory.getLogger(SqliteDocumentIndex.class);

    private static final String UPSERT_DOCUMENT = """
            INSERT INTO documents (
              category, path, content, title, description, author,
              created_at, updated_at, source_modified_at, meta_json
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (category, path) DO UPDATE SET
              content = excluded.content,
              title = excluded.title,
              description = excluded.description,
              author = excluded.author,
              created_at = excluded.created_at,
              updated_at = excluded.updated_at,
              source_modified_at = excluded.source_modified_at,
              meta_json = excluded.meta_json
            """;
    private static final String SELECT_ID = "SELECT id FROM documents WHERE category = ? AND path = ?";
    private static final String SELECT_COLUMNS = """
            SELECT d.id, d.category, d.path, %s AS content, d.title, d.description, d.author,
                   d.created_at, d.updated_at, d.meta_json
            FROM documents d
            """;

    private final IndexDatabase database;
    private final MatchHighlighter highlighter;
    private final int maxResults;
    private final ObjectMapper objectMapper = JsonMapper.builder().build();

    public SqliteDocumentIndex(IndexDatabase database) {
        this(database, new MatchHighlighter(), 0);
    }

    public SqliteDocumentIndex(IndexDatabase database, MatchHighlighter highlighter, int maxResults) {
        this.database = database;
        this.highlighter = highlighter;
        this.maxResults = maxResults;
    }

    @Override
    public void upsert(Document document, Instant sourceModifiedAt) {
        DocumentMetadata metadata = document.metadata();
        String metaJson = toJson(metadata);
        Set<String> tags = new LinkedHashSet<>(metadata.tags());

        database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(UPSERT_DOCUMENT)) {
                statement.setString(1, document.category().id());
                statement.setString(2, document.path());
                statement.setString(3, document.content());
                statement.setString(4, metadata.title());
                statement.setString(5, metadata.description());
                statement.setString(6, metadata.author());
                statement.setString(7, Timestamps.format(metadata.createdAt()));
                statement.setString(8, Timestamps.format(metadata.updatedAt()));
                statement.setString(9, Timestamps.format(sourceModifiedAt));
                statement.setString(10, metaJson);
                statement.executeUpdate();
            }
            long id = findId(connection, document.category(), document.path())
                    .orElseThrow(() -> new SQLException("Upserted row not found for " + document.location()));

            replaceTags(connection, id, tags);
            replaceProjection(connection, id, document, tags);
            return null;
        });
        log.debug("Indexed {} tags={}", document.location(), tags.size());
    }

    @Override
    public boolean remove(DocumentCategory category, String path) {
        boolean removed = database.inTransaction(connection -> {
            Optional<Long> id = findId(connection, category, path);
            if (id.isEmpty()) {
                return false;
            }
            executeForId(connection, "DELETE FROM documents_fts WHERE rowid = ?", id.get());
            executeForId(connection, "DELETE FROM document_tags WHERE document_id = ?", id.get());
            executeForId(connection, "DELETE FROM documents WHERE id = ?", id.get());
            return true;
        });
        log.debug("Remove {}://{} removed={}", category.id(), path, removed);
        return removed;
    }

    @Override
    public Map<DocumentKey, IndexEntry> metadataSnapshot() {
        return database.query(connection -> {
            Map<DocumentKey, IndexEntry> snapshot = new HashMap<>();
            try (Statement statement = connection.createStatement();
                    ResultSet rs = statement.executeQuery(
                            "SELECT id, category, path, updated_at, source_modified_at FROM documents")) {
                while (rs.next()) {
                    DocumentCategory category = categoryOrNull(rs.getString("category"));
                    if (category == null) {
                        continue;
                    }
                    Instant updatedAt = Timestamps.latest(
                            Timestamps.parse(rs.getString("updated_at")).orElse(null),
                            Timestamps.parse(rs.getString("source_modified_at")).orElse(null));
                    snapshot.put(new DocumentKey(category, rs.getString("path")), new IndexEntry(rs.getLong("id"), updatedAt));
                }
            }
            return snapshot;
        });
    }

    @Override
    public long count() {
        return database.query(connection -> {
            try (Statement statement = connection.createStatement();
                    ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM documents")) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    @Override
    public List<SearchResult> search(String query, SearchFilters filters) {
        SearchFilters effective = filters == null ? SearchFilters.none() : filters;
        SearchQuery parsed = SearchQuery.parse(query);
        log.debug("Search query=\"{}\" terms={} filters={}", parsed.raw(), parsed.terms(), effective);

        List<SearchResult> results = parsed.isWildcard()
                ? wildcardSearch(effective)
                : termSearch(parsed, effective);
        if (maxResults > 0 && results.size() > maxResults) {
            results = results.subList(0, maxResults);
        }
        log.debug("Search found {} matching documents", results.size());
        return results;
    }

    private List<SearchResult> wildcardSearch(SearchFilters filters) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder(selectColumns(filters.includeContent()));
        List<String> conditions = filterConditions(filters, params);
        appendWhere(sql, conditions);
        sql.append(" ORDER BY d.title, d.path");

        return database.query(connection -> readDocuments(connection, sql.toString(), params)).stream()
                .map(document -> new SearchResult(document, List.of()))
                .toList();
    }

    private List<SearchResult> termSearch(SearchQuery query, SearchFilters filters) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder(selectColumns(filters.includeContent()))
                .append(" JOIN documents_fts f ON f.rowid = d.id");
        List<String> conditions = filterConditions(filters, params);
        for (String term : query.terms()) {
            conditions.add("(" + contains("f.content") + " OR " + contains("f.title") + " OR "
                    + contains("f.description") + " OR " + contains("f.tags") + ")");
            params.add(term);
            params.add(term);
            params.add(term);
            params.add(term);
        }
        appendWhere(sql, conditions);
        sql.append(" ORDER BY d.title, d.path");

        List<Document> documents = database.query(connection -> readDocuments(connection, sql.toString(), params));
        return documents.stream()
                .sorted(Comparator.comparing((Document document) -> !query.matchesAnyTerm(document.metadata().title()))
                        .thenComparing(document -> document.metadata().title())
                        .thenComparing(Document::path))
                .map(document -> new SearchResult(document,
                        filters.includeContent() ? highlighter.excerpts(document, query) : List.of()))
                .toList();
    }

    private static String selectColumns(boolean includeContent) {
        return SELECT_COLUMNS.formatted(includeContent ? "d.content" : "''");
    }

    private static String contains(String column) {
        return IndexDatabase.CONTAINS_FUNCTION + "(" + column + ", ?) = 1";
    }

    private static List<String> filterConditions(SearchFilters filters, List<Object> params) {
        List<String> conditions = new ArrayList<>();
        if (filters.category() != null) {
            conditions.add("d.category = ?");
            params.add(filters.category().id());
        }
        String prefix = filters.pathPrefix();
        if (prefix != null) {
            conditions.add("substr(d.path, 1, ?) = ?");
            params.add(prefix.codePointCount(0, prefix.length()));
            params.add(prefix);
        }
        return conditions;
    }

    private static void appendWhere(StringBuilder sql, List<String> conditions) {
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
    }

    private List<Document> readDocuments(Connection connection, String sql, List<Object> params) throws SQLException {
        List<Document> documents = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                statement.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    DocumentCategory category = categoryOrNull(rs.getString("category"));
                    if (category == null) {
                        continue;
                    }
                    DocumentMetadata metadata = fromJson(rs.getString("meta_json"), rs.getString("path"));
                    documents.add(new Document(category, rs.getString("path"), rs.getString("content"), metadata));
                }
            }
        }
        return documents;
    }

    private static Optional<Long> findId(Connection connection, DocumentCategory category, String path) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(SELECT_ID)) {
            statement.setString(1, category.id());
            statement.setString(2, path);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        }
    }

    private static void replaceTags(Connection connection, long id, Set<String> tags) throws SQLException {
        executeForId(connection, "DELETE FROM document_tags WHERE document_id = ?", id);
        if (tags.isEmpty()) {
            return;
        }
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO document_tags (document_id, position, tag) VALUES (?, ?, ?)")) {
            int position = 0;
            for (String tag : tags) {
                statement.setLong(1, id);
                statement.setInt(2, position++);
                statement.setString(3, tag);
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private static void replaceProjection(Connection connection, long id, Document document, Set<String> tags)
            throws SQLException {
        executeForId(connection, "DELETE FROM documents_fts WHERE rowid = ?", id);
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO documents_fts (rowid, content, title, description, tags) VALUES (?, ?, ?, ?, ?)")) {
            statement.setLong(1, id);
            statement.setString(2, document.content());
            statement.setString(3, document.metadata().title());
            statement.setString(4, document.metadata().description() == null ? "" : document.metadata().description());
            statement.setString(5, String.join(" ", tags));
            statement.executeUpdate();
        }
    }

    private static void executeForId(Connection connection, String sql, long id) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, id);
            statement.executeUpdate();
        }
    }

    private static DocumentCategory categoryOrNull(String id) {
        try {
            return DocumentCategory.fromId(id);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring index row with unknown category {}", id);
            return null;
        }
    }

    private String toJson(DocumentMetadata metadata) {
        try {
            return objectMapper.writeValueAsString(metadata.toMap());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }

    private DocumentMetadata fromJson(String json, String path) throws SQLException {
        try {
            Map<String, Object> values = objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {
            });
            return DocumentMetadata.fromMap(values);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt metadata for indexed document " + path + ": " + e.getOriginalMessage(), e);
        }
    }
}
