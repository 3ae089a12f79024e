package com.kbindex.index;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.Function;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import com.kbindex.runtime.AppConfig;

public class IndexDatabase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IndexDatabase.class);
    private static final String SCHEMA_RESOURCE = "/db/schema.sql";

    static final String CONTAINS_FUNCTION = "kb_contains";

    private final Path databasePath;
    private final AppConfig.IndexConfig config;
    private SQLiteDataSource dataSource;
    private Connection anchor;

    public IndexDatabase(AppConfig.IndexConfig config) {
        this(Path.of(config.getPath()), config);
    }

    public IndexDatabase(Path databasePath, AppConfig.IndexConfig config) {
        this.databasePath = databasePath.toAbsolutePath().normalize();
        this.config = config;
    }

    public Path databasePath() {
        return databasePath;
    }

    public synchronized void initialize() {
        if (anchor != null) {
            return;
        }
        try {
            if (databasePath.getParent() != null) {
                Files.createDirectories(databasePath.getParent());
            }
        } catch (IOException e) {
            throw new IndexStorageException("Unable to create index directory for " + databasePath, e);
        }

        SQLiteDataSource source = new SQLiteDataSource(sqliteConfig());
        source.setUrl("jdbc:sqlite:" + databasePath);
        Connection connection = null;
        try {
            connection = source.getConnection();
            applySchema(connection);
        } catch (SQLException | IOException e) {
            closeAfterFailure(connection, e);
            throw new IndexStorageException("Unable to initialize document index at " + databasePath, e);
        }
        this.dataSource = source;
        this.anchor = connection;
        log.info("Document index ready at {} journalMode={} synchronous={}",
                databasePath, config.getJournalMode(), config.getSynchronous());
    }

    public synchronized boolean isInitialized() {
        return anchor != null;
    }

    public <T> T inTransaction(SqlWork<T> work) {
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try {
                T result = work.execute(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackAfterFailure(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new IndexStorageException("Index write failed: " + e.getMessage(), e);
        }
    }

    public <T> T query(SqlWork<T> work) {
        try (Connection connection = openConnection()) {
            return work.execute(connection);
        } catch (SQLException e) {
            throw new IndexStorageException("Index query failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (anchor == null) {
            return;
        }
        try {
            anchor.close();
            log.debug("Document index closed at {}", databasePath);
        } catch (SQLException e) {
            throw new IndexStorageException("Unable to close document index at " + databasePath, e);
        } finally {
            anchor = null;
            dataSource = null;
        }
    }

    private Connection openConnection() throws SQLException {
        SQLiteDataSource source;
        synchronized (this) {
            if (dataSource == null) {
                throw new IllegalStateException("Document index is not initialized. Call initialize() first.");
            }
            source = dataSource;
        }
        Connection connection = source.getConnection();
        try {
            Function.create(connection, CONTAINS_FUNCTION, new ContainsTermFunction());
        } catch (SQLException e) {
            closeAfterFailure(connection, e);
            throw e;
        }
        return connection;
    }

    private SQLiteConfig sqliteConfig() {
        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.setJournalMode(SQLiteConfig.JournalMode.valueOf(config.getJournalMode().toUpperCase(Locale.ROOT)));
        sqliteConfig.setSynchronous(SQLiteConfig.SynchronousMode.valueOf(config.getSynchronous().toUpperCase(Locale.ROOT)));
        sqliteConfig.enforceForeignKeys(true);
        sqliteConfig.setBusyTimeout(config.getBusyTimeoutMs());
        sqliteConfig.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return sqliteConfig;
    }

    private void applySchema(Connection connection) throws SQLException, IOException {
        try (Statement statement = connection.createStatement()) {
            for (String sql : schemaStatements()) {
                statement.execute(sql);
            }
        }
    }

    static List<String> schemaStatements() throws IOException {
        String script;
        try (InputStream in = IndexDatabase.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IOException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        String withoutComments = script.lines()
                .filter(line -> !line.strip().startsWith("--"))
                .collect(Collectors.joining("\n"));
        return Arrays.stream(withoutComments.split(";\\s*(?:\\n|$)"))
                .map(String::strip)
                .filter(sql -> !sql.isEmpty())
                .toList();
    }

    private static void rollbackAfterFailure(Connection connection, Exception failure) {
        try {
            connection.rollback();
        } catch (SQLException rollbackError) {
            failure.addSuppressed(rollbackError);
        }
    }

    private static void closeAfterFailure(Connection connection, Exception failure) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException closeError) {
            failure.addSuppressed(closeError);
        }
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection connection) throws SQLException;
    }

    private static final class ContainsTermFunction extends Function {
        @Override
        protected void xFunc() throws SQLException {
            if (args() != 2) {
                throw new SQLException(CONTAINS_FUNCTION + " expects 2 arguments, got " + args());
            }
            String text = value_text(0);
            String term = value_text(1);
            boolean contains = text != null && term != null && text.toLowerCase(Locale.ROOT).contains(term);
            result(contains ? 1 : 0);
        }
    }
}
