package com.kbindex;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.kbindex.document.Document;
import com.kbindex.document.DocumentCategory;
import com.kbindex.document.DocumentMetadata;
import com.kbindex.document.FileSystemDocumentStore;
import com.kbindex.index.IndexDatabase;
import com.kbindex.index.IndexStorageException;
import com.kbindex.index.ReconciliationScanner;
import com.kbindex.index.ScanError;
import com.kbindex.index.ScanInterruptedException;
import com.kbindex.index.ScanReport;
import com.kbindex.index.SqliteDocumentIndex;
import com.kbindex.runtime.AppConfig;
import com.kbindex.search.MatchHighlighter;
import com.kbindex.search.SearchFilters;
import com.kbindex.search.SearchResult;
import com.kbindex.search.SearchResultFormatter;
import com.kbindex.service.DocumentService;
import com.kbindex.service.DocumentUpdate;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "kb-index",
        mixinStandardHelpOptions = true,
        version = "kb-index 0.1.0",
        description = "Indexes and searches a markdown knowledge base of reference docs and project specs.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE_ERROR = 2;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "application.yml")
    String configPath;

    @Option(names = "--mode", description = "Operation: ${COMPLETION-CANDIDATES}", defaultValue = "search")
    Mode mode;

    @Option(names = "--store-root", description = "Document store root directory (overrides store.root)")
    Path storeRoot;

    @Option(names = "--index-path", description = "SQLite index file (overrides index.path)")
    Path indexPath;

    @Option(names = "--no-startup-scan", description = "Skip the reconciliation scan before running the mode")
    boolean noStartupScan;

    @Option(names = { "-q", "--query" }, description = "Search query; '*' or empty lists everything matching the filters")
    String query;

    @Option(names = "--category", description = "Document category: stdlib or spec")
    String category;

    @Option(names = "--subcategory", description = "Language (stdlib) or project (spec)")
    String subcategory;

    @Option(names = "--include-content", description = "Include document bodies and match excerpts in search output")
    boolean includeContent;

    @Option(names = "--path", description = "Document path within its category, e.g. javascript/array-methods.md")
    String path;

    @Option(names = "--name", description = "File name of a new document within its subcategory")
    String name;

    @Option(names = "--title", description = "Document title")
    String title;

    @Option(names = "--description", description = "Document description")
    String description;

    @Option(names = "--author", description = "Document author")
    String author;

    @Option(names = "--tag", description = "Document tag (repeatable)")
    List<String> tags;

    @Option(names = "--content", description = "Document body (markdown)")
    String content;

    @Option(names = "--content-file", description = "Read the document body from this file")
    Path contentFile;

    private final PrintStream out;
    private final SearchResultFormatter formatter = new SearchResultFormatter();

    enum Mode {
        scan,
        search,
        get,
        list,
        create,
        update,
        remove
    }

    public Main() {
        this(System.out);
    }

    Main(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        AppConfig config;
        try {
            config = loadConfig(Path.of(configPath));
        } catch (IOException e) {
            log.error("Unable to read config file {}: {}", configPath, e.getMessage());
            return EXIT_USAGE_ERROR;
        }
        applyOverrides(config);

        log.info("Starting kb-index in {} mode", mode);
        log.info("Using config file: {}", configPath);

        FileSystemDocumentStore store = new FileSystemDocumentStore(Path.of(config.getStore().getRoot()));
        try (IndexDatabase database = new IndexDatabase(config.getIndex())) {
            database.initialize();
            if (config.getStore().isCreateStructure()) {
                store.ensureStructure();
            }
            SqliteDocumentIndex index = new SqliteDocumentIndex(
                    database, new MatchHighlighter(), config.getSearch().getMaxResults());
            ReconciliationScanner scanner = new ReconciliationScanner(store, index, config.getScan().getParallelism());
            DocumentService documents = new DocumentService(store, index);
            log.info("Document store at {}, index at {} with {} documents",
                    store.root(), database.databasePath(), index.count());

            if (mode != Mode.scan && config.getScan().isOnStartup()) {
                scanner.scan();
            }
            return switch (mode) {
                case scan -> runScan(scanner);
                case search -> runSearch(index);
                case get -> runGet(documents);
                case list -> runList(documents);
                case create -> runCreate(documents);
                case update -> runUpdate(documents);
                case remove -> runRemove(documents);
            };
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error(e.getMessage());
            return EXIT_USAGE_ERROR;
        } catch (IOException | IndexStorageException | ScanInterruptedException e) {
            log.error("{} failed", mode, e);
            return EXIT_FAILURE;
        }
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }

    private void applyOverrides(AppConfig config) {
        if (storeRoot != null) {
            config.getStore().setRoot(storeRoot.toString());
        }
        if (indexPath != null) {
            config.getIndex().setPath(indexPath.toString());
        }
        if (noStartupScan) {
            config.getScan().setOnStartup(false);
        }
    }

    private int runScan(ReconciliationScanner scanner) {
        ScanReport report = scanner.scan();
        out.printf("Document scan complete. Indexed: %d, Skipped: %d, Failed: %d%n",
                report.indexed(), report.skipped(), report.failed());
        for (ScanError error : report.errors()) {
            out.println("  " + error);
        }
        return EXIT_OK;
    }

    private int runSearch(SqliteDocumentIndex index) {
        String effectiveQuery = query == null ? "" : query;
        SearchFilters filters = new SearchFilters(optionalCategory().orElse(null), subcategory, includeContent);
        List<SearchResult> results = index.search(effectiveQuery, filters);
        out.println(formatter.format(effectiveQuery, results, includeContent));
        return EXIT_OK;
    }

    private int runGet(DocumentService documents) throws IOException {
        DocumentCategory documentCategory = requiredCategory();
        String documentPath = required(path, "--path");
        Optional<Document> document = documents.get(documentCategory, documentPath);
        if (document.isEmpty()) {
            log.error("Document not found: {}://{}", documentCategory.id(), documentPath);
            return EXIT_FAILURE;
        }
        out.println("# " + document.get().metadata().title());
        out.println();
        out.println(document.get().content());
        return EXIT_OK;
    }

    private int runList(DocumentService documents) throws IOException {
        Optional<DocumentCategory> documentCategory = optionalCategory();
        if (documentCategory.isEmpty()) {
            for (DocumentCategory each : DocumentCategory.values()) {
                out.println(each.id() + ": " + String.join(", ", documents.listSubcategories(each)));
            }
            return EXIT_OK;
        }
        List<String> entries = subcategory == null || subcategory.isBlank()
                ? documents.listSubcategories(documentCategory.get())
                : documents.list(documentCategory.get(), subcategory);
        entries.forEach(out::println);
        return EXIT_OK;
    }

    private int runCreate(DocumentService documents) throws IOException {
        DocumentCategory documentCategory = requiredCategory();
        String body = resolveContent();
        if (body == null) {
            throw new IllegalArgumentException("--content or --content-file is required in create mode");
        }
        DocumentMetadata metadata = DocumentMetadata.of(required(title, "--title"), description, author, tags);
        Document created = documents.create(documentCategory, subcategory, required(name, "--name"), body, metadata);
        out.println("Document created successfully at " + created.location());
        return EXIT_OK;
    }

    private int runUpdate(DocumentService documents) throws IOException {
        DocumentCategory documentCategory = requiredCategory();
        DocumentUpdate update = new DocumentUpdate(resolveContent(), title, description, author, tags);
        Document updated = documents.update(documentCategory, required(path, "--path"), update);
        out.println("Document updated successfully at " + updated.location());
        return EXIT_OK;
    }

    private int runRemove(DocumentService documents) {
        DocumentCategory documentCategory = requiredCategory();
        String documentPath = required(path, "--path");
        boolean removed = documents.remove(documentCategory, documentPath);
        out.println(removed
                ? "Removed " + documentCategory.id() + "://" + documentPath + " from the index"
                : "Not indexed: " + documentCategory.id() + "://" + documentPath);
        return EXIT_OK;
    }

    private String resolveContent() throws IOException {
        if (contentFile != null) {
            return Files.readString(contentFile);
        }
        return content;
    }

    private Optional<DocumentCategory> optionalCategory() {
        return category == null || category.isBlank()
                ? Optional.empty()
                : Optional.of(DocumentCategory.fromId(category));
    }

    private DocumentCategory requiredCategory() {
        return optionalCategory()
                .orElseThrow(() -> new IllegalArgumentException("--category is required in " + mode + " mode"));
    }

    private String required(String value, String option) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(option + " is required in " + mode + " mode");
        }
        return value;
    }
}
