package com.kbindex.document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FileSystemDocumentStore implements DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(FileSystemDocumentStore.class);
    private static final String DOCUMENT_EXTENSION = ".md";

    private final Path root;
    private final FrontmatterCodec codec;

    public FileSystemDocumentStore(Path root) {
        this(root, new FrontmatterCodec());
    }

    public FileSystemDocumentStore(Path root, FrontmatterCodec codec) {
        this.root = root.toAbsolutePath().normalize();
        this.codec = codec;
    }

    public Path root() {
        return root;
    }

    @Override
    public List<String> list(DocumentCategory category, String subpath) throws IOException {
        Path categoryRoot = categoryRoot(category);
        if (!Files.isDirectory(categoryRoot)) {
            throw new NoSuchFileException(categoryRoot.toString(), null, "category directory is missing");
        }
        Path start = subpath == null || subpath.isBlank() ? categoryRoot : resolve(category, subpath);
        if (!Files.isDirectory(start)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(start)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(DOCUMENT_EXTENSION))
                    .map(file -> toRelative(categoryRoot, file))
                    .sorted()
                    .toList();
        }
    }

    @Override
    public Optional<Document> read(DocumentCategory category, String path) throws IOException {
        Path file = resolve(category, path);
        String markdown;
        try {
            markdown = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
        FrontmatterCodec.Parsed parsed = codec.parse(markdown);
        return Optional.of(new Document(category, normalizePath(path), parsed.body(), parsed.metadata()));
    }

    @Override
    public Instant lastModified(DocumentCategory category, String path) throws IOException {
        return Files.getLastModifiedTime(resolve(category, path)).toInstant();
    }

    @Override
    public void write(Document document) throws IOException {
        Path file = resolve(document.category(), document.path());
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        Files.writeString(file, codec.render(document.metadata(), document.content()), StandardCharsets.UTF_8);
        log.debug("Wrote document {}", document.location());
    }

    @Override
    public List<String> listSubcategories(DocumentCategory category) throws IOException {
        Path categoryRoot = categoryRoot(category);
        if (!Files.isDirectory(categoryRoot)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(categoryRoot)) {
            return entries
                    .filter(Files::isDirectory)
                    .map(entry -> entry.getFileName().toString())
                    .sorted()
                    .toList();
        }
    }

    @Override
    public void ensureStructure() throws IOException {
        for (DocumentCategory category : DocumentCategory.values()) {
            Files.createDirectories(categoryRoot(category));
        }
    }

    Path resolve(DocumentCategory category, String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Document path must not be blank");
        }
        Path categoryRoot = categoryRoot(category);
        Path resolved = categoryRoot.resolve(normalizePath(path)).normalize();
        if (!resolved.startsWith(categoryRoot) || resolved.equals(categoryRoot)) {
            throw new IllegalArgumentException("Document path escapes the " + category.id() + " directory: " + path);
        }
        return resolved;
    }

    private Path categoryRoot(DocumentCategory category) {
        return root.resolve(category.directoryName());
    }

    private static String toRelative(Path categoryRoot, Path file) {
        return categoryRoot.relativize(file).toString().replace('\\', '/');
    }

    private static String normalizePath(String path) {
        String normalized = path.strip().replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        return normalized;
    }
}
