package com.kbindex.index;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbindex.document.Document;
import com.kbindex.document.DocumentCategory;
import com.kbindex.document.DocumentStore;

public class ReconciliationScanner {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationScanner.class);

    private final DocumentStore store;
    private final DocumentIndex index;
    private final int parallelism;

    public ReconciliationScanner(DocumentStore store, DocumentIndex index) {
        this(store, index, 1);
    }

    public ReconciliationScanner(DocumentStore store, DocumentIndex index, int parallelism) {
        this.store = store;
        this.index = index;
        this.parallelism = Math.max(1, parallelism);
    }

    public ScanReport scan() {
        long start = System.nanoTime();
        log.info("Starting document scan parallelism={}", parallelism);

        Map<DocumentKey, IndexEntry> existing = index.metadataSnapshot();
        log.info("Found {} documents in index", existing.size());

        Tally tally = new Tally();
        for (DocumentCategory category : DocumentCategory.values()) {
            List<String> paths;
            try {
                paths = store.list(category, null);
            } catch (IOException | RuntimeException e) {
                tally.fail(new ScanError(category, null, "Unable to list documents: " + describe(e)));
                log.error("Error listing {} documents: {}", category.id(), describe(e));
                continue;
            }
            log.info("Found {} {} documents to scan", paths.size(), category.id());
            if (parallelism > 1 && paths.size() > 1) {
                reconcileInParallel(category, paths, existing, tally);
            } else {
                for (String path : paths) {
                    reconcile(category, path, existing, tally);
                }
            }
        }

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        ScanReport report = tally.toReport(durationMs);
        log.info("Document scan complete indexed={} skipped={} failed={} durationMs={}",
                report.indexed(), report.skipped(), report.failed(), durationMs);
        return report;
    }

    private void reconcile(DocumentCategory category, String path, Map<DocumentKey, IndexEntry> existing, Tally tally) {
        DocumentKey key = new DocumentKey(category, path);
        try {
            Instant modified = store.lastModified(category, path);
            IndexEntry entry = existing.get(key);
            if (entry != null && entry.isCurrentAsOf(modified)) {
                tally.skipped.incrementAndGet();
                log.debug("Skipped unchanged document {} (index: {}, file: {})", key, entry.updatedAt(), modified);
                return;
            }

            Optional<Document> document = store.read(category, path);
            if (document.isEmpty()) {
                tally.fail(new ScanError(category, path, "Document not found"));
                log.error("Failed to read document {}", key);
                return;
            }
            index.upsert(document.get(), modified);
            tally.indexed.incrementAndGet();
            log.debug("Indexed document {} ({})", key, entry == null ? "new" : "updated");
        } catch (IOException | RuntimeException e) {
            tally.fail(new ScanError(category, path, describe(e)));
            log.error("Error processing document {}: {}", key, describe(e));
        }
    }

    private void reconcileInParallel(DocumentCategory category, List<String> paths,
            Map<DocumentKey, IndexEntry> existing, Tally tally) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, paths.size()));
        try {
            for (String path : paths) {
                executor.submit(() -> reconcile(category, path, existing, tally));
            }
            executor.shutdown();
            while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                log.info("Still scanning {} documents...", category.id());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanInterruptedException("Document scan interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() == null || e.getMessage().isBlank() ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static final class Tally {
        private final AtomicInteger indexed = new AtomicInteger();
        private final AtomicInteger skipped = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final List<ScanError> errors = Collections.synchronizedList(new ArrayList<>());

        private void fail(ScanError error) {
            failed.incrementAndGet();
            errors.add(error);
        }

        private ScanReport toReport(long durationMs) {
            synchronized (errors) {
                return new ScanReport(indexed.get(), skipped.get(), failed.get(), new ArrayList<>(errors), durationMs);
            }
        }
    }
}
