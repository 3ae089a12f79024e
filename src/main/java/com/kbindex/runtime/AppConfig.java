package com.kbindex.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StoreConfig store = new StoreConfig();
    private IndexConfig index = new IndexConfig();
    private ScanConfig scan = new ScanConfig();
    private SearchConfig search = new SearchConfig();

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    public ScanConfig getScan() {
        return scan;
    }

    public void setScan(ScanConfig scan) {
        this.scan = scan == null ? new ScanConfig() : scan;
    }

    public SearchConfig getSearch() {
        return search;
    }

    public void setSearch(SearchConfig search) {
        this.search = search == null ? new SearchConfig() : search;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String root = "kb";
        private boolean createStructure = true;

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public boolean isCreateStructure() {
            return createStructure;
        }

        public void setCreateStructure(boolean createStructure) {
            this.createStructure = createStructure;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private String path = ".kbindex/document-index.db";
        private String journalMode = "WAL";
        private String synchronous = "NORMAL";
        private int busyTimeoutMs = 5000;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getJournalMode() {
            return journalMode;
        }

        public void setJournalMode(String journalMode) {
            this.journalMode = journalMode;
        }

        public String getSynchronous() {
            return synchronous;
        }

        public void setSynchronous(String synchronous) {
            this.synchronous = synchronous;
        }

        public int getBusyTimeoutMs() {
            return busyTimeoutMs;
        }

        public void setBusyTimeoutMs(int busyTimeoutMs) {
            this.busyTimeoutMs = busyTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScanConfig {
        private boolean onStartup = true;
        private int parallelism = 1;

        public boolean isOnStartup() {
            return onStartup;
        }

        public void setOnStartup(boolean onStartup) {
            this.onStartup = onStartup;
        }

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchConfig {
        private int maxResults = 0;

        public int getMaxResults() {
            return maxResults;
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = maxResults;
        }
    }
}
