package com.kbindex.index;

import java.util.List;

public record ScanReport(int indexed, int skipped, int failed, List<ScanError> errors, long durationMs) {

    public ScanReport {
        errors = List.copyOf(errors);
    }

    public int total() {
        return indexed + skipped + failed;
    }
}
