package com.kbindex.search;

import com.kbindex.document.DocumentCategory;

public record SearchFilters(DocumentCategory category, String subcategoryPrefix, boolean includeContent) {

    public SearchFilters {
        if (subcategoryPrefix != null) {
            String trimmed = subcategoryPrefix.strip();
            while (trimmed.endsWith("/")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            subcategoryPrefix = trimmed.isEmpty() ? null : trimmed;
        }
    }

    public static SearchFilters none() {
        return new SearchFilters(null, null, false);
    }

    public static SearchFilters withContent() {
        return new SearchFilters(null, null, true);
    }

    public String pathPrefix() {
        return subcategoryPrefix == null ? null : subcategoryPrefix + "/";
    }
}
