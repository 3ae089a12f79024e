package com.kbindex.search;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public record SearchQuery(String raw, List<String> terms) {
    public static final String WILDCARD = "*";

    public SearchQuery {
        terms = List.copyOf(terms);
    }

    public static SearchQuery parse(String query) {
        String raw = query == null ? "" : query.strip();
        if (raw.isEmpty() || WILDCARD.equals(raw)) {
            return new SearchQuery(raw, List.of());
        }
        List<String> terms = Arrays.stream(raw.toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(term -> !term.isEmpty())
                .distinct()
                .toList();
        return new SearchQuery(raw, terms);
    }

    public boolean isWildcard() {
        return terms.isEmpty();
    }

    public boolean matchesAnyTerm(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return terms.stream().anyMatch(lower::contains);
    }
}
