package com.kbindex.search;

import java.util.List;
import java.util.stream.Collectors;

import com.kbindex.document.Document;
import com.kbindex.document.DocumentMetadata;

public class SearchResultFormatter {

    public String format(String query, List<SearchResult> results, boolean includeContent) {
        if (results.isEmpty()) {
            return "No results found for query: " + query;
        }
        String body = results.stream()
                .map(result -> formatResult(result, includeContent))
                .collect(Collectors.joining("\n\n---\n\n"));
        return "Found %d results for \"%s\":\n\n%s".formatted(results.size(), query, body);
    }

    String formatResult(SearchResult result, boolean includeContent) {
        Document document = result.document();
        DocumentMetadata metadata = document.metadata();
        StringBuilder output = new StringBuilder()
                .append("## ").append(metadata.title()).append('\n')
                .append("**Path:** ").append(document.location()).append('\n');
        if (metadata.description() != null && !metadata.description().isBlank()) {
            output.append("**Description:** ").append(metadata.description()).append('\n');
        }
        if (!metadata.tags().isEmpty()) {
            output.append("**Tags:** ").append(String.join(", ", metadata.tags())).append('\n');
        }
        if (!result.matches().isEmpty()) {
            output.append("\n**Matches:**\n");
            output.append(result.matches().stream().map(match -> "> " + match).collect(Collectors.joining("\n")));
            output.append('\n');
        }
        if (includeContent && !document.content().isEmpty()) {
            output.append("\n**Content:**\n").append(document.content());
        }
        return output.toString().stripTrailing();
    }
}
