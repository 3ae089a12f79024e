package com.kbindex.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.kbindex.document.Document;

public class MatchHighlighter {
    static final String MARKER = "**";

    public List<String> excerpts(Document document, SearchQuery query) {
        if (query.isWildcard()) {
            return List.of();
        }
        Pattern pattern = termPattern(query);
        List<String> excerpts = new ArrayList<>();

        String line = firstMatchingLine(document.content(), query);
        if (line != null) {
            excerpts.add(highlight(line.strip(), pattern));
        }
        String title = document.metadata().title();
        if (query.matchesAnyTerm(title)) {
            excerpts.add("Title: " + highlight(title, pattern));
        }
        String description = document.metadata().description();
        if (query.matchesAnyTerm(description)) {
            excerpts.add("Description: " + highlight(description, pattern));
        }
        return excerpts;
    }

    String highlight(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        return matcher.replaceAll(result -> Matcher.quoteReplacement(MARKER + result.group() + MARKER));
    }

    private static String firstMatchingLine(String content, SearchQuery query) {
        if (content == null || content.isEmpty()) {
            return null;
        }
        return content.lines()
                .filter(query::matchesAnyTerm)
                .findFirst()
                .orElse(null);
    }

    static Pattern termPattern(SearchQuery query) {
        String alternation = query.terms().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile(alternation, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
