package com.kbindex.document;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

public class FrontmatterCodec {
    private static final Pattern FRONTMATTER = Pattern.compile(
            "\\A\\uFEFF?---[ \\t]*\\r?\\n(.*?)^---[ \\t]*(?:\\r?\\n|\\z)",
            Pattern.MULTILINE | Pattern.DOTALL);

    private final ObjectMapper yamlMapper = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .build());

    public Parsed parse(String markdown) throws IOException {
        String text = markdown == null ? "" : markdown;
        Matcher matcher = FRONTMATTER.matcher(text);
        if (!matcher.find()) {
            return new Parsed(DocumentMetadata.untitled(), text);
        }
        String yaml = matcher.group(1);
        String body = text.substring(matcher.end());
        if (yaml.isBlank()) {
            return new Parsed(DocumentMetadata.untitled(), body);
        }
        Map<String, Object> values = yamlMapper.readValue(yaml, new TypeReference<LinkedHashMap<String, Object>>() {
        });
        return new Parsed(DocumentMetadata.fromMap(values), body);
    }

    public String render(DocumentMetadata metadata, String content) throws IOException {
        String yaml = yamlMapper.writeValueAsString(metadata.toMap());
        StringBuilder builder = new StringBuilder()
                .append("---\n")
                .append(yaml);
        if (!yaml.endsWith("\n")) {
            builder.append('\n');
        }
        builder.append("---\n");
        if (content != null) {
            builder.append(content);
        }
        return builder.toString();
    }

    public record Parsed(DocumentMetadata metadata, String body) {
    }
}
