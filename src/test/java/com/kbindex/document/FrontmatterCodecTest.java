package com.kbindex.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class FrontmatterCodecTest {

    private final FrontmatterCodec codec = new FrontmatterCodec();

    @Test
    void shouldSplitFrontmatterFromBody() throws Exception {
        FrontmatterCodec.Parsed parsed = codec.parse("""
                ---
                title: Array Methods
                description: Iterating over arrays
                author: docs-team
                tags:
                  - arrays
                  - iteration
                createdAt: 2024-01-15T10:00:00Z
                difficulty: beginner
                ---
                # Arrays
                Use map and filter.
                """);

        DocumentMetadata metadata = parsed.metadata();
        assertEquals("Array Methods", metadata.title());
        assertEquals("Iterating over arrays", metadata.description());
        assertEquals("docs-team", metadata.author());
        assertEquals(List.of("arrays", "iteration"), metadata.tags());
        assertEquals(Instant.parse("2024-01-15T10:00:00Z"), metadata.createdAt());
        assertNull(metadata.updatedAt());
        assertEquals(Map.of("difficulty", "beginner"), metadata.extras());
        assertEquals("# Arrays\nUse map and filter.\n", parsed.body());
    }

    @Test
    void shouldTreatMissingFrontmatterAsUntitled() throws Exception {
        String markdown = "# Just a body\n\n---\nnot frontmatter\n";

        FrontmatterCodec.Parsed parsed = codec.parse(markdown);

        assertEquals(DocumentMetadata.DEFAULT_TITLE, parsed.metadata().title());
        assertTrue(parsed.metadata().tags().isEmpty());
        assertEquals(markdown, parsed.body());
    }

    @Test
    void shouldAcceptEmptyFrontmatterBlock() throws Exception {
        FrontmatterCodec.Parsed parsed = codec.parse("---\n---\nbody\n");

        assertEquals(DocumentMetadata.DEFAULT_TITLE, parsed.metadata().title());
        assertEquals("body\n", parsed.body());
    }

    @Test
    void shouldRenderMetadataThatParsesBackUnchanged() throws Exception {
        DocumentMetadata metadata = new DocumentMetadata(
                "List Operations",
                "Appending to python lists",
                null,
                List.of("python", "lists"),
                Instant.parse("2024-03-01T08:30:00Z"),
                Instant.parse("2024-03-02T09:45:00Z"),
                Map.of("level", "intermediate"));

        String markdown = codec.render(metadata, "Use append and extend.\n");
        FrontmatterCodec.Parsed parsed = codec.parse(markdown);

        assertTrue(markdown.startsWith("---\ntitle: List Operations\n"));
        assertEquals(metadata, parsed.metadata());
        assertEquals("Use append and extend.\n", parsed.body());
    }
}
