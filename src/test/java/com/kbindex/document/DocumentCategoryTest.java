package com.kbindex.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class DocumentCategoryTest {

    @Test
    void shouldResolveIdsAndAliases() {
        assertEquals(DocumentCategory.REFERENCE_DOC, DocumentCategory.fromId("stdlib"));
        assertEquals(DocumentCategory.REFERENCE_DOC, DocumentCategory.fromId("reference-doc"));
        assertEquals(DocumentCategory.PROJECT_SPEC, DocumentCategory.fromId(" SPEC "));
        assertEquals(DocumentCategory.PROJECT_SPEC, DocumentCategory.fromId("project_spec"));
        assertEquals("specs", DocumentCategory.PROJECT_SPEC.directoryName());
    }

    @Test
    void shouldRejectUnknownCategory() {
        assertThrows(IllegalArgumentException.class, () -> DocumentCategory.fromId("notes"));
        assertThrows(IllegalArgumentException.class, () -> DocumentCategory.fromId(""));
    }
}
