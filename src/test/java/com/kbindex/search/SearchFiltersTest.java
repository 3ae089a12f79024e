package com.kbindex.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class SearchFiltersTest {

    @Test
    void shouldNormalizeSubcategoryPrefix() {
        assertEquals("proj1/", new SearchFilters(null, " proj1// ", false).pathPrefix());
        assertEquals("python/builtins/", new SearchFilters(null, "python/builtins", false).pathPrefix());
        assertNull(new SearchFilters(null, "  ", false).subcategoryPrefix());
        assertNull(new SearchFilters(null, "/", false).pathPrefix());
    }
}
