package com.esports.dashboard.infrastructure.query;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SearchSanitizerTest {

    @Test
    void testSanitize_EscapesWildcards() {
        assertEquals("100\\%", SearchSanitizer.sanitize("100%", 100));
        assertEquals("a\\_b", SearchSanitizer.sanitize("a_b", 100));
    }

    @Test
    void testSanitize_EscapesBackslashFirst() {
        assertEquals("a\\\\\\%", SearchSanitizer.sanitize("a\\%", 100));
    }

    @Test
    void testSanitize_TrimsAndCuts() {
        assertEquals("abc", SearchSanitizer.sanitize("  abcdef ", 3));
    }

    @Test
    void testContainsPattern() {
        assertEquals("%Caps%", SearchSanitizer.containsPattern(" Caps "));
        assertNull(SearchSanitizer.containsPattern("   "));
        assertNull(SearchSanitizer.containsPattern(null));
    }

    @Test
    void testContainsPattern_CapsLength() {
        String pattern = SearchSanitizer.containsPattern("x".repeat(500));

        assertEquals(SearchSanitizer.DEFAULT_MAX_LENGTH + 2, pattern.length());
    }
}
