package com.bountyscope.core.scope;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScopeMatcherTest {

    private final ScopeMatcher matcher = new ScopeMatcher();

    @Nested
    @DisplayName("matches")
    class Matches {

        @Test
        @DisplayName("exact pattern matches only the identical target")
        void exact() {
            assertTrue(matcher.matches("api.example.com", "api.example.com"));
            assertFalse(matcher.matches("api.example.com", "www.example.com"));
        }

        @Test
        @DisplayName("wildcard matches the apex domain and any subdomain")
        void wildcard() {
            assertTrue(matcher.matches("example.com", "*.example.com"));
            assertTrue(matcher.matches("a.b.example.com", "*.example.com"));
            assertFalse(matcher.matches("badexample.com", "*.example.com"));
        }

        @Test
        @DisplayName("plain pattern matches subdomains by dotted suffix")
        void plainSuffix() {
            assertTrue(matcher.matches("www.example.com", "example.com"));
            assertFalse(matcher.matches("notexample.com", "example.com"));
        }

        @Test
        @DisplayName("patterns are not treated as regular expressions")
        void noRegex() {
            assertFalse(matcher.matches("exampleXcom", "example.com"));
            assertFalse(matcher.matches("anything", ".*"));
        }

        @Test
        @DisplayName("host names compare case-insensitively")
        void caseInsensitive() {
            assertTrue(matcher.matches("admin.example.com", "Admin.example.com"));
            assertTrue(matcher.matches("API.Example.com", "*.example.COM"));
            assertTrue(matcher.matches("www.shop.example.com", "Shop.Example.com"));
        }

        @Test
        @DisplayName("blank input never matches")
        void blanks() {
            assertFalse(matcher.matches("", "example.com"));
            assertFalse(matcher.matches("example.com", " "));
            assertFalse(matcher.matches(null, "example.com"));
            assertFalse(matcher.matches("example.com", "*."));
        }
    }

    @Test
    @DisplayName("firstMatch returns the first matching pattern in declaration order")
    void firstMatch() {
        var patterns = List.of("other.org", "*.example.com", "example.com");
        assertEquals("*.example.com", matcher.firstMatch("api.example.com", patterns).orElseThrow());
        assertTrue(matcher.firstMatch("api.example.net", patterns).isEmpty());
        assertTrue(matcher.firstMatch("api.example.com", null).isEmpty());
    }

    @Test
    @DisplayName("a mixed-case exclusion reports the pattern as written")
    void mixedCaseExclusion() {
        var exclusions = List.of("Admin.example.com");
        assertEquals("Admin.example.com", matcher.firstMatch("admin.example.com", exclusions).orElseThrow());
    }
}
