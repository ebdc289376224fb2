package com.bountyscope.tools;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HostSanitizerTest {

    @Nested
    @DisplayName("sanitizeDomain")
    class SanitizeDomain {

        @Test
        @DisplayName("strips scheme, path and port and lower-cases")
        void stripsUrlParts() {
            assertEquals(Optional.of("api.example.com"),
                    HostSanitizer.sanitizeDomain("https://API.Example.com:8443/v1/users"));
        }

        @Test
        @DisplayName("accepts IPv4 addresses")
        void acceptsIpv4() {
            assertEquals(Optional.of("10.0.0.1"), HostSanitizer.sanitizeDomain("10.0.0.1"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "localhost", "example.com; rm -rf /", "-bad.example.com",
                "999.1.1.1", "exa mple.com", "example.c"})
        @DisplayName("rejects values that are not a domain or IPv4 address")
        void rejectsInvalid(String input) {
            assertTrue(HostSanitizer.sanitizeDomain(input).isEmpty());
        }

        @Test
        @DisplayName("rejects null")
        void rejectsNull() {
            assertTrue(HostSanitizer.sanitizeDomain(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("sanitizeUrl")
    class SanitizeUrl {

        @Test
        @DisplayName("keeps http and https URLs")
        void keepsHttpUrls() {
            assertEquals(Optional.of("https://example.com/a?b=1"), HostSanitizer.sanitizeUrl(" https://example.com/a?b=1 "));
            assertEquals(Optional.of("http://example.com"), HostSanitizer.sanitizeUrl("http://example.com"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"ftp://example.com", "example.com", "file:///etc/passwd", "https://", "http://exa mple.com"})
        @DisplayName("rejects other schemes and malformed URLs")
        void rejectsOthers(String input) {
            assertTrue(HostSanitizer.sanitizeUrl(input).isEmpty());
        }
    }

    @Test
    @DisplayName("toUrl prefixes bare hosts with https")
    void toUrl() {
        assertEquals("https://example.com", HostSanitizer.toUrl("example.com"));
        assertEquals("http://example.com:8080", HostSanitizer.toUrl("http://example.com:8080"));
    }
}
