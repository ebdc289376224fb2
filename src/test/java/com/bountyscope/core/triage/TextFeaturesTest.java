package com.bountyscope.core.triage;

import com.bountyscope.core.model.FindingRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TextFeaturesTest {

    @Test
    @DisplayName("tokens are lower-cased unigrams and adjacent bigrams")
    void unigramsAndBigrams() {
        var tokens = TextFeatures.tokens("SQL Injection-found");

        assertEquals(List.of("sql", "sql_injection", "injection", "injection_found", "found"), List.copyOf(tokens));
    }

    @Test
    @DisplayName("single characters are dropped")
    void dropsShortWords() {
        var tokens = TextFeatures.tokens("a b cd");

        assertEquals(List.of("cd"), List.copyOf(tokens));
    }

    @Test
    @DisplayName("blank text has no tokens")
    void blankText() {
        assertTrue(TextFeatures.tokens("  ").isEmpty());
        assertTrue(TextFeatures.tokens(null).isEmpty());
    }

    @Test
    @DisplayName("finding text joins name, description, severity and evidence")
    void extractFromFinding() {
        var finding = new FindingRecord("a.example.com", "XSS", "high", "reflected",
                Map.of("type", "http"), "nuclei", "https://a.example.com", "xss");

        assertEquals("XSS reflected high {type=http}", TextFeatures.extract(finding));
    }
}
