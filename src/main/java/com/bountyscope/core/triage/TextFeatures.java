package com.bountyscope.core.triage;

import com.bountyscope.core.model.FindingRecord;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a finding into the text and token set the classifier works on.
 * Unigrams and adjacent bigrams of lower-cased alphanumeric runs, at least two characters long.
 */
public final class TextFeatures {

    private TextFeatures() {}

    public static String extract(FindingRecord finding) {
        return extract(finding.getName(), finding.getDescription(), finding.getSeverity(), finding.getEvidence());
    }

    public static String extract(String name, String description, String severity, Map<String, Object> evidence) {
        return String.join(" ",
                name != null ? name : "",
                description != null ? description : "",
                severity != null ? severity : "",
                evidence != null ? evidence.toString() : "{}");
    }

    public static Set<String> tokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        List<String> words = new ArrayList<>();
        for (String raw : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (raw.length() >= 2) {
                words.add(raw);
            }
        }
        for (int i = 0; i < words.size(); i++) {
            tokens.add(words.get(i));
            if (i + 1 < words.size()) {
                tokens.add(words.get(i) + "_" + words.get(i + 1));
            }
        }
        return tokens;
    }
}
