package com.bountyscope.core.triage;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One training example; {@code label} 1 marks a true positive, 0 a false positive.
 */
public record LabeledExample(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("severity") String severity,
    @JsonProperty("evidence") Map<String, Object> evidence,
    @JsonProperty("label") int label
) {

    public String text() {
        return TextFeatures.extract(name, description, severity, evidence);
    }

    public boolean positive() {
        return label == 1;
    }
}
