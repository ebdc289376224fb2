package com.bountyscope.core.model;

import java.util.Locale;

/**
 * Outcome of a policy evaluation.
 * <p>
 * The wire names ({@code Allowed|Blocked|Unknown|RequiresValidation}) are part of
 * the persisted audit contract and must not change.
 */
public enum Decision {
    ALLOWED("Allowed"),
    BLOCKED("Blocked"),
    UNKNOWN("Unknown"),
    REQUIRES_VALIDATION("RequiresValidation");

    private final String wireName;

    Decision(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses either the wire name or the upper-snake constant name, case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no decision
     */
    public static Decision fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Decision value is empty");
        }
        String normalized = value.trim().replace("_", "").toLowerCase(Locale.ROOT);
        for (Decision d : values()) {
            if (d.wireName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown decision value: " + value);
    }
}
