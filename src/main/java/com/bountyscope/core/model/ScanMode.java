package com.bountyscope.core.model;

/**
 * How far the pipeline may go for a target.
 */
public enum ScanMode {
    PASSIVE_ONLY("passive-only"),
    SAFE_SCAN("safe-scan"),
    FULL_SCAN_WITH_VALIDATION("full-scan-with-validation");

    private final String cliName;

    ScanMode(String cliName) {
        this.cliName = cliName;
    }

    public String cliName() {
        return cliName;
    }

    public boolean isActive() {
        return this != PASSIVE_ONLY;
    }

    /** Whether actions flagged for validation may still be scanned in this mode. */
    public boolean allowsValidatedScanning() {
        return this == FULL_SCAN_WITH_VALIDATION;
    }

    public static ScanMode fromCliName(String value) {
        for (ScanMode mode : values()) {
            if (mode.cliName.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown scan mode: " + value
                + ". Valid modes: passive-only, safe-scan, full-scan-with-validation");
    }
}
