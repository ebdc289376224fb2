package com.bountyscope.core.scope;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Structural scope pattern matching. Patterns are compared as case-insensitive strings
 * and never compiled as regular expressions.
 * <p>
 * Rules, in priority order:
 * <ol>
 *   <li>exact equality</li>
 *   <li>{@code *.D} matches {@code D} itself or any target ending with {@code .D}</li>
 *   <li>a plain pattern {@code P} matches any target ending with {@code .P}</li>
 * </ol>
 */
@Component
public class ScopeMatcher {

    private static final String WILDCARD_PREFIX = "*.";

    public boolean matches(String target, String pattern) {
        if (target == null || pattern == null || target.isBlank() || pattern.isBlank()) {
            return false;
        }
        target = normalize(target);
        pattern = normalize(pattern);
        if (target.equals(pattern)) {
            return true;
        }
        if (pattern.startsWith(WILDCARD_PREFIX)) {
            String suffix = pattern.substring(WILDCARD_PREFIX.length());
            return !suffix.isEmpty() && (target.equals(suffix) || target.endsWith("." + suffix));
        }
        return target.endsWith("." + pattern);
    }

    /** Host names compare case-insensitively. */
    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    /** Returns the first pattern in declaration order that matches the target. */
    public Optional<String> firstMatch(String target, List<String> patterns) {
        if (patterns == null) {
            return Optional.empty();
        }
        for (String pattern : patterns) {
            if (matches(target, pattern)) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }
}
