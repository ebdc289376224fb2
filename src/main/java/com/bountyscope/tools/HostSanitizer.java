package com.bountyscope.tools;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validates host names and URLs before they reach an external tool's command line.
 */
public final class HostSanitizer {

    private static final Pattern DOMAIN = Pattern.compile(
            "^(?:[a-zA-Z0-9](?:[a-zA-Z0-9\\-]{0,61}[a-zA-Z0-9])?\\.)+[a-zA-Z]{2,}$");
    private static final Pattern IPV4 = Pattern.compile(
            "^(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)$");

    private HostSanitizer() {}

    /**
     * Reduces {@code input} to a lower-cased domain or an IPv4 address, dropping any
     * scheme, path and port.
     */
    public static Optional<String> sanitizeDomain(String input) {
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }
        String domain = input.trim();
        int scheme = domain.indexOf("://");
        if (scheme >= 0) {
            domain = domain.substring(scheme + 3);
        }
        int slash = domain.indexOf('/');
        if (slash >= 0) {
            domain = domain.substring(0, slash);
        }
        int colon = domain.indexOf(':');
        if (colon >= 0) {
            domain = domain.substring(0, colon);
        }
        if (DOMAIN.matcher(domain).matches()) {
            return Optional.of(domain.toLowerCase(Locale.ROOT));
        }
        if (IPV4.matcher(domain).matches()) {
            return Optional.of(domain);
        }
        return Optional.empty();
    }

    /** Accepts only absolute http/https URLs with a host. */
    public static Optional<String> sanitizeUrl(String input) {
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }
        try {
            URI uri = new URI(input.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) {
                return Optional.empty();
            }
            if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) {
                return Optional.empty();
            }
            return Optional.of(input.trim());
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    /** URL to scan for a probed host: kept as is when already a URL, otherwise https. */
    public static String toUrl(String host) {
        return sanitizeUrl(host).orElse("https://" + host);
    }
}
