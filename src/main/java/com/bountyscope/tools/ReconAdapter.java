package com.bountyscope.tools;

import java.util.List;

/**
 * Passive subdomain enumeration.
 */
public interface ReconAdapter {

    String name();

    /** Discovered subdomains of {@code domain}; empty when the tool is unavailable. */
    List<String> enumerate(String domain);
}
