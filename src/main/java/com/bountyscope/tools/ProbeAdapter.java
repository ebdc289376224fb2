package com.bountyscope.tools;

import java.util.List;

/**
 * HTTP liveness probing.
 */
public interface ProbeAdapter {

    /** URLs of hosts that answered over HTTP or HTTPS. */
    List<String> probe(List<String> hosts);
}
