package com.bountyscope.core.policy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "bounty.policy")
public class PolicyProperties {

    /** External manifest file; the bundled manifest is used when blank. */
    private String manifestPath = "";
    private boolean allowManualUnblock = false;
    private String overrideToken = "I_ACCEPT_RISK";

    public String getManifestPath() {
        return manifestPath;
    }

    public void setManifestPath(String manifestPath) {
        this.manifestPath = manifestPath;
    }

    public boolean isAllowManualUnblock() {
        return allowManualUnblock;
    }

    public void setAllowManualUnblock(boolean allowManualUnblock) {
        this.allowManualUnblock = allowManualUnblock;
    }

    public String getOverrideToken() {
        return overrideToken;
    }

    public void setOverrideToken(String overrideToken) {
        this.overrideToken = overrideToken;
    }
}
