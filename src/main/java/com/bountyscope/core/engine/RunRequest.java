package com.bountyscope.core.engine;

import com.bountyscope.core.model.ScanMode;
import com.bountyscope.core.model.ScopeDefinition;
import com.bountyscope.core.policy.OverrideChannel;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Parameters of one pipeline run.
 *
 * @param target          domain or host to process
 * @param mode            how far the pipeline may go
 * @param scope           program scope; null when none was supplied
 * @param allowUnblock    whether the operator asked to be offered a manual override
 * @param outputDir       parent directory for per-run artifacts; null for the configured default
 * @param timeout         run deadline; null for the configured default
 * @param overrideChannel where override confirmations come from
 */
public record RunRequest(
    String target,
    ScanMode mode,
    ScopeDefinition scope,
    boolean allowUnblock,
    Path outputDir,
    Duration timeout,
    OverrideChannel overrideChannel
) {

    public RunRequest {
        mode = mode != null ? mode : ScanMode.SAFE_SCAN;
        overrideChannel = overrideChannel != null ? overrideChannel : OverrideChannel.NONE;
    }

    public static RunRequest of(String target, ScanMode mode, ScopeDefinition scope) {
        return new RunRequest(target, mode, scope, false, null, null, OverrideChannel.NONE);
    }

    public Optional<ScopeDefinition> scopeDefinition() {
        return Optional.ofNullable(scope);
    }

    public RunRequest withTarget(String newTarget) {
        return new RunRequest(newTarget, mode, scope, allowUnblock, outputDir, timeout, overrideChannel);
    }
}
