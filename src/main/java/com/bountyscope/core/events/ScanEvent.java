package com.bountyscope.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a pipeline run, consumed by the CLI for progress output.
 *
 * @param eventType event type, e.g. "run.started", "stage.entered", "policy.decision", "run.finished"
 * @param runId     the run this event belongs to
 * @param target    the target being processed
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ScanEvent(
    String eventType,
    String runId,
    String target,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static ScanEvent of(String eventType, String runId, String target, Map<String, Object> payload) {
        return new ScanEvent(eventType, runId, target, payload != null ? Map.copyOf(payload) : Map.of(), Instant.now());
    }
}
