package com.bountyscope.core.state;

import com.bountyscope.core.model.FindingRecord;
import com.bountyscope.core.model.PipelineStage;
import com.bountyscope.core.model.PolicyDecision;
import com.bountyscope.core.model.RunOutcome;
import com.bountyscope.core.model.RunStatus;
import com.bountyscope.core.model.ScanMode;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state of one pipeline run.
 * <p>
 * Every value is serializable. Stage outputs use base channels so the producing
 * stage replaces them; {@code errors} accumulates non-fatal problems from all stages.
 */
public class PipelineState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("runId",          Channels.base(() -> "")),
        Map.entry("target",         Channels.base(() -> "")),
        Map.entry("mode",           Channels.base(() -> ScanMode.SAFE_SCAN.name())),
        Map.entry("outputDir",      Channels.base(() -> "")),
        Map.entry("stage",          Channels.base(() -> PipelineStage.SCOPE_CHECK.name())),
        Map.entry("status",         Channels.base(() -> RunStatus.RUNNING.name())),
        Map.entry("outcome",        Channels.base(() -> "")),
        Map.entry("reason",         Channels.base(() -> "")),
        Map.entry("scopeDecision",  Channels.base((Reducer<PolicyDecision>) null)),
        Map.entry("overrideAccepted", Channels.base(() -> false)),

        Map.entry("subdomains",     Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("liveHosts",      Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("crawledUrls",    Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("findings",       Channels.base((Supplier<List<FindingRecord>>) List::of)),
        Map.entry("findingsCount",  Channels.base(() -> 0)),
        Map.entry("skippedActions", Channels.base(() -> 0)),
        Map.entry("failedScans",    Channels.base(() -> 0)),
        Map.entry("reportLocation", Channels.base(() -> "")),

        Map.entry("errors",         Channels.appender(ArrayList::new))
    );

    public PipelineState(Map<String, Object> initData) {
        super(initData);
    }

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public String target() {
        return this.<String>value("target").orElse("");
    }

    public ScanMode mode() {
        return ScanMode.valueOf(this.<String>value("mode").orElse(ScanMode.SAFE_SCAN.name()));
    }

    public String outputDir() {
        return this.<String>value("outputDir").orElse("");
    }

    public PipelineStage stage() {
        return PipelineStage.valueOf(this.<String>value("stage").orElse(PipelineStage.SCOPE_CHECK.name()));
    }

    public RunStatus status() {
        return RunStatus.valueOf(this.<String>value("status").orElse(RunStatus.RUNNING.name()));
    }

    public boolean isFailed() {
        return status() == RunStatus.FAILED;
    }

    /** Empty while the run is still in progress or completed normally. */
    public Optional<RunOutcome> outcome() {
        String raw = this.<String>value("outcome").orElse("");
        return raw.isEmpty() ? Optional.empty() : Optional.of(RunOutcome.valueOf(raw));
    }

    public String reason() {
        return this.<String>value("reason").orElse("");
    }

    public Optional<PolicyDecision> scopeDecision() {
        return value("scopeDecision");
    }

    public boolean overrideAccepted() {
        return this.<Boolean>value("overrideAccepted").orElse(false);
    }

    public List<String> subdomains() {
        return this.<List<String>>value("subdomains").orElse(List.of());
    }

    public List<String> liveHosts() {
        return this.<List<String>>value("liveHosts").orElse(List.of());
    }

    public List<String> crawledUrls() {
        return this.<List<String>>value("crawledUrls").orElse(List.of());
    }

    public List<FindingRecord> findings() {
        return this.<List<FindingRecord>>value("findings").orElse(List.of());
    }

    public int findingsCount() {
        return this.<Integer>value("findingsCount").orElse(0);
    }

    public int skippedActions() {
        return this.<Integer>value("skippedActions").orElse(0);
    }

    public int failedScans() {
        return this.<Integer>value("failedScans").orElse(0);
    }

    public Optional<String> reportLocation() {
        return this.<String>value("reportLocation").filter(s -> !s.isBlank());
    }

    public List<String> errors() {
        return this.<List<String>>value("errors").orElse(List.of());
    }
}
