package com.bountyscope.core.persistence;

import com.bountyscope.core.model.FindingRecord;
import com.bountyscope.core.model.PolicyAuditRecord;
import com.bountyscope.core.model.RunRecord;
import com.bountyscope.core.model.RunStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Non-durable {@link ScanStore}, used when no DataSource is configured and in tests.
 */
public class InMemoryScanStore implements ScanStore {

    private final ConcurrentHashMap<String, RunRecord> runs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<FindingRecord>> findings = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<PolicyAuditRecord> decisions = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<String[]> advisoryExchanges = new CopyOnWriteArrayList<>();

    @Override
    public void createRun(RunRecord run) {
        runs.put(run.runId(), run);
    }

    @Override
    public boolean updateRunStatus(String runId, RunStatus status, Integer findingsCount) {
        AtomicBoolean changed = new AtomicBoolean(false);
        runs.computeIfPresent(runId, (id, run) -> {
            if (run.status().isTerminal()) {
                return run;
            }
            changed.set(true);
            return run.finish(status, findingsCount);
        });
        return changed.get();
    }

    @Override
    public Optional<RunRecord> findRun(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public List<RunRecord> listRuns(int limit) {
        return runs.values().stream()
                .sorted(Comparator.comparing(RunRecord::startTime).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public void saveFinding(String runId, FindingRecord finding) {
        findings.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(finding);
    }

    @Override
    public List<FindingRecord> listFindings(String runId) {
        return new ArrayList<>(findings.getOrDefault(runId, new CopyOnWriteArrayList<>()));
    }

    @Override
    public void appendPolicyDecision(PolicyAuditRecord record) {
        decisions.add(record);
    }

    @Override
    public List<PolicyAuditRecord> listPolicyDecisions(String target) {
        return decisions.stream().filter(d -> d.target().equals(target)).toList();
    }

    @Override
    public void recordAdvisoryExchange(String prompt, String response) {
        advisoryExchanges.add(new String[]{prompt, response});
    }

    public int advisoryExchangeCount() {
        return advisoryExchanges.size();
    }
}
