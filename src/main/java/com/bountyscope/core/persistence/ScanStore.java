package com.bountyscope.core.persistence;

import com.bountyscope.core.model.FindingRecord;
import com.bountyscope.core.model.PolicyAuditRecord;
import com.bountyscope.core.model.RunRecord;
import com.bountyscope.core.model.RunStatus;

import java.util.List;
import java.util.Optional;

/**
 * Storage collaborator for runs, findings, policy audit records and advisory exchanges.
 * <p>
 * Implementations log failures instead of throwing them into the pipeline; a read
 * that fails returns an empty result.
 */
public interface ScanStore {

    void createRun(RunRecord run);

    /**
     * Moves a run out of {@code RUNNING}. Has no effect when the run is already terminal.
     *
     * @param findingsCount final count, or null to keep the stored value
     * @return true if the status changed
     */
    boolean updateRunStatus(String runId, RunStatus status, Integer findingsCount);

    Optional<RunRecord> findRun(String runId);

    List<RunRecord> listRuns(int limit);

    void saveFinding(String runId, FindingRecord finding);

    List<FindingRecord> listFindings(String runId);

    void appendPolicyDecision(PolicyAuditRecord record);

    /** Audit records for a target in append order. */
    List<PolicyAuditRecord> listPolicyDecisions(String target);

    void recordAdvisoryExchange(String prompt, String response);
}
