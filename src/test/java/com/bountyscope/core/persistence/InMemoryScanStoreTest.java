package com.bountyscope.core.persistence;

import com.bountyscope.core.model.FindingRecord;
import com.bountyscope.core.model.PolicyAuditRecord;
import com.bountyscope.core.model.PolicyDecision;
import com.bountyscope.core.model.RunRecord;
import com.bountyscope.core.model.RunStatus;
import com.bountyscope.core.model.ScanMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryScanStoreTest {

    private final InMemoryScanStore store = new InMemoryScanStore();

    @Test
    @DisplayName("run status is updated once")
    void updatesOnce() {
        store.createRun(RunRecord.started("r1", "example.com", ScanMode.SAFE_SCAN, "/out"));

        assertTrue(store.updateRunStatus("r1", RunStatus.FAILED, null));
        assertFalse(store.updateRunStatus("r1", RunStatus.COMPLETED, 5));
        assertEquals(RunStatus.FAILED, store.findRun("r1").orElseThrow().status());
    }

    @Test
    @DisplayName("unknown runs are not created by an update")
    void unknownRun() {
        assertFalse(store.updateRunStatus("nope", RunStatus.COMPLETED, 0));
        assertTrue(store.listRuns(10).isEmpty());
    }

    @Test
    @DisplayName("findings are isolated per run and returned as a copy")
    void findingsPerRun() {
        store.saveFinding("r1", new FindingRecord("h", "a", "low", "", Map.of(), "nuclei", "h", "t"));

        var listed = store.listFindings("r1");
        listed.clear();

        assertEquals(1, store.listFindings("r1").size());
        assertTrue(store.listFindings("r2").isEmpty());
    }

    @Test
    @DisplayName("policy decisions are filtered by target")
    void decisionsByTarget() {
        store.appendPolicyDecision(PolicyAuditRecord.of("a.com", "scope_check", PolicyDecision.allowed("in", "")));
        store.appendPolicyDecision(PolicyAuditRecord.of("b.com", "scope_check", PolicyDecision.blocked("out", "")));

        assertEquals(1, store.listPolicyDecisions("a.com").size());
    }
}
