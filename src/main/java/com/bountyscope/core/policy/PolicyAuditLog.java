package com.bountyscope.core.policy;

import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.model.PolicyAuditRecord;
import com.bountyscope.core.model.PolicyDecision;
import com.bountyscope.core.persistence.ScanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Single append path for policy decision records. Appends are serialized so the
 * stored order equals the order in which decisions were made.
 */
@Component
public class PolicyAuditLog {

    private static final Logger log = LoggerFactory.getLogger(PolicyAuditLog.class);

    private final ScanStore store;
    private final BountyscopeMetrics metrics;
    private final ReentrantLock appendLock = new ReentrantLock();

    @Autowired
    public PolicyAuditLog(ScanStore store, BountyscopeMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    PolicyAuditLog(ScanStore store) {
        this(store, null);
    }

    public PolicyAuditRecord append(String target, String actionKind, PolicyDecision decision) {
        var record = PolicyAuditRecord.of(target, actionKind, decision);
        appendLock.lock();
        try {
            store.appendPolicyDecision(record);
        } finally {
            appendLock.unlock();
        }
        log.info("Policy {} for {} [{}]: {} (confidence {})", decision.decision().wireName(), target,
                actionKind, decision.reason(), String.format("%.2f", decision.confidence()));
        if (metrics != null) {
            metrics.recordPolicyDecision(actionKind, decision.decision().wireName());
        }
        return record;
    }
}
