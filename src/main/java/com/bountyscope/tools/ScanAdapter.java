package com.bountyscope.tools;

import com.bountyscope.core.model.ActionDescriptor;
import com.bountyscope.core.model.FindingRecord;
import com.bountyscope.core.model.ScanMode;

import java.util.List;

/**
 * A vulnerability scanner. The pipeline asks it to {@link #plan} actions, submits each
 * to the policy gate, and calls {@link #run} only for approved ones.
 */
public interface ScanAdapter {

    /** Scanner kind used in action descriptors and audit records, e.g. "nuclei". */
    String kind();

    List<ActionDescriptor> plan(String host, ScanMode mode);

    /**
     * @return findings; an empty list means no results
     */
    List<FindingRecord> run(String target, ScanConstraints constraints);
}
