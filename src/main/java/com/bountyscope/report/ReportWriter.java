package com.bountyscope.report;

import com.bountyscope.core.model.FindingRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Renders a run's findings into a document.
 */
public interface ReportWriter {

    /**
     * @param findings triaged findings sorted by final score, highest first
     * @return location of the written report
     */
    String write(String runId, String target, List<FindingRecord> findings, Path outputDir) throws IOException;
}
