package com.bountyscope.report;

import com.bountyscope.core.model.FindingRecord;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Decides which triaged findings a report shows.
 * <p>
 * False positives are left out when so configured. Of the rest, only findings scoring
 * above the minimum get an individual section, highest score first.
 */
@Component
public class ReportPolicy {

    public static final Comparator<FindingRecord> BY_SCORE_DESC =
            Comparator.comparingDouble(FindingRecord::getFinalScore).reversed();

    private final ReportProperties properties;

    public ReportPolicy(ReportProperties properties) {
        this.properties = properties;
    }

    public boolean isReportable(FindingRecord finding) {
        return !(properties.isExcludeFalsePositives() && finding.isFalsePositive());
    }

    public boolean isSignificant(FindingRecord finding) {
        return isReportable(finding) && finding.getFinalScore() > properties.getMinScore();
    }

    /** Significant findings, highest score first. */
    public List<FindingRecord> significant(List<FindingRecord> findings) {
        return findings.stream().filter(this::isSignificant).sorted(BY_SCORE_DESC).toList();
    }

    public int maxDetailedFindings() {
        return properties.getMaxDetailedFindings();
    }
}
