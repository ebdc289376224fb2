package com.bountyscope.report;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "bounty.report")
public class ReportProperties {

    private boolean excludeFalsePositives = true;
    /** Findings need a final score above this to get their own section. */
    private double minScore = 0.5;
    private int maxDetailedFindings = 10;

    public boolean isExcludeFalsePositives() {
        return excludeFalsePositives;
    }

    public void setExcludeFalsePositives(boolean excludeFalsePositives) {
        this.excludeFalsePositives = excludeFalsePositives;
    }

    public double getMinScore() {
        return minScore;
    }

    public void setMinScore(double minScore) {
        this.minScore = minScore;
    }

    public int getMaxDetailedFindings() {
        return maxDetailedFindings;
    }

    public void setMaxDetailedFindings(int maxDetailedFindings) {
        this.maxDetailedFindings = maxDetailedFindings;
    }
}
