package com.bountyscope.report;

import com.bountyscope.core.model.FindingRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes {@code report.md} (summary plus top findings) and one
 * {@code findings/finding_N.md} per significant finding.
 */
@Component
public class MarkdownReportWriter implements ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(MarkdownReportWriter.class);

    private static final List<String> SEVERITY_ORDER = List.of("critical", "high", "medium", "low", "info");

    private final ReportPolicy policy;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public MarkdownReportWriter(ReportPolicy policy) {
        this.policy = policy;
    }

    @Override
    public String write(String runId, String target, List<FindingRecord> findings, Path outputDir) throws IOException {
        log.info("Generating report for {}", target);
        List<FindingRecord> significant = policy.significant(findings);
        List<FindingRecord> detailed = significant.stream().limit(policy.maxDetailedFindings()).toList();

        Files.createDirectories(outputDir);
        Path findingsDir = outputDir.resolve("findings");
        Files.createDirectories(findingsDir);
        for (int i = 0; i < detailed.size(); i++) {
            Files.writeString(findingsDir.resolve("finding_" + (i + 1) + ".md"), findingSection(detailed.get(i), target));
        }

        Path report = outputDir.resolve("report.md");
        Files.writeString(report, summary(runId, target, findings.size(), significant, detailed));
        log.info("Report saved to {}", report);
        return report.toString();
    }

    String summary(String runId, String target, int totalFindings,
                   List<FindingRecord> significant, List<FindingRecord> detailed) {
        var sb = new StringBuilder();
        sb.append("# Security Assessment Report\n\n");
        sb.append("**Target:** ").append(target).append("\n\n");
        sb.append("**Date:** ").append(LocalDate.now()).append("\n\n");
        sb.append("**Run ID:** ").append(runId).append("\n\n");
        sb.append("## Executive Summary\n\n");
        sb.append("This report contains the results of an automated security assessment conducted on ")
                .append(target).append(".\n");
        sb.append("The assessment triaged ").append(totalFindings).append(" finding(s), of which ")
                .append(significant.size()).append(" are significant and require attention.\n\n");

        sb.append("## Findings Summary\n\n");
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (FindingRecord f : significant) {
            bySeverity.merge(f.getSeverityAdjusted().toLowerCase(Locale.ROOT), 1, Integer::sum);
        }
        for (String severity : SEVERITY_ORDER) {
            Integer count = bySeverity.get(severity);
            if (count != null) {
                sb.append("- **").append(severity.toUpperCase(Locale.ROOT)).append("**: ")
                        .append(count).append(" finding(s)\n");
            }
        }
        if (significant.isEmpty()) {
            sb.append("No significant findings.\n");
        }

        sb.append("\n## Detailed Findings\n\n");
        int i = 1;
        for (FindingRecord f : detailed) {
            sb.append("### ").append(i++).append(". ").append(f.getName()).append("\n\n");
            sb.append("**Severity:** ").append(f.getSeverityAdjusted().toUpperCase(Locale.ROOT)).append("\n\n");
            sb.append("**Confidence Score:** ").append(String.format("%.2f", f.getFinalScore())).append("\n\n");
            sb.append("**Description:** ").append(f.getDescription().isBlank() ? "N/A" : f.getDescription()).append("\n\n");
            sb.append("**Location:** ").append(f.getMatchedAt()).append("\n\n");
            sb.append("---\n\n");
        }

        sb.append("""
                ## Methodology

                This assessment used automated tools with local and advisory triage to identify potential security issues.
                All findings have been scored and filtered to reduce false positives.

                ## Recommendations

                1. Review and validate each finding manually
                2. Prioritize remediation based on severity and confidence scores
                3. Implement security controls to prevent similar issues
                4. Conduct regular security assessments

                ## Disclaimer

                This is an automated assessment. Manual verification is recommended before reporting to bug bounty programs.
                """);
        return sb.toString();
    }

    String findingSection(FindingRecord f, String target) {
        String evidence;
        try {
            evidence = mapper.writeValueAsString(f.getEvidence());
        } catch (JsonProcessingException e) {
            evidence = String.valueOf(f.getEvidence());
        }
        return "# " + f.getName() + "\n\n"
                + "**Target:** " + target + "\n\n"
                + "**Severity:** " + f.getSeverityAdjusted().toUpperCase(Locale.ROOT) + "\n\n"
                + "**Score:** " + String.format("%.2f", f.getFinalScore())
                + " (confidence " + String.format("%.2f", f.getConfidence() != null ? f.getConfidence() : 0.0) + ")\n\n"
                + "## Description\n\n" + (f.getDescription().isBlank() ? "No description available" : f.getDescription()) + "\n\n"
                + "## Impact\n\n" + impact(f.getSeverityAdjusted()) + "\n\n"
                + "## Steps to Reproduce\n\n"
                + "1. Navigate to " + f.getMatchedAt() + "\n"
                + "2. Observe the security issue as described\n"
                + "3. Review the evidence provided below\n\n"
                + "## Evidence\n\n```json\n" + evidence + "\n```\n\n"
                + "## Remediation\n\n" + remediation(f.getName()) + "\n\n"
                + (f.getExplanation().isBlank() ? "" : "## Triage Notes\n\n" + f.getExplanation() + "\n");
    }

    static String impact(String severity) {
        return switch (severity.toLowerCase(Locale.ROOT)) {
            case "critical" -> "This vulnerability could lead to complete system compromise, data breach, or significant business impact.";
            case "high" -> "This vulnerability could allow unauthorized access to sensitive data or functionality.";
            case "medium" -> "This vulnerability could expose information or allow limited unauthorized actions.";
            case "low" -> "This issue has minimal security impact but should be addressed.";
            case "info" -> "This is an informational finding that may aid in further attacks.";
            default -> "Impact assessment required.";
        };
    }

    static String remediation(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.contains("xss") || lower.contains("cross-site scripting")) {
            return "Implement proper input validation and output encoding. Use Content-Security-Policy headers.";
        } else if (lower.contains("sql")) {
            return "Use parameterized queries or prepared statements. Never concatenate user input into SQL queries.";
        } else if (lower.contains("csrf")) {
            return "Implement CSRF tokens for all state-changing operations.";
        } else if (lower.contains("auth")) {
            return "Review authentication logic and ensure proper access controls are in place.";
        } else if (lower.contains("header")) {
            return "Configure security headers according to OWASP recommendations.";
        }
        return "Review the specific vulnerability and implement appropriate security controls.";
    }
}
