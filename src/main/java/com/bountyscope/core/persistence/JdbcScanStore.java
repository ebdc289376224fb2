package com.bountyscope.core.persistence;

import com.bountyscope.core.model.Decision;
import com.bountyscope.core.model.FindingRecord;
import com.bountyscope.core.model.PolicyAuditRecord;
import com.bountyscope.core.model.RunRecord;
import com.bountyscope.core.model.RunStatus;
import com.bountyscope.core.model.ScanMode;
import com.bountyscope.core.model.TriageResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link ScanStore}.
 * <p>
 * Tables {@code runs}, {@code findings}, {@code policy_decisions} and
 * {@code advisory_responses} are created by {@link #createTables()}. The DDL sticks
 * to types that both H2 and PostgreSQL accept. Finding evidence is stored as JSON text.
 */
public class JdbcScanStore implements ScanStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcScanStore.class);

    private static final List<String> CREATE_TABLES_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS runs (
                run_id          VARCHAR(255) PRIMARY KEY,
                target          VARCHAR(1024) NOT NULL,
                mode            VARCHAR(64) NOT NULL,
                output_location VARCHAR(2048),
                status          VARCHAR(32) NOT NULL,
                start_time      TIMESTAMP NOT NULL,
                end_time        TIMESTAMP,
                findings_count  INT DEFAULT 0
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS findings (
                id                BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                run_id            VARCHAR(255) NOT NULL,
                target            VARCHAR(1024),
                name              VARCHAR(1024),
                severity          VARCHAR(32),
                description       TEXT,
                evidence          TEXT,
                scanner_kind      VARCHAR(64),
                matched_at        VARCHAR(2048),
                template_id       VARCHAR(512),
                discovered_at     TIMESTAMP,
                ml_score          DOUBLE PRECISION,
                llm_score         DOUBLE PRECISION,
                final_score       DOUBLE PRECISION,
                confidence        DOUBLE PRECISION,
                severity_adjusted VARCHAR(32),
                false_positive    BOOLEAN DEFAULT FALSE,
                explanation       TEXT
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS policy_decisions (
                id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                target      VARCHAR(1024) NOT NULL,
                action_kind VARCHAR(128) NOT NULL,
                decision    VARCHAR(32) NOT NULL,
                reason      TEXT,
                confidence  DOUBLE PRECISION,
                created_at  TIMESTAMP NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS advisory_responses (
                id         BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                prompt     TEXT,
                response   TEXT,
                created_at TIMESTAMP NOT NULL
            )
            """
    );

    private static final String INSERT_RUN_SQL = """
            INSERT INTO runs (run_id, target, mode, output_location, status, start_time, end_time, findings_count)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String FINISH_RUN_SQL = """
            UPDATE runs SET status = ?, end_time = ?, findings_count = COALESCE(?, findings_count)
            WHERE run_id = ? AND status = 'RUNNING'
            """;

    private static final String SELECT_RUN_SQL = """
            SELECT run_id, target, mode, output_location, status, start_time, end_time, findings_count
            FROM runs WHERE run_id = ?
            """;

    private static final String SELECT_RECENT_RUNS_SQL = """
            SELECT run_id, target, mode, output_location, status, start_time, end_time, findings_count
            FROM runs ORDER BY start_time DESC
            """;

    private static final String INSERT_FINDING_SQL = """
            INSERT INTO findings (run_id, target, name, severity, description, evidence, scanner_kind,
                                  matched_at, template_id, discovered_at, ml_score, llm_score, final_score,
                                  confidence, severity_adjusted, false_positive, explanation)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_FINDINGS_SQL = """
            SELECT target, name, severity, description, evidence, scanner_kind, matched_at, template_id,
                   discovered_at, ml_score, llm_score, final_score, confidence, severity_adjusted,
                   false_positive, explanation
            FROM findings WHERE run_id = ? ORDER BY id ASC
            """;

    private static final String INSERT_DECISION_SQL = """
            INSERT INTO policy_decisions (target, action_kind, decision, reason, confidence, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_DECISIONS_SQL = """
            SELECT target, action_kind, decision, reason, confidence, created_at
            FROM policy_decisions WHERE target = ? ORDER BY id ASC
            """;

    private static final String INSERT_ADVISORY_SQL = """
            INSERT INTO advisory_responses (prompt, response, created_at) VALUES (?, ?, ?)
            """;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcScanStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Creates the store tables if they do not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String ddl : CREATE_TABLES_SQL) {
                stmt.execute(ddl);
            }
            log.info("Scan store tables ensured");
        }
    }

    @Override
    public void createRun(RunRecord run) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_RUN_SQL)) {
            stmt.setString(1, run.runId());
            stmt.setString(2, run.target());
            stmt.setString(3, run.mode().name());
            stmt.setString(4, run.outputLocation());
            stmt.setString(5, run.status().name());
            stmt.setTimestamp(6, toTimestamp(run.startTime()));
            stmt.setTimestamp(7, toTimestamp(run.endTime()));
            stmt.setInt(8, run.findingsCount());
            stmt.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to create run '{}'", run.runId(), e);
        }
    }

    @Override
    public boolean updateRunStatus(String runId, RunStatus status, Integer findingsCount) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(FINISH_RUN_SQL)) {
            stmt.setString(1, status.name());
            stmt.setTimestamp(2, status.isTerminal() ? toTimestamp(Instant.now()) : null);
            if (findingsCount != null) {
                stmt.setInt(3, findingsCount);
            } else {
                stmt.setNull(3, Types.INTEGER);
            }
            stmt.setString(4, runId);
            int updated = stmt.executeUpdate();
            if (updated == 0) {
                log.warn("Run '{}' not updated to {}: unknown run or already finished", runId, status);
            }
            return updated > 0;
        } catch (SQLException e) {
            log.error("Failed to update status of run '{}'", runId, e);
            return false;
        }
    }

    @Override
    public Optional<RunRecord> findRun(String runId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RUN_SQL)) {
            stmt.setString(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(runFromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to load run '{}'", runId, e);
        }
        return Optional.empty();
    }

    @Override
    public List<RunRecord> listRuns(int limit) {
        List<RunRecord> runs = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RECENT_RUNS_SQL)) {
            stmt.setMaxRows(Math.max(0, limit));
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    runs.add(runFromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to list runs", e);
        }
        return runs;
    }

    @Override
    public void saveFinding(String runId, FindingRecord finding) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_FINDING_SQL)) {
            stmt.setString(1, runId);
            stmt.setString(2, finding.getTarget());
            stmt.setString(3, finding.getName());
            stmt.setString(4, finding.getSeverity());
            stmt.setString(5, finding.getDescription());
            stmt.setString(6, objectMapper.writeValueAsString(finding.getEvidence()));
            stmt.setString(7, finding.getScannerKind());
            stmt.setString(8, finding.getMatchedAt());
            stmt.setString(9, finding.getTemplateId());
            stmt.setTimestamp(10, toTimestamp(finding.getDiscoveredAt()));
            setNullableDouble(stmt, 11, finding.getMlScore());
            setNullableDouble(stmt, 12, finding.getLlmScore());
            setNullableDouble(stmt, 13, finding.isTriaged() ? finding.getFinalScore() : null);
            setNullableDouble(stmt, 14, finding.getConfidence());
            stmt.setString(15, finding.isTriaged() ? finding.getSeverityAdjusted() : null);
            stmt.setBoolean(16, finding.isFalsePositive());
            stmt.setString(17, finding.getExplanation());
            stmt.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to save finding '{}' for run '{}'", finding.getName(), runId, e);
        }
    }

    @Override
    public List<FindingRecord> listFindings(String runId) {
        List<FindingRecord> findings = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_FINDINGS_SQL)) {
            stmt.setString(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    findings.add(findingFromResultSet(rs));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to list findings for run '{}'", runId, e);
        }
        return findings;
    }

    @Override
    public void appendPolicyDecision(PolicyAuditRecord record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_DECISION_SQL)) {
            stmt.setString(1, record.target());
            stmt.setString(2, record.actionKind());
            stmt.setString(3, record.decision().wireName());
            stmt.setString(4, record.reason());
            stmt.setDouble(5, record.confidence());
            stmt.setTimestamp(6, toTimestamp(record.timestamp()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to append policy decision {} for '{}'", record.actionKind(), record.target(), e);
        }
    }

    @Override
    public List<PolicyAuditRecord> listPolicyDecisions(String target) {
        List<PolicyAuditRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_DECISIONS_SQL)) {
            stmt.setString(1, target);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(new PolicyAuditRecord(
                            rs.getString("target"),
                            rs.getString("action_kind"),
                            Decision.fromWireName(rs.getString("decision")),
                            rs.getString("reason"),
                            rs.getDouble("confidence"),
                            toInstant(rs.getTimestamp("created_at"))));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to list policy decisions for '{}'", target, e);
        }
        return records;
    }

    @Override
    public void recordAdvisoryExchange(String prompt, String response) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_ADVISORY_SQL)) {
            stmt.setString(1, prompt);
            stmt.setString(2, response);
            stmt.setTimestamp(3, toTimestamp(Instant.now()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to record advisory exchange", e);
        }
    }

    // ── Internal helpers ─────────────────────────────────────────────

    private RunRecord runFromResultSet(ResultSet rs) throws SQLException {
        return new RunRecord(
                rs.getString("run_id"),
                rs.getString("target"),
                ScanMode.valueOf(rs.getString("mode")),
                rs.getString("output_location"),
                RunStatus.valueOf(rs.getString("status")),
                toInstant(rs.getTimestamp("start_time")),
                toInstant(rs.getTimestamp("end_time")),
                rs.getInt("findings_count"));
    }

    private FindingRecord findingFromResultSet(ResultSet rs) throws SQLException, JsonProcessingException {
        String evidenceJson = rs.getString("evidence");
        Map<String, Object> evidence = evidenceJson != null && !evidenceJson.isBlank()
                ? objectMapper.readValue(evidenceJson, new TypeReference<LinkedHashMap<String, Object>>() {})
                : Map.of();
        var finding = new FindingRecord(
                rs.getString("target"),
                rs.getString("name"),
                rs.getString("severity"),
                rs.getString("description"),
                evidence,
                rs.getString("scanner_kind"),
                rs.getString("matched_at"),
                rs.getString("template_id"),
                toInstant(rs.getTimestamp("discovered_at")));
        Double finalScore = getNullableDouble(rs, "final_score");
        if (finalScore != null) {
            Double ml = getNullableDouble(rs, "ml_score");
            Double llm = getNullableDouble(rs, "llm_score");
            Double confidence = getNullableDouble(rs, "confidence");
            finding.applyTriage(new TriageResult(
                    ml != null ? ml : 0.5,
                    llm != null ? llm : 0.5,
                    finalScore,
                    confidence != null ? confidence : 0.0,
                    rs.getString("explanation"),
                    rs.getBoolean("false_positive"),
                    rs.getString("severity_adjusted")));
        }
        return finding;
    }

    private static void setNullableDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value != null) {
            stmt.setDouble(index, value);
        } else {
            stmt.setNull(index, Types.DOUBLE);
        }
    }

    private static Double getNullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
