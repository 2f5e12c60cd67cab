package io.convotest.core.storage;

import io.convotest.core.storage.WriteOperation.ApiCallWrite;
import io.convotest.core.storage.WriteOperation.FindingWrite;
import io.convotest.core.storage.WriteOperation.GoalTestResultWrite;
import io.convotest.core.storage.WriteOperation.ProgressSnapshotWrite;
import io.convotest.core.storage.WriteOperation.TestResultWrite;
import io.convotest.core.storage.WriteOperation.TranscriptWrite;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteResultStore implements BatchCommitter {
    private static final String[] SCHEMA = {
        """
        CREATE TABLE IF NOT EXISTS test_runs (
            id TEXT PRIMARY KEY,
            name TEXT,
            status TEXT NOT NULL,
            started_at TEXT NOT NULL,
            completed_at TEXT
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS test_results (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            run_id TEXT NOT NULL,
            test_id TEXT NOT NULL,
            test_name TEXT NOT NULL,
            category TEXT,
            status TEXT NOT NULL,
            started_at TEXT,
            completed_at TEXT,
            duration_ms INTEGER NOT NULL DEFAULT 0,
            error_message TEXT,
            UNIQUE (run_id, test_id)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS transcripts (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            result_id INTEGER,
            run_id TEXT NOT NULL,
            test_id TEXT NOT NULL,
            transcript_json TEXT NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS findings (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            run_id TEXT NOT NULL,
            test_id TEXT NOT NULL,
            type TEXT NOT NULL,
            severity TEXT NOT NULL,
            title TEXT NOT NULL,
            description TEXT NOT NULL,
            affected_step TEXT,
            agent_question TEXT,
            expected_behavior TEXT,
            actual_behavior TEXT,
            recommendation TEXT
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS api_calls (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            run_id TEXT NOT NULL,
            test_id TEXT NOT NULL,
            step_id TEXT,
            tool_name TEXT NOT NULL,
            request_json TEXT,
            response_json TEXT,
            duration_ms INTEGER,
            status TEXT NOT NULL,
            timestamp TEXT
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS goal_test_results (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            run_id TEXT NOT NULL,
            test_id TEXT NOT NULL,
            passed INTEGER NOT NULL,
            turn_count INTEGER NOT NULL,
            duration_ms INTEGER NOT NULL,
            started_at TEXT,
            completed_at TEXT,
            goal_results_json TEXT NOT NULL,
            constraint_violations_json TEXT NOT NULL,
            summary_text TEXT NOT NULL,
            resolved_persona_json TEXT,
            persona_seed INTEGER,
            UNIQUE (run_id, test_id)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS goal_progress_snapshots (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            run_id TEXT NOT NULL,
            test_id TEXT NOT NULL,
            turn_number INTEGER NOT NULL,
            collected_fields_json TEXT NOT NULL,
            pending_fields_json TEXT NOT NULL,
            issues_json TEXT NOT NULL,
            captured_at TEXT
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_test_results_run ON test_results(run_id)",
        "CREATE INDEX IF NOT EXISTS idx_transcripts_run_test ON transcripts(run_id, test_id)",
        "CREATE INDEX IF NOT EXISTS idx_findings_run ON findings(run_id)",
        "CREATE INDEX IF NOT EXISTS idx_api_calls_run_test ON api_calls(run_id, test_id)",
        "CREATE INDEX IF NOT EXISTS idx_snapshots_run_test ON goal_progress_snapshots(run_id, test_id, turn_number)"
    };

    private final String jdbcUrl;

    public SqliteResultStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        init();
    }

    @Override
    public synchronized void commit(List<WriteOperation> batch) throws IOException {
        if (batch == null || batch.isEmpty()) {
            return;
        }
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try {
                for (WriteOperation operation : batch) {
                    write(connection, operation);
                }
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to commit batch of " + batch.size() + " operations", e);
        }
    }

    public synchronized void createRun(String runId, String name, Instant startedAt) throws IOException {
        String sql = """
            INSERT INTO test_runs (id, name, status, started_at)
            VALUES (?, ?, 'running', ?)
            ON CONFLICT(id) DO UPDATE SET name = excluded.name, status = 'running', started_at = excluded.started_at
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, runId);
            statement.setString(2, name);
            statement.setString(3, startedAt.toString());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to create test run " + runId, e);
        }
    }

    public synchronized void completeRun(String runId, String status, Instant completedAt) throws IOException {
        String sql = "UPDATE test_runs SET status = ?, completed_at = ? WHERE id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, status);
            statement.setString(2, completedAt.toString());
            statement.setString(3, runId);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to complete test run " + runId, e);
        }
    }

    public synchronized List<TestRunRecord> listRuns(int limit) throws IOException {
        String sql = """
            SELECT id, name, status, started_at, completed_at
            FROM test_runs
            ORDER BY started_at DESC
            LIMIT ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, Math.max(1, limit));
            try (ResultSet resultSet = statement.executeQuery()) {
                List<TestRunRecord> runs = new ArrayList<>();
                while (resultSet.next()) {
                    runs.add(new TestRunRecord(
                        resultSet.getString("id"),
                        resultSet.getString("name"),
                        resultSet.getString("status"),
                        instant(resultSet.getString("started_at")),
                        instant(resultSet.getString("completed_at"))
                    ));
                }
                return runs;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list test runs", e);
        }
    }

    public synchronized List<TestResultWrite> listTestResults(String runId) throws IOException {
        String sql = """
            SELECT run_id, test_id, test_name, category, status, started_at, completed_at, duration_ms, error_message
            FROM test_results
            WHERE run_id = ?
            ORDER BY id ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, runId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<TestResultWrite> results = new ArrayList<>();
                while (resultSet.next()) {
                    results.add(new TestResultWrite(
                        resultSet.getString("run_id"),
                        resultSet.getString("test_id"),
                        resultSet.getString("test_name"),
                        resultSet.getString("category"),
                        resultSet.getString("status"),
                        instant(resultSet.getString("started_at")),
                        instant(resultSet.getString("completed_at")),
                        resultSet.getLong("duration_ms"),
                        resultSet.getString("error_message")
                    ));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list test results for run " + runId, e);
        }
    }

    public synchronized Optional<StoredTranscript> findTranscript(String runId, String testId) throws IOException {
        String sql = """
            SELECT result_id, transcript_json
            FROM transcripts
            WHERE run_id = ? AND test_id = ?
            ORDER BY id DESC
            LIMIT 1
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, runId);
            statement.setString(2, testId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                long resultId = resultSet.getLong("result_id");
                Long boxed = resultSet.wasNull() ? null : resultId;
                return Optional.of(new StoredTranscript(boxed, resultSet.getString("transcript_json")));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read transcript for " + runId + "/" + testId, e);
        }
    }

    public synchronized List<FindingWrite> listFindings(String runId) throws IOException {
        String sql = """
            SELECT run_id, test_id, type, severity, title, description, affected_step, agent_question,
                   expected_behavior, actual_behavior, recommendation
            FROM findings
            WHERE run_id = ?
            ORDER BY id ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, runId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<FindingWrite> findings = new ArrayList<>();
                while (resultSet.next()) {
                    findings.add(new FindingWrite(
                        resultSet.getString("run_id"),
                        resultSet.getString("test_id"),
                        resultSet.getString("type"),
                        resultSet.getString("severity"),
                        resultSet.getString("title"),
                        resultSet.getString("description"),
                        resultSet.getString("affected_step"),
                        resultSet.getString("agent_question"),
                        resultSet.getString("expected_behavior"),
                        resultSet.getString("actual_behavior"),
                        resultSet.getString("recommendation")
                    ));
                }
                return findings;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list findings for run " + runId, e);
        }
    }

    public synchronized List<ApiCallWrite> listApiCalls(String runId, String testId) throws IOException {
        String sql = """
            SELECT run_id, test_id, step_id, tool_name, request_json, response_json, duration_ms, status, timestamp
            FROM api_calls
            WHERE run_id = ? AND test_id = ?
            ORDER BY id ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, runId);
            statement.setString(2, testId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<ApiCallWrite> calls = new ArrayList<>();
                while (resultSet.next()) {
                    long duration = resultSet.getLong("duration_ms");
                    Long boxed = resultSet.wasNull() ? null : duration;
                    calls.add(new ApiCallWrite(
                        resultSet.getString("run_id"),
                        resultSet.getString("test_id"),
                        resultSet.getString("step_id"),
                        resultSet.getString("tool_name"),
                        resultSet.getString("request_json"),
                        resultSet.getString("response_json"),
                        boxed,
                        resultSet.getString("status"),
                        instant(resultSet.getString("timestamp"))
                    ));
                }
                return calls;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list api calls for " + runId + "/" + testId, e);
        }
    }

    public synchronized Optional<GoalTestResultWrite> findGoalTestResult(String runId, String testId) throws IOException {
        String sql = """
            SELECT run_id, test_id, passed, turn_count, duration_ms, started_at, completed_at, goal_results_json,
                   constraint_violations_json, summary_text, resolved_persona_json, persona_seed
            FROM goal_test_results
            WHERE run_id = ? AND test_id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, runId);
            statement.setString(2, testId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                long seed = resultSet.getLong("persona_seed");
                Long boxedSeed = resultSet.wasNull() ? null : seed;
                return Optional.of(new GoalTestResultWrite(
                    resultSet.getString("run_id"),
                    resultSet.getString("test_id"),
                    resultSet.getInt("passed") == 1,
                    resultSet.getInt("turn_count"),
                    resultSet.getLong("duration_ms"),
                    instant(resultSet.getString("started_at")),
                    instant(resultSet.getString("completed_at")),
                    resultSet.getString("goal_results_json"),
                    resultSet.getString("constraint_violations_json"),
                    resultSet.getString("summary_text"),
                    resultSet.getString("resolved_persona_json"),
                    boxedSeed
                ));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read goal test result for " + runId + "/" + testId, e);
        }
    }

    public synchronized List<ProgressSnapshotWrite> listProgressSnapshots(String runId, String testId) throws IOException {
        String sql = """
            SELECT run_id, test_id, turn_number, collected_fields_json, pending_fields_json, issues_json, captured_at
            FROM goal_progress_snapshots
            WHERE run_id = ? AND test_id = ?
            ORDER BY turn_number ASC, id ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, runId);
            statement.setString(2, testId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<ProgressSnapshotWrite> snapshots = new ArrayList<>();
                while (resultSet.next()) {
                    snapshots.add(new ProgressSnapshotWrite(
                        resultSet.getString("run_id"),
                        resultSet.getString("test_id"),
                        resultSet.getInt("turn_number"),
                        resultSet.getString("collected_fields_json"),
                        resultSet.getString("pending_fields_json"),
                        resultSet.getString("issues_json"),
                        instant(resultSet.getString("captured_at"))
                    ));
                }
                return snapshots;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list progress snapshots for " + runId + "/" + testId, e);
        }
    }

    private void write(Connection connection, WriteOperation operation) throws SQLException {
        if (operation instanceof TestResultWrite result) {
            writeTestResult(connection, result);
        } else if (operation instanceof TranscriptWrite transcript) {
            writeTranscript(connection, transcript);
        } else if (operation instanceof FindingWrite finding) {
            writeFinding(connection, finding);
        } else if (operation instanceof ApiCallWrite call) {
            writeApiCall(connection, call);
        } else if (operation instanceof GoalTestResultWrite goalResult) {
            writeGoalTestResult(connection, goalResult);
        } else if (operation instanceof ProgressSnapshotWrite snapshot) {
            writeSnapshot(connection, snapshot);
        } else {
            throw new IllegalArgumentException("Unsupported write operation: " + operation.kind());
        }
    }

    private void writeTestResult(Connection connection, TestResultWrite result) throws SQLException {
        String sql = """
            INSERT INTO test_results
                (run_id, test_id, test_name, category, status, started_at, completed_at, duration_ms, error_message)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(run_id, test_id) DO UPDATE SET
                test_name = excluded.test_name,
                category = excluded.category,
                status = excluded.status,
                started_at = excluded.started_at,
                completed_at = excluded.completed_at,
                duration_ms = excluded.duration_ms,
                error_message = excluded.error_message
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, result.runId());
            statement.setString(2, result.testId());
            statement.setString(3, result.testName());
            statement.setString(4, result.category());
            statement.setString(5, result.status());
            statement.setString(6, text(result.startedAt()));
            statement.setString(7, text(result.completedAt()));
            statement.setLong(8, result.durationMs());
            statement.setString(9, result.errorMessage());
            statement.executeUpdate();
        }
    }

    private void writeTranscript(Connection connection, TranscriptWrite transcript) throws SQLException {
        String sql = """
            INSERT INTO transcripts (result_id, run_id, test_id, transcript_json)
            VALUES ((SELECT id FROM test_results WHERE run_id = ? AND test_id = ?), ?, ?, ?)
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, transcript.runId());
            statement.setString(2, transcript.testId());
            statement.setString(3, transcript.runId());
            statement.setString(4, transcript.testId());
            statement.setString(5, transcript.transcriptJson());
            statement.executeUpdate();
        }
    }

    private void writeFinding(Connection connection, FindingWrite finding) throws SQLException {
        String sql = """
            INSERT INTO findings
                (run_id, test_id, type, severity, title, description, affected_step, agent_question,
                 expected_behavior, actual_behavior, recommendation)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, finding.runId());
            statement.setString(2, finding.testId());
            statement.setString(3, finding.type());
            statement.setString(4, finding.severity());
            statement.setString(5, finding.title());
            statement.setString(6, finding.description());
            statement.setString(7, finding.affectedStep());
            statement.setString(8, finding.agentQuestion());
            statement.setString(9, finding.expectedBehavior());
            statement.setString(10, finding.actualBehavior());
            statement.setString(11, finding.recommendation());
            statement.executeUpdate();
        }
    }

    private void writeApiCall(Connection connection, ApiCallWrite call) throws SQLException {
        String sql = """
            INSERT INTO api_calls
                (run_id, test_id, step_id, tool_name, request_json, response_json, duration_ms, status, timestamp)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, call.runId());
            statement.setString(2, call.testId());
            statement.setString(3, call.stepId());
            statement.setString(4, call.toolName());
            statement.setString(5, call.requestJson());
            statement.setString(6, call.responseJson());
            setLong(statement, 7, call.durationMs());
            statement.setString(8, call.status());
            statement.setString(9, text(call.timestamp()));
            statement.executeUpdate();
        }
    }

    private void writeGoalTestResult(Connection connection, GoalTestResultWrite result) throws SQLException {
        String sql = """
            INSERT INTO goal_test_results
                (run_id, test_id, passed, turn_count, duration_ms, started_at, completed_at, goal_results_json,
                 constraint_violations_json, summary_text, resolved_persona_json, persona_seed)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(run_id, test_id) DO UPDATE SET
                passed = excluded.passed,
                turn_count = excluded.turn_count,
                duration_ms = excluded.duration_ms,
                started_at = excluded.started_at,
                completed_at = excluded.completed_at,
                goal_results_json = excluded.goal_results_json,
                constraint_violations_json = excluded.constraint_violations_json,
                summary_text = excluded.summary_text,
                resolved_persona_json = excluded.resolved_persona_json,
                persona_seed = excluded.persona_seed
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, result.runId());
            statement.setString(2, result.testId());
            statement.setInt(3, result.passed() ? 1 : 0);
            statement.setInt(4, result.turnCount());
            statement.setLong(5, result.durationMs());
            statement.setString(6, text(result.startedAt()));
            statement.setString(7, text(result.completedAt()));
            statement.setString(8, result.goalResultsJson());
            statement.setString(9, result.constraintViolationsJson());
            statement.setString(10, result.summary());
            statement.setString(11, result.resolvedPersonaJson());
            setLong(statement, 12, result.personaSeed());
            statement.executeUpdate();
        }
    }

    private void writeSnapshot(Connection connection, ProgressSnapshotWrite snapshot) throws SQLException {
        String sql = """
            INSERT INTO goal_progress_snapshots
                (run_id, test_id, turn_number, collected_fields_json, pending_fields_json, issues_json, captured_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, snapshot.runId());
            statement.setString(2, snapshot.testId());
            statement.setInt(3, snapshot.turnNumber());
            statement.setString(4, snapshot.collectedFieldsJson());
            statement.setString(5, snapshot.pendingFieldsJson());
            statement.setString(6, snapshot.issuesJson());
            statement.setString(7, text(snapshot.capturedAt()));
            statement.executeUpdate();
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            for (String ddl : SCHEMA) {
                statement.execute(ddl);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite result store", e);
        }
    }

    private static void setLong(PreparedStatement statement, int index, Long value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, value);
        }
    }

    private static String text(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private static Instant instant(String value) {
        return value == null || value.isBlank() ? null : Instant.parse(value);
    }

    public record TestRunRecord(String runId, String name, String status, Instant startedAt, Instant completedAt) {
    }

    public record StoredTranscript(Long resultId, String transcriptJson) {
    }
}
