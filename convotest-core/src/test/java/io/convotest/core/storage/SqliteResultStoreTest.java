package io.convotest.core.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.convotest.core.storage.SqliteResultStore.StoredTranscript;
import io.convotest.core.storage.SqliteResultStore.TestRunRecord;
import io.convotest.core.storage.WriteOperation.ApiCallWrite;
import io.convotest.core.storage.WriteOperation.FindingWrite;
import io.convotest.core.storage.WriteOperation.GoalTestResultWrite;
import io.convotest.core.storage.WriteOperation.ProgressSnapshotWrite;
import io.convotest.core.storage.WriteOperation.TestResultWrite;
import io.convotest.core.storage.WriteOperation.TranscriptWrite;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteResultStoreTest {
    private static final Instant STARTED = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant COMPLETED = Instant.parse("2026-03-01T10:00:04Z");

    @TempDir
    Path tempDir;

    @Test
    void shouldCommitMixedBatchAndLinkTranscriptToResult() throws Exception {
        SqliteResultStore store = new SqliteResultStore(tempDir.resolve("db/results.db"));
        store.createRun("run-1", "smoke", STARTED);

        store.commit(List.of(
            new TestResultWrite("run-1", "GOAL-HAPPY-001", "Happy path", "happy-path", "passed", STARTED, COMPLETED, 4000, null),
            new TranscriptWrite("run-1", "GOAL-HAPPY-001", "[{\"role\":\"user\",\"content\":\"Hi\"}]"),
            new FindingWrite("run-1", "GOAL-HAPPY-001", "prompt-issue", "high", "Goal failed: collect-phone",
                "phone missing", null, null, null, null, "Missing fields: parent_phone"),
            new ApiCallWrite("run-1", "GOAL-HAPPY-001", "turn-2", "lookup_patient", "{\"q\":1}", "{\"ok\":true}",
                120L, "completed", COMPLETED),
            new GoalTestResultWrite("run-1", "GOAL-HAPPY-001", true, 6, 4000, STARTED, COMPLETED,
                "[]", "[]", "All goals passed", "{\"name\":\"Sarah\"}", 42L),
            new ProgressSnapshotWrite("run-1", "GOAL-HAPPY-001", 2, "[]", "[\"parent_phone\"]", "[]", COMPLETED)
        ));

        List<TestResultWrite> results = store.listTestResults("run-1");
        assertThat(results).hasSize(1);
        assertThat(results.get(0).status()).isEqualTo("passed");
        assertThat(results.get(0).durationMs()).isEqualTo(4000);
        assertThat(results.get(0).startedAt()).isEqualTo(STARTED);

        Optional<StoredTranscript> transcript = store.findTranscript("run-1", "GOAL-HAPPY-001");
        assertThat(transcript).isPresent();
        assertThat(transcript.get().resultId()).isNotNull();
        assertThat(transcript.get().transcriptJson()).contains("Hi");

        assertThat(store.listFindings("run-1")).extracting(FindingWrite::title).containsExactly("Goal failed: collect-phone");
        assertThat(store.listApiCalls("run-1", "GOAL-HAPPY-001")).extracting(ApiCallWrite::toolName)
            .containsExactly("lookup_patient");
        Optional<GoalTestResultWrite> goalResult = store.findGoalTestResult("run-1", "GOAL-HAPPY-001");
        assertThat(goalResult).isPresent();
        assertThat(goalResult.get().personaSeed()).isEqualTo(42L);
        assertThat(goalResult.get().turnCount()).isEqualTo(6);
        assertThat(store.listProgressSnapshots("run-1", "GOAL-HAPPY-001")).extracting(ProgressSnapshotWrite::turnNumber)
            .containsExactly(2);
    }

    @Test
    void shouldLeaveNoRowsWhenLaterOperationInBatchFails() throws Exception {
        Path dbPath = tempDir.resolve("results.db");
        SqliteResultStore store = new SqliteResultStore(dbPath);
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
             Statement statement = connection.createStatement()) {
            statement.execute("""
                CREATE TRIGGER reject_api_calls BEFORE INSERT ON api_calls
                BEGIN SELECT RAISE(ABORT, 'api calls rejected'); END
                """);
        }

        assertThatThrownBy(() -> store.commit(List.of(
            new TestResultWrite("run-1", "T1", "First", "edge-case", "passed", STARTED, COMPLETED, 10, null),
            new TranscriptWrite("run-1", "T1", "[]"),
            new GoalTestResultWrite("run-1", "T1", true, 2, 10, STARTED, COMPLETED, "[]", "[]", "ok", null, null),
            new ApiCallWrite("run-1", "T1", "turn-1", "lookup_patient", "{}", "{}", 5L, "completed", COMPLETED)
        ))).isInstanceOf(IOException.class).hasMessageContaining("Failed to commit batch of 4 operations");

        assertThat(store.listTestResults("run-1")).isEmpty();
        assertThat(store.findTranscript("run-1", "T1")).isEmpty();
        assertThat(store.findGoalTestResult("run-1", "T1")).isEmpty();
        assertThat(store.listApiCalls("run-1", "T1")).isEmpty();
    }

    @Test
    void shouldUpsertResultForSameRunAndTest() throws Exception {
        SqliteResultStore store = new SqliteResultStore(tempDir.resolve("results.db"));

        store.commit(List.of(new TestResultWrite("run-1", "T1", "First", "edge-case", "failed", STARTED, COMPLETED, 10, "boom")));
        store.commit(List.of(new TestResultWrite("run-1", "T1", "First", "edge-case", "passed", STARTED, COMPLETED, 20, null)));

        List<TestResultWrite> results = store.listTestResults("run-1");
        assertThat(results).hasSize(1);
        assertThat(results.get(0).status()).isEqualTo("passed");
        assertThat(results.get(0).errorMessage()).isNull();
    }

    @Test
    void shouldTrackRunLifecycle() throws Exception {
        SqliteResultStore store = new SqliteResultStore(tempDir.resolve("results.db"));
        store.createRun("run-old", "nightly", STARTED);
        store.createRun("run-new", "nightly", COMPLETED);
        store.completeRun("run-old", "failed", COMPLETED);

        List<TestRunRecord> runs = store.listRuns(10);

        assertThat(runs).extracting(TestRunRecord::runId).containsExactly("run-new", "run-old");
        assertThat(runs.get(0).status()).isEqualTo("running");
        assertThat(runs.get(1).status()).isEqualTo("failed");
        assertThat(runs.get(1).completedAt()).isEqualTo(COMPLETED);
    }

    @Test
    void shouldReturnEmptyResultsForFreshDatabase() throws Exception {
        SqliteResultStore store = new SqliteResultStore(tempDir.resolve("results.db"));

        assertThat(store.listRuns(5)).isEmpty();
        assertThat(store.listTestResults("missing")).isEmpty();
        assertThat(store.findTranscript("missing", "T1")).isEmpty();
        assertThat(store.findGoalTestResult("missing", "T1")).isEmpty();
    }
}
