package io.convotest.core.storage;

import io.convotest.core.storage.WriteOperation.ApiCallWrite;
import io.convotest.core.storage.WriteOperation.FindingWrite;
import io.convotest.core.storage.WriteOperation.GoalTestResultWrite;
import io.convotest.core.storage.WriteOperation.ProgressSnapshotWrite;
import io.convotest.core.storage.WriteOperation.TestResultWrite;
import io.convotest.core.storage.WriteOperation.TranscriptWrite;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

public final class BatchingResultRepository implements ResultRepository {
    private final BatchWriter writer;

    public BatchingResultRepository(BatchWriter writer) {
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    @Override
    public void saveTestResult(TestResultWrite result) throws IOException {
        writer.add(result);
    }

    @Override
    public void saveTranscript(TranscriptWrite transcript) throws IOException {
        writer.add(transcript);
    }

    @Override
    public void saveFindings(List<FindingWrite> findings) throws IOException {
        for (FindingWrite finding : findings) {
            writer.add(finding);
        }
    }

    @Override
    public void saveApiCall(ApiCallWrite call) throws IOException {
        writer.add(call);
    }

    @Override
    public void saveGoalTestResult(GoalTestResultWrite result) throws IOException {
        writer.add(result);
    }

    @Override
    public void saveGoalProgressSnapshot(ProgressSnapshotWrite snapshot) throws IOException {
        writer.add(snapshot);
    }

    public BatchWriter writer() {
        return writer;
    }
}
