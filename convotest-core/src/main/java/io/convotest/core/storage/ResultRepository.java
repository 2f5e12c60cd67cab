package io.convotest.core.storage;

import io.convotest.core.storage.WriteOperation.ApiCallWrite;
import io.convotest.core.storage.WriteOperation.FindingWrite;
import io.convotest.core.storage.WriteOperation.GoalTestResultWrite;
import io.convotest.core.storage.WriteOperation.ProgressSnapshotWrite;
import io.convotest.core.storage.WriteOperation.TestResultWrite;
import io.convotest.core.storage.WriteOperation.TranscriptWrite;
import java.io.IOException;
import java.util.List;

public interface ResultRepository {
    void saveTestResult(TestResultWrite result) throws IOException;

    void saveTranscript(TranscriptWrite transcript) throws IOException;

    void saveFindings(List<FindingWrite> findings) throws IOException;

    void saveApiCall(ApiCallWrite call) throws IOException;

    void saveGoalTestResult(GoalTestResultWrite result) throws IOException;

    void saveGoalProgressSnapshot(ProgressSnapshotWrite snapshot) throws IOException;
}
