package io.convotest.core.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.convotest.core.config.model.BatchWriterSettings;
import io.convotest.core.storage.WriteOperation.TestResultWrite;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class BatchWriterTest {

    @Test
    void shouldFlushFullBatchesSynchronouslyAndLeaveRemainderQueued() throws Exception {
        RecordingCommitter committer = new RecordingCommitter();
        BatchWriter writer = new BatchWriter(committer, new BatchWriterSettings(50, 0, true), Clock.systemUTC());

        List<WriteOperation> operations = operations(125);
        for (WriteOperation operation : operations) {
            writer.add(operation);
        }

        assertThat(committer.batchSizes()).containsExactly(50, 50);
        assertThat(writer.queueSize()).isEqualTo(25);

        assertThat(writer.flush()).isEqualTo(25);
        assertThat(committer.batchSizes()).containsExactly(50, 50, 25);
        assertThat(committer.committed()).containsExactlyElementsOf(operations);
        assertThat(writer.getStats().totalWrites()).isEqualTo(125);
        assertThat(writer.getStats().batchesWritten()).isEqualTo(3);
        assertThat(writer.getStats().currentQueueSize()).isZero();
    }

    @Test
    void shouldRequeueFailedBatchAndCommitEveryOperationExactlyOnce() throws Exception {
        RecordingCommitter committer = new RecordingCommitter();
        committer.failOnCall = 2;
        RecordingListener listener = new RecordingListener();
        BatchWriter writer = new BatchWriter(committer, new BatchWriterSettings(50, 0, true), Clock.systemUTC());
        writer.addListener(listener);

        List<WriteOperation> operations = operations(125);
        for (WriteOperation operation : operations) {
            writer.add(operation);
        }
        writer.flush();

        assertThat(committer.committed()).containsExactlyElementsOf(operations);
        assertThat(committer.committed()).doesNotHaveDuplicates();
        assertThat(listener.errors).containsExactly(50);
        assertThat(listener.flushes.stream().mapToInt(Integer::intValue).sum()).isEqualTo(125);
        assertThat(writer.queueSize()).isZero();
    }

    @Test
    void shouldThrowFromExplicitFlushAndKeepOperationsQueued() throws Exception {
        RecordingCommitter committer = new RecordingCommitter();
        committer.failOnCall = 1;
        BatchWriter writer = new BatchWriter(committer, new BatchWriterSettings(10, 0, true), Clock.systemUTC());
        List<WriteOperation> operations = operations(3);
        for (WriteOperation operation : operations) {
            writer.add(operation);
        }

        assertThatThrownBy(writer::flush).isInstanceOf(IOException.class).hasMessageContaining("forced failure");
        assertThat(writer.queueSize()).isEqualTo(3);

        assertThat(writer.flush()).isEqualTo(3);
        assertThat(committer.committed()).containsExactlyElementsOf(operations);
    }

    @Test
    void shouldReturnZeroWhenQueueIsEmpty() throws Exception {
        RecordingCommitter committer = new RecordingCommitter();
        BatchWriter writer = new BatchWriter(committer, new BatchWriterSettings(10, 0, true), Clock.systemUTC());

        assertThat(writer.flush()).isZero();
        assertThat(committer.batchSizes()).isEmpty();
    }

    @Test
    void shouldWriteImmediatelyWhenDisabled() throws Exception {
        RecordingCommitter committer = new RecordingCommitter();
        BatchWriter writer = new BatchWriter(committer, new BatchWriterSettings(50, 0, false), Clock.systemUTC());

        writer.add(operations(1).get(0));
        writer.add(operations(1).get(0));

        assertThat(committer.batchSizes()).containsExactly(1, 1);
        assertThat(writer.queueSize()).isZero();
        assertThat(writer.getStats().enabled()).isFalse();
    }

    @Test
    void shouldFlushQueueWhenDisabledAtRuntime() throws Exception {
        RecordingCommitter committer = new RecordingCommitter();
        BatchWriter writer = new BatchWriter(committer, new BatchWriterSettings(50, 0, true), Clock.systemUTC());
        for (WriteOperation operation : operations(4)) {
            writer.add(operation);
        }

        writer.setEnabled(false);

        assertThat(committer.batchSizes()).containsExactly(4);
        assertThat(writer.isEnabled()).isFalse();
    }

    @Test
    void shouldKeepBatchingWithTimerWhenDisableFlushFails() throws Exception {
        RecordingCommitter committer = new RecordingCommitter();
        committer.failOnCall = 1;
        try (BatchWriter writer = new BatchWriter(committer, new BatchWriterSettings(10, 200, true), Clock.systemUTC())) {
            List<WriteOperation> operations = operations(3);
            for (WriteOperation operation : operations) {
                writer.add(operation);
            }

            assertThatThrownBy(() -> writer.setEnabled(false)).isInstanceOf(IOException.class);
            assertThat(writer.isEnabled()).isTrue();

            long deadline = System.currentTimeMillis() + 5_000;
            while (committer.committed().size() < 3 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }

            assertThat(committer.committed()).containsExactlyElementsOf(operations);
            assertThat(writer.queueSize()).isZero();
        }
    }

    @Test
    void shouldDrainOperationsQueuedBehindInFlightFlushOnShutdown() throws Exception {
        BlockingCommitter committer = new BlockingCommitter();
        BatchWriter writer = new BatchWriter(committer, new BatchWriterSettings(2, 0, true), Clock.systemUTC());
        List<WriteOperation> operations = operations(3);

        Thread sizeTriggered = new Thread(() -> {
            try {
                writer.add(operations.get(0));
                writer.add(operations.get(1));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        sizeTriggered.start();
        assertThat(committer.entered.await(5, TimeUnit.SECONDS)).isTrue();
        writer.add(operations.get(2));

        Thread closing = new Thread(() -> {
            try {
                writer.shutdown();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        closing.start();
        committer.release.countDown();
        sizeTriggered.join(5_000);
        closing.join(5_000);

        assertThat(committer.committed).containsExactlyElementsOf(operations);
        assertThat(writer.queueSize()).isZero();
    }

    @Test
    void shouldFlushRemainderOnTimerTick() throws Exception {
        RecordingCommitter committer = new RecordingCommitter();
        try (BatchWriter writer = new BatchWriter(committer, new BatchWriterSettings(50, 20, true), Clock.systemUTC())) {
            for (WriteOperation operation : operations(7)) {
                writer.add(operation);
            }

            long deadline = System.currentTimeMillis() + 5_000;
            while (committer.committed().size() < 7 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }

            assertThat(committer.committed()).hasSize(7);
            assertThat(writer.queueSize()).isZero();
        }
    }

    @Test
    void shouldFlushOnClose() throws Exception {
        RecordingCommitter committer = new RecordingCommitter();
        BatchWriter writer = new BatchWriter(committer, new BatchWriterSettings(50, 60_000, true), Clock.systemUTC());
        for (WriteOperation operation : operations(5)) {
            writer.add(operation);
        }

        writer.close();

        assertThat(committer.committed()).hasSize(5);
    }

    private static List<WriteOperation> operations(int count) {
        return IntStream.rangeClosed(1, count)
            .<WriteOperation>mapToObj(i -> new TestResultWrite("run-1", "test-" + i, null, null, "passed", null, null, i, null))
            .toList();
    }

    private static final class RecordingCommitter implements BatchCommitter {
        private final List<List<WriteOperation>> batches = new CopyOnWriteArrayList<>();
        private int calls;
        private int failOnCall = -1;

        @Override
        public synchronized void commit(List<WriteOperation> batch) throws IOException {
            calls++;
            if (calls == failOnCall) {
                throw new IOException("forced failure");
            }
            batches.add(List.copyOf(batch));
        }

        List<Integer> batchSizes() {
            return batches.stream().map(List::size).toList();
        }

        List<WriteOperation> committed() {
            List<WriteOperation> all = new ArrayList<>();
            batches.forEach(all::addAll);
            return all;
        }
    }

    private static final class BlockingCommitter implements BatchCommitter {
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final List<WriteOperation> committed = new CopyOnWriteArrayList<>();

        @Override
        public void commit(List<WriteOperation> batch) throws IOException {
            entered.countDown();
            try {
                if (!release.await(5, TimeUnit.SECONDS)) {
                    throw new IOException("not released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
            committed.addAll(batch);
        }
    }

    private static final class RecordingListener implements BatchWriterListener {
        private final List<Integer> flushes = new CopyOnWriteArrayList<>();
        private final List<Integer> errors = new CopyOnWriteArrayList<>();

        @Override
        public void onFlush(int count) {
            flushes.add(count);
        }

        @Override
        public void onError(Exception error, int count) {
            errors.add(count);
        }
    }
}
