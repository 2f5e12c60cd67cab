package io.convotest.core.storage;

import io.convotest.core.config.model.BatchWriterSettings;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queues write operations and commits them in batches.
 *
 * <p>A flush takes the whole queue and hands it to the {@link BatchCommitter} in one call. When the
 * commit fails the batch goes back to the front of the queue in its original order, so a later flush
 * retries it. Only one flush runs at a time; a flush requested while another is running, or against
 * an empty queue, returns without doing anything.
 *
 * <p>Reaching the batch size flushes on the thread that called {@link #add}. A scheduled timer
 * flushes whatever is left every {@code flushIntervalMs}; an interval of zero or less disables it.
 */
public final class BatchWriter implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(BatchWriter.class);

    private final BatchCommitter committer;
    private final int batchSize;
    private final long flushIntervalMs;
    private final Clock clock;
    private final Deque<WriteOperation> queue = new ArrayDeque<>();
    private final List<BatchWriterListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock flushLock = new ReentrantLock();
    private final Object lock = new Object();

    private ScheduledExecutorService timer;
    private volatile boolean enabled;
    private long totalWrites;
    private long batchesWritten;
    private Instant lastFlushTime;

    public BatchWriter(BatchCommitter committer, BatchWriterSettings settings, Clock clock) {
        this.committer = Objects.requireNonNull(committer, "committer must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (settings.batchSize() <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.batchSize = settings.batchSize();
        this.flushIntervalMs = settings.flushIntervalMs();
        this.enabled = settings.enabled();
        if (enabled) {
            startTimer();
        }
    }

    public void addListener(BatchWriterListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(BatchWriterListener listener) {
        listeners.remove(listener);
    }

    /**
     * Queues an operation. With batching disabled the operation is committed immediately and a commit
     * failure is thrown to the caller.
     */
    public void add(WriteOperation operation) throws IOException {
        Objects.requireNonNull(operation, "operation must not be null");
        if (!enabled) {
            writeImmediately(operation);
            return;
        }
        int size;
        synchronized (lock) {
            queue.addLast(operation);
            size = queue.size();
        }
        if (size >= batchSize) {
            try {
                flush();
            } catch (IOException e) {
                LOG.warn("Size-triggered flush failed, {} operations stay queued: {}", queueSize(), e.getMessage());
            }
        }
    }

    public int flush() throws IOException {
        if (!flushLock.tryLock()) {
            return 0;
        }
        try {
            return commitQueued();
        } finally {
            flushLock.unlock();
        }
    }

    // Waits for a flush in flight, then commits what it left behind.
    private int drain() throws IOException {
        flushLock.lock();
        try {
            return commitQueued();
        } finally {
            flushLock.unlock();
        }
    }

    private int commitQueued() throws IOException {
        List<WriteOperation> batch;
        synchronized (lock) {
            if (queue.isEmpty()) {
                return 0;
            }
            batch = new ArrayList<>(queue);
            queue.clear();
        }
        try {
            committer.commit(batch);
        } catch (IOException | RuntimeException e) {
            requeue(batch);
            LOG.error("Batch flush of {} operations failed, re-queued: {}", batch.size(), e.getMessage(), e);
            notifyError(e, batch.size());
            if (e instanceof IOException io) {
                throw io;
            }
            throw new IOException("Failed to commit batch of " + batch.size() + " operations", e);
        }
        synchronized (lock) {
            totalWrites += batch.size();
            batchesWritten++;
            lastFlushTime = clock.instant();
        }
        LOG.debug("Flushed {} operations", batch.size());
        notifyFlush(batch.size());
        return batch.size();
    }

    /**
     * Switches between batching and immediate writes. Disabling stops the timer and flushes the queue;
     * if that flush fails, batching stays on with the timer running and the error is thrown.
     */
    public void setEnabled(boolean value) throws IOException {
        if (value == enabled) {
            return;
        }
        if (value) {
            enabled = true;
            startTimer();
            return;
        }
        stopTimer();
        enabled = false;
        try {
            drain();
        } catch (IOException e) {
            enabled = true;
            startTimer();
            throw e;
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public BatchWriterStats getStats() {
        synchronized (lock) {
            return new BatchWriterStats(totalWrites, batchesWritten, queue.size(), lastFlushTime, enabled);
        }
    }

    public int queueSize() {
        synchronized (lock) {
            return queue.size();
        }
    }

    /**
     * Stops the timer and flushes what is left, after any flush already in flight. Safe to call with an
     * empty queue and more than once.
     */
    public void shutdown() throws IOException {
        stopTimer();
        drain();
    }

    @Override
    public void close() throws IOException {
        shutdown();
    }

    private void writeImmediately(WriteOperation operation) throws IOException {
        try {
            committer.commit(List.of(operation));
        } catch (IOException e) {
            notifyError(e, 1);
            throw e;
        }
        synchronized (lock) {
            totalWrites++;
            lastFlushTime = clock.instant();
        }
        notifyFlush(1);
    }

    private void requeue(List<WriteOperation> batch) {
        synchronized (lock) {
            for (int i = batch.size() - 1; i >= 0; i--) {
                queue.addFirst(batch.get(i));
            }
        }
    }

    private void scheduledFlush() {
        try {
            flush();
        } catch (IOException e) {
            LOG.warn("Scheduled flush failed, will retry on next tick: {}", e.getMessage());
        }
    }

    private void startTimer() {
        if (flushIntervalMs <= 0) {
            return;
        }
        synchronized (lock) {
            if (timer != null) {
                return;
            }
            timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "convotest-batch-writer");
                thread.setDaemon(true);
                return thread;
            });
            timer.scheduleAtFixedRate(this::scheduledFlush, flushIntervalMs, flushIntervalMs, TimeUnit.MILLISECONDS);
        }
    }

    private void stopTimer() {
        ScheduledExecutorService current;
        synchronized (lock) {
            current = timer;
            timer = null;
        }
        if (current == null) {
            return;
        }
        current.shutdown();
        try {
            if (!current.awaitTermination(flushIntervalMs + 5_000, TimeUnit.MILLISECONDS)) {
                LOG.warn("Batch writer timer did not stop in time");
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.shutdownNow();
        }
    }

    private void notifyFlush(int count) {
        for (BatchWriterListener listener : listeners) {
            try {
                listener.onFlush(count);
            } catch (RuntimeException e) {
                LOG.warn("Batch writer listener failed on flush: {}", e.getMessage(), e);
            }
        }
    }

    private void notifyError(Exception error, int count) {
        for (BatchWriterListener listener : listeners) {
            try {
                listener.onError(error, count);
            } catch (RuntimeException e) {
                LOG.warn("Batch writer listener failed on error: {}", e.getMessage(), e);
            }
        }
    }
}
