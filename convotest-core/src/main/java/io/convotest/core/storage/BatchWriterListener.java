package io.convotest.core.storage;

public interface BatchWriterListener {
    default void onFlush(int count) {
    }

    default void onError(Exception error, int count) {
    }
}
