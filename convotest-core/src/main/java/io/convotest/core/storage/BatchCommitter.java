package io.convotest.core.storage;

import java.io.IOException;
import java.util.List;

@FunctionalInterface
public interface BatchCommitter {
    void commit(List<WriteOperation> batch) throws IOException;
}
