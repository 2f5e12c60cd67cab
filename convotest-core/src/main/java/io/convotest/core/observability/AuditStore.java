package io.convotest.core.observability;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public interface AuditStore {
    List<AuditEvent> load() throws IOException;

    void save(List<AuditEvent> events) throws IOException;

    default void append(AuditEvent event, int maxEvents) throws IOException {
        List<AuditEvent> all = new ArrayList<>(load());
        all.add(event);
        if (all.size() > maxEvents) {
            all = new ArrayList<>(all.subList(all.size() - maxEvents, all.size()));
        }
        save(all);
    }
}
