package io.convotest.core.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FileAuditStore implements AuditStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileAuditStore.class);

    private final Path path;
    private final ObjectMapper mapper;
    private int lineCount = -1;

    public FileAuditStore(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized List<AuditEvent> load() throws IOException {
        if (!Files.exists(path)) {
            lineCount = 0;
            return List.of();
        }
        List<AuditEvent> events = new ArrayList<>();
        int lineNumber = 0;
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(mapper.readValue(line, AuditEvent.class));
            } catch (JsonProcessingException e) {
                LOG.warn("Skipping unreadable audit line {} in {}: {}", lineNumber, path, e.getOriginalMessage());
            }
        }
        lineCount = events.size();
        return events;
    }

    @Override
    public synchronized void save(List<AuditEvent> events) throws IOException {
        createParent();
        StringBuilder out = new StringBuilder();
        for (AuditEvent event : events) {
            out.append(mapper.writeValueAsString(event)).append('\n');
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, out.toString(), StandardCharsets.UTF_8);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        lineCount = events.size();
    }

    @Override
    public synchronized void append(AuditEvent event, int maxEvents) throws IOException {
        if (lineCount < 0) {
            load();
        }
        if (lineCount + 1 > maxEvents) {
            AuditStore.super.append(event, maxEvents);
            return;
        }
        createParent();
        Files.writeString(
            path,
            mapper.writeValueAsString(event) + "\n",
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND
        );
        lineCount++;
    }

    private void createParent() throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
