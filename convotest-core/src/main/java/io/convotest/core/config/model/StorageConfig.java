package io.convotest.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String workspace,
    @JsonAlias({"results_db"}) String resultsDb,
    @JsonAlias({"experiments_db"}) String experimentsDb,
    @JsonAlias({"audit_file"}) String auditFile
) {

    public static StorageConfig defaults() {
        return new StorageConfig("~/.convotest/workspace", "results.db", "experiments.db", "audit-events.jsonl");
    }
}
