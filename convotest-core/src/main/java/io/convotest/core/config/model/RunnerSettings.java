package io.convotest.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RunnerSettings(
    @JsonAlias({"max_turns"}) int maxTurns,
    @JsonAlias({"delay_between_turns_ms"}) long delayBetweenTurnsMs,
    @JsonAlias({"turn_timeout_ms"}) long turnTimeoutMs,
    @JsonAlias({"save_progress_snapshots"}) boolean saveProgressSnapshots,
    @JsonAlias({"continue_on_error"}) boolean continueOnError,
    @JsonAlias({"use_category_based_system"}) boolean useCategoryBasedSystem,
    int concurrency
) {

    public static RunnerSettings defaults() {
        return new RunnerSettings(50, 500, 30_000, true, true, true, 1);
    }
}
