package io.convotest.core.extract;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.convotest.core.progress.CollectableField;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractionRules(int version, List<Family> families) {
    public ExtractionRules {
        families = families == null ? List.of() : List.copyOf(families);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Family(CollectableField field, List<String> patterns, List<String> stopWords) {
        public Family {
            patterns = patterns == null ? List.of() : List.copyOf(patterns);
            stopWords = stopWords == null ? List.of() : List.copyOf(stopWords);
        }
    }
}
