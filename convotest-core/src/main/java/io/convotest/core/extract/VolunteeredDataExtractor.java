package io.convotest.core.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.convotest.core.progress.CollectableField;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class VolunteeredDataExtractor {
    public static final String DEFAULT_RULES_RESOURCE = "/volunteered-data.json";

    private final int version;
    private final List<CompiledFamily> families;

    public VolunteeredDataExtractor(ExtractionRules rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        this.version = rules.version();
        this.families = rules.families().stream().map(CompiledFamily::compile).toList();
    }

    public static VolunteeredDataExtractor fromClasspath() {
        return fromClasspath(DEFAULT_RULES_RESOURCE);
    }

    public static VolunteeredDataExtractor fromClasspath(String resource) {
        try (InputStream in = VolunteeredDataExtractor.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Extraction rules not found on classpath: " + resource);
            }
            return new VolunteeredDataExtractor(new ObjectMapper().readValue(in, ExtractionRules.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load extraction rules " + resource, e);
        }
    }

    public int rulesVersion() {
        return version;
    }

    public List<ExtractedField> extract(String message) {
        if (message == null || message.isBlank()) {
            return List.of();
        }
        List<ExtractedField> found = new ArrayList<>();
        for (CompiledFamily family : families) {
            String value = family.firstMatch(message);
            if (value != null) {
                found.add(new ExtractedField(family.field(), value));
            }
        }
        return found;
    }

    private record CompiledFamily(CollectableField field, List<Pattern> patterns, Set<String> stopWords) {

        static CompiledFamily compile(ExtractionRules.Family family) {
            List<Pattern> compiled = family.patterns().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
            Set<String> stop = family.stopWords().stream()
                .map(w -> w.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
            return new CompiledFamily(family.field(), compiled, stop);
        }

        String firstMatch(String message) {
            for (Pattern pattern : patterns) {
                Matcher matcher = pattern.matcher(message);
                if (!matcher.find()) {
                    continue;
                }
                String value = accept(matcher.group(1).trim());
                if (value != null) {
                    return value;
                }
            }
            return null;
        }

        // A stop word in first position rejects the match; later stop words end the value.
        private String accept(String raw) {
            if (stopWords.isEmpty()) {
                return raw.isEmpty() ? null : raw;
            }
            String[] words = raw.split("\\s+");
            List<String> kept = new ArrayList<>();
            for (String word : words) {
                if (stopWords.contains(word.toLowerCase(Locale.ROOT))) {
                    break;
                }
                kept.add(word);
            }
            return kept.isEmpty() ? null : String.join(" ", kept);
        }
    }
}
