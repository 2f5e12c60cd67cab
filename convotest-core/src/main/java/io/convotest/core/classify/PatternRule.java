package io.convotest.core.classify;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

public record PatternRule(
    String name,
    ResponseCategory category,
    double confidence,
    int priority,
    List<Pattern> patterns,
    TerminalState terminalState,
    List<DataField> dataFields,
    ConfirmationSubject confirmationSubject,
    String infoProvided,
    boolean bookingConfirmed,
    boolean extractsOptions
) {
    public PatternRule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(category, "category must not be null");
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        terminalState = terminalState == null ? TerminalState.NONE : terminalState;
        dataFields = dataFields == null ? List.of() : List.copyOf(dataFields);
        infoProvided = infoProvided == null ? "" : infoProvided;
    }

    public static PatternRule of(String name, ResponseCategory category, double confidence, int priority, String... regexes) {
        List<Pattern> compiled = Arrays.stream(regexes)
            .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
            .toList();
        return new PatternRule(name, category, confidence, priority, compiled, TerminalState.NONE, List.of(), null, "", false, false);
    }

    public PatternRule terminal(TerminalState state) {
        return new PatternRule(name, category, confidence, priority, patterns, state, dataFields, confirmationSubject,
            infoProvided, bookingConfirmed, extractsOptions);
    }

    public PatternRule fields(DataField... fields) {
        return new PatternRule(name, category, confidence, priority, patterns, terminalState, List.of(fields),
            confirmationSubject, infoProvided, bookingConfirmed, extractsOptions);
    }

    public PatternRule subject(ConfirmationSubject subject) {
        return new PatternRule(name, category, confidence, priority, patterns, terminalState, dataFields, subject,
            infoProvided, bookingConfirmed, extractsOptions);
    }

    public PatternRule info(String info) {
        return new PatternRule(name, category, confidence, priority, patterns, terminalState, dataFields,
            confirmationSubject, info, bookingConfirmed, extractsOptions);
    }

    public PatternRule confirmsBooking() {
        return new PatternRule(name, category, confidence, priority, patterns, terminalState, dataFields,
            confirmationSubject, infoProvided, true, extractsOptions);
    }

    public PatternRule offersOptions() {
        return new PatternRule(name, category, confidence, priority, patterns, terminalState, dataFields,
            confirmationSubject, infoProvided, bookingConfirmed, true);
    }

    public Pattern firstMatch(String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return pattern;
            }
        }
        return null;
    }
}
