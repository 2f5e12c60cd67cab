package io.convotest.core.classify;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Classification(
    ResponseCategory category,
    double confidence,
    List<DataField> dataFields,
    ConfirmationSubject confirmationSubject,
    ExpectedAnswer expectedAnswer,
    List<String> options,
    String infoProvided,
    TerminalState terminalState,
    boolean bookingMentioned,
    boolean transferMentioned,
    boolean bookingConfirmedThisTurn,
    String matchedPattern,
    String reasoning,
    IntentDetectionResult legacyIntent
) {
    public Classification {
        Objects.requireNonNull(category, "category must not be null");
        dataFields = dataFields == null ? List.of() : List.copyOf(dataFields);
        options = options == null ? List.of() : List.copyOf(options);
        infoProvided = infoProvided == null ? "" : infoProvided;
        terminalState = terminalState == null ? TerminalState.NONE : terminalState;
        matchedPattern = matchedPattern == null ? "" : matchedPattern;
        reasoning = reasoning == null ? "" : reasoning;
    }

    public static Builder builder(ResponseCategory category, double confidence) {
        return new Builder(category, confidence);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(category, confidence);
        builder.dataFields = dataFields;
        builder.confirmationSubject = confirmationSubject;
        builder.expectedAnswer = expectedAnswer;
        builder.options = options;
        builder.infoProvided = infoProvided;
        builder.terminalState = terminalState;
        builder.bookingMentioned = bookingMentioned;
        builder.transferMentioned = transferMentioned;
        builder.bookingConfirmedThisTurn = bookingConfirmedThisTurn;
        builder.matchedPattern = matchedPattern;
        builder.reasoning = reasoning;
        builder.legacyIntent = legacyIntent;
        return builder;
    }

    public DataField primaryField() {
        return dataFields.isEmpty() ? null : dataFields.get(0);
    }

    public static final class Builder {
        private ResponseCategory category;
        private double confidence;
        private List<DataField> dataFields = List.of();
        private ConfirmationSubject confirmationSubject;
        private ExpectedAnswer expectedAnswer;
        private List<String> options = List.of();
        private String infoProvided = "";
        private TerminalState terminalState = TerminalState.NONE;
        private boolean bookingMentioned;
        private boolean transferMentioned;
        private boolean bookingConfirmedThisTurn;
        private String matchedPattern = "";
        private String reasoning = "";
        private IntentDetectionResult legacyIntent;

        private Builder(ResponseCategory category, double confidence) {
            this.category = category;
            this.confidence = confidence;
        }

        public Builder category(ResponseCategory value) {
            this.category = value;
            return this;
        }

        public Builder confidence(double value) {
            this.confidence = value;
            return this;
        }

        public Builder dataFields(List<DataField> value) {
            this.dataFields = value;
            return this;
        }

        public Builder confirmationSubject(ConfirmationSubject value) {
            this.confirmationSubject = value;
            return this;
        }

        public Builder expectedAnswer(ExpectedAnswer value) {
            this.expectedAnswer = value;
            return this;
        }

        public Builder options(List<String> value) {
            this.options = value;
            return this;
        }

        public Builder infoProvided(String value) {
            this.infoProvided = value;
            return this;
        }

        public Builder terminalState(TerminalState value) {
            this.terminalState = value;
            return this;
        }

        public Builder bookingMentioned(boolean value) {
            this.bookingMentioned = value;
            return this;
        }

        public Builder transferMentioned(boolean value) {
            this.transferMentioned = value;
            return this;
        }

        public Builder bookingConfirmedThisTurn(boolean value) {
            this.bookingConfirmedThisTurn = value;
            return this;
        }

        public Builder matchedPattern(String value) {
            this.matchedPattern = value;
            return this;
        }

        public Builder reasoning(String value) {
            this.reasoning = value;
            return this;
        }

        public Builder legacyIntent(IntentDetectionResult value) {
            this.legacyIntent = value;
            return this;
        }

        public Classification build() {
            return new Classification(
                category,
                confidence,
                dataFields,
                confirmationSubject,
                expectedAnswer,
                options,
                infoProvided,
                terminalState,
                bookingMentioned,
                transferMentioned,
                bookingConfirmedThisTurn,
                matchedPattern,
                reasoning,
                legacyIntent
            );
        }
    }
}
