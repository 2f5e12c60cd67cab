package io.convotest.core.classify;

import static org.assertj.core.api.Assertions.assertThat;

import io.convotest.core.config.model.ClassifierSettings;
import io.convotest.core.config.model.StrategySettings;
import io.convotest.core.provider.ProviderRegistry;
import io.convotest.core.respond.ResponseStrategyEngine;
import io.convotest.core.respond.TemplateResponseGenerator;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class LegacyResponseClassifierTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-05-10T08:00:00Z"), ZoneOffset.UTC);

    private final ProviderRegistry providers = new ProviderRegistry();
    private final LegacyResponseClassifier classifier = new LegacyResponseClassifier(
        new IntentDetector(ClassifierSettings.defaults(), providers, CLOCK),
        new TemplateResponseGenerator(CLOCK),
        new ResponseStrategyEngine(StrategySettings.defaults(), providers, new Random(1), CLOCK)
    );

    @Test
    void shouldRequireConfidenceForBookingTermination() {
        Classification weak = LegacyResponseClassifier.fromIntent(
            new IntentDetectionResult(AgentIntent.CONFIRMING_BOOKING, 0.6, false, false, "")
        );
        Classification strong = LegacyResponseClassifier.fromIntent(
            new IntentDetectionResult(AgentIntent.CONFIRMING_BOOKING, 0.85, false, false, "")
        );

        assertThat(classifier.isTerminal(weak)).isFalse();
        assertThat(classifier.isTerminal(strong)).isTrue();
    }

    @Test
    void shouldShortCircuitExplicitBookingConfirmation() {
        Classification result = classifier.classify("Great news, your appointment is confirmed!", List.of(), CategoryResponseClassifierTest.persona());

        assertThat(result.legacyIntent().primaryIntent()).isEqualTo(AgentIntent.CONFIRMING_BOOKING);
        assertThat(result.confidence()).isEqualTo(0.95);
        assertThat(result.terminalState()).isEqualTo(TerminalState.BOOKING_CONFIRMED);
        assertThat(classifier.isTerminal(result)).isTrue();
    }

    @Test
    void shouldNotTerminateOnKeywordLevelBookingMatch() {
        Classification result = classifier.classify("Okay, the appointment is all set", List.of(), CategoryResponseClassifierTest.persona());

        assertThat(result.legacyIntent().primaryIntent()).isEqualTo(AgentIntent.CONFIRMING_BOOKING);
        assertThat(result.confidence()).isEqualTo(0.7);
        assertThat(classifier.isTerminal(result)).isFalse();
    }

    @Test
    void shouldAlwaysTerminateOnGoodbyeAndTransfer() {
        Classification goodbye = classifier.classify("Goodbye!", List.of(), CategoryResponseClassifierTest.persona());
        Classification transfer = classifier.classify("Please hold while I transfer you.", List.of(), CategoryResponseClassifierTest.persona());

        assertThat(goodbye.terminalState()).isEqualTo(TerminalState.CONVERSATION_ENDED);
        assertThat(classifier.isTerminal(goodbye)).isTrue();
        assertThat(transfer.legacyIntent().primaryIntent()).isEqualTo(AgentIntent.INITIATING_TRANSFER);
        assertThat(classifier.isTerminal(transfer)).isTrue();
    }

    @Test
    void shouldMapDetectedIntentToDataField() {
        Classification phone = classifier.classify("What's the best phone number to reach you?", List.of(), CategoryResponseClassifierTest.persona());

        assertThat(phone.category()).isEqualTo(ResponseCategory.PROVIDE_DATA);
        assertThat(phone.dataFields()).containsExactly(DataField.CALLER_PHONE);
        assertThat(classifier.toLegacyIntent(phone).primaryIntent()).isEqualTo(AgentIntent.ASKING_PHONE);
        assertThat(classifier.name()).isEqualTo("legacy");
    }

    @Test
    void shouldReportUnknownIntentWithoutKeywordMatch() {
        IntentDetectionResult result = IntentDetector.detectWithKeywords("Blue is a lovely colour");

        assertThat(result.primaryIntent()).isEqualTo(AgentIntent.UNKNOWN);
        assertThat(result.confidence()).isEqualTo(0.3);
        assertThat(result.question()).isFalse();
    }
}
