package io.convotest.core.classify;

import io.convotest.core.conversation.ConversationTurn;
import io.convotest.core.conversation.TurnRole;
import io.convotest.core.persona.Persona;
import io.convotest.core.progress.CollectableField;
import io.convotest.core.respond.ResponseStrategyEngine;
import io.convotest.core.respond.TemplateResponseGenerator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class LegacyResponseClassifier implements ResponseClassifier {
    private static final double TERMINAL_BOOKING_CONFIDENCE = 0.8;
    private static final double TEMPLATE_CONFIDENCE = 0.5;
    private static final Map<AgentIntent, DataField> INTENT_TO_FIELD = new EnumMap<>(AgentIntent.class);

    static {
        INTENT_TO_FIELD.put(AgentIntent.ASKING_PARENT_NAME, DataField.CALLER_NAME);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_SPELL_NAME, DataField.CALLER_NAME_SPELLING);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_SPELL_CHILD_NAME, DataField.CHILD_NAME_SPELLING);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_PHONE, DataField.CALLER_PHONE);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_EMAIL, DataField.CALLER_EMAIL);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_PARENT_DOB, DataField.PARENT_DOB);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_CHILD_COUNT, DataField.CHILD_COUNT);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_CHILD_NAME, DataField.CHILD_NAME);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_CHILD_DOB, DataField.CHILD_DOB);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_CHILD_AGE, DataField.CHILD_AGE);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_NEW_PATIENT, DataField.NEW_PATIENT_STATUS);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_PREVIOUS_VISIT, DataField.PREVIOUS_VISIT);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_PREVIOUS_ORTHO, DataField.PREVIOUS_ORTHO_TREATMENT);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_INSURANCE, DataField.INSURANCE_INFO);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_INSURANCE_MEMBER_ID, DataField.INSURANCE_MEMBER_ID);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_SPECIAL_NEEDS, DataField.SPECIAL_NEEDS);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_MEDICAL_CONDITIONS, DataField.MEDICAL_CONDITIONS);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_TIME_PREFERENCE, DataField.TIME_PREFERENCE);
        INTENT_TO_FIELD.put(AgentIntent.ASKING_LOCATION_PREFERENCE, DataField.LOCATION_PREFERENCE);
    }

    private final IntentDetector detector;
    private final TemplateResponseGenerator templates;
    private final ResponseStrategyEngine strategy;

    public LegacyResponseClassifier(
        IntentDetector detector,
        TemplateResponseGenerator templates,
        ResponseStrategyEngine strategy
    ) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.templates = Objects.requireNonNull(templates, "templates must not be null");
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
    }

    @Override
    public String name() {
        return "legacy";
    }

    @Override
    public Classification classify(String agentUtterance, List<ConversationTurn> history, Persona persona) {
        return fromIntent(detector.detectIntent(agentUtterance, history, List.of()));
    }

    @Override
    public Classification classify(
        String agentUtterance,
        List<ConversationTurn> history,
        Persona persona,
        List<CollectableField> pendingFields
    ) {
        return fromIntent(detector.detectIntent(agentUtterance, history, pendingFields));
    }

    static Classification fromIntent(IntentDetectionResult detected) {
        AgentIntent intent = detected.primaryIntent();
        DataField field = INTENT_TO_FIELD.get(intent);
        Classification.Builder builder = Classification.builder(categoryOf(intent), detected.confidence())
            .terminalState(terminalStateOf(intent))
            .bookingConfirmedThisTurn(intent == AgentIntent.CONFIRMING_BOOKING)
            .bookingMentioned(intent == AgentIntent.CONFIRMING_BOOKING || intent == AgentIntent.OFFERING_TIME_SLOTS)
            .transferMentioned(intent == AgentIntent.INITIATING_TRANSFER)
            .reasoning(detected.reasoning())
            .legacyIntent(detected);
        if (field != null) {
            builder.dataFields(List.of(field));
        }
        switch (intent) {
            case CONFIRMING_SPELLING -> builder.confirmationSubject(ConfirmationSubject.SPELLING_CORRECT);
            case ASKING_PROCEED_CONFIRMATION -> builder.confirmationSubject(ConfirmationSubject.PROCEED_ANYWAY);
            case OFFERING_ADDRESS -> builder.confirmationSubject(ConfirmationSubject.WANTS_ADDRESS);
            case REMINDING_BRING_CARD -> builder.confirmationSubject(ConfirmationSubject.INSURANCE_CARD_REMINDER);
            case CONFIRMING_INFORMATION -> builder.confirmationSubject(ConfirmationSubject.INFORMATION_CORRECT);
            case PROVIDING_ADDRESS -> builder.infoProvided("address");
            case PROVIDING_PARKING_INFO -> builder.infoProvided("parking_info");
            case PROVIDING_ADDRESS_AND_PARKING -> builder.infoProvided("address_and_parking");
            case PROVIDING_HOURS_INFO -> builder.infoProvided("hours");
            case SEARCHING_AVAILABILITY -> builder.infoProvided("searching");
            default -> {
            }
        }
        return builder.build();
    }

    @Override
    public boolean isTerminal(Classification classification) {
        AgentIntent intent = toLegacyIntent(classification).primaryIntent();
        if (intent == AgentIntent.SAYING_GOODBYE || intent == AgentIntent.INITIATING_TRANSFER) {
            return true;
        }
        return intent == AgentIntent.CONFIRMING_BOOKING && classification.confidence() >= TERMINAL_BOOKING_CONFIDENCE;
    }

    @Override
    public IntentDetectionResult toLegacyIntent(Classification classification) {
        if (classification.legacyIntent() != null) {
            return classification.legacyIntent();
        }
        return new IntentDetectionResult(AgentIntent.UNKNOWN, classification.confidence(), true, true, classification.reasoning());
    }

    @Override
    public String generateResponse(Classification classification, Persona persona, ResponseContext context) {
        IntentDetectionResult detected = toLegacyIntent(classification);
        if (detected.primaryIntent() == AgentIntent.UNKNOWN || detected.confidence() < TEMPLATE_CONFIDENCE) {
            Optional<String> modelReply = strategy.generateWithLlm(
                classification,
                persona,
                lastAgentMessage(context.history()),
                context.history()
            );
            if (modelReply.isPresent()) {
                return modelReply.get();
            }
        }
        return templates.generate(detected.primaryIntent(), persona, context.currentChildIndex());
    }

    public IntentDetector detector() {
        return detector;
    }

    private static ResponseCategory categoryOf(AgentIntent intent) {
        return switch (intent) {
            case CONFIRMING_INFORMATION, CONFIRMING_SPELLING, ASKING_PROCEED_CONFIRMATION, OFFERING_ADDRESS,
                REMINDING_BRING_CARD -> ResponseCategory.CONFIRM_OR_DENY;
            case OFFERING_TIME_SLOTS -> ResponseCategory.SELECT_FROM_OPTIONS;
            case ASKING_TIME_PREFERENCE, ASKING_LOCATION_PREFERENCE -> ResponseCategory.EXPRESS_PREFERENCE;
            case ASKING_CLARIFICATION -> ResponseCategory.CLARIFY_REQUEST;
            case SAYING_GOODBYE, CONFIRMING_BOOKING, INITIATING_TRANSFER, SEARCHING_AVAILABILITY, PROVIDING_ADDRESS,
                PROVIDING_PARKING_INFO, PROVIDING_ADDRESS_AND_PARKING, PROVIDING_HOURS_INFO, HANDLING_ERROR ->
                ResponseCategory.ACKNOWLEDGE;
            default -> ResponseCategory.PROVIDE_DATA;
        };
    }

    private static TerminalState terminalStateOf(AgentIntent intent) {
        return switch (intent) {
            case SAYING_GOODBYE -> TerminalState.CONVERSATION_ENDED;
            case CONFIRMING_BOOKING -> TerminalState.BOOKING_CONFIRMED;
            case INITIATING_TRANSFER -> TerminalState.TRANSFER_INITIATED;
            default -> TerminalState.NONE;
        };
    }

    private static String lastAgentMessage(List<ConversationTurn> history) {
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).role() == TurnRole.ASSISTANT) {
                return history.get(i).content();
            }
        }
        return "";
    }
}
