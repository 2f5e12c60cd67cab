package io.convotest.core.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.convotest.core.config.model.ClassifierSettings;
import io.convotest.core.conversation.ConversationTurn;
import io.convotest.core.model.ChatMessage;
import io.convotest.core.persona.Persona;
import io.convotest.core.provider.LlmResponse;
import io.convotest.core.provider.ProviderRegistry;
import io.convotest.core.respond.ResponseStrategyEngine;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CategoryResponseClassifier implements ResponseClassifier {
    private static final Logger LOG = LoggerFactory.getLogger(CategoryResponseClassifier.class);

    private static final Pattern BOOKING_MENTION = Pattern.compile("\\b(book|appointment|schedule)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRANSFER_MENTION = Pattern.compile("\\b(transfer|connect|hold)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DAY_TIME_OPTION = Pattern.compile(
        "\\b(monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\s+(?:at\\s+)?(\\d+[:\\d]*\\s*(?:am|pm)?)",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern LOCATION_OPTION = Pattern.compile(
        "\\b(alleghany|philadelphia|main street|oak avenue)\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");

    private static final List<Pattern> ADDRESS_FOLLOW_UP = compileAll(
        "would you like the address\\s*\\??\\s*$",
        "want the address\\s*\\??\\s*$",
        "like the address\\s*\\??\\s*$",
        "\\bwould you like (the|an?)\\s*address\\b",
        "\\bwant (the|an?)\\s*address\\b",
        "\\bneed (the|an?)\\s*address\\b",
        "\\bprovide (the|an?)\\s*address\\b",
        "\\bshould I (give|send|provide) you (the|an?)\\s*address\\b",
        "\\bdo you (want|need) (the|an?)\\s*address\\b",
        "\\baddress\\s*\\?\\s*$"
    );
    private static final List<Pattern> PARKING_FOLLOW_UP = compileAll(
        "\\bwould you like (the\\s+)?parking (info|information)\\b",
        "\\bwant (the\\s+)?parking (info|information)\\b",
        "\\bparking info\\s*\\?\\s*$"
    );
    private static final List<Pattern> ANYTHING_ELSE_FOLLOW_UP = compileAll(
        "\\bis there anything else\\b",
        "\\banything else I can help\\b",
        "\\banything else\\s*\\?\\s*$"
    );

    private static final Map<DataField, AgentIntent> FIELD_TO_INTENT = Map.ofEntries(
        Map.entry(DataField.CALLER_NAME, AgentIntent.ASKING_PARENT_NAME),
        Map.entry(DataField.CALLER_NAME_SPELLING, AgentIntent.ASKING_SPELL_NAME),
        Map.entry(DataField.CALLER_PHONE, AgentIntent.ASKING_PHONE),
        Map.entry(DataField.CALLER_EMAIL, AgentIntent.ASKING_EMAIL),
        Map.entry(DataField.PARENT_DOB, AgentIntent.ASKING_PARENT_DOB),
        Map.entry(DataField.CHILD_COUNT, AgentIntent.ASKING_CHILD_COUNT),
        Map.entry(DataField.CHILD_NAME, AgentIntent.ASKING_CHILD_NAME),
        Map.entry(DataField.CHILD_NAME_SPELLING, AgentIntent.ASKING_SPELL_CHILD_NAME),
        Map.entry(DataField.CHILD_DOB, AgentIntent.ASKING_CHILD_DOB),
        Map.entry(DataField.CHILD_AGE, AgentIntent.ASKING_CHILD_AGE),
        Map.entry(DataField.NEW_PATIENT_STATUS, AgentIntent.ASKING_NEW_PATIENT),
        Map.entry(DataField.PREVIOUS_VISIT, AgentIntent.ASKING_PREVIOUS_VISIT),
        Map.entry(DataField.PREVIOUS_ORTHO_TREATMENT, AgentIntent.ASKING_PREVIOUS_ORTHO),
        Map.entry(DataField.INSURANCE_INFO, AgentIntent.ASKING_INSURANCE),
        Map.entry(DataField.INSURANCE_MEMBER_ID, AgentIntent.ASKING_INSURANCE_MEMBER_ID),
        Map.entry(DataField.SPECIAL_NEEDS, AgentIntent.ASKING_SPECIAL_NEEDS),
        Map.entry(DataField.MEDICAL_CONDITIONS, AgentIntent.ASKING_MEDICAL_CONDITIONS),
        Map.entry(DataField.CARD_REMINDER, AgentIntent.REMINDING_BRING_CARD),
        Map.entry(DataField.TIME_PREFERENCE, AgentIntent.ASKING_TIME_PREFERENCE),
        Map.entry(DataField.LOCATION_PREFERENCE, AgentIntent.ASKING_LOCATION_PREFERENCE),
        Map.entry(DataField.DAY_PREFERENCE, AgentIntent.ASKING_TIME_PREFERENCE),
        Map.entry(DataField.OTHER, AgentIntent.UNKNOWN),
        Map.entry(DataField.UNKNOWN, AgentIntent.UNKNOWN)
    );

    private static final Map<ResponseCategory, AgentIntent> CATEGORY_TO_INTENT = Map.of(
        ResponseCategory.PROVIDE_DATA, AgentIntent.UNKNOWN,
        ResponseCategory.CONFIRM_OR_DENY, AgentIntent.CONFIRMING_INFORMATION,
        ResponseCategory.SELECT_FROM_OPTIONS, AgentIntent.OFFERING_TIME_SLOTS,
        ResponseCategory.ACKNOWLEDGE, AgentIntent.CONFIRMING_BOOKING,
        ResponseCategory.CLARIFY_REQUEST, AgentIntent.ASKING_CLARIFICATION,
        ResponseCategory.EXPRESS_PREFERENCE, AgentIntent.ASKING_TIME_PREFERENCE
    );

    private static final double TERMINAL_CONFIDENCE = 0.8;
    private static final double LLM_TEMPERATURE = 0.1;
    private static final int LLM_MAX_TOKENS = 512;

    private final ClassifierSettings settings;
    private final List<PatternRule> rules;
    private final ProviderRegistry providers;
    private final ResponseStrategyEngine strategy;
    private final ClassificationCache cache;
    private final ObjectMapper mapper = new ObjectMapper();

    public CategoryResponseClassifier(
        ClassifierSettings settings,
        ProviderRegistry providers,
        ResponseStrategyEngine strategy,
        Clock clock
    ) {
        this(settings, CategoryPatternRules.defaults(), providers, strategy, clock);
    }

    public CategoryResponseClassifier(
        ClassifierSettings settings,
        List<PatternRule> rules,
        ProviderRegistry providers,
        ResponseStrategyEngine strategy,
        Clock clock
    ) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.rules = CategoryPatternRules.sorted(Objects.requireNonNull(rules, "rules must not be null"));
        this.providers = Objects.requireNonNull(providers, "providers must not be null");
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.cache = new ClassificationCache(settings.cacheTtlMs(), settings.cacheMaxEntries(), clock);
    }

    @Override
    public String name() {
        return "category";
    }

    @Override
    public Classification classify(String agentUtterance, List<ConversationTurn> history, Persona persona) {
        String utterance = agentUtterance == null ? "" : agentUtterance;
        String key = ClassificationCache.key(utterance);
        Optional<Classification> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        Classification tierOne = classifyWithPatterns(utterance);
        if (tierOne.confidence() >= settings.llmConfidenceThreshold() || !settings.useLlm()) {
            LOG.debug("Pattern match {} ({}) via {}", tierOne.category().key(), tierOne.confidence(), tierOne.matchedPattern());
            cache.put(key, tierOne);
            return tierOne;
        }

        LlmResponse response = providers.resolve(settings.provider()).chat(
            settings.model(),
            List.of(ChatMessage.user(buildPrompt(utterance, history, persona))),
            LLM_TEMPERATURE,
            LLM_MAX_TOKENS
        );
        if (response.isError()) {
            LOG.warn("Language-model classification failed, keeping pattern result: {}", response.content());
            cache.put(key, tierOne);
            return tierOne;
        }
        Classification tierTwo = parseModelOutput(response.content());
        LOG.debug("Model classification {} ({})", tierTwo.category().key(), tierTwo.confidence());
        cache.put(key, tierTwo);
        return tierTwo;
    }

    Classification classifyWithPatterns(String utterance) {
        boolean bookingMentioned = BOOKING_MENTION.matcher(utterance).find();
        boolean transferMentioned = TRANSFER_MENTION.matcher(utterance).find();
        for (PatternRule rule : rules) {
            Pattern matched = rule.firstMatch(utterance);
            if (matched == null) {
                continue;
            }
            Classification result = Classification.builder(rule.category(), rule.confidence())
                .terminalState(rule.terminalState())
                .dataFields(rule.dataFields())
                .confirmationSubject(rule.confirmationSubject())
                .infoProvided(rule.infoProvided())
                .options(rule.extractsOptions() ? extractOptions(utterance) : List.of())
                .bookingMentioned(bookingMentioned)
                .transferMentioned(transferMentioned)
                .bookingConfirmedThisTurn(rule.bookingConfirmed())
                .matchedPattern(matched.pattern())
                .reasoning("Matched rule " + rule.name())
                .build();
            if (result.terminalState() == TerminalState.BOOKING_CONFIRMED) {
                return followUpAfterBooking(utterance, result);
            }
            return result;
        }
        return Classification.builder(ResponseCategory.PROVIDE_DATA, 0.3)
            .dataFields(List.of(DataField.UNKNOWN))
            .bookingMentioned(bookingMentioned)
            .transferMentioned(transferMentioned)
            .reasoning("No pattern matched")
            .build();
    }

    // A booking confirmation that ends in a question still needs an answer.
    private Classification followUpAfterBooking(String utterance, Classification confirmed) {
        ConfirmationSubject subject = null;
        String reasoning = null;
        if (anyMatch(ADDRESS_FOLLOW_UP, utterance)) {
            subject = ConfirmationSubject.WANTS_ADDRESS;
            reasoning = "Booking confirmed with an address offer";
        } else if (anyMatch(PARKING_FOLLOW_UP, utterance)) {
            subject = ConfirmationSubject.WANTS_PARKING_INFO;
            reasoning = "Booking confirmed with a parking offer";
        } else if (anyMatch(ANYTHING_ELSE_FOLLOW_UP, utterance)) {
            subject = ConfirmationSubject.GENERAL;
            reasoning = "Booking confirmed with an anything-else question";
        }
        if (subject == null) {
            return confirmed;
        }
        LOG.debug("Follow-up question after booking confirmation: {}", subject.key());
        return confirmed.toBuilder()
            .category(ResponseCategory.CONFIRM_OR_DENY)
            .confirmationSubject(subject)
            .terminalState(TerminalState.NONE)
            .reasoning(reasoning)
            .build();
    }

    private List<String> extractOptions(String utterance) {
        Set<String> options = new LinkedHashSet<>();
        Matcher dayTime = DAY_TIME_OPTION.matcher(utterance);
        while (dayTime.find()) {
            options.add((dayTime.group(1) + " at " + dayTime.group(2)).trim());
        }
        Matcher location = LOCATION_OPTION.matcher(utterance);
        while (location.find()) {
            options.add(location.group(1));
        }
        return new ArrayList<>(options);
    }

    private String buildPrompt(String utterance, List<ConversationTurn> history, Persona persona) {
        List<ConversationTurn> turns = history == null ? List.of() : history;
        List<ConversationTurn> recent = turns.subList(Math.max(0, turns.size() - 4), turns.size());
        StringBuilder historyText = new StringBuilder();
        for (ConversationTurn turn : recent) {
            historyText.append('[').append(turn.role().name().toLowerCase(Locale.ROOT)).append("]: ")
                .append(turn.content()).append('\n');
        }
        if (historyText.length() == 0) {
            historyText.append("No prior conversation\n");
        }
        Boolean hasInsurance = persona.inventory().hasInsurance();
        return """
            You are classifying a scheduling assistant's message to decide what TYPE of reply the caller should give.

            ## Agent message
            "%s"

            ## Recent conversation
            %s
            ## Caller
            - Name: %s
            - Children: %d
            - Has insurance: %s

            Return ONLY a JSON object with these keys:
            category (provide_data | confirm_or_deny | select_from_options | acknowledge | clarify_request | express_preference),
            confidence (0.0-1.0), dataFields (array), confirmationSubject, expectedAnswer (yes | no | either),
            options (array), terminalState (booking_confirmed | transfer_initiated | conversation_ended | error_terminal | none),
            bookingMentioned, transferMentioned, reasoning.

            terminalState is booking_confirmed ONLY when the booking is already done ("Your appointment has been scheduled").
            Statements about work in progress ("Let me check", "I'll book that") are terminalState none.

            Data fields: caller_name, caller_name_spelling, caller_phone, caller_email, child_count, child_name,
            child_name_spelling, child_dob, child_age, new_patient_status, previous_visit, previous_ortho_treatment,
            insurance_info, special_needs, time_preference, location_preference.
            """.formatted(
            utterance,
            historyText,
            persona.inventory().parentFullName(),
            persona.inventory().children().size(),
            hasInsurance == null ? "unknown" : hasInsurance.toString()
        );
    }

    Classification parseModelOutput(String content) {
        Matcher json = JSON_OBJECT.matcher(content == null ? "" : content);
        if (!json.find()) {
            return unparsedModelOutput("no JSON object in model output");
        }
        JsonNode node;
        try {
            node = mapper.readTree(json.group());
        } catch (IOException e) {
            return unparsedModelOutput(e.getMessage());
        }
        ResponseCategory category = lookup(ResponseCategory.class, node.path("category").asText(null));
        if (category == null) {
            category = ResponseCategory.PROVIDE_DATA;
        }

        Set<DataField> fields = new LinkedHashSet<>();
        for (JsonNode field : node.path("dataFields")) {
            DataField parsed = lookup(DataField.class, field.asText());
            fields.add(parsed == null ? DataField.UNKNOWN : parsed);
        }

        ConfirmationSubject subject = null;
        String rawSubject = node.path("confirmationSubject").asText(null);
        if (rawSubject != null) {
            subject = lookup(ConfirmationSubject.class, rawSubject);
            if (subject == null) {
                DataField asField = lookup(DataField.class, rawSubject);
                if (asField != null) {
                    fields.add(asField);
                }
                subject = ConfirmationSubject.GENERAL;
            }
        }

        TerminalState terminal = lookup(TerminalState.class, node.path("terminalState").asText(null));
        List<String> options = new ArrayList<>();
        for (JsonNode option : node.path("options")) {
            options.add(option.asText());
        }

        return Classification.builder(category, clamp(node.path("confidence").asDouble(0.5)))
            .dataFields(new ArrayList<>(fields))
            .confirmationSubject(subject)
            .expectedAnswer(parseExpectedAnswer(node.path("expectedAnswer").asText(null)))
            .options(options)
            .terminalState(terminal == null ? TerminalState.NONE : terminal)
            .bookingMentioned(node.path("bookingMentioned").asBoolean(false))
            .transferMentioned(node.path("transferMentioned").asBoolean(false))
            .reasoning(node.path("reasoning").asText(""))
            .build();
    }

    private Classification unparsedModelOutput(String reason) {
        LOG.warn("Failed to parse model classification: {}", reason);
        return Classification.builder(ResponseCategory.PROVIDE_DATA, 0.4)
            .dataFields(List.of(DataField.UNKNOWN))
            .reasoning("Failed to parse LLM response")
            .build();
    }

    private ExpectedAnswer parseExpectedAnswer(String raw) {
        if (raw == null) {
            return null;
        }
        ExpectedAnswer exact = lookup(ExpectedAnswer.class, raw);
        if (exact != null) {
            return exact;
        }
        String lowered = raw.toLowerCase(Locale.ROOT);
        if (lowered.contains("/") || lowered.contains("or")) {
            return ExpectedAnswer.EITHER;
        }
        if (lowered.startsWith("yes")) {
            return ExpectedAnswer.YES;
        }
        if (lowered.startsWith("no")) {
            return ExpectedAnswer.NO;
        }
        return ExpectedAnswer.EITHER;
    }

    @Override
    public boolean isTerminal(Classification classification) {
        return classification.terminalState() != TerminalState.NONE
            && classification.confidence() >= TERMINAL_CONFIDENCE;
    }

    @Override
    public IntentDetectionResult toLegacyIntent(Classification c) {
        AgentIntent intent = c.dataFields().isEmpty()
            ? CATEGORY_TO_INTENT.getOrDefault(c.category(), AgentIntent.UNKNOWN)
            : FIELD_TO_INTENT.getOrDefault(c.primaryField(), AgentIntent.UNKNOWN);

        TerminalState terminal = c.terminalState();
        if (terminal == TerminalState.BOOKING_CONFIRMED || c.bookingConfirmedThisTurn()) {
            intent = AgentIntent.CONFIRMING_BOOKING;
        } else if (terminal == TerminalState.TRANSFER_INITIATED) {
            intent = AgentIntent.INITIATING_TRANSFER;
        } else if (terminal == TerminalState.CONVERSATION_ENDED) {
            intent = AgentIntent.SAYING_GOODBYE;
        }

        boolean terminalState = terminal != TerminalState.NONE;
        if (c.category() == ResponseCategory.CONFIRM_OR_DENY && !terminalState && !c.bookingConfirmedThisTurn()
            && c.confirmationSubject() != null) {
            intent = switch (c.confirmationSubject()) {
                case PHONE_NUMBER_CORRECT -> AgentIntent.ASKING_PHONE;
                case SPELLING_CORRECT -> AgentIntent.CONFIRMING_SPELLING;
                case PROCEED_ANYWAY -> AgentIntent.ASKING_PROCEED_CONFIRMATION;
                case WANTS_ADDRESS -> AgentIntent.OFFERING_ADDRESS;
                case WANTS_PARKING_INFO -> AgentIntent.PROVIDING_PARKING_INFO;
                case INSURANCE_CARD_REMINDER -> AgentIntent.REMINDING_BRING_CARD;
                default -> intent;
            };
        }
        if (c.category() == ResponseCategory.SELECT_FROM_OPTIONS && !terminalState) {
            intent = AgentIntent.OFFERING_TIME_SLOTS;
        }
        if (c.category() == ResponseCategory.ACKNOWLEDGE && !terminalState) {
            intent = acknowledgedInfoIntent(c.infoProvided());
        }

        return new IntentDetectionResult(
            intent,
            c.confidence(),
            c.category() != ResponseCategory.ACKNOWLEDGE,
            !intent.endsConversation(),
            c.reasoning()
        );
    }

    private AgentIntent acknowledgedInfoIntent(String info) {
        String lowered = info.toLowerCase(Locale.ROOT);
        if (lowered.equals("address_and_parking")) {
            return AgentIntent.PROVIDING_ADDRESS_AND_PARKING;
        }
        if (lowered.contains("address")) {
            return AgentIntent.PROVIDING_ADDRESS;
        }
        if (lowered.contains("parking")) {
            return AgentIntent.PROVIDING_PARKING_INFO;
        }
        if (lowered.contains("hours")) {
            return AgentIntent.PROVIDING_HOURS_INFO;
        }
        if (lowered.contains("card_reminder")) {
            return AgentIntent.REMINDING_BRING_CARD;
        }
        return AgentIntent.SEARCHING_AVAILABILITY;
    }

    @Override
    public String generateResponse(Classification classification, Persona persona, ResponseContext context) {
        return strategy.generateResponse(classification, persona, context);
    }

    public void clearCache() {
        cache.clear();
    }

    private static boolean anyMatch(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compileAll(String... regexes) {
        List<Pattern> compiled = new ArrayList<>();
        for (String regex : regexes) {
            compiled.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(compiled);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    static <E extends Enum<E>> E lookup(Class<E> type, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(normalized)) {
                return constant;
            }
        }
        return null;
    }
}
