package io.convotest.core.respond;

import io.convotest.core.classify.Classification;
import io.convotest.core.classify.ConfirmationSubject;
import io.convotest.core.classify.DataField;
import io.convotest.core.classify.ResponseContext;
import io.convotest.core.classify.TerminalState;
import io.convotest.core.config.model.StrategySettings;
import io.convotest.core.conversation.ConversationTurn;
import io.convotest.core.conversation.TurnRole;
import io.convotest.core.model.ChatMessage;
import io.convotest.core.persona.ChildData;
import io.convotest.core.persona.DataInventory;
import io.convotest.core.persona.Persona;
import io.convotest.core.provider.LlmResponse;
import io.convotest.core.provider.ProviderRegistry;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.function.BiFunction;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ResponseStrategyEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ResponseStrategyEngine.class);

    static final String CANCEL_REPLY = "Actually, never mind. I need to cancel. I'll call back another time.";
    static final String NOTHING_ELSE_REPLY = "No, that's all. Thank you!";
    private static final int CANCEL_TRIGGER_TURN = 4;
    private static final int SILENCE_TRIGGER_TURN = 3;

    private static final Pattern ANYTHING_ELSE = regex("\\b(anything else|is there anything|can i help|help.*today)\\b");
    private static final Pattern ORTHO_SCOPE = regex("\\b(looking for|calling about|need|want)\\s*(orthodontic|ortho|braces|invisalign)");
    private static final Pattern ORTHO_SCOPE_QUESTION = regex("\\bare you.*(orthodontic|ortho)");
    private static final Pattern NON_ORTHO_REQUEST = regex(
        "\\b(cleaning|dental cleaning|checkup|check-up|check up|cavity|filling|hygienist|general dentist|general dentistry|regular dentist)\\b"
    );
    private static final Pattern SCHEDULING_INTENT = regex("\\b(looking to|want to|like to|need to)\\s*(schedule|book|make|set up)");
    private static final Pattern SCHEDULING_NEW = regex("\\bschedule\\s*(a|an)?\\s*(new patient|appointment|consultation)");
    private static final Pattern PATIENT_HISTORY = regex("\\b(new patient|been (here|seen|to)|visited before|first (time|visit))");
    private static final Pattern BOOKING_WORDS = regex("\\b(schedule|book|appointment|consultation|looking to)");
    private static final Pattern UNRESOLVED_PHONE_VARIABLE = regex("c1mg_variable|caller_id_number|\\$vars");
    private static final Pattern MORNING_SLOT = regex("\\b(9|10|11)\\s*:?\\s*\\d*\\s*(am)?");
    private static final Pattern AFTERNOON_SLOT = regex("\\b(1|2|3|4|5)\\s*:?\\s*\\d*\\s*(pm)?");
    private static final Pattern SEARCHING = regex("checking|searching|looking");
    private static final List<FallbackRule> FALLBACKS = fallbackRules();

    private final StrategySettings settings;
    private final ProviderRegistry providers;
    private final Random random;
    private final Clock clock;

    public ResponseStrategyEngine(StrategySettings settings, ProviderRegistry providers, Random random, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.providers = Objects.requireNonNull(providers, "providers must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public String generateResponse(Classification classification, Persona persona, ResponseContext context) {
        String special = specialBehavior(context.testId(), context.turnNumber(), persona);
        if (special != null) {
            return special;
        }

        LocalDate today = LocalDate.now(clock);
        PersonaDataMapper data = new PersonaDataMapper(persona, context.currentChildIndex(), today);
        ResponseFormatter formatter = new ResponseFormatter(persona.traits(), random);
        String lastAgentMessage = lastAgentMessage(context.history());

        if (context.bookingCompleted() && ANYTHING_ELSE.matcher(lastAgentMessage).find()) {
            LOG.debug("Booking complete and agent asked for anything else; closing ({})", classification.category().key());
            return NOTHING_ELSE_REPLY;
        }

        return switch (classification.category()) {
            case PROVIDE_DATA -> provideData(classification, persona, context, data, formatter, lastAgentMessage, today);
            case CONFIRM_OR_DENY -> confirmOrDeny(classification, persona, context, formatter, lastAgentMessage);
            case SELECT_FROM_OPTIONS -> classification.options().isEmpty()
                ? formatter.formatConfirmation(ConfirmationSubject.GENERAL, true)
                : formatter.formatSelection(selectBestOption(classification.options(), persona.inventory()));
            case ACKNOWLEDGE -> acknowledge(classification, formatter);
            case CLARIFY_REQUEST -> formatter.formatClarificationRequest();
            case EXPRESS_PREFERENCE -> expressPreference(classification, data, formatter);
        };
    }

    private String specialBehavior(String testId, int turnNumber, Persona persona) {
        if (settings.cancelTestIds().contains(testId) && turnNumber >= CANCEL_TRIGGER_TURN) {
            LOG.info("Test {} cancels at turn {}", testId, turnNumber);
            return CANCEL_REPLY;
        }
        if (settings.silenceTestIds().contains(testId) && turnNumber >= SILENCE_TRIGGER_TURN) {
            LOG.info("Test {} goes silent at turn {}", testId, turnNumber);
            return "";
        }
        if (persona.name().toLowerCase(Locale.ROOT).contains("silent") && turnNumber >= SILENCE_TRIGGER_TURN) {
            LOG.info("Persona {} goes silent at turn {}", persona.name(), turnNumber);
            return "";
        }
        return null;
    }

    private String provideData(
        Classification classification,
        Persona persona,
        ResponseContext context,
        PersonaDataMapper data,
        ResponseFormatter formatter,
        String lastAgentMessage,
        LocalDate today
    ) {
        List<DataField> fields = classification.dataFields().isEmpty() ? List.of(DataField.UNKNOWN) : classification.dataFields();
        List<String> values = data.getAll(fields);
        if (!values.isEmpty()) {
            return formatter.formatData(values);
        }
        for (FallbackRule rule : FALLBACKS) {
            if (rule.pattern().matcher(lastAgentMessage).find()) {
                LOG.debug("Fallback reply for unmapped request: {}", abbreviate(lastAgentMessage));
                return rule.reply().apply(persona.inventory(), new ChildCursor(context.currentChildIndex(), today));
            }
        }
        if (settings.useLlmForComplex()) {
            return generateWithLlm(classification, persona, lastAgentMessage, context.history()).orElse("Yes");
        }
        LOG.debug("No data mapping for: {}", abbreviate(lastAgentMessage));
        return "Yes";
    }

    private String confirmOrDeny(
        Classification classification,
        Persona persona,
        ResponseContext context,
        ResponseFormatter formatter,
        String lastAgentMessage
    ) {
        ConfirmationSubject subject = classification.confirmationSubject() == null
            ? ConfirmationSubject.GENERAL
            : classification.confirmationSubject();
        List<DataField> fields = classification.dataFields();

        if (subject == ConfirmationSubject.GENERAL && context.bookingCompleted() && ANYTHING_ELSE.matcher(lastAgentMessage).find()) {
            return formatter.formatConfirmation(ConfirmationSubject.GENERAL, false);
        }

        if (ORTHO_SCOPE.matcher(lastAgentMessage).find() || ORTHO_SCOPE_QUESTION.matcher(lastAgentMessage).find()) {
            String firstUserMessage = context.history().stream()
                .filter(turn -> turn.role() == TurnRole.USER)
                .map(ConversationTurn::content)
                .findFirst()
                .orElse("");
            if (NON_ORTHO_REQUEST.matcher(firstUserMessage).find()) {
                LOG.debug("Caller asked for general dentistry; correcting scope");
                return formatter.formatData(List.of("No, I need a dental cleaning"));
            }
        }

        if (SCHEDULING_INTENT.matcher(lastAgentMessage).find() || SCHEDULING_NEW.matcher(lastAgentMessage).find()) {
            return formatter.formatConfirmation(subject, true);
        }

        if (fields.contains(DataField.PREVIOUS_VISIT) || fields.contains(DataField.NEW_PATIENT_STATUS)) {
            boolean historyQuestion = PATIENT_HISTORY.matcher(lastAgentMessage).find()
                && !BOOKING_WORDS.matcher(lastAgentMessage).find();
            if (historyQuestion) {
                return formatter.formatConfirmation(subject, Boolean.TRUE.equals(persona.inventory().previousVisitToOffice()));
            }
            return formatter.formatConfirmation(subject, true);
        }

        // Treatment and special-needs history is answered for the first child.
        ChildData firstChild = persona.inventory().child(0);
        if (fields.contains(DataField.PREVIOUS_ORTHO_TREATMENT)) {
            boolean hadBraces = firstChild != null && Boolean.TRUE.equals(firstChild.hadBracesBefore());
            return formatter.formatConfirmation(subject, hadBraces);
        }
        if (fields.contains(DataField.SPECIAL_NEEDS)) {
            String needs = firstChild == null ? null : firstChild.specialNeeds();
            if (needs != null && !needs.isBlank() && !needs.equalsIgnoreCase("none")) {
                return formatter.formatData(List.of(needs));
            }
            return formatter.formatData(List.of("No special needs"));
        }

        if ((subject == ConfirmationSubject.PHONE_NUMBER_CORRECT || subject == ConfirmationSubject.INFORMATION_CORRECT)
            && UNRESOLVED_PHONE_VARIABLE.matcher(lastAgentMessage).find()) {
            String phone = persona.inventory().parentPhone().isEmpty() ? "5551234567" : persona.inventory().parentPhone();
            LOG.debug("Agent read back an unresolved phone variable; correcting");
            return "Actually, my number is " + phone;
        }
        return formatter.formatConfirmation(subject, true);
    }

    String selectBestOption(List<String> options, DataInventory inventory) {
        String time = inventory.preferredTimeOfDay();
        if (time != null && !time.isBlank() && !time.equalsIgnoreCase("any")) {
            for (String option : options) {
                if (time.equalsIgnoreCase("morning") && MORNING_SLOT.matcher(option).find()) {
                    return option;
                }
                if (time.equalsIgnoreCase("afternoon") && AFTERNOON_SLOT.matcher(option).find()) {
                    return option;
                }
            }
        }
        if (inventory.preferredLocation() != null && !inventory.preferredLocation().isBlank()) {
            String location = inventory.preferredLocation().toLowerCase(Locale.ROOT);
            for (String option : options) {
                if (option.toLowerCase(Locale.ROOT).contains(location)) {
                    return option;
                }
            }
        }
        for (String day : inventory.preferredDays()) {
            for (String option : options) {
                if (option.toLowerCase(Locale.ROOT).contains(day.toLowerCase(Locale.ROOT))) {
                    return option;
                }
            }
        }
        return options.get(0);
    }

    private String acknowledge(Classification classification, ResponseFormatter formatter) {
        String infoType = "general";
        String info = classification.infoProvided().toLowerCase(Locale.ROOT);
        if (classification.terminalState() == TerminalState.BOOKING_CONFIRMED) {
            infoType = "booking_confirmation";
        } else if (!info.isEmpty()) {
            if (info.contains("address")) {
                infoType = "address";
            } else if (info.contains("parking")) {
                infoType = "parking_info";
            }
        } else if (SEARCHING.matcher(classification.reasoning()).find()) {
            infoType = "searching";
        }
        return formatter.formatAcknowledgment(infoType);
    }

    private String expressPreference(Classification classification, PersonaDataMapper data, ResponseFormatter formatter) {
        DataField field = classification.primaryField() == null ? DataField.TIME_PREFERENCE : classification.primaryField();
        String preference = data.getData(field);
        return formatter.formatPreference(preference == null ? "Any time works" : preference);
    }

    public Optional<String> generateWithLlm(
        Classification classification,
        Persona persona,
        String agentMessage,
        List<ConversationTurn> history
    ) {
        if (!settings.useLlmForComplex()) {
            return Optional.empty();
        }
        LlmResponse response = providers.resolve(settings.provider()).chat(
            settings.model(),
            List.of(ChatMessage.user(buildPrompt(classification, persona, agentMessage, history))),
            settings.temperature(),
            settings.maxTokens()
        );
        if (response.isError() || response.content().isBlank()) {
            LOG.warn("Model reply failed, using templates: {}", response.content());
            return Optional.empty();
        }
        return Optional.of(response.content().trim());
    }

    private String buildPrompt(Classification classification, Persona persona, String agentMessage, List<ConversationTurn> history) {
        DataInventory inventory = persona.inventory();
        List<ConversationTurn> recent = history.subList(Math.max(0, history.size() - 4), history.size());
        String historyText = recent.isEmpty()
            ? "No prior conversation"
            : recent.stream()
                .map(turn -> "[" + turn.role().name().toLowerCase(Locale.ROOT) + "]: " + turn.content())
                .collect(Collectors.joining("\n"));
        ChildData child = inventory.child(0);
        String style = switch (persona.traits().verbosity()) {
            case TERSE -> "Keep responses very brief, just the essential information.";
            case NORMAL -> "Use natural, polite responses with brief acknowledgments.";
            case VERBOSE -> "Be friendly and conversational, add warmth to responses.";
        };
        return """
            You are simulating a parent calling to schedule an orthodontic appointment for their child.

            ## Your persona
            Name: %s
            Children: %s
            Insurance: %s

            ## Agent's message
            "%s"

            ## Conversation history
            %s

            ## What the agent is asking
            Category: %s
            Data requested: %s
            Confirming: %s
            Options: %s

            ## Your data
            - Phone: %s
            - Child: %s
            - Child date of birth: %s
            - Preferred time: %s

            ## Style
            %s

            The appointment is for your CHILD. Answer the question directly, mention only morning or afternoon
            preferences rather than specific days, and cooperate with booking.
            Respond ONLY with your message as the caller.
            """.formatted(
            inventory.parentFullName(),
            inventory.children().stream().map(ChildData::firstName).collect(Collectors.joining(", ")),
            inventory.insuranceProvider() == null ? "Unknown" : inventory.insuranceProvider(),
            agentMessage,
            historyText,
            classification.category().key(),
            classification.dataFields().stream().map(DataField::key).collect(Collectors.joining(", ")),
            classification.confirmationSubject() == null ? "" : classification.confirmationSubject().key(),
            String.join(", ", classification.options()),
            inventory.parentPhone(),
            child == null ? "Unknown" : child.fullName(),
            child == null || child.dateOfBirth() == null ? "Unknown" : child.dateOfBirth().toString(),
            inventory.preferredTimeOfDay() == null ? "any" : inventory.preferredTimeOfDay(),
            style
        );
    }

    private static String lastAgentMessage(List<ConversationTurn> history) {
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).role() == TurnRole.ASSISTANT) {
                return history.get(i).content();
            }
        }
        return "";
    }

    private static String abbreviate(String text) {
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
    }

    private static Pattern regex(String value) {
        return Pattern.compile(value, Pattern.CASE_INSENSITIVE);
    }

    private record ChildCursor(int index, LocalDate today) {
    }

    private record FallbackRule(Pattern pattern, BiFunction<DataInventory, ChildCursor, String> reply) {
    }

    // Replies for data requests the classifier could not pin to a field, keyed on question wording.
    private static List<FallbackRule> fallbackRules() {
        BiFunction<DataInventory, ChildCursor, String> childName = (inv, cursor) -> {
            ChildData child = inv.child(cursor.index());
            return child == null ? "I'm not sure" : child.fullName();
        };
        return List.of(
            new FallbackRule(regex("\\b(child|kid|patient|son|daughter)('s)?\\s+(first\\s+)?(name|called)\\b"), childName),
            new FallbackRule(regex("\\bwhat.*name.*child\\b"), childName),
            new FallbackRule(regex("\\b(child'?s?|kid'?s?|son'?s?|daughter'?s?)\\b[^.?!]{0,40}\\bname\\b"), (inv, cursor) -> {
                ChildData child = inv.child(cursor.index());
                return child == null ? inv.parentFirstName() : child.fullName();
            }),
            new FallbackRule(regex("\\b(date\\s+of\\s+birth|dob|birth\\s*date|birthday|born|birthdate)\\b"), (inv, cursor) -> {
                ChildData child = inv.child(cursor.index());
                return child == null || child.dateOfBirth() == null
                    ? "I'm not sure"
                    : child.dateOfBirth().format(PersonaDataMapper.SPOKEN_DATE);
            }),
            new FallbackRule(regex("\\b(how\\s+old|age|years\\s+old)\\b"), (inv, cursor) -> {
                ChildData child = inv.child(cursor.index());
                return child == null || child.dateOfBirth() == null
                    ? "I'm not sure"
                    : child.ageOn(cursor.today()) + " years old";
            }),
            new FallbackRule(regex("\\b(phone|number|call.*back|reach\\s+you|contact)\\b"), (inv, cursor) -> inv.parentPhone()),
            new FallbackRule(regex("\\b(email|e-mail)\\b"), (inv, cursor) ->
                inv.parentEmail() == null || inv.parentEmail().isBlank() ? "I don't have an email" : inv.parentEmail()),
            new FallbackRule(regex("\\b(your|caller|parent)\\s*(full\\s*)?(name|called)\\b"), (inv, cursor) -> inv.parentFullName()),
            new FallbackRule(regex("\\bwho\\s+(am\\s+i|are\\s+you)\\s+(speaking|talking)\\b"), (inv, cursor) -> inv.parentFullName()),
            new FallbackRule(regex("\\b(insurance|coverage|plan|provider)\\b"), (inv, cursor) -> {
                boolean noProvider = inv.insuranceProvider() == null || inv.insuranceProvider().isBlank();
                if (noProvider && Boolean.FALSE.equals(inv.hasInsurance())) {
                    return "No insurance";
                }
                return noProvider ? "I'm not sure about insurance" : inv.insuranceProvider();
            }),
            new FallbackRule(regex("\\b(which\\s+location|prefer.*location|office)\\b"), (inv, cursor) ->
                inv.preferredLocation() == null || inv.preferredLocation().isBlank()
                    ? "Either location is fine"
                    : inv.preferredLocation()),
            new FallbackRule(regex("\\b(what\\s+time|prefer.*time|morning|afternoon|best\\s+time)\\b"), (inv, cursor) -> {
                String time = inv.preferredTimeOfDay();
                return time != null && !time.isBlank() && !time.equalsIgnoreCase("any")
                    ? time + " works best"
                    : "Any time works for us";
            }),
            new FallbackRule(
                regex("\\b(been\\s+(seen|to)|visited|been\\s+here|seen\\s+(at|here|before)|(existing|returning)\\s+patient)\\b"),
                (inv, cursor) -> Boolean.TRUE.equals(inv.previousVisitToOffice())
                    ? "Yes, she has been seen before"
                    : "No, this is our first visit"
            ),
            new FallbackRule(
                regex("\\b(orthodontic\\s+treatment|braces|ortho\\s+treatment|had\\s+(ortho|braces|treatment))\\b.*before\\b"),
                (inv, cursor) -> {
                    ChildData child = inv.child(cursor.index());
                    return child != null && Boolean.TRUE.equals(child.hadBracesBefore())
                        ? "Yes, she has had orthodontic treatment before"
                        : "No previous orthodontic treatment";
                }
            ),
            new FallbackRule(regex("\\b(are\\s+you|is\\s+(this|it))\\s+(a\\s+)?new\\s+patient\\b"), (inv, cursor) ->
                Boolean.TRUE.equals(inv.previousVisitToOffice()) ? "No, we have been seen before" : "Yes, we are new patients")
        );
    }
}
