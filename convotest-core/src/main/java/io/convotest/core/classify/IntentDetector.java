package io.convotest.core.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.convotest.core.config.model.ClassifierSettings;
import io.convotest.core.conversation.ConversationTurn;
import io.convotest.core.model.ChatMessage;
import io.convotest.core.progress.CollectableField;
import io.convotest.core.provider.LlmResponse;
import io.convotest.core.provider.ProviderRegistry;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class IntentDetector {
    private static final Logger LOG = LoggerFactory.getLogger(IntentDetector.class);

    private static final List<Pattern> BOOKING_OVERRIDES = List.of(
        Pattern.compile("\\bappointment has been (successfully )?scheduled\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\bI have booked\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\byour appointment is confirmed\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile(
            "\\bappointment.*scheduled.*for (Monday|Tuesday|Wednesday|Thursday|Friday|Saturday|Sunday)",
            Pattern.CASE_INSENSITIVE
        )
    );
    private static final Pattern QUESTION_WORDS = Pattern.compile(
        "\\b(what|how|when|where|who|which|could you|would you|can you|may i)\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");
    private static final int KEY_PREFIX_LENGTH = 100;
    private static final double KEYWORD_CONFIDENCE = 0.7;
    private static final double UNKNOWN_CONFIDENCE = 0.3;
    private static final double LLM_TEMPERATURE = 0.1;
    private static final int LLM_MAX_TOKENS = 512;

    static final List<IntentKeywords> KEYWORDS = List.of(
        keywords(AgentIntent.CONFIRMING_BOOKING,
            "\\bappointment has been (successfully )?scheduled\\b",
            "\\bappointment.*scheduled\\b",
            "\\b(booked|scheduled) .* for (Monday|Tuesday|Wednesday|Thursday|Friday|Saturday|Sunday)",
            "\\bI have booked\\b",
            "\\byour appointment is confirmed\\b",
            "\\bappointment.*set\\b"),
        keywords(AgentIntent.SAYING_GOODBYE,
            "\\b(goodbye|bye bye)\\b",
            "\\bhave a (great|wonderful|nice) day\\b",
            "\\bthank you for calling.*have a\\b",
            "\\btake care\\b",
            "\\bwe('ll| will) (see you|talk to you)\\b"),
        keywords(AgentIntent.INITIATING_TRANSFER,
            "\\b(transfer|connect|live agent|specialist|hold)\\b"),
        keywords(AgentIntent.PROVIDING_ADDRESS,
            "\\boffice is located at\\b",
            "\\baddress is\\b",
            "\\blocated at\\b.*\\d+\\b",
            "\\b\\d+\\s+\\w+\\s+(street|st|avenue|ave|road|rd|boulevard|blvd|drive|dr)\\b"),
        keywords(AgentIntent.PROVIDING_PARKING_INFO,
            "\\bparking\\b.*\\b(available|lot|garage|street|behind|front|free)\\b",
            "\\b(free|ample|plenty of)\\s+parking\\b",
            "\\bpark\\b.*\\b(building|office|lot)\\b"),
        keywords(AgentIntent.PROVIDING_HOURS_INFO,
            "\\bwe('re| are) open\\b",
            "\\bour hours\\b",
            "\\bhours (are|of operation)\\b",
            "\\bopen (from|monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b",
            "\\bmonday (through|to) (friday|saturday|sunday)\\b"),
        keywords(AgentIntent.OFFERING_ADDRESS,
            "\\bwould you like.*(address|directions)\\b",
            "\\bwant me to (give|provide).*(address|directions)\\b",
            "\\bneed.*(address|directions)\\b"),
        keywords(AgentIntent.SEARCHING_AVAILABILITY,
            "\\b(let me check|one moment|checking|looking up|look up)\\b.*\\b(available|availability|times|slots)\\b",
            "\\b(available|availability).*\\b(let me|one moment|checking)\\b",
            "\\bworking on finding\\b.*\\b(appointment|time|slot)\\b",
            "\\bchecking available appointment\\b",
            "\\bwill (let you know|offer you).*\\b(slot|time)\\b"),
        keywords(AgentIntent.OFFERING_TIME_SLOTS,
            "\\b(I have|we have|there is|there are).*\\b(available|opening|slot)\\b",
            "\\bcan see you (on|at)\\b",
            "\\bI can offer\\b",
            "\\b(Monday|Tuesday|Wednesday|Thursday|Friday|Saturday|Sunday).*\\b(at|available)\\b"),
        keywords(AgentIntent.ASKING_SPECIAL_NEEDS,
            "\\bspecial needs\\b",
            "\\bconditions? we should (know|be aware)\\b",
            "\\ballerg(y|ies|ic)\\b",
            "\\bshould we be aware of\\b",
            "\\bneed to know about\\b"),
        keywords(AgentIntent.ASKING_INSURANCE,
            "\\bwhat (kind of |type of )?(insurance|coverage)\\b",
            "\\bwho is your (insurance|carrier|provider)\\b",
            "\\bdo you have (insurance|coverage)\\b",
            "\\b(insurance|carrier|provider).*(do you have|what is)\\b"),
        keywords(AgentIntent.ASKING_TIME_PREFERENCE,
            "\\b(prefer|preference).*(time|morning|afternoon|day)\\b",
            "\\b(when|what time).*(work|available|convenient)\\b",
            "\\bmorning or afternoon\\b",
            "\\bwhat (time|day).*(prefer|work)\\b"),
        keywords(AgentIntent.ASKING_LOCATION_PREFERENCE,
            "\\bwhich (location|office)\\b",
            "\\b(prefer|preference).*(location|office)\\b",
            "\\balleghany or philadelphia\\b",
            "\\bphiladelphia or alleghany\\b"),
        keywords(AgentIntent.ASKING_PARENT_DOB,
            "\\bmay i have your (date of birth|dob|birth\\s*date)\\b",
            "\\bwhat('s| is) your (date of birth|dob|birth\\s*date)\\b",
            "\\byour (date of birth|dob|birth\\s*date)\\s*(please|in)\\b",
            "\\bprovide your (date of birth|dob|birth\\s*date)\\b",
            "\\bi need your (date of birth|dob|birth\\s*date)\\b",
            "\\byour own (date of birth|dob|birth\\s*date)\\b"),
        keywords(AgentIntent.ASKING_CHILD_COUNT,
            "\\b(how many|number of).*child",
            "\\bchildren.*coming in\\b"),
        keywords(AgentIntent.ASKING_CHILD_DOB,
            "\\bchild'?s?\\s+(date of birth|dob|birth\\s*date|birthday)\\b",
            "\\b(kid'?s?|patient'?s?)\\s+(date of birth|dob|birth\\s*date)\\b",
            "\\byour (child|kid|patient|son|daughter)('?s)? (date of birth|dob|birth\\s*date|birthday)\\b",
            "\\b(date of birth|dob|birth\\s*date) (of|for) (your )?(child|kid|patient|son|daughter)\\b"),
        keywords(AgentIntent.ASKING_CHILD_AGE,
            "\\b(how old|age)\\b"),
        keywords(AgentIntent.ASKING_CHILD_NAME,
            "\\bchild'?s?\\s+(?:\\w+\\s+){0,4}name\\b",
            "\\bname\\s+of\\s+(?:your\\s+)?(?:\\w+\\s+)?child\\b",
            "\\bwhat is (your )?child'?s?\\b",
            "\\bpatient'?s?\\s+(?:\\w+\\s+){0,3}name\\b",
            "\\b(first|second|other)\\s+child\\b"),
        keywords(AgentIntent.ASKING_SPELL_NAME,
            "\\b(spell|spelling|s-p-e-l-l)\\b"),
        keywords(AgentIntent.ASKING_PHONE,
            "\\bphone\\s*number\\b",
            "\\bbest number\\b",
            "\\bnumber is ending\\b",
            "\\bcaller id\\b",
            "\\bis that (the|a|your).*number\\b",
            "\\bwhat.*(phone|number|contact)\\b",
            "\\bcan i (have|get) your.*(phone|number)\\b"),
        keywords(AgentIntent.ASKING_EMAIL,
            "\\bwhat('s| is) your (email|e-mail)\\b",
            "\\b(email|e-mail) address\\b",
            "\\bmay i have your.*(email|e-mail)\\b",
            "\\bcan i get your.*(email|e-mail)\\b",
            "\\bprovide.*(email|e-mail)\\b"),
        keywords(AgentIntent.ASKING_PARENT_NAME,
            "\\b(your name|first and last name|full name)\\b",
            "\\bmay i have your.*name\\b"),
        keywords(AgentIntent.ASKING_NEW_PATIENT,
            "\\b(new patient|first time|been here before)\\b"),
        keywords(AgentIntent.ASKING_PREVIOUS_ORTHO,
            "\\b(orthodont|braces|retainer|treatment before)\\b"),
        keywords(AgentIntent.ASKING_PREVIOUS_VISIT,
            "\\b(visited|been to|previous visit)\\b",
            "\\b(child|kid|patient|son|daughter).*(been|been seen).*(office|offices|location).*before\\b",
            "\\b(been seen at|been to).*(our|any of our|this).*(office|offices)\\b"),
        keywords(AgentIntent.ASKING_PROCEED_CONFIRMATION,
            "\\bwould you like to proceed\\b",
            "\\bdo you (still )?want to (proceed|continue)\\b",
            "\\bnot in.?network\\b.*\\b(proceed|continue|anyway)\\b",
            "\\b(proceed|continue) anyway\\b"),
        keywords(AgentIntent.REMINDING_BRING_CARD,
            "\\bbring your insurance card\\b",
            "\\bbring.*(insurance|coverage) card\\b",
            "\\binsurance card.*(to|at) the appointment\\b",
            "\\bverify your coverage\\b"),
        keywords(AgentIntent.CONFIRMING_SPELLING,
            "\\b(spelled|s-\\w+-\\w+)\\b"),
        keywords(AgentIntent.CONFIRMING_INFORMATION,
            "\\b(confirm|correct|verify|got it|thank you)\\b"),
        keywords(AgentIntent.HANDLING_ERROR,
            "\\b(sorry|apologize|trouble|try again)\\b"),
        keywords(AgentIntent.ASKING_CLARIFICATION,
            "\\b(didn't catch|repeat|could you say|pardon)\\b"),
        keywords(AgentIntent.GREETING,
            "\\b(hi|hello|welcome|good morning|good afternoon)\\b",
            "\\bmy name is allie\\b")
    );

    private final ClassifierSettings settings;
    private final ProviderRegistry providers;
    private final Clock clock;
    private final Map<String, CachedResult> cache = new ConcurrentHashMap<>();
    private final ObjectMapper mapper = new ObjectMapper();

    public IntentDetector(ClassifierSettings settings, ProviderRegistry providers, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.providers = Objects.requireNonNull(providers, "providers must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public IntentDetectionResult detectIntent(
        String agentUtterance,
        List<ConversationTurn> history,
        List<CollectableField> pendingFields
    ) {
        String utterance = agentUtterance == null ? "" : agentUtterance;
        List<CollectableField> pending = pendingFields == null ? List.of() : pendingFields;
        for (Pattern pattern : BOOKING_OVERRIDES) {
            if (pattern.matcher(utterance).find()) {
                return new IntentDetectionResult(
                    AgentIntent.CONFIRMING_BOOKING,
                    0.95,
                    false,
                    false,
                    "Explicit booking confirmation detected"
                );
            }
        }

        String key = cacheKey(utterance, pending);
        CachedResult cached = cache.get(key);
        if (cached != null && clock.millis() - cached.storedAt() <= settings.cacheTtlMs()) {
            return cached.result();
        }

        IntentDetectionResult result = null;
        if (settings.useLlm()) {
            result = detectWithModel(utterance, history == null ? List.of() : history, pending);
        }
        if (result == null) {
            result = detectWithKeywords(utterance);
        }
        if (settings.cacheTtlMs() > 0) {
            if (cache.size() >= settings.cacheMaxEntries()) {
                long now = clock.millis();
                cache.entrySet().removeIf(e -> now - e.getValue().storedAt() > settings.cacheTtlMs());
            }
            cache.put(key, new CachedResult(result, clock.millis()));
        }
        return result;
    }

    public static IntentDetectionResult detectWithKeywords(String utterance) {
        String text = utterance == null ? "" : utterance;
        boolean question = isQuestion(text);
        for (IntentKeywords entry : KEYWORDS) {
            for (Pattern pattern : entry.patterns()) {
                Matcher matcher = pattern.matcher(text);
                if (matcher.find()) {
                    return new IntentDetectionResult(
                        entry.intent(),
                        KEYWORD_CONFIDENCE,
                        question,
                        question,
                        "Keyword match: " + matcher.group()
                    );
                }
            }
        }
        return new IntentDetectionResult(AgentIntent.UNKNOWN, UNKNOWN_CONFIDENCE, question, question, "No keyword match");
    }

    public static boolean isQuestion(String text) {
        return text.contains("?") || QUESTION_WORDS.matcher(text).find();
    }

    public void clearCache() {
        cache.clear();
    }

    private IntentDetectionResult detectWithModel(
        String utterance,
        List<ConversationTurn> history,
        List<CollectableField> pending
    ) {
        LlmResponse response = providers.resolve(settings.provider()).chat(
            settings.model(),
            List.of(ChatMessage.user(buildPrompt(utterance, history, pending))),
            LLM_TEMPERATURE,
            LLM_MAX_TOKENS
        );
        if (response.isError()) {
            LOG.warn("Language-model intent detection failed, falling back to keywords: {}", response.content());
            return null;
        }
        try {
            return parseModelOutput(response.content());
        } catch (IOException e) {
            LOG.warn("Unreadable intent detection output, falling back to keywords: {}", e.getMessage());
            return null;
        }
    }

    IntentDetectionResult parseModelOutput(String text) throws IOException {
        Matcher json = JSON_OBJECT.matcher(text == null ? "" : text);
        if (!json.find()) {
            throw new IOException("No JSON found in response");
        }
        JsonNode node = mapper.readTree(json.group());
        AgentIntent intent = CategoryResponseClassifier.lookup(AgentIntent.class, node.path("primaryIntent").asText(null));
        double confidence = Math.max(0.0, Math.min(1.0, node.path("confidence").asDouble(0.5)));
        return new IntentDetectionResult(
            intent == null ? AgentIntent.UNKNOWN : intent,
            confidence,
            node.path("isQuestion").asBoolean(true),
            node.path("requiresUserResponse").asBoolean(true),
            node.path("reasoning").asText("")
        );
    }

    private String buildPrompt(String utterance, List<ConversationTurn> history, List<CollectableField> pending) {
        List<ConversationTurn> recent = history.subList(Math.max(0, history.size() - 4), history.size());
        String historyText = recent.isEmpty()
            ? "No prior conversation"
            : recent.stream()
                .map(turn -> "[" + turn.role().name().toLowerCase() + "]: " + turn.content())
                .collect(Collectors.joining("\n"));
        String pendingText = pending.isEmpty()
            ? "None specified"
            : pending.stream().map(CollectableField::key).collect(Collectors.joining(", "));
        List<String> intents = new ArrayList<>();
        for (AgentIntent intent : AgentIntent.values()) {
            intents.add(intent.key());
        }
        return """
            You are analyzing an orthodontic scheduling assistant's response to detect what information it is asking for.

            ## Agent's Response
            "%s"

            ## Recent Conversation History
            %s

            ## Fields Not Yet Collected
            %s

            Identify the agent's PRIMARY intent. Return ONLY a JSON object:
            {"primaryIntent": "asking_parent_name", "confidence": 0.95, "isQuestion": true,
             "requiresUserResponse": true, "reasoning": "Agent asks for the caller's full name"}

            ## Valid Intent Values
            %s

            - searching_availability: the agent is checking times without offering specific ones yet
            - offering_time_slots: the agent offers specific times
            - asking_proceed_confirmation: the agent asks whether to proceed anyway
            """.formatted(utterance, historyText, pendingText, String.join(", ", intents));
    }

    private static String cacheKey(String utterance, List<CollectableField> pending) {
        String prefix = utterance.length() > KEY_PREFIX_LENGTH ? utterance.substring(0, KEY_PREFIX_LENGTH) : utterance;
        return prefix + "|" + pending.stream().map(CollectableField::key).sorted().collect(Collectors.joining(","));
    }

    private static IntentKeywords keywords(AgentIntent intent, String... regexes) {
        List<Pattern> patterns = new ArrayList<>();
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return new IntentKeywords(intent, List.copyOf(patterns));
    }

    record IntentKeywords(AgentIntent intent, List<Pattern> patterns) {
    }

    private record CachedResult(IntentDetectionResult result, long storedAt) {
    }
}
