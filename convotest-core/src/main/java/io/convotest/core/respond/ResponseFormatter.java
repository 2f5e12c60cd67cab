package io.convotest.core.respond;

import io.convotest.core.classify.ConfirmationSubject;
import io.convotest.core.classify.ResponseCategory;
import io.convotest.core.persona.PersonaTraits;
import io.convotest.core.persona.Verbosity;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

public final class ResponseFormatter {
    private static final Map<ResponseCategory, Map<Verbosity, List<String>>> PREFIXES = new EnumMap<>(ResponseCategory.class);
    private static final Map<ConfirmationSubject, Map<Verbosity, List<String>>> YES = new EnumMap<>(ConfirmationSubject.class);
    private static final Map<ConfirmationSubject, Map<Verbosity, List<String>>> NO = new EnumMap<>(ConfirmationSubject.class);
    private static final Map<String, Map<Verbosity, List<String>>> ACKNOWLEDGMENTS = Map.of(
        "booking_confirmation", phrases(
            List.of("Thanks", "Great"),
            List.of("Great, thank you!", "Perfect, thanks so much"),
            List.of("Wonderful! Thank you so much for scheduling that for us!")),
        "address", phrases(
            List.of("Got it", "Thanks"),
            List.of("Thank you, I got the address", "Perfect, thanks"),
            List.of("Great, I've written that down. Thank you so much!")),
        "parking_info", phrases(
            List.of("Thanks", "OK"),
            List.of("Perfect, thanks for the parking info", "Got it, thanks"),
            List.of("That's really helpful, thank you so much for the parking information!")),
        "searching", phrases(
            List.of("OK"),
            List.of("Okay, thank you", "Sure, take your time"),
            List.of("No problem, take your time! I appreciate you checking for us.")),
        "general", phrases(
            List.of("OK", "Thanks"),
            List.of("Thank you", "Got it", "Perfect"),
            List.of("Thank you so much!", "That's great, I appreciate it!"))
    );
    private static final Map<Verbosity, List<String>> GOODBYES = phrases(
        List.of("Bye", "Thanks, bye"),
        List.of("Thank you, goodbye!", "Thanks so much, bye!"),
        List.of("Thank you so much for all your help! Have a wonderful day!")
    );

    static {
        PREFIXES.put(ResponseCategory.PROVIDE_DATA, phrases(
            List.of(""),
            List.of("Sure,", "It's", "Yes,", "That would be"),
            List.of("Yes, of course!", "Sure thing!", "Happy to help,", "Absolutely,")));
        PREFIXES.put(ResponseCategory.CONFIRM_OR_DENY, phrases(
            List.of("Yes", "No", "Correct", "Right"),
            List.of("Yes, that's correct", "That's right", "Correct", "Yes, exactly"),
            List.of("Yes, that's absolutely correct!", "That's exactly right!", "Yes, you've got it!")));
        PREFIXES.put(ResponseCategory.SELECT_FROM_OPTIONS, phrases(
            List.of(""),
            List.of("I'll take", "Let's go with", "Yes,", "That works,"),
            List.of("That sounds perfect!", "I'd love that time!", "Yes, let's do")));
        PREFIXES.put(ResponseCategory.ACKNOWLEDGE, phrases(
            List.of("Thanks", "Got it", "OK"),
            List.of("Great, thank you", "Perfect, thanks", "Got it, thanks"),
            List.of("That sounds wonderful!", "Perfect, thank you so much!", "Great, I really appreciate it!")));
        PREFIXES.put(ResponseCategory.CLARIFY_REQUEST, phrases(
            List.of("What?", "Sorry?", "Repeat?"),
            List.of("Sorry, could you repeat that?", "I didn't quite catch that", "Could you clarify?"),
            List.of("I'm so sorry, I didn't quite understand. Could you please repeat that?")));
        PREFIXES.put(ResponseCategory.EXPRESS_PREFERENCE, phrases(
            List.of(""),
            List.of("I prefer", "We'd like", "Ideally,"),
            List.of("If possible, we would really prefer", "We'd love if we could have")));

        confirmation(ConfirmationSubject.INFORMATION_CORRECT,
            phrases(List.of("Yes", "Correct"),
                List.of("Yes, that's correct", "That's right"),
                List.of("Yes, that's exactly right!", "Correct, you've got all the information right!")),
            phrases(List.of("No", "Actually..."),
                List.of("Actually, let me correct that", "Not quite, it should be"),
                List.of("Oh, I'm sorry but that's not quite right. Let me clarify...")));
        confirmation(ConfirmationSubject.PROCEED_ANYWAY,
            phrases(List.of("Yes", "OK", "Proceed"),
                List.of("Yes, please proceed", "That's fine, go ahead"),
                List.of("Yes, please go ahead anyway. We'll figure it out!")),
            phrases(List.of("No", "Cancel"),
                List.of("No, let's not proceed", "Actually, I'd like to reconsider"),
                List.of("Hmm, actually I think I'd rather not proceed with that. Let me think about it.")));
        confirmation(ConfirmationSubject.BOOKING_DETAILS,
            phrases(List.of("Yes", "Confirmed"),
                List.of("Yes, that's all correct", "Perfect, confirmed"),
                List.of("Yes, all of those details are perfect! Thank you so much!")),
            phrases(List.of("Wait", "Actually..."),
                List.of("Actually, there's a small issue", "Wait, let me check"),
                List.of("Hold on, I think there might be a small mix-up. Let me clarify...")));
        confirmation(ConfirmationSubject.WANTS_ADDRESS,
            phrases(List.of("Yes"),
                List.of("Yes, please", "Yes, that would be helpful"),
                List.of("Yes please! I'd really appreciate having the address.")),
            phrases(List.of("No", "I'm fine"),
                List.of("No thanks, I know where it is", "I'm good, thanks"),
                List.of("No thank you, I'm already familiar with the location!")));
        confirmation(ConfirmationSubject.WANTS_PARKING_INFO,
            phrases(List.of("Yes"),
                List.of("Yes, please", "That would be helpful"),
                List.of("Yes please! Parking info would be really helpful.")),
            phrases(List.of("No", "I'm fine"),
                List.of("No thanks, I'll figure it out", "I'm okay"),
                List.of("No thank you, I'm sure I'll find parking just fine!")));
        confirmation(ConfirmationSubject.SPELLING_CORRECT,
            phrases(List.of("Yes", "Correct"),
                List.of("Yes, that's the correct spelling", "Correct"),
                List.of("Yes, you've spelled it perfectly!")),
            phrases(List.of("No", "Actually..."),
                List.of("Actually, let me spell it again", "Not quite, it's spelled"),
                List.of("Oh no, I think there was a small mistake. Let me spell it out more clearly...")));
        confirmation(ConfirmationSubject.INSURANCE_CARD_REMINDER,
            phrases(List.of("OK", "Will do"),
                List.of("Okay, I'll bring the insurance card", "Will do, thanks"),
                List.of("Absolutely! I'll make sure to bring the insurance card with us.")),
            phrases(List.of("OK"),
                List.of("Understood"),
                List.of("Got it, thank you for the reminder!")));
        confirmation(ConfirmationSubject.GENERAL,
            phrases(List.of("Yes", "OK"),
                List.of("Yes please", "Yes, thank you", "Sure, please do"),
                List.of("Yes, that sounds great! Please do.", "Yes please, that would be wonderful!")),
            phrases(List.of("No"),
                List.of("Actually, no", "I don't think so"),
                List.of("Hmm, I'm not so sure about that...")));
    }

    private final PersonaTraits traits;
    private final Random random;

    public ResponseFormatter(PersonaTraits traits, Random random) {
        this.traits = Objects.requireNonNull(traits, "traits must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public String formatData(List<String> values) {
        return combine(pick(PREFIXES.get(ResponseCategory.PROVIDE_DATA)), String.join(", ", values));
    }

    public String formatConfirmation(ConfirmationSubject subject, boolean yes) {
        Map<ConfirmationSubject, Map<Verbosity, List<String>>> table = yes ? YES : NO;
        Map<Verbosity, List<String>> phrases = table.getOrDefault(subject, table.get(ConfirmationSubject.GENERAL));
        return pick(phrases);
    }

    public String formatSelection(String option) {
        return combine(pick(PREFIXES.get(ResponseCategory.SELECT_FROM_OPTIONS)), option);
    }

    public String formatAcknowledgment(String infoType) {
        Map<Verbosity, List<String>> phrases = ACKNOWLEDGMENTS.getOrDefault(
            infoType == null ? "general" : infoType,
            ACKNOWLEDGMENTS.get("general")
        );
        return pick(phrases);
    }

    public String formatClarificationRequest() {
        return pick(PREFIXES.get(ResponseCategory.CLARIFY_REQUEST));
    }

    public String formatPreference(String preference) {
        return combine(pick(PREFIXES.get(ResponseCategory.EXPRESS_PREFERENCE)), preference);
    }

    public String formatGoodbye() {
        return pick(GOODBYES);
    }

    public String addExtraInfo(String reply, String extra) {
        if (extra == null || extra.isBlank() || !traits.providesExtraInfo() || traits.verbosity() == Verbosity.TERSE) {
            return reply;
        }
        return reply + " " + extra;
    }

    private String pick(Map<Verbosity, List<String>> phrases) {
        List<String> bucket = phrases.get(traits.verbosity());
        if (bucket == null || bucket.isEmpty()) {
            return "";
        }
        return bucket.get(random.nextInt(bucket.size()));
    }

    private static String combine(String prefix, String content) {
        if (prefix == null || prefix.isBlank()) {
            return content;
        }
        return (prefix.trim() + " " + content.trim()).trim();
    }

    private static void confirmation(
        ConfirmationSubject subject,
        Map<Verbosity, List<String>> yes,
        Map<Verbosity, List<String>> no
    ) {
        YES.put(subject, yes);
        NO.put(subject, no);
    }

    private static Map<Verbosity, List<String>> phrases(List<String> terse, List<String> normal, List<String> verbose) {
        Map<Verbosity, List<String>> map = new EnumMap<>(Verbosity.class);
        map.put(Verbosity.TERSE, terse);
        map.put(Verbosity.NORMAL, normal);
        map.put(Verbosity.VERBOSE, verbose);
        return map;
    }
}
