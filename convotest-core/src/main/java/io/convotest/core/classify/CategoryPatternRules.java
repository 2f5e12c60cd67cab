package io.convotest.core.classify;

import java.util.Comparator;
import java.util.List;

public final class CategoryPatternRules {
    private static final List<PatternRule> DEFAULT_RULES = sorted(List.of(
        PatternRule.of("processing", ResponseCategory.ACKNOWLEDGE, 0.85, 105,
            "\\blet me (verify|check|confirm|schedule|book)\\b",
            "\\bI('ll| will) (verify|check|confirm|schedule|book)\\b",
            "\\bI('m| am) (verifying|checking|confirming|scheduling|booking)\\b",
            "\\bone moment while I (verify|check|confirm|schedule|book)\\b",
            "\\bprocessing your (request|booking|appointment)\\b",
            "\\bjust a moment\\b",
            "\\blet me (look|search|find|pull up)\\b",
            "\\bI('m| am) (looking|searching|finding|pulling)\\b")
            .terminal(TerminalState.NONE)
            .info("processing"),
        PatternRule.of("booking_confirmed", ResponseCategory.ACKNOWLEDGE, 0.95, 100,
            "\\b(your appointment|booking|appointment)\\s+(has been|is)\\s+(successfully\\s+)?(scheduled|booked|confirmed)\\b",
            "\\bI have (booked|scheduled|confirmed)\\b",
            "\\bconfirmation number\\b",
            "\\b(both|all|your)\\s+appointments?\\s+(are|is)\\s+confirmed\\b",
            "\\bappointment\\s+is\\s+confirmed\\b",
            "\\bappointments?\\s+confirmed\\b",
            "\\byou('re| are)\\s+(all\\s+)?(set|booked|scheduled)\\b",
            "\\bwe('ve| have)\\s+(scheduled|booked)\\s+(you|your)\\b",
            "\\b(is|are)\\s+scheduled\\s+for\\b")
            .terminal(TerminalState.BOOKING_CONFIRMED)
            .confirmsBooking(),
        PatternRule.of("transfer_initiated", ResponseCategory.ACKNOWLEDGE, 0.95, 99,
            "\\bI('m| am) (now\\s+)?(transferring|connecting) you\\b",
            "\\btransferring you (now|to)\\b",
            "\\bplease hold\\s+(while|as)\\s+I\\s+transfer\\b",
            "\\blet me transfer you (now|right now)\\b",
            "\\bconnecting you (now|right now)\\b",
            "\\bone moment while I transfer\\b",
            "\\bwhile I transfer your call\\b")
            .terminal(TerminalState.TRANSFER_INITIATED),
        PatternRule.of("transfer_offer", ResponseCategory.CONFIRM_OR_DENY, 0.90, 98,
            "\\bwould you like (me to )?(connect|transfer) you\\b",
            "\\bshould I (connect|transfer) you\\b",
            "\\bconnect you with a (specialist|representative|team member)\\b",
            "\\bwant me to (connect|transfer) you\\b",
            "\\bfor more options\\??$")
            .subject(ConfirmationSubject.PROCEED_ANYWAY),
        PatternRule.of("goodbye", ResponseCategory.ACKNOWLEDGE, 0.90, 98,
            "\\b(goodbye|bye|have a (great|good|nice|wonderful) day)\\b",
            "\\bthank you for calling\\b",
            "\\btake care\\b")
            .terminal(TerminalState.CONVERSATION_ENDED),
        PatternRule.of("phone_confirmation", ResponseCategory.CONFIRM_OR_DENY, 0.92, 82,
            "\\bis\\s+[\\d\\-().\\s]+\\s+the best number\\b",
            "\\bthe best number to reach you\\b",
            "\\bis that the (right|correct|best) (number|phone)\\b",
            "\\bis this the (right|correct|best) (number|phone)\\b",
            "\\bcalling from\\b.*\\bis that the best number\\b",
            "\\bbest number for the account\\b")
            .subject(ConfirmationSubject.PHONE_NUMBER_CORRECT),
        PatternRule.of("information_correct", ResponseCategory.CONFIRM_OR_DENY, 0.90, 80,
            "\\bis that (correct|right|accurate)\\b",
            "\\bdoes that (sound|look) (correct|right|good)\\b",
            "\\bcan you confirm\\b",
            "\\bjust to confirm\\b")
            .subject(ConfirmationSubject.INFORMATION_CORRECT),
        PatternRule.of("proceed_anyway", ResponseCategory.CONFIRM_OR_DENY, 0.90, 79,
            "\\bwould you like to proceed\\s*(anyway)?\\b",
            "\\bshould (I|we) proceed\\b",
            "\\bdo you (still )?want to (proceed|continue|book)\\b")
            .subject(ConfirmationSubject.PROCEED_ANYWAY),
        PatternRule.of("spelling_correct", ResponseCategory.CONFIRM_OR_DENY, 0.90, 78,
            "\\bis (the|that) spelling (correct|right)\\b",
            "\\bdid I (spell|get) that (right|correctly)\\b")
            .subject(ConfirmationSubject.SPELLING_CORRECT),
        PatternRule.of("wants_address", ResponseCategory.CONFIRM_OR_DENY, 0.88, 77,
            "\\bwould you like the (address|directions)\\b",
            "\\bcan I give you the address\\b")
            .subject(ConfirmationSubject.WANTS_ADDRESS),
        PatternRule.of("wants_parking_info", ResponseCategory.CONFIRM_OR_DENY, 0.88, 76,
            "\\bwould you like (the )?parking (info|information)\\b",
            "\\bshould I tell you about parking\\b")
            .subject(ConfirmationSubject.WANTS_PARKING_INFO),
        PatternRule.of("check_offer", ResponseCategory.CONFIRM_OR_DENY, 0.90, 75,
            "\\bwould you like me to (check|look|search|find)\\b",
            "\\bshould I (check|look|search|find) for\\b",
            "\\bwant me to (check|look|search|find)\\b",
            "\\bshall I (check|look|search|find)\\b",
            "\\bwould you like me to see (if|what|when)\\b")
            .subject(ConfirmationSubject.GENERAL),
        PatternRule.of("card_reminder_with_special_needs", ResponseCategory.PROVIDE_DATA, 0.90, 76,
            "\\b(bring|remember).{0,80}(insurance|card).{0,100}special needs\\b",
            "\\binsurance card.{0,100}special needs\\b",
            "\\bverify.{0,30}coverage.{0,50}special needs\\b")
            .fields(DataField.SPECIAL_NEEDS, DataField.CARD_REMINDER)
            .info("card_reminder"),
        PatternRule.of("card_reminder", ResponseCategory.ACKNOWLEDGE, 0.88, 74,
            "\\bplease (remember to )?bring (your )?insurance card\\b",
            "\\bdon't forget (to bring |your )?insurance\\b",
            "\\bremember to bring\\b.*\\bcard\\b",
            "\\bbring your (insurance )?card\\b")
            .terminal(TerminalState.NONE)
            .info("card_reminder"),
        PatternRule.of("calling_about", ResponseCategory.CONFIRM_OR_DENY, 0.88, 73,
            "\\bare you calling (about|for|regarding)\\b",
            "\\bis this (for|about|regarding)\\s+(a|an)?\\s*(ortho|braces|dental|appointment)\\b",
            "\\bis this (call )?(about|for|regarding)\\b",
            "\\bare you (looking|interested) (in|for)\\b",
            "\\blike braces\\??$",
            "\\bor invisalign\\??$")
            .subject(ConfirmationSubject.GENERAL),
        PatternRule.of("booking_details", ResponseCategory.CONFIRM_OR_DENY, 0.90, 72,
            "\\bwould that work\\b",
            "\\bdoes that work\\b",
            "\\bwork for you\\?$",
            "\\bwork for \\w+\\?$",
            "\\bsound good\\??$")
            .subject(ConfirmationSubject.BOOKING_DETAILS),
        PatternRule.of("time_slots", ResponseCategory.SELECT_FROM_OPTIONS, 0.88, 70,
            "\\b(monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\s+(at\\s+)?\\d+[:\\d]*\\s*(am|pm)?\\b",
            "\\bI (have|found|see)\\s+(an?|some)\\s+(opening|slot|availability|time)\\b",
            "\\b(how about|what about|would)\\s+(monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b")
            .offersOptions(),
        PatternRule.of("caller_name", ResponseCategory.PROVIDE_DATA, 0.90, 60,
            "\\b(what('s| is)|may I have|could I get|can I have)\\s+(your\\s+)?(full\\s+)?name\\b",
            "\\bwho am I speaking with\\b",
            "\\b(first and last|full) name\\b")
            .fields(DataField.CALLER_NAME),
        PatternRule.of("child_name_spelling", ResponseCategory.PROVIDE_DATA, 0.92, 63,
            "\\bspell \\w+'s (first )?(and last )?(full )?name\\b",
            "\\bspell (your )?(child'?s?|son'?s?|daughter'?s?|kid'?s?|patient'?s?) (first )?(and last )?(full )?name\\b",
            "\\bspell \\w+'s.*letter by letter\\b",
            "\\bhow do you spell (your )?(child'?s?|son'?s?|daughter'?s?) name\\b")
            .fields(DataField.CHILD_NAME_SPELLING),
        PatternRule.of("caller_name_spelling", ResponseCategory.PROVIDE_DATA, 0.90, 61,
            "\\bcan you spell your (full |last |first )?name\\b",
            "\\bhow do you spell your name\\b")
            .fields(DataField.CALLER_NAME_SPELLING),
        PatternRule.of("caller_phone", ResponseCategory.PROVIDE_DATA, 0.90, 58,
            "\\b(what('s| is)|may I have|could I get)\\s+(your\\s+)?(phone|contact)\\s*(number)?\\b",
            "\\bgood (phone|contact) number\\b",
            "\\bbest (phone|number|way) to reach you\\b",
            "\\bphone number\\s+(to reach|for)\\b",
            "\\b(what('s| is)|may I have)\\s+(the\\s+)?(best\\s+)?(phone|contact)\\s*(number)?\\b",
            "\\bwhat('s| is)\\s+\\w+\\s+phone\\s*number\\b")
            .fields(DataField.CALLER_PHONE),
        PatternRule.of("email_spelling", ResponseCategory.PROVIDE_DATA, 0.92, 58,
            "\\b(spell|spelling)\\b.*\\bemail\\b",
            "\\bspell your email\\b",
            "\\bcan you spell.*email\\b")
            .fields(DataField.CALLER_EMAIL),
        PatternRule.of("caller_email", ResponseCategory.PROVIDE_DATA, 0.88, 57,
            "\\b(what('s| is)|may I have|could I get)\\s+(your\\s+)?email\\b",
            "\\bemail address\\b")
            .fields(DataField.CALLER_EMAIL),
        PatternRule.of("child_count", ResponseCategory.PROVIDE_DATA, 0.90, 55,
            "\\bhow many (children|kids)\\b",
            "\\bnumber of (children|kids)\\b")
            .fields(DataField.CHILD_COUNT),
        PatternRule.of("child_name", ResponseCategory.PROVIDE_DATA, 0.90, 62,
            "\\b(what('s| is)|may I have)\\s+(the\\s+|your\\s+)?(first\\s+|second\\s+|third\\s+)?(child'?s?|patient'?s?|son'?s?|daughter'?s?|kid'?s?)\\s+(first\\s+)?(and\\s+last\\s+)?(full\\s+)?name\\b",
            "\\bname of (the\\s+|your\\s+)?(first\\s+|second\\s+)?(child|patient|son|daughter|kid)\\b",
            "\\b(first\\s+|second\\s+)?(child|son|daughter|kid)('?s)? (first\\s+)?(and\\s+last\\s+)?(full\\s+)?name\\b",
            "\\b(your\\s+)?(first\\s+|second\\s+)?(son'?s?|daughter'?s?|child'?s?|kid'?s?)\\s+(first\\s+)?(and\\s+last\\s+)?(full\\s+)?name\\b",
            "\\bwhat'?s\\s+(your\\s+)?(first\\s+|second\\s+)?(son'?s?|daughter'?s?|child'?s?)\\s+(first\\s+)?(and\\s+last\\s+)?name\\b",
            "\\b(first\\s+|second\\s+)?(child'?s?|kid'?s?|patient'?s?|son'?s?|daughter'?s?).*(first\\s+)?and\\s+last\\s+name\\b",
            "\\byour (first\\s+|second\\s+)?(child|kid|patient|son|daughter).*(first\\s+)?(and\\s+last\\s+)?name\\b")
            .fields(DataField.CHILD_NAME),
        PatternRule.of("parent_dob", ResponseCategory.PROVIDE_DATA, 0.92, 56,
            "\\bmay i have your (date of birth|dob|birth\\s*date)\\b",
            "\\bwhat('s| is) your (date of birth|dob|birth\\s*date)\\b",
            "\\byour (date of birth|dob|birth\\s*date)\\s*(please|in)\\b",
            "\\bprovide your (date of birth|dob|birth\\s*date)\\b",
            "\\bi need your (date of birth|dob|birth\\s*date)\\b",
            "\\byour own (date of birth|dob|birth\\s*date)\\b")
            .fields(DataField.PARENT_DOB),
        PatternRule.of("child_dob", ResponseCategory.PROVIDE_DATA, 0.90, 54,
            "\\b(what('s| is)|when is)\\s+(the\\s+)?(child'?s?|patient'?s?|son'?s?|daughter'?s?)?\\s*(date of birth|dob|birthday|birth date)\\b",
            "\\bwhen (was|were) (the\\s+)?(child|patient|son|daughter|they|he|she) born\\b",
            "\\b(child|son|daughter)('?s)? (date of birth|birthday|dob)\\b",
            "\\b(your\\s+)?(son'?s?|daughter'?s?)\\s+(date of birth|birthday|dob)\\b",
            "\\bwhat('s| is)\\s+\\w+['’]s\\s+(date of birth|dob|birthday|birth\\s*date)\\b",
            "\\bwhen (was|were)\\s+\\w+\\s+born\\b")
            .fields(DataField.CHILD_DOB),
        PatternRule.of("child_age", ResponseCategory.PROVIDE_DATA, 0.88, 52,
            "\\bhow old is (the\\s+)?(child|patient)\\b",
            "\\b(child'?s?|patient'?s?) age\\b",
            "\\bwhat age is\\b")
            .fields(DataField.CHILD_AGE),
        PatternRule.of("new_patient_status", ResponseCategory.PROVIDE_DATA, 0.88, 50,
            "\\b(is|are) (this|the\\s+child|the\\s+patient|they) (a\\s+)?new (patient|to (our|this))\\b",
            "\\bnew patient\\b.*\\?",
            "\\bhave (you|they) been (to|seen at) (our|this) office before\\b")
            .fields(DataField.NEW_PATIENT_STATUS),
        PatternRule.of("previous_visit", ResponseCategory.PROVIDE_DATA, 0.88, 49,
            "\\bhave (you|they) visited (this|our) (office|location) before\\b",
            "\\bprevious visit\\b",
            "\\bbeen here before\\b",
            "\\bhas (your|the) (child|patient|son|daughter) been (to|at) (our|this|the) office before\\b",
            "\\b(child|patient|kid) (been|visited) (here|our office|this office) before\\b",
            "\\bvisited (us|this office|our office) before\\b",
            "\\bhas (your )?(child|kid|patient|son|daughter) (ever )?(been |been seen )(to |at )?(our |this |the |any of our )?(offices?|location) before\\b",
            "\\bhave (either of |any of )?(your )?(children|kids) (ever )?(been |been seen )(to |at )?(our |this |the |any of our )?(offices?|location) before\\b",
            "\\bhas (either of |any of )?(your )?(children|kids) (ever )?(been |been seen )(to |at )?(our |this |the |any of our )?(offices?|location) before\\b",
            "\\b(children|kids) (ever )?(been|been seen) (here|to our office|at our office|at any of our offices) before\\b",
            "\\bhave (any of )?them (ever )?(been|been seen) (to )?(our |this |the |any of our )?(offices?|location)? before\\b",
            "\\bhas \\w+ (ever )?(been |been seen )(to |at )?(our |this |the |any of our )?(offices?|locations?) before\\b",
            "\\bhas (either )?\\w+ (or )?(your )?(child|second child|other child) (ever )?(been |been seen )(to |at )?(our |this |the |any of our )?(offices?|locations?) before\\b",
            "\\bhas (either )?\\w+ or \\w+ (ever )?(been |been seen )(to |at )?(our |this |the |any of our )?(offices?|locations?) before\\b")
            .fields(DataField.PREVIOUS_VISIT),
        PatternRule.of("previous_ortho_treatment", ResponseCategory.PROVIDE_DATA, 0.85, 48,
            "\\bhad (braces|orthodontic treatment|ortho) before\\b",
            "\\bhad braces (or|and) orthodontic treatment before\\b",
            "\\bhad (braces|ortho|orthodontic).*(before|previously)\\b",
            "\\bprevious orthodontic\\b",
            "\\bseen (an )?orthodontist before\\b",
            "\\borthodontic treatment before\\b")
            .fields(DataField.PREVIOUS_ORTHO_TREATMENT),
        PatternRule.of("insurance_info", ResponseCategory.PROVIDE_DATA, 0.88, 45,
            "\\b(what('s| is)|do you have)\\s+(your\\s+)?insurance\\b",
            "\\binsurance (provider|company|carrier)\\b",
            "\\bwho is (your\\s+)?insurance (with|through)\\b",
            "\\bwhat insurance (do you have|does \\w+ have)\\b",
            "\\bwhat (kind of )?insurance\\b",
            "\\b(do you have|does \\w+ have) insurance\\b")
            .fields(DataField.INSURANCE_INFO),
        PatternRule.of("insurance_member_id", ResponseCategory.PROVIDE_DATA, 0.90, 46,
            "\\bmember\\s*id\\s*(and|&)?\\s*(group\\s*(number|#)?)?",
            "\\bgroup\\s*(number|#)?\\s*(and|&)?\\s*(member\\s*id)?",
            "\\binsurance\\s*(member\\s*)?id",
            "\\b(provide|tell me|give me)\\s*(the\\s+)?(member\\s*id|group\\s*(number|#))",
            "\\b(do you have|what is)\\s*(the\\s+)?(member\\s*id|group\\s*(number|#))",
            "\\bpolicy\\s*number")
            .fields(DataField.INSURANCE_MEMBER_ID),
        PatternRule.of("special_needs", ResponseCategory.PROVIDE_DATA, 0.92, 49,
            "\\b(are there )?(any )?special (needs|accommodations|requirements)\\b",
            "\\bspecial needs or accommodations\\b",
            "\\b(should|do) (we|I) (know|note|be aware)\\b",
            "\\banything (else )?(we should know|to note|to be aware of)\\b",
            "\\bmedical conditions\\b",
            "\\baccommodations (we should|to) (know|note)\\b",
            "\\bspecial needs.{0,30}(know|aware|note)\\b",
            "\\b(know|aware|note).{0,30}special needs\\b",
            "\\baccommodations.{0,30}(you'd|you would) like\\b",
            "\\banything.{0,20}(us|we).{0,10}(know|aware)\\b")
            .fields(DataField.SPECIAL_NEEDS),
        PatternRule.of("time_preference", ResponseCategory.EXPRESS_PREFERENCE, 0.85, 40,
            "\\bprefer\\s+(morning|afternoon|evening)\\b",
            "\\b(morning|afternoon|evening)\\s+or\\s+(morning|afternoon|evening)\\b",
            "\\bwhat time (of day )?works (best|better)\\b")
            .fields(DataField.TIME_PREFERENCE),
        PatternRule.of("location_preference", ResponseCategory.EXPRESS_PREFERENCE, 0.85, 39,
            "\\bwhich location\\b",
            "\\bprefer(red)? location\\b",
            "\\b(alleghany|philadelphia)\\s+or\\s+(alleghany|philadelphia)\\b")
            .fields(DataField.LOCATION_PREFERENCE),
        PatternRule.of("address_and_parking", ResponseCategory.ACKNOWLEDGE, 0.88, 32,
            "\\b(Avenue|Ave|Street|St|Road|Rd|Boulevard|Blvd|Drive|Dr).+\\b(park|parking)\\b",
            "\\baddress.+\\b(park|parking)\\b",
            "\\blocated.+\\b(park|parking)\\b")
            .terminal(TerminalState.NONE)
            .info("address_and_parking"),
        PatternRule.of("address", ResponseCategory.ACKNOWLEDGE, 0.85, 30,
            "\\b(the\\s+)?address is\\b",
            "\\blocated at\\b",
            "\\boffice is at\\b",
            "\\bIt('s| is)\\s+\\d+\\s+[\\w\\s]+?(Avenue|Ave|Street|St|Road|Rd|Boulevard|Blvd|Drive|Dr|Lane|Ln|Way)\\b",
            "\\b\\d+\\s+[\\w\\s]+?(Avenue|Ave|Street|St|Road|Rd|Boulevard|Blvd|Drive|Dr|Lane|Ln|Way).{0,20}(Suite|Ste|Unit|#)\\s*\\d+")
            .terminal(TerminalState.NONE)
            .info("address"),
        PatternRule.of("parking", ResponseCategory.ACKNOWLEDGE, 0.85, 29,
            "\\bparking (is|available)\\b",
            "\\bfree parking\\b",
            "\\bpark in\\b")
            .terminal(TerminalState.NONE)
            .info("parking"),
        PatternRule.of("hours", ResponseCategory.ACKNOWLEDGE, 0.90, 31,
            "\\bwe('re| are) open\\b",
            "\\bour hours\\b",
            "\\bhours (are|of operation)\\b",
            "\\bopen (from|monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b",
            "\\bmonday (through|to) (friday|saturday|sunday)\\b",
            "\\b\\d+\\s*(:\\d+)?\\s*(am|pm)\\s+to\\s+\\d+\\s*(:\\d+)?\\s*(am|pm)\\b")
            .terminal(TerminalState.NONE)
            .info("hours"),
        PatternRule.of("checking", ResponseCategory.ACKNOWLEDGE, 0.80, 28,
            "\\b(let me|one moment|checking|looking)\\b.*\\b(check|look|search|find)\\b",
            "\\bI('m| am) (checking|looking|searching)\\b")
            .terminal(TerminalState.NONE),
        PatternRule.of("clarify", ResponseCategory.CLARIFY_REQUEST, 0.85, 20,
            "\\b(sorry|pardon|excuse me)\\b.*\\b(repeat|say that again|didn't (catch|understand))\\b",
            "\\bcould you (please )?(repeat|clarify)\\b",
            "\\bI didn't (quite )?(understand|catch|get) that\\b")
    ));

    private CategoryPatternRules() {
    }

    public static List<PatternRule> defaults() {
        return DEFAULT_RULES;
    }

    public static List<PatternRule> sorted(List<PatternRule> rules) {
        return rules.stream()
            .sorted(Comparator.comparingInt(PatternRule::priority).reversed())
            .toList();
    }
}
