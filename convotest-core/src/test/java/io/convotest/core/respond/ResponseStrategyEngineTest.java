package io.convotest.core.respond;

import static org.assertj.core.api.Assertions.assertThat;

import io.convotest.core.classify.Classification;
import io.convotest.core.classify.ConfirmationSubject;
import io.convotest.core.classify.DataField;
import io.convotest.core.classify.ResponseCategory;
import io.convotest.core.classify.ResponseContext;
import io.convotest.core.config.model.StrategySettings;
import io.convotest.core.conversation.ConversationTurn;
import io.convotest.core.model.ChatMessage;
import io.convotest.core.persona.ChildData;
import io.convotest.core.persona.DataInventory;
import io.convotest.core.persona.Persona;
import io.convotest.core.persona.PersonaTraits;
import io.convotest.core.persona.Verbosity;
import io.convotest.core.provider.LlmProvider;
import io.convotest.core.provider.LlmResponse;
import io.convotest.core.provider.ProviderRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ResponseStrategyEngineTest {
    private final Clock clock = Clock.fixed(Instant.parse("2026-05-10T08:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldAnswerDataRequestsFromInventory() {
        ResponseStrategyEngine engine = engine(StrategySettings.defaults(), new ProviderRegistry());

        String phone = engine.generateResponse(provide(DataField.CALLER_PHONE), persona("Dana Smith"), context("T-1", 1, "What's your number?"));
        String child = engine.generateResponse(
            provide(DataField.CHILD_NAME, DataField.CHILD_DOB),
            persona("Dana Smith"),
            context("T-1", 2, "Your child's name and birth date?")
        );

        assertThat(phone).isEqualTo("555-000-1111");
        assertThat(child).isEqualTo("Ella Smith, March 2, 2016");
    }

    @Test
    void shouldFallBackToQuestionWordingForUnmappedRequests() {
        ResponseStrategyEngine engine = engine(StrategySettings.defaults(), new ProviderRegistry());
        Classification unmapped = provide(DataField.UNKNOWN);

        String dob = engine.generateResponse(unmapped, persona("Dana Smith"), context("T-1", 2, "And when was she born?"));
        String age = engine.generateResponse(unmapped, persona("Dana Smith"), context("T-1", 3, "How old is she?"));
        String nothing = engine.generateResponse(unmapped, persona("Dana Smith"), context("T-1", 4, "Blue or green?"));

        assertThat(dob).isEqualTo("March 2, 2016");
        assertThat(age).isEqualTo("10 years old");
        assertThat(nothing).isEqualTo("Yes");
    }

    @Test
    void shouldAskModelForUnmappedRequestsWhenEnabled() {
        ProviderRegistry registry = new ProviderRegistry();
        RecordingProvider provider = new RecordingProvider("openai", "  Green, I guess.  ");
        registry.register(provider);
        ResponseStrategyEngine engine = engine(settings(true, List.of(), List.of()), registry);

        String reply = engine.generateResponse(provide(DataField.UNKNOWN), persona("Dana Smith"), context("T-1", 2, "Blue or green?"));

        assertThat(reply).isEqualTo("Green, I guess.");
        assertThat(provider.prompts).singleElement().satisfies(prompt -> {
            assertThat(prompt).contains("\"Blue or green?\"");
            assertThat(prompt).contains("Name: Dana Smith");
            assertThat(prompt).contains("Keep responses very brief");
        });
    }

    @Test
    void shouldKeepTemplateReplyWhenModelFails() {
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new RecordingProvider("openai", LlmResponse.ERROR_PREFIX + " timeout"));
        ResponseStrategyEngine engine = engine(settings(true, List.of(), List.of()), registry);

        String reply = engine.generateResponse(provide(DataField.UNKNOWN), persona("Dana Smith"), context("T-1", 2, "Blue or green?"));

        assertThat(reply).isEqualTo("Yes");
    }

    @Test
    void shouldCancelAndGoSilentForConfiguredTests() {
        ResponseStrategyEngine engine = engine(settings(false, List.of("T-CANCEL"), List.of("T-SILENT")), new ProviderRegistry());
        Classification phone = provide(DataField.CALLER_PHONE);

        assertThat(engine.generateResponse(phone, persona("Dana Smith"), context("T-CANCEL", 3, "Number?"))).isEqualTo("555-000-1111");
        assertThat(engine.generateResponse(phone, persona("Dana Smith"), context("T-CANCEL", 4, "Number?")))
            .isEqualTo(ResponseStrategyEngine.CANCEL_REPLY);
        assertThat(engine.generateResponse(phone, persona("Dana Smith"), context("T-SILENT", 3, "Number?"))).isEmpty();
        assertThat(engine.generateResponse(phone, persona("Silent Sam"), context("T-1", 3, "Number?"))).isEmpty();
    }

    @Test
    void shouldCloseAfterBookingWhenAskedForAnythingElse() {
        ResponseStrategyEngine engine = engine(StrategySettings.defaults(), new ProviderRegistry());
        ResponseContext done = new ResponseContext(
            "T-1", 0, Set.of(), history("Is there anything else I can help you with today?"), 6, true
        );

        String reply = engine.generateResponse(
            Classification.builder(ResponseCategory.CONFIRM_OR_DENY, 0.9).build(),
            persona("Dana Smith"),
            done
        );

        assertThat(reply).isEqualTo(ResponseStrategyEngine.NOTHING_ELSE_REPLY);
    }

    @Test
    void shouldConfirmOrDenyFromPersonaFacts() {
        ResponseStrategyEngine engine = engine(StrategySettings.defaults(), new ProviderRegistry());

        String braces = engine.generateResponse(
            Classification.builder(ResponseCategory.CONFIRM_OR_DENY, 0.9).dataFields(List.of(DataField.PREVIOUS_ORTHO_TREATMENT)).build(),
            persona("Dana Smith"),
            context("T-1", 2, "Has she had braces before?")
        );
        String unresolvedPhone = engine.generateResponse(
            Classification.builder(ResponseCategory.CONFIRM_OR_DENY, 0.9)
                .confirmationSubject(ConfirmationSubject.PHONE_NUMBER_CORRECT)
                .build(),
            persona("Dana Smith"),
            context("T-1", 3, "Is c1mg_variable_caller_id_number the best number?")
        );

        assertThat(braces).isEqualTo("No");
        assertThat(unresolvedPhone).isEqualTo("Actually, my number is 555-000-1111");
    }

    @Test
    void shouldCorrectScopeForGeneralDentistryCallers() {
        ResponseStrategyEngine engine = engine(StrategySettings.defaults(), new ProviderRegistry());
        List<ConversationTurn> history = new ArrayList<>();
        history.add(ConversationTurn.user("Hi, I need a dental cleaning for my daughter", clock.instant(), null));
        history.add(ConversationTurn.assistant("Are you looking for orthodontic treatment?", clock.instant(), 50, null));

        String reply = engine.generateResponse(
            Classification.builder(ResponseCategory.CONFIRM_OR_DENY, 0.9).build(),
            persona("Dana Smith"),
            new ResponseContext("T-1", 0, Set.of(), history, 1, false)
        );

        assertThat(reply).isEqualTo("No, I need a dental cleaning");
    }

    @Test
    void shouldPickOptionMatchingPreferredTimeOfDay() {
        ResponseStrategyEngine engine = engine(StrategySettings.defaults(), new ProviderRegistry());
        Classification slots = Classification.builder(ResponseCategory.SELECT_FROM_OPTIONS, 0.85)
            .options(List.of("Monday at 9am", "Tuesday at 2pm"))
            .build();

        String reply = engine.generateResponse(slots, persona("Dana Smith"), context("T-1", 5, "I have Monday at 9am or Tuesday at 2pm."));

        assertThat(reply).isEqualTo("Tuesday at 2pm");
        assertThat(engine.selectBestOption(List.of("Downtown", "Northside"), inventory("any", "northside", List.of())))
            .isEqualTo("Northside");
        assertThat(engine.selectBestOption(List.of("Monday 3pm", "Friday 3pm"), inventory(null, null, List.of("Friday"))))
            .isEqualTo("Friday 3pm");
    }

    private ResponseStrategyEngine engine(StrategySettings settings, ProviderRegistry registry) {
        return new ResponseStrategyEngine(settings, registry, new Random(7), clock);
    }

    private static StrategySettings settings(boolean useLlm, List<String> cancel, List<String> silence) {
        return new StrategySettings(useLlm, 0.7, 128, "openai", "gpt-4o-mini", cancel, silence);
    }

    private static Classification provide(DataField... fields) {
        return Classification.builder(ResponseCategory.PROVIDE_DATA, 0.9).dataFields(List.of(fields)).build();
    }

    private ResponseContext context(String testId, int turn, String agentSays) {
        return new ResponseContext(testId, 0, Set.of(), history(agentSays), turn, false);
    }

    private List<ConversationTurn> history(String agentSays) {
        return List.of(
            ConversationTurn.user("Hi, I'd like to book a consult", clock.instant(), null),
            ConversationTurn.assistant(agentSays, clock.instant(), 80, null)
        );
    }

    private static Persona persona(String name) {
        return new Persona(name, "", inventory("afternoon", null, List.of()), new PersonaTraits(Verbosity.TERSE, false));
    }

    private static DataInventory inventory(String timeOfDay, String location, List<String> days) {
        ChildData ella = new ChildData("Ella", "Smith", LocalDate.of(2016, 3, 2), true, false, null);
        return new DataInventory(
            "Dana", "Smith", "555-000-1111", "dana@example.com", List.of(ella),
            true, "Aetna", null, location, days, timeOfDay, null, false, false
        );
    }

    private static final class RecordingProvider implements LlmProvider {
        private final String name;
        private final String content;
        private final List<String> prompts = new ArrayList<>();

        private RecordingProvider(String name, String content) {
            this.name = name;
            this.content = content;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public LlmResponse chat(String model, List<ChatMessage> messages, double temperature, int maxTokens) {
            messages.forEach(message -> prompts.add(message.content()));
            return new LlmResponse(content, Map.of());
        }
    }
}
