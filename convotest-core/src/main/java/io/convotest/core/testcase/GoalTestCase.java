package io.convotest.core.testcase;

import io.convotest.core.persona.Persona;
import io.convotest.core.persona.PersonaTemplate;
import io.convotest.core.progress.ConversationGoal;
import io.convotest.core.progress.PresetConstraints;
import io.convotest.core.progress.TestConstraint;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record GoalTestCase(
    String id,
    String name,
    String description,
    TestCategory category,
    List<String> tags,
    PersonaTemplate persona,
    InitialMessage initialMessage,
    List<ConversationGoal> goals,
    List<TestConstraint> constraints,
    ResponseConfig responseConfig
) {
    public GoalTestCase {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("test id must not be blank");
        }
        name = name == null || name.isBlank() ? id : name;
        description = description == null ? name : description;
        category = category == null ? TestCategory.HAPPY_PATH : category;
        tags = tags == null ? List.of() : List.copyOf(tags);
        Objects.requireNonNull(persona, "persona must not be null");
        Objects.requireNonNull(initialMessage, "initialMessage must not be null");
        goals = goals == null ? List.of() : List.copyOf(goals);
        constraints = constraints == null ? PresetConstraints.defaults() : List.copyOf(constraints);
        responseConfig = responseConfig == null ? ResponseConfig.defaults() : responseConfig;
    }

    public static Builder builder(String id, Persona persona) {
        return new Builder(id, PersonaTemplate.fixed(persona));
    }

    public static Builder builder(String id, PersonaTemplate template) {
        return new Builder(id, template);
    }

    public static final class Builder {
        private final String id;
        private final PersonaTemplate persona;
        private String name;
        private String description;
        private TestCategory category = TestCategory.HAPPY_PATH;
        private List<String> tags = List.of();
        private InitialMessage initialMessage = InitialMessage.literal("Hi");
        private final List<ConversationGoal> goals = new ArrayList<>();
        private List<TestConstraint> constraints;
        private ResponseConfig responseConfig = ResponseConfig.defaults();

        private Builder(String id, PersonaTemplate persona) {
            this.id = id;
            this.persona = persona;
        }

        public Builder name(String value) {
            this.name = value;
            return this;
        }

        public Builder description(String value) {
            this.description = value;
            return this;
        }

        public Builder category(TestCategory value) {
            this.category = value;
            return this;
        }

        public Builder tags(List<String> value) {
            this.tags = value;
            return this;
        }

        public Builder initialMessage(String value) {
            this.initialMessage = InitialMessage.literal(value);
            return this;
        }

        public Builder initialMessage(InitialMessage value) {
            this.initialMessage = value;
            return this;
        }

        public Builder goal(ConversationGoal value) {
            this.goals.add(value);
            return this;
        }

        public Builder constraints(List<TestConstraint> value) {
            this.constraints = value;
            return this;
        }

        public Builder responseConfig(ResponseConfig value) {
            this.responseConfig = value;
            return this;
        }

        public Builder maxTurns(int value) {
            this.responseConfig = responseConfig.withMaxTurns(value);
            return this;
        }

        public GoalTestCase build() {
            return new GoalTestCase(
                id,
                name,
                description,
                category,
                tags,
                persona,
                initialMessage,
                goals,
                constraints,
                responseConfig
            );
        }
    }
}
