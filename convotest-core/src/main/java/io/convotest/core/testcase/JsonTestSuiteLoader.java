package io.convotest.core.testcase;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.convotest.core.persona.DynamicFieldSpec;
import io.convotest.core.persona.Persona;
import io.convotest.core.persona.PersonaTemplate;
import io.convotest.core.progress.CollectableField;
import io.convotest.core.progress.ConstraintType;
import io.convotest.core.progress.ConversationGoal;
import io.convotest.core.progress.GoalType;
import io.convotest.core.progress.PresetConstraints;
import io.convotest.core.progress.Severity;
import io.convotest.core.progress.TestConstraint;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class JsonTestSuiteLoader {
    private final ObjectMapper mapper;

    public JsonTestSuiteLoader() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
    }

    public TestSuite load(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.exists(path)) {
            throw new IOException("Test suite not found: " + path);
        }
        return toSuite(mapper.readValue(path.toFile(), SuiteDocument.class));
    }

    public TestSuite load(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in must not be null");
        return toSuite(mapper.readValue(in, SuiteDocument.class));
    }

    private TestSuite toSuite(SuiteDocument document) throws IOException {
        List<GoalTestCase> tests = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (TestDocument test : document.tests() == null ? List.<TestDocument>of() : document.tests()) {
            if (!ids.add(test.id())) {
                throw new IOException("Duplicate test id " + test.id() + " in suite " + document.name());
            }
            tests.add(toTestCase(test));
        }
        return new TestSuite(document.name(), tests);
    }

    private GoalTestCase toTestCase(TestDocument test) throws IOException {
        if (test.persona() == null) {
            throw new IOException("Test " + test.id() + " has no persona");
        }
        List<ConversationGoal> goals = new ArrayList<>();
        for (GoalDocument goal : test.goals() == null ? List.<GoalDocument>of() : test.goals()) {
            goals.add(new ConversationGoal(
                goal.id(),
                goal.type(),
                goal.description(),
                goal.requiredFields(),
                goal.priority() == null ? 1 : goal.priority(),
                goal.required() == null || goal.required(),
                null
            ));
        }
        List<TestConstraint> constraints = null;
        if (test.constraints() != null) {
            constraints = new ArrayList<>();
            for (ConstraintDocument constraint : test.constraints()) {
                constraints.add(toConstraint(test.id(), constraint));
            }
        }
        String opening = test.initialMessage() == null ? "Hi" : test.initialMessage();
        return new GoalTestCase(
            test.id(),
            test.name(),
            test.description(),
            test.category(),
            test.tags(),
            new PersonaTemplate(test.persona(), test.dynamicFields()),
            InitialMessage.template(opening),
            goals,
            constraints,
            test.responseConfig()
        );
    }

    private TestConstraint toConstraint(String testId, ConstraintDocument constraint) throws IOException {
        if (constraint.preset() != null) {
            return switch (constraint.preset().toLowerCase(Locale.ROOT).replace("_", "")) {
                case "noerrors" -> PresetConstraints.noErrors();
                case "nointernalexposure" -> PresetConstraints.noInternalExposure();
                case "maxturns" -> PresetConstraints.maxTurns(required(testId, constraint.maxTurns(), "maxTurns"));
                case "maxtime" -> PresetConstraints.maxTime(required(testId, constraint.maxTimeMs(), "maxTimeMs"));
                default -> throw new IOException("Unknown constraint preset " + constraint.preset() + " in test " + testId);
            };
        }
        if (constraint.type() == ConstraintType.MAX_TURNS || constraint.type() == ConstraintType.MAX_TIME) {
            return new TestConstraint(
                constraint.type(),
                constraint.description(),
                null,
                constraint.maxTurns(),
                constraint.maxTimeMs(),
                constraint.severity()
            );
        }
        throw new IOException("Test " + testId + ": only limit constraints and presets can be read from JSON");
    }

    private static <T> T required(String testId, T value, String name) throws IOException {
        if (value == null) {
            throw new IOException("Test " + testId + ": constraint is missing " + name);
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SuiteDocument(String name, List<TestDocument> tests) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TestDocument(
        String id,
        String name,
        String description,
        TestCategory category,
        List<String> tags,
        Persona persona,
        @JsonAlias({"dynamic_fields"}) Map<String, DynamicFieldSpec> dynamicFields,
        @JsonAlias({"initial_message"}) String initialMessage,
        List<GoalDocument> goals,
        List<ConstraintDocument> constraints,
        @JsonAlias({"response_config"}) ResponseConfig responseConfig
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GoalDocument(
        String id,
        GoalType type,
        String description,
        @JsonAlias({"required_fields"}) List<CollectableField> requiredFields,
        Integer priority,
        Boolean required
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ConstraintDocument(
        String preset,
        ConstraintType type,
        String description,
        @JsonAlias({"max_turns"}) Integer maxTurns,
        @JsonAlias({"max_time_ms"}) Long maxTimeMs,
        Severity severity
    ) {
    }
}
