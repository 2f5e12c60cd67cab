package io.convotest.core.persona;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PersonaResolver {
    private static final Pattern INDEXED_SEGMENT = Pattern.compile("^([A-Za-z]+)\\[(\\d+)]$");

    private final Clock clock;
    private final ObjectMapper mapper;

    public PersonaResolver(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public ResolvedPersona resolve(PersonaTemplate template) {
        return resolve(template, clock.millis() % 1_000_000_000L);
    }

    public ResolvedPersona resolve(PersonaTemplate template, long seed) {
        Objects.requireNonNull(template, "template must not be null");
        LocalDate today = LocalDate.now(clock);
        DataGenerator generator = new DataGenerator(seed, today);

        ObjectNode inventory = mapper.valueToTree(template.base().inventory());
        List<String> generated = new ArrayList<>();
        for (Map.Entry<String, DynamicFieldSpec> entry : template.dynamicFields().entrySet()) {
            Object value = generator.generate(entry.getValue());
            setPath(inventory, entry.getKey(), value);
            generated.add(entry.getKey());
        }

        DataInventory resolvedInventory;
        try {
            resolvedInventory = mapper.treeToValue(inventory, DataInventory.class);
        } catch (Exception e) {
            throw new IllegalArgumentException("Generated values do not fit persona " + template.base().name(), e);
        }
        Persona base = template.base();
        Persona persona = new Persona(base.name(), base.description(), resolvedInventory, base.traits());
        return new ResolvedPersona(template, persona, new ResolutionMetadata(seed, clock.instant(), generated));
    }

    private void setPath(ObjectNode root, String path, Object value) {
        String[] segments = path.split("\\.");
        ObjectNode current = root;
        for (int i = 0; i < segments.length - 1; i++) {
            current = descend(current, segments[i], path);
        }
        String leaf = "isNewPatient".equals(segments[segments.length - 1]) ? "newPatient" : segments[segments.length - 1];
        if (!current.has(leaf)) {
            throw new IllegalArgumentException("Unknown persona field path: " + path);
        }
        JsonNode node = mapper.valueToTree(value);
        current.set(leaf, node);
    }

    private ObjectNode descend(ObjectNode current, String segment, String path) {
        Matcher indexed = INDEXED_SEGMENT.matcher(segment);
        if (indexed.matches()) {
            JsonNode array = current.get(indexed.group(1));
            int index = Integer.parseInt(indexed.group(2));
            if (!(array instanceof ArrayNode arrayNode) || index >= arrayNode.size()) {
                throw new IllegalArgumentException("Persona path out of range: " + path);
            }
            return (ObjectNode) arrayNode.get(index);
        }
        JsonNode next = current.get(segment);
        if (!(next instanceof ObjectNode objectNode)) {
            throw new IllegalArgumentException("Unknown persona field path: " + path);
        }
        return objectNode;
    }
}
