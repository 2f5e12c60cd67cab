package io.convotest.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AgentResponseParser {
    private static final Logger LOG = LoggerFactory.getLogger(AgentResponseParser.class);
    private static final String PAYLOAD_MARKER = "PAYLOAD:";
    private static final int DOCUMENT_PREVIEW_LENGTH = 200;

    private final ObjectMapper mapper;

    AgentResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    String extractText(JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return "";
        }
        if (data.isTextual()) {
            return data.asText();
        }
        for (String field : List.of("text", "answer", "response", "output")) {
            JsonNode value = data.path(field);
            if (value.isTextual() && !value.asText().isEmpty()) {
                return value.asText();
            }
        }
        return data.toString();
    }

    List<ToolCall> extractToolCalls(JsonNode data) {
        List<ToolCall> calls = new ArrayList<>();
        if (data == null || !data.isObject()) {
            return calls;
        }

        ToolCall payload = payloadSection(extractText(data));
        if (payload != null) {
            calls.add(payload);
        }
        for (JsonNode step : data.path("agentReasoning")) {
            for (JsonNode tool : step.path("usedTools")) {
                calls.add(usedTool(tool));
            }
            String stepTool = firstText(step, "tool", "toolName");
            if (stepTool != null) {
                calls.add(new ToolCall(
                    stepTool,
                    first(step, "toolInput", "input"),
                    first(step, "toolOutput", "output"),
                    firstText(step, "status"),
                    null
                ));
            }
        }
        for (JsonNode call : data.path("tool_calls")) {
            String name = call.path("function").path("name").isTextual()
                ? call.path("function").path("name").asText()
                : textOr(call.path("name"), "unknown");
            JsonNode input = call.path("function").has("arguments")
                ? call.path("function").path("arguments")
                : first(call, "arguments");
            calls.add(new ToolCall(name, input, first(call, "output", "result"), "completed", null));
        }
        JsonNode functionCall = data.path("function_call");
        if (functionCall.isObject()) {
            calls.add(new ToolCall(
                textOr(functionCall.path("name"), "unknown"),
                first(functionCall, "arguments"),
                first(functionCall, "output"),
                "completed",
                null
            ));
        }
        for (JsonNode tool : data.path("usedTools")) {
            calls.add(usedTool(tool));
        }
        JsonNode documents = data.path("sourceDocuments");
        if (documents.isArray()) {
            calls.add(documentRetrieval(documents));
        }
        return calls;
    }

    private ToolCall payloadSection(String text) {
        int marker = text.toUpperCase(Locale.ROOT).indexOf(PAYLOAD_MARKER);
        if (marker < 0) {
            return null;
        }
        String section = text.substring(marker + PAYLOAD_MARKER.length()).trim();
        int start = section.indexOf('{');
        if (start < 0) {
            return null;
        }
        int depth = 0;
        int end = start;
        for (int i = start; i < section.length(); i++) {
            char c = section.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
            if (depth == 0) {
                end = i + 1;
                break;
            }
        }
        String json = section.substring(start, end);
        JsonNode output;
        try {
            output = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            LOG.debug("Payload section is not valid JSON, keeping it raw: {}", e.getOriginalMessage());
            ObjectNode raw = mapper.createObjectNode();
            raw.put("raw", json);
            output = raw;
        }
        return new ToolCall("flowise_payload", NullNode.getInstance(), output, "completed", null);
    }

    private ToolCall usedTool(JsonNode tool) {
        String name = firstText(tool, "tool", "name");
        return new ToolCall(
            name == null ? "unknown" : name,
            first(tool, "toolInput", "input"),
            first(tool, "toolOutput", "output"),
            firstText(tool, "status"),
            null
        );
    }

    private ToolCall documentRetrieval(JsonNode documents) {
        ObjectNode input = mapper.createObjectNode();
        input.put("query", "vector search");
        ArrayNode output = mapper.createArrayNode();
        for (JsonNode doc : documents) {
            ObjectNode summary = output.addObject();
            String content = doc.path("pageContent").asText("");
            summary.put("pageContent", content.length() > DOCUMENT_PREVIEW_LENGTH
                ? content.substring(0, DOCUMENT_PREVIEW_LENGTH)
                : content);
            summary.set("metadata", doc.path("metadata").isMissingNode() ? NullNode.getInstance() : doc.path("metadata"));
        }
        return new ToolCall("document_retrieval", input, output, "completed", null);
    }

    private static JsonNode first(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (!value.isMissingNode() && !value.isNull()) {
                return value;
            }
        }
        return NullNode.getInstance();
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (value.isTextual() && !value.asText().isEmpty()) {
                return value.asText();
            }
        }
        return null;
    }

    private static String textOr(JsonNode node, String fallback) {
        return node.isTextual() && !node.asText().isEmpty() ? node.asText() : fallback;
    }
}
