package me.bechberger.mcpprobe.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds minimal arguments for tool calls and prompt requests from their declarations.
 */
public final class ArgumentSynthesizer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String SAMPLE_TEXT = "test";

    private ArgumentSynthesizer() {
    }

    /**
     * Arguments for the required properties of a tool's {@code inputSchema}.
     * Enum values and defaults win over type-based samples.
     */
    public static Map<String, Object> forTool(@Nullable JsonNode inputSchema) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        if (inputSchema == null || !inputSchema.isObject()) {
            return arguments;
        }
        Set<String> required = new HashSet<>();
        inputSchema.path("required").forEach(name -> required.add(name.asText()));
        JsonNode properties = inputSchema.path("properties");
        properties.fields().forEachRemaining(entry -> {
            if (required.contains(entry.getKey())) {
                arguments.put(entry.getKey(), sampleValue(entry.getValue()));
            }
        });
        return arguments;
    }

    /**
     * Arguments for the required entries of a prompt's {@code arguments} list
     */
    public static Map<String, Object> forPrompt(@Nullable JsonNode argumentList) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        if (argumentList == null || !argumentList.isArray()) {
            return arguments;
        }
        for (JsonNode argument : argumentList) {
            if (argument.path("required").asBoolean(false)) {
                arguments.put(argument.path("name").asText(), SAMPLE_TEXT);
            }
        }
        return arguments;
    }

    static Object sampleValue(JsonNode schema) {
        JsonNode enumValues = schema.get("enum");
        if (enumValues != null && enumValues.isArray() && !enumValues.isEmpty()) {
            return MAPPER.convertValue(enumValues.get(0), Object.class);
        }
        JsonNode defaultValue = schema.get("default");
        if (defaultValue != null && !defaultValue.isNull()) {
            return MAPPER.convertValue(defaultValue, Object.class);
        }
        String type = schema.path("type").asText("string");
        return switch (type) {
            case "integer", "number" -> 1;
            case "boolean" -> true;
            case "array" -> List.of();
            case "object" -> forTool(schema);
            default -> SAMPLE_TEXT;
        };
    }
}
