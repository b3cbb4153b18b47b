package me.bechberger.mcpprobe.test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Helper class for asserting JSON structures in tests
 */
public class JsonAssertions {

    private static final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    /**
     * Parse JSON string into JsonNode
     */
    public static JsonNode parseJson(String json) throws IOException {
        return mapper.readTree(json);
    }

    /**
     * Assert that JSON contains a field with expected value
     */
    public static void assertJsonField(JsonNode json, String fieldPath, Object expectedValue) {
        JsonNode node = navigateToField(json, fieldPath);
        assertNotNull(node, "Field not found: " + fieldPath);

        if (expectedValue instanceof String) {
            assertEquals(expectedValue, node.asText(), "Field value mismatch at: " + fieldPath);
        } else if (expectedValue instanceof Integer) {
            assertEquals(expectedValue, node.asInt(), "Field value mismatch at: " + fieldPath);
        } else if (expectedValue instanceof Double) {
            assertEquals((Double) expectedValue, node.asDouble(), 1e-9, "Field value mismatch at: " + fieldPath);
        } else if (expectedValue instanceof Boolean) {
            assertEquals(expectedValue, node.asBoolean(), "Field value mismatch at: " + fieldPath);
        } else {
            fail("Unsupported expected value type: " + expectedValue.getClass());
        }
    }

    /**
     * Assert that JSON field exists
     */
    public static void assertJsonFieldExists(JsonNode json, String fieldPath) {
        JsonNode node = navigateToField(json, fieldPath);
        assertNotNull(node, "Field not found: " + fieldPath);
    }

    /**
     * Assert that JSON field does not exist
     */
    public static void assertJsonFieldNotExists(JsonNode json, String fieldPath) {
        JsonNode node = navigateToField(json, fieldPath);
        assertTrue(node == null || node.isNull(), "Field should not exist: " + fieldPath);
    }

    /**
     * Assert that JSON array has expected size
     */
    public static void assertJsonArraySize(JsonNode json, String arrayPath, int expectedSize) {
        JsonNode node = navigateToField(json, arrayPath);
        assertNotNull(node, "Array not found: " + arrayPath);
        assertTrue(node.isArray(), "Field is not an array: " + arrayPath);
        assertEquals(expectedSize, node.size(), "Array size mismatch at: " + arrayPath);
    }

    /**
     * Navigate to a field using dot notation (e.g., "benchmarks.0.operation")
     */
    private static JsonNode navigateToField(JsonNode root, String fieldPath) {
        String[] parts = fieldPath.split("\\.");
        JsonNode current = root;

        for (String part : parts) {
            if (current == null) {
                return null;
            }
            if (part.matches("\\d+")) {
                int index = Integer.parseInt(part);
                if (current.isArray() && index < current.size()) {
                    current = current.get(index);
                } else {
                    return null;
                }
            } else {
                current = current.get(part);
            }
        }

        return current;
    }
}
