package me.bechberger.mcpprobe.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class McpResponsesTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static ExchangeResult result(String json) throws Exception {
        return ExchangeResult.response(JsonRpcResponse.fromJson(MAPPER.readTree(json)), Duration.ZERO);
    }

    @Test
    void toolCallNeedsContentArray() throws Exception {
        McpResponses.validatePayload(McpRequests.TOOLS_CALL,
                result("{\"id\":1,\"result\":{\"content\":[{\"type\":\"text\",\"text\":\"x\"}]}}"));

        assertThrows(ProtocolException.class, () -> McpResponses.validatePayload(McpRequests.TOOLS_CALL,
                result("{\"id\":1,\"result\":{}}")));
    }

    @Test
    void errorResponse_isRejectedWithItsMessage() throws Exception {
        ProtocolException e = assertThrows(ProtocolException.class, () -> McpResponses.requireResult("prompts/get",
                result("{\"id\":1,\"error\":{\"code\":-32602,\"message\":\"missing argument\"}}")));

        assertTrue(e.getMessage().contains("missing argument"));
    }

    @Test
    void payloadFieldPerMethod() {
        assertEquals("contents", McpResponses.payloadField(McpRequests.RESOURCES_READ));
        assertEquals("messages", McpResponses.payloadField(McpRequests.PROMPTS_GET));
        assertThrows(IllegalArgumentException.class, () -> McpResponses.payloadField(McpRequests.PING));
    }
}
