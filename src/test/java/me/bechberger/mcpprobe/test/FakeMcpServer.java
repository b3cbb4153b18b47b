package me.bechberger.mcpprobe.test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Minimal MCP server speaking newline-delimited JSON-RPC on stdio, launched as a child JVM by the tests.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@code normal}: two tools, one resource, one prompt</li>
 *   <li>{@code tools-only}: only the tools capability</li>
 *   <li>{@code minimal}: no capabilities, list methods are unknown</li>
 *   <li>{@code broken}: tool calls return results without content</li>
 *   <li>{@code noisy}: writes a log line to stdout before every response</li>
 *   <li>{@code silent}: reads requests and never answers</li>
 *   <li>{@code crash}: writes a fatal error to stderr and exits with code 3</li>
 * </ul>
 */
public class FakeMcpServer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String mode;
    private final PrintStream out;

    FakeMcpServer(String mode, PrintStream out) {
        this.mode = mode;
        this.out = out;
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        String mode = args.length > 0 ? args[0] : "normal";
        System.err.println("fake server starting in " + mode + " mode");
        if (mode.equals("crash")) {
            System.err.println("Fatal error: cannot bind transport");
            System.exit(3);
        }
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        new FakeMcpServer(mode, out).serve(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    void serve(BufferedReader in) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            if (line.isBlank() || mode.equals("silent")) {
                continue;
            }
            JsonNode request = MAPPER.readTree(line);
            JsonNode id = request.get("id");
            if (id == null || id.isNull()) {
                continue;
            }
            if (mode.equals("noisy")) {
                out.println("log: handling " + request.path("method").asText());
            }
            out.println(MAPPER.writeValueAsString(respond(id, request.path("method").asText(), request.path("params"))));
        }
    }

    ObjectNode respond(JsonNode id, String method, JsonNode params) {
        ObjectNode response = MAPPER.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        ObjectNode result = MAPPER.createObjectNode();
        switch (method) {
            case "initialize" -> {
                result.put("protocolVersion", params.path("protocolVersion").asText("2024-11-05"));
                ObjectNode capabilities = result.putObject("capabilities");
                if (!mode.equals("minimal")) {
                    capabilities.putObject("tools");
                    if (!mode.equals("tools-only")) {
                        capabilities.putObject("resources");
                        capabilities.putObject("prompts");
                    }
                }
                ObjectNode info = result.putObject("serverInfo");
                info.put("name", "fake-server");
                info.put("version", "1.2.3");
            }
            case "ping" -> {
            }
            case "tools/list" -> {
                if (mode.equals("minimal")) {
                    return error(response, -32601, "Method not found: " + method);
                }
                ArrayNode tools = result.putArray("tools");
                ObjectNode echo = tools.addObject();
                echo.put("name", "echo");
                echo.put("description", "Echo the text back");
                ObjectNode schema = echo.putObject("inputSchema");
                schema.put("type", "object");
                schema.putObject("properties").putObject("text").put("type", "string");
                schema.putArray("required").add("text");
                ObjectNode add = tools.addObject();
                add.put("name", "add");
                ObjectNode addSchema = add.putObject("inputSchema");
                addSchema.put("type", "object");
                ObjectNode props = addSchema.putObject("properties");
                props.putObject("a").put("type", "number");
                props.putObject("b").put("type", "number");
            }
            case "tools/call" -> {
                if (!mode.equals("broken")) {
                    ObjectNode text = result.putArray("content").addObject();
                    text.put("type", "text");
                    text.put("text", params.path("name").asText() + " " + params.path("arguments"));
                }
            }
            case "resources/list" -> {
                if (!hasAll()) {
                    return error(response, -32601, "Method not found: " + method);
                }
                ObjectNode resource = result.putArray("resources").addObject();
                resource.put("uri", "file:///greeting.txt");
                resource.put("name", "greeting");
            }
            case "resources/read" -> {
                ObjectNode content = result.putArray("contents").addObject();
                content.put("uri", params.path("uri").asText());
                content.put("text", "hello");
            }
            case "prompts/list" -> {
                if (!hasAll()) {
                    return error(response, -32601, "Method not found: " + method);
                }
                ObjectNode prompt = result.putArray("prompts").addObject();
                prompt.put("name", "greet");
                ObjectNode argument = prompt.putArray("arguments").addObject();
                argument.put("name", "name");
                argument.put("required", true);
            }
            case "prompts/get" -> {
                ObjectNode message = result.putArray("messages").addObject();
                message.put("role", "user");
                message.putObject("content").put("type", "text").put("text", "Hello " + params.path("arguments"));
            }
            default -> {
                return error(response, -32601, "Method not found: " + method);
            }
        }
        response.set("result", result);
        return response;
    }

    private boolean hasAll() {
        return !mode.equals("minimal") && !mode.equals("tools-only");
    }

    private static ObjectNode error(ObjectNode response, int code, String message) {
        ObjectNode error = response.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return response;
    }
}
