package me.bechberger.mcpprobe.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.bechberger.mcpprobe.process.ServerProcess;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Newline-delimited JSON-RPC over a server process's stdin and stdout.
 * <p>
 * One call holds the process's exchange lock for its whole write-then-read cycle, and the write
 * counts against the call's timeout like the read does. While waiting,
 * lines that are not JSON objects, notifications and responses for other ids are discarded, so a
 * late answer to a timed-out call never reaches a later caller.
 */
public class ProtocolExchange {

    private static final Logger log = LoggerFactory.getLogger(ProtocolExchange.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Send a request and wait for the response carrying the same id.
     * Never throws for transport problems; those are reported in the result.
     */
    public @NotNull ExchangeResult call(@NotNull ServerProcess process, @NotNull JsonRpcRequest request,
                                        @NotNull Duration timeout) {
        if (request.isNotification()) {
            throw new IllegalArgumentException("Use notify() for notifications: " + request.method());
        }
        long start = System.nanoTime();
        long deadline = start + timeout.toNanos();
        ReentrantLock lock = process.exchangeLock();
        try {
            if (!lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                return ExchangeResult.timeout(since(start), "waiting for exclusive access to pid " + process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExchangeResult.ioError(since(start), "interrupted");
        }
        try {
            String payload = serialize(request);
            try {
                process.writeLine(payload, Duration.ofNanos(deadline - System.nanoTime()));
            } catch (IOException e) {
                return ExchangeResult.ioError(since(start), "write failed: " + e.getMessage());
            } catch (TimeoutException e) {
                return ExchangeResult.timeout(since(start), "pid " + process.pid() + " did not read " + request.method()
                        + " within " + timeout.toMillis() + " ms");
            }
            String expectedId = String.valueOf(request.id());
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return ExchangeResult.timeout(since(start), request.method() + " after " + timeout.toMillis() + " ms");
                }
                String line = process.readLine(remaining, TimeUnit.NANOSECONDS);
                if (line == null) {
                    return ExchangeResult.timeout(since(start), request.method() + " after " + timeout.toMillis() + " ms");
                }
                JsonRpcResponse response = parseMatching(line, expectedId, process);
                if (response != null) {
                    return ExchangeResult.response(response, since(start));
                }
            }
        } catch (IOException e) {
            return ExchangeResult.ioError(since(start), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExchangeResult.ioError(since(start), "interrupted");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write a notification. No response is expected.
     *
     * @throws IOException if the write fails or does not finish within the timeout
     */
    public void notify(@NotNull ServerProcess process, @NotNull JsonRpcRequest notification,
                       @NotNull Duration timeout) throws IOException {
        if (!notification.isNotification()) {
            throw new IllegalArgumentException("Notification must not carry an id: " + notification.method());
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        ReentrantLock lock = process.exchangeLock();
        try {
            if (!lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new IOException("Timed out waiting for exclusive access to pid " + process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while sending " + notification.method(), e);
        }
        try {
            process.writeLine(serialize(notification), Duration.ofNanos(deadline - System.nanoTime()));
        } catch (TimeoutException e) {
            throw new IOException("pid " + process.pid() + " did not read " + notification.method()
                    + " within " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while sending " + notification.method(), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Channel sending every request over this exchange with the given timeout
     */
    public @NotNull RequestChannel channel(@NotNull ServerProcess process, @NotNull Duration timeout) {
        return request -> call(process, request, timeout);
    }

    private JsonRpcResponse parseMatching(String line, String expectedId, ServerProcess process) {
        if (line.isBlank()) {
            return null;
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring non-JSON output from pid {}: {}", process.pid(), abbreviate(line));
            return null;
        }
        if (node == null || !node.isObject()) {
            log.debug("Ignoring non-object output from pid {}: {}", process.pid(), abbreviate(line));
            return null;
        }
        JsonNode id = node.get("id");
        if (id == null || id.isNull()) {
            log.debug("Ignoring notification from pid {}: {}", process.pid(), node.path("method").asText("?"));
            return null;
        }
        if (!id.asText().equals(expectedId)) {
            log.debug("Discarding response for id {} from pid {}, waiting for {}", id.asText(), process.pid(), expectedId);
            return null;
        }
        return JsonRpcResponse.fromJson(node);
    }

    private static String serialize(JsonRpcRequest request) {
        try {
            return MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request cannot be serialized: " + request.method(), e);
        }
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String abbreviate(String line) {
        return line.length() <= 120 ? line : line.substring(0, 117) + "...";
    }
}
