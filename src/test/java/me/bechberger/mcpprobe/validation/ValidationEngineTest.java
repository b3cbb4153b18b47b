package me.bechberger.mcpprobe.validation;

import me.bechberger.mcpprobe.events.DefaultErrorHandler;
import me.bechberger.mcpprobe.events.ProgressListener;
import me.bechberger.mcpprobe.events.RecoveryTable;
import me.bechberger.mcpprobe.model.ValidationLevel;
import me.bechberger.mcpprobe.model.ValidationReport;
import me.bechberger.mcpprobe.process.ProcessRegistry;
import me.bechberger.mcpprobe.process.ProcessSupervisor;
import me.bechberger.mcpprobe.protocol.McpRequests;
import me.bechberger.mcpprobe.protocol.ProtocolExchange;
import me.bechberger.mcpprobe.test.FakeServers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the engine against {@code FakeMcpServer} child processes.
 */
class ValidationEngineTest {

    @TempDir
    Path projectDir;

    private final ProcessSupervisor supervisor = new ProcessSupervisor(new ProcessRegistry(), Duration.ofMillis(500));

    @AfterEach
    void cleanUp() {
        supervisor.terminateAll();
    }

    private ValidationEngine engine(String mode, ValidationLevel level, RecoveryTable table) {
        ValidationOptions options = ValidationOptions.builder()
                .level(level)
                .entryCommand(FakeServers.command(mode))
                .startupWindow(Duration.ofMillis(500))
                .startupTimeout(Duration.ofSeconds(10))
                .requestTimeout(Duration.ofSeconds(10))
                .build();
        return new ValidationEngine(options, supervisor, new ProtocolExchange(), ProgressListener.NOOP,
                new DefaultErrorHandler(table));
    }

    private ValidationEngine engine(String mode, ValidationLevel level) {
        return engine(mode, level, RecoveryTable.defaults());
    }

    @Nested
    @DisplayName("Working server")
    class WorkingServer {

        @Test
        void standardValidationPasses() {
            ValidationReport report = engine("normal", ValidationLevel.STANDARD).validate(projectDir);

            assertTrue(report.overallSuccess(), () -> report.startup().errors() + " " + report.protocol().errors()
                    + " " + report.functionality().errors());
            assertTrue(report.startup().success());
            assertNotNull(report.startup().pid());
            assertEquals(List.of("initialize", "tools/list", "resources/list", "prompts/list"),
                    report.protocol().supportedCapabilities());
            assertEquals(List.of(), report.protocol().missingCapabilities());
            assertEquals("fake-server", report.protocol().serverName());
            assertEquals(true, report.functionality().tools().get("echo"));
            assertEquals(true, report.functionality().tools().get("add"));
            assertEquals(true, report.functionality().resources().get("file:///greeting.txt"));
            assertEquals(true, report.functionality().prompts().get("greet"));
            assertEquals(4.0, report.performanceMetrics().get("total_capabilities"));
            assertTrue(report.recommendations().isEmpty(), report.recommendations()::toString);
            assertTrue(supervisor.registry().isEmpty());
        }

        @Test
        void stateFollowsThePhases() {
            AtomicReference<ValidationEngine> engine = new AtomicReference<>();
            List<ValidationPhase> seen = new CopyOnWriteArrayList<>();
            ProgressListener listener = new ProgressListener() {
                @Override
                public void phaseStarted(String projectId, String phase, String message) {
                    seen.add(engine.get().getState());
                }
            };
            ValidationOptions options = ValidationOptions.builder()
                    .entryCommand(FakeServers.command("normal"))
                    .startupWindow(Duration.ofMillis(500))
                    .build();
            engine.set(new ValidationEngine(options, supervisor, new ProtocolExchange(), listener,
                    new DefaultErrorHandler()));
            assertEquals(ValidationPhase.IDLE, engine.get().getState());

            engine.get().validate(projectDir);

            assertEquals(List.of(ValidationPhase.STARTUP, ValidationPhase.PROTOCOL, ValidationPhase.FUNCTIONALITY), seen);
            assertEquals(ValidationPhase.DONE, engine.get().getState());
        }

        @Test
        void basicLevelSkipsFunctionality() {
            ValidationReport report = engine("normal", ValidationLevel.BASIC).validate(projectDir);

            assertTrue(report.overallSuccess());
            assertFalse(report.functionality().executed());
            assertEquals(0, report.functionality().itemsTested());
        }

        @Test
        void standardLevelRespectsItemLimit() {
            ValidationOptions options = ValidationOptions.builder()
                    .entryCommand(FakeServers.command("normal"))
                    .startupWindow(Duration.ofMillis(500))
                    .maxItemsPerKind(1)
                    .build();
            ValidationEngine limited = new ValidationEngine(options, supervisor, new ProtocolExchange(),
                    ProgressListener.NOOP, new DefaultErrorHandler());

            ValidationReport report = limited.validate(projectDir);

            assertEquals(List.of("echo"), List.copyOf(report.functionality().tools().keySet()));
            assertEquals(2.0, report.functionality().metrics().get("tools_count"));
        }

        @Test
        void noisyStdoutIsTolerated() {
            ValidationReport report = engine("noisy", ValidationLevel.STANDARD).validate(projectDir);

            assertTrue(report.overallSuccess(), () -> report.functionality().errors().toString());
        }
    }

    @Nested
    @DisplayName("Failing server")
    class FailingServer {

        @Test
        void crashDuringStartupSkipsRemainingPhases() {
            ValidationOptions options = ValidationOptions.builder()
                    .entryCommand(FakeServers.command("crash"))
                    .startupWindow(Duration.ofSeconds(10))
                    .build();
            ValidationEngine crashing = new ValidationEngine(options, supervisor, new ProtocolExchange(),
                    ProgressListener.NOOP, new DefaultErrorHandler());

            ValidationReport report = crashing.validate(projectDir);

            assertFalse(report.overallSuccess());
            assertFalse(report.startup().success());
            assertTrue(report.startup().errors().stream().anyMatch(e -> e.contains("code 3")),
                    report.startup().errors()::toString);
            assertFalse(report.protocol().success());
            assertTrue(report.protocol().errors().get(0).startsWith("Skipped"));
            assertTrue(report.recommendations().contains("Fix server startup issues before deployment"));
            assertEquals("Validation failed: server did not start", report.getSummary());
            assertTrue(supervisor.registry().isEmpty());
        }

        @Test
        void silentServerFailsStartupAndIsKilled() {
            ValidationOptions options = ValidationOptions.builder()
                    .entryCommand(FakeServers.command("silent"))
                    .startupWindow(Duration.ofMillis(300))
                    .startupTimeout(Duration.ofMillis(700))
                    .build();
            ValidationEngine silent = new ValidationEngine(options, supervisor, new ProtocolExchange(),
                    ProgressListener.NOOP, new DefaultErrorHandler());

            ValidationReport report = silent.validate(projectDir);

            assertFalse(report.startup().success());
            assertTrue(report.startup().errors().get(0).contains("no output"));
            assertTrue(supervisor.registry().isEmpty());
        }

        @Test
        void missingBaselineCapabilityFailsProtocol() {
            ValidationOptions options = ValidationOptions.builder()
                    .entryCommand(FakeServers.command("minimal"))
                    .startupWindow(Duration.ofMillis(500))
                    .baselineCapabilities(List.of(McpRequests.INITIALIZE, McpRequests.TOOLS_LIST))
                    .build();
            ValidationEngine minimal = new ValidationEngine(options, supervisor, new ProtocolExchange(),
                    ProgressListener.NOOP, new DefaultErrorHandler());

            ValidationReport report = minimal.validate(projectDir);

            assertTrue(report.startup().success());
            assertFalse(report.protocol().success());
            assertEquals(List.of("tools/list"), report.protocol().missingCapabilities());
            assertEquals(List.of("initialize"), report.protocol().supportedCapabilities());
            assertTrue(report.recommendations().contains("Implement missing MCP capabilities: tools/list"));
        }

        @Test
        void brokenToolIsReportedPerItem() {
            ValidationReport report = engine("broken", ValidationLevel.STANDARD, RecoveryTable.lenient())
                    .validate(projectDir);

            assertTrue(report.protocol().success());
            assertFalse(report.functionality().success());
            assertEquals(false, report.functionality().tools().get("echo"));
            assertEquals(true, report.functionality().resources().get("file:///greeting.txt"));
            assertTrue(report.functionality().errors().stream().anyMatch(e -> e.startsWith("Tool 'echo'")));
        }

        @Test
        void noEntryCommandFailsStartup() {
            ValidationEngine none = new ValidationEngine(ValidationOptions.defaults(), supervisor,
                    new ProtocolExchange(), ProgressListener.NOOP, new DefaultErrorHandler());

            ValidationReport report = none.validate(projectDir);

            assertFalse(report.startup().success());
            assertNull(report.startup().pid());
        }
    }

    @Test
    void optionsRejectNonPositiveDurations() {
        assertThrows(IllegalArgumentException.class,
                () -> ValidationOptions.builder().requestTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> ValidationOptions.builder().maxItemsPerKind(0).build());
    }
}
