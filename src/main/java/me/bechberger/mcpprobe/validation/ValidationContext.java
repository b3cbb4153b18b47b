package me.bechberger.mcpprobe.validation;

import me.bechberger.mcpprobe.process.EntryCommand;
import me.bechberger.mcpprobe.process.ProcessStartException;
import me.bechberger.mcpprobe.process.ProcessSupervisor;
import me.bechberger.mcpprobe.process.ServerProcess;
import me.bechberger.mcpprobe.protocol.McpSession;
import me.bechberger.mcpprobe.protocol.ProtocolExchange;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * Everything a validation check needs: the project, how to launch it and the settings.
 *
 * @param entryCommand null when none was given and none could be detected
 */
public record ValidationContext(
        @NotNull Path projectPath,
        @Nullable EntryCommand entryCommand,
        @NotNull ValidationOptions options,
        @NotNull ProcessSupervisor supervisor,
        @NotNull ProtocolExchange exchange
) {

    /**
     * Name used to key progress events
     */
    public String projectId() {
        Path name = projectPath.toAbsolutePath().normalize().getFileName();
        return name != null ? name.toString() : projectPath.toString();
    }

    /**
     * Start a fresh server process.
     *
     * @throws ProcessStartException also when no entry command is known
     */
    public ServerProcess startServer() throws ProcessStartException {
        if (entryCommand == null) {
            throw new ProcessStartException("Could not detect server entry point in " + projectPath);
        }
        return supervisor.start(projectPath, entryCommand);
    }

    public McpSession openSession(@NotNull ServerProcess process) {
        return McpSession.open(exchange, process, options.getRequestTimeout());
    }
}
