package me.bechberger.mcpprobe.cli;

import me.bechberger.mcpprobe.config.ConfigLoader;
import me.bechberger.mcpprobe.config.Durations;
import me.bechberger.mcpprobe.config.ProbeConfig;
import me.bechberger.mcpprobe.events.DefaultErrorHandler;
import me.bechberger.mcpprobe.events.ProgressListener;
import me.bechberger.mcpprobe.events.RecoveryTable;
import me.bechberger.mcpprobe.model.ValidationLevel;
import me.bechberger.mcpprobe.process.EntryCommand;
import me.bechberger.mcpprobe.process.ProcessSupervisor;
import me.bechberger.mcpprobe.protocol.ProtocolExchange;
import me.bechberger.mcpprobe.validation.ValidationEngine;
import me.bechberger.mcpprobe.validation.ValidationOptions;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Options of the commands that start the server: validation level, timeouts, entry command and config file.
 */
public class ServerOptions {

    @Option(names = {"-l", "--level"}, description = "Validation level: basic, standard, comprehensive (default: standard)")
    private String level;

    @Option(names = {"-t", "--timeout"}, description = "Startup timeout, e.g. 30s (default: 30s)")
    private String timeout;

    @Option(names = {"--entry-command"}, description = "Command that starts the server, e.g. \"python server.py\"")
    private String entryCommand;

    @Option(names = {"--keep-going"}, description = "Run all phases even after a failed one")
    private boolean keepGoing = false;

    @Option(names = {"-c", "--config"}, description = "YAML or JSON config file")
    private Path configFile;

    private ProbeConfig config;

    /**
     * The config file's settings, or empty settings without {@code --config}
     */
    public ProbeConfig config() throws IOException {
        if (config == null) {
            config = configFile != null ? ConfigLoader.load(configFile) : ProbeConfig.EMPTY;
        }
        return config;
    }

    /**
     * Built-in defaults, overridden by the config file, overridden by flags
     *
     * @throws IllegalArgumentException for invalid values
     */
    public ValidationOptions buildValidationOptions() throws IOException {
        ValidationOptions.Builder builder = config().applyTo(ValidationOptions.builder());
        if (level != null) {
            builder.level(ValidationLevel.fromString(level));
        }
        if (timeout != null) {
            builder.startupTimeout(Durations.parse(timeout));
        }
        if (entryCommand != null) {
            builder.entryCommand(EntryCommand.parse(entryCommand));
        }
        return builder.build();
    }

    public boolean isKeepGoing() throws IOException {
        return keepGoing || config().isKeepGoing();
    }

    public ValidationEngine buildEngine(ValidationOptions options, ProgressListener progress) throws IOException {
        RecoveryTable table = isKeepGoing() ? RecoveryTable.lenient() : RecoveryTable.defaults();
        return new ValidationEngine(options, new ProcessSupervisor(), new ProtocolExchange(), progress,
                new DefaultErrorHandler(table));
    }
}
