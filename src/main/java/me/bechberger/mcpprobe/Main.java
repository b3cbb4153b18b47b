package me.bechberger.mcpprobe;

import me.bechberger.mcpprobe.cli.ScanCommand;
import me.bechberger.mcpprobe.cli.TestCommand;
import me.bechberger.mcpprobe.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Main entry point for the mcpprobe CLI
 */
@Command(
        name = "mcpprobe",
        description = "Validate, test and scan Model Context Protocol servers",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        subcommands = {
                ValidateCommand.class,
                TestCommand.class,
                ScanCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        // Show help if no subcommand is provided
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
