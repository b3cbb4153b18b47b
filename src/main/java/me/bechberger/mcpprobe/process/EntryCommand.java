package me.bechberger.mcpprobe.process;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * The command line used to launch a server project.
 *
 * @param argv   program and arguments, never empty
 * @param source where the command came from, e.g. "package.json start script"
 */
public record EntryCommand(List<String> argv, String source) {

    public EntryCommand {
        argv = List.copyOf(argv);
        if (argv.isEmpty()) {
            throw new IllegalArgumentException("Entry command must not be empty");
        }
    }

    public static EntryCommand of(@NotNull String source, @NotNull String... argv) {
        return new EntryCommand(List.of(argv), source);
    }

    /**
     * Parse a command string as given on the command line.
     * Whitespace separates arguments; single and double quotes group them.
     */
    public static EntryCommand parse(@NotNull String command) {
        List<String> args = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        boolean inToken = false;
        for (int i = 0; i < command.length(); i++) {
            char c = command.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    args.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (quote != 0) {
            throw new IllegalArgumentException("Unterminated quote in command: " + command);
        }
        if (inToken) {
            args.add(current.toString());
        }
        return new EntryCommand(args, "override");
    }

    /**
     * Command line for display and reports
     */
    public String display() {
        return String.join(" ", argv);
    }

    @Override
    public String toString() {
        return display();
    }
}
