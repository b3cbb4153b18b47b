package me.bechberger.mcpprobe.process;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntryCommandTest {

    @Test
    void parse_splitsOnWhitespace() {
        EntryCommand command = EntryCommand.parse("  python   server.py --port 0 ");

        assertEquals(List.of("python", "server.py", "--port", "0"), command.argv());
        assertEquals("override", command.source());
    }

    @Test
    void parse_keepsQuotedArgumentsTogether() {
        EntryCommand command = EntryCommand.parse("node \"my server.js\" 'a b' \"\"");

        assertEquals(List.of("node", "my server.js", "a b", ""), command.argv());
    }

    @Test
    void parse_rejectsUnterminatedQuote() {
        assertThrows(IllegalArgumentException.class, () -> EntryCommand.parse("python 'server.py"));
    }

    @Test
    void emptyCommand_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> EntryCommand.parse("   "));
    }

    @Test
    void display_joinsArguments() {
        assertEquals("npm start", EntryCommand.of("package.json start script", "npm", "start").display());
    }
}
