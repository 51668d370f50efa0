package io.github.manjago.memsim.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MemsimCliTest {

    @Test
    @DisplayName("Root command registers every subcommand")
    void subcommands() {
        CommandLine cli = MemsimCli.commandLine(new MemsimCli());

        assertTrue(cli.getSubcommands().keySet().containsAll(List.of("shell", "run", "info", "help")));
    }

    @Test
    @DisplayName("--version prints the version")
    void version() {
        StringWriter sw = new StringWriter();
        CommandLine cli = MemsimCli.commandLine(new MemsimCli());
        cli.setOut(new PrintWriter(sw, true));

        assertEquals(0, cli.execute("--version"));
        assertTrue(sw.toString().contains("memsim 1.0.0"));
    }

    @Test
    @DisplayName("info succeeds with the default configuration")
    void info() {
        assertEquals(0, MemsimCli.commandLine(new MemsimCli()).execute("info"));
    }

    @Test
    @DisplayName("Unknown subcommand is a usage error")
    void unknownSubcommand() {
        CommandLine cli = MemsimCli.commandLine(new MemsimCli());
        cli.setErr(new PrintWriter(new StringWriter()));

        assertEquals(2, cli.execute("defrag"));
    }
}
