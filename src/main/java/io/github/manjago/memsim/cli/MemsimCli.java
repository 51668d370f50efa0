package io.github.manjago.memsim.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * memsim CLI - contiguous memory allocation simulator.
 *
 * Usage:
 *   memsim shell [capacity]     - Interactive allocator session
 *   memsim run <script>         - Execute a file of allocator commands
 *   memsim info                 - Show version and default config
 */
@Command(
    name = "memsim",
    description = "Contiguous memory allocation simulator (first/best/worst fit)",
    mixinStandardHelpOptions = true,
    version = "memsim 1.0.0",
    subcommands = {
        ShellCommand.class,
        RunCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class MemsimCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    /**
     * Command line with the settings every entry point uses.
     */
    public static CommandLine commandLine(Object command) {
        return new CommandLine(command)
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new MemsimCli()).execute(args);
        System.exit(exitCode);
    }
}
