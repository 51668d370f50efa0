package io.github.manjago.memsim.cli;

import com.typesafe.config.ConfigException;
import io.github.manjago.memsim.config.AllocatorConfig;
import io.github.manjago.memsim.core.BlockListAllocator;
import io.github.manjago.memsim.shell.CommandParser;
import io.github.manjago.memsim.shell.CommandProcessor;
import io.github.manjago.memsim.shell.Shell;
import io.github.manjago.memsim.shell.StatusPrinter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * CLI command: shell
 *
 * Interactive session reading one allocator command per line.
 *
 * Usage:
 *   memsim shell                  # asks for the memory size first
 *   memsim shell 1048576          # 1M cells
 *   memsim shell 100 --owner-policy multiple
 */
@Command(
    name = "shell",
    description = "Start an interactive allocator session",
    mixinStandardHelpOptions = true
)
public class ShellCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Total memory size (asked for when omitted)")
    private Integer capacity;

    @Mixin
    private ConfigOptions configOptions;

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public ShellCommand() {
        this(System.in, System.out, System.err);
    }

    ShellCommand(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        try {
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));

            Integer size = capacity != null ? capacity : askCapacity(reader);
            if (size == null) {
                return 1;
            }
            if (size <= 0) {
                err.println("❌ Memory size must be positive: " + size);
                return 1;
            }

            AllocatorConfig config = AllocatorConfig.builder(configOptions.load())
                    .capacity(size)
                    .build();
            BlockListAllocator allocator = BlockListAllocator.fromConfig(config);

            StatusPrinter printer = new StatusPrinter(out).showSizes(config.showSizes());
            Shell shell = new Shell(new CommandParser(),
                    new CommandProcessor(allocator, printer, out), out, config.prompt());
            shell.run(reader);
            return 0;

        } catch (ConfigException e) {
            err.println("❌ Configuration error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("❌ Error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Ask for the memory size on the first input line.
     *
     * @return parsed size, or null if the input ended or was not a number
     */
    private Integer askCapacity(BufferedReader reader) throws IOException {
        out.print("Enter total memory size: ");
        out.flush();

        String line = reader.readLine();
        if (line == null) {
            err.println("❌ No memory size given");
            return null;
        }
        try {
            return Integer.parseInt(line.strip());
        } catch (NumberFormatException e) {
            err.println("❌ Invalid memory size: " + line.strip());
            return null;
        }
    }
}
