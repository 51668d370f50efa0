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
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: run
 *
 * Executes a script of allocator commands, one per line, without prompting.
 *
 * Examples:
 *   memsim run workload.txt                 # capacity from config
 *   memsim run workload.txt -m 100 --echo   # 100 cells, echo commands
 *   memsim run workload.txt -f my.conf -q   # custom config, no report
 */
@Command(
    name = "run",
    description = "Execute a file of allocator commands",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Command script (one command per line)")
    private Path scriptFile;

    @Option(names = {"-m", "--capacity"}, description = "Total memory size (overrides config)")
    private Integer capacity;

    @Option(names = {"--echo"}, description = "Print each command before its output")
    private boolean echo;

    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (no final report)")
    private boolean quiet;

    @Mixin
    private ConfigOptions configOptions;

    private final PrintStream out;
    private final PrintStream err;

    public RunCommand() {
        this(System.out, System.err);
    }

    RunCommand(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        try {
            AllocatorConfig config = buildConfig();
            BlockListAllocator allocator = BlockListAllocator.fromConfig(config);

            StatusPrinter printer = new StatusPrinter(out).showSizes(config.showSizes());
            Shell shell = new Shell(new CommandParser(),
                    new CommandProcessor(allocator, printer, out), out, null)
                    .echo(echo);

            int executed;
            try (BufferedReader reader = Files.newBufferedReader(scriptFile, StandardCharsets.UTF_8)) {
                executed = shell.run(reader);
            }

            if (!quiet) {
                out.println();
                out.printf("Executed %d command(s) from %s%n", executed, scriptFile);
                out.println();
                out.print(allocator.getStats());
            }
            return 0;

        } catch (ConfigException e) {
            err.println("❌ Configuration error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("❌ " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("❌ Cannot read script: " + e.getMessage());
            return 1;
        }
    }

    private AllocatorConfig buildConfig() {
        AllocatorConfig base = configOptions.load();
        if (capacity == null) {
            return base;
        }
        return AllocatorConfig.builder(base)
                .capacity(capacity)
                .build();
    }
}
