package io.github.manjago.memsim.cli;

import com.typesafe.config.ConfigException;
import io.github.manjago.memsim.core.PlacementStrategy;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * Show information about memsim.
 */
@Command(
    name = "info",
    description = "Show version and configuration info",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions configOptions;

    @Override
    public Integer call() {
        System.out.println();
        System.out.println("memsim 1.0.0 - contiguous memory allocation simulator");
        System.out.println();

        try {
            System.out.println("Effective Configuration:");
            System.out.println(configOptions.load());
        } catch (ConfigException e) {
            System.err.println("❌ Configuration error: " + e.getMessage());
            return 1;
        }

        System.out.println("Placement strategies:");
        for (PlacementStrategy strategy : PlacementStrategy.values()) {
            System.out.printf("  %c  %s%n", strategy.getCode(), strategy.getDisplayName());
        }
        System.out.println();
        System.out.println("Commands: RQ <process> <size> <F|B|W>, RL <process>, C, STAT, X");

        return 0;
    }
}
