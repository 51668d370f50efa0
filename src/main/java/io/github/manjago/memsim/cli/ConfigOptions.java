package io.github.manjago.memsim.cli;

import io.github.manjago.memsim.config.AllocatorConfig;
import io.github.manjago.memsim.core.OwnerPolicy;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Configuration options shared by all subcommands.
 */
public class ConfigOptions {

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"--owner-policy"}, description = "One block per owner or many: ${COMPLETION-CANDIDATES}")
    private OwnerPolicy ownerPolicy;

    /**
     * Build configuration: defaults, then the config file, then command-line overrides.
     */
    public AllocatorConfig load() {
        AllocatorConfig base = configFile != null
                ? AllocatorConfig.fromFile(configFile)
                : AllocatorConfig.defaults();

        if (ownerPolicy == null) {
            return base;
        }
        return AllocatorConfig.builder(base)
                .ownerPolicy(ownerPolicy)
                .build();
    }
}
