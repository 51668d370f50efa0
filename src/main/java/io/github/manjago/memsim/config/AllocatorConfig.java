package io.github.manjago.memsim.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import io.github.manjago.memsim.core.OwnerPolicy;

import java.nio.file.Path;

/**
 * Configuration for the allocator and the command shell.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record AllocatorConfig(
    // Allocator
    int capacity,
    OwnerPolicy ownerPolicy,
    boolean verifyInvariants,

    // Shell
    String prompt,
    boolean showSizes
) {

    /**
     * Load default configuration.
     */
    public static AllocatorConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file, falling back to the defaults.
     *
     * @throws com.typesafe.config.ConfigException if the file is missing or malformed
     */
    public static AllocatorConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile(),
                ConfigParseOptions.defaults().setAllowMissing(false));
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static AllocatorConfig fromConfig(Config config) {
        Config c = config.getConfig("memsim");

        return new AllocatorConfig(
            c.getInt("allocator.capacity"),
            c.getEnum(OwnerPolicy.class, "allocator.owner-policy"),
            c.getBoolean("allocator.verify-invariants"),
            c.getString("shell.prompt"),
            c.getBoolean("shell.show-sizes")
        );
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with the values of an existing configuration.
     */
    public static Builder builder(AllocatorConfig base) {
        return new Builder()
                .capacity(base.capacity())
                .ownerPolicy(base.ownerPolicy())
                .verifyInvariants(base.verifyInvariants())
                .prompt(base.prompt())
                .showSizes(base.showSizes());
    }

    public static class Builder {
        private int capacity = 1_048_576;
        private OwnerPolicy ownerPolicy = OwnerPolicy.SINGLE;
        private boolean verifyInvariants = true;
        private String prompt = "allocator> ";
        private boolean showSizes = true;

        public Builder capacity(int capacity) { this.capacity = capacity; return this; }
        public Builder ownerPolicy(OwnerPolicy policy) { this.ownerPolicy = policy; return this; }
        public Builder verifyInvariants(boolean verify) { this.verifyInvariants = verify; return this; }
        public Builder prompt(String prompt) { this.prompt = prompt; return this; }
        public Builder showSizes(boolean show) { this.showSizes = show; return this; }

        public AllocatorConfig build() {
            if (capacity <= 0) {
                throw new IllegalArgumentException("Capacity must be positive: " + capacity);
            }
            return new AllocatorConfig(capacity, ownerPolicy, verifyInvariants, prompt, showSizes);
        }
    }

    @Override
    public String toString() {
        return String.format("""
            AllocatorConfig:
              allocator.capacity:          %,d
              allocator.owner-policy:      %s
              allocator.verify-invariants: %s
              shell.prompt:                "%s"
              shell.show-sizes:            %s
            """,
            capacity,
            ownerPolicy,
            verifyInvariants,
            prompt,
            showSizes
        );
    }
}
