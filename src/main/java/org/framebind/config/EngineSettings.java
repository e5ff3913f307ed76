package org.framebind.config;

import com.typesafe.config.Config;

import java.util.Objects;

/**
 * Runtime switches of the frame-visibility engine, read from the {@code framebind.engine} block.
 *
 * @param verifyInvariants Check invariants I1..I5 on every rebuilt sequence before it is installed.
 * @param strictQueries    Scan all records on every query and fail if more than one is visible.
 */
public record EngineSettings(boolean verifyInvariants, boolean strictQueries) {

    /** Config path of the engine block. */
    public static final String CONFIG_PATH = "framebind.engine";

    /**
     * @return Settings with both checks disabled, matching {@code reference.conf}.
     */
    public static EngineSettings defaults() {
        return new EngineSettings(false, false);
    }

    /**
     * @return Settings with both checks enabled, for tests and debugging sessions.
     */
    public static EngineSettings strict() {
        return new EngineSettings(true, true);
    }

    /**
     * Reads the settings from a root configuration. Missing keys fall back to {@link #defaults()}.
     *
     * @param rootConfig The root configuration, typically from {@link ConfigLoader#load()}.
     * @return The engine settings.
     */
    public static EngineSettings fromConfig(Config rootConfig) {
        Objects.requireNonNull(rootConfig, "Config cannot be null.");
        if (!rootConfig.hasPath(CONFIG_PATH)) {
            return defaults();
        }
        Config engine = rootConfig.getConfig(CONFIG_PATH);
        boolean verify = engine.hasPath("verify-invariants") && engine.getBoolean("verify-invariants");
        boolean strict = engine.hasPath("strict-queries") && engine.getBoolean("strict-queries");
        return new EngineSettings(verify, strict);
    }
}
