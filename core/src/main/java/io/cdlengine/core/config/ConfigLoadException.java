package io.cdlengine.core.config;

import java.nio.file.Path;

/**
 * Raised when engine configuration cannot be loaded. Carries the offending setting, when one is
 * known, as either a dotted YAML key ({@code limits.max-depth}) or an environment variable name
 * ({@code CDL_MAX_DEPTH}), and the file it came from.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String key;
    private final transient Path source;

    public ConfigLoadException(String message, Path source) {
        this(message, null, source, null);
    }

    public ConfigLoadException(String message, Path source, Throwable cause) {
        this(message, null, source, cause);
    }

    /**
     * @param key dotted YAML key or environment variable name, {@code null} for file-level failures
     * @param source configuration file, {@code null} for environment-only configuration
     */
    public ConfigLoadException(String message, String key, Path source, Throwable cause) {
        super(message, cause);
        this.key = key;
        this.source = source;
    }

    /** The setting that failed, or {@code null} when the failure is not tied to one. */
    public String key() {
        return key;
    }

    /** The configuration file, or {@code null} when loading from the environment only. */
    public Path source() {
        return source;
    }

    /** Whether the failing value came from an environment variable rather than the file. */
    public boolean fromEnvironment() {
        return key != null && key.startsWith(EngineConfigLoader.ENV_PREFIX);
    }

    ConfigLoadException withSource(Path file) {
        if (source != null) {
            return this;
        }
        return new ConfigLoadException(getMessage(), key, file, getCause());
    }
}
