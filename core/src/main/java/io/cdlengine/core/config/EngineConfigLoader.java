package io.cdlengine.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.cdlengine.core.error.MalformedDurationException;
import io.cdlengine.core.spec.DurationParser;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads {@link EngineConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * limits:
 *   max-depth: 100
 *   max-children: 1000
 *   max-window: 365d
 * aggregation:
 *   retention: 7d
 *   prune-interval: 1h
 * </pre>
 *
 * <p>
 * Missing keys keep the defaults from {@link EngineConfig.Builder}. Every key can be overridden by
 * an environment variable ({@code CDL_MAX_DEPTH}, {@code CDL_MAX_CHILDREN}, {@code CDL_MAX_WINDOW},
 * {@code CDL_RETENTION}, {@code CDL_PRUNE_INTERVAL}); env vars take precedence over YAML. A
 * variable that is undefined or blank after trimming counts as unset.
 */
public final class EngineConfigLoader {

    static final String ENV_PREFIX = "CDL_";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private EngineConfigLoader() {
        // utility class
    }

    /** Loads the file and applies overrides from {@link System#getenv}. */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the file and applies overrides from the supplied lookup ({@code null} means
     * undefined).
     *
     * @throws ConfigLoadException if the file is missing, unreadable or holds an invalid value
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath, configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e.withSource(configPath);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException(
                    "Invalid configuration in " + configPath + ": " + e.getMessage(), configPath, e);
        }
    }

    /** Builds a configuration from defaults and environment variables only. */
    public static EngineConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        EngineConfig.Builder builder = EngineConfig.builder();

        JsonNode limits = root.path("limits");
        if (limits.has("max-depth")) builder.maxDepth(requireInt(limits, "limits", "max-depth"));
        if (limits.has("max-children")) builder.maxChildren(requireInt(limits, "limits", "max-children"));
        if (limits.has("max-window"))
            builder.maxWindowSeconds(duration("limits.max-window", limits.get("max-window").asText()));

        JsonNode aggregation = root.path("aggregation");
        if (aggregation.has("retention"))
            builder.retentionSeconds(duration("aggregation.retention", aggregation.get("retention").asText()));
        if (aggregation.has("prune-interval"))
            builder.pruneIntervalSeconds(
                    duration("aggregation.prune-interval", aggregation.get("prune-interval").asText()));

        // --- Environment variable overlay ---
        envInt(envLookup, ENV_PREFIX + "MAX_DEPTH", builder::maxDepth);
        envInt(envLookup, ENV_PREFIX + "MAX_CHILDREN", builder::maxChildren);
        envDuration(envLookup, ENV_PREFIX + "MAX_WINDOW", builder::maxWindowSeconds);
        envDuration(envLookup, ENV_PREFIX + "RETENTION", builder::retentionSeconds);
        envDuration(envLookup, ENV_PREFIX + "PRUNE_INTERVAL", builder::pruneIntervalSeconds);

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), null, e);
        }
    }

    private static int requireInt(JsonNode block, String blockName, String name) {
        JsonNode value = block.get(name);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            String key = blockName + "." + name;
            throw new ConfigLoadException("'" + key + "' must be an integer, got: " + value, key, null, null);
        }
        return value.intValue();
    }

    private static long duration(String key, String value) {
        try {
            return DurationParser.parseSeconds(value);
        } catch (MalformedDurationException e) {
            throw new ConfigLoadException("'" + key + "' is not a valid duration: " + value, key, null, e);
        }
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: " + value, envVar, null, e);
            }
        }
    }

    private static void envDuration(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(duration(envVar, envLookup.apply(envVar).trim()));
        }
    }
}
