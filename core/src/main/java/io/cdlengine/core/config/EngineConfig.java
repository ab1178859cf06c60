package io.cdlengine.core.config;

import io.cdlengine.core.engine.EngineLimits;
import java.time.Duration;

/**
 * Engine configuration. Every field has a default; use {@link #builder()} to override some.
 *
 * @param maxDepth              halt checker nesting limit
 * @param maxChildren           halt checker composite fan-out limit
 * @param maxWindowSeconds      halt checker aggregation window limit
 * @param retentionSeconds      aggregation entries older than this are pruned
 * @param pruneIntervalSeconds  time between two scheduled prune passes
 */
public record EngineConfig(
        int maxDepth, int maxChildren, long maxWindowSeconds, long retentionSeconds, long pruneIntervalSeconds) {

    public EngineConfig {
        if (retentionSeconds <= 0) {
            throw new IllegalArgumentException("retentionSeconds must be positive, got: " + retentionSeconds);
        }
        if (pruneIntervalSeconds <= 0) {
            throw new IllegalArgumentException("pruneIntervalSeconds must be positive, got: " + pruneIntervalSeconds);
        }
    }

    /** Configuration with every default applied. */
    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The halt-check limits described by this configuration. */
    public EngineLimits limits() {
        return new EngineLimits(maxDepth, maxChildren, maxWindowSeconds);
    }

    public Duration retention() {
        return Duration.ofSeconds(retentionSeconds);
    }

    public Duration pruneInterval() {
        return Duration.ofSeconds(pruneIntervalSeconds);
    }

    /** Builder seeded with the defaults. */
    public static final class Builder {
        private int maxDepth = EngineLimits.DEFAULT.maxDepth();
        private int maxChildren = EngineLimits.DEFAULT.maxChildren();
        private long maxWindowSeconds = EngineLimits.DEFAULT.maxWindowSeconds();
        private long retentionSeconds = 604_800L; // 7d
        private long pruneIntervalSeconds = 3_600L; // 1h

        Builder() {}

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxChildren(int maxChildren) {
            this.maxChildren = maxChildren;
            return this;
        }

        public Builder maxWindowSeconds(long maxWindowSeconds) {
            this.maxWindowSeconds = maxWindowSeconds;
            return this;
        }

        public Builder retentionSeconds(long retentionSeconds) {
            this.retentionSeconds = retentionSeconds;
            return this;
        }

        public Builder pruneIntervalSeconds(long pruneIntervalSeconds) {
            this.pruneIntervalSeconds = pruneIntervalSeconds;
            return this;
        }

        public EngineConfig build() {
            EngineConfig config =
                    new EngineConfig(maxDepth, maxChildren, maxWindowSeconds, retentionSeconds, pruneIntervalSeconds);
            config.limits(); // validates the limit fields
            return config;
        }
    }
}
