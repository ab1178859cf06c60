package io.cdlengine.core.engine;

/**
 * Static bounds enforced by the {@link HaltChecker}. Immutable and thread-safe.
 *
 * @param maxDepth         maximum conditional/composite nesting below the root (default: 100)
 * @param maxChildren      maximum children of one composite (default: 1000)
 * @param maxWindowSeconds maximum aggregation window (default: one year, 31,536,000 s)
 */
public record EngineLimits(int maxDepth, int maxChildren, long maxWindowSeconds) {

    /** Default limits: depth 100, 1000 children, 365-day window. */
    public static final EngineLimits DEFAULT = new EngineLimits(100, 1000, 31_536_000L);

    public EngineLimits {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        if (maxChildren <= 0) {
            throw new IllegalArgumentException("maxChildren must be positive, got: " + maxChildren);
        }
        if (maxWindowSeconds <= 0) {
            throw new IllegalArgumentException("maxWindowSeconds must be positive, got: " + maxWindowSeconds);
        }
    }
}
