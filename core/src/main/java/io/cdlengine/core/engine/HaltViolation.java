package io.cdlengine.core.engine;

/** The bound a constraint tree violated when the halt checker rejected it. */
public enum HaltViolation {
    /** Conditional/composite nesting deeper than the depth limit. */
    DEPTH_EXCEEDED,
    /** Aggregation operator without a window, or with a window over the maximum. */
    UNBOUNDED_AGGREGATION,
    /** Composite with more children than the fan-out limit. */
    TOO_MANY_CHILDREN
}
