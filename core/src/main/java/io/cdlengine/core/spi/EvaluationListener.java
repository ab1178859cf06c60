package io.cdlengine.core.spi;

/**
 * SPI for observability hooks on the {@link io.cdlengine.core.engine.ConstraintEngine}.
 *
 * <p>
 * Implementations bridge to metrics or audit systems; the core has no such dependency. All
 * methods receive immutable event records and default to no-ops. Implementations MUST be
 * thread-safe and non-blocking. Exceptions thrown by a listener are caught and logged by the
 * engine and never change a verdict.
 */
public interface EvaluationListener {

    /** Called after a constraint document was parsed, halt-checked and registered. */
    default void onConstraintLoaded(ConstraintLoadedEvent event) {}

    /** Called when a document failed to parse or was rejected by the halt checker. */
    default void onConstraintRejected(ConstraintRejectedEvent event) {}

    /** Called after every engine-level evaluation. */
    default void onConstraintEvaluated(ConstraintEvaluatedEvent event) {}

    /** Event emitted when a constraint is registered. */
    record ConstraintLoadedEvent(String name, String version, String constraintId, String source) {}

    /** Event emitted when a constraint document is rejected. */
    record ConstraintRejectedEvent(String source, String errorDetail) {}

    /** Event emitted after an evaluation. */
    record ConstraintEvaluatedEvent(
            String name, String constraintId, boolean passed, String message, long durationNanos) {}
}
