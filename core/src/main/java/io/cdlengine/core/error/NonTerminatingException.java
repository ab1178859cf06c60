package io.cdlengine.core.error;

import io.cdlengine.core.engine.HaltViolation;

/**
 * Thrown by the parser when the halt checker rejects a constraint tree. The caller never receives
 * a constraint that failed the check.
 */
public final class NonTerminatingException extends ConstraintException {

    private static final long serialVersionUID = 1L;

    private final HaltViolation violation;
    private final String reason;

    public NonTerminatingException(HaltViolation violation, String reason, String source) {
        super("Constraint may not terminate: " + reason, source);
        this.violation = violation;
        this.reason = reason;
    }

    /** Which bound the tree violated. */
    public HaltViolation violation() {
        return violation;
    }

    /** The halt checker's explanation, without the exception prefix. */
    public String reason() {
        return reason;
    }
}
