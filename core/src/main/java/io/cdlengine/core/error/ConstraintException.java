package io.cdlengine.core.error;

/**
 * Abstract base for all CDL engine exceptions. Never thrown directly; use the concrete
 * subclasses. All of them are structural errors raised while a constraint is being built, before
 * any record is evaluated. Runtime data problems are reported as failing evaluation results
 * instead.
 */
public abstract class ConstraintException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected ConstraintException(String message, String source) {
        super(message);
        this.source = source;
    }

    protected ConstraintException(String message, Throwable cause, String source) {
        super(message, cause);
        this.source = source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The file path or resource the definition came from, or {@code null} for in-memory input. */
    public String source() {
        return source;
    }
}
