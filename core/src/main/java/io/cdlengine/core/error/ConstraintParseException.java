package io.cdlengine.core.error;

/**
 * Thrown when a constraint definition is missing a required field, has a field of the wrong JSON
 * type, uses an unrecognized operator, domain, action or logic literal, or carries unknown keys.
 */
public final class ConstraintParseException extends ConstraintException {

    private static final long serialVersionUID = 1L;

    public ConstraintParseException(String message, String source) {
        super(message, source);
    }

    public ConstraintParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
