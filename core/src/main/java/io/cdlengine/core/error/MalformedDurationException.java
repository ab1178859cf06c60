package io.cdlengine.core.error;

/** Thrown when a duration string does not match {@code <digits><s|m|h|d|w>}. */
public final class MalformedDurationException extends ConstraintException {

    private static final long serialVersionUID = 1L;

    private final String input;

    public MalformedDurationException(String message, String input) {
        super(message, null);
        this.input = input;
    }

    public MalformedDurationException(String message, Throwable cause, String input) {
        this(message, cause, input, null);
    }

    public MalformedDurationException(String message, Throwable cause, String input, String source) {
        super(message, cause, source);
        this.input = input;
    }

    /** The rejected duration string, possibly {@code null}. */
    public String input() {
        return input;
    }
}
