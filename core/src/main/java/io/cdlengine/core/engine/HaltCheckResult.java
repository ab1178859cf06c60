package io.cdlengine.core.engine;

/**
 * Outcome of a halt check: either the tree halts ({@code violation} and {@code reason} null), or
 * it was rejected for the given violation.
 */
public record HaltCheckResult(boolean halts, HaltViolation violation, String reason) {

    private static final HaltCheckResult HALTS = new HaltCheckResult(true, null, null);

    public HaltCheckResult {
        if (halts && violation != null) {
            throw new IllegalArgumentException("a halting result carries no violation");
        }
        if (!halts && violation == null) {
            throw new IllegalArgumentException("a rejected result needs a violation");
        }
    }

    public static HaltCheckResult halting() {
        return HALTS;
    }

    public static HaltCheckResult rejected(HaltViolation violation, String reason) {
        return new HaltCheckResult(false, violation, reason);
    }
}
