package io.cdlengine.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Binary verdict of evaluating a constraint against a record. Produced fresh per call and never
 * retained by the engine.
 *
 * <p>
 * The fingerprint hashes {@code (passed, constraintId, timestamp)}, so the same verdict produced
 * at two different instants has two different fingerprints.
 *
 * @param passed       whether the record satisfies the constraint
 * @param constraintId id of the constraint that produced the verdict
 * @param message      diagnostic for failing verdicts, {@code null} when passing
 * @param timestamp    evaluation time in epoch milliseconds
 * @param fingerprint  16 upper-case hex characters
 */
public record EvaluationResult(
        boolean passed, String constraintId, String message, long timestamp, String fingerprint) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public EvaluationResult {
        Objects.requireNonNull(constraintId, "constraintId must not be null");
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
    }

    /** Creates a result and computes its fingerprint. */
    public static EvaluationResult of(boolean passed, String constraintId, String message, long timestamp) {
        return new EvaluationResult(
                passed, constraintId, message, timestamp, fingerprint(passed, constraintId, timestamp));
    }

    public static EvaluationResult pass(String constraintId, long timestamp) {
        return of(true, constraintId, null, timestamp);
    }

    public static EvaluationResult fail(String constraintId, String message, long timestamp) {
        return of(false, constraintId, message, timestamp);
    }

    /**
     * Renders the wire document {@code {"passed", "constraint_id", "message", "timestamp",
     * "fingerprint"}}.
     */
    public ObjectNode toJson() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("passed", passed);
        node.put("constraint_id", constraintId);
        if (message != null) {
            node.put("message", message);
        } else {
            node.putNull("message");
        }
        node.put("timestamp", timestamp);
        node.put("fingerprint", fingerprint);
        return node;
    }

    /**
     * First 16 upper-case hex digits of {@code sha256(passed:constraintId:timestamp)}, with
     * {@code passed} written as {@code true}/{@code false} and the timestamp in epoch milliseconds.
     * Fingerprints are therefore only comparable with fingerprints computed by this recipe.
     */
    static String fingerprint(boolean passed, String constraintId, long timestamp) {
        return Digests.sha256Prefix(passed + ":" + constraintId + ":" + timestamp, 16);
    }
}
