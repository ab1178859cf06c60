package io.cdlengine.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.cdlengine.core.error.MalformedDurationException;
import io.cdlengine.core.spec.DurationParser;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * The smallest indivisible rule: one field, one operator, one value.
 *
 * <p>
 * The {@code id} is derived from {@code (domain, field, operator, value)} so that two identical
 * definitions always share an id. It is a dedup/audit key, not a uniqueness guarantee: the
 * number {@code 1} and the string {@code "1"} render identically and collide.
 *
 * <p>
 * Temporal {@code within} carries its duration in {@code value}; aggregation operators carry
 * theirs in {@code window}. Both are checked for well-formedness on construction.
 *
 * @param domain    subject area, informational
 * @param field     dot-path into the input record
 * @param operator  the operator to apply
 * @param value     operand; never {@code null} (JSON null is {@link NullNode}). Copied on the way in
 *                  and on the way out, so the constraint cannot be changed after its id is computed
 * @param message   optional diagnostic returned when the constraint fails
 * @param action    caller-side handling of a failure
 * @param window    trailing window for aggregation operators, e.g. {@code "24h"}
 * @param groupBy   dot-path of the field partitioning aggregation state
 * @param reference dot-path of the reference timestamp for temporal operators; current time if
 *                  {@code null}
 * @param id        content-derived id; computed when {@code null}
 */
public record AtomicConstraint(
        Domain domain,
        String field,
        Operator operator,
        JsonNode value,
        String message,
        Action action,
        String window,
        String groupBy,
        String reference,
        String id)
        implements Constraint {

    public AtomicConstraint {
        domain = domain != null ? domain : Domain.CUSTOM;
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        value = value != null ? value.deepCopy() : NullNode.getInstance();
        action = action != null ? action : Action.REJECT;
        if (window != null) {
            DurationParser.parseSeconds(window);
        }
        if (operator == Operator.WITHIN) {
            if (!value.isTextual()) {
                throw new MalformedDurationException(
                        "'within' requires a duration string value, got: " + value, value.toString());
            }
            DurationParser.parseSeconds(value.asText());
        }
        if (id == null) {
            id = contentId(domain, field, operator, value);
        }
    }

    /** Creates a constraint with only the required parts; everything else takes its default. */
    public static AtomicConstraint of(String field, Operator operator, JsonNode value) {
        return new AtomicConstraint(null, field, operator, value, null, null, null, null, null, null);
    }

    /** The aggregation window in seconds, or empty when no window is set. */
    public OptionalLong windowSeconds() {
        return window == null ? OptionalLong.empty() : OptionalLong.of(DurationParser.parseSeconds(window));
    }

    /** A copy of the operand. Scalar nodes are immutable and returned as-is. */
    @Override
    public JsonNode value() {
        return value.deepCopy();
    }

    /** Short human-readable form, e.g. {@code amount lt 1000}. */
    public String describe() {
        return field + " " + operator.wireName() + " " + value;
    }

    @Override
    public <R, C> R accept(ConstraintVisitor<R, C> visitor, C context) {
        return visitor.visitAtomic(this, context);
    }

    /**
     * {@code "C_"} plus the first 8 hex digits of {@code sha256(domain:field:operator:value)}.
     * Text values hash as their raw text, everything else as compact JSON ({@code [1,2]},
     * {@code true}, {@code null}).
     */
    static String contentId(Domain domain, String field, Operator operator, JsonNode value) {
        String rendered = value.isTextual() ? value.asText() : value.toString();
        String data = domain.wireName() + ":" + field + ":" + operator.wireName() + ":" + rendered;
        return "C_" + Digests.sha256Prefix(data, 8);
    }
}
