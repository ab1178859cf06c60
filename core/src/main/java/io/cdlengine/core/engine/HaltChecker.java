package io.cdlengine.core.engine;

import io.cdlengine.core.error.MalformedDurationException;
import io.cdlengine.core.model.AtomicConstraint;
import io.cdlengine.core.model.CompositeConstraint;
import io.cdlengine.core.model.ConditionalConstraint;
import io.cdlengine.core.model.Constraint;
import io.cdlengine.core.model.ConstraintVisitor;
import io.cdlengine.core.spec.DurationParser;
import java.util.Objects;

/**
 * Static admissibility check run once per constraint tree before any evaluation. A tree passes
 * iff its nesting depth, composite fan-out and aggregation windows all stay within
 * {@link EngineLimits}, which bounds the work of every later evaluation.
 *
 * <p>
 * A rejected tree is reported through {@link HaltCheckResult}, never by throwing; the parser
 * decides whether to turn a rejection into an error.
 *
 * <p>
 * Thread-safe and stateless apart from its immutable limits.
 */
public final class HaltChecker implements ConstraintVisitor<HaltCheckResult, Integer> {

    private final EngineLimits limits;

    public HaltChecker() {
        this(EngineLimits.DEFAULT);
    }

    public HaltChecker(EngineLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
    }

    public EngineLimits limits() {
        return limits;
    }

    /**
     * Checks whether the tree rooted at {@code constraint} is guaranteed to halt.
     *
     * @param constraint root of the tree
     * @return {@link HaltCheckResult#halting()} or the first violation found
     */
    public HaltCheckResult check(Constraint constraint) {
        Objects.requireNonNull(constraint, "constraint must not be null");
        return check(constraint, 0);
    }

    /**
     * Checks a single nesting level, root = 0. Lets a builder stop descending into a definition
     * before the tree exists.
     */
    public HaltCheckResult checkDepth(int depth) {
        if (depth > limits.maxDepth()) {
            return HaltCheckResult.rejected(
                    HaltViolation.DEPTH_EXCEEDED, "Constraint depth exceeds maximum (" + limits.maxDepth() + ")");
        }
        return HaltCheckResult.halting();
    }

    private HaltCheckResult check(Constraint constraint, int depth) {
        HaltCheckResult depthCheck = checkDepth(depth);
        if (!depthCheck.halts()) {
            return depthCheck;
        }
        return constraint.accept(this, depth);
    }

    @Override
    public HaltCheckResult visitAtomic(AtomicConstraint constraint, Integer depth) {
        if (!constraint.operator().isAggregation()) {
            return HaltCheckResult.halting();
        }
        if (constraint.window() == null) {
            return HaltCheckResult.rejected(
                    HaltViolation.UNBOUNDED_AGGREGATION,
                    "Aggregation requires bounded window (" + constraint.operator().wireName() + " on '"
                            + constraint.field() + "')");
        }
        long windowSeconds;
        try {
            windowSeconds = DurationParser.parseSeconds(constraint.window());
        } catch (MalformedDurationException e) {
            return HaltCheckResult.rejected(HaltViolation.UNBOUNDED_AGGREGATION, e.getMessage());
        }
        if (windowSeconds > limits.maxWindowSeconds()) {
            return HaltCheckResult.rejected(
                    HaltViolation.UNBOUNDED_AGGREGATION,
                    "Aggregation window " + constraint.window() + " exceeds maximum of "
                            + limits.maxWindowSeconds() + "s");
        }
        return HaltCheckResult.halting();
    }

    @Override
    public HaltCheckResult visitConditional(ConditionalConstraint constraint, Integer depth) {
        HaltCheckResult result = check(constraint.condition(), depth + 1);
        if (!result.halts()) {
            return result;
        }
        result = check(constraint.thenConstraint(), depth + 1);
        if (!result.halts() || !constraint.hasElse()) {
            return result;
        }
        return check(constraint.elseConstraint(), depth + 1);
    }

    @Override
    public HaltCheckResult visitComposite(CompositeConstraint constraint, Integer depth) {
        if (constraint.children().size() > limits.maxChildren()) {
            return HaltCheckResult.rejected(
                    HaltViolation.TOO_MANY_CHILDREN,
                    "Composite exceeds maximum constraints (" + limits.maxChildren() + "), got "
                            + constraint.children().size());
        }
        for (Constraint child : constraint.children()) {
            HaltCheckResult result = check(child, depth + 1);
            if (!result.halts()) {
                return result;
            }
        }
        return HaltCheckResult.halting();
    }
}
