package io.cdlengine.core.model;

/**
 * A CDL constraint: the recursive union of {@link AtomicConstraint}, {@link ConditionalConstraint}
 * and {@link CompositeConstraint}.
 *
 * <p>
 * All variants are immutable records built bottom-up, so a constraint tree is always acyclic.
 * Finiteness (depth, fan-out, window size) is enforced separately by the halt checker before a
 * tree is handed to an evaluator.
 */
public sealed interface Constraint permits AtomicConstraint, ConditionalConstraint, CompositeConstraint {

    /** Identifier used as dedup/audit key in evaluation results. */
    String id();

    /** Double-dispatches to the visitor method for this variant. */
    <R, C> R accept(ConstraintVisitor<R, C> visitor, C context);
}
