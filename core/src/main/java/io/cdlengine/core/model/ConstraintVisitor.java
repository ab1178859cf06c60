package io.cdlengine.core.model;

/**
 * Visitor over the closed {@link Constraint} hierarchy. Adding a constraint variant breaks every
 * implementation at compile time, so dispatch is always exhaustive.
 *
 * @param <R> result type
 * @param <C> per-call context passed through the traversal (the input record, a depth counter)
 */
public interface ConstraintVisitor<R, C> {

    R visitAtomic(AtomicConstraint constraint, C context);

    R visitConditional(ConditionalConstraint constraint, C context);

    R visitComposite(CompositeConstraint constraint, C context);
}
