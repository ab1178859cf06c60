package io.cdlengine.core.model;

import java.util.Objects;

/**
 * If/then/else over sub-constraints. When the condition fails and there is no else branch, the
 * conditional passes (vacuous truth).
 *
 * @param condition     the constraint deciding which branch applies
 * @param thenConstraint evaluated when the condition passes
 * @param elseConstraint evaluated when the condition fails; may be {@code null}
 * @param id            derived from the branch ids when {@code null}
 */
public record ConditionalConstraint(
        Constraint condition, Constraint thenConstraint, Constraint elseConstraint, String id)
        implements Constraint {

    public ConditionalConstraint {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(thenConstraint, "thenConstraint must not be null");
        if (id == null) {
            String data = "if:" + condition.id() + ";then:" + thenConstraint.id() + ";else:"
                    + (elseConstraint != null ? elseConstraint.id() : "-");
            id = "COND_" + Digests.sha256Prefix(data, 8);
        }
    }

    public ConditionalConstraint(Constraint condition, Constraint thenConstraint, Constraint elseConstraint) {
        this(condition, thenConstraint, elseConstraint, null);
    }

    public boolean hasElse() {
        return elseConstraint != null;
    }

    @Override
    public <R, C> R accept(ConstraintVisitor<R, C> visitor, C context) {
        return visitor.visitConditional(this, context);
    }
}
