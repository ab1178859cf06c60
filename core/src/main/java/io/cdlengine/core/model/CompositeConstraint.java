package io.cdlengine.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Logical combination of child constraints. See {@link Logic} for the semantics of each
 * combinator, in particular the n-ary "none-of" reading of {@link Logic#NOT}.
 *
 * @param logic    the combinator
 * @param children child constraints, defensively copied; may be empty
 * @param id       derived from the logic and child ids when {@code null}
 */
public record CompositeConstraint(Logic logic, List<Constraint> children, String id) implements Constraint {

    public CompositeConstraint {
        Objects.requireNonNull(logic, "logic must not be null");
        Objects.requireNonNull(children, "children must not be null");
        children = List.copyOf(children);
        if (id == null) {
            String data = logic.wireName() + ":"
                    + children.stream().map(Constraint::id).collect(Collectors.joining(","));
            id = "COMP_" + Digests.sha256Prefix(data, 8);
        }
    }

    public CompositeConstraint(Logic logic, List<Constraint> children) {
        this(logic, children, null);
    }

    @Override
    public <R, C> R accept(ConstraintVisitor<R, C> visitor, C context) {
        return visitor.visitComposite(this, context);
    }
}
