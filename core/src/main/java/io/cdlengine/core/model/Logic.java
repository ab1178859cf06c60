package io.cdlengine.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Combinator of a {@link CompositeConstraint}.
 *
 * <ul>
 * <li>{@link #AND}: every child passes.</li>
 * <li>{@link #OR}: at least one child passes.</li>
 * <li>{@link #NOT}: <em>none</em> of the children pass. This is n-ary "none-of", not unary
 * negation: with several children, {@code not} fails as soon as any one of them passes.</li>
 * </ul>
 */
public enum Logic {
    AND,
    OR,
    NOT;

    /** The lower-case literal used in constraint definitions. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Looks up a logic literal, case-insensitive. */
    public static Optional<Logic> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(l -> l.name().equalsIgnoreCase(name.strip()))
                .findFirst();
    }
}
