package io.cdlengine.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Subject area a constraint belongs to. Informational only: the domain never changes how a
 * constraint is evaluated, but it is part of an atomic constraint's content id.
 */
public enum Domain {
    FINANCIAL("financial"),
    COMMUNICATION("communication"),
    HEALTH("health"),
    EPISTEMIC("epistemic"),
    TEMPORAL("temporal"),
    IDENTITY("identity"),
    CUSTOM("custom");

    private final String wireName;

    Domain(String wireName) {
        this.wireName = wireName;
    }

    /** The literal used in constraint definitions. */
    public String wireName() {
        return wireName;
    }

    /** Looks up a domain by its definition literal (case-sensitive). */
    public static Optional<Domain> fromWireName(String name) {
        return Arrays.stream(values()).filter(d -> d.wireName.equals(name)).findFirst();
    }
}
