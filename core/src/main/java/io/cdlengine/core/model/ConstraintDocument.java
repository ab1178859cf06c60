package io.cdlengine.core.model;

import java.util.Objects;

/**
 * A named, versioned constraint loaded from a YAML or JSON file.
 *
 * @param id          document id, the registry key
 * @param version     optional version; also registered as {@code id@version}
 * @param description optional free text
 * @param constraint  the parsed, halt-checked constraint tree
 */
public record ConstraintDocument(String id, String version, String description, Constraint constraint) {

    public ConstraintDocument {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(constraint, "constraint must not be null");
    }
}
