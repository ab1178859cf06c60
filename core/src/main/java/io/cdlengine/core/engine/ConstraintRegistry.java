package io.cdlengine.core.engine;

import io.cdlengine.core.model.ConstraintDocument;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable snapshot of the named constraints held by a {@link ConstraintEngine}.
 *
 * <p>
 * This is the unit of atomic swap in {@link ConstraintEngine#reload}: evaluations that captured
 * the old snapshot finish with it, new ones see the new one. Documents are keyed by {@code id}
 * and, when versioned, by {@code id@version}.
 *
 * <p>
 * Thread-safe: all fields are final and the map is unmodifiable.
 */
public final class ConstraintRegistry {

    private final Map<String, ConstraintDocument> documents;

    public ConstraintRegistry(Map<String, ConstraintDocument> documents) {
        this.documents = Collections.unmodifiableMap(new HashMap<>(documents));
    }

    public static ConstraintRegistry empty() {
        return new ConstraintRegistry(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a document by {@code id} or {@code id@version}.
     *
     * @return the document, or {@code null} if not registered
     */
    public ConstraintDocument get(String key) {
        return documents.get(key);
    }

    public boolean contains(String key) {
        return documents.containsKey(key);
    }

    /** Unmodifiable view of all keys (ids and id@version) to documents. */
    public Map<String, ConstraintDocument> all() {
        return documents;
    }

    /** Number of keys, counting both plain and versioned keys. */
    public int size() {
        return documents.size();
    }

    /** Returns a new registry with the document added under its keys, replacing older entries. */
    public ConstraintRegistry with(ConstraintDocument document) {
        return builder().addAll(this).add(document).build();
    }

    /** Builder registering each document under both of its keys. */
    public static final class Builder {

        private final Map<String, ConstraintDocument> documents = new HashMap<>();

        Builder() {}

        public Builder add(ConstraintDocument document) {
            documents.put(document.id(), document);
            if (document.version() != null) {
                documents.put(document.id() + "@" + document.version(), document);
            }
            return this;
        }

        Builder addAll(ConstraintRegistry registry) {
            documents.putAll(registry.documents);
            return this;
        }

        public ConstraintRegistry build() {
            return new ConstraintRegistry(documents);
        }
    }
}
