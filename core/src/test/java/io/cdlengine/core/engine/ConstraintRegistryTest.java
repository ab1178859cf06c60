package io.cdlengine.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.cdlengine.core.model.AtomicConstraint;
import io.cdlengine.core.model.ConstraintDocument;
import io.cdlengine.core.model.Operator;
import org.junit.jupiter.api.Test;

class ConstraintRegistryTest {

    private static ConstraintDocument document(String id, String version) {
        return new ConstraintDocument(id, version, null, AtomicConstraint.of(id, Operator.EXISTS, null));
    }

    @Test
    void emptyRegistryHasNothing() {
        assertThat(ConstraintRegistry.empty().size()).isZero();
        assertThat(ConstraintRegistry.empty().get("anything")).isNull();
    }

    @Test
    void versionedDocumentsAreRegisteredUnderBothKeys() {
        var doc = document("limits", "2.0");
        ConstraintRegistry registry = ConstraintRegistry.builder().add(doc).build();

        assertThat(registry.get("limits")).isSameAs(doc);
        assertThat(registry.get("limits@2.0")).isSameAs(doc);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void unversionedDocumentsHaveOneKey() {
        ConstraintRegistry registry =
                ConstraintRegistry.builder().add(document("limits", null)).build();

        assertThat(registry.all()).containsOnlyKeys("limits");
    }

    @Test
    void withReturnsANewSnapshot() {
        ConstraintRegistry original = ConstraintRegistry.builder().add(document("a", null)).build();

        ConstraintRegistry updated = original.with(document("b", null));

        assertThat(original.contains("b")).isFalse();
        assertThat(updated.contains("a")).isTrue();
        assertThat(updated.contains("b")).isTrue();
    }

    @Test
    void laterDocumentReplacesEarlierUnderTheSameId() {
        var v1 = document("limits", "1");
        var v2 = document("limits", "2");

        ConstraintRegistry registry = ConstraintRegistry.empty().with(v1).with(v2);

        assertThat(registry.get("limits")).isSameAs(v2);
        assertThat(registry.get("limits@1")).isSameAs(v1);
    }
}
