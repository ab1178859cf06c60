package io.cdlengine.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

class EvaluationResultTest {

    @Test
    void fingerprintHashesVerdictIdAndTimestamp() throws Exception {
        var result = EvaluationResult.pass("C_1234ABCD", 1_700_000_000_000L);

        assertThat(result.fingerprint())
                .isEqualTo(ConstraintIdTest.sha256Prefix("true:C_1234ABCD:1700000000000", 16))
                .matches("[0-9A-F]{16}");
    }

    @Test
    void fingerprintChangesWithTime() {
        var first = EvaluationResult.fail("C_1", "nope", 1000L);
        var second = EvaluationResult.fail("C_1", "nope", 2000L);

        assertThat(first.fingerprint()).isNotEqualTo(second.fingerprint());
    }

    @Test
    void passingResultHasNoMessage() {
        var result = EvaluationResult.pass("C_1", 5L);

        assertThat(result.passed()).isTrue();
        assertThat(result.message()).isNull();
    }

    @Test
    void toJsonUsesWireFieldNames() {
        ObjectNode json = EvaluationResult.fail("C_1", "amount lt 1000 not satisfied", 42L).toJson();

        assertThat(json.get("passed").booleanValue()).isFalse();
        assertThat(json.get("constraint_id").textValue()).isEqualTo("C_1");
        assertThat(json.get("message").textValue()).isEqualTo("amount lt 1000 not satisfied");
        assertThat(json.get("timestamp").longValue()).isEqualTo(42L);
        assertThat(json.get("fingerprint").textValue()).hasSize(16);
    }

    @Test
    void toJsonWritesNullMessageExplicitly() {
        ObjectNode json = EvaluationResult.pass("C_1", 42L).toJson();

        assertThat(json.has("message")).isTrue();
        assertThat(json.get("message").isNull()).isTrue();
    }
}
