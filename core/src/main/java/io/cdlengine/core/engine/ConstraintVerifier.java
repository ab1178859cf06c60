package io.cdlengine.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cdlengine.core.model.Constraint;
import io.cdlengine.core.model.EvaluationResult;
import io.cdlengine.core.spec.ConstraintParser;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One-shot verification helpers over {@link ConstraintParser} and {@link ConstraintEvaluator}.
 *
 * <p>
 * Every call uses a fresh evaluator, so aggregation operators only ever see the current record.
 * Callers that need windowed state across records keep their own {@link ConstraintEvaluator}
 * (or use {@link ConstraintEngine}).
 *
 * <p>
 * Items passed to these methods are {@link Constraint} instances, {@link JsonNode} definitions or
 * definitions as nested maps and lists; definitions are parsed and halt-checked first. Records
 * are {@link JsonNode}s or maps; a map record that Jackson cannot convert raises
 * {@link IllegalArgumentException}.
 */
public final class ConstraintVerifier {

    private static final ConstraintParser PARSER = new ConstraintParser();
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConstraintVerifier() {}

    /** Verifies a single constraint or definition against the record. */
    public static EvaluationResult verify(Object constraintOrDefinition, JsonNode record) {
        return verify(constraintOrDefinition, record, Clock.systemUTC());
    }

    /** Same as {@link #verify(Object, JsonNode)}, with an explicit clock. */
    public static EvaluationResult verify(Object constraintOrDefinition, JsonNode record, Clock clock) {
        return new ConstraintEvaluator(clock).evaluate(toConstraint(constraintOrDefinition), record);
    }

    public static EvaluationResult verify(Object constraintOrDefinition, Map<String, ?> record) {
        return verify(constraintOrDefinition, toRecord(record));
    }

    /** Verifies every item independently and returns the results in order. */
    public static List<EvaluationResult> verifyAll(List<?> constraintsOrDefinitions, JsonNode record) {
        return verifyAll(constraintsOrDefinitions, record, Clock.systemUTC());
    }

    public static List<EvaluationResult> verifyAll(List<?> constraintsOrDefinitions, Map<String, ?> record) {
        return verifyAll(constraintsOrDefinitions, toRecord(record));
    }

    public static List<EvaluationResult> verifyAll(List<?> constraintsOrDefinitions, JsonNode record, Clock clock) {
        Objects.requireNonNull(constraintsOrDefinitions, "constraintsOrDefinitions must not be null");
        return constraintsOrDefinitions.stream()
                .map(item -> verify(item, record, clock))
                .collect(Collectors.toList());
    }

    /**
     * Passes iff every item passes. The result id is {@code AND_} followed by the first four
     * characters of each item's id, joined by underscores.
     */
    public static EvaluationResult verifyAnd(List<?> constraintsOrDefinitions, JsonNode record) {
        return verifyAnd(constraintsOrDefinitions, record, Clock.systemUTC());
    }

    public static EvaluationResult verifyAnd(List<?> constraintsOrDefinitions, Map<String, ?> record) {
        return verifyAnd(constraintsOrDefinitions, toRecord(record));
    }

    public static EvaluationResult verifyAnd(List<?> constraintsOrDefinitions, JsonNode record, Clock clock) {
        List<EvaluationResult> results = verifyAll(constraintsOrDefinitions, record, clock);
        boolean passed = results.stream().allMatch(EvaluationResult::passed);
        String message = passed
                ? null
                : results.stream()
                        .filter(r -> r.message() != null)
                        .map(EvaluationResult::message)
                        .collect(Collectors.joining("; "));
        return EvaluationResult.of(passed, combinedId("AND_", results), message, clock.millis());
    }

    /** Passes iff at least one item passes. The result id is built like {@link #verifyAnd}'s with {@code OR_}. */
    public static EvaluationResult verifyOr(List<?> constraintsOrDefinitions, JsonNode record) {
        return verifyOr(constraintsOrDefinitions, record, Clock.systemUTC());
    }

    public static EvaluationResult verifyOr(List<?> constraintsOrDefinitions, Map<String, ?> record) {
        return verifyOr(constraintsOrDefinitions, toRecord(record));
    }

    public static EvaluationResult verifyOr(List<?> constraintsOrDefinitions, JsonNode record, Clock clock) {
        List<EvaluationResult> results = verifyAll(constraintsOrDefinitions, record, clock);
        boolean passed = results.stream().anyMatch(EvaluationResult::passed);
        return EvaluationResult.of(
                passed, combinedId("OR_", results), passed ? null : "All constraints failed", clock.millis());
    }

    private static Constraint toConstraint(Object item) {
        if (item instanceof Constraint constraint) {
            return constraint;
        }
        if (item instanceof JsonNode definition) {
            return PARSER.parse(definition);
        }
        if (item instanceof Map<?, ?> definition) {
            return PARSER.parse(MAPPER.<JsonNode>valueToTree(definition));
        }
        throw new IllegalArgumentException("Expected a Constraint, a JsonNode or a Map definition, got: "
                + (item == null ? "null" : item.getClass().getName()));
    }

    private static JsonNode toRecord(Map<String, ?> record) {
        return MAPPER.valueToTree(record);
    }

    private static String combinedId(String prefix, List<EvaluationResult> results) {
        return prefix
                + results.stream()
                        .map(r -> r.constraintId().substring(0, Math.min(4, r.constraintId().length())))
                        .collect(Collectors.joining("_"));
    }
}
