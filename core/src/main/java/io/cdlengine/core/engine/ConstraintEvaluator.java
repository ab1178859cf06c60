package io.cdlengine.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.cdlengine.core.model.Action;
import io.cdlengine.core.model.AtomicConstraint;
import io.cdlengine.core.model.CompositeConstraint;
import io.cdlengine.core.model.ConditionalConstraint;
import io.cdlengine.core.model.Constraint;
import io.cdlengine.core.model.ConstraintVisitor;
import io.cdlengine.core.model.EvaluationResult;
import io.cdlengine.core.model.Operator;
import io.cdlengine.core.spec.DurationParser;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Walks a halt-checked constraint tree against an input record and produces a binary verdict.
 *
 * <p>
 * Evaluation never throws: missing fields, type mismatches, bad regexes and any other runtime
 * problem come back as a failing {@link EvaluationResult} with a diagnostic message. The only
 * side effect is that aggregation-family atomics append the record's value to the
 * {@link AggregationState} before reading the window (observe, then decide).
 *
 * <p>
 * Composite children are always all evaluated, without short-circuit, so every aggregation
 * atomic in the tree records its observation on every call.
 *
 * <p>
 * The append-then-aggregate step holds the {@link AggregationState} monitor, so an evaluator may
 * be shared between threads without windowed sums double-counting or racing.
 */
public final class ConstraintEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ConstraintEvaluator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Group key used when {@code group_by} is unset or resolves to a falsy value. */
    public static final String DEFAULT_GROUP = "default";

    private final AggregationState aggregationState;
    private final Clock clock;
    private final AtomicLong evaluationCount = new AtomicLong();
    private final Dispatcher dispatcher = new Dispatcher();

    /** Creates an evaluator on the system UTC clock with a fresh aggregation state. */
    public ConstraintEvaluator() {
        this(Clock.systemUTC());
    }

    /** Creates an evaluator with a fresh aggregation state driven by the given clock. */
    public ConstraintEvaluator(Clock clock) {
        this(new AggregationState(clock), clock);
    }

    /**
     * Creates an evaluator owning the given aggregation state.
     *
     * @param aggregationState windowed store for aggregation operators; this evaluator is its only
     *                         writer
     * @param clock            source of evaluation timestamps and of "now" for temporal operators
     */
    public ConstraintEvaluator(AggregationState aggregationState, Clock clock) {
        this.aggregationState = Objects.requireNonNull(aggregationState, "aggregationState must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Evaluates the constraint against a JSON record.
     *
     * @param constraint a constraint that passed the halt checker
     * @param record     the input record; {@code null} is treated as JSON null (every path absent)
     * @return the verdict, never {@code null}
     */
    public EvaluationResult evaluate(Constraint constraint, JsonNode record) {
        Objects.requireNonNull(constraint, "constraint must not be null");
        evaluationCount.incrementAndGet();
        JsonNode input = record != null ? record : NullNode.getInstance();
        try {
            return constraint.accept(dispatcher, input);
        } catch (RuntimeException e) {
            LOG.warn("Unexpected error evaluating constraint {}", constraint.id(), e);
            return EvaluationResult.fail(constraint.id(), "Evaluation error: " + e.getMessage(), clock.millis());
        }
    }

    /** Evaluates the constraint against a record given as nested maps and lists. */
    public EvaluationResult evaluate(Constraint constraint, Map<String, ?> record) {
        Objects.requireNonNull(constraint, "constraint must not be null");
        JsonNode tree;
        try {
            tree = MAPPER.valueToTree(record);
        } catch (IllegalArgumentException e) {
            evaluationCount.incrementAndGet();
            return EvaluationResult.fail(constraint.id(), "Evaluation error: record is not JSON-compatible: "
                    + e.getMessage(), clock.millis());
        }
        return evaluate(constraint, tree);
    }

    /** The aggregation state this evaluator writes to. */
    public AggregationState aggregationState() {
        return aggregationState;
    }

    /** Number of {@code evaluate} calls so far, nested ones included. */
    public long evaluationCount() {
        return evaluationCount.get();
    }

    private long now() {
        return clock.millis();
    }

    private final class Dispatcher implements ConstraintVisitor<EvaluationResult, JsonNode> {

        @Override
        public EvaluationResult visitAtomic(AtomicConstraint constraint, JsonNode record) {
            return switch (constraint.operator().family()) {
                case COMPARISON -> evaluateComparison(constraint, record);
                case TEMPORAL -> evaluateTemporal(constraint, record);
                case AGGREGATION -> evaluateAggregation(constraint, record);
            };
        }

        @Override
        public EvaluationResult visitConditional(ConditionalConstraint constraint, JsonNode record) {
            EvaluationResult condition = evaluate(constraint.condition(), record);
            if (condition.passed()) {
                return evaluate(constraint.thenConstraint(), record);
            }
            if (constraint.hasElse()) {
                return evaluate(constraint.elseConstraint(), record);
            }
            return EvaluationResult.pass(constraint.id(), now());
        }

        @Override
        public EvaluationResult visitComposite(CompositeConstraint constraint, JsonNode record) {
            List<EvaluationResult> results = new ArrayList<>(constraint.children().size());
            for (Constraint child : constraint.children()) {
                results.add(evaluate(child, record));
            }
            long passedCount = results.stream().filter(EvaluationResult::passed).count();
            int total = results.size();

            return switch (constraint.logic()) {
                case AND -> {
                    if (passedCount == total) {
                        yield EvaluationResult.pass(constraint.id(), now());
                    }
                    String message = results.stream()
                            .filter(r -> !r.passed() && r.message() != null)
                            .map(EvaluationResult::message)
                            .collect(Collectors.joining("; "));
                    yield EvaluationResult.fail(
                            constraint.id(), message.isEmpty() ? "AND condition not satisfied" : message, now());
                }
                case OR -> passedCount > 0
                        ? EvaluationResult.pass(constraint.id(), now())
                        : EvaluationResult.fail(constraint.id(), "All constraints failed", now());
                case NOT -> passedCount == 0
                        ? EvaluationResult.pass(constraint.id(), now())
                        : EvaluationResult.fail(
                                constraint.id(),
                                "NOT condition not satisfied: " + passedCount + " of " + total
                                        + " constraints passed",
                                now());
            };
        }
    }

    private EvaluationResult evaluateComparison(AtomicConstraint constraint, JsonNode record) {
        JsonNode fieldValue = RecordPaths.resolve(record, constraint.field());
        boolean passed;
        try {
            passed = ComparisonOperators.apply(constraint.operator(), fieldValue, constraint.value());
        } catch (RuntimeException e) {
            return failed(constraint, "Evaluation error: " + e.getMessage());
        }
        return passed ? EvaluationResult.pass(constraint.id(), now()) : failed(constraint, failureMessage(constraint));
    }

    private EvaluationResult evaluateTemporal(AtomicConstraint constraint, JsonNode record) {
        JsonNode fieldValue = RecordPaths.resolve(record, constraint.field());
        if (fieldValue == null) {
            return failed(constraint, "Field not found: " + constraint.field());
        }
        double reference;
        if (constraint.reference() != null) {
            JsonNode referenceValue = RecordPaths.resolve(record, constraint.reference());
            if (referenceValue == null) {
                return failed(constraint, "Reference field not found: " + constraint.reference());
            }
            Double parsed = RecordPaths.number(referenceValue);
            if (parsed == null) {
                return failed(
                        constraint,
                        "Evaluation error: reference '" + constraint.reference() + "' is not a number: "
                                + RecordPaths.text(referenceValue));
            }
            reference = parsed;
        } else {
            reference = now() / 1000.0;
        }
        Double timestamp = RecordPaths.number(fieldValue);
        if (timestamp == null) {
            return failed(
                    constraint,
                    "Evaluation error: field '" + constraint.field() + "' is not a number: "
                            + RecordPaths.text(fieldValue));
        }

        boolean passed =
                switch (constraint.operator()) {
                    case WITHIN -> Math.abs(timestamp - reference)
                            <= DurationParser.parseSeconds(constraint.value().asText());
                    case AFTER -> timestamp > reference;
                    case BEFORE -> timestamp < reference;
                    default -> throw new IllegalStateException(
                            "Not a temporal operator: " + constraint.operator().wireName());
                };
        return passed ? EvaluationResult.pass(constraint.id(), now()) : failed(constraint, failureMessage(constraint));
    }

    private EvaluationResult evaluateAggregation(AtomicConstraint constraint, JsonNode record) {
        OptionalLong window = constraint.windowSeconds();
        if (window.isEmpty()) {
            return failed(constraint, "Window required for aggregation");
        }

        String groupKey = DEFAULT_GROUP;
        if (constraint.groupBy() != null) {
            JsonNode groupValue = RecordPaths.resolve(record, constraint.groupBy());
            if (RecordPaths.isTruthy(groupValue)) {
                groupKey = RecordPaths.text(groupValue);
            }
        }

        Double observed = RecordPaths.number(RecordPaths.resolve(record, constraint.field()));
        Operator operator = constraint.operator();
        double aggregate;
        synchronized (aggregationState) {
            if (observed != null) {
                aggregationState.append(groupKey, observed);
            }
            aggregate = switch (operator.aggregate()) {
                case SUM -> aggregationState.sum(groupKey, window.getAsLong());
                case COUNT -> aggregationState.count(groupKey, window.getAsLong());
                case AVG -> aggregationState.avg(groupKey, window.getAsLong());
            };
        }

        JsonNode limit = constraint.value();
        if (!limit.isNumber()) {
            return failed(
                    constraint,
                    "Evaluation error: aggregation limit must be a number, got " + RecordPaths.text(limit));
        }
        if (operator.comparator().test(aggregate, limit.doubleValue())) {
            return EvaluationResult.pass(constraint.id(), now());
        }
        String rendered = operator.aggregate() == Operator.Aggregate.COUNT
                ? Long.toString((long) aggregate)
                : Double.toString(aggregate);
        return failed(
                constraint,
                operator.wireName() + "(" + constraint.field() + ") = " + rendered + ", limit = "
                        + RecordPaths.text(limit));
    }

    private static String failureMessage(AtomicConstraint constraint) {
        return constraint.message() != null ? constraint.message() : constraint.describe() + " not satisfied";
    }

    private EvaluationResult failed(AtomicConstraint constraint, String message) {
        LOG.atLevel(levelFor(constraint.action()))
                .log(
                        "constraint.failed constraint_id={} field={} operator={} action={} message={}",
                        constraint.id(),
                        constraint.field(),
                        constraint.operator().wireName(),
                        constraint.action().wireName(),
                        message);
        return EvaluationResult.fail(constraint.id(), message, now());
    }

    private static Level levelFor(Action action) {
        return switch (action) {
            case WARN -> Level.WARN;
            case LOG -> Level.INFO;
            case REJECT -> Level.DEBUG;
        };
    }
}
