package io.cdlengine.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.cdlengine.core.config.EngineConfig;
import io.cdlengine.core.error.NonTerminatingException;
import io.cdlengine.core.model.Constraint;
import io.cdlengine.core.model.ConstraintDocument;
import io.cdlengine.core.model.EvaluationResult;
import io.cdlengine.core.spec.ConstraintParser;
import io.cdlengine.core.spi.EvaluationListener;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Holds named constraints and evaluates records against them with a single long-lived
 * {@link ConstraintEvaluator}, so aggregation windows accumulate across calls.
 *
 * <p>
 * Constraints are loaded from documents ({@link ConstraintParser#parseDocument}) or registered
 * programmatically; both paths halt-check the tree. The named set lives in an immutable
 * {@link ConstraintRegistry} behind an {@link AtomicReference}; {@link #reload} swaps a complete
 * new set in one step.
 *
 * <p>
 * Thread-safe: the evaluator serializes aggregation updates itself.
 */
public final class ConstraintEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ConstraintEngine.class);

    /** MDC key holding the name of the constraint being evaluated. */
    static final String MDC_CONSTRAINT_NAME = "constraintName";

    private final ConstraintParser parser;
    private final ConstraintEvaluator evaluator;
    private final EvaluationListener listener;
    private final AtomicReference<ConstraintRegistry> registryRef = new AtomicReference<>(ConstraintRegistry.empty());

    public ConstraintEngine(ConstraintParser parser, ConstraintEvaluator evaluator) {
        this(parser, evaluator, null);
    }

    /**
     * @param parser    parser used for documents; its halt checker also vets registered trees
     * @param evaluator the evaluator owning the aggregation state
     * @param listener  optional lifecycle listener, may be null
     */
    public ConstraintEngine(ConstraintParser parser, ConstraintEvaluator evaluator, EvaluationListener listener) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.listener = listener; // nullable
    }

    /** Creates an engine whose halt-check limits come from the configuration. */
    public static ConstraintEngine create(EngineConfig config, Clock clock, EvaluationListener listener) {
        Objects.requireNonNull(config, "config must not be null");
        ConstraintParser parser = new ConstraintParser(new HaltChecker(config.limits()));
        return new ConstraintEngine(parser, new ConstraintEvaluator(clock), listener);
    }

    /**
     * Loads a constraint document and registers it under its id (and id@version). An existing
     * document with the same key is replaced.
     *
     * @throws io.cdlengine.core.error.ConstraintException if the document is invalid or does not
     *                                                     halt
     */
    public ConstraintDocument loadDocument(Path path) {
        ConstraintDocument document;
        try {
            document = parser.parseDocument(path);
        } catch (RuntimeException e) {
            notifyRejected(path.toString(), e);
            throw e;
        }
        registryRef.updateAndGet(old -> old.with(document));
        LOG.info(
                "constraint.loaded name={} version={} constraint_id={} source={}",
                document.id(),
                document.version(),
                document.constraint().id(),
                path);
        notifyLoaded(document, path.toString());
        return document;
    }

    /**
     * Registers an already-built constraint under a name after halt-checking it.
     *
     * @throws NonTerminatingException if the halt checker rejects the tree
     */
    public ConstraintDocument register(String name, Constraint constraint) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(constraint, "constraint must not be null");
        HaltCheckResult check = parser.haltChecker().check(constraint);
        if (!check.halts()) {
            NonTerminatingException e = new NonTerminatingException(check.violation(), check.reason(), null);
            notifyRejected(name, e);
            throw e;
        }
        ConstraintDocument document = new ConstraintDocument(name, null, null, constraint);
        registryRef.updateAndGet(old -> old.with(document));
        notifyLoaded(document, null);
        return document;
    }

    /**
     * Replaces the whole named set with the documents at the given paths. If any document fails,
     * nothing is swapped and the previous set stays active.
     */
    public void reload(List<Path> documentPaths) {
        ConstraintRegistry.Builder builder = ConstraintRegistry.builder();
        List<Map.Entry<Path, ConstraintDocument>> parsed = new ArrayList<>();
        for (Path path : documentPaths) {
            ConstraintDocument document;
            try {
                document = parser.parseDocument(path);
            } catch (RuntimeException e) {
                notifyRejected(path.toString(), e);
                throw e;
            }
            builder.add(document);
            parsed.add(Map.entry(path, document));
        }
        ConstraintRegistry registry = builder.build();
        registryRef.set(registry);
        LOG.info("Registry reloaded: documents={}, keys={}", documentPaths.size(), registry.size());
        // listeners only hear about documents that are actually live
        parsed.forEach(entry -> notifyLoaded(entry.getValue(), entry.getKey().toString()));
    }

    /**
     * Evaluates the record against a named constraint.
     *
     * @param name document id or id@version
     * @throws IllegalArgumentException if no constraint is registered under the name
     */
    public EvaluationResult evaluate(String name, JsonNode record) {
        Objects.requireNonNull(name, "name must not be null");
        ConstraintDocument document = registryRef.get().get(name);
        if (document == null) {
            throw new IllegalArgumentException("No constraint registered under '" + name + "'");
        }
        MDC.put(MDC_CONSTRAINT_NAME, name);
        try {
            long start = System.nanoTime();
            EvaluationResult result = evaluator.evaluate(document.constraint(), record);
            long durationNanos = System.nanoTime() - start;
            LOG.debug(
                    "constraint.evaluated name={} constraint_id={} passed={} duration_us={}",
                    name,
                    result.constraintId(),
                    result.passed(),
                    durationNanos / 1_000);
            notifyEvaluated(name, result, durationNanos);
            return result;
        } finally {
            MDC.remove(MDC_CONSTRAINT_NAME);
        }
    }

    /**
     * Starts a background pruner over this engine's aggregation state, using the configured
     * retention and interval. The caller owns the returned pruner and closes it on shutdown.
     */
    public AggregationPruner startPruner(EngineConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new AggregationPruner(evaluator.aggregationState(), config.retention(), config.pruneInterval());
    }

    public ConstraintRegistry registry() {
        return registryRef.get();
    }

    public ConstraintEvaluator evaluator() {
        return evaluator;
    }

    public ConstraintParser parser() {
        return parser;
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they never affect a verdict.

    private void notifyLoaded(ConstraintDocument document, String source) {
        if (listener == null) {
            return;
        }
        try {
            listener.onConstraintLoaded(new EvaluationListener.ConstraintLoadedEvent(
                    document.id(), document.version(), document.constraint().id(), source));
        } catch (Exception e) {
            LOG.warn("EvaluationListener.onConstraintLoaded failed", e);
        }
    }

    private void notifyRejected(String source, Exception error) {
        if (listener == null) {
            return;
        }
        try {
            listener.onConstraintRejected(new EvaluationListener.ConstraintRejectedEvent(source, error.getMessage()));
        } catch (Exception e) {
            LOG.warn("EvaluationListener.onConstraintRejected failed", e);
        }
    }

    private void notifyEvaluated(String name, EvaluationResult result, long durationNanos) {
        if (listener == null) {
            return;
        }
        try {
            listener.onConstraintEvaluated(new EvaluationListener.ConstraintEvaluatedEvent(
                    name, result.constraintId(), result.passed(), result.message(), durationNanos));
        } catch (Exception e) {
            LOG.warn("EvaluationListener.onConstraintEvaluated failed", e);
        }
    }
}
