package io.cdlengine.core.engine;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically prunes an {@link AggregationState} to bound its memory. Evaluation never prunes on
 * its own; the process owning the state decides the retention horizon and the schedule.
 *
 * <p>
 * Runs on a single daemon thread. {@link #close()} stops the schedule.
 */
public final class AggregationPruner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationPruner.class);

    private final AggregationState state;
    private final long retentionSeconds;
    private final ScheduledExecutorService scheduler;

    /**
     * Starts pruning at a fixed rate.
     *
     * @param state     the state to prune
     * @param retention entries older than this are dropped
     * @param interval  time between two prune passes
     */
    public AggregationPruner(AggregationState state, Duration retention, Duration interval) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(retention, "retention must not be null");
        Objects.requireNonNull(interval, "interval must not be null");
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive, got: " + retention);
        }
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive, got: " + interval);
        }
        this.retentionSeconds = retention.toSeconds();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "cdl-aggregation-pruner");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::runScheduled, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Runs one prune pass on the calling thread.
     *
     * @return number of entries removed
     */
    public int pruneNow() {
        int removed = state.prune(retentionSeconds);
        LOG.debug("aggregation.pruned removed={} remaining={} retention_s={}", removed, state.size(), retentionSeconds);
        return removed;
    }

    private void runScheduled() {
        try {
            pruneNow();
        } catch (RuntimeException e) {
            // an exception would cancel every later run
            LOG.error("Aggregation prune pass failed", e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
