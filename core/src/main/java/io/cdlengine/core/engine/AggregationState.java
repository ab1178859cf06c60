package io.cdlengine.core.engine;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Append-only, per-group time series backing the windowed aggregation operators.
 *
 * <p>
 * Each group key maps to an insertion-ordered list of {@code (timestamp, value)} entries.
 * Entries are only ever removed by {@link #prune(long)}, which evaluation never calls; the owning
 * process schedules it (see {@link AggregationPruner}).
 *
 * <p>
 * "Now" comes from the injected {@link Clock}, in whole epoch seconds. Every method is
 * {@code synchronized} on this instance. A caller that must append and then read without another
 * thread interleaving holds this object's monitor across both calls.
 */
public final class AggregationState {

    /** Default retention horizon for {@link #prune()}: one week. */
    public static final long DEFAULT_MAX_AGE_SECONDS = 604_800L;

    /** One observation. */
    public record Entry(long timestamp, double value) {}

    private final Clock clock;
    private final Map<String, List<Entry>> groups = new LinkedHashMap<>();

    public AggregationState(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /** Current time in epoch seconds, from the injected clock. */
    public long nowSeconds() {
        return clock.instant().getEpochSecond();
    }

    /** Appends a value to the group, timestamped with the current time. */
    public synchronized void append(String groupKey, double value) {
        append(groupKey, value, nowSeconds());
    }

    /** Appends a value to the group with an explicit timestamp in epoch seconds. */
    public synchronized void append(String groupKey, double value, long timestamp) {
        Objects.requireNonNull(groupKey, "groupKey must not be null");
        groups.computeIfAbsent(groupKey, k -> new ArrayList<>()).add(new Entry(timestamp, value));
    }

    /**
     * Returns the values of the group whose timestamp is at or after {@code now - windowSeconds},
     * in insertion order. An unknown group yields an empty list.
     */
    public synchronized List<Double> window(String groupKey, long windowSeconds) {
        List<Entry> entries = groups.get(groupKey);
        if (entries == null) {
            return List.of();
        }
        long cutoff = nowSeconds() - windowSeconds;
        List<Double> values = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.timestamp() >= cutoff) {
                values.add(entry.value());
            }
        }
        return values;
    }

    /** Sum of the values in the window; {@code 0.0} for an empty window. */
    public synchronized double sum(String groupKey, long windowSeconds) {
        double sum = 0.0;
        for (double v : window(groupKey, windowSeconds)) {
            sum += v;
        }
        return sum;
    }

    /** Number of values in the window. */
    public synchronized int count(String groupKey, long windowSeconds) {
        return window(groupKey, windowSeconds).size();
    }

    /** Mean of the values in the window; {@code 0.0} (not NaN) for an empty window. */
    public synchronized double avg(String groupKey, long windowSeconds) {
        List<Double> values = window(groupKey, windowSeconds);
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /** Prunes with the default one-week horizon. */
    public synchronized int prune() {
        return prune(DEFAULT_MAX_AGE_SECONDS);
    }

    /**
     * Deletes, from every group, the entries older than {@code now - maxAgeSeconds}. Groups left
     * without entries are dropped.
     *
     * @return the number of entries removed
     */
    public synchronized int prune(long maxAgeSeconds) {
        long cutoff = nowSeconds() - maxAgeSeconds;
        int removed = 0;
        Iterator<List<Entry>> it = groups.values().iterator();
        while (it.hasNext()) {
            List<Entry> entries = it.next();
            int before = entries.size();
            entries.removeIf(e -> e.timestamp() < cutoff);
            removed += before - entries.size();
            if (entries.isEmpty()) {
                it.remove();
            }
        }
        return removed;
    }

    /** Snapshot of the group keys currently holding entries. */
    public synchronized Set<String> groupKeys() {
        return Set.copyOf(groups.keySet());
    }

    /** Total number of entries across all groups. */
    public synchronized int size() {
        int size = 0;
        for (List<Entry> entries : groups.values()) {
            size += entries.size();
        }
        return size;
    }
}
