package io.cdlengine.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of CDL operators, grouped in three families.
 *
 * <p>
 * Comparison operators test a single field against the constraint value. Temporal operators
 * compare a timestamp field against a reference field or the current time. Aggregation operators
 * compute {@code sum}, {@code count} or {@code avg} over a trailing time window and compare the
 * aggregate against the constraint value.
 */
public enum Operator {
    EQ("eq", Family.COMPARISON, null, null),
    NE("ne", Family.COMPARISON, null, null),
    LT("lt", Family.COMPARISON, null, null),
    GT("gt", Family.COMPARISON, null, null),
    LE("le", Family.COMPARISON, null, null),
    GE("ge", Family.COMPARISON, null, null),
    CONTAINS("contains", Family.COMPARISON, null, null),
    MATCHES("matches", Family.COMPARISON, null, null),
    IN("in", Family.COMPARISON, null, null),
    NOT_IN("not_in", Family.COMPARISON, null, null),
    EXISTS("exists", Family.COMPARISON, null, null),
    EMPTY("empty", Family.COMPARISON, null, null),

    WITHIN("within", Family.TEMPORAL, null, null),
    AFTER("after", Family.TEMPORAL, null, null),
    BEFORE("before", Family.TEMPORAL, null, null),

    SUM_LT("sum_lt", Family.AGGREGATION, Aggregate.SUM, Comparator.LT),
    SUM_LE("sum_le", Family.AGGREGATION, Aggregate.SUM, Comparator.LE),
    SUM_GT("sum_gt", Family.AGGREGATION, Aggregate.SUM, Comparator.GT),
    SUM_GE("sum_ge", Family.AGGREGATION, Aggregate.SUM, Comparator.GE),
    COUNT_LT("count_lt", Family.AGGREGATION, Aggregate.COUNT, Comparator.LT),
    COUNT_LE("count_le", Family.AGGREGATION, Aggregate.COUNT, Comparator.LE),
    COUNT_GT("count_gt", Family.AGGREGATION, Aggregate.COUNT, Comparator.GT),
    COUNT_GE("count_ge", Family.AGGREGATION, Aggregate.COUNT, Comparator.GE),
    AVG_LT("avg_lt", Family.AGGREGATION, Aggregate.AVG, Comparator.LT),
    AVG_LE("avg_le", Family.AGGREGATION, Aggregate.AVG, Comparator.LE),
    AVG_GT("avg_gt", Family.AGGREGATION, Aggregate.AVG, Comparator.GT),
    AVG_GE("avg_ge", Family.AGGREGATION, Aggregate.AVG, Comparator.GE);

    /** Operator family. */
    public enum Family {
        COMPARISON,
        TEMPORAL,
        AGGREGATION
    }

    /** Aggregate function of an aggregation operator. */
    public enum Aggregate {
        SUM,
        COUNT,
        AVG
    }

    /** Threshold comparison of an aggregation operator. */
    public enum Comparator {
        LT,
        LE,
        GT,
        GE;

        /** Applies {@code aggregate <op> limit}. */
        public boolean test(double aggregate, double limit) {
            return switch (this) {
                case LT -> aggregate < limit;
                case LE -> aggregate <= limit;
                case GT -> aggregate > limit;
                case GE -> aggregate >= limit;
            };
        }
    }

    private final String wireName;
    private final Family family;
    private final Aggregate aggregate;
    private final Comparator comparator;

    Operator(String wireName, Family family, Aggregate aggregate, Comparator comparator) {
        this.wireName = wireName;
        this.family = family;
        this.aggregate = aggregate;
        this.comparator = comparator;
    }

    /** The literal used in constraint definitions, e.g. {@code "sum_lt"}. */
    public String wireName() {
        return wireName;
    }

    public Family family() {
        return family;
    }

    /** The aggregate function, or {@code null} outside the aggregation family. */
    public Aggregate aggregate() {
        return aggregate;
    }

    /** The threshold comparator, or {@code null} outside the aggregation family. */
    public Comparator comparator() {
        return comparator;
    }

    public boolean isAggregation() {
        return family == Family.AGGREGATION;
    }

    public boolean isTemporal() {
        return family == Family.TEMPORAL;
    }

    /** Looks up an operator by its definition literal (case-sensitive). */
    public static Optional<Operator> fromWireName(String name) {
        return Arrays.stream(values()).filter(o -> o.wireName.equals(name)).findFirst();
    }
}
