package io.cdlengine.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.cdlengine.core.testkit.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AggregationState")
class AggregationStateTest {

    private MutableClock clock;
    private AggregationState state;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(0);
        state = new AggregationState(clock);
    }

    @Test
    void oldValuesLeaveTheWindow() {
        state.append("g", 10);
        clock.advanceSeconds(100);
        state.append("g", 20);

        assertThat(state.window("g", 50)).containsExactly(20.0);
        assertThat(state.sum("g", 50)).isEqualTo(20.0);
        assertThat(state.count("g", 50)).isEqualTo(1);
        assertThat(state.sum("g", 100)).isEqualTo(30.0);
    }

    @Test
    void windowBoundaryIsInclusive() {
        state.append("g", 10);
        clock.advanceSeconds(50);

        assertThat(state.count("g", 50)).isEqualTo(1);

        clock.advanceSeconds(1);
        assertThat(state.count("g", 50)).isZero();
    }

    @Test
    void emptyWindowAggregatesToZero() {
        assertThat(state.sum("unknown", 60)).isZero();
        assertThat(state.count("unknown", 60)).isZero();
        assertThat(state.avg("unknown", 60)).isZero();
        assertThat(state.window("unknown", 60)).isEmpty();
    }

    @Test
    void averageOverWindow() {
        state.append("g", 10);
        state.append("g", 20);
        state.append("g", 60);

        assertThat(state.avg("g", 60)).isEqualTo(30.0);
    }

    @Test
    void groupsAreIndependent() {
        state.append("alice", 10);
        state.append("bob", 99);

        assertThat(state.sum("alice", 60)).isEqualTo(10.0);
        assertThat(state.groupKeys()).containsExactlyInAnyOrder("alice", "bob");
        assertThat(state.size()).isEqualTo(2);
    }

    @Test
    void explicitTimestampsAreHonoured() {
        state.append("g", 5, -1000);

        assertThat(state.count("g", 60)).isZero();
        assertThat(state.count("g", 1000)).isEqualTo(1);
    }

    @Test
    void pruneRemovesOldEntriesAndEmptyGroups() {
        state.append("old", 1);
        state.append("mixed", 2);
        clock.advanceSeconds(100);
        state.append("mixed", 3);

        int removed = state.prune(60);

        assertThat(removed).isEqualTo(2);
        assertThat(state.groupKeys()).containsExactly("mixed");
        assertThat(state.window("mixed", 1000)).containsExactly(3.0);
    }

    @Test
    void defaultPruneKeepsOneWeek() {
        state.append("g", 1);
        clock.advanceSeconds(AggregationState.DEFAULT_MAX_AGE_SECONDS);

        assertThat(state.prune()).isZero();

        clock.advanceSeconds(1);
        assertThat(state.prune()).isEqualTo(1);
        assertThat(state.size()).isZero();
    }
}
