package com.carelog.concern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.carelog.core.error.ConcernNotMatchedException;
import com.carelog.core.error.InvalidCommandException;
import com.carelog.core.match.FuzzyMatcher;
import com.carelog.core.model.Concern;
import com.carelog.core.model.ConcernCommand;
import com.carelog.core.model.ConcernSnapshot;
import com.carelog.core.model.SnapshotReason;
import com.carelog.testing.InMemoryConcernStore;
import com.carelog.testing.InMemoryLegacyAggregateStore;
import com.carelog.testing.MutableClock;

class ConcernCommandExecutorTest {

    private static final String USER = "user-7";

    private MutableClock clock;
    private InMemoryConcernStore store;
    private InMemoryLegacyAggregateStore aggregates;
    private ConcernLifecycleService concerns;
    private ConcernCommandExecutor executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        store = new InMemoryConcernStore();
        aggregates = new InMemoryLegacyAggregateStore();
        FuzzyMatcher matcher = new FuzzyMatcher();
        concerns = new ConcernLifecycleService(store, new LegacyAggregator(store, aggregates, clock), matcher, clock);
        executor = new ConcernCommandExecutor(concerns, matcher);
    }

    private Concern concern(String title, String content) {
        Concern c = concerns.getOrCreateConcern(USER, title).block();
        if (content != null) {
            concerns.updateConcernSummary(c.id(), content, SnapshotReason.AUTO_UPDATE).block();
        }
        clock.advance(Duration.ofMinutes(10));
        return c;
    }

    @Test
    void mergeFoldsSecondaryIntoFirstNamedConcern() {
        Concern back = concern("Back Pain", "Back hurts.");
        Concern neck = concern("Neck Stiffness", "Stiff neck in the morning.");

        List<String> matched = executor.execute(USER, ConcernCommand.merge(List.of("back", "neck"))).block();

        assertThat(matched).containsExactly("Back Pain", "Neck Stiffness");
        List<Concern> open = concerns.getActiveConcerns(USER).collectList().block();
        assertThat(open).extracting(Concern::id).containsExactly(back.id());
        assertThat(open.get(0).summaryContent()).isEqualTo("Back hurts.\n\nStiff neck in the morning.");

        List<ConcernSnapshot> history = concerns.getConcernHistory(back.id()).collectList().block();
        assertThat(history.get(0).reason()).isEqualTo(SnapshotReason.USER_EDIT);
        assertThat(concerns.getConcernHistory(neck.id()).collectList().block()).hasSize(1);
        assertThat(aggregates.content(USER)).isEqualTo("--- Back Pain ---\nBack hurts.\n\nStiff neck in the morning.");
    }

    @Test
    void mergeJoinsContentWithBlankLine() {
        Concern stomach = concern("Stomach Pain", "A");
        concern("Acid Reflux", "B");

        executor.execute(USER, ConcernCommand.merge(List.of("Stomach Pain", "Acid Reflux"))).block();

        List<Concern> open = concerns.getActiveConcerns(USER).collectList().block();
        assertThat(open).extracting(Concern::title).containsExactly("Stomach Pain");
        assertThat(open.get(0).id()).isEqualTo(stomach.id());
        assertThat(open.get(0).summaryContent()).isEqualTo("A\n\nB");
    }

    @Test
    void mergeSkipsEmptyContent() {
        concern("Back Pain", null);
        concern("Neck Stiffness", "Stiff neck.");

        executor.execute(USER, ConcernCommand.merge(List.of("Back Pain", "Neck Stiffness"))).block();

        assertThat(concerns.getPrimaryConcern(USER).block().summaryContent()).isEqualTo("Stiff neck.");
    }

    @Test
    void mergeOfSameConcernTwiceIsInvalid() {
        concern("Back Pain", "Back hurts.");
        concern("Eye Stye", "Red eyelid.");

        assertThatThrownBy(() -> executor.execute(USER, ConcernCommand.merge(List.of("back", "Back Pain"))).block())
                .isInstanceOf(InvalidCommandException.class);
        assertThat(concerns.getActiveConcerns(USER).collectList().block()).hasSize(2);
    }

    @Test
    void mergeNeedsTwoNames() {
        concern("Back Pain", "Back hurts.");

        assertThatThrownBy(() -> executor.execute(USER, ConcernCommand.merge(List.of("back"))).block())
                .isInstanceOf(InvalidCommandException.class);
    }

    @Test
    void mergeWithUnknownNameChangesNothing() {
        concern("Back Pain", "Back hurts.");
        concern("Eye Stye", "Red eyelid.");

        assertThatThrownBy(() -> executor.execute(USER, ConcernCommand.merge(List.of("back", "migraine"))).block())
                .isInstanceOf(ConcernNotMatchedException.class)
                .hasMessageContaining("migraine");
        assertThat(concerns.getActiveConcerns(USER).collectList().block()).hasSize(2);
    }

    @Test
    void deleteRemovesMatchedConcern() {
        concern("Back Pain", "Back hurts.");
        Concern eye = concern("Eye Stye", "Red eyelid.");

        List<String> matched = executor.execute(USER, ConcernCommand.delete("back")).block();

        assertThat(matched).containsExactly("Back Pain");
        assertThat(concerns.getActiveConcerns(USER).collectList().block()).extracting(Concern::id).containsExactly(eye.id());
    }

    @Test
    void deleteWithoutMatchFails() {
        concern("Back Pain", "Back hurts.");

        assertThatThrownBy(() -> executor.execute(USER, ConcernCommand.delete("headache")).block())
                .isInstanceOf(ConcernNotMatchedException.class);
    }

    @Test
    void renameReportsOldAndNewTitle() {
        concern("Back Pain", "Back hurts.");

        List<String> matched = executor.execute(USER, ConcernCommand.rename("back", "Lower Back Pain")).block();

        assertThat(matched).containsExactly("Back Pain", "Lower Back Pain");
        assertThat(concerns.getPrimaryConcern(USER).block().title()).isEqualTo("Lower Back Pain");
    }

    @Test
    void renameNeedsNewName() {
        concern("Back Pain", "Back hurts.");

        assertThatThrownBy(() -> executor.execute(USER, ConcernCommand.rename("back", " ")).block())
                .isInstanceOf(InvalidCommandException.class);
    }

    @Test
    void deleteWithTwoTargetsIsInvalid() {
        concern("Back Pain", "Back hurts.");

        ConcernCommand twoTargets = new ConcernCommand(ConcernCommand.Type.DELETE, List.of("back", "eye"), null);
        assertThatThrownBy(() -> executor.execute(USER, twoTargets).block())
                .isInstanceOf(InvalidCommandException.class);
    }
}
