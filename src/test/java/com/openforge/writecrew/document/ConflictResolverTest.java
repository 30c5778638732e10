package com.openforge.writecrew.document;

import com.openforge.writecrew.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ConflictResolverTest {

    private MutableClock clock;
    private ConflictResolver resolver;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        resolver = new ConflictResolver(clock, CollaborationProperties.defaults());
    }

    private static DocumentChange insert(int position, String text, String actor, Long base) {
        return DocumentChange.builder().operation(ChangeOperation.INSERT).position(position)
                .content(text).actorId(actor).baseVersion(base).build();
    }

    private static DocumentChange replace(int position, int length, String text, String actor, Long base) {
        return DocumentChange.builder().operation(ChangeOperation.REPLACE).position(position).length(length)
                .content(text).actorId(actor).baseVersion(base).build();
    }

    private static DocumentChange delete(int position, int length, String actor, Long base) {
        return DocumentChange.builder().operation(ChangeOperation.DELETE).position(position).length(length)
                .actorId(actor).baseVersion(base).build();
    }

    @Test
    @DisplayName("an earlier insert shifts a later change right by its length")
    void earlierInsertShifts() {
        DocumentChange prior = insert(5, "abc", "user:1", 1L);
        DocumentChange incoming = replace(20, 4, "word", "agent:a", 1L);

        Optional<DocumentChange> resolved = resolver.resolve(incoming, List.of(prior));

        assertThat(resolved).get().extracting(DocumentChange::position).isEqualTo(23);
    }

    @Test
    @DisplayName("an earlier delete shifts a later change left")
    void earlierDeleteShifts() {
        DocumentChange prior = delete(0, 10, "user:1", 1L);

        Optional<DocumentChange> resolved = resolver.resolve(insert(15, "x", "agent:a", 1L), List.of(prior));

        assertThat(resolved).get().extracting(DocumentChange::position).isEqualTo(5);
    }

    @Test
    @DisplayName("a prior change after the incoming one leaves it in place")
    void laterPriorNoShift() {
        DocumentChange prior = replace(50, 5, "hello", "user:1", 1L);
        DocumentChange incoming = replace(10, 5, "world", "agent:a", 1L);

        assertThat(resolver.resolve(incoming, List.of(prior))).contains(incoming);
    }

    @Test
    @DisplayName("overlapping replaces cannot be merged")
    void overlappingReplaceUnresolvable() {
        DocumentChange prior = replace(10, 10, "first", "user:1", 1L);

        assertThat(resolver.resolve(replace(15, 10, "second", "agent:a", 1L), List.of(prior))).isEmpty();
    }

    @Test
    @DisplayName("shifts accumulate over several prior changes")
    void shiftsAccumulate() {
        List<DocumentChange> priors = List.of(insert(0, "12345", "user:1", 1L), delete(2, 3, "user:2", 2L));

        Optional<DocumentChange> resolved = resolver.resolve(insert(10, "!", "agent:a", 1L), priors);

        assertThat(resolved).get().extracting(DocumentChange::position).isEqualTo(12);
    }

    @Test
    @DisplayName("only changes applied after the base version count as concurrent")
    void concurrencyByBaseVersion() {
        DocumentChange seen = insert(0, "a", "user:1", 1L);
        DocumentChange unseen = insert(0, "b", "user:1", 2L);
        resolver.recordApplied("doc-1", seen, 2);
        resolver.recordApplied("doc-1", unseen, 3);

        assertThat(resolver.concurrentChanges("doc-1", insert(4, "c", "agent:a", 2L))).containsExactly(unseen);
    }

    @Test
    @DisplayName("without a base version, other actors' recent changes count as concurrent")
    void concurrencyByActor() {
        DocumentChange mine = insert(0, "a", "agent:a", null);
        DocumentChange theirs = insert(0, "b", "user:1", null);
        resolver.recordApplied("doc-1", mine, 2);
        resolver.recordApplied("doc-1", theirs, 3);

        assertThat(resolver.concurrentChanges("doc-1", insert(9, "c", "agent:a", null))).containsExactly(theirs);
    }

    @Test
    @DisplayName("changes older than the conflict window are forgotten")
    void windowPrunes() {
        resolver.recordApplied("doc-1", insert(0, "a", "user:1", 1L), 2);

        clock.advance(Duration.ofSeconds(31));

        assertThat(resolver.concurrentChanges("doc-1", insert(4, "c", "agent:a", 1L))).isEmpty();
    }

    @Test
    @DisplayName("unseenChanges is empty once the window no longer covers every version after the base")
    void unseenChangesNeedsFullHistory() {
        DocumentChange second = insert(0, "b", "user:1", 2L);
        resolver.recordApplied("doc-1", insert(0, "a", "user:1", 1L), 2);
        clock.advance(Duration.ofSeconds(20));
        resolver.recordApplied("doc-1", second, 3);
        clock.advance(Duration.ofSeconds(15));

        assertThat(resolver.unseenChanges("doc-1", insert(4, "c", "agent:a", 1L), 3)).isEmpty();
        assertThat(resolver.unseenChanges("doc-1", insert(4, "c", "agent:a", 2L), 3)).contains(List.of(second));
        assertThat(resolver.unseenChanges("doc-1", insert(4, "c", "agent:a", 3L), 3)).contains(List.of());
    }

    @Test
    @DisplayName("history trimmed by the limit also makes older bases unresolvable")
    void unseenChangesRespectsHistoryLimit() {
        ConflictResolver small = new ConflictResolver(clock,
                new CollaborationProperties(Duration.ofSeconds(30), 2, 100, Duration.ofMinutes(10), 2));
        small.recordApplied("doc-1", insert(0, "a", "user:1", 1L), 2);
        small.recordApplied("doc-1", insert(0, "b", "user:1", 2L), 3);
        small.recordApplied("doc-1", insert(0, "c", "user:1", 3L), 4);

        assertThat(small.unseenChanges("doc-1", insert(9, "d", "agent:a", 1L), 4)).isEmpty();
        assertThat(small.unseenChanges("doc-1", insert(9, "d", "agent:a", 2L), 4)).hasValueSatisfying(
                unseen -> assertThat(unseen).hasSize(2));
    }

    @Test
    @DisplayName("with no history at all, only a change on the current version is resolvable")
    void unseenChangesWithoutHistory() {
        assertThat(resolver.unseenChanges("doc-9", insert(0, "x", "agent:a", 4L), 5)).isEmpty();
        assertThat(resolver.unseenChanges("doc-9", insert(0, "x", "agent:a", 5L), 5)).contains(List.of());
        assertThat(resolver.unseenChanges("doc-9", insert(0, "x", "agent:a", null), 5)).contains(List.of());
    }

    @Test
    @DisplayName("checkConflicts returns only overlapping concurrent changes")
    void checkConflictsFiltersOverlap() {
        DocumentChange far = replace(100, 5, "x", "user:1", 1L);
        DocumentChange near = replace(8, 5, "y", "user:2", 1L);
        resolver.recordApplied("doc-1", far, 2);
        resolver.recordApplied("doc-1", near, 3);

        assertThat(resolver.checkConflicts("doc-1", replace(10, 5, "z", "agent:a", 1L))).containsExactly(near);
    }

    @Test
    @DisplayName("overlap rules for inserts and ranges")
    void overlapRules() {
        assertThat(ConflictResolver.overlaps(insert(5, "a", "x", null), insert(5, "b", "y", null))).isTrue();
        assertThat(ConflictResolver.overlaps(insert(5, "a", "x", null), insert(6, "b", "y", null))).isFalse();
        assertThat(ConflictResolver.overlaps(insert(7, "a", "x", null), delete(5, 5, "y", null))).isTrue();
        assertThat(ConflictResolver.overlaps(insert(10, "a", "x", null), delete(5, 5, "y", null))).isFalse();
        assertThat(ConflictResolver.overlaps(delete(0, 5, "x", null), delete(5, 5, "y", null))).isFalse();
        assertThat(ConflictResolver.overlaps(delete(0, 6, "x", null), delete(5, 5, "y", null))).isTrue();
    }
}
