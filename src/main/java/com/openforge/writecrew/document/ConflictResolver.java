package com.openforge.writecrew.document;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Detects and merges concurrent edits.
 *
 * Keeps, per document, a trailing window of applied changes tagged with
 * the version they produced.  An incoming change is concurrent with every
 * remembered change it did not observe: applied at a version above its
 * base version, or, when the base version is unknown, made by someone
 * else.
 *
 * Merge is a positional transform over the concurrent changes in apply
 * order.  A prior change wholly before the incoming one shifts it by the
 * prior's net delta; one wholly after leaves it alone; anything that
 * overlaps makes the incoming change unresolvable.  Two overlapping
 * replaces therefore resolve as first-committed-wins.
 *
 * A change whose base version predates what the window still holds cannot
 * be rebased at all; unseenChanges() reports that as empty.
 */
@Slf4j
@Component
public class ConflictResolver {

    private final Clock                            clock;
    private final CollaborationProperties          properties;
    private final Cache<String, Deque<AppliedChange>> applied;

    public ConflictResolver(Clock clock, CollaborationProperties properties) {
        this.clock      = clock;
        this.properties = properties;
        // A window untouched for longer than its own span holds nothing usable.
        this.applied    = Caffeine.newBuilder()
                .expireAfterAccess(properties.conflictWindow())
                .build();
    }

    record AppliedChange(DocumentChange change, long version, Instant appliedAt) {
    }

    // ── Window ───────────────────────────────────────────────────────────────

    public void recordApplied(String documentId, DocumentChange change, long version) {
        Deque<AppliedChange> window = applied.get(documentId, id -> new ArrayDeque<>());
        synchronized (window) {
            window.addLast(new AppliedChange(change, version, clock.instant()));
            while (window.size() > properties.historyLimit()) {
                window.removeFirst();
            }
        }
    }

    /** Remembered changes the incoming one has not seen, oldest first. */
    public List<DocumentChange> concurrentChanges(String documentId, DocumentChange incoming) {
        Deque<AppliedChange> window = applied.getIfPresent(documentId);
        if (window == null) {
            return List.of();
        }
        synchronized (window) {
            prune(window);
            return collectUnseen(window, incoming);
        }
    }

    /**
     * Like concurrentChanges(), but empty when the incoming change has a base
     * version below {@code currentVersion} and the window no longer holds
     * every version in (baseVersion, currentVersion].  Callers must hold the
     * document's write lock so currentVersion cannot move.
     */
    public Optional<List<DocumentChange>> unseenChanges(String documentId, DocumentChange incoming,
                                                        long currentVersion) {
        Long base = incoming.baseVersion();
        boolean behind = base != null && base < currentVersion;
        Deque<AppliedChange> window = applied.getIfPresent(documentId);
        if (window == null) {
            return behind ? Optional.empty() : Optional.of(List.of());
        }
        synchronized (window) {
            prune(window);
            if (behind) {
                long retained = window.stream()
                        .mapToLong(AppliedChange::version)
                        .filter(v -> v > base && v <= currentVersion)
                        .distinct()
                        .count();
                if (retained < currentVersion - base) {
                    return Optional.empty();
                }
            }
            return Optional.of(collectUnseen(window, incoming));
        }
    }

    /** Concurrent changes whose range touches the incoming change. */
    public List<DocumentChange> checkConflicts(String documentId, DocumentChange incoming) {
        return concurrentChanges(documentId, incoming).stream()
                .filter(prior -> overlaps(prior, incoming))
                .toList();
    }

    // ── Merge ────────────────────────────────────────────────────────────────

    /**
     * Rebases {@code incoming} over {@code priorChanges} (in apply order).
     *
     * @return the adjusted change, or empty if any prior overlaps it
     */
    public Optional<DocumentChange> resolve(DocumentChange incoming, List<DocumentChange> priorChanges) {
        DocumentChange current = incoming;
        for (DocumentChange prior : priorChanges) {
            Optional<DocumentChange> next = transform(current, prior);
            if (next.isEmpty()) {
                log.debug("[Conflict] change={} overlaps prior={} from actor={}",
                        incoming.changeId(), prior.changeId(), prior.actorId());
                return Optional.empty();
            }
            current = next.get();
        }
        if (current.position() != incoming.position()) {
            log.debug("[Conflict] change={} shifted {} -> {}", incoming.changeId(),
                    incoming.position(), current.position());
        }
        return Optional.of(current);
    }

    private static Optional<DocumentChange> transform(DocumentChange c, DocumentChange p) {
        boolean priorBefore = p.removedLength() == 0
                ? p.position() <= c.position()
                : p.end() <= c.position();
        if (priorBefore) {
            return Optional.of(c.movedTo(c.position() + p.delta()));
        }
        if (p.position() >= c.end()) {
            return Optional.of(c);
        }
        return Optional.empty();
    }

    /**
     * Ranges [position, position+length) intersect, or the positions are
     * equal.  A zero-length insert intersects a range it falls strictly inside.
     */
    public static boolean overlaps(DocumentChange a, DocumentChange b) {
        if (a.position() == b.position()) {
            return true;
        }
        if (a.removedLength() == 0 && b.removedLength() == 0) {
            return false;
        }
        if (a.removedLength() == 0) {
            return a.position() > b.position() && a.position() < b.end();
        }
        if (b.removedLength() == 0) {
            return b.position() > a.position() && b.position() < a.end();
        }
        return a.position() < b.end() && b.position() < a.end();
    }

    private void prune(Deque<AppliedChange> window) {
        Instant cutoff = clock.instant().minus(properties.conflictWindow());
        while (!window.isEmpty() && window.peekFirst().appliedAt().isBefore(cutoff)) {
            window.removeFirst();
        }
    }

    private static List<DocumentChange> collectUnseen(Deque<AppliedChange> window, DocumentChange incoming) {
        List<DocumentChange> unseen = new ArrayList<>();
        for (AppliedChange prior : window) {
            if (unseen(prior, incoming)) {
                unseen.add(prior.change());
            }
        }
        return unseen;
    }

    private static boolean unseen(AppliedChange prior, DocumentChange incoming) {
        if (incoming.baseVersion() != null) {
            return prior.version() > incoming.baseVersion();
        }
        return !prior.change().actorId().equals(incoming.actorId());
    }
}
