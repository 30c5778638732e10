package com.openforge.writecrew.document;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single writer per document.
 *
 * apply() under the document lock:
 *   1. load current state (cache, then store)
 *   2. rebase over concurrent changes       → ConflictUnresolvableException
 *      (also when the base version is older than the retained window)
 *   3. bounds check                         → InvalidChangeException
 *   4. apply text, version + 1, word count
 *   5. persist, cache, remember for conflict detection
 *   6. snapshot if the change touched enough words
 *   7. broadcast
 *
 * Broadcasting inside the lock is what makes the presentation surface see
 * changes in exactly the order they were applied.
 */
@Slf4j
@Service
public class DocumentStateManager {

    private final DocumentStore              store;
    private final ConflictResolver           conflictResolver;
    private final CollaborationBroadcaster   broadcaster;
    private final Clock                      clock;
    private final CollaborationProperties    properties;
    private final Cache<String, DocumentState> cache;
    private final LoadingCache<String, ReentrantLock> locks;

    public DocumentStateManager(DocumentStore store,
                                ConflictResolver conflictResolver,
                                CollaborationBroadcaster broadcaster,
                                Clock clock,
                                CollaborationProperties properties) {
        this.store            = store;
        this.conflictResolver = conflictResolver;
        this.broadcaster      = broadcaster;
        this.clock            = clock;
        this.properties       = properties;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(properties.stateCacheTtl())
                .maximumSize(1_000)
                .build();
        // Weak values: a lock is dropped once no thread holds a reference to it.
        this.locks = Caffeine.newBuilder()
                .weakValues()
                .build(id -> new ReentrantLock());
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    public DocumentState getState(String documentId) {
        DocumentState state = cache.get(documentId, id -> store.load(id).orElse(null));
        if (state == null) {
            throw new DocumentNotFoundException(documentId);
        }
        return state;
    }

    public List<DocumentVersion> listVersions(String documentId) {
        getState(documentId);
        return store.listVersions(documentId);
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    /** Creates a document at version 1 and stores its first snapshot. */
    public DocumentState createDocument(String title, String content, String actorId) {
        String body = content == null ? "" : content;
        Instant now = clock.instant();
        DocumentState state = new DocumentState(UUID.randomUUID().toString(), title, body, 1,
                now, actorId, DocumentText.countWords(body));
        store.save(state);
        store.saveVersion(new DocumentVersion(state.documentId(), 1, body, state.wordCount(),
                actorId, now, "Document created"));
        cache.put(state.documentId(), state);
        log.info("[Document] Created id={} words={} by={}", state.documentId(), state.wordCount(), actorId);
        return state;
    }

    public DocumentState apply(String documentId, DocumentChange change) {
        ReentrantLock lock = lockFor(documentId);
        lock.lock();
        try {
            DocumentState current = getState(documentId);

            DocumentChange resolved = change;
            List<DocumentChange> concurrent = conflictResolver
                    .unseenChanges(documentId, change, current.version())
                    .orElseThrow(() -> {
                        log.warn("[Conflict] Rejected change={} on document={}: base version {} is older than "
                                        + "the retained history at version {}",
                                change.changeId(), documentId, change.baseVersion(), current.version());
                        return ConflictUnresolvableException.staleBase(documentId, change.changeId(),
                                change.baseVersion(), current.version());
                    });
            if (!concurrent.isEmpty()) {
                resolved = conflictResolver.resolve(change, concurrent).orElseThrow(() -> {
                    List<String> ids = concurrent.stream()
                            .filter(prior -> ConflictResolver.overlaps(prior, change))
                            .map(DocumentChange::changeId)
                            .toList();
                    log.warn("[Conflict] Rejected change={} on document={} by actor={}, overlaps {}",
                            change.changeId(), documentId, change.actorId(), ids);
                    return new ConflictUnresolvableException(documentId, change.changeId(), ids);
                });
            }

            checkBounds(current, resolved);

            String content = DocumentText.apply(current.content(), resolved);
            Instant now = clock.instant();
            DocumentState next = new DocumentState(documentId, current.title(), content, current.version() + 1,
                    now, resolved.actorId(), DocumentText.countWords(content));

            store.save(next);
            cache.put(documentId, next);
            conflictResolver.recordApplied(documentId, resolved, next.version());

            int touched = DocumentText.wordsTouched(current.content(), resolved);
            if (touched > properties.snapshotWordThreshold()) {
                store.saveVersion(new DocumentVersion(documentId, next.version(), content, next.wordCount(),
                        resolved.actorId(), now, summarize(resolved, touched)));
            }

            broadcaster.documentChanged(resolved, next);
            log.debug("[Document] Applied change={} {} document={} version={} actor={}",
                    resolved.changeId(), resolved.operation(), documentId, next.version(), resolved.actorId());
            return next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Restores the content of a snapshotted version as a new version, via a
     * whole-document REPLACE so it is broadcast and conflict-checked like any
     * other change.
     */
    public DocumentState revertToVersion(String documentId, long version, String actorId) {
        ReentrantLock lock = lockFor(documentId);
        lock.lock();
        try {
            DocumentState current = getState(documentId);
            DocumentVersion target = store.loadVersion(documentId, version)
                    .orElseThrow(() -> new InvalidChangeException(
                            "No snapshot of document %s at version %d".formatted(documentId, version)));

            DocumentChange revert = DocumentChange.builder()
                    .operation(ChangeOperation.REPLACE)
                    .position(0)
                    .length(current.content().length())
                    .content(target.content())
                    .actorId(actorId)
                    .timestamp(clock.instant())
                    .source(ChangeSource.REVERT)
                    .baseVersion(current.version())
                    .build();
            DocumentState reverted = apply(documentId, revert);
            log.info("[Document] Reverted document={} to version={} as version={} by={}",
                    documentId, version, reverted.version(), actorId);
            return reverted;
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(String documentId) {
        return locks.get(documentId);
    }

    private static void checkBounds(DocumentState state, DocumentChange change) {
        int size = state.content().length();
        if (change.position() < 0 || change.position() > size) {
            throw new InvalidChangeException(
                    "Position %d outside document of length %d".formatted(change.position(), size));
        }
        // Compared against the remaining length so position + length cannot overflow.
        if (change.length() < 0 || change.length() > size - change.position()) {
            throw new InvalidChangeException("Range of length %d at %d outside document of length %d"
                    .formatted(change.length(), change.position(), size));
        }
    }

    private static String summarize(DocumentChange change, int wordsTouched) {
        return "%s by %s (%s), ~%d words".formatted(
                change.operation().name().toLowerCase(), change.actorId(),
                change.source().name().toLowerCase(), wordsTouched);
    }
}
