package com.openforge.writecrew.document;

import java.util.List;
import java.util.Optional;

/**
 * Persistence seam for documents and their snapshots.  Callers hold the
 * document's lock, so implementations need no locking of their own.
 */
public interface DocumentStore {

    Optional<DocumentState> load(String documentId);

    /** Inserts or overwrites the current state. */
    void save(DocumentState state);

    void saveVersion(DocumentVersion version);

    Optional<DocumentVersion> loadVersion(String documentId, long version);

    /** Snapshots, newest first. */
    List<DocumentVersion> listVersions(String documentId);
}
