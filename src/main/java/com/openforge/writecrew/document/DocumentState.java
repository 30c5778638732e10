package com.openforge.writecrew.document;

import java.time.Instant;

/**
 * Immutable snapshot of a document.  {@code version} increases by exactly
 * one per applied change.
 */
public record DocumentState(
        String  documentId,
        String  title,
        String  content,
        long    version,
        Instant lastModifiedAt,
        String  lastModifiedBy,
        int     wordCount
) {
}
