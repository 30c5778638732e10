package com.openforge.writecrew.document;

import java.time.Instant;

/**
 * Stored full-content snapshot of a document at one version.
 */
public record DocumentVersion(
        String  documentId,
        long    version,
        String  content,
        int     wordCount,
        String  createdBy,
        Instant createdAt,
        String  changesSummary
) {
}
