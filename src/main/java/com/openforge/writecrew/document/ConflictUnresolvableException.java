package com.openforge.writecrew.document;

import com.openforge.writecrew.common.CollaborationException;
import lombok.Getter;

import java.util.List;

/**
 * The incoming change overlaps a concurrent change that was applied first,
 * or was based on a version too old to rebase.  The document is untouched;
 * the author should rebase on the current state.
 */
@Getter
public class ConflictUnresolvableException extends CollaborationException {

    private final String       documentId;
    private final String       changeId;
    private final List<String> conflictingChangeIds;

    public ConflictUnresolvableException(String documentId, String changeId, List<String> conflictingChangeIds) {
        this("Change %s conflicts with %s on document %s".formatted(changeId, conflictingChangeIds, documentId),
                documentId, changeId, conflictingChangeIds);
    }

    private ConflictUnresolvableException(String message, String documentId, String changeId,
                                          List<String> conflictingChangeIds) {
        super(message);
        this.documentId           = documentId;
        this.changeId             = changeId;
        this.conflictingChangeIds = List.copyOf(conflictingChangeIds);
    }

    public static ConflictUnresolvableException staleBase(String documentId, String changeId,
                                                          long baseVersion, long currentVersion) {
        return new ConflictUnresolvableException(
                "Change %s is based on version %d of document %s, now at %d; refetch and retry"
                        .formatted(changeId, baseVersion, documentId, currentVersion),
                documentId, changeId, List.of());
    }

    @Override
    public String errorCode() {
        return "conflict_unresolvable";
    }
}
