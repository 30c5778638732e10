package com.openforge.writecrew.permission;

/**
 * The four ordered autonomy tiers an agent can run at, lowest autonomy first.
 *
 * Each level carries the approval scope applied when the stored permissions
 * leave the scope empty, and the widest scope it may be configured with.
 */
public enum AutonomyLevel {

    /** Every action requires explicit approval. */
    ASSISTANT(1, ApprovalScope.ACTION),

    /** Paragraph-level approval for writes, edits and deletes. */
    COLLABORATIVE(2, ApprovalScope.PARAGRAPH),

    /** Section-level approval for large writes; deletes always reviewed. */
    SEMI_AUTONOMOUS(3, ApprovalScope.SECTION),

    /** Project-level approval only; whole-document deletes still reviewed. */
    FULLY_AUTONOMOUS(4, ApprovalScope.PROJECT);

    private final int rank;
    private final ApprovalScope defaultScope;

    AutonomyLevel(int rank, ApprovalScope defaultScope) {
        this.rank = rank;
        this.defaultScope = defaultScope;
    }

    public int rank() {
        return rank;
    }

    public ApprovalScope defaultScope() {
        return defaultScope;
    }

    /** A level accepts its default scope or anything narrower. */
    public boolean accepts(ApprovalScope scope) {
        return scope.ordinal() <= defaultScope.ordinal();
    }

    public boolean isHigherThan(AutonomyLevel other) {
        return rank > other.rank;
    }
}
