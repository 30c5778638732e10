package com.openforge.writecrew.approval;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    EXPIRED,
    /** Caller cancelled its wait, or the queue was cleared. */
    WITHDRAWN;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /** Counts towards the consecutive-rejection escalation. */
    public boolean isRejection() {
        return this == REJECTED || this == EXPIRED;
    }
}
