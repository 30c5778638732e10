package com.openforge.writecrew.approval;

import java.time.Instant;

/**
 * What the waiting agent receives once its request is decided.  Expiry and
 * withdrawal come back as non-approved outcomes, never as exceptions.
 *
 * @param consecutiveRejections REJECTED/EXPIRED outcomes in a row for this agent, this one included
 * @param escalationSuggested   true once that streak exceeds the configured threshold
 */
public record ApprovalOutcome(
        String         requestId,
        String         agentInstanceId,
        ApprovalStatus status,
        Long           respondedBy,
        String         feedback,
        Instant        decidedAt,
        int            consecutiveRejections,
        boolean        escalationSuggested
) {

    public boolean approved() {
        return status == ApprovalStatus.APPROVED;
    }
}
