package com.openforge.writecrew.approval;

import java.time.Instant;

/**
 * Returned to the human who answered an approval request.
 */
public record ApprovalResponse(
        String         requestId,
        ApprovalStatus status,
        Long           respondedBy,
        Instant        respondedAt,
        String         feedback,
        boolean        escalationSuggested
) {

    public static ApprovalResponse from(ApprovalOutcome outcome) {
        return new ApprovalResponse(outcome.requestId(), outcome.status(), outcome.respondedBy(),
                outcome.decidedAt(), outcome.feedback(), outcome.escalationSuggested());
    }
}
