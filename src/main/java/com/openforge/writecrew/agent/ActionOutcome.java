package com.openforge.writecrew.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.writecrew.approval.ApprovalOutcome;
import com.openforge.writecrew.document.DocumentState;
import com.openforge.writecrew.permission.PermissionEvaluationResult;
import com.openforge.writecrew.usage.ActualUsage;

/**
 * Final result of one coordinated agent action.
 *
 * @param evaluation    the permission decision the action started with
 * @param approval      present only when approval was required
 * @param documentState state after the change, for document-modifying actions
 * @param violation     set when the produced content broke a threshold its estimate passed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionOutcome(
        Status                     status,
        String                     actionId,
        PermissionEvaluationResult evaluation,
        ApprovalOutcome            approval,
        DocumentState              documentState,
        ActualUsage                usage,
        String                     message,
        String                     violation
) {

    public enum Status {
        COMPLETED,
        /** Denied, rate-limited or cost-limited, at evaluation or at reservation. */
        BLOCKED,
        /** Approval rejected, expired or withdrawn. */
        REJECTED,
        /** The change overlapped a concurrent edit. */
        CONFLICT,
        /** The content producer or the apply step failed. */
        FAILED
    }

    static ActionOutcome blocked(String actionId, PermissionEvaluationResult evaluation) {
        return new ActionOutcome(Status.BLOCKED, actionId, evaluation, null, null, null, evaluation.reason(), null);
    }

    public boolean completed() {
        return status == Status.COMPLETED;
    }
}
