package com.openforge.writecrew.approval.dto;

import com.openforge.writecrew.approval.ApprovalStatus;
import com.openforge.writecrew.domain.ApprovalRecord;
import com.openforge.writecrew.permission.ActionType;

import java.time.Instant;

public record ApprovalHistoryResponse(
        String         requestId,
        String         agentInstanceId,
        ActionType     actionType,
        String         actionDescription,
        ApprovalStatus status,
        Long           respondedBy,
        String         feedback,
        Instant        requestedAt,
        Instant        resolvedAt
) {

    public static ApprovalHistoryResponse from(ApprovalRecord r) {
        return new ApprovalHistoryResponse(r.getRequestId(), r.getAgentInstanceId(), r.getActionType(),
                r.getActionDescription(), r.getStatus(), r.getRespondedBy(), r.getFeedback(),
                r.getRequestedAt(), r.getResolvedAt());
    }
}
