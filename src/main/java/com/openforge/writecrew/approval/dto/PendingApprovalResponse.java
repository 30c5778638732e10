package com.openforge.writecrew.approval.dto;

import com.openforge.writecrew.approval.ApprovalPriority;
import com.openforge.writecrew.approval.ApprovalRequest;
import com.openforge.writecrew.approval.ImpactEstimate;
import com.openforge.writecrew.permission.ActionType;
import com.openforge.writecrew.permission.ApprovalScope;

import java.time.Instant;

public record PendingApprovalResponse(
        String           requestId,
        String           agentInstanceId,
        ActionType       actionType,
        String           actionDescription,
        ApprovalScope    approvalScope,
        ApprovalPriority priority,
        ImpactEstimate   impact,
        long             estimatedCostMicros,
        Instant          createdAt,
        Instant          expiresAt
) {

    public static PendingApprovalResponse from(ApprovalRequest request) {
        return new PendingApprovalResponse(
                request.requestId(),
                request.agentInstanceId(),
                request.action().type(),
                request.action().summary(),
                request.scope(),
                request.priority(),
                request.impact(),
                request.action().estimatedCostMicros(),
                request.createdAt(),
                request.expiresAt());
    }
}
