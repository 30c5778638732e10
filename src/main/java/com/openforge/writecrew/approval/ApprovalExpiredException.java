package com.openforge.writecrew.approval;

import com.openforge.writecrew.common.CollaborationException;

import java.time.Instant;

public class ApprovalExpiredException extends CollaborationException {

    public ApprovalExpiredException(String requestId, Instant expiredAt) {
        super("Approval request %s expired at %s".formatted(requestId, expiredAt));
    }

    @Override
    public String errorCode() {
        return "approval_expired";
    }
}
