package com.openforge.writecrew.approval;

import com.openforge.writecrew.common.CollaborationException;
import lombok.Getter;

@Getter
public class ApprovalAlreadyResolvedException extends CollaborationException {

    private final ApprovalStatus status;

    public ApprovalAlreadyResolvedException(String requestId, ApprovalStatus status) {
        super("Approval request %s is already %s".formatted(requestId, status));
        this.status = status;
    }

    @Override
    public String errorCode() {
        return "approval_already_resolved";
    }
}
