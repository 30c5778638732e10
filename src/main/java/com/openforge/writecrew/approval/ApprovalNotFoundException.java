package com.openforge.writecrew.approval;

import com.openforge.writecrew.common.CollaborationException;

public class ApprovalNotFoundException extends CollaborationException {

    public ApprovalNotFoundException(String requestId) {
        super("Approval request not found: " + requestId);
    }

    @Override
    public String errorCode() {
        return "approval_not_found";
    }
}
