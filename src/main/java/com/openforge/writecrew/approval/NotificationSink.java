package com.openforge.writecrew.approval;

import com.openforge.writecrew.permission.AgentAction;

/**
 * User-facing push channel.  Implementations must not throw: a failed
 * notification never blocks or fails the workflow.
 */
public interface NotificationSink {

    void approvalRequested(ApprovalRequest request);

    void approvalResolved(ApprovalRequest request, ApprovalOutcome outcome);

    void escalationSuggested(String agentInstanceId, int consecutiveRejections);

    /** The executed action turned out larger than its estimate allowed. */
    void policyViolation(String agentInstanceId, AgentAction action, String reason);
}
