package com.openforge.writecrew.approval;

import com.openforge.writecrew.approval.dto.ApprovalDecisionRequest;
import com.openforge.writecrew.approval.dto.ApprovalHistoryResponse;
import com.openforge.writecrew.approval.dto.PendingApprovalResponse;
import com.openforge.writecrew.auth.AuthenticatedUser;
import com.openforge.writecrew.auth.CurrentUser;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for human approvals.
 *
 * Endpoints:
 *   GET    /api/approvals/pending         : open requests, highest priority first
 *   GET    /api/approvals/history         : archived requests, newest first
 *   GET    /api/approvals/stats           : counts
 *   POST   /api/approvals/{id}/respond    : approve or reject (410 once expired, 409 once resolved)
 *   DELETE /api/approvals/{id}            : withdraw
 */
@RestController
@RequestMapping("/api/approvals")
@RequiredArgsConstructor
public class ApprovalController {

    private final ApprovalWorkflowManager workflowManager;

    @GetMapping("/pending")
    public List<PendingApprovalResponse> pending(@RequestParam(required = false) String agentInstanceId) {
        return workflowManager.pending(agentInstanceId).stream()
                .map(PendingApprovalResponse::from)
                .toList();
    }

    @GetMapping("/history")
    public List<ApprovalHistoryResponse> history(@RequestParam(required = false) String agentInstanceId,
                                                 @RequestParam(defaultValue = "50") int limit) {
        return workflowManager.history(agentInstanceId, Math.min(limit, 500)).stream()
                .map(ApprovalHistoryResponse::from)
                .toList();
    }

    @GetMapping("/stats")
    public ApprovalStats stats() {
        return workflowManager.stats();
    }

    @PostMapping("/{requestId}/respond")
    public ApprovalResponse respond(@PathVariable String requestId,
                                    @Valid @RequestBody ApprovalDecisionRequest request) {
        AuthenticatedUser user = CurrentUser.require();
        return workflowManager.respond(requestId, user.userId(), request.approved(), request.feedback());
    }

    @DeleteMapping("/{requestId}")
    public ApprovalResponse withdraw(@PathVariable String requestId,
                                     @RequestParam(defaultValue = "Withdrawn by user") String reason) {
        return ApprovalResponse.from(workflowManager.withdraw(requestId, reason));
    }
}
