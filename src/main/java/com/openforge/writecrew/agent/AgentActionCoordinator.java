package com.openforge.writecrew.agent;

import com.openforge.writecrew.approval.ApprovalOutcome;
import com.openforge.writecrew.approval.ApprovalWorkflowManager;
import com.openforge.writecrew.approval.NotificationSink;
import com.openforge.writecrew.document.ChangeOperation;
import com.openforge.writecrew.document.ChangeSource;
import com.openforge.writecrew.document.ConflictUnresolvableException;
import com.openforge.writecrew.document.DocumentChange;
import com.openforge.writecrew.document.DocumentState;
import com.openforge.writecrew.document.DocumentStateManager;
import com.openforge.writecrew.permission.ActionContext;
import com.openforge.writecrew.permission.AgentAction;
import com.openforge.writecrew.permission.AgentPermissionService;
import com.openforge.writecrew.permission.AgentPermissions;
import com.openforge.writecrew.permission.PermissionEngine;
import com.openforge.writecrew.permission.PermissionEvaluationResult;
import com.openforge.writecrew.usage.ActualUsage;
import com.openforge.writecrew.usage.UsageLimitExceededException;
import com.openforge.writecrew.usage.UsageReservation;
import com.openforge.writecrew.usage.UsageTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs one agent action end to end.
 *
 *   submit()
 *     └─ PermissionEngine.evaluate
 *           ├─ DENIED / RATE_LIMITED / COST_LIMITED → BLOCKED, immediately
 *           ├─ REQUIRES_APPROVAL → wait for the human (cancel = withdraw)
 *           │     └─ not approved → REJECTED
 *           └─ ALLOWED / approved
 *                 └─ collaborationExecutor
 *                       reserve budget → produce → apply change → commit usage
 *                       (conflict or failure releases the reservation)
 *                       → post-hoc threshold check
 */
@Slf4j
@Service
public class AgentActionCoordinator {

    private final PermissionEngine          engine;
    private final AgentPermissionService    permissionService;
    private final ApprovalWorkflowManager   approvals;
    private final UsageTracker              usageTracker;
    private final DocumentStateManager      documents;
    private final NotificationSink          notifications;
    private final ExecutorService           executor;
    private final Clock                     clock;

    public AgentActionCoordinator(PermissionEngine engine,
                                  AgentPermissionService permissionService,
                                  ApprovalWorkflowManager approvals,
                                  UsageTracker usageTracker,
                                  DocumentStateManager documents,
                                  NotificationSink notifications,
                                  @Qualifier("collaborationExecutor") ExecutorService executor,
                                  Clock clock) {
        this.engine            = engine;
        this.permissionService = permissionService;
        this.approvals         = approvals;
        this.usageTracker      = usageTracker;
        this.documents         = documents;
        this.notifications     = notifications;
        this.executor          = executor;
        this.clock             = clock;
    }

    /**
     * Cancelling the returned future while the action waits for approval
     * withdraws the approval request.
     */
    public CompletableFuture<ActionOutcome> submit(String agentInstanceId, AgentAction action,
                                                   ActionContext context, ContentProducer producer) {
        PermissionEvaluationResult evaluation = engine.evaluate(agentInstanceId, action, context);

        switch (evaluation.decision()) {
            case ALLOWED:
                return CompletableFuture.supplyAsync(
                        () -> execute(agentInstanceId, action, context, producer, evaluation, null), executor);

            case REQUIRES_APPROVAL:
                String requestId = approvals.requestApproval(agentInstanceId, action,
                        evaluation.approvalScope(), approvalTimeout(action, evaluation));
                CompletableFuture<ApprovalOutcome> decision = approvals.awaitDecision(requestId);
                CompletableFuture<ActionOutcome> result = decision.thenApplyAsync(approval -> approval.approved()
                        ? execute(agentInstanceId, action, context, producer, evaluation, approval)
                        : notApproved(action, evaluation, approval), executor);
                result.whenComplete((outcome, error) -> {
                    if (result.isCancelled()) {
                        decision.cancel(true);
                    }
                });
                return result;

            default:
                return CompletableFuture.completedFuture(ActionOutcome.blocked(action.actionId(), evaluation));
        }
    }

    // ── Execution ────────────────────────────────────────────────────────────

    private ActionOutcome execute(String agentInstanceId, AgentAction action, ActionContext context,
                                  ContentProducer producer, PermissionEvaluationResult evaluation,
                                  ApprovalOutcome approval) {
        AgentPermissions permissions = permissionService.require(agentInstanceId);

        UsageReservation reservation;
        try {
            reservation = usageTracker.reserve(agentInstanceId, context.sessionId(), context.sessionStartedAt(),
                    action, permissions.usageLimits());
        } catch (UsageLimitExceededException e) {
            PermissionEvaluationResult limited = e.isCostLimit()
                    ? PermissionEvaluationResult.costLimited(e.getMessage(), e.getLimitType(), e.getRemaining(), e.getRetryAfter())
                    : PermissionEvaluationResult.rateLimited(e.getMessage(), e.getLimitType(), e.getRemaining(), e.getRetryAfter());
            return new ActionOutcome(ActionOutcome.Status.BLOCKED, action.actionId(), limited, approval,
                    null, null, limited.reason(), null);
        }

        ProducedContent produced;
        DocumentState state = null;
        try {
            produced = producer.produce(action);
            if (action.type().modifiesDocument()) {
                String documentId = context.documentId() != null ? context.documentId() : permissions.documentId();
                state = documents.apply(documentId, toChange(agentInstanceId, action, context, produced));
            }
        } catch (ConflictUnresolvableException e) {
            usageTracker.release(reservation);
            return new ActionOutcome(ActionOutcome.Status.CONFLICT, action.actionId(), evaluation, approval,
                    null, null, e.getMessage(), null);
        } catch (Exception e) {
            usageTracker.release(reservation);
            log.error("[Agent] Action {} for agent={} failed: {}", action.actionId(), agentInstanceId, e.getMessage(), e);
            return new ActionOutcome(ActionOutcome.Status.FAILED, action.actionId(), evaluation, approval,
                    null, null, e.getMessage(), null);
        }

        // The change is applied and broadcast from here on; bookkeeping failures only get logged.
        try {
            usageTracker.commit(reservation, action, produced.usage());
        } catch (RuntimeException e) {
            log.warn("[Usage] Commit failed for action={} agent={}, edit kept: {}",
                    action.actionId(), agentInstanceId, e.getMessage(), e);
        }

        String violation = checkThresholds(agentInstanceId, permissions, action, context, produced.usage());
        log.info("[Agent] Completed action={} agent={} type={} words={}",
                action.actionId(), agentInstanceId, action.type(), produced.usage().words());
        return new ActionOutcome(ActionOutcome.Status.COMPLETED, action.actionId(), evaluation, approval,
                state, produced.usage(), "Completed", violation);
    }

    private ActionOutcome notApproved(AgentAction action, PermissionEvaluationResult evaluation,
                                      ApprovalOutcome approval) {
        log.info("[Agent] Action {} not run: approval {}", action.actionId(), approval.status());
        return new ActionOutcome(ActionOutcome.Status.REJECTED, action.actionId(), evaluation, approval,
                null, null, "Approval " + approval.status().name().toLowerCase(), null);
    }

    private DocumentChange toChange(String agentInstanceId, AgentAction action, ActionContext context,
                                    ProducedContent produced) {
        ChangeOperation operation = switch (action.type()) {
            case WRITE -> ChangeOperation.INSERT;
            case EDIT -> ChangeOperation.REPLACE;
            case DELETE -> ChangeOperation.DELETE;
            default -> throw new IllegalArgumentException(action.type() + " does not change the document");
        };
        return DocumentChange.builder()
                .operation(operation)
                .position(action.position())
                .length(action.length())
                .content(produced.content())
                .actorId("agent:" + agentInstanceId)
                .timestamp(clock.instant())
                .source(ChangeSource.AGENT)
                .baseVersion(context.documentVersion())
                .build();
    }

    /**
     * Level thresholds are decided on the estimate.  If the real output is
     * larger and would have needed approval, or breaks the per-action cap,
     * that is reported, never undone.
     */
    private String checkThresholds(String agentInstanceId, AgentPermissions permissions, AgentAction action,
                                   ActionContext context, ActualUsage usage) {
        int actualWords = usage.words();
        if (actualWords <= action.estimatedWords()) {
            return null;
        }
        String violation = null;
        if (permissions.maxWordsPerAction() != null && actualWords > permissions.maxWordsPerAction()) {
            violation = "Produced %d words, per-action limit is %d"
                    .formatted(actualWords, permissions.maxWordsPerAction());
        } else {
            PermissionEvaluationResult declared = engine.evaluateLevel(permissions, action, context);
            PermissionEvaluationResult actual = engine.evaluateLevel(permissions,
                    action.withEstimatedWords(actualWords), context);
            if (declared.isAllowed() && !actual.isAllowed()) {
                violation = "Produced %d words against an estimate of %d: %s"
                        .formatted(actualWords, action.estimatedWords(), actual.reason());
            }
        }
        if (violation != null) {
            log.warn("[Agent] Policy violation agent={} action={}: {}", agentInstanceId, action.actionId(), violation);
            notifications.policyViolation(agentInstanceId, action, violation);
        }
        return violation;
    }

    /** The permission's timeout, shortened to the action's deadline when that comes first. */
    private Duration approvalTimeout(AgentAction action, PermissionEvaluationResult evaluation) {
        Duration timeout = evaluation.approvalTimeout();
        if (action.deadline() == null) {
            return timeout;
        }
        Duration untilDeadline = Duration.between(clock.instant(), action.deadline());
        if (untilDeadline.compareTo(Duration.ofSeconds(1)) < 0) {
            return Duration.ofSeconds(1);
        }
        return timeout == null || untilDeadline.compareTo(timeout) < 0 ? untilDeadline : timeout;
    }
}
