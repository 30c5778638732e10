package com.openforge.writecrew.approval;

import com.openforge.writecrew.permission.AgentAction;
import com.openforge.writecrew.permission.ApprovalScope;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A live approval request held by {@link ApprovalWorkflowManager}.
 *
 * Status moves from PENDING to a terminal state exactly once, through
 * {@link #transition}.  Whoever wins the CAS fills in the resolution
 * fields and completes the decision future; losers touch nothing.
 */
public final class ApprovalRequest {

    private final String           requestId;
    private final String           agentInstanceId;
    private final AgentAction      action;
    private final ApprovalScope    scope;
    private final ApprovalPriority priority;
    private final ImpactEstimate   impact;
    private final Instant          createdAt;
    private final Instant          expiresAt;

    private final AtomicReference<ApprovalStatus>     status   = new AtomicReference<>(ApprovalStatus.PENDING);
    private final CompletableFuture<ApprovalOutcome>  decision = new CompletableFuture<>();

    private volatile ScheduledFuture<?> expiryTask;
    private volatile Long               respondedBy;
    private volatile String             feedback;
    private volatile Instant            resolvedAt;

    ApprovalRequest(String requestId, String agentInstanceId, AgentAction action, ApprovalScope scope,
                    Instant createdAt, Instant expiresAt) {
        this.requestId       = requestId;
        this.agentInstanceId = agentInstanceId;
        this.action          = action;
        this.scope           = scope;
        this.priority        = ApprovalPriority.of(action);
        this.impact          = ImpactEstimate.of(action);
        this.createdAt       = createdAt;
        this.expiresAt       = expiresAt;
    }

    public String requestId()           { return requestId; }
    public String agentInstanceId()     { return agentInstanceId; }
    public AgentAction action()         { return action; }
    public ApprovalScope scope()        { return scope; }
    public ApprovalPriority priority()  { return priority; }
    public ImpactEstimate impact()      { return impact; }
    public Instant createdAt()          { return createdAt; }
    public Instant expiresAt()          { return expiresAt; }
    public ApprovalStatus status()      { return status.get(); }
    public Long respondedBy()           { return respondedBy; }
    public String feedback()            { return feedback; }
    public Instant resolvedAt()         { return resolvedAt; }

    public boolean isPending() {
        return status.get() == ApprovalStatus.PENDING;
    }

    public boolean isOverdue(Instant now) {
        return now.isAfter(expiresAt);
    }

    // ── Manager-only state changes ───────────────────────────────────────────

    boolean transition(ApprovalStatus target) {
        return status.compareAndSet(ApprovalStatus.PENDING, target);
    }

    void resolve(Long respondedBy, String feedback, Instant resolvedAt) {
        this.respondedBy = respondedBy;
        this.feedback    = feedback;
        this.resolvedAt  = resolvedAt;
        ScheduledFuture<?> task = expiryTask;
        if (task != null) {
            task.cancel(false);
        }
    }

    void expiryTask(ScheduledFuture<?> task) {
        this.expiryTask = task;
    }

    CompletableFuture<ApprovalOutcome> decision() {
        return decision;
    }
}
