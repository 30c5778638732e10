package com.openforge.writecrew.approval;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.openforge.writecrew.domain.ApprovalRecord;
import com.openforge.writecrew.permission.AgentAction;
import com.openforge.writecrew.permission.AgentPermissionService;
import com.openforge.writecrew.permission.AgentPermissions;
import com.openforge.writecrew.permission.ApprovalScope;
import com.openforge.writecrew.permission.PermissionProperties;
import com.openforge.writecrew.permission.PermissionsChangedEvent;
import com.openforge.writecrew.repository.ApprovalRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Time-boxed human approval for agent actions.
 *
 * Lifecycle of one request:
 *
 *   requestApproval()  → PENDING, sink notified, expiry timer armed
 *     ├─ respond(approve)   → APPROVED
 *     ├─ respond(reject)    → REJECTED
 *     ├─ timer / sweep      → EXPIRED
 *     └─ withdraw / cancel  → WITHDRAWN
 *
 * Every exit goes through {@link #finish}, guarded by the request's status
 * CAS, so exactly one of them wins.  The winner archives the request,
 * notifies the sink and completes the decision future.
 */
@Slf4j
@Service
public class ApprovalWorkflowManager {

    static final String CANCELLED_BY_CALLER = "Cancelled by caller";
    static final String LEVEL_INCREASED     = "Permission level increased";

    private final ApprovalRecordRepository          archive;
    private final AgentPermissionService            permissionService;
    private final NotificationSink                  notifications;
    private final TaskScheduler                     scheduler;
    private final Clock                             clock;
    private final PermissionProperties              properties;

    private final Map<String, ApprovalRequest>      pending              = new ConcurrentHashMap<>();
    private final Cache<String, AtomicInteger>      rejectionStreaks;
    private final Cache<String, ApprovalRequest>    recentlyResolved;

    public ApprovalWorkflowManager(ApprovalRecordRepository archive,
                                   AgentPermissionService permissionService,
                                   NotificationSink notifications,
                                   @Qualifier("approvalScheduler") TaskScheduler scheduler,
                                   Clock clock,
                                   PermissionProperties properties) {
        this.archive           = archive;
        this.permissionService = permissionService;
        this.notifications     = notifications;
        this.scheduler         = scheduler;
        this.clock             = clock;
        this.properties        = properties;
        this.recentlyResolved  = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofHours(1))
                .maximumSize(10_000)
                .build();
        // An agent idle for a day starts a fresh streak.
        this.rejectionStreaks  = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofDays(1))
                .build();
    }

    // ── Create & wait ────────────────────────────────────────────────────────

    /**
     * Opens a request and pushes it to the notification sink before returning.
     *
     * @param timeout null means the agent's approvalTimeoutMinutes
     * @return the request id
     */
    public String requestApproval(String agentInstanceId, AgentAction action, ApprovalScope scope, Duration timeout) {
        Duration effective = timeout != null ? timeout : defaultTimeout(agentInstanceId);
        if (effective.isZero() || effective.isNegative()) {
            throw new IllegalArgumentException("Approval timeout must be positive: " + effective);
        }

        Instant now = clock.instant();
        ApprovalRequest request = new ApprovalRequest(
                UUID.randomUUID().toString(), agentInstanceId, action,
                scope != null ? scope : ApprovalScope.ACTION,
                now, now.plus(effective));
        pending.put(request.requestId(), request);

        notifications.approvalRequested(request);
        request.expiryTask(scheduler.schedule(() -> expire(request.requestId()), request.expiresAt()));

        log.info("[Approval] Requested id={} agent={} action={} scope={} priority={} expiresAt={}",
                request.requestId(), agentInstanceId, action.type(), request.scope(),
                request.priority(), request.expiresAt());
        return request.requestId();
    }

    /**
     * Future that completes with the decision.  Cancelling it withdraws the
     * request; other waiters on the same request see WITHDRAWN.
     */
    public CompletableFuture<ApprovalOutcome> awaitDecision(String requestId) {
        ApprovalRequest request = pending.get(requestId);
        if (request == null) {
            ApprovalRequest resolved = recentlyResolved.getIfPresent(requestId);
            if (resolved == null) {
                throw new ApprovalNotFoundException(requestId);
            }
            return resolved.decision().thenApply(outcome -> outcome);
        }

        CompletableFuture<ApprovalOutcome> handle = new CompletableFuture<>();
        request.decision().whenComplete((outcome, error) -> {
            if (error != null) {
                handle.completeExceptionally(error);
            } else {
                handle.complete(outcome);
            }
        });
        handle.whenComplete((outcome, error) -> {
            if (handle.isCancelled() && request.isPending()) {
                finish(request, ApprovalStatus.WITHDRAWN, null, CANCELLED_BY_CALLER);
            }
        });
        return handle;
    }

    // ── Resolve ──────────────────────────────────────────────────────────────

    /**
     * Records a human decision.
     *
     * @throws ApprovalNotFoundException        unknown id
     * @throws ApprovalExpiredException         the deadline has passed
     * @throws ApprovalAlreadyResolvedException the request is no longer pending
     */
    public ApprovalResponse respond(String requestId, Long userId, boolean approved, String feedback) {
        ApprovalRequest request = pending.get(requestId);
        if (request == null) {
            throw notPending(requestId);
        }
        if (request.isOverdue(clock.instant())) {
            expire(requestId);
            throw new ApprovalExpiredException(requestId, request.expiresAt());
        }

        ApprovalOutcome outcome = finish(request, approved ? ApprovalStatus.APPROVED : ApprovalStatus.REJECTED,
                userId, feedback);
        if (outcome == null) {
            throw notPending(requestId);
        }
        return ApprovalResponse.from(outcome);
    }

    /**
     * Withdraws a pending request.
     *
     * @throws ApprovalNotFoundException        unknown id
     * @throws ApprovalAlreadyResolvedException the request is no longer pending
     */
    public ApprovalOutcome withdraw(String requestId, String reason) {
        ApprovalRequest request = pending.get(requestId);
        ApprovalOutcome outcome = request == null ? null
                : finish(request, ApprovalStatus.WITHDRAWN, null, reason);
        if (outcome == null) {
            throw notPending(requestId);
        }
        return outcome;
    }

    /** Withdraws every pending request of one agent. */
    public int withdrawAll(String agentInstanceId, String reason) {
        int withdrawn = 0;
        for (ApprovalRequest request : List.copyOf(pending.values())) {
            if (request.agentInstanceId().equals(agentInstanceId)
                    && finish(request, ApprovalStatus.WITHDRAWN, null, reason) != null) {
                withdrawn++;
            }
        }
        if (withdrawn > 0) {
            log.info("[Approval] Withdrew {} pending requests for agent={}: {}", withdrawn, agentInstanceId, reason);
        }
        return withdrawn;
    }

    @EventListener
    public void onPermissionsChanged(PermissionsChangedEvent event) {
        if (event.autonomyIncreased()) {
            withdrawAll(event.agentInstanceId(), LEVEL_INCREASED);
        }
    }

    /** Timer callback; also the safety-net sweep target. */
    void expire(String requestId) {
        ApprovalRequest request = pending.get(requestId);
        if (request != null) {
            finish(request, ApprovalStatus.EXPIRED, null, "No response before " + request.expiresAt());
        }
    }

    /** Catches requests whose timer was lost, e.g. to a saturated scheduler. */
    @Scheduled(fixedDelayString = "${writecrew.permission.expiry-sweep-interval:PT30S}")
    public int expireOverdue() {
        Instant now = clock.instant();
        int expired = 0;
        for (ApprovalRequest request : List.copyOf(pending.values())) {
            if (request.isOverdue(now)
                    && finish(request, ApprovalStatus.EXPIRED, null, "No response before " + request.expiresAt()) != null) {
                expired++;
            }
        }
        return expired;
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    /** Pending requests, highest priority first, then oldest first. */
    public List<ApprovalRequest> pending(String agentInstanceId) {
        return pending.values().stream()
                .filter(r -> agentInstanceId == null || r.agentInstanceId().equals(agentInstanceId))
                .filter(ApprovalRequest::isPending)
                .sorted(Comparator.comparing(ApprovalRequest::priority).reversed()
                        .thenComparing(ApprovalRequest::createdAt))
                .toList();
    }

    public Optional<ApprovalRequest> find(String requestId) {
        ApprovalRequest request = pending.get(requestId);
        return Optional.ofNullable(request != null ? request : recentlyResolved.getIfPresent(requestId));
    }

    /** Archived requests, newest first. */
    public List<ApprovalRecord> history(String agentInstanceId, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        return agentInstanceId == null
                ? archive.findAllByOrderByResolvedAtDesc(page)
                : archive.findByAgentInstanceIdOrderByResolvedAtDesc(agentInstanceId, page);
    }

    public ApprovalStats stats() {
        Map<ApprovalStatus, Long> archived = new EnumMap<>(ApprovalStatus.class);
        for (ApprovalStatus status : ApprovalStatus.values()) {
            if (status.isTerminal()) {
                archived.put(status, archive.countByStatus(status));
            }
        }
        List<ApprovalRequest> open = pending(null);
        int activeAgents = (int) open.stream().map(ApprovalRequest::agentInstanceId).distinct().count();
        return new ApprovalStats(open.size(), archived, activeAgents);
    }

    public int consecutiveRejections(String agentInstanceId) {
        AtomicInteger streak = rejectionStreaks.getIfPresent(agentInstanceId);
        return streak == null ? 0 : streak.get();
    }

    // ── Internals ────────────────────────────────────────────────────────────

    /**
     * Single exit point.  Returns null when another path already resolved
     * the request, in which case nothing is touched.
     */
    private ApprovalOutcome finish(ApprovalRequest request, ApprovalStatus status, Long userId, String feedback) {
        if (!request.transition(status)) {
            return null;
        }
        Instant now = clock.instant();
        request.resolve(userId, feedback, now);
        pending.remove(request.requestId());
        recentlyResolved.put(request.requestId(), request);

        int streak = updateStreak(request.agentInstanceId(), status);
        boolean escalate = status.isRejection() && streak > properties.rejectionEscalationThreshold();

        ApprovalOutcome outcome = new ApprovalOutcome(request.requestId(), request.agentInstanceId(), status,
                userId, feedback, now, streak, escalate);

        archive(request);
        notifications.approvalResolved(request, outcome);
        if (escalate) {
            log.warn("[Approval] Escalation suggested for agent={} after {} consecutive rejections",
                    request.agentInstanceId(), streak);
            notifications.escalationSuggested(request.agentInstanceId(), streak);
        }
        request.decision().complete(outcome);

        log.info("[Approval] Resolved id={} agent={} status={} by={}",
                request.requestId(), request.agentInstanceId(), status, userId);
        return outcome;
    }

    private int updateStreak(String agentInstanceId, ApprovalStatus status) {
        AtomicInteger streak = rejectionStreaks.get(agentInstanceId, id -> new AtomicInteger());
        if (status == ApprovalStatus.APPROVED) {
            streak.set(0);
            return 0;
        }
        if (status.isRejection()) {
            return streak.incrementAndGet();
        }
        return streak.get();
    }

    private void archive(ApprovalRequest request) {
        AgentAction action = request.action();
        try {
            archive.save(ApprovalRecord.builder()
                    .requestId(request.requestId())
                    .agentInstanceId(request.agentInstanceId())
                    .actionId(action.actionId())
                    .actionType(action.type())
                    .actionDescription(truncate(action.summary(), 512))
                    .approvalScope(request.scope())
                    .priority(request.priority())
                    .status(request.status())
                    .estimatedWords(action.estimatedWords())
                    .estimatedCostMicros(action.estimatedCostMicros())
                    .requestedAt(request.createdAt())
                    .expiresAt(request.expiresAt())
                    .resolvedAt(request.resolvedAt())
                    .respondedBy(request.respondedBy())
                    .feedback(request.feedback())
                    .build());
        } catch (DataAccessException e) {
            log.error("[Approval] Failed to archive request id={}: {}", request.requestId(), e.getMessage());
        }
    }

    private RuntimeException notPending(String requestId) {
        ApprovalRequest resolved = recentlyResolved.getIfPresent(requestId);
        ApprovalStatus status = resolved != null ? resolved.status()
                : archive.findByRequestId(requestId).map(ApprovalRecord::getStatus).orElse(null);
        if (status == null) {
            return new ApprovalNotFoundException(requestId);
        }
        if (status == ApprovalStatus.EXPIRED) {
            Instant expiresAt = resolved != null ? resolved.expiresAt()
                    : archive.findByRequestId(requestId).map(ApprovalRecord::getExpiresAt).orElse(null);
            return new ApprovalExpiredException(requestId, expiresAt);
        }
        return new ApprovalAlreadyResolvedException(requestId, status);
    }

    private Duration defaultTimeout(String agentInstanceId) {
        return permissionService.find(agentInstanceId)
                .map(AgentPermissions::approvalTimeout)
                .orElse(Duration.ofMinutes(properties.defaultApprovalTimeoutMinutes()));
    }

    private static String truncate(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }
}
