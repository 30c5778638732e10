package com.openforge.writecrew.permission;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Immutable outcome of {@link PermissionEngine#evaluate}.
 *
 * Every non-ALLOWED result carries a human-readable reason; rate and cost
 * limits also carry the remaining budget and a retry-after so the calling
 * agent can wait, shrink the request or give up.
 *
 * @param remainingBudget words for RATE_LIMITED, micro-dollars for COST_LIMITED
 * @param limitType       which limit tripped, e.g. "session_words" or "daily_cost"
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PermissionEvaluationResult(
        PermissionDecision decision,
        String             reason,
        ApprovalScope      approvalScope,
        @JsonIgnore Duration approvalTimeout,
        @JsonIgnore Duration retryAfter,
        Long               remainingBudget,
        String             limitType
) {

    // ── Static factory helpers ───────────────────────────────────────────────

    public static PermissionEvaluationResult allowed(String reason) {
        return new PermissionEvaluationResult(PermissionDecision.ALLOWED, reason, null, null, null, null, null);
    }

    public static PermissionEvaluationResult denied(String reason) {
        return new PermissionEvaluationResult(PermissionDecision.DENIED, reason, null, null, null, null, null);
    }

    public static PermissionEvaluationResult denied(String reason, String limitType, long remaining) {
        return new PermissionEvaluationResult(PermissionDecision.DENIED, reason, null, null, null, remaining, limitType);
    }

    public static PermissionEvaluationResult requiresApproval(String reason, ApprovalScope scope, Duration timeout) {
        return new PermissionEvaluationResult(PermissionDecision.REQUIRES_APPROVAL, reason, scope, timeout, null, null, null);
    }

    public static PermissionEvaluationResult rateLimited(String reason, String limitType, long remainingWords, Duration retryAfter) {
        return new PermissionEvaluationResult(PermissionDecision.RATE_LIMITED, reason, null, null,
                atLeastOneSecond(retryAfter), remainingWords, limitType);
    }

    public static PermissionEvaluationResult costLimited(String reason, String limitType, long remainingMicros, Duration retryAfter) {
        return new PermissionEvaluationResult(PermissionDecision.COST_LIMITED, reason, null, null,
                atLeastOneSecond(retryAfter), remainingMicros, limitType);
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    @JsonIgnore
    public boolean isAllowed() {
        return decision == PermissionDecision.ALLOWED;
    }

    @JsonIgnore
    public boolean needsApproval() {
        return decision == PermissionDecision.REQUIRES_APPROVAL;
    }

    @JsonProperty("retryAfterSeconds")
    public Long retryAfterSeconds() {
        return retryAfter == null ? null : retryAfter.toSeconds();
    }

    @JsonProperty("approvalTimeoutMinutes")
    public Long approvalTimeoutMinutes() {
        return approvalTimeout == null ? null : approvalTimeout.toMinutes();
    }

    private static Duration atLeastOneSecond(Duration d) {
        if (d == null || d.compareTo(Duration.ofSeconds(1)) < 0) {
            return Duration.ofSeconds(1);
        }
        return d;
    }
}
