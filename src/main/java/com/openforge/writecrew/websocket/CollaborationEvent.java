package com.openforge.writecrew.websocket;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.writecrew.approval.ApprovalOutcome;
import com.openforge.writecrew.approval.ApprovalRequest;
import com.openforge.writecrew.approval.ApprovalStatus;
import com.openforge.writecrew.document.ChangeOperation;
import com.openforge.writecrew.document.DocumentChange;
import com.openforge.writecrew.document.DocumentState;
import com.openforge.writecrew.permission.AgentPermissions;
import com.openforge.writecrew.permission.ApprovalScope;
import com.openforge.writecrew.permission.AutonomyLevel;

import java.time.Instant;

/**
 * The single event envelope broadcast over WebSocket.
 *
 * Fields:
 *   destination  : STOMP topic the event goes to; not serialized
 *   type         : discriminator, snake_case on the wire
 *   payload      : one of the nested payload records
 *   timestamp    : epoch millis at publish time
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CollaborationEvent(
        @JsonIgnore String destination,
        EventType          type,
        Object             payload,
        long               timestamp
) {

    static final String DOCUMENT_TOPIC = "/topic/documents/";
    static final String AGENT_TOPIC    = "/topic/agents/";

    // ── Static factory helpers ───────────────────────────────────────────────

    public static CollaborationEvent documentChange(DocumentChange change, DocumentState state) {
        return new CollaborationEvent(DOCUMENT_TOPIC + state.documentId(), EventType.DOCUMENT_CHANGE,
                new DocumentChangePayload(change.changeId(), change.actorId(), change.operation(),
                        change.position(), change.length(), change.content(),
                        change.timestamp() != null ? change.timestamp() : state.lastModifiedAt(),
                        state.version()),
                now());
    }

    public static CollaborationEvent approvalRequest(ApprovalRequest request) {
        return new CollaborationEvent(AGENT_TOPIC + request.agentInstanceId(), EventType.APPROVAL_REQUEST,
                new ApprovalRequestPayload(request.requestId(), request.agentInstanceId(),
                        request.action().type().name(), request.action().summary(), request.scope(),
                        request.expiresAt(), request.action().estimatedCostMicros(),
                        request.priority().name(), request.impact().riskLevel().name()),
                now());
    }

    public static CollaborationEvent approvalResolved(ApprovalOutcome outcome) {
        return new CollaborationEvent(AGENT_TOPIC + outcome.agentInstanceId(), EventType.APPROVAL_RESOLVED,
                new ApprovalResolvedPayload(outcome.requestId(), outcome.status(), outcome.respondedBy(),
                        outcome.feedback(), outcome.decidedAt()),
                now());
    }

    public static CollaborationEvent permissionsChanged(AgentPermissions previous, AgentPermissions current,
                                                        Long updatedBy) {
        return new CollaborationEvent(AGENT_TOPIC + current.agentInstanceId(), EventType.PERMISSIONS_CHANGED,
                new PermissionsChangedPayload(current.agentInstanceId(),
                        previous == null ? null : previous.autonomyLevel(),
                        current.autonomyLevel(), current.approvalScope(), updatedBy),
                now());
    }

    public static CollaborationEvent escalation(String agentInstanceId, int consecutiveRejections) {
        return new CollaborationEvent(AGENT_TOPIC + agentInstanceId, EventType.ESCALATION,
                new EscalationPayload(agentInstanceId, consecutiveRejections), now());
    }

    public static CollaborationEvent policyViolation(String agentInstanceId, String actionId, String reason) {
        return new CollaborationEvent(AGENT_TOPIC + agentInstanceId, EventType.POLICY_VIOLATION,
                new PolicyViolationPayload(agentInstanceId, actionId, reason), now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }

    // ── Nested payload types ─────────────────────────────────────────────────

    public record DocumentChangePayload(String changeId, String actorId, ChangeOperation operation,
                                        int position, int length, String content, Instant timestamp,
                                        long version) {}

    /** estimatedCost is in micro-dollars. */
    public record ApprovalRequestPayload(String requestId, String agentId, String actionType,
                                         String actionDescription, ApprovalScope approvalScope,
                                         Instant expiresAt, long estimatedCost,
                                         String priority, String riskLevel) {}

    public record ApprovalResolvedPayload(String requestId, ApprovalStatus status, Long respondedBy,
                                          String feedback, Instant decidedAt) {}

    public record PermissionsChangedPayload(String agentId, AutonomyLevel previousLevel, AutonomyLevel newLevel,
                                            ApprovalScope approvalScope, Long updatedBy) {}

    public record EscalationPayload(String agentId, int consecutiveRejections) {}

    public record PolicyViolationPayload(String agentId, String actionId, String reason) {}
}
