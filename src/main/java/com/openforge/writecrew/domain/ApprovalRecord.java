package com.openforge.writecrew.domain;

import com.openforge.writecrew.approval.ApprovalPriority;
import com.openforge.writecrew.approval.ApprovalStatus;
import com.openforge.writecrew.permission.ActionType;
import com.openforge.writecrew.permission.ApprovalScope;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Archived approval request.  Written once, when the request reaches a
 * terminal state; live requests are held in memory only.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "approval_requests",
    uniqueConstraints = @UniqueConstraint(name = "uq_approval_request_id", columnNames = "request_id"),
    indexes = @Index(name = "idx_approval_agent", columnList = "agent_instance_id")
)
public class ApprovalRecord extends BaseEntity {

    @Column(name = "request_id", nullable = false, length = 64)
    private String requestId;

    @Column(name = "agent_instance_id", nullable = false, length = 64)
    private String agentInstanceId;

    @Column(name = "action_id", length = 64)
    private String actionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, length = 32)
    private ActionType actionType;

    @Column(name = "action_description", length = 512)
    private String actionDescription;

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_scope", nullable = false, length = 16)
    private ApprovalScope approvalScope;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 8)
    private ApprovalPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ApprovalStatus status;

    @Column(name = "estimated_words")
    private Integer estimatedWords;

    @Column(name = "estimated_cost_micros")
    private Long estimatedCostMicros;

    @Column(name = "requested_at", nullable = false)
    private Instant requestedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    /** users.id of the responder; null for EXPIRED and WITHDRAWN. */
    @Column(name = "responded_by")
    private Long respondedBy;

    @Column(name = "feedback", columnDefinition = "TEXT")
    private String feedback;
}
