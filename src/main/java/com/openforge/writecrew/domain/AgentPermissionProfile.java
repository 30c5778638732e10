package com.openforge.writecrew.domain;

import com.openforge.writecrew.permission.ApprovalScope;
import com.openforge.writecrew.permission.AutonomyLevel;
import com.openforge.writecrew.permission.ContentFilterLevel;
import jakarta.persistence.*;
import lombok.*;

/**
 * Stored permission profile for one agent instance attached to one document.
 *
 * Mutable JPA state; the rest of the service only ever sees the immutable
 * {@link com.openforge.writecrew.permission.AgentPermissions} built from it.
 *
 * Limit columns are nullable: null means "no limit".  Cost limits are in
 * micro-dollars.  Working hours are UTC hours [start, end) and may wrap
 * past midnight (start=22, end=6).
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "agent_permissions",
    uniqueConstraints = @UniqueConstraint(name = "uq_agent_instance", columnNames = "agent_instance_id")
)
public class AgentPermissionProfile extends BaseEntity {

    @Column(name = "agent_instance_id", nullable = false, length = 64)
    private String agentInstanceId;

    @Column(name = "document_id", nullable = false, length = 64)
    private String documentId;

    /** FK to users.id: the human who attached the agent. */
    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "autonomy_level", nullable = false, length = 32)
    private AutonomyLevel autonomyLevel;

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_scope", nullable = false, length = 16)
    private ApprovalScope approvalScope;

    // ── Capabilities ─────────────────────────────────────────────────────────

    @Column(name = "can_write", nullable = false)
    private boolean canWrite;

    @Column(name = "can_edit", nullable = false)
    private boolean canEdit;

    @Column(name = "can_delete", nullable = false)
    private boolean canDelete;

    @Column(name = "can_research", nullable = false)
    private boolean canResearch;

    @Column(name = "can_generate_images", nullable = false)
    private boolean canGenerateImages;

    @Column(name = "can_generate_audio", nullable = false)
    private boolean canGenerateAudio;

    @Column(name = "can_use_external_apis", nullable = false)
    private boolean canUseExternalApis;

    // ── Limits ───────────────────────────────────────────────────────────────

    @Column(name = "max_words_per_action")
    private Integer maxWordsPerAction;

    @Column(name = "max_words_per_session")
    private Integer maxWordsPerSession;

    @Column(name = "max_words_per_day")
    private Integer maxWordsPerDay;

    @Column(name = "max_cost_per_action_micros")
    private Long maxCostPerActionMicros;

    @Column(name = "max_cost_per_session_micros")
    private Long maxCostPerSessionMicros;

    @Column(name = "max_cost_per_day_micros")
    private Long maxCostPerDayMicros;

    @Column(name = "working_hours_start_utc")
    private Integer workingHoursStartUtc;

    @Column(name = "working_hours_end_utc")
    private Integer workingHoursEndUtc;

    // ── Behaviour ────────────────────────────────────────────────────────────

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "content_filter_level", nullable = false, length = 16)
    private ContentFilterLevel contentFilterLevel = ContentFilterLevel.STANDARD;

    @Builder.Default
    @Column(name = "approval_timeout_minutes", nullable = false)
    private Integer approvalTimeoutMinutes = 5;

    @Column(name = "auto_approve_minor_edits", nullable = false)
    private boolean autoApproveMinorEdits;

    /** Comma-separated provider ids in preference order, e.g. "openai,anthropic". */
    @Column(name = "provider_preferences", length = 512)
    private String providerPreferences;
}
