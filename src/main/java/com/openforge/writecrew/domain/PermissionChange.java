package com.openforge.writecrew.domain;

import com.openforge.writecrew.permission.AutonomyLevel;
import jakarta.persistence.*;
import lombok.*;

/**
 * Audit row written on every permission update.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "permission_changes",
    indexes = @Index(name = "idx_permission_changes_agent", columnList = "agent_instance_id")
)
public class PermissionChange extends BaseEntity {

    @Column(name = "agent_instance_id", nullable = false, length = 64)
    private String agentInstanceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_level", length = 32)
    private AutonomyLevel previousLevel;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_level", nullable = false, length = 32)
    private AutonomyLevel newLevel;

    /** users.id of whoever made the change. */
    @Column(name = "updated_by", nullable = false)
    private Long updatedBy;

    /** JSON of the full permission set after the change. */
    @Column(name = "snapshot_json", columnDefinition = "TEXT")
    private String snapshotJson;
}
