package com.openforge.writecrew.domain;

import com.openforge.writecrew.permission.ActionType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Append-only record of committed agent usage.  Billing reads it; the
 * collaboration core only writes.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "usage_ledger",
    indexes = {
        @Index(name = "idx_usage_agent", columnList = "agent_instance_id"),
        @Index(name = "idx_usage_recorded_at", columnList = "recorded_at")
    }
)
public class UsageLedgerEntry extends BaseEntity {

    @Column(name = "agent_instance_id", nullable = false, length = 64)
    private String agentInstanceId;

    @Column(name = "session_id", length = 64)
    private String sessionId;

    @Column(name = "action_id", length = 64)
    private String actionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", length = 32)
    private ActionType actionType;

    @Column(name = "words", nullable = false)
    private int words;

    @Column(name = "tokens", nullable = false)
    private long tokens;

    @Column(name = "cost_micros", nullable = false)
    private long costMicros;

    @Column(name = "provider", length = 64)
    private String provider;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;
}
