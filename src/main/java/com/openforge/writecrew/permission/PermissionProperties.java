package com.openforge.writecrew.permission;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Permission engine tuning.
 *
 * Reads from application.yml under the "writecrew.permission" prefix:
 *
 * writecrew:
 *   permission:
 *     cache-ttl: 5m
 *     minor-edit-threshold: 50
 *     section-threshold: 500
 *     daily-reset-hour-utc: 0
 *     session-window: 8h
 *     default-approval-timeout-minutes: 5
 *     rejection-escalation-threshold: 3
 *
 * @param minorEditThreshold   COLLABORATIVE: edits up to this many words may be auto-approved
 * @param sectionThreshold     SEMI_AUTONOMOUS: writes/edits up to this many words need no approval
 * @param sessionWindow        maximum session length; the session counters roll after it
 * @param rejectionEscalationThreshold consecutive rejections above which escalation is suggested
 */
@ConfigurationProperties(prefix = "writecrew.permission")
public record PermissionProperties(
        @DefaultValue("5m")  Duration cacheTtl,
        @DefaultValue("50")  int      minorEditThreshold,
        @DefaultValue("500") int      sectionThreshold,
        @DefaultValue("0")   int      dailyResetHourUtc,
        @DefaultValue("8h")  Duration sessionWindow,
        @DefaultValue("5")   int      defaultApprovalTimeoutMinutes,
        @DefaultValue("3")   int      rejectionEscalationThreshold
) {

    /** Defaults, for tests and manual wiring. */
    public static PermissionProperties defaults() {
        return new PermissionProperties(Duration.ofMinutes(5), 50, 500, 0, Duration.ofHours(8), 5, 3);
    }
}
