package com.openforge.writecrew.permission;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.writecrew.domain.AgentPermissionProfile;
import com.openforge.writecrew.usage.UsageLimits;
import lombok.Builder;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable view of an agent instance's permissions, as cached by
 * {@link AgentPermissionService} and read by {@link PermissionEngine}.
 *
 * Null limits mean "unlimited".  Cost limits are micro-dollars.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentPermissions(
        String             agentInstanceId,
        String             documentId,
        Long               ownerId,
        AutonomyLevel      autonomyLevel,
        ApprovalScope      approvalScope,
        boolean            canWrite,
        boolean            canEdit,
        boolean            canDelete,
        boolean            canResearch,
        boolean            canGenerateImages,
        boolean            canGenerateAudio,
        boolean            canUseExternalApis,
        Integer            maxWordsPerAction,
        Integer            maxWordsPerSession,
        Integer            maxWordsPerDay,
        Long               maxCostPerActionMicros,
        Long               maxCostPerSessionMicros,
        Long               maxCostPerDayMicros,
        Integer            workingHoursStartUtc,
        Integer            workingHoursEndUtc,
        ContentFilterLevel contentFilterLevel,
        int                approvalTimeoutMinutes,
        boolean            autoApproveMinorEdits,
        List<String>       providerPreferences
) {

    public AgentPermissions {
        providerPreferences = providerPreferences == null ? List.of() : List.copyOf(providerPreferences);
        if (contentFilterLevel == null) {
            contentFilterLevel = ContentFilterLevel.STANDARD;
        }
    }

    /**
     * Fills the approval scope from the autonomy level when it is absent and
     * the approval timeout when it is unset.
     */
    public AgentPermissions withDefaults(int defaultApprovalTimeoutMinutes) {
        AgentPermissions p = this;
        if (p.approvalScope == null && p.autonomyLevel != null) {
            p = p.toBuilder().approvalScope(p.autonomyLevel.defaultScope()).build();
        }
        if (p.approvalTimeoutMinutes <= 0) {
            p = p.toBuilder().approvalTimeoutMinutes(defaultApprovalTimeoutMinutes).build();
        }
        return p;
    }

    /**
     * @throws InvalidPermissionsException on the first violated invariant
     */
    public AgentPermissions validate() {
        if (autonomyLevel == null) {
            throw new InvalidPermissionsException("autonomyLevel is required");
        }
        if (approvalScope == null) {
            throw new InvalidPermissionsException("approvalScope is required");
        }
        if (!autonomyLevel.accepts(approvalScope)) {
            throw new InvalidPermissionsException(
                    "approval scope %s is wider than %s allows (max %s)"
                            .formatted(approvalScope, autonomyLevel, autonomyLevel.defaultScope()));
        }
        if (approvalTimeoutMinutes <= 0) {
            throw new InvalidPermissionsException("approvalTimeoutMinutes must be positive");
        }
        requireNonNegative("maxWordsPerAction", maxWordsPerAction);
        requireNonNegative("maxWordsPerSession", maxWordsPerSession);
        requireNonNegative("maxWordsPerDay", maxWordsPerDay);
        requireNonNegative("maxCostPerActionMicros", maxCostPerActionMicros);
        requireNonNegative("maxCostPerSessionMicros", maxCostPerSessionMicros);
        requireNonNegative("maxCostPerDayMicros", maxCostPerDayMicros);
        if (maxWordsPerSession != null && maxWordsPerDay != null && maxWordsPerSession > maxWordsPerDay) {
            throw new InvalidPermissionsException("maxWordsPerSession must not exceed maxWordsPerDay");
        }
        if (maxCostPerSessionMicros != null && maxCostPerDayMicros != null
                && maxCostPerSessionMicros > maxCostPerDayMicros) {
            throw new InvalidPermissionsException("maxCostPerSession must not exceed maxCostPerDay");
        }
        if ((workingHoursStartUtc == null) != (workingHoursEndUtc == null)) {
            throw new InvalidPermissionsException("working hours need both a start and an end hour");
        }
        if (workingHoursStartUtc != null
                && (outOfDay(workingHoursStartUtc) || outOfDay(workingHoursEndUtc))) {
            throw new InvalidPermissionsException("working hours must be within 0..23");
        }
        return this;
    }

    /** Capability flag for the action type. */
    public boolean permits(ActionType type) {
        return switch (type) {
            case WRITE          -> canWrite;
            case EDIT           -> canEdit;
            case DELETE         -> canDelete;
            case RESEARCH       -> canResearch;
            case GENERATE_IMAGE -> canGenerateImages;
            case GENERATE_AUDIO -> canGenerateAudio;
            case EXTERNAL_API   -> canUseExternalApis;
        };
    }

    /**
     * Working hours are [start, end) in UTC.  start > end wraps past
     * midnight; start == end means the whole day.  No window configured
     * means always.
     */
    public boolean withinWorkingHours(Instant now) {
        if (workingHoursStartUtc == null || workingHoursEndUtc == null) {
            return true;
        }
        int hour = now.atZone(ZoneOffset.UTC).getHour();
        int start = workingHoursStartUtc;
        int end = workingHoursEndUtc;
        if (start == end) {
            return true;
        }
        if (start < end) {
            return hour >= start && hour < end;
        }
        return hour >= start || hour < end;
    }

    @JsonIgnore
    public Duration approvalTimeout() {
        return Duration.ofMinutes(approvalTimeoutMinutes);
    }

    @JsonIgnore
    public UsageLimits usageLimits() {
        return new UsageLimits(maxWordsPerSession, maxWordsPerDay, maxCostPerSessionMicros, maxCostPerDayMicros);
    }

    // ── Entity mapping ───────────────────────────────────────────────────────

    public static AgentPermissions from(AgentPermissionProfile p) {
        return AgentPermissions.builder()
                .agentInstanceId(p.getAgentInstanceId())
                .documentId(p.getDocumentId())
                .ownerId(p.getOwnerId())
                .autonomyLevel(p.getAutonomyLevel())
                .approvalScope(p.getApprovalScope())
                .canWrite(p.isCanWrite())
                .canEdit(p.isCanEdit())
                .canDelete(p.isCanDelete())
                .canResearch(p.isCanResearch())
                .canGenerateImages(p.isCanGenerateImages())
                .canGenerateAudio(p.isCanGenerateAudio())
                .canUseExternalApis(p.isCanUseExternalApis())
                .maxWordsPerAction(p.getMaxWordsPerAction())
                .maxWordsPerSession(p.getMaxWordsPerSession())
                .maxWordsPerDay(p.getMaxWordsPerDay())
                .maxCostPerActionMicros(p.getMaxCostPerActionMicros())
                .maxCostPerSessionMicros(p.getMaxCostPerSessionMicros())
                .maxCostPerDayMicros(p.getMaxCostPerDayMicros())
                .workingHoursStartUtc(p.getWorkingHoursStartUtc())
                .workingHoursEndUtc(p.getWorkingHoursEndUtc())
                .contentFilterLevel(p.getContentFilterLevel())
                .approvalTimeoutMinutes(p.getApprovalTimeoutMinutes() == null ? 0 : p.getApprovalTimeoutMinutes())
                .autoApproveMinorEdits(p.isAutoApproveMinorEdits())
                .providerPreferences(splitProviders(p.getProviderPreferences()))
                .build();
    }

    /** Copies every field except identity and ownership onto the entity. */
    public void copyInto(AgentPermissionProfile p) {
        p.setAutonomyLevel(autonomyLevel);
        p.setApprovalScope(approvalScope);
        p.setCanWrite(canWrite);
        p.setCanEdit(canEdit);
        p.setCanDelete(canDelete);
        p.setCanResearch(canResearch);
        p.setCanGenerateImages(canGenerateImages);
        p.setCanGenerateAudio(canGenerateAudio);
        p.setCanUseExternalApis(canUseExternalApis);
        p.setMaxWordsPerAction(maxWordsPerAction);
        p.setMaxWordsPerSession(maxWordsPerSession);
        p.setMaxWordsPerDay(maxWordsPerDay);
        p.setMaxCostPerActionMicros(maxCostPerActionMicros);
        p.setMaxCostPerSessionMicros(maxCostPerSessionMicros);
        p.setMaxCostPerDayMicros(maxCostPerDayMicros);
        p.setWorkingHoursStartUtc(workingHoursStartUtc);
        p.setWorkingHoursEndUtc(workingHoursEndUtc);
        p.setContentFilterLevel(contentFilterLevel);
        p.setApprovalTimeoutMinutes(approvalTimeoutMinutes);
        p.setAutoApproveMinorEdits(autoApproveMinorEdits);
        p.setProviderPreferences(providerPreferences.isEmpty() ? null : String.join(",", providerPreferences));
    }

    private static List<String> splitProviders(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static void requireNonNegative(String field, Number value) {
        if (value != null && value.longValue() < 0) {
            throw new InvalidPermissionsException(field + " must not be negative");
        }
    }

    private static boolean outOfDay(int hour) {
        return hour < 0 || hour > 23;
    }
}
