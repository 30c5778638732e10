package com.openforge.writecrew.permission.dto;

import com.openforge.writecrew.permission.AgentPermissions;
import com.openforge.writecrew.permission.ApprovalScope;
import com.openforge.writecrew.permission.AutonomyLevel;
import com.openforge.writecrew.permission.ContentFilterLevel;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * Body of POST (attach) and PUT (update) on /api/agents/{id}/permissions.
 * documentId is only read on attach.  Omitted approvalScope falls back to
 * the level's default; omitted limits mean unlimited.
 */
public record PermissionsRequest(
        String             documentId,
        @NotNull AutonomyLevel autonomyLevel,
        ApprovalScope      approvalScope,
        boolean            canWrite,
        boolean            canEdit,
        boolean            canDelete,
        boolean            canResearch,
        boolean            canGenerateImages,
        boolean            canGenerateAudio,
        boolean            canUseExternalApis,
        @PositiveOrZero Integer maxWordsPerAction,
        @PositiveOrZero Integer maxWordsPerSession,
        @PositiveOrZero Integer maxWordsPerDay,
        @PositiveOrZero Long    maxCostPerActionMicros,
        @PositiveOrZero Long    maxCostPerSessionMicros,
        @PositiveOrZero Long    maxCostPerDayMicros,
        @Min(0) @Max(23) Integer workingHoursStartUtc,
        @Min(0) @Max(23) Integer workingHoursEndUtc,
        ContentFilterLevel contentFilterLevel,
        @Min(1) Integer    approvalTimeoutMinutes,
        boolean            autoApproveMinorEdits,
        List<String>       providerPreferences
) {

    public AgentPermissions toPermissions() {
        return AgentPermissions.builder()
                .autonomyLevel(autonomyLevel)
                .approvalScope(approvalScope)
                .canWrite(canWrite)
                .canEdit(canEdit)
                .canDelete(canDelete)
                .canResearch(canResearch)
                .canGenerateImages(canGenerateImages)
                .canGenerateAudio(canGenerateAudio)
                .canUseExternalApis(canUseExternalApis)
                .maxWordsPerAction(maxWordsPerAction)
                .maxWordsPerSession(maxWordsPerSession)
                .maxWordsPerDay(maxWordsPerDay)
                .maxCostPerActionMicros(maxCostPerActionMicros)
                .maxCostPerSessionMicros(maxCostPerSessionMicros)
                .maxCostPerDayMicros(maxCostPerDayMicros)
                .workingHoursStartUtc(workingHoursStartUtc)
                .workingHoursEndUtc(workingHoursEndUtc)
                .contentFilterLevel(contentFilterLevel)
                .approvalTimeoutMinutes(approvalTimeoutMinutes == null ? 0 : approvalTimeoutMinutes)
                .autoApproveMinorEdits(autoApproveMinorEdits)
                .providerPreferences(providerPreferences)
                .build();
    }
}
