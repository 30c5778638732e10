package com.openforge.writecrew.permission.dto;

import com.openforge.writecrew.domain.PermissionChange;
import com.openforge.writecrew.permission.AutonomyLevel;

import java.time.LocalDateTime;

public record PermissionChangeResponse(
        AutonomyLevel previousLevel,
        AutonomyLevel newLevel,
        Long          updatedBy,
        LocalDateTime changedAt
) {

    public static PermissionChangeResponse from(PermissionChange change) {
        return new PermissionChangeResponse(change.getPreviousLevel(), change.getNewLevel(),
                change.getUpdatedBy(), change.getCreateTime());
    }
}
