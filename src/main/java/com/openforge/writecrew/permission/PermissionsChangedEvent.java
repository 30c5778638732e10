package com.openforge.writecrew.permission;

/**
 * Published after a permission update has been committed.
 * {@code previous} is null on first attach.
 */
public record PermissionsChangedEvent(
        String           agentInstanceId,
        AgentPermissions previous,
        AgentPermissions current,
        Long             updatedBy
) {

    public boolean autonomyIncreased() {
        return previous != null && current.autonomyLevel().isHigherThan(previous.autonomyLevel());
    }
}
