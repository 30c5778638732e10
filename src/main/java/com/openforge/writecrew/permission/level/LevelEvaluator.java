package com.openforge.writecrew.permission.level;

import com.openforge.writecrew.permission.ActionContext;
import com.openforge.writecrew.permission.AgentAction;
import com.openforge.writecrew.permission.AgentPermissions;
import com.openforge.writecrew.permission.AutonomyLevel;
import com.openforge.writecrew.permission.PermissionEvaluationResult;

/**
 * Autonomy-level policy.  One bean per {@link AutonomyLevel}; the engine
 * dispatches on {@link #level()} after capability, limit and time checks
 * have already passed.
 *
 * Implementations are pure: no I/O, no clock, no mutation.
 */
public interface LevelEvaluator {

    AutonomyLevel level();

    PermissionEvaluationResult evaluate(AgentPermissions permissions, AgentAction action, ActionContext context);
}
