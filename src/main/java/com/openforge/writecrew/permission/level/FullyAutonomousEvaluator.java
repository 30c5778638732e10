package com.openforge.writecrew.permission.level;

import com.openforge.writecrew.permission.ActionContext;
import com.openforge.writecrew.permission.ActionType;
import com.openforge.writecrew.permission.AgentAction;
import com.openforge.writecrew.permission.AgentPermissions;
import com.openforge.writecrew.permission.ApprovalScope;
import com.openforge.writecrew.permission.AutonomyLevel;
import com.openforge.writecrew.permission.PermissionEvaluationResult;
import org.springframework.stereotype.Component;

/**
 * Everything runs except deleting a whole document or chapter.  External
 * API calls normally never reach this evaluator without the capability
 * flag (the engine denies them first); the approval branch covers callers
 * that evaluate the level directly.
 */
@Component
public class FullyAutonomousEvaluator implements LevelEvaluator {

    @Override
    public AutonomyLevel level() {
        return AutonomyLevel.FULLY_AUTONOMOUS;
    }

    @Override
    public PermissionEvaluationResult evaluate(AgentPermissions permissions, AgentAction action, ActionContext context) {
        ActionType type = action.type();
        if (type == ActionType.DELETE && action.targetScope().isDocumentWide()) {
            return PermissionEvaluationResult.requiresApproval(
                    "Deleting a whole %s needs approval".formatted(action.targetScope().name().toLowerCase()),
                    ApprovalScope.DOCUMENT,
                    permissions.approvalTimeout());
        }
        if (type == ActionType.EXTERNAL_API && !permissions.canUseExternalApis()) {
            return PermissionEvaluationResult.requiresApproval(
                    "External API use is not pre-authorised",
                    ApprovalScope.ACTION,
                    permissions.approvalTimeout());
        }
        return PermissionEvaluationResult.allowed("Allowed in fully autonomous mode");
    }
}
