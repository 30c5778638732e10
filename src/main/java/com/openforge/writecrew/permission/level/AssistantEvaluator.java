package com.openforge.writecrew.permission.level;

import com.openforge.writecrew.permission.ActionContext;
import com.openforge.writecrew.permission.AgentAction;
import com.openforge.writecrew.permission.AgentPermissions;
import com.openforge.writecrew.permission.ApprovalScope;
import com.openforge.writecrew.permission.AutonomyLevel;
import com.openforge.writecrew.permission.PermissionEvaluationResult;
import org.springframework.stereotype.Component;

@Component
public class AssistantEvaluator implements LevelEvaluator {

    @Override
    public AutonomyLevel level() {
        return AutonomyLevel.ASSISTANT;
    }

    @Override
    public PermissionEvaluationResult evaluate(AgentPermissions permissions, AgentAction action, ActionContext context) {
        return PermissionEvaluationResult.requiresApproval(
                "Assistant mode: every action needs approval",
                ApprovalScope.ACTION,
                permissions.approvalTimeout());
    }
}
