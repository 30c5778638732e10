package com.openforge.writecrew.permission.level;

import com.openforge.writecrew.permission.ActionContext;
import com.openforge.writecrew.permission.ActionType;
import com.openforge.writecrew.permission.AgentAction;
import com.openforge.writecrew.permission.AgentPermissions;
import com.openforge.writecrew.permission.ApprovalScope;
import com.openforge.writecrew.permission.AutonomyLevel;
import com.openforge.writecrew.permission.PermissionEvaluationResult;
import com.openforge.writecrew.permission.PermissionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Research runs freely; minor edits pass when the user opted in;
 * every other document change is reviewed per paragraph.
 */
@Component
@RequiredArgsConstructor
public class CollaborativeEvaluator implements LevelEvaluator {

    private final PermissionProperties properties;

    @Override
    public AutonomyLevel level() {
        return AutonomyLevel.COLLABORATIVE;
    }

    @Override
    public PermissionEvaluationResult evaluate(AgentPermissions permissions, AgentAction action, ActionContext context) {
        ActionType type = action.type();
        if (type == ActionType.RESEARCH) {
            return PermissionEvaluationResult.allowed("Research is allowed in collaborative mode");
        }
        if (type == ActionType.EDIT
                && permissions.autoApproveMinorEdits()
                && action.estimatedWords() <= properties.minorEditThreshold()) {
            return PermissionEvaluationResult.allowed("Minor edit auto-approved");
        }
        if (type.modifiesDocument()) {
            return PermissionEvaluationResult.requiresApproval(
                    "Collaborative mode: %s needs paragraph approval".formatted(type.name().toLowerCase()),
                    ApprovalScope.PARAGRAPH,
                    permissions.approvalTimeout());
        }
        return PermissionEvaluationResult.allowed("Allowed in collaborative mode");
    }
}
