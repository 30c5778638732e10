package com.openforge.writecrew.permission.level;

import com.openforge.writecrew.permission.ActionContext;
import com.openforge.writecrew.permission.AgentAction;
import com.openforge.writecrew.permission.AgentPermissions;
import com.openforge.writecrew.permission.ApprovalScope;
import com.openforge.writecrew.permission.AutonomyLevel;
import com.openforge.writecrew.permission.PermissionEvaluationResult;
import com.openforge.writecrew.permission.PermissionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SemiAutonomousEvaluator implements LevelEvaluator {

    private final PermissionProperties properties;

    @Override
    public AutonomyLevel level() {
        return AutonomyLevel.SEMI_AUTONOMOUS;
    }

    @Override
    public PermissionEvaluationResult evaluate(AgentPermissions permissions, AgentAction action, ActionContext context) {
        return switch (action.type()) {
            case RESEARCH, GENERATE_IMAGE, GENERATE_AUDIO ->
                    PermissionEvaluationResult.allowed("Allowed in semi-autonomous mode");
            case WRITE, EDIT -> {
                if (action.estimatedWords() <= properties.sectionThreshold()) {
                    yield PermissionEvaluationResult.allowed("Within section threshold");
                }
                yield PermissionEvaluationResult.requiresApproval(
                        "%d words exceeds section threshold of %d"
                                .formatted(action.estimatedWords(), properties.sectionThreshold()),
                        ApprovalScope.SECTION,
                        permissions.approvalTimeout());
            }
            case DELETE -> PermissionEvaluationResult.requiresApproval(
                    "Deletes need approval in semi-autonomous mode",
                    ApprovalScope.ACTION,
                    permissions.approvalTimeout());
            default -> PermissionEvaluationResult.allowed("Allowed in semi-autonomous mode");
        };
    }
}
