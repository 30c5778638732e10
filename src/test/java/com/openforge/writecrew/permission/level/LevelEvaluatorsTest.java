package com.openforge.writecrew.permission.level;

import com.openforge.writecrew.permission.ActionContext;
import com.openforge.writecrew.permission.ActionType;
import com.openforge.writecrew.permission.AgentAction;
import com.openforge.writecrew.permission.AgentPermissions;
import com.openforge.writecrew.permission.ApprovalScope;
import com.openforge.writecrew.permission.AutonomyLevel;
import com.openforge.writecrew.permission.PermissionDecision;
import com.openforge.writecrew.permission.PermissionEvaluationResult;
import com.openforge.writecrew.permission.PermissionProperties;
import com.openforge.writecrew.permission.TargetScope;
import com.openforge.writecrew.support.TestPermissions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class LevelEvaluatorsTest {

    private final PermissionProperties properties = PermissionProperties.defaults();
    private final ActionContext context = ActionContext.builder().build();

    private static AgentAction action(ActionType type, int words) {
        return AgentAction.builder().type(type).estimatedWords(words).build();
    }

    // ── ASSISTANT ────────────────────────────────────────────────────────────

    @ParameterizedTest
    @EnumSource(ActionType.class)
    @DisplayName("assistant needs action-level approval for every action type")
    void assistantAlwaysNeedsApproval(ActionType type) {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.ASSISTANT).build();

        PermissionEvaluationResult result = new AssistantEvaluator().evaluate(p, action(type, 1), context);

        assertThat(result.decision()).isEqualTo(PermissionDecision.REQUIRES_APPROVAL);
        assertThat(result.approvalScope()).isEqualTo(ApprovalScope.ACTION);
        assertThat(result.approvalTimeout()).isEqualTo(Duration.ofMinutes(5));
    }

    // ── COLLABORATIVE ────────────────────────────────────────────────────────

    @Test
    @DisplayName("collaborative writes need paragraph approval")
    void collaborativeWriteNeedsParagraphApproval() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.COLLABORATIVE).build();

        PermissionEvaluationResult result = new CollaborativeEvaluator(properties)
                .evaluate(p, action(ActionType.WRITE, 20), context);

        assertThat(result.decision()).isEqualTo(PermissionDecision.REQUIRES_APPROVAL);
        assertThat(result.approvalScope()).isEqualTo(ApprovalScope.PARAGRAPH);
    }

    @Test
    @DisplayName("collaborative research runs without approval")
    void collaborativeResearchAllowed() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.COLLABORATIVE).build();

        PermissionEvaluationResult result = new CollaborativeEvaluator(properties)
                .evaluate(p, action(ActionType.RESEARCH, 0), context);

        assertThat(result.isAllowed()).isTrue();
    }

    @Test
    @DisplayName("minor edits pass only when the user opted in and the edit is small")
    void collaborativeMinorEdits() {
        CollaborativeEvaluator evaluator = new CollaborativeEvaluator(properties);
        AgentPermissions optedIn = TestPermissions.at(AutonomyLevel.COLLABORATIVE).autoApproveMinorEdits(true).build();
        AgentPermissions optedOut = TestPermissions.at(AutonomyLevel.COLLABORATIVE).build();

        assertThat(evaluator.evaluate(optedIn, action(ActionType.EDIT, 50), context).isAllowed()).isTrue();
        assertThat(evaluator.evaluate(optedIn, action(ActionType.EDIT, 51), context).needsApproval()).isTrue();
        assertThat(evaluator.evaluate(optedOut, action(ActionType.EDIT, 10), context).needsApproval()).isTrue();
    }

    @Test
    @DisplayName("collaborative deletes need approval even when minor edits are auto-approved")
    void collaborativeDeleteNeedsApproval() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.COLLABORATIVE).autoApproveMinorEdits(true).build();

        PermissionEvaluationResult result = new CollaborativeEvaluator(properties)
                .evaluate(p, action(ActionType.DELETE, 3), context);

        assertThat(result.needsApproval()).isTrue();
    }

    // ── SEMI_AUTONOMOUS ──────────────────────────────────────────────────────

    @Test
    @DisplayName("semi-autonomous writes up to the section threshold run freely")
    void semiAutonomousSmallWriteAllowed() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.SEMI_AUTONOMOUS).build();
        SemiAutonomousEvaluator evaluator = new SemiAutonomousEvaluator(properties);

        assertThat(evaluator.evaluate(p, action(ActionType.WRITE, 500), context).isAllowed()).isTrue();
        assertThat(evaluator.evaluate(p, action(ActionType.EDIT, 120), context).isAllowed()).isTrue();
    }

    @Test
    @DisplayName("semi-autonomous edit of 600 words needs section approval")
    void semiAutonomousLargeEditNeedsSectionApproval() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.SEMI_AUTONOMOUS).build();

        PermissionEvaluationResult result = new SemiAutonomousEvaluator(properties)
                .evaluate(p, action(ActionType.EDIT, 600), context);

        assertThat(result.decision()).isEqualTo(PermissionDecision.REQUIRES_APPROVAL);
        assertThat(result.approvalScope()).isEqualTo(ApprovalScope.SECTION);
    }

    @Test
    @DisplayName("semi-autonomous deletes always need approval")
    void semiAutonomousDeleteNeedsApproval() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.SEMI_AUTONOMOUS).build();

        PermissionEvaluationResult result = new SemiAutonomousEvaluator(properties)
                .evaluate(p, action(ActionType.DELETE, 1), context);

        assertThat(result.needsApproval()).isTrue();
    }

    @Test
    @DisplayName("semi-autonomous media generation runs freely")
    void semiAutonomousMediaAllowed() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.SEMI_AUTONOMOUS).build();
        SemiAutonomousEvaluator evaluator = new SemiAutonomousEvaluator(properties);

        assertThat(evaluator.evaluate(p, action(ActionType.GENERATE_IMAGE, 0), context).isAllowed()).isTrue();
        assertThat(evaluator.evaluate(p, action(ActionType.GENERATE_AUDIO, 0), context).isAllowed()).isTrue();
    }

    // ── FULLY_AUTONOMOUS ─────────────────────────────────────────────────────

    @Test
    @DisplayName("fully autonomous allows large writes and paragraph deletes")
    void fullyAutonomousAllowsMost() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.FULLY_AUTONOMOUS).build();
        FullyAutonomousEvaluator evaluator = new FullyAutonomousEvaluator();

        assertThat(evaluator.evaluate(p, action(ActionType.WRITE, 5_000), context).isAllowed()).isTrue();
        assertThat(evaluator.evaluate(p, action(ActionType.DELETE, 40), context).isAllowed()).isTrue();
    }

    @Test
    @DisplayName("fully autonomous whole-document deletes need document approval")
    void fullyAutonomousDocumentDeleteNeedsApproval() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.FULLY_AUTONOMOUS).build();
        AgentAction delete = AgentAction.builder().type(ActionType.DELETE).targetScope(TargetScope.DOCUMENT).build();

        PermissionEvaluationResult result = new FullyAutonomousEvaluator().evaluate(p, delete, context);

        assertThat(result.decision()).isEqualTo(PermissionDecision.REQUIRES_APPROVAL);
        assertThat(result.approvalScope()).isEqualTo(ApprovalScope.DOCUMENT);
    }

    @Test
    @DisplayName("fully autonomous external API calls without the flag need approval")
    void fullyAutonomousExternalApiWithoutFlag() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.FULLY_AUTONOMOUS).canUseExternalApis(false).build();

        PermissionEvaluationResult result = new FullyAutonomousEvaluator()
                .evaluate(p, action(ActionType.EXTERNAL_API, 0), context);

        assertThat(result.approvalScope()).isEqualTo(ApprovalScope.ACTION);
    }
}
