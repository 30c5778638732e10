package com.openforge.writecrew.permission;

import com.openforge.writecrew.permission.level.AssistantEvaluator;
import com.openforge.writecrew.permission.level.CollaborativeEvaluator;
import com.openforge.writecrew.permission.level.FullyAutonomousEvaluator;
import com.openforge.writecrew.permission.level.SemiAutonomousEvaluator;
import com.openforge.writecrew.support.MutableClock;
import com.openforge.writecrew.support.TestPermissions;
import com.openforge.writecrew.usage.ActualUsage;
import com.openforge.writecrew.usage.UsageLedgerWriter;
import com.openforge.writecrew.usage.UsageTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PermissionEngineTest {

    private static final Instant NOON = Instant.parse("2026-03-02T12:00:00Z");

    private MutableClock clock;
    private AgentPermissionService permissionService;
    private UsageTracker usageTracker;
    private PermissionEngine engine;

    @BeforeEach
    void setUp() {
        PermissionProperties properties = PermissionProperties.defaults();
        clock = new MutableClock(NOON);
        permissionService = mock(AgentPermissionService.class);
        UsageLedgerWriter ledger = mock(UsageLedgerWriter.class);
        when(ledger.append(any())).thenReturn(CompletableFuture.completedFuture(null));
        usageTracker = new UsageTracker(clock, properties, ledger);
        engine = new PermissionEngine(permissionService, usageTracker, clock, List.of(
                new AssistantEvaluator(),
                new CollaborativeEvaluator(properties),
                new SemiAutonomousEvaluator(properties),
                new FullyAutonomousEvaluator()));
    }

    private static AgentAction write(int words) {
        return AgentAction.builder().type(ActionType.WRITE).estimatedWords(words).build();
    }

    private static ActionContext context() {
        return ActionContext.builder().sessionId("s1").sessionStartedAt(NOON.minus(Duration.ofHours(1))).now(NOON).build();
    }

    @Test
    @DisplayName("unknown agent is denied")
    void unknownAgentDenied() {
        when(permissionService.find("ghost")).thenReturn(Optional.empty());

        PermissionEvaluationResult result = engine.evaluate("ghost", write(10), context());

        assertThat(result.decision()).isEqualTo(PermissionDecision.DENIED);
        assertThat(result.reason()).isEqualTo("permissions not found");
    }

    @Test
    @DisplayName("stored permissions are looked up by agent id")
    void evaluatesStoredPermissions() {
        when(permissionService.find("agent-1"))
                .thenReturn(Optional.of(TestPermissions.at(AutonomyLevel.ASSISTANT).build()));

        PermissionEvaluationResult result = engine.evaluate("agent-1", write(10), context());

        assertThat(result.decision()).isEqualTo(PermissionDecision.REQUIRES_APPROVAL);
        assertThat(result.approvalScope()).isEqualTo(ApprovalScope.ACTION);
    }

    @Test
    @DisplayName("missing capability denies before any level policy")
    void capabilityDenied() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.FULLY_AUTONOMOUS).canDelete(false).build();

        PermissionEvaluationResult result = engine.evaluate(p,
                AgentAction.builder().type(ActionType.DELETE).build(), context());

        assertThat(result.decision()).isEqualTo(PermissionDecision.DENIED);
        assertThat(result.reason()).contains("delete");
    }

    @Test
    @DisplayName("per-action word limit denies outright")
    void perActionWordsDenied() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.FULLY_AUTONOMOUS).maxWordsPerAction(200).build();

        PermissionEvaluationResult result = engine.evaluate(p, write(201), context());

        assertThat(result.decision()).isEqualTo(PermissionDecision.DENIED);
        assertThat(result.limitType()).isEqualTo("action_words");
    }

    @Test
    @DisplayName("per-action cost limit denies outright")
    void perActionCostDenied() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.FULLY_AUTONOMOUS).maxCostPerActionMicros(10_000L).build();
        AgentAction expensive = write(10).toBuilder().estimatedCostMicros(10_001).build();

        PermissionEvaluationResult result = engine.evaluate(p, expensive, context());

        assertThat(result.decision()).isEqualTo(PermissionDecision.DENIED);
        assertThat(result.limitType()).isEqualTo("action_cost");
    }

    @Test
    @DisplayName("950 of 1000 session words plus 100 more is rate limited until the session resets")
    void sessionWordsRateLimited() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.FULLY_AUTONOMOUS).maxWordsPerSession(1000).build();
        ActionContext ctx = context().toBuilder().sessionWordsSoFar(950).build();

        PermissionEvaluationResult result = engine.evaluate(p, write(100), ctx);

        assertThat(result.decision()).isEqualTo(PermissionDecision.RATE_LIMITED);
        assertThat(result.limitType()).isEqualTo("session_words");
        assertThat(result.remainingBudget()).isEqualTo(50L);
        assertThat(result.retryAfter()).isEqualTo(Duration.ofHours(7));
        assertThat(result.retryAfterSeconds()).isPositive();
    }

    @Test
    @DisplayName("tracked usage counts even when the caller reports none")
    void trackedUsageWins() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.FULLY_AUTONOMOUS).maxWordsPerDay(1000).build();
        usageTracker.record("agent-1", "s1", write(900), new ActualUsage(900, 0, 0, null));

        PermissionEvaluationResult result = engine.evaluate(p, write(200), context());

        assertThat(result.decision()).isEqualTo(PermissionDecision.RATE_LIMITED);
        assertThat(result.limitType()).isEqualTo("daily_words");
        assertThat(result.remainingBudget()).isEqualTo(100L);
        assertThat(result.retryAfter()).isEqualTo(Duration.ofHours(12));
    }

    @Test
    @DisplayName("daily cost cap reports cost limited")
    void dailyCostLimited() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.FULLY_AUTONOMOUS).maxCostPerDayMicros(1_000_000L).build();
        ActionContext ctx = context().toBuilder().dailyCostSoFarMicros(990_000).build();

        PermissionEvaluationResult result = engine.evaluate(p,
                write(10).toBuilder().estimatedCostMicros(20_000).build(), ctx);

        assertThat(result.decision()).isEqualTo(PermissionDecision.COST_LIMITED);
        assertThat(result.limitType()).isEqualTo("daily_cost");
        assertThat(result.remainingBudget()).isEqualTo(10_000L);
    }

    @Test
    @DisplayName("word limits are checked before cost limits")
    void wordsBeforeCost() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.FULLY_AUTONOMOUS)
                .maxWordsPerSession(100)
                .maxCostPerSessionMicros(100L)
                .build();
        AgentAction both = write(500).toBuilder().estimatedCostMicros(500).build();

        assertThat(engine.evaluate(p, both, context()).limitType()).isEqualTo("session_words");
    }

    @Test
    @DisplayName("actions outside working hours are denied")
    void outsideWorkingHoursDenied() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.FULLY_AUTONOMOUS)
                .workingHoursStartUtc(9)
                .workingHoursEndUtc(17)
                .build();

        PermissionEvaluationResult evening = engine.evaluate(p, write(10),
                context().toBuilder().now(Instant.parse("2026-03-02T20:00:00Z")).build());
        PermissionEvaluationResult midday = engine.evaluate(p, write(10), context());

        assertThat(evening.decision()).isEqualTo(PermissionDecision.DENIED);
        assertThat(evening.reason()).contains("09:00-17:00");
        assertThat(midday.isAllowed()).isTrue();
    }

    @Test
    @DisplayName("limit checks come before the level policy")
    void limitsBeforeLevel() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.ASSISTANT).maxWordsPerAction(5).build();

        assertThat(engine.evaluate(p, write(6), context()).decision()).isEqualTo(PermissionDecision.DENIED);
    }

    @Test
    @DisplayName("evaluation never changes the usage counters")
    void evaluationIsReadOnly() {
        AgentPermissions p = TestPermissions.at(AutonomyLevel.FULLY_AUTONOMOUS).build();

        engine.evaluate(p, write(300), context());

        assertThat(usageTracker.snapshot("agent-1").sessionWords()).isZero();
    }

    @Test
    @DisplayName("a missing level evaluator fails at startup")
    void missingEvaluatorRejected() {
        assertThatThrownBy(() -> new PermissionEngine(permissionService, usageTracker, clock,
                List.of(new AssistantEvaluator())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("COLLABORATIVE");
    }
}
