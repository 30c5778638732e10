package com.openforge.writecrew.permission;

import com.openforge.writecrew.permission.level.LevelEvaluator;
import com.openforge.writecrew.usage.UsageReport;
import com.openforge.writecrew.usage.UsageTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether an agent action may run.
 *
 * Check order (first failure wins):
 *   1. capability flag for the action type          → DENIED
 *   2. word limits  (action → session → day)         → DENIED / RATE_LIMITED
 *   3. cost limits  (action → session → day)         → DENIED / COST_LIMITED
 *   4. working hours                                 → DENIED
 *   5. LevelEvaluator for the autonomy level         → ALLOWED / REQUIRES_APPROVAL
 *
 * Read-only: usage is only ever written by UsageTracker after execution.
 */
@Slf4j
@Service
public class PermissionEngine {

    private final AgentPermissionService                   permissionService;
    private final UsageTracker                             usageTracker;
    private final Clock                                    clock;
    private final Map<AutonomyLevel, LevelEvaluator>       evaluators;

    public PermissionEngine(AgentPermissionService permissionService,
                            UsageTracker usageTracker,
                            Clock clock,
                            List<LevelEvaluator> evaluators) {
        this.permissionService = permissionService;
        this.usageTracker      = usageTracker;
        this.clock             = clock;
        this.evaluators        = new EnumMap<>(AutonomyLevel.class);
        for (LevelEvaluator evaluator : evaluators) {
            LevelEvaluator existing = this.evaluators.put(evaluator.level(), evaluator);
            if (existing != null) {
                throw new IllegalStateException("Two evaluators registered for " + evaluator.level());
            }
        }
        for (AutonomyLevel level : AutonomyLevel.values()) {
            if (!this.evaluators.containsKey(level)) {
                throw new IllegalStateException("No LevelEvaluator registered for " + level);
            }
        }
    }

    public PermissionEvaluationResult evaluate(String agentInstanceId, AgentAction action, ActionContext context) {
        Optional<AgentPermissions> found = permissionService.find(agentInstanceId);
        if (found.isEmpty()) {
            log.info("[Permission] DENIED agent={} action={}: no permissions", agentInstanceId, action.type());
            return PermissionEvaluationResult.denied("permissions not found");
        }
        PermissionEvaluationResult result = evaluate(found.get(), action, context);
        log.info("[Permission] {} agent={} action={} words={} reason={}",
                result.decision(), agentInstanceId, action.type(), action.estimatedWords(), result.reason());
        return result;
    }

    /** Full check chain against already-loaded permissions. */
    public PermissionEvaluationResult evaluate(AgentPermissions permissions, AgentAction action, ActionContext context) {
        if (!permissions.permits(action.type())) {
            return PermissionEvaluationResult.denied(
                    "Agent lacks %s capability".formatted(action.type().name().toLowerCase()));
        }

        UsageReport usage = usageTracker.checkLimits(permissions.agentInstanceId(), context, action);

        PermissionEvaluationResult limited = checkWordLimits(permissions, action, usage);
        if (limited == null) {
            limited = checkCostLimits(permissions, action, usage);
        }
        if (limited != null) {
            return limited;
        }

        Instant now = context.now() != null ? context.now() : clock.instant();
        if (!permissions.withinWorkingHours(now)) {
            return PermissionEvaluationResult.denied(
                    "Outside working hours (%02d:00-%02d:00 UTC)"
                            .formatted(permissions.workingHoursStartUtc(), permissions.workingHoursEndUtc()));
        }

        return evaluateLevel(permissions, action, context);
    }

    /** Only the autonomy-level policy, skipping capability, limit and time checks. */
    public PermissionEvaluationResult evaluateLevel(AgentPermissions permissions, AgentAction action,
                                                    ActionContext context) {
        return evaluators.get(permissions.autonomyLevel()).evaluate(permissions, action, context);
    }

    // ── Limit checks ─────────────────────────────────────────────────────────

    private PermissionEvaluationResult checkWordLimits(AgentPermissions p, AgentAction action, UsageReport usage) {
        long words = action.estimatedWords();
        if (p.maxWordsPerAction() != null && words > p.maxWordsPerAction()) {
            return PermissionEvaluationResult.denied(
                    "Action of %d words exceeds per-action limit of %d".formatted(words, p.maxWordsPerAction()),
                    "action_words", p.maxWordsPerAction());
        }
        if (p.maxWordsPerSession() != null && usage.projectedSessionWords() > p.maxWordsPerSession()) {
            long remaining = Math.max(0, p.maxWordsPerSession() - usage.sessionWords());
            return PermissionEvaluationResult.rateLimited(
                    "Session word limit reached (%d/%d)".formatted(usage.sessionWords(), p.maxWordsPerSession()),
                    "session_words", remaining, usage.untilSessionReset());
        }
        if (p.maxWordsPerDay() != null && usage.projectedDailyWords() > p.maxWordsPerDay()) {
            long remaining = Math.max(0, p.maxWordsPerDay() - usage.dailyWords());
            return PermissionEvaluationResult.rateLimited(
                    "Daily word limit reached (%d/%d)".formatted(usage.dailyWords(), p.maxWordsPerDay()),
                    "daily_words", remaining, usage.untilDailyReset());
        }
        return null;
    }

    private PermissionEvaluationResult checkCostLimits(AgentPermissions p, AgentAction action, UsageReport usage) {
        long cost = action.estimatedCostMicros();
        if (p.maxCostPerActionMicros() != null && cost > p.maxCostPerActionMicros()) {
            return PermissionEvaluationResult.denied(
                    "Estimated cost %d exceeds per-action limit of %d micro-dollars"
                            .formatted(cost, p.maxCostPerActionMicros()),
                    "action_cost", p.maxCostPerActionMicros());
        }
        if (p.maxCostPerSessionMicros() != null && usage.projectedSessionCostMicros() > p.maxCostPerSessionMicros()) {
            long remaining = Math.max(0, p.maxCostPerSessionMicros() - usage.sessionCostMicros());
            return PermissionEvaluationResult.costLimited(
                    "Session cost limit reached", "session_cost", remaining, usage.untilSessionReset());
        }
        if (p.maxCostPerDayMicros() != null && usage.projectedDailyCostMicros() > p.maxCostPerDayMicros()) {
            long remaining = Math.max(0, p.maxCostPerDayMicros() - usage.dailyCostMicros());
            return PermissionEvaluationResult.costLimited(
                    "Daily cost limit reached", "daily_cost", remaining, usage.untilDailyReset());
        }
        return null;
    }
}
