package com.openforge.writecrew.usage;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only view of an agent's counters at one instant, with the action
 * under evaluation folded into the projected figures.
 *
 * @param sessionResetsAt when the current session window ends
 * @param dailyResetsAt   next daily reset instant
 */
public record UsageReport(
        String  agentInstanceId,
        String  sessionId,
        long    sessionWords,
        long    sessionCostMicros,
        long    sessionTokens,
        long    dailyWords,
        long    dailyCostMicros,
        long    dailyTokens,
        long    pendingWords,
        long    pendingCostMicros,
        Instant sessionStartedAt,
        Instant sessionResetsAt,
        Instant dailyResetsAt,
        Instant asOf
) {

    public long projectedSessionWords() {
        return sessionWords + pendingWords;
    }

    public long projectedDailyWords() {
        return dailyWords + pendingWords;
    }

    public long projectedSessionCostMicros() {
        return sessionCostMicros + pendingCostMicros;
    }

    public long projectedDailyCostMicros() {
        return dailyCostMicros + pendingCostMicros;
    }

    public Duration untilSessionReset() {
        return nonNegative(Duration.between(asOf, sessionResetsAt));
    }

    public Duration untilDailyReset() {
        return nonNegative(Duration.between(asOf, dailyResetsAt));
    }

    private static Duration nonNegative(Duration d) {
        return d.isNegative() ? Duration.ZERO : d;
    }
}
