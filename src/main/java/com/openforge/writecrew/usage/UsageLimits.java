package com.openforge.writecrew.usage;

/**
 * Rolling-window caps checked by {@link UsageTracker#reserve}.  Null means unlimited.
 */
public record UsageLimits(
        Integer maxWordsPerSession,
        Integer maxWordsPerDay,
        Long    maxCostPerSessionMicros,
        Long    maxCostPerDayMicros
) {

    public static UsageLimits unlimited() {
        return new UsageLimits(null, null, null, null);
    }
}
