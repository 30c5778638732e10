package com.openforge.writecrew.usage;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Budget held by {@link UsageTracker#reserve} until the action completes.
 * Settles exactly once, through either commit or release.
 */
public final class UsageReservation {

    private final String        agentInstanceId;
    private final String        sessionId;
    private final Instant       sessionStartedAt;
    private final String        dayKey;
    private final int           words;
    private final long          tokens;
    private final long          costMicros;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    UsageReservation(String agentInstanceId, String sessionId, Instant sessionStartedAt, String dayKey,
                     int words, long tokens, long costMicros) {
        this.agentInstanceId  = agentInstanceId;
        this.sessionId        = sessionId;
        this.sessionStartedAt = sessionStartedAt;
        this.dayKey           = dayKey;
        this.words            = words;
        this.tokens           = tokens;
        this.costMicros       = costMicros;
    }

    public String agentInstanceId() { return agentInstanceId; }
    public String sessionId()       { return sessionId; }
    public int words()              { return words; }
    public long tokens()            { return tokens; }
    public long costMicros()        { return costMicros; }

    Instant sessionStartedAt() { return sessionStartedAt; }
    String dayKey()            { return dayKey; }

    /** True the first time only. */
    boolean settle() {
        return settled.compareAndSet(false, true);
    }

    public boolean isSettled() {
        return settled.get();
    }
}
