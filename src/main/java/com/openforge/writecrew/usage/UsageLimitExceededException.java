package com.openforge.writecrew.usage;

import com.openforge.writecrew.common.CollaborationException;
import lombok.Getter;

import java.time.Duration;

/**
 * A reservation would push a rolling counter over its cap.  The counters
 * are left exactly as they were before the attempt.
 */
@Getter
public class UsageLimitExceededException extends CollaborationException {

    /** session_words, daily_words, session_cost or daily_cost. */
    private final String   limitType;
    private final long     remaining;
    private final Duration retryAfter;

    public UsageLimitExceededException(String limitType, long remaining, Duration retryAfter) {
        super("Usage limit %s exceeded (remaining %d)".formatted(limitType, remaining));
        this.limitType  = limitType;
        this.remaining  = remaining;
        this.retryAfter = retryAfter;
    }

    public boolean isCostLimit() {
        return limitType.endsWith("_cost");
    }

    @Override
    public String errorCode() {
        return "usage_limit_exceeded";
    }
}
