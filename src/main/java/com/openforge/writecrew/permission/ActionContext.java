package com.openforge.writecrew.permission;

import lombok.Builder;

import java.time.Instant;
import java.util.Set;

/**
 * Read-only snapshot supplied by the caller at evaluation time. Never persisted.
 *
 * The counters-so-far are the caller's view; UsageTracker holds the
 * authoritative counters and the engine checks against whichever is higher.
 *
 * @param documentVersion version of the document the agent worked from, used
 *                        as the base version of the resulting change
 * @param now             evaluation instant; null means "ask the clock"
 */
@Builder(toBuilder = true)
public record ActionContext(
        Long        userId,
        String      userTier,
        String      documentId,
        int         documentWordCount,
        Set<String> collaborators,
        Long        documentVersion,
        String      sessionId,
        Instant     sessionStartedAt,
        long        sessionWordsSoFar,
        long        sessionCostSoFarMicros,
        long        dailyWordsSoFar,
        long        dailyCostSoFarMicros,
        Instant     now,
        double      recentApprovalRate
) {

    public ActionContext {
        collaborators = collaborators == null ? Set.of() : Set.copyOf(collaborators);
    }
}
