package com.openforge.writecrew.permission.dto;

import com.openforge.writecrew.auth.AuthenticatedUser;
import com.openforge.writecrew.permission.ActionContext;
import com.openforge.writecrew.permission.ActionType;
import com.openforge.writecrew.permission.AgentAction;
import com.openforge.writecrew.permission.TargetScope;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;

/**
 * Dry-run evaluation: the proposed action plus the caller's session view.
 */
public record EvaluateRequest(
        @NotNull ActionType     type,
        TargetScope             targetScope,
        @PositiveOrZero int     position,
        @PositiveOrZero int     length,
        @PositiveOrZero int     estimatedWords,
        @PositiveOrZero long    estimatedTokens,
        @PositiveOrZero long    estimatedCostMicros,
        String                  description,
        String                  sessionId,
        Instant                 sessionStartedAt,
        @PositiveOrZero long    sessionWordsSoFar,
        @PositiveOrZero long    sessionCostSoFarMicros,
        @PositiveOrZero long    dailyWordsSoFar,
        @PositiveOrZero long    dailyCostSoFarMicros,
        Long                    documentVersion
) {

    public AgentAction toAction(Instant now) {
        return AgentAction.builder()
                .type(type)
                .targetScope(targetScope)
                .position(position)
                .length(length)
                .estimatedWords(estimatedWords)
                .estimatedTokens(estimatedTokens)
                .estimatedCostMicros(estimatedCostMicros)
                .description(description)
                .requestedAt(now)
                .build();
    }

    public ActionContext toContext(AuthenticatedUser user, String documentId, Instant now) {
        return ActionContext.builder()
                .userId(user.userId())
                .userTier(user.tier())
                .documentId(documentId)
                .documentVersion(documentVersion)
                .sessionId(sessionId)
                .sessionStartedAt(sessionStartedAt)
                .sessionWordsSoFar(sessionWordsSoFar)
                .sessionCostSoFarMicros(sessionCostSoFarMicros)
                .dailyWordsSoFar(dailyWordsSoFar)
                .dailyCostSoFarMicros(dailyCostSoFarMicros)
                .now(now)
                .build();
    }
}
