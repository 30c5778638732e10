package com.openforge.writecrew.permission;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * An operation an agent proposes. Immutable; one action maps to exactly one
 * permission decision.
 *
 * estimatedWords is the declared content-length estimate. Level thresholds
 * are always evaluated against it, never against the produced length.
 *
 * @param position           character offset the action targets
 * @param length             characters the action replaces or removes (0 for pure writes)
 * @param estimatedCostMicros estimated provider cost in micro-dollars
 * @param content            text to insert when the agent already has it, else null
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentAction(
        String      actionId,
        ActionType  type,
        TargetScope targetScope,
        int         position,
        int         length,
        int         estimatedWords,
        long        estimatedTokens,
        long        estimatedCostMicros,
        Instant     requestedAt,
        Instant     deadline,
        String      description,
        String      content
) {

    public AgentAction {
        Objects.requireNonNull(type, "action type is required");
        if (actionId == null || actionId.isBlank()) {
            actionId = UUID.randomUUID().toString();
        }
        if (targetScope == null) {
            targetScope = TargetScope.PARAGRAPH;
        }
        if (position < 0 || length < 0 || estimatedWords < 0 || estimatedTokens < 0 || estimatedCostMicros < 0) {
            throw new IllegalArgumentException("action offsets and estimates must be non-negative");
        }
    }

    /** Short human-readable label for approval prompts and logs. */
    public String summary() {
        if (description != null && !description.isBlank()) {
            return description;
        }
        return "%s %s (~%d words)".formatted(
                type.name().toLowerCase(), targetScope.name().toLowerCase(), estimatedWords);
    }

    public AgentAction withEstimatedWords(int words) {
        return toBuilder().estimatedWords(words).build();
    }
}
