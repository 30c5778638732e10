package com.openforge.writecrew.approval;

import com.openforge.writecrew.permission.ActionType;
import com.openforge.writecrew.permission.AgentAction;

/**
 * Ordering hint for the pending-approval list.
 */
public enum ApprovalPriority {
    LOW,
    MEDIUM,
    HIGH;

    static final int LARGE_ACTION_WORDS = 500;

    /**
     * Deletes are HIGH, research LOW, the rest MEDIUM; anything over 500
     * words moves up one step.
     */
    public static ApprovalPriority of(AgentAction action) {
        ApprovalPriority priority = MEDIUM;
        if (action.type() == ActionType.DELETE) {
            priority = HIGH;
        } else if (action.type() == ActionType.RESEARCH) {
            priority = LOW;
        }
        if (action.estimatedWords() > LARGE_ACTION_WORDS) {
            priority = priority == LOW ? MEDIUM : HIGH;
        }
        return priority;
    }
}
