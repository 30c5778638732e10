package com.openforge.writecrew.permission;

/**
 * Outcome of one permission evaluation.
 *
 * DENIED needs a permission change before a retry can succeed; RATE_LIMITED
 * and COST_LIMITED are transient; REQUIRES_APPROVAL is a control-flow branch,
 * not an error.
 */
public enum PermissionDecision {
    ALLOWED,
    DENIED,
    REQUIRES_APPROVAL,
    RATE_LIMITED,
    COST_LIMITED
}
