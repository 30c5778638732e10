package com.openforge.writecrew.permission;

/**
 * Strictness of the downstream content-safety filter. Carried with the
 * permissions for the content producer; the engine does not interpret it.
 */
public enum ContentFilterLevel {
    RELAXED,
    STANDARD,
    STRICT
}
