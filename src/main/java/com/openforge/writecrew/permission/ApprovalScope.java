package com.openforge.writecrew.permission;

/**
 * Granularity at which a human reviews agent work, narrowest first.
 */
public enum ApprovalScope {
    ACTION,
    PARAGRAPH,
    SECTION,
    DOCUMENT,
    PROJECT
}
