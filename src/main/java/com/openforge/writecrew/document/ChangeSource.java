package com.openforge.writecrew.document;

/** Who produced a change. */
public enum ChangeSource {
    HUMAN,
    AGENT,
    REVERT,
    SYSTEM
}
