package com.openforge.writecrew.permission;

/**
 * Operations an agent can propose.
 */
public enum ActionType {
    WRITE,
    EDIT,
    DELETE,
    RESEARCH,
    GENERATE_IMAGE,
    GENERATE_AUDIO,
    EXTERNAL_API;

    /** True for operations that change document text. */
    public boolean modifiesDocument() {
        return this == WRITE || this == EDIT || this == DELETE;
    }
}
