package com.openforge.writecrew.permission;

import com.openforge.writecrew.common.CollaborationException;

/**
 * Permissions violate an invariant: session limit above daily limit, a scope
 * the autonomy level cannot use, a non-positive approval timeout, etc.
 */
public class InvalidPermissionsException extends CollaborationException {

    public InvalidPermissionsException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "invalid_permissions";
    }
}
