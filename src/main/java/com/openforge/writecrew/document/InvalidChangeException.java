package com.openforge.writecrew.document;

import com.openforge.writecrew.common.CollaborationException;

/** Change falls outside the document, or targets a version with no snapshot. */
public class InvalidChangeException extends CollaborationException {

    public InvalidChangeException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "invalid_change";
    }
}
