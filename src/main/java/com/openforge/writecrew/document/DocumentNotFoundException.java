package com.openforge.writecrew.document;

import com.openforge.writecrew.common.CollaborationException;

public class DocumentNotFoundException extends CollaborationException {

    public DocumentNotFoundException(String documentId) {
        super("Document not found: " + documentId);
    }

    @Override
    public String errorCode() {
        return "document_not_found";
    }
}
