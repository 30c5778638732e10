package com.openforge.writecrew.document;

public enum ChangeOperation {
    INSERT,
    DELETE,
    REPLACE
}
