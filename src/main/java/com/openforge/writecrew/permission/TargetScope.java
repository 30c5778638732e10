package com.openforge.writecrew.permission;

/**
 * Portion of the document an action targets, widest first.
 */
public enum TargetScope {
    DOCUMENT,
    CHAPTER,
    SECTION,
    PARAGRAPH,
    SENTENCE;

    public boolean isDocumentWide() {
        return this == DOCUMENT || this == CHAPTER;
    }
}
