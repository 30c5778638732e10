package com.openforge.writecrew.document;

import java.util.regex.Pattern;

/**
 * Text operations on document content.
 */
final class DocumentText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private DocumentText() {
    }

    static String apply(String content, DocumentChange change) {
        StringBuilder sb = new StringBuilder(content.length() + change.insertedLength());
        sb.append(content, 0, change.position());
        sb.append(change.content());
        sb.append(content, change.end(), content.length());
        return sb.toString();
    }

    static int countWords(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }

    /** Words inserted plus words removed. */
    static int wordsTouched(String before, DocumentChange change) {
        String removed = before.substring(change.position(), change.end());
        return countWords(removed) + countWords(change.content());
    }
}
