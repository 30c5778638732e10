package com.openforge.writecrew.document;

import lombok.Builder;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One edit to a document's text.
 *
 * {@code length} is the number of characters removed at {@code position}
 * and is always 0 for INSERT; {@code content} is the inserted text and is
 * always empty for DELETE.
 *
 * @param baseVersion document version the author saw; null when unknown
 */
@Builder(toBuilder = true)
public record DocumentChange(
        String          changeId,
        ChangeOperation operation,
        int             position,
        int             length,
        String          content,
        String          actorId,
        Instant         timestamp,
        ChangeSource    source,
        Long            baseVersion
) {

    public DocumentChange {
        Objects.requireNonNull(operation, "operation is required");
        Objects.requireNonNull(actorId, "actorId is required");
        if (changeId == null || changeId.isBlank()) {
            changeId = UUID.randomUUID().toString();
        }
        if (source == null) {
            source = ChangeSource.HUMAN;
        }
        if (operation == ChangeOperation.INSERT) {
            length = 0;
        }
        if (operation == ChangeOperation.DELETE || content == null) {
            content = "";
        }
    }

    public int removedLength() {
        return length;
    }

    public int insertedLength() {
        return content.length();
    }

    /** Net change in document length once applied. */
    public int delta() {
        return insertedLength() - removedLength();
    }

    public int end() {
        return position + length;
    }

    public DocumentChange movedTo(int newPosition) {
        return toBuilder().position(newPosition).build();
    }
}
