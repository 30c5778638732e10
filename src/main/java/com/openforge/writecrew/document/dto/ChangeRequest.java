package com.openforge.writecrew.document.dto;

import com.openforge.writecrew.document.ChangeOperation;
import com.openforge.writecrew.document.ChangeSource;
import com.openforge.writecrew.document.DocumentChange;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;

/**
 * A human edit submitted over REST.
 *
 * @param baseVersion version the editor last saw; strongly recommended, as
 *                    without it every recent change by someone else is
 *                    treated as concurrent
 */
public record ChangeRequest(
        @NotNull ChangeOperation operation,
        @PositiveOrZero int      position,
        @PositiveOrZero int      length,
        String                   content,
        Long                     baseVersion
) {

    public DocumentChange toChange(String actorId, Instant now) {
        return DocumentChange.builder()
                .operation(operation)
                .position(position)
                .length(length)
                .content(content)
                .actorId(actorId)
                .timestamp(now)
                .source(ChangeSource.HUMAN)
                .baseVersion(baseVersion)
                .build();
    }
}
