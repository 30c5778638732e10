package com.openforge.writecrew.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Current content of a collaboratively edited document.
 *
 * revision is the logical document version (one per applied change),
 * distinct from BaseEntity.rowVersion.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "documents",
    uniqueConstraints = @UniqueConstraint(name = "uq_document_id", columnNames = "document_id")
)
public class SharedDocument extends BaseEntity {

    /** External UUID used in topics and REST paths. */
    @Column(name = "document_id", nullable = false, length = 64)
    private String documentId;

    @Column(name = "title", length = 255)
    private String title;

    @Builder.Default
    @Column(name = "content", nullable = false, columnDefinition = "LONGTEXT")
    private String content = "";

    @Column(name = "revision", nullable = false)
    private long revision;

    @Column(name = "word_count", nullable = false)
    private int wordCount;

    @Column(name = "last_modified_by", length = 64)
    private String lastModifiedBy;

    @Column(name = "last_modified_at")
    private Instant lastModifiedAt;
}
