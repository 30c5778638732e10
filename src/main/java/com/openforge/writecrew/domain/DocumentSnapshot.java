package com.openforge.writecrew.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "document_snapshots",
    uniqueConstraints = @UniqueConstraint(name = "uq_snapshot_version", columnNames = {"document_id", "version"})
)
public class DocumentSnapshot extends BaseEntity {

    @Column(name = "document_id", nullable = false, length = 64)
    private String documentId;

    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "content", nullable = false, columnDefinition = "LONGTEXT")
    private String content;

    @Column(name = "word_count", nullable = false)
    private int wordCount;

    @Column(name = "created_by", length = 64)
    private String createdBy;

    @Column(name = "snapshot_at", nullable = false)
    private Instant snapshotAt;

    /** One-line description of the change that produced this version. */
    @Column(name = "changes_summary", length = 512)
    private String changesSummary;
}
