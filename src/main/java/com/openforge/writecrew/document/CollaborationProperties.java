package com.openforge.writecrew.document;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Document collaboration tuning, under "writecrew.collaboration".
 *
 * @param conflictWindow        how far back applied changes count as possibly concurrent
 * @param historyLimit          max applied changes remembered per document
 * @param snapshotWordThreshold changes touching more words than this trigger a snapshot
 * @param stateCacheTtl         how long a document state stays cached after a write
 * @param executorThreads       size of the collaborationExecutor pool
 */
@ConfigurationProperties(prefix = "writecrew.collaboration")
public record CollaborationProperties(
        @DefaultValue("30s") Duration conflictWindow,
        @DefaultValue("200") int      historyLimit,
        @DefaultValue("100") int      snapshotWordThreshold,
        @DefaultValue("10m") Duration stateCacheTtl,
        @DefaultValue("8")   int      executorThreads
) {

    public static CollaborationProperties defaults() {
        return new CollaborationProperties(Duration.ofSeconds(30), 200, 100, Duration.ofMinutes(10), 8);
    }
}
