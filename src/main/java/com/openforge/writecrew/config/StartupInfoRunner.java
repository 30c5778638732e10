package com.openforge.writecrew.config;

import com.openforge.writecrew.document.CollaborationProperties;
import com.openforge.writecrew.permission.PermissionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Prints a structured startup summary once the context is ready.
 *
 * Checks performed:
 *   - Database: opens a real JDBC connection and reads the server version
 *   - Permission engine: thresholds, windows and cache TTL in effect
 *   - Collaboration: conflict window, snapshot threshold, executor size
 */
@Slf4j
@Component
@Profile("!test")
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource              dataSource;
    private final PermissionProperties    permissionProperties;
    private final CollaborationProperties collaborationProperties;
    private final Environment             env;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║           WriteCrew Collaboration Core : Startup         ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Permission Engine                                       ║
                ║    Minor edit     : <= {} words
                ║    Section        : <= {} words
                ║    Session window : {}
                ║    Daily reset    : {}:00 UTC
                ║    Cache TTL      : {}
                ║    Approval       : {} min default, escalate after {} rejections
                ╠══════════════════════════════════════════════════════════╣
                ║  Collaboration                                           ║
                ║    Conflict window: {}  (max {} changes)
                ║    Snapshot above : {} words
                ║    Executor       : {} threads
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                probeDatabase(),

                permissionProperties.minorEditThreshold(),
                permissionProperties.sectionThreshold(),
                permissionProperties.sessionWindow(),
                permissionProperties.dailyResetHourUtc(),
                permissionProperties.cacheTtl(),
                permissionProperties.defaultApprovalTimeoutMinutes(),
                permissionProperties.rejectionEscalationThreshold(),

                collaborationProperties.conflictWindow(),
                collaborationProperties.historyLimit(),
                collaborationProperties.snapshotWordThreshold(),
                collaborationProperties.executorThreads()
        );
    }

    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (Exception e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }
}
