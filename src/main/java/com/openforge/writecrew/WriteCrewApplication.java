package com.openforge.writecrew;

import com.openforge.writecrew.document.CollaborationProperties;
import com.openforge.writecrew.permission.PermissionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

// Scheduling drives the approval expiry sweep and the usage-ledger reconciliation.
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({PermissionProperties.class, CollaborationProperties.class})
public class WriteCrewApplication {

    public static void main(String[] args) {
        SpringApplication.run(WriteCrewApplication.class, args);
    }
}
