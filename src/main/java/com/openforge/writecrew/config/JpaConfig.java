package com.openforge.writecrew.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Activates Spring Data JPA Auditing so that @CreatedDate / @LastModifiedDate
 * on BaseEntity are populated for permissions, documents, snapshots and the
 * approval archive.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
