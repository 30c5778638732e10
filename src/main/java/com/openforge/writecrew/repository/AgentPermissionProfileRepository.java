package com.openforge.writecrew.repository;

import com.openforge.writecrew.domain.AgentPermissionProfile;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface AgentPermissionProfileRepository extends JpaRepository<AgentPermissionProfile, Long> {

    Optional<AgentPermissionProfile> findByAgentInstanceId(String agentInstanceId);

    boolean existsByAgentInstanceId(String agentInstanceId);

    List<AgentPermissionProfile> findByDocumentId(String documentId);
}
