package com.openforge.writecrew.repository;

import com.openforge.writecrew.domain.PermissionChange;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PermissionChangeRepository extends JpaRepository<PermissionChange, Long> {

    List<PermissionChange> findByAgentInstanceIdOrderByCreateTimeDesc(String agentInstanceId);
}
