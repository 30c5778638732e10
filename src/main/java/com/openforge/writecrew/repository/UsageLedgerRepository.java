package com.openforge.writecrew.repository;

import com.openforge.writecrew.domain.UsageLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface UsageLedgerRepository extends JpaRepository<UsageLedgerEntry, Long> {

    List<UsageLedgerEntry> findByAgentInstanceIdOrderByRecordedAtDesc(String agentInstanceId);
}
