package com.openforge.writecrew.repository;

import com.openforge.writecrew.approval.ApprovalStatus;
import com.openforge.writecrew.domain.ApprovalRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ApprovalRecordRepository extends JpaRepository<ApprovalRecord, Long> {

    Optional<ApprovalRecord> findByRequestId(String requestId);

    List<ApprovalRecord> findAllByOrderByResolvedAtDesc(Pageable pageable);

    List<ApprovalRecord> findByAgentInstanceIdOrderByResolvedAtDesc(String agentInstanceId, Pageable pageable);

    long countByStatus(ApprovalStatus status);
}
