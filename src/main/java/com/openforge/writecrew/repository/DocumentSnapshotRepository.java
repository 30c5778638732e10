package com.openforge.writecrew.repository;

import com.openforge.writecrew.domain.DocumentSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface DocumentSnapshotRepository extends JpaRepository<DocumentSnapshot, Long> {

    Optional<DocumentSnapshot> findByDocumentIdAndVersion(String documentId, long version);

    List<DocumentSnapshot> findByDocumentIdOrderByVersionDesc(String documentId);
}
