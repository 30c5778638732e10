package com.openforge.writecrew.repository;

import com.openforge.writecrew.domain.SharedDocument;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SharedDocumentRepository extends JpaRepository<SharedDocument, Long> {

    Optional<SharedDocument> findByDocumentId(String documentId);
}
