package com.openforge.writecrew.document;

import com.openforge.writecrew.domain.DocumentSnapshot;
import com.openforge.writecrew.domain.SharedDocument;
import com.openforge.writecrew.repository.DocumentSnapshotRepository;
import com.openforge.writecrew.repository.SharedDocumentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaDocumentStore implements DocumentStore {

    private final SharedDocumentRepository   documentRepository;
    private final DocumentSnapshotRepository snapshotRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<DocumentState> load(String documentId) {
        return documentRepository.findByDocumentId(documentId).map(JpaDocumentStore::toState);
    }

    @Override
    @Transactional
    public void save(DocumentState state) {
        SharedDocument doc = documentRepository.findByDocumentId(state.documentId())
                .orElseGet(() -> SharedDocument.builder().documentId(state.documentId()).build());
        doc.setTitle(state.title());
        doc.setContent(state.content());
        doc.setRevision(state.version());
        doc.setWordCount(state.wordCount());
        doc.setLastModifiedBy(state.lastModifiedBy());
        doc.setLastModifiedAt(state.lastModifiedAt());
        documentRepository.save(doc);
    }

    @Override
    @Transactional
    public void saveVersion(DocumentVersion version) {
        snapshotRepository.save(DocumentSnapshot.builder()
                .documentId(version.documentId())
                .version(version.version())
                .content(version.content())
                .wordCount(version.wordCount())
                .createdBy(version.createdBy())
                .snapshotAt(version.createdAt())
                .changesSummary(version.changesSummary())
                .build());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DocumentVersion> loadVersion(String documentId, long version) {
        return snapshotRepository.findByDocumentIdAndVersion(documentId, version).map(JpaDocumentStore::toVersion);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DocumentVersion> listVersions(String documentId) {
        return snapshotRepository.findByDocumentIdOrderByVersionDesc(documentId).stream()
                .map(JpaDocumentStore::toVersion)
                .toList();
    }

    private static DocumentState toState(SharedDocument d) {
        return new DocumentState(d.getDocumentId(), d.getTitle(), d.getContent(), d.getRevision(),
                d.getLastModifiedAt(), d.getLastModifiedBy(), d.getWordCount());
    }

    private static DocumentVersion toVersion(DocumentSnapshot s) {
        return new DocumentVersion(s.getDocumentId(), s.getVersion(), s.getContent(), s.getWordCount(),
                s.getCreatedBy(), s.getSnapshotAt(), s.getChangesSummary());
    }
}
