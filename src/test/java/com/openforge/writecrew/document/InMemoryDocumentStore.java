package com.openforge.writecrew.document;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed store for tests.
 */
class InMemoryDocumentStore implements DocumentStore {

    final Map<String, DocumentState> states = new ConcurrentHashMap<>();
    final List<DocumentVersion> versions = new ArrayList<>();

    @Override
    public Optional<DocumentState> load(String documentId) {
        return Optional.ofNullable(states.get(documentId));
    }

    @Override
    public void save(DocumentState state) {
        states.put(state.documentId(), state);
    }

    @Override
    public synchronized void saveVersion(DocumentVersion version) {
        versions.add(version);
    }

    @Override
    public synchronized Optional<DocumentVersion> loadVersion(String documentId, long version) {
        return versions.stream()
                .filter(v -> v.documentId().equals(documentId) && v.version() == version)
                .findFirst();
    }

    @Override
    public synchronized List<DocumentVersion> listVersions(String documentId) {
        List<DocumentVersion> result = new ArrayList<>(versions.stream()
                .filter(v -> v.documentId().equals(documentId))
                .toList());
        result.sort(Comparator.comparingLong(DocumentVersion::version).reversed());
        return result;
    }
}
