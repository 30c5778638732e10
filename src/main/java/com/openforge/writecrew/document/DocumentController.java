package com.openforge.writecrew.document;

import com.openforge.writecrew.auth.CurrentUser;
import com.openforge.writecrew.document.dto.ChangeRequest;
import com.openforge.writecrew.document.dto.CreateDocumentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;

/**
 * REST API for shared documents.
 *
 * Endpoints:
 *   POST /api/documents                         : create
 *   GET  /api/documents/{id}                    : current state
 *   POST /api/documents/{id}/changes            : apply a human edit (409 on overlap with a concurrent edit)
 *   GET  /api/documents/{id}/versions           : stored snapshots, newest first
 *   POST /api/documents/{id}/revert/{version}   : restore a snapshot as a new version
 *
 * Live changes are pushed on /topic/documents/{id}.
 */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentStateManager documentStateManager;
    private final Clock                clock;

    @PostMapping
    public ResponseEntity<DocumentState> create(@Valid @RequestBody CreateDocumentRequest request) {
        DocumentState state = documentStateManager.createDocument(
                request.title(), request.content(), CurrentUser.require().actorId());
        return ResponseEntity.status(HttpStatus.CREATED).body(state);
    }

    @GetMapping("/{documentId}")
    public DocumentState get(@PathVariable String documentId) {
        return documentStateManager.getState(documentId);
    }

    @PostMapping("/{documentId}/changes")
    public DocumentState applyChange(@PathVariable String documentId, @Valid @RequestBody ChangeRequest request) {
        DocumentChange change = request.toChange(CurrentUser.require().actorId(), clock.instant());
        return documentStateManager.apply(documentId, change);
    }

    @GetMapping("/{documentId}/versions")
    public List<DocumentVersion> versions(@PathVariable String documentId) {
        return documentStateManager.listVersions(documentId);
    }

    @PostMapping("/{documentId}/revert/{version}")
    public DocumentState revert(@PathVariable String documentId, @PathVariable long version) {
        return documentStateManager.revertToVersion(documentId, version, CurrentUser.require().actorId());
    }
}
