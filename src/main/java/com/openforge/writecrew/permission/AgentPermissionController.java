package com.openforge.writecrew.permission;

import com.openforge.writecrew.auth.AuthenticatedUser;
import com.openforge.writecrew.auth.CurrentUser;
import com.openforge.writecrew.permission.dto.EvaluateRequest;
import com.openforge.writecrew.permission.dto.PermissionChangeResponse;
import com.openforge.writecrew.permission.dto.PermissionsRequest;
import com.openforge.writecrew.usage.UsageReport;
import com.openforge.writecrew.usage.UsageTracker;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * REST API for agent permissions.
 *
 * Endpoints:
 *   POST /api/agents/{id}/permissions           : attach the agent to a document
 *   GET  /api/agents/{id}/permissions           : current permissions
 *   PUT  /api/agents/{id}/permissions           : replace permissions (owner only)
 *   GET  /api/agents/{id}/permissions/history   : level changes, newest first
 *   POST /api/agents/{id}/evaluate              : dry-run a proposed action
 *   GET  /api/agents/{id}/usage                 : rolling usage counters
 */
@RestController
@RequestMapping("/api/agents/{agentInstanceId}")
@RequiredArgsConstructor
public class AgentPermissionController {

    private final AgentPermissionService permissionService;
    private final PermissionEngine       permissionEngine;
    private final UsageTracker           usageTracker;
    private final Clock                  clock;

    // ── Permissions ──────────────────────────────────────────────────────────

    @PostMapping("/permissions")
    public ResponseEntity<AgentPermissions> attach(@PathVariable String agentInstanceId,
                                                   @Valid @RequestBody PermissionsRequest request) {
        if (request.documentId() == null || request.documentId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "documentId is required to attach an agent");
        }
        AuthenticatedUser user = CurrentUser.require();
        AgentPermissions attached = permissionService.attach(
                agentInstanceId, request.documentId(), user.userId(), request.toPermissions());
        return ResponseEntity.status(HttpStatus.CREATED).body(attached);
    }

    @GetMapping("/permissions")
    public AgentPermissions get(@PathVariable String agentInstanceId) {
        return permissionService.require(agentInstanceId);
    }

    @PutMapping("/permissions")
    public AgentPermissions update(@PathVariable String agentInstanceId,
                                   @Valid @RequestBody PermissionsRequest request) {
        AuthenticatedUser user = CurrentUser.require();
        AgentPermissions current = permissionService.require(agentInstanceId);
        if (!user.userId().equals(current.ownerId())) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Only the owner can change agent permissions");
        }
        return permissionService.updatePermissions(agentInstanceId, request.toPermissions(), user.userId());
    }

    @GetMapping("/permissions/history")
    public List<PermissionChangeResponse> history(@PathVariable String agentInstanceId) {
        return permissionService.history(agentInstanceId).stream()
                .map(PermissionChangeResponse::from)
                .toList();
    }

    // ── Evaluation & usage ───────────────────────────────────────────────────

    @PostMapping("/evaluate")
    public PermissionEvaluationResult evaluate(@PathVariable String agentInstanceId,
                                               @Valid @RequestBody EvaluateRequest request) {
        AuthenticatedUser user = CurrentUser.require();
        Instant now = clock.instant();
        String documentId = permissionService.find(agentInstanceId)
                .map(AgentPermissions::documentId)
                .orElse(null);
        return permissionEngine.evaluate(agentInstanceId, request.toAction(now),
                request.toContext(user, documentId, now));
    }

    @GetMapping("/usage")
    public UsageReport usage(@PathVariable String agentInstanceId) {
        permissionService.require(agentInstanceId);
        return usageTracker.snapshot(agentInstanceId);
    }
}
