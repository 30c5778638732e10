package com.openforge.writecrew.permission;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.openforge.writecrew.domain.AgentPermissionProfile;
import com.openforge.writecrew.domain.PermissionChange;
import com.openforge.writecrew.repository.AgentPermissionProfileRepository;
import com.openforge.writecrew.repository.PermissionChangeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;

/**
 * Owns stored agent permissions.
 *
 * Reads go through a Caffeine cache keyed by agent instance id.  Updates
 * are deliberately non-transactional at this level: the repository save
 * commits first, then listeners are told, and the cache entry is dropped as
 * the very last step so no reader can reload the old row after we return.
 */
@Slf4j
@Service
public class AgentPermissionService {

    private final AgentPermissionProfileRepository profileRepository;
    private final PermissionChangeRepository       changeRepository;
    private final ApplicationEventPublisher        events;
    private final ObjectMapper                     objectMapper;
    private final PermissionProperties             properties;
    private final Cache<String, AgentPermissions>  cache;

    public AgentPermissionService(AgentPermissionProfileRepository profileRepository,
                                  PermissionChangeRepository changeRepository,
                                  ApplicationEventPublisher events,
                                  ObjectMapper objectMapper,
                                  PermissionProperties properties) {
        this.profileRepository = profileRepository;
        this.changeRepository  = changeRepository;
        this.events            = events;
        this.objectMapper      = objectMapper;
        this.properties        = properties;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(properties.cacheTtl())
                .maximumSize(10_000)
                .build();
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    public Optional<AgentPermissions> find(String agentInstanceId) {
        return Optional.ofNullable(cache.get(agentInstanceId, id ->
                profileRepository.findByAgentInstanceId(id)
                        .map(AgentPermissions::from)
                        .orElse(null)));
    }

    public AgentPermissions require(String agentInstanceId) {
        return find(agentInstanceId)
                .orElseThrow(() -> new AgentPermissionsNotFoundException(agentInstanceId));
    }

    public List<PermissionChange> history(String agentInstanceId) {
        if (!profileRepository.existsByAgentInstanceId(agentInstanceId)) {
            throw new AgentPermissionsNotFoundException(agentInstanceId);
        }
        return changeRepository.findByAgentInstanceIdOrderByCreateTimeDesc(agentInstanceId);
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    /**
     * Attaches an agent instance to a document with the given permissions.
     *
     * @throws ResponseStatusException     409 if the instance is already attached
     * @throws InvalidPermissionsException if the permissions are inconsistent
     */
    public AgentPermissions attach(String agentInstanceId, String documentId, Long ownerId,
                                   AgentPermissions requested) {
        if (profileRepository.existsByAgentInstanceId(agentInstanceId)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Agent instance already attached: " + agentInstanceId);
        }
        AgentPermissions permissions = requested.toBuilder()
                .agentInstanceId(agentInstanceId)
                .documentId(documentId)
                .ownerId(ownerId)
                .build()
                .withDefaults(properties.defaultApprovalTimeoutMinutes())
                .validate();

        AgentPermissionProfile profile = AgentPermissionProfile.builder()
                .agentInstanceId(agentInstanceId)
                .documentId(documentId)
                .ownerId(ownerId)
                .build();
        permissions.copyInto(profile);
        profileRepository.save(profile);
        recordChange(null, permissions, ownerId);

        events.publishEvent(new PermissionsChangedEvent(agentInstanceId, null, permissions, ownerId));
        cache.invalidate(agentInstanceId);

        log.info("[Permission] Attached agent={} document={} level={} scope={}",
                agentInstanceId, documentId, permissions.autonomyLevel(), permissions.approvalScope());
        return permissions;
    }

    /**
     * Replaces the stored permissions.  Identity and ownership fields of
     * {@code newPermissions} are ignored.  When this returns, every
     * subsequent {@link #find} sees the new values.
     */
    public AgentPermissions updatePermissions(String agentInstanceId, AgentPermissions newPermissions,
                                              Long updatedBy) {
        AgentPermissionProfile profile = profileRepository.findByAgentInstanceId(agentInstanceId)
                .orElseThrow(() -> new AgentPermissionsNotFoundException(agentInstanceId));
        AgentPermissions previous = AgentPermissions.from(profile);

        AgentPermissions updated = newPermissions.toBuilder()
                .agentInstanceId(agentInstanceId)
                .documentId(profile.getDocumentId())
                .ownerId(profile.getOwnerId())
                .build()
                .withDefaults(properties.defaultApprovalTimeoutMinutes())
                .validate();

        updated.copyInto(profile);
        profileRepository.save(profile);
        recordChange(previous, updated, updatedBy);

        events.publishEvent(new PermissionsChangedEvent(agentInstanceId, previous, updated, updatedBy));
        cache.invalidate(agentInstanceId);

        log.info("[Permission] Updated agent={} level {} -> {} by user={}",
                agentInstanceId, previous.autonomyLevel(), updated.autonomyLevel(), updatedBy);
        return updated;
    }

    private void recordChange(AgentPermissions previous, AgentPermissions current, Long updatedBy) {
        changeRepository.save(PermissionChange.builder()
                .agentInstanceId(current.agentInstanceId())
                .previousLevel(previous == null ? null : previous.autonomyLevel())
                .newLevel(current.autonomyLevel())
                .updatedBy(updatedBy)
                .snapshotJson(toJson(current))
                .build());
    }

    private String toJson(AgentPermissions permissions) {
        try {
            return objectMapper.writeValueAsString(permissions);
        } catch (JsonProcessingException e) {
            log.warn("[Permission] Could not serialize permissions snapshot: {}", e.getMessage());
            return null;
        }
    }
}
