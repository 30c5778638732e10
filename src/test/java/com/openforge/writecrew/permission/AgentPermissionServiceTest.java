package com.openforge.writecrew.permission;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.writecrew.domain.AgentPermissionProfile;
import com.openforge.writecrew.domain.PermissionChange;
import com.openforge.writecrew.repository.AgentPermissionProfileRepository;
import com.openforge.writecrew.repository.PermissionChangeRepository;
import com.openforge.writecrew.support.TestPermissions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentPermissionServiceTest {

    private AgentPermissionProfileRepository profileRepository;
    private PermissionChangeRepository changeRepository;
    private ApplicationEventPublisher events;
    private AgentPermissionService service;
    private AgentPermissionProfile stored;

    @BeforeEach
    void setUp() {
        profileRepository = mock(AgentPermissionProfileRepository.class);
        changeRepository = mock(PermissionChangeRepository.class);
        events = mock(ApplicationEventPublisher.class);
        service = new AgentPermissionService(profileRepository, changeRepository, events,
                new ObjectMapper(), PermissionProperties.defaults());

        stored = AgentPermissionProfile.builder()
                .agentInstanceId("agent-1")
                .documentId("doc-1")
                .ownerId(7L)
                .build();
        TestPermissions.at(AutonomyLevel.COLLABORATIVE).build().copyInto(stored);
        when(profileRepository.findByAgentInstanceId("agent-1")).thenReturn(Optional.of(stored));
        when(profileRepository.existsByAgentInstanceId("agent-1")).thenReturn(true);
    }

    @Test
    @DisplayName("reads are served from the cache after the first load")
    void findIsCached() {
        service.find("agent-1");
        service.find("agent-1");

        verify(profileRepository, times(1)).findByAgentInstanceId("agent-1");
        assertThat(service.require("agent-1").autonomyLevel()).isEqualTo(AutonomyLevel.COLLABORATIVE);
    }

    @Test
    @DisplayName("unknown agents are not cached and require() throws")
    void unknownAgent() {
        when(profileRepository.findByAgentInstanceId("ghost")).thenReturn(Optional.empty());

        assertThat(service.find("ghost")).isEmpty();
        assertThat(service.find("ghost")).isEmpty();
        verify(profileRepository, times(2)).findByAgentInstanceId("ghost");
        assertThatThrownBy(() -> service.require("ghost")).isInstanceOf(AgentPermissionsNotFoundException.class);
    }

    @Test
    @DisplayName("a read after an update sees the new values")
    void updateInvalidatesCache() {
        assertThat(service.require("agent-1").autonomyLevel()).isEqualTo(AutonomyLevel.COLLABORATIVE);

        service.updatePermissions("agent-1",
                TestPermissions.at(AutonomyLevel.SEMI_AUTONOMOUS).approvalScope(null).build(), 7L);

        AgentPermissions current = service.require("agent-1");
        assertThat(current.autonomyLevel()).isEqualTo(AutonomyLevel.SEMI_AUTONOMOUS);
        assertThat(current.approvalScope()).isEqualTo(ApprovalScope.SECTION);
    }

    @Test
    @DisplayName("update persists, audits, then publishes the change event")
    void updatePublishesAfterSave() {
        service.updatePermissions("agent-1", TestPermissions.at(AutonomyLevel.FULLY_AUTONOMOUS).build(), 9L);

        InOrder order = inOrder(profileRepository, changeRepository, events);
        order.verify(profileRepository).save(stored);
        ArgumentCaptor<PermissionChange> change = ArgumentCaptor.forClass(PermissionChange.class);
        order.verify(changeRepository).save(change.capture());
        ArgumentCaptor<PermissionsChangedEvent> event = ArgumentCaptor.forClass(PermissionsChangedEvent.class);
        order.verify(events).publishEvent(event.capture());

        assertThat(change.getValue().getPreviousLevel()).isEqualTo(AutonomyLevel.COLLABORATIVE);
        assertThat(change.getValue().getNewLevel()).isEqualTo(AutonomyLevel.FULLY_AUTONOMOUS);
        assertThat(change.getValue().getUpdatedBy()).isEqualTo(9L);
        assertThat(change.getValue().getSnapshotJson()).contains("FULLY_AUTONOMOUS");
        assertThat(event.getValue().autonomyIncreased()).isTrue();
    }

    @Test
    @DisplayName("update keeps identity and ownership of the stored row")
    void updateIgnoresIdentityFields() {
        AgentPermissions requested = TestPermissions.at(AutonomyLevel.ASSISTANT)
                .agentInstanceId("other")
                .documentId("other-doc")
                .ownerId(99L)
                .build();

        AgentPermissions updated = service.updatePermissions("agent-1", requested, 7L);

        assertThat(updated.agentInstanceId()).isEqualTo("agent-1");
        assertThat(updated.documentId()).isEqualTo("doc-1");
        assertThat(updated.ownerId()).isEqualTo(7L);
    }

    @Test
    @DisplayName("an approval scope wider than the level allows is rejected and nothing is stored")
    void invalidScopeRejected() {
        AgentPermissions tooWide = TestPermissions.at(AutonomyLevel.ASSISTANT)
                .approvalScope(ApprovalScope.DOCUMENT)
                .build();

        assertThatThrownBy(() -> service.updatePermissions("agent-1", tooWide, 7L))
                .isInstanceOf(InvalidPermissionsException.class)
                .hasMessageContaining("DOCUMENT");
        verify(profileRepository, never()).save(any());
        verify(events, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("updating an unattached agent fails")
    void updateUnknownAgent() {
        when(profileRepository.findByAgentInstanceId("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.updatePermissions("ghost",
                TestPermissions.at(AutonomyLevel.ASSISTANT).build(), 7L))
                .isInstanceOf(AgentPermissionsNotFoundException.class);
    }

    @Test
    @DisplayName("attaching an already attached agent is a conflict")
    void attachTwiceConflicts() {
        assertThatThrownBy(() -> service.attach("agent-1", "doc-1", 7L,
                TestPermissions.at(AutonomyLevel.ASSISTANT).build()))
                .isInstanceOf(ResponseStatusException.class)
                .satisfies(e -> assertThat(((ResponseStatusException) e).getStatusCode()).isEqualTo(HttpStatus.CONFLICT));
    }

    @Test
    @DisplayName("attach fills the default scope and timeout")
    void attachAppliesDefaults() {
        when(profileRepository.existsByAgentInstanceId("agent-2")).thenReturn(false);

        AgentPermissions attached = service.attach("agent-2", "doc-9", 3L,
                TestPermissions.at(AutonomyLevel.COLLABORATIVE).approvalScope(null).approvalTimeoutMinutes(0).build());

        assertThat(attached.approvalScope()).isEqualTo(ApprovalScope.PARAGRAPH);
        assertThat(attached.approvalTimeoutMinutes()).isEqualTo(5);
        assertThat(attached.documentId()).isEqualTo("doc-9");
        verify(profileRepository).save(any(AgentPermissionProfile.class));
    }
}
