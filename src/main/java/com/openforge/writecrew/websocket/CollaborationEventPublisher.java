package com.openforge.writecrew.websocket;

import com.openforge.writecrew.approval.ApprovalOutcome;
import com.openforge.writecrew.approval.ApprovalRequest;
import com.openforge.writecrew.approval.NotificationSink;
import com.openforge.writecrew.document.CollaborationBroadcaster;
import com.openforge.writecrew.document.DocumentChange;
import com.openforge.writecrew.document.DocumentState;
import com.openforge.writecrew.permission.AgentAction;
import com.openforge.writecrew.permission.PermissionsChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Thin facade over SimpMessagingTemplate: both the presentation-surface
 * broadcaster and the notification sink.
 *
 * Delivery is fire-and-forget.  A failed send is logged and swallowed so
 * it never breaks an apply or an approval transition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CollaborationEventPublisher implements CollaborationBroadcaster, NotificationSink {

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void documentChanged(DocumentChange change, DocumentState state) {
        publish(CollaborationEvent.documentChange(change, state));
    }

    @Override
    public void approvalRequested(ApprovalRequest request) {
        publish(CollaborationEvent.approvalRequest(request));
    }

    @Override
    public void approvalResolved(ApprovalRequest request, ApprovalOutcome outcome) {
        publish(CollaborationEvent.approvalResolved(outcome));
    }

    @Override
    public void escalationSuggested(String agentInstanceId, int consecutiveRejections) {
        publish(CollaborationEvent.escalation(agentInstanceId, consecutiveRejections));
    }

    @Override
    public void policyViolation(String agentInstanceId, AgentAction action, String reason) {
        publish(CollaborationEvent.policyViolation(agentInstanceId, action.actionId(), reason));
    }

    @EventListener
    public void onPermissionsChanged(PermissionsChangedEvent event) {
        publish(CollaborationEvent.permissionsChanged(event.previous(), event.current(), event.updatedBy()));
    }

    public void publish(CollaborationEvent event) {
        try {
            messagingTemplate.convertAndSend(event.destination(), event);
        } catch (Exception e) {
            log.warn("[Publisher] Failed to deliver {} event to {}: {}",
                    event.type(), event.destination(), e.getMessage());
        }
    }
}
