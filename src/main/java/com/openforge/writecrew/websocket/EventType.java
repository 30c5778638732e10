package com.openforge.writecrew.websocket;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classifies every event pushed over WebSocket.  Serialized in snake_case,
 * which is what the add-in switches on.
 */
public enum EventType {

    /** An applied change.  payload = DocumentChangePayload. */
    DOCUMENT_CHANGE("document_change"),

    /** An agent is waiting on a human.  payload = ApprovalRequestPayload. */
    APPROVAL_REQUEST("approval_request"),

    /** Approved, rejected, expired or withdrawn.  payload = ApprovalResolvedPayload. */
    APPROVAL_RESOLVED("approval_resolved"),

    /** payload = PermissionsChangedPayload. */
    PERMISSIONS_CHANGED("permissions_changed"),

    /** Too many rejections in a row; the user may want to lower autonomy. */
    ESCALATION("escalation"),

    /** Produced content was larger than its estimate allowed. */
    POLICY_VIOLATION("policy_violation");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
