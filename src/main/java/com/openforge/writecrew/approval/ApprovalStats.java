package com.openforge.writecrew.approval;

import java.util.Map;

/**
 * @param archived    terminal requests per status, from the archive table
 * @param activeAgents agents with at least one pending request
 */
public record ApprovalStats(int pending, Map<ApprovalStatus, Long> archived, int activeAgents) {
}
