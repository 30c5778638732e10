package com.openforge.writecrew.permission;

import com.openforge.writecrew.common.CollaborationException;

public class AgentPermissionsNotFoundException extends CollaborationException {

    public AgentPermissionsNotFoundException(String agentInstanceId) {
        super("Permissions not found for agent instance " + agentInstanceId);
    }

    @Override
    public String errorCode() {
        return "permissions_not_found";
    }
}
