package com.openforge.writecrew.agent;

import com.openforge.writecrew.permission.AgentAction;

/**
 * The AI side of an action: turns an approved {@link AgentAction} into text.
 * Called on a collaborationExecutor thread; may block.
 */
@FunctionalInterface
public interface ContentProducer {

    ProducedContent produce(AgentAction action) throws Exception;
}
