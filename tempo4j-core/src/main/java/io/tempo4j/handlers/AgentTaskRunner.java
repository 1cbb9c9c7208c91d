package io.tempo4j.handlers;

import io.tempo4j.interaction.TenantConversation;

/**
 * Host-provided agent that carries out a scheduled task.
 */
@FunctionalInterface
public interface AgentTaskRunner {

    /**
     * Run the task to completion. May call {@link TenantConversation#ask} when the conversation is
     * interactive.
     *
     * @return text sent to the tenant when the task finishes, or {@code null} for none
     */
    String run(AgentTaskData task, TenantConversation conversation) throws Exception;
}
