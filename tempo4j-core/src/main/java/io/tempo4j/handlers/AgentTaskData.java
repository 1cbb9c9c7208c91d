package io.tempo4j.handlers;

/**
 * Payload of an agent task job.
 *
 * @param prompt       what the agent should do
 * @param chatId       chat the result is sent to; defaults to the job owner
 * @param chatWithUser whether the agent may ask the tenant questions while it runs
 */
public record AgentTaskData(String prompt, String chatId, boolean chatWithUser) {
}
