package io.tempo4j.handlers;

import io.tempo4j.JobContext;
import io.tempo4j.JobHandler;
import io.tempo4j.interaction.ChatTransport;
import io.tempo4j.interaction.InteractionBridge;
import io.tempo4j.interaction.TaskHandle;
import io.tempo4j.interaction.TaskSupervisor;
import io.tempo4j.interaction.TenantConversation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Runs an {@link AgentTaskRunner} as the tenant's supervised background task and sends its result.
 *
 * <p>The firing lasts as long as the task, so the job is not rescheduled until the task is over.
 */
public class AgentTaskJobHandler implements JobHandler<AgentTaskData> {
    private static final Logger log = LoggerFactory.getLogger(AgentTaskJobHandler.class);

    public static final String KIND = "agent_task";

    private final AgentTaskRunner runner;
    private final TaskSupervisor supervisor;
    private final InteractionBridge bridge;
    private final ChatTransport transport;

    public AgentTaskJobHandler(AgentTaskRunner runner, TaskSupervisor supervisor,
                               InteractionBridge bridge, ChatTransport transport) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor must not be null");
        this.bridge = Objects.requireNonNull(bridge, "bridge must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public Class<AgentTaskData> dataClass() {
        return AgentTaskData.class;
    }

    @Override
    public void execute(JobContext context, AgentTaskData data) throws Exception {
        if (data == null || data.prompt() == null || data.prompt().isBlank()) {
            log.warn("agent task without prompt, skipped jobId={}", context.jobId());
            return;
        }
        String tenantId = context.ownerId();
        String chatId = data.chatId() != null ? data.chatId() : tenantId;
        TenantConversation conversation =
                new TenantConversation(bridge, transport, tenantId, chatId, data.chatWithUser());

        TaskHandle handle = supervisor.start(tenantId, KIND + ":" + context.jobId(), () -> {
            String result;
            try {
                result = runner.run(data, conversation);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Agent task interrupted");
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
            if (result != null && !result.isBlank()) {
                conversation.send(result);
            }
        });

        try {
            handle.completion().get();
        } catch (CancellationException e) {
            log.info("agent task cancelled jobId={} tenant={}", context.jobId(), tenantId);
        } catch (InterruptedException e) {
            supervisor.cancel(tenantId);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause()
                    : e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        }
    }
}
