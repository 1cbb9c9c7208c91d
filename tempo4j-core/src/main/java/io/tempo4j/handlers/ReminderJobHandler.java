package io.tempo4j.handlers;

import io.tempo4j.JobContext;
import io.tempo4j.JobHandler;
import io.tempo4j.interaction.ChatTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Sends a fixed reminder text to the tenant's chat.
 */
public class ReminderJobHandler implements JobHandler<ReminderData> {
    private static final Logger log = LoggerFactory.getLogger(ReminderJobHandler.class);

    public static final String KIND = "reminder";
    static final String PREFIX = "🔔 Reminder: ";

    private final ChatTransport transport;

    public ReminderJobHandler(ChatTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public Class<ReminderData> dataClass() {
        return ReminderData.class;
    }

    @Override
    public void execute(JobContext context, ReminderData data) {
        if (data == null || data.message() == null || data.message().isBlank()) {
            log.warn("reminder without message, nothing sent jobId={}", context.jobId());
            return;
        }
        String chatId = data.chatId() != null ? data.chatId() : context.ownerId();
        transport.sendMessage(chatId, PREFIX + data.message());
        log.info("reminder sent jobId={} chat={}", context.jobId(), chatId);
    }
}
