package io.tempo4j.interaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Per-tenant single-slot rendezvous between a background task and the inbound message path.
 *
 * <p>A task calls {@link #ask} to publish a question and block until the tenant answers. The message
 * handling path calls {@link #deliver} for every inbound message; it returns {@code true} only when the
 * message was consumed as the answer to a pending question.
 *
 * <p>Guarantees:
 * <ul>
 *   <li>at most one outstanding question per tenant; a second {@code ask} is rejected, never merged</li>
 *   <li>the slot is claimed before the question is sent, so a fast reply cannot be lost</li>
 *   <li>each reply is handed to exactly one {@code ask}; a reply with no pending question is refused</li>
 *   <li>a blocked {@code ask} always ends: with the reply, a timeout, or a cancellation</li>
 * </ul>
 */
public class InteractionBridge {
    private static final Logger log = LoggerFactory.getLogger(InteractionBridge.class);

    private final Map<String, Slot> slots = new ConcurrentHashMap<>();
    private final ChatTransport transport;
    private final Duration defaultTimeout;

    public InteractionBridge(ChatTransport transport, Duration defaultTimeout) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
        if (defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTimeout must be a positive duration");
        }
    }

    public String ask(String tenantId, String chatId, String question) throws InterruptedException {
        return ask(tenantId, chatId, question, defaultTimeout);
    }

    /**
     * Publish {@code question} to the tenant and block the calling thread until the reply arrives.
     *
     * @throws QuestionAlreadyPendingException if the tenant already has an unanswered question
     * @throws InteractionTimeoutException     if no reply arrives within {@code timeout}
     * @throws InteractionCancelledException   if the question is cancelled while waiting
     * @throws InterruptedException            if the waiting thread is interrupted
     */
    public String ask(String tenantId, String chatId, String question, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(chatId, "chatId must not be null");
        Objects.requireNonNull(question, "question must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        Slot slot = new Slot(question, new CompletableFuture<>());
        Slot existing = slots.putIfAbsent(tenantId, slot);
        if (existing != null) {
            throw new QuestionAlreadyPendingException(tenantId, existing.question());
        }

        try {
            transport.sendMessage(chatId, question);
        } catch (RuntimeException e) {
            slots.remove(tenantId, slot);
            throw e;
        }
        log.debug("interaction question sent tenant={} chat={}", tenantId, chatId);

        try {
            return slot.reply().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (slots.remove(tenantId, slot)) {
                log.info("interaction timed out tenant={} timeout={}", tenantId, timeout);
                throw new InteractionTimeoutException(tenantId, timeout);
            }
            // deliver() or cancel() claimed the slot concurrently and will complete it.
            return awaitClaimed(slot);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } finally {
            slots.remove(tenantId, slot);
        }
    }

    /**
     * Hand {@code reply} to the tenant's pending question.
     *
     * @return {@code false} if no question was pending; the message is then ordinary traffic
     */
    public boolean deliver(String tenantId, String reply) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Slot slot = slots.remove(tenantId);
        if (slot == null) {
            return false;
        }
        boolean accepted = slot.reply().complete(reply);
        log.debug("interaction reply delivered tenant={} accepted={}", tenantId, accepted);
        return accepted;
    }

    /**
     * Clear the tenant's slot and release a blocked {@code ask} with {@link InteractionCancelledException}.
     *
     * @return {@code true} if a question was pending
     */
    public boolean cancel(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Slot slot = slots.remove(tenantId);
        if (slot == null) {
            return false;
        }
        slot.reply().completeExceptionally(new InteractionCancelledException(tenantId));
        log.info("interaction cancelled tenant={}", tenantId);
        return true;
    }

    public boolean isAwaiting(String tenantId) {
        return tenantId != null && slots.containsKey(tenantId);
    }

    public Optional<String> pendingQuestion(String tenantId) {
        Slot slot = tenantId == null ? null : slots.get(tenantId);
        return slot == null ? Optional.empty() : Optional.of(slot.question());
    }

    private static String awaitClaimed(Slot slot) throws InterruptedException {
        try {
            return slot.reply().get();
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    private static RuntimeException unwrap(ExecutionException e) {
        if (e.getCause() instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException("Unexpected interaction failure", e.getCause());
    }

    private record Slot(String question, CompletableFuture<String> reply) {
    }
}
