package io.tempo4j.interaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Decides whether an inbound message answers a pending question or is ordinary traffic.
 */
public class InboundMessageRouter {
    private static final Logger log = LoggerFactory.getLogger(InboundMessageRouter.class);

    public enum Route {
        REPLY,
        ORDINARY
    }

    private final InteractionBridge bridge;
    private final Consumer<InboundMessage> ordinaryHandler;

    public InboundMessageRouter(InteractionBridge bridge, Consumer<InboundMessage> ordinaryHandler) {
        this.bridge = Objects.requireNonNull(bridge, "bridge must not be null");
        this.ordinaryHandler = Objects.requireNonNull(ordinaryHandler, "ordinaryHandler must not be null");
    }

    public Route route(InboundMessage message) {
        Objects.requireNonNull(message, "message must not be null");
        if (bridge.deliver(message.userId(), message.text())) {
            log.debug("inbound message answered pending question tenant={}", message.userId());
            return Route.REPLY;
        }
        ordinaryHandler.accept(message);
        return Route.ORDINARY;
    }
}
