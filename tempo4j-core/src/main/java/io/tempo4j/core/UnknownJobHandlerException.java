package io.tempo4j.core;

public class UnknownJobHandlerException extends IllegalArgumentException {

    private final String handlerKind;

    public UnknownJobHandlerException(String handlerKind) {
        super("No JobHandler registered for kind: " + handlerKind);
        this.handlerKind = handlerKind;
    }

    public String handlerKind() {
        return handlerKind;
    }
}
