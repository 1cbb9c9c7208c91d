package io.tempo4j.interaction;

public class InteractionException extends RuntimeException {

    private final String tenantId;

    public InteractionException(String tenantId, String message) {
        super(message);
        this.tenantId = tenantId;
    }

    public String tenantId() {
        return tenantId;
    }
}
