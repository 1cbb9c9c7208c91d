package io.tempo4j.interaction;

public class InteractionCancelledException extends InteractionException {

    public InteractionCancelledException(String tenantId) {
        super(tenantId, "Pending question for tenant " + tenantId + " was cancelled");
    }
}
