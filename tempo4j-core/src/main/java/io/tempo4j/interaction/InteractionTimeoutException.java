package io.tempo4j.interaction;

import java.time.Duration;

public class InteractionTimeoutException extends InteractionException {

    public InteractionTimeoutException(String tenantId, Duration timeout) {
        super(tenantId, "Tenant " + tenantId + " did not reply within " + timeout);
    }
}
