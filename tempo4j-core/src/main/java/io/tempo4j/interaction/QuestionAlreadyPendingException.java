package io.tempo4j.interaction;

/**
 * A second question was asked for a tenant while an earlier one is still unanswered.
 */
public class QuestionAlreadyPendingException extends InteractionException {

    public QuestionAlreadyPendingException(String tenantId, String pendingQuestion) {
        super(tenantId, "Tenant " + tenantId + " already has a pending question: '" + pendingQuestion + "'");
    }
}
