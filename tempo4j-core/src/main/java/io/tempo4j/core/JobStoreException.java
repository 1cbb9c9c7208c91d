package io.tempo4j.core;

/**
 * A job store or schedule registry operation failed. Nothing was silently dropped: the caller decides
 * whether to retry or to surface the failure.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
