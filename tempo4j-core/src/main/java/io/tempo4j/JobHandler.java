package io.tempo4j;

/**
 * Executable implementation behind a symbolic handler kind.
 *
 * <p>Handlers are registered once at process start. A persisted job stores only {@link #kind()} and a
 * plain-data payload, which is converted back to {@link #dataClass()} before every run.
 */
public interface JobHandler<T> {
    String kind();

    Class<T> dataClass();

    void execute(JobContext context, T data) throws Exception;
}
