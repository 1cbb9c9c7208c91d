package io.tempo4j.core;

import io.tempo4j.JobHandler;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maps symbolic handler kinds to live {@link JobHandler} implementations.
 *
 * <p>Built once at process start; persisted jobs are bound to a handler through this registry.
 */
public class JobHandlerRegistry {

    private final Map<String, JobHandler<?>> handlersByKind;

    public JobHandlerRegistry(List<JobHandler<?>> handlers) {
        this.handlersByKind = handlers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        JobHandler::kind,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate JobHandler kind: " + a.kind());
                        }
                ));
    }

    public JobHandler<?> getRequired(String kind) {
        JobHandler<?> handler = kind == null ? null : handlersByKind.get(kind);
        if (handler == null) {
            throw new UnknownJobHandlerException(kind);
        }
        return handler;
    }

    public Optional<JobHandler<?>> find(String kind) {
        return Optional.ofNullable(kind == null ? null : handlersByKind.get(kind));
    }

    public boolean contains(String kind) {
        return kind != null && handlersByKind.containsKey(kind);
    }

    public Set<String> kinds() {
        return handlersByKind.keySet();
    }
}
