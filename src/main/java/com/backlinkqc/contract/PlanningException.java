package com.backlinkqc.contract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured failure raised across the planning/QC boundary.
 *
 * Carries an {@link ErrorKind} plus a small context map so callers (and the
 * HTTP error handler) can react without parsing messages.
 */
public class PlanningException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> context;

    public PlanningException(ErrorKind kind, String message) {
        this(kind, message, Map.of(), null);
    }

    public PlanningException(ErrorKind kind, String message, Map<String, ?> context) {
        this(kind, message, context, null);
    }

    public PlanningException(ErrorKind kind, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public static PlanningException dependencyUnavailable(String dependency, String key, Throwable cause) {
        return new PlanningException(ErrorKind.DEPENDENCY_UNAVAILABLE,
            dependency + " unavailable for " + key,
            Map.of("dependency", dependency, "key", String.valueOf(key)),
            cause);
    }
}
