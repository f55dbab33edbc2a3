package com.agentmeta.common.exception;

/**
 * Failure inside one component of the meta-evaluation engine. Always absorbed at
 * the owning service's boundary; never surfaces out of a cycle.
 */
public class MetaEvaluationException extends RuntimeException {
    private final String component;

    public MetaEvaluationException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public MetaEvaluationException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
