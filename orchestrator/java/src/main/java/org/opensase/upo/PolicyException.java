package org.opensase.upo;

/**
 * Base type for failures of a pipeline stage. Each subtype names the smallest failing unit
 * (a document path, a rule identifier) in {@link #location()}.
 */
public abstract class PolicyException extends RuntimeException {

    protected PolicyException(String message) {
        super(message);
    }

    protected PolicyException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Where the failure was detected, e.g. {@code egressRules[3].destination}. */
    public abstract String location();
}
