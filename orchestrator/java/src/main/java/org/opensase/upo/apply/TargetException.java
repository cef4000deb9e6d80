package org.opensase.upo.apply;

import org.opensase.upo.adapter.TargetKind;

import java.io.IOException;

/**
 * A call to a live target failed. Never retried by the orchestrator.
 */
public class TargetException extends IOException {

    private final TargetKind target;

    public TargetException(TargetKind target, String message) {
        super(target + ": " + message);
        this.target = target;
    }

    public TargetException(TargetKind target, String message, Throwable cause) {
        super(target + ": " + message, cause);
        this.target = target;
    }

    public TargetKind target() {
        return target;
    }
}
