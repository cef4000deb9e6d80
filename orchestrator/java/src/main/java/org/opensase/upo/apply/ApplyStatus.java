package org.opensase.upo.apply;

public enum ApplyStatus {
    APPLIED("applied"),
    DRY_RUN_ONLY("dry-run-only"),
    FAILED("failed");

    private final String value;

    ApplyStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
