package org.opensase.upo.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * What an egress rule does with matching traffic.
 */
public enum Action {
    ALLOW("allow"),
    DENY("deny"),
    INSPECT("inspect");

    private final String value;

    Action(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** True for actions that let traffic through (allow, inspect). */
    public boolean permits() {
        return this != DENY;
    }

    public static Optional<Action> fromValue(String value) {
        return Arrays.stream(values()).filter(a -> a.value.equals(value)).findFirst();
    }
}
