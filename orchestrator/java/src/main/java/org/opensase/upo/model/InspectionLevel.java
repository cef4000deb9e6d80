package org.opensase.upo.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Traffic inspection depth, ordered from weakest to strongest.
 */
public enum InspectionLevel {
    NONE("none"),
    BASIC("basic"),
    DEEP("deep");

    private final String value;

    InspectionLevel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isAtLeast(InspectionLevel other) {
        return compareTo(other) >= 0;
    }

    public static InspectionLevel strongest(InspectionLevel a, InspectionLevel b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static Optional<InspectionLevel> fromValue(String value) {
        return Arrays.stream(values()).filter(l -> l.value.equals(value)).findFirst();
    }
}
