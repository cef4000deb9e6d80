package org.opensase.upo.model;

import java.util.List;

/**
 * One declared egress rule. Sources and destinations are unresolved references.
 */
public record EgressRule(
        String name,
        List<String> sources,
        List<String> destinations,
        Action action,
        InspectionLevel inspectionLevel,
        int priority,
        String preferredWan
) {
    public static final int DEFAULT_PRIORITY = 100;

    public EgressRule {
        sources = sources != null ? List.copyOf(sources) : List.of();
        destinations = destinations != null ? List.copyOf(destinations) : List.of();
        inspectionLevel = inspectionLevel != null ? inspectionLevel : InspectionLevel.NONE;
    }
}
