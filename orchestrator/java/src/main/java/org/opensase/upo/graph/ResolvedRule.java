package org.opensase.upo.graph;

import org.opensase.upo.model.Action;
import org.opensase.upo.model.InspectionLevel;

/**
 * One fully expanded (source, destination, action, inspection level, priority) tuple.
 *
 * @param origin           name of the egress rule this tuple was expanded from
 * @param declarationIndex position of that egress rule in the document
 * @param preferredWan     SD-WAN path hint carried from the egress rule, may be {@code null}
 */
public record ResolvedRule(
        PolicySource source,
        PolicyDestination destination,
        Action action,
        InspectionLevel inspectionLevel,
        int priority,
        String origin,
        int declarationIndex,
        String preferredWan
) {

    /** The (source, destination) pair that must carry at most one action. */
    public String key() {
        return source.key() + " -> " + destination.key();
    }

    /** Identifier used in error reports: the originating rule plus the tuple key. */
    public String ruleId() {
        return origin + " [" + key() + "]";
    }

    ResolvedRule withInspectionLevel(InspectionLevel level) {
        return new ResolvedRule(source, destination, action, level, priority, origin, declarationIndex, preferredWan);
    }
}
