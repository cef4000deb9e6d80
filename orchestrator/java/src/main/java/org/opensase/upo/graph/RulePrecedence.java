package org.opensase.upo.graph;

import java.util.Comparator;

/**
 * Explicit precedence and output ordering for resolved rules. Nothing in resolution
 * depends on map iteration order; every ordering decision goes through these comparators.
 */
public final class RulePrecedence {

    /** Winner first: higher priority, then earlier declaration. */
    public static final Comparator<ResolvedRule> PRECEDENCE = Comparator
            .comparingInt(ResolvedRule::priority).reversed()
            .thenComparingInt(ResolvedRule::declarationIndex);

    /** Total order of the graph: precedence, then source key, then destination key. */
    public static final Comparator<ResolvedRule> GRAPH_ORDER = PRECEDENCE
            .thenComparing(ResolvedRule::source)
            .thenComparing(ResolvedRule::destination);

    private RulePrecedence() {}
}
