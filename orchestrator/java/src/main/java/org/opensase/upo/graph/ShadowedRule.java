package org.opensase.upo.graph;

/**
 * A candidate tuple that lost precedence to another rule on the same (source, destination).
 */
public record ShadowedRule(ResolvedRule rule, String shadowedBy) {}
