package org.opensase.upo.graph;

import org.opensase.upo.PolicyException;

import java.util.List;

/**
 * Thrown when a validated policy cannot be resolved into an unambiguous graph.
 */
public class ResolutionException extends PolicyException {

    public enum Reason { AMBIGUOUS_POLICY }

    private final Reason reason;
    private final String tupleKey;
    private final List<String> rules;

    public ResolutionException(Reason reason, String tupleKey, List<String> rules, String message) {
        super(reason + ": " + message);
        this.reason = reason;
        this.tupleKey = tupleKey;
        this.rules = List.copyOf(rules);
    }

    static ResolutionException ambiguous(ResolvedRule a, ResolvedRule b) {
        return new ResolutionException(Reason.AMBIGUOUS_POLICY, a.key(), List.of(a.origin(), b.origin()),
                "rules '" + a.origin() + "' (" + a.action().value() + ") and '" + b.origin() + "' ("
                        + b.action().value() + ") both match " + a.key() + " at priority " + a.priority());
    }

    public Reason reason() {
        return reason;
    }

    /** The (source, destination) pair the conflict is on. */
    public String tupleKey() {
        return tupleKey;
    }

    /** Names of the conflicting egress rules. */
    public List<String> rules() {
        return rules;
    }

    @Override
    public String location() {
        return String.join(", ", rules);
    }
}
