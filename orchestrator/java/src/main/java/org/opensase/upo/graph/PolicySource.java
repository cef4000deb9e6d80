package org.opensase.upo.graph;

/**
 * The "who" of a resolved rule: a user, a group or a whole segment.
 */
public record PolicySource(Kind kind, String name) implements Comparable<PolicySource> {

    public enum Kind { USER, GROUP, SEGMENT }

    public boolean isIdentity() {
        return kind != Kind.SEGMENT;
    }

    public String key() {
        return kind.name().toLowerCase() + ":" + name;
    }

    @Override
    public int compareTo(PolicySource o) {
        return key().compareTo(o.key());
    }
}
