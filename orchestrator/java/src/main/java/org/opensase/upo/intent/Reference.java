package org.opensase.upo.intent;

import org.opensase.upo.util.Cidr;

/**
 * A reference from an egress rule to a declared entity or a literal network range.
 *
 * <p>Accepted forms: {@code user:alice}, {@code group:eng}, {@code segment:hq},
 * {@code app:saas-crm}, {@code cidr:10.0.0.0/8}, a bare CIDR literal, or a bare name that
 * is looked up in the policy namespace.
 */
public record Reference(Kind kind, String name) {

    public enum Kind {
        USER("user"),
        GROUP("group"),
        SEGMENT("segment"),
        APPLICATION("app"),
        CIDR("cidr"),
        /** A bare name whose kind is decided by lookup. */
        NAME(null);

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    public static Reference parse(String raw) {
        String s = raw.trim();
        int colon = s.indexOf(':');
        if (colon > 0) {
            String prefix = s.substring(0, colon);
            for (Kind kind : Kind.values()) {
                if (prefix.equals(kind.prefix())) {
                    return new Reference(kind, s.substring(colon + 1).trim());
                }
            }
        }
        if (Cidr.isValid(s)) {
            return new Reference(Kind.CIDR, s);
        }
        return new Reference(Kind.NAME, s);
    }

    @Override
    public String toString() {
        return kind == Kind.NAME ? name : kind.prefix() + ":" + name;
    }
}
