package org.opensase.upo.graph;

/**
 * The "what" of a resolved rule: one application endpoint, a segment or a literal range.
 *
 * @param protocol transport for application endpoints, {@code null} otherwise
 * @param port     port for application endpoints, {@code null} otherwise
 */
public record PolicyDestination(Kind kind, String name, String protocol, Integer port)
        implements Comparable<PolicyDestination> {

    public enum Kind { APPLICATION, SEGMENT, CIDR }

    public static PolicyDestination application(String name, String protocol, int port) {
        return new PolicyDestination(Kind.APPLICATION, name, protocol, port);
    }

    public static PolicyDestination segment(String name) {
        return new PolicyDestination(Kind.SEGMENT, name, null, null);
    }

    public static PolicyDestination cidr(String cidr) {
        return new PolicyDestination(Kind.CIDR, cidr, null, null);
    }

    public String key() {
        switch (kind) {
            case APPLICATION:
                return "app:" + name + "/" + protocol + "/" + port;
            case SEGMENT:
                return "segment:" + name;
            default:
                return "cidr:" + name;
        }
    }

    @Override
    public int compareTo(PolicyDestination o) {
        return key().compareTo(o.key());
    }
}
