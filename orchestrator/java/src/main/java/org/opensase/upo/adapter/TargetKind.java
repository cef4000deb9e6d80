package org.opensase.upo.adapter;

import java.util.Arrays;
import java.util.Optional;

/**
 * The three control planes UPO compiles for.
 */
public enum TargetKind {
    OPNSENSE("opnsense", "Security PoP (OPNsense) - firewall, NAT, IPS"),
    OPENZITI("openziti", "OpenZiti zero-trust overlay - services, identities, service policies"),
    FLEXIWAN("flexiwan", "flexiWAN SD-WAN - segments, path policies, site templates");

    private final String id;
    private final String description;

    TargetKind(String id, String description) {
        this.id = id;
        this.description = description;
    }

    public String id() {
        return id;
    }

    public String description() {
        return description;
    }

    public static Optional<TargetKind> fromId(String id) {
        return Arrays.stream(values()).filter(t -> t.id.equals(id)).findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
