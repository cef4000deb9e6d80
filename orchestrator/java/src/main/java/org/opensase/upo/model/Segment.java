package org.opensase.upo.model;

import java.util.List;

/**
 * A named network zone. Membership is the union of its CIDRs and its VLAN.
 *
 * @param edgeRouter overlay tunneler identity that fronts the segment's clients, if any
 * @param nat        whether traffic leaving the segment is source-NATed by the firewall
 */
public record Segment(
        String name,
        Integer vlan,
        Integer vrfId,
        List<String> cidrs,
        String description,
        String edgeRouter,
        boolean nat
) {
    public Segment {
        cidrs = cidrs != null ? List.copyOf(cidrs) : List.of();
        description = description != null ? description : "";
    }
}
