package org.opensase.upo.model;

import java.util.List;

/**
 * A named service reachable at an address over one transport and one or more ports.
 *
 * @param segment    hosting segment, or {@code null} when the application lives outside the fabric
 * @param inspection minimum inspection any rule reaching this application must apply
 */
public record Application(
        String name,
        String address,
        String protocol,
        List<Integer> ports,
        String segment,
        InspectionLevel inspection
) {
    public Application {
        ports = ports != null ? List.copyOf(ports) : List.of();
        inspection = inspection != null ? inspection : InspectionLevel.NONE;
    }
}
