package org.opensase.upo.adapter;

import org.opensase.upo.model.InspectionLevel;

/**
 * A rule the target expresses only through a documented substitution.
 *
 * @param requested level the rule asked for
 * @param applied   level the target enforces; never weaker than {@code requested}
 */
public record CapabilityGap(String ruleId, Kind kind, InspectionLevel requested, InspectionLevel applied, String detail) {

    public enum Kind {
        /** Inspection level raised to the nearest stronger level the target supports. */
        INSPECTION_LEVEL,
        /** A deny enforced by the target's default-deny posture instead of an explicit object. */
        IMPLICIT_DENY
    }
}
