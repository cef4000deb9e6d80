package org.opensase.upo.adapter;

import org.opensase.upo.graph.PolicyDestination;
import org.opensase.upo.graph.PolicySource;
import org.opensase.upo.model.Action;
import org.opensase.upo.model.InspectionLevel;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * What a target can express natively: inspection levels, source and destination kinds, actions.
 */
public record CapabilityTable(
        Set<InspectionLevel> inspectionLevels,
        Set<PolicySource.Kind> sourceKinds,
        Set<PolicyDestination.Kind> destinationKinds,
        Set<Action> actions
) {
    public CapabilityTable {
        inspectionLevels = Set.copyOf(inspectionLevels);
        sourceKinds = Set.copyOf(sourceKinds);
        destinationKinds = Set.copyOf(destinationKinds);
        actions = Set.copyOf(actions);
    }

    public static CapabilityTable full() {
        return new CapabilityTable(EnumSet.allOf(InspectionLevel.class), EnumSet.allOf(PolicySource.Kind.class),
                EnumSet.allOf(PolicyDestination.Kind.class), EnumSet.allOf(Action.class));
    }

    public CapabilityTable withInspectionLevels(Set<InspectionLevel> levels) {
        return new CapabilityTable(levels, sourceKinds, destinationKinds, actions);
    }

    /**
     * The level to enforce for {@code requested}: itself when supported, otherwise the
     * weakest supported level that is still stronger. Empty when only weaker levels exist.
     */
    public Optional<InspectionLevel> substitute(InspectionLevel requested) {
        for (InspectionLevel level : InspectionLevel.values()) {
            if (level.isAtLeast(requested) && inspectionLevels.contains(level)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    public boolean supports(PolicySource.Kind kind) {
        return sourceKinds.contains(kind);
    }

    public boolean supports(PolicyDestination.Kind kind) {
        return destinationKinds.contains(kind);
    }

    public boolean supports(Action action) {
        return actions.contains(action);
    }
}
