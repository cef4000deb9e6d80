package org.opensase.upo.adapter;

import org.opensase.upo.UpoSettings;
import org.opensase.upo.adapter.flexiwan.FlexiWanAdapter;
import org.opensase.upo.adapter.openziti.OpenZitiAdapter;
import org.opensase.upo.adapter.opnsense.OpnsenseAdapter;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates the adapter for each target, applying configured capability overrides.
 */
public final class TargetAdapters {

    private TargetAdapters() {}

    public static TargetAdapter create(TargetKind target) {
        switch (target) {
            case OPNSENSE:
                return new OpnsenseAdapter();
            case OPENZITI:
                return new OpenZitiAdapter();
            case FLEXIWAN:
                return new FlexiWanAdapter();
            default:
                throw new IllegalArgumentException("Unknown target: " + target);
        }
    }

    public static TargetAdapter create(TargetKind target, UpoSettings settings) {
        TargetAdapter defaults = create(target);
        return settings.inspectionLevels(target)
                .map(levels -> create(target, defaults.capabilities().withInspectionLevels(levels)))
                .orElse(defaults);
    }

    public static TargetAdapter create(TargetKind target, CapabilityTable capabilities) {
        switch (target) {
            case OPNSENSE:
                return new OpnsenseAdapter(capabilities);
            case OPENZITI:
                return new OpenZitiAdapter(capabilities);
            case FLEXIWAN:
                return new FlexiWanAdapter(capabilities);
            default:
                throw new IllegalArgumentException("Unknown target: " + target);
        }
    }

    /** One adapter per target, in {@link TargetKind} order. */
    public static List<TargetAdapter> all(UpoSettings settings) {
        List<TargetAdapter> adapters = new ArrayList<>();
        for (TargetKind target : TargetKind.values()) {
            adapters.add(create(target, settings));
        }
        return adapters;
    }
}
