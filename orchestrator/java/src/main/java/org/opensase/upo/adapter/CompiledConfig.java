package org.opensase.upo.adapter;

import java.util.List;

/**
 * The output of one adapter: native objects plus every gap and error met on the way.
 *
 * @param ruleKind object kind that carries one native rule per resolved rule
 * @param rendered the configuration in the target's own dialect (nftables script, JSON)
 */
public record CompiledConfig(
        TargetKind target,
        String policyName,
        String policyVersion,
        String ruleKind,
        List<NativeObject> objects,
        List<CapabilityGap> capabilityGaps,
        List<CapabilityError> capabilityErrors,
        String rendered
) {
    public CompiledConfig {
        objects = List.copyOf(objects);
        capabilityGaps = List.copyOf(capabilityGaps);
        capabilityErrors = List.copyOf(capabilityErrors);
    }

    public List<NativeObject> objectsOfKind(String kind) {
        return objects.stream().filter(o -> o.kind().equals(kind)).toList();
    }

    public List<NativeObject> rules() {
        return objectsOfKind(ruleKind);
    }

    public boolean hasErrors() {
        return !capabilityErrors.isEmpty();
    }
}
