package org.opensase.upo.apply;

import org.opensase.upo.adapter.CapabilityError;
import org.opensase.upo.adapter.TargetKind;

import java.util.List;

/**
 * Ordered operations that take one target from its live state to a compiled config.
 *
 * @param capabilityErrors errors carried over from the compiled config; a plan that has any
 *                         may be shown but is never executed
 */
public record ApplyPlan(TargetKind target, String policyName, List<PlanOperation> operations,
                        List<CapabilityError> capabilityErrors) {

    public ApplyPlan {
        operations = List.copyOf(operations);
        capabilityErrors = List.copyOf(capabilityErrors);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public boolean isExecutable() {
        return capabilityErrors.isEmpty();
    }

    public long count(OperationType type) {
        return operations.stream().filter(op -> op.type() == type).count();
    }
}
