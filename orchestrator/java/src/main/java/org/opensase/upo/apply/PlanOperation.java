package org.opensase.upo.apply;

import org.opensase.upo.adapter.NativeObject;

/**
 * One step of an {@link ApplyPlan}.
 *
 * @param index   position in the plan, 0-based
 * @param object  desired object for ADD and MODIFY, the live object for REMOVE
 * @param current live object replaced by a MODIFY, {@code null} otherwise
 */
public record PlanOperation(int index, OperationType type, NativeObject object, NativeObject current) {

    PlanOperation withIndex(int newIndex) {
        return new PlanOperation(newIndex, type, object, current);
    }

    public String describe() {
        return type.name().toLowerCase() + " " + object.id();
    }
}
