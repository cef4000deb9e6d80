package org.opensase.upo.apply;

import org.opensase.upo.adapter.CompiledConfig;
import org.opensase.upo.adapter.NativeObject;
import org.opensase.upo.adapter.TargetAdapter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural diff of a compiled config against a target's live state, keyed by
 * (kind, name). Objects of kinds the adapter does not manage are left alone.
 */
public final class ApplyPlanner {

    private ApplyPlanner() {}

    public static ApplyPlan plan(CompiledConfig config, List<NativeObject> liveState, TargetAdapter adapter) {
        return plan(config, liveState, adapter.managedKinds(), adapter.ordering());
    }

    public static ApplyPlan plan(CompiledConfig config, List<NativeObject> liveState,
                                 List<String> managedKinds, ApplyOrdering ordering) {
        Map<String, NativeObject> live = new LinkedHashMap<>();
        for (NativeObject object : liveState) {
            if (managedKinds.contains(object.kind())) {
                live.put(object.id(), object);
            }
        }

        List<PlanOperation> ops = new ArrayList<>();
        Map<String, NativeObject> desired = new LinkedHashMap<>();
        for (NativeObject object : config.objects()) {
            desired.put(object.id(), object);
            NativeObject current = live.get(object.id());
            if (current == null) {
                ops.add(new PlanOperation(0, OperationType.ADD, object, null));
            } else if (!current.spec().equals(object.spec())) {
                ops.add(new PlanOperation(0, OperationType.MODIFY, object, current));
            }
        }
        for (NativeObject object : live.values()) {
            if (!desired.containsKey(object.id())) {
                ops.add(new PlanOperation(0, OperationType.REMOVE, object, null));
            }
        }

        List<PlanOperation> ordered = ordering.order(ops);
        List<PlanOperation> indexed = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            indexed.add(ordered.get(i).withIndex(i));
        }
        return new ApplyPlan(config.target(), config.policyName(), indexed, config.capabilityErrors());
    }
}
