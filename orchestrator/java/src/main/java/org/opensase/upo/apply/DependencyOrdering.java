package org.opensase.upo.apply;

import org.opensase.upo.adapter.NativeObject;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Orders operations so that the live target never passes through a state more permissive
 * than both the old and the new configuration:
 *
 * <ol>
 *   <li>support objects (interfaces, aliases, services) added or modified, dependencies first;</li>
 *   <li>blocking rules added or modified;</li>
 *   <li>permissive rules added or modified;</li>
 *   <li>permissive rules removed;</li>
 *   <li>blocking rules removed;</li>
 *   <li>support objects removed, dependents first.</li>
 * </ol>
 *
 * Within a phase the incoming order is kept (the sort is stable).
 */
public final class DependencyOrdering implements ApplyOrdering {

    private final List<String> kindOrder;
    private final Set<String> ruleKinds;
    private final Predicate<NativeObject> blocking;

    /**
     * @param kindOrder object kinds, each listed after the kinds it depends on
     * @param ruleKinds kinds that carry policy rules rather than supporting objects
     * @param blocking  tells whether a rule object drops traffic
     */
    public DependencyOrdering(List<String> kindOrder, Set<String> ruleKinds, Predicate<NativeObject> blocking) {
        this.kindOrder = List.copyOf(kindOrder);
        this.ruleKinds = Set.copyOf(ruleKinds);
        this.blocking = blocking;
    }

    @Override
    public List<PlanOperation> order(List<PlanOperation> operations) {
        Comparator<PlanOperation> byPhase = Comparator.comparingInt(this::phase);
        return operations.stream()
                .sorted(byPhase.thenComparingInt(this::kindRank))
                .toList();
    }

    private int phase(PlanOperation op) {
        boolean rule = ruleKinds.contains(op.object().kind());
        boolean remove = op.type() == OperationType.REMOVE;
        if (!rule) {
            return remove ? 5 : 0;
        }
        boolean blocks = blocking.test(op.object());
        if (!remove) {
            return blocks ? 1 : 2;
        }
        return blocks ? 4 : 3;
    }

    private int kindRank(PlanOperation op) {
        int rank = kindOrder.indexOf(op.object().kind());
        if (rank < 0) {
            rank = kindOrder.size();
        }
        // removals unwind dependencies in reverse
        return op.type() == OperationType.REMOVE ? -rank : rank;
    }
}
