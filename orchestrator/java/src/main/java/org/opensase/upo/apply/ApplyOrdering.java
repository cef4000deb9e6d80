package org.opensase.upo.apply;

import java.util.List;

/**
 * Target-specific order in which plan operations may safely run.
 */
@FunctionalInterface
public interface ApplyOrdering {

    /** Returns the same operations in execution order. Indexes are reassigned by the caller. */
    List<PlanOperation> order(List<PlanOperation> operations);
}
