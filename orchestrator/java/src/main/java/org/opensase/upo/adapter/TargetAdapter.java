package org.opensase.upo.adapter;

import org.opensase.upo.apply.ApplyOrdering;
import org.opensase.upo.graph.NormalizedPolicyGraph;

import java.util.List;

/**
 * Compiles the normalized policy graph into one target's native configuration.
 *
 * <p>Implementations are stateless and side-effect free: they never talk to live targets
 * or to each other, so several adapters may compile the same graph concurrently.
 */
public interface TargetAdapter {

    TargetKind target();

    CapabilityTable capabilities();

    /** Object kind that carries one native rule per resolved rule. */
    String ruleKind();

    /** Kinds this adapter owns on the target; planning only removes objects of these kinds. */
    List<String> managedKinds();

    /** Safe execution order for plans against this target. */
    ApplyOrdering ordering();

    CompiledConfig compile(NormalizedPolicyGraph graph);
}
