package org.opensase.upo.graph;

import org.opensase.upo.intent.Reference;
import org.opensase.upo.model.Action;
import org.opensase.upo.model.Application;
import org.opensase.upo.model.EgressRule;
import org.opensase.upo.model.Identity;
import org.opensase.upo.model.InspectionLevel;
import org.opensase.upo.model.IntentPolicy;
import org.opensase.upo.util.Cidr;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expands a validated {@link IntentPolicy} into a {@link NormalizedPolicyGraph}.
 *
 * <p>Each egress rule is cross-produced over its sources and destinations; application
 * destinations expand to one endpoint per declared port. Tuples colliding on the same
 * (source, destination) are settled by {@link RulePrecedence#PRECEDENCE}: the higher
 * priority wins, equal priority with different actions is ambiguous, equal priority with
 * the same action keeps the strongest inspection level. Pure and deterministic.
 */
public final class PolicyGraphResolver {

    private PolicyGraphResolver() {}

    public static NormalizedPolicyGraph resolve(IntentPolicy policy) {
        Map<String, List<ResolvedRule>> byKey = new LinkedHashMap<>();
        for (int i = 0; i < policy.egressRules().size(); i++) {
            for (ResolvedRule candidate : expand(policy, policy.egressRules().get(i), i)) {
                byKey.computeIfAbsent(candidate.key(), k -> new ArrayList<>()).add(candidate);
            }
        }

        List<ResolvedRule> winners = new ArrayList<>();
        List<ShadowedRule> shadowed = new ArrayList<>();
        for (List<ResolvedRule> group : byKey.values()) {
            group.sort(RulePrecedence.PRECEDENCE);
            ResolvedRule top = group.get(0);
            InspectionLevel level = top.inspectionLevel();
            for (ResolvedRule other : group.subList(1, group.size())) {
                if (other.priority() == top.priority()) {
                    if (other.action() != top.action()) {
                        throw ResolutionException.ambiguous(top, other);
                    }
                    level = InspectionLevel.strongest(level, other.inspectionLevel());
                } else if (!other.origin().equals(top.origin())) {
                    shadowed.add(new ShadowedRule(other, top.origin()));
                }
            }
            winners.add(level == top.inspectionLevel() ? top : top.withInspectionLevel(level));
        }

        winners.sort(RulePrecedence.GRAPH_ORDER);
        shadowed.sort((a, b) -> RulePrecedence.GRAPH_ORDER.compare(a.rule(), b.rule()));
        return new NormalizedPolicyGraph(
                policy.name(),
                policy.metadata() != null ? policy.metadata().version() : null,
                winners,
                shadowed,
                policy.segments(),
                policy.identities(),
                policy.applications());
    }

    private static List<ResolvedRule> expand(IntentPolicy policy, EgressRule rule, int index) {
        Set<PolicySource> sources = new LinkedHashSet<>();
        for (String ref : rule.sources()) {
            sources.add(source(policy, Reference.parse(ref)));
        }
        Set<PolicyDestination> destinations = new LinkedHashSet<>();
        for (String ref : rule.destinations()) {
            destinations.addAll(destinations(policy, Reference.parse(ref)));
        }

        List<ResolvedRule> out = new ArrayList<>();
        for (PolicySource source : sources) {
            for (PolicyDestination destination : destinations) {
                out.add(new ResolvedRule(source, destination, rule.action(),
                        effectiveLevel(policy, rule, destination), rule.priority(),
                        rule.name(), index, rule.preferredWan()));
            }
        }
        return out;
    }

    /** Rule level raised to the application's floor; deny carries no inspection. */
    private static InspectionLevel effectiveLevel(IntentPolicy policy, EgressRule rule, PolicyDestination destination) {
        if (rule.action() == Action.DENY) {
            return InspectionLevel.NONE;
        }
        InspectionLevel level = rule.inspectionLevel();
        if (destination.kind() == PolicyDestination.Kind.APPLICATION) {
            InspectionLevel floor = policy.application(destination.name())
                    .map(Application::inspection).orElse(InspectionLevel.NONE);
            level = InspectionLevel.strongest(level, floor);
        }
        return level;
    }

    private static PolicySource source(IntentPolicy policy, Reference ref) {
        switch (ref.kind()) {
            case USER:
                return new PolicySource(PolicySource.Kind.USER, ref.name());
            case GROUP:
                return new PolicySource(PolicySource.Kind.GROUP, ref.name());
            case SEGMENT:
                return new PolicySource(PolicySource.Kind.SEGMENT, ref.name());
            case NAME:
                if (policy.segment(ref.name()).isPresent()) {
                    return new PolicySource(PolicySource.Kind.SEGMENT, ref.name());
                }
                Identity identity = policy.identity(ref.name())
                        .orElseThrow(() -> new IllegalStateException("unresolved source '" + ref + "'"));
                return new PolicySource(identity.type() == Identity.IdentityType.GROUP
                        ? PolicySource.Kind.GROUP : PolicySource.Kind.USER, ref.name());
            default:
                throw new IllegalStateException("not a source: " + ref);
        }
    }

    private static List<PolicyDestination> destinations(IntentPolicy policy, Reference ref) {
        switch (ref.kind()) {
            case CIDR:
                return List.of(PolicyDestination.cidr(Cidr.parse(ref.name()).orElseThrow().toString()));
            case SEGMENT:
                return List.of(PolicyDestination.segment(ref.name()));
            case APPLICATION:
                return endpoints(policy, ref.name());
            case NAME:
                if (policy.segment(ref.name()).isPresent()) {
                    return List.of(PolicyDestination.segment(ref.name()));
                }
                return endpoints(policy, ref.name());
            default:
                throw new IllegalStateException("not a destination: " + ref);
        }
    }

    private static List<PolicyDestination> endpoints(IntentPolicy policy, String name) {
        Application app = policy.application(name)
                .orElseThrow(() -> new IllegalStateException("unresolved application '" + name + "'"));
        return app.ports().stream()
                .map(port -> PolicyDestination.application(app.name(), app.protocol(), port))
                .toList();
    }
}
