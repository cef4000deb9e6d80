package org.opensase.upo.graph;

import org.opensase.upo.model.Application;
import org.opensase.upo.model.Identity;
import org.opensase.upo.model.Segment;

import java.util.List;
import java.util.Optional;

/**
 * Target-agnostic, read-only result of resolution. Adapters read it concurrently.
 *
 * @param rules        winning tuples in {@link RulePrecedence#GRAPH_ORDER}
 * @param shadowed     candidates that lost precedence, kept for diagnostics
 * @param segments     declared segments, needed for support objects (VLANs, aliases)
 * @param identities   declared users and groups
 * @param applications declared applications
 */
public record NormalizedPolicyGraph(
        String policyName,
        String policyVersion,
        List<ResolvedRule> rules,
        List<ShadowedRule> shadowed,
        List<Segment> segments,
        List<Identity> identities,
        List<Application> applications
) {
    public NormalizedPolicyGraph {
        rules = List.copyOf(rules);
        shadowed = List.copyOf(shadowed);
        segments = List.copyOf(segments);
        identities = List.copyOf(identities);
        applications = List.copyOf(applications);
    }

    public Optional<Segment> segment(String name) {
        return segments.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public Optional<Identity> identity(String name) {
        return identities.stream().filter(i -> i.name().equals(name)).findFirst();
    }

    public Optional<Application> application(String name) {
        return applications.stream().filter(a -> a.name().equals(name)).findFirst();
    }
}
