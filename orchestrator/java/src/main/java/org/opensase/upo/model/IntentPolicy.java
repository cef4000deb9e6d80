package org.opensase.upo.model;

import java.util.List;
import java.util.Optional;

/**
 * The root intent document. Instances handed out by the validator are immutable and
 * referentially consistent.
 */
public record IntentPolicy(
        String name,
        String description,
        PolicyMetadata metadata,
        List<Identity> identities,
        List<Application> applications,
        List<Segment> segments,
        List<EgressRule> egressRules
) {
    public IntentPolicy {
        description = description != null ? description : "";
        identities = identities != null ? List.copyOf(identities) : List.of();
        applications = applications != null ? List.copyOf(applications) : List.of();
        segments = segments != null ? List.copyOf(segments) : List.of();
        egressRules = egressRules != null ? List.copyOf(egressRules) : List.of();
    }

    public Optional<Identity> identity(String name) {
        return identities.stream().filter(i -> i.name().equals(name)).findFirst();
    }

    public Optional<Application> application(String name) {
        return applications.stream().filter(a -> a.name().equals(name)).findFirst();
    }

    public Optional<Segment> segment(String name) {
        return segments.stream().filter(s -> s.name().equals(name)).findFirst();
    }
}
