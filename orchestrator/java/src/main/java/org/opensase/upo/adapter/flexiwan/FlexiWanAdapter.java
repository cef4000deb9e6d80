package org.opensase.upo.adapter.flexiwan;

import org.opensase.upo.adapter.AbstractTargetAdapter;
import org.opensase.upo.adapter.CapabilityError;
import org.opensase.upo.adapter.CapabilityTable;
import org.opensase.upo.adapter.NativeNames;
import org.opensase.upo.adapter.NativeObject;
import org.opensase.upo.adapter.TargetKind;
import org.opensase.upo.graph.NormalizedPolicyGraph;
import org.opensase.upo.graph.PolicyDestination;
import org.opensase.upo.graph.PolicySource;
import org.opensase.upo.graph.ResolvedRule;
import org.opensase.upo.model.Action;
import org.opensase.upo.model.InspectionLevel;
import org.opensase.upo.model.Segment;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SD-WAN controller: segments, one path policy per rule and a site template for new branches.
 *
 * <p>Edge devices classify traffic by segment (VRF), never by user, so identity sources are
 * inexpressible. Inspection maps onto paths: {@code none} breaks out locally, {@code basic}
 * breaks out locally with application identification, {@code deep} hauls traffic to the
 * security PoP hub.
 */
public class FlexiWanAdapter extends AbstractTargetAdapter {

    public static final String SEGMENT = "segment";
    public static final String SITE_TEMPLATE = "site-template";
    public static final String PATH_POLICY = "path-policy";

    static final String HUB = "pop-gateway";

    private static final Map<String, String> COLORS = Map.of(
            "corp", "#4285f4",
            "guest", "#fbbc04",
            "iot", "#34a853",
            "voice", "#ea4335");
    private static final String DEFAULT_COLOR = "#9e9e9e";

    public static final CapabilityTable DEFAULT_CAPABILITIES = new CapabilityTable(
            EnumSet.allOf(InspectionLevel.class),
            EnumSet.of(PolicySource.Kind.SEGMENT),
            EnumSet.allOf(PolicyDestination.Kind.class),
            EnumSet.allOf(Action.class));

    public FlexiWanAdapter() {
        this(DEFAULT_CAPABILITIES);
    }

    public FlexiWanAdapter(CapabilityTable capabilities) {
        super(capabilities);
    }

    @Override
    public TargetKind target() {
        return TargetKind.FLEXIWAN;
    }

    @Override
    public String ruleKind() {
        return PATH_POLICY;
    }

    @Override
    public List<String> managedKinds() {
        return List.of(SEGMENT, SITE_TEMPLATE, PATH_POLICY);
    }

    @Override
    protected boolean isBlocking(NativeObject rule) {
        return "drop".equals(rule.get("action"));
    }

    @Override
    protected Optional<CapabilityError> checkExpressible(ResolvedRule rule, NormalizedPolicyGraph graph) {
        Optional<CapabilityError> base = super.checkExpressible(rule, graph);
        if (base.isPresent()) {
            return base;
        }
        if (graph.segment(rule.source().name()).map(s -> s.vrfId() == null).orElse(true)) {
            return Optional.of(unsupported(rule, "source:segment",
                    "segment '" + rule.source().name() + "' has no vrfId for the edge to classify on"));
        }
        PolicyDestination destination = rule.destination();
        if (destination.kind() == PolicyDestination.Kind.SEGMENT
                && graph.segment(destination.name()).map(s -> s.vrfId() == null).orElse(true)) {
            return Optional.of(unsupported(rule, "destination:segment",
                    "segment '" + destination.name() + "' has no vrfId, so no edge segment exists to match"));
        }
        return Optional.empty();
    }

    @Override
    protected void emitRule(ResolvedRule rule, InspectionLevel level, Compilation c) {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("priority", rule.priority());
        spec.put("matchSegment", NativeNames.slug(rule.source().name()));
        spec.put("matchDestination", matchDestination(c.graph(), rule.destination()));
        spec.put("enabled", true);
        spec.put("description", rule.origin());
        if (rule.action() == Action.DENY) {
            spec.put("action", "drop");
        } else if (level == InspectionLevel.DEEP) {
            spec.put("action", "route-to-hub");
            spec.put("destination", HUB);
        } else {
            spec.put("action", "local-breakout");
            spec.put("appIdentification", level == InspectionLevel.BASIC);
        }
        if (rule.preferredWan() != null && rule.action() != Action.DENY) {
            spec.put("preferredWan", rule.preferredWan());
        }
        c.addRule(rule, PATH_POLICY, NativeNames.ruleName(rule), spec);
    }

    @Override
    protected void emitSupportObjects(Compilation c) {
        NormalizedPolicyGraph graph = c.graph();
        List<Map<String, Object>> vlans = new ArrayList<>();
        List<Map<String, Object>> templateSegments = new ArrayList<>();
        for (Segment segment : graph.segments()) {
            if (segment.vrfId() == null) {
                continue;
            }
            String name = NativeNames.slug(segment.name());
            Map<String, Object> spec = new LinkedHashMap<>();
            spec.put("segmentId", segment.vrfId());
            spec.put("description", segment.description().isEmpty()
                    ? segment.name() + " segment" : segment.description());
            if (segment.vlan() != null) {
                spec.put("vlan", segment.vlan());
            }
            spec.put("color", COLORS.getOrDefault(segment.name(), DEFAULT_COLOR));
            c.addSupport(SEGMENT, name, spec);

            if (segment.vlan() != null) {
                vlans.add(Map.of("id", segment.vlan(), "name", "vlan" + segment.vlan(), "segment", name));
            }
            templateSegments.add(Map.of("name", name, "id", segment.vrfId()));
        }

        Map<String, Object> interfaces = new LinkedHashMap<>();
        interfaces.put("wan1", Map.of("type", "WAN", "assignedTo", "eth0", "dhcp", true, "metric", 100));
        interfaces.put("wan2", Map.of("type", "WAN", "assignedTo", "eth1", "dhcp", false, "metric", 200));
        interfaces.put("lan", Map.of("type", "LAN", "assignedTo", "eth2", "vlans", vlans));

        Map<String, Object> template = new LinkedHashMap<>();
        template.put("description", "Site template from policy " + graph.policyName());
        template.put("interfaces", interfaces);
        template.put("segments", templateSegments);
        c.addSupport(SITE_TEMPLATE, NativeNames.slug(graph.policyName()) + "-site-template", template);
    }

    @Override
    protected String render(NormalizedPolicyGraph graph, List<NativeObject> objects) {
        return renderJson(graph, objects);
    }

    private static Map<String, Object> matchDestination(NormalizedPolicyGraph graph, PolicyDestination destination) {
        Map<String, Object> match = new LinkedHashMap<>();
        switch (destination.kind()) {
            case APPLICATION:
                match.put("application", destination.name());
                match.put("address", graph.application(destination.name()).orElseThrow().address());
                match.put("protocol", destination.protocol());
                match.put("port", destination.port());
                break;
            case SEGMENT:
                match.put("segment", NativeNames.slug(destination.name()));
                break;
            default:
                match.put("network", destination.name());
                break;
        }
        return match;
    }
}
