package org.opensase.upo.adapter.openziti;

import org.opensase.upo.adapter.AbstractTargetAdapter;
import org.opensase.upo.adapter.CapabilityError;
import org.opensase.upo.adapter.CapabilityGap;
import org.opensase.upo.adapter.CapabilityTable;
import org.opensase.upo.adapter.NativeNames;
import org.opensase.upo.adapter.NativeObject;
import org.opensase.upo.adapter.TargetKind;
import org.opensase.upo.graph.NormalizedPolicyGraph;
import org.opensase.upo.graph.PolicyDestination;
import org.opensase.upo.graph.PolicySource;
import org.opensase.upo.graph.ResolvedRule;
import org.opensase.upo.model.Action;
import org.opensase.upo.model.Application;
import org.opensase.upo.model.Identity;
import org.opensase.upo.model.InspectionLevel;
import org.opensase.upo.model.Segment;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Zero-trust overlay: services with intercept and host configs, Bind policies that put a
 * router in front of each service and one Dial policy per permitted rule.
 *
 * <p>The overlay is allow-only. Nothing is reachable without a Dial policy, so a deny is
 * already enforced unless a Dial policy grants an overlapping source the same service.
 * Plain network segments have no overlay identity; a segment is usable only through the
 * edge router that fronts it.
 */
public class OpenZitiAdapter extends AbstractTargetAdapter {

    public static final String IDENTITY_ROLE = "identity-role";
    public static final String SERVICE = "service";
    public static final String BIND_POLICY = "bind-policy";
    public static final String DIAL_POLICY = "dial-policy";

    /** Router role hosting services that no segment edge router claims. */
    static final String DEFAULT_ROUTER = "router-pop";

    public static final CapabilityTable DEFAULT_CAPABILITIES = new CapabilityTable(
            EnumSet.of(InspectionLevel.NONE, InspectionLevel.BASIC),
            EnumSet.allOf(PolicySource.Kind.class),
            EnumSet.allOf(PolicyDestination.Kind.class),
            EnumSet.of(Action.ALLOW, Action.INSPECT));

    public OpenZitiAdapter() {
        this(DEFAULT_CAPABILITIES);
    }

    public OpenZitiAdapter(CapabilityTable capabilities) {
        super(capabilities);
    }

    @Override
    public TargetKind target() {
        return TargetKind.OPENZITI;
    }

    @Override
    public String ruleKind() {
        return DIAL_POLICY;
    }

    @Override
    public List<String> managedKinds() {
        return List.of(IDENTITY_ROLE, SERVICE, BIND_POLICY, DIAL_POLICY);
    }

    @Override
    protected boolean isBlocking(NativeObject rule) {
        return false;
    }

    @Override
    protected void compileRule(ResolvedRule rule, Compilation c) {
        if (rule.action() != Action.DENY) {
            super.compileRule(rule, c);
            return;
        }
        Optional<ResolvedRule> grant = c.graph().rules().stream()
                .filter(other -> other.action().permits())
                .filter(other -> other.destination().equals(rule.destination()))
                .filter(other -> overlaps(c.graph(), other.source(), rule.source()))
                .findFirst();
        if (grant.isPresent()) {
            c.error(unsupported(rule, "action:deny",
                    "overlay cannot carve a deny out of '" + grant.get().origin() + "', which grants "
                            + grant.get().source().key() + " the same service"));
        } else {
            c.gap(new CapabilityGap(rule.ruleId(), CapabilityGap.Kind.IMPLICIT_DENY, InspectionLevel.NONE,
                    InspectionLevel.NONE, "enforced by the overlay's default deny; no object emitted"));
        }
    }

    @Override
    protected Optional<CapabilityError> checkExpressible(ResolvedRule rule, NormalizedPolicyGraph graph) {
        Optional<CapabilityError> base = super.checkExpressible(rule, graph);
        if (base.isPresent()) {
            return base;
        }
        if (rule.source().kind() == PolicySource.Kind.SEGMENT
                && graph.segment(rule.source().name()).map(s -> s.edgeRouter() == null).orElse(true)) {
            return Optional.of(unsupported(rule, "source:segment",
                    "overlay has no plain network segments; '" + rule.source().name() + "' declares no edgeRouter"));
        }
        if (rule.destination().kind() == PolicyDestination.Kind.SEGMENT) {
            Segment segment = graph.segment(rule.destination().name()).orElseThrow();
            if (segment.edgeRouter() == null || segment.cidrs().isEmpty()) {
                return Optional.of(unsupported(rule, "destination:segment",
                        "overlay reaches segment '" + segment.name() + "' only through an edgeRouter hosting its cidrs"));
            }
        }
        return Optional.empty();
    }

    @Override
    protected void emitRule(ResolvedRule rule, InspectionLevel level, Compilation c) {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("type", "Dial");
        spec.put("semantic", "AnyOf");
        spec.put("identityRoles", List.of("#" + identityRole(c.graph(), rule.source())));
        spec.put("serviceRoles", List.of("@" + serviceName(c.graph(), rule.destination())));
        spec.put("inspection", level.value());
        if (level == InspectionLevel.BASIC) {
            // session events exported to the PoP collector
            spec.put("postureChecks", List.of("upo-session-logging"));
        }
        spec.put("description", rule.origin());
        c.addRule(rule, DIAL_POLICY, NativeNames.ruleName(rule), spec);
    }

    @Override
    protected void emitSupportObjects(Compilation c) {
        NormalizedPolicyGraph graph = c.graph();
        for (Identity identity : graph.identities()) {
            TreeSet<String> roles = new TreeSet<>();
            roles.add(identity.name());
            for (Identity group : graph.identities()) {
                if (group.type() == Identity.IdentityType.GROUP && group.members().contains(identity.name())) {
                    roles.add(group.name());
                }
            }
            Map<String, Object> spec = new LinkedHashMap<>();
            spec.put("type", identity.type().value());
            spec.put("roleAttributes", List.copyOf(roles));
            c.addSupport(IDENTITY_ROLE, NativeNames.slug(identity.name()), spec);
        }
        for (ResolvedRule rule : c.emitted()) {
            String service = serviceName(graph, rule.destination());
            if (c.hasSupport(SERVICE, service)) {
                continue;
            }
            c.addSupport(SERVICE, service, service(graph, rule.destination()));

            Map<String, Object> bind = new LinkedHashMap<>();
            bind.put("type", "Bind");
            bind.put("semantic", "AnyOf");
            bind.put("identityRoles", List.of("#" + routerRole(graph, rule.destination())));
            bind.put("serviceRoles", List.of("@" + service));
            c.addSupport(BIND_POLICY, service + "-bind", bind);
        }
    }

    @Override
    protected String render(NormalizedPolicyGraph graph, List<NativeObject> objects) {
        return renderJson(graph, objects);
    }

    /** One service per endpoint: the application name when it listens on one port, name-port otherwise. */
    static String serviceName(NormalizedPolicyGraph graph, PolicyDestination destination) {
        if (destination.kind() == PolicyDestination.Kind.APPLICATION) {
            Application app = graph.application(destination.name()).orElseThrow();
            String name = NativeNames.slug(app.name());
            return app.ports().size() == 1 ? name : name + "-" + destination.port();
        }
        return NativeNames.destinationSlug(destination);
    }

    private static Map<String, Object> service(NormalizedPolicyGraph graph, PolicyDestination destination) {
        Map<String, Object> intercept = new LinkedHashMap<>();
        Map<String, Object> host = new LinkedHashMap<>();
        switch (destination.kind()) {
            case APPLICATION: {
                Application app = graph.application(destination.name()).orElseThrow();
                intercept.put("protocols", protocols(destination.protocol()));
                intercept.put("addresses", List.of(app.address()));
                intercept.put("portRanges", List.of(Map.of("low", destination.port(), "high", destination.port())));
                host.put("protocol", destination.protocol());
                host.put("address", app.address());
                host.put("port", destination.port());
                break;
            }
            case SEGMENT: {
                Segment segment = graph.segment(destination.name()).orElseThrow();
                intercept.put("protocols", protocols("any"));
                intercept.put("addresses", List.copyOf(segment.cidrs()));
                host.put("forwardProtocol", true);
                host.put("forwardAddress", true);
                host.put("allowedAddresses", List.copyOf(segment.cidrs()));
                break;
            }
            default:
                intercept.put("protocols", protocols("any"));
                intercept.put("addresses", List.of(destination.name()));
                host.put("forwardProtocol", true);
                host.put("forwardAddress", true);
                host.put("allowedAddresses", List.of(destination.name()));
                break;
        }
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("intercept.v1", intercept);
        spec.put("host.v1", host);
        spec.put("terminatorStrategy", "smartrouting");
        return spec;
    }

    private static List<String> protocols(String protocol) {
        return "any".equals(protocol) ? List.of("tcp", "udp") : List.of(protocol);
    }

    private static String identityRole(NormalizedPolicyGraph graph, PolicySource source) {
        if (source.kind() == PolicySource.Kind.SEGMENT) {
            return graph.segment(source.name()).orElseThrow().edgeRouter();
        }
        return source.name();
    }

    /** Edge router of the segment hosting the destination, or the PoP router. */
    private static String routerRole(NormalizedPolicyGraph graph, PolicyDestination destination) {
        String hosting = null;
        if (destination.kind() == PolicyDestination.Kind.APPLICATION) {
            hosting = graph.application(destination.name()).orElseThrow().segment();
        } else if (destination.kind() == PolicyDestination.Kind.SEGMENT) {
            hosting = destination.name();
        }
        if (hosting == null) {
            return DEFAULT_ROUTER;
        }
        return graph.segment(hosting).map(Segment::edgeRouter).orElse(DEFAULT_ROUTER);
    }

    /** True when some traffic matched by {@code a} is also matched by {@code b}. */
    private static boolean overlaps(NormalizedPolicyGraph graph, PolicySource a, PolicySource b) {
        if (a.equals(b)) {
            return true;
        }
        return memberOf(graph, a, b) || memberOf(graph, b, a);
    }

    private static boolean memberOf(NormalizedPolicyGraph graph, PolicySource member, PolicySource group) {
        if (group.kind() != PolicySource.Kind.GROUP || !member.isIdentity()) {
            return false;
        }
        return graph.identity(group.name()).map(g -> g.members().contains(member.name())).orElse(false);
    }
}
