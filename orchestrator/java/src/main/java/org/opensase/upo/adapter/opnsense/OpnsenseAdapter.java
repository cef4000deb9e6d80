package org.opensase.upo.adapter.opnsense;

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
import org.opensase.upo.model.Identity;
import org.opensase.upo.model.InspectionLevel;
import org.opensase.upo.model.Segment;
import org.opensase.upo.util.Cidr;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Security PoP firewall: VLAN interfaces, address aliases, outbound NAT and one filter rule
 * per resolved rule, with Suricata IDS/IPS toggled per rule. Every action, source kind,
 * destination kind and inspection level is native here, so the default table is full.
 *
 * <p>Aliases hold one address family each: the IPv6 part of a range list goes to an alias
 * named {@code <alias>_v6}. Rules carry an {@code ipprotocol} of {@code inet}, {@code inet6}
 * or {@code inet46}, the families both ends of the rule can match.
 */
public class OpnsenseAdapter extends AbstractTargetAdapter {

    public static final String INTERFACE = "interface";
    public static final String ALIAS = "alias";
    public static final String NAT_RULE = "nat-rule";
    public static final String FILTER_RULE = "filter-rule";

    /** Parent device the segment VLANs are tagged on. */
    static final String LAN_DEVICE = "eth2";
    static final String WAN_DEVICE = "wan";

    /** Address family of an alias or of one side of a rule. */
    enum Family {
        INET, INET6;

        static Family of(Cidr cidr) {
            return cidr.ipv6() ? INET6 : INET;
        }
    }

    public OpnsenseAdapter() {
        this(CapabilityTable.full());
    }

    public OpnsenseAdapter(CapabilityTable capabilities) {
        super(capabilities);
    }

    @Override
    public TargetKind target() {
        return TargetKind.OPNSENSE;
    }

    @Override
    public String ruleKind() {
        return FILTER_RULE;
    }

    @Override
    public List<String> managedKinds() {
        return List.of(INTERFACE, ALIAS, NAT_RULE, FILTER_RULE);
    }

    @Override
    protected boolean isBlocking(NativeObject rule) {
        return "block".equals(rule.get("action"));
    }

    @Override
    protected Optional<CapabilityError> checkExpressible(ResolvedRule rule, NormalizedPolicyGraph graph) {
        Optional<CapabilityError> base = super.checkExpressible(rule, graph);
        if (base.isPresent()) {
            return base;
        }
        PolicySource source = rule.source();
        if (source.isIdentity()) {
            boolean addressed = graph.identity(source.name()).map(i -> !identityCidrs(graph, i).isEmpty()).orElse(false);
            if (!addressed) {
                return Optional.of(unsupported(rule, "source:" + source.key(),
                        "firewall matches identities by address; '" + source.name()
                                + "' and its members declare no cidrs"));
            }
        } else {
            Segment segment = graph.segment(source.name()).orElseThrow();
            if (segment.cidrs().isEmpty() && segment.vlan() == null) {
                return Optional.of(unsupported(rule, "source:" + source.key(),
                        "segment '" + segment.name() + "' has neither cidrs nor a vlan to match on"));
            }
        }
        PolicyDestination destination = rule.destination();
        if (destination.kind() == PolicyDestination.Kind.SEGMENT
                && graph.segment(destination.name()).map(s -> s.cidrs().isEmpty()).orElse(true)) {
            return Optional.of(unsupported(rule, "destination:" + destination.key(),
                    "segment '" + destination.name() + "' declares no cidrs to match as a destination"));
        }
        if (ruleFamilies(rule, graph).isEmpty()) {
            return Optional.of(unsupported(rule, "address-family",
                    "source " + source.key() + " (" + sourceFamilies(rule, graph) + ") and destination "
                            + destination.key() + " (" + destinationFamilies(rule, graph)
                            + ") share no address family"));
        }
        return Optional.empty();
    }

    @Override
    protected void emitRule(ResolvedRule rule, InspectionLevel level, Compilation c) {
        NormalizedPolicyGraph graph = c.graph();
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("action", rule.action() == Action.DENY ? "block" : "pass");
        spec.put("ips", ipsMode(level));
        spec.put("sequence", (c.ruleCount() + 1) * 10);
        spec.put("description", rule.origin());
        spec.put("ipprotocol", ipProtocol(ruleFamilies(rule, graph)));

        PolicySource source = rule.source();
        if (source.isIdentity()) {
            spec.put("sourceAlias", identityAlias(source.name()));
        } else {
            Segment segment = graph.segment(source.name()).orElseThrow();
            if (segment.cidrs().isEmpty()) {
                spec.put("sourceInterface", vlanDevice(segment));
            } else {
                spec.put("sourceAlias", segmentAlias(segment.name()));
            }
        }

        PolicyDestination destination = rule.destination();
        switch (destination.kind()) {
            case APPLICATION:
                spec.put("destinationAddress", graph.application(destination.name()).orElseThrow().address());
                spec.put("protocol", destination.protocol());
                spec.put("port", destination.port());
                break;
            case SEGMENT:
                spec.put("destinationAlias", segmentAlias(destination.name()));
                break;
            default:
                spec.put("destinationAddress", destination.name());
                break;
        }
        c.addRule(rule, FILTER_RULE, NativeNames.ruleName(rule), spec);
    }

    @Override
    protected void emitSupportObjects(Compilation c) {
        NormalizedPolicyGraph graph = c.graph();
        for (Segment segment : graph.segments()) {
            if (segment.vlan() != null) {
                Map<String, Object> spec = new LinkedHashMap<>();
                spec.put("device", vlanDevice(segment));
                spec.put("parent", LAN_DEVICE);
                spec.put("vlan", segment.vlan());
                if (segment.vrfId() != null) {
                    spec.put("vrfId", segment.vrfId());
                }
                spec.put("description", segment.description());
                c.addSupport(INTERFACE, NativeNames.slug(segment.name()), spec);
            }
            if (!segment.cidrs().isEmpty()) {
                addAliases(c, segmentAlias(segment.name()), segment.cidrs(), "segment " + segment.name());
                if (segment.nat()) {
                    Map<String, Object> nat = new LinkedHashMap<>();
                    nat.put("interface", WAN_DEVICE);
                    nat.put("sourceAlias", segmentAlias(segment.name()));
                    nat.put("ipprotocol", ipProtocol(families(segment.cidrs())));
                    nat.put("target", "masquerade");
                    c.addSupport(NAT_RULE, "outbound-" + NativeNames.slug(segment.name()), nat);
                }
            }
        }
        for (Identity identity : graph.identities()) {
            List<String> cidrs = identityCidrs(graph, identity);
            if (!cidrs.isEmpty()) {
                addAliases(c, identityAlias(identity.name()), cidrs, identity.type().value() + " " + identity.name());
            }
        }
    }

    @Override
    protected String render(NormalizedPolicyGraph graph, List<NativeObject> objects) {
        return NftablesRenderer.render(graph.policyName(), graph.policyVersion(), objects);
    }

    static String ipsMode(InspectionLevel level) {
        switch (level) {
            case DEEP:
                return "ips";
            case BASIC:
                return "ids";
            default:
                return "off";
        }
    }

    static String segmentAlias(String segment) {
        return "seg_" + NativeNames.slug(segment).replace('-', '_');
    }

    static String identityAlias(String identity) {
        return "id_" + NativeNames.slug(identity).replace('-', '_');
    }

    /** Name of the alias holding the {@code family} part of {@code alias}. */
    static String aliasName(String alias, Family family) {
        return family == Family.INET6 ? alias + "_v6" : alias;
    }

    static String ipProtocol(Set<Family> families) {
        if (families.size() == 2) {
            return "inet46";
        }
        return families.contains(Family.INET6) ? "inet6" : "inet";
    }

    /** Families an {@code ipprotocol} value covers, in render order. */
    static List<Family> protocolFamilies(String ipProtocol) {
        switch (ipProtocol) {
            case "inet6":
                return List.of(Family.INET6);
            case "inet46":
                return List.of(Family.INET, Family.INET6);
            default:
                return List.of(Family.INET);
        }
    }

    /** A group without addresses of its own is matched by the union of its members' addresses. */
    static List<String> identityCidrs(NormalizedPolicyGraph graph, Identity identity) {
        if (!identity.cidrs().isEmpty() || identity.type() != Identity.IdentityType.GROUP) {
            return identity.cidrs();
        }
        Set<String> union = new LinkedHashSet<>();
        for (String member : identity.members()) {
            graph.identity(member).ifPresent(m -> union.addAll(m.cidrs()));
        }
        return List.copyOf(union);
    }

    private static Set<Family> ruleFamilies(ResolvedRule rule, NormalizedPolicyGraph graph) {
        Set<Family> families = sourceFamilies(rule, graph);
        families.retainAll(destinationFamilies(rule, graph));
        return families;
    }

    private static Set<Family> sourceFamilies(ResolvedRule rule, NormalizedPolicyGraph graph) {
        PolicySource source = rule.source();
        if (source.isIdentity()) {
            return families(graph.identity(source.name()).map(i -> identityCidrs(graph, i)).orElse(List.of()));
        }
        Segment segment = graph.segment(source.name()).orElseThrow();
        // an interface match sees both families
        return segment.cidrs().isEmpty() ? EnumSet.allOf(Family.class) : families(segment.cidrs());
    }

    private static Set<Family> destinationFamilies(ResolvedRule rule, NormalizedPolicyGraph graph) {
        PolicyDestination destination = rule.destination();
        switch (destination.kind()) {
            case APPLICATION:
                String address = graph.application(destination.name()).orElseThrow().address();
                // host names are resolved to IPv4 addresses when the ruleset loads
                return Cidr.parse(address).map(cidr -> EnumSet.of(Family.of(cidr))).orElse(EnumSet.of(Family.INET));
            case SEGMENT:
                return families(graph.segment(destination.name()).map(Segment::cidrs).orElse(List.of()));
            default:
                return families(List.of(destination.name()));
        }
    }

    private static Set<Family> families(List<String> cidrs) {
        Set<Family> families = EnumSet.noneOf(Family.class);
        for (String raw : cidrs) {
            Cidr.parse(raw).ifPresent(cidr -> families.add(Family.of(cidr)));
        }
        return families;
    }

    private static String vlanDevice(Segment segment) {
        return LAN_DEVICE + "." + segment.vlan();
    }

    private static void addAliases(Compilation c, String alias, List<String> cidrs, String description) {
        for (Family family : Family.values()) {
            List<String> content = new ArrayList<>();
            for (String raw : cidrs) {
                Cidr.parse(raw).filter(cidr -> Family.of(cidr) == family).ifPresent(cidr -> content.add(cidr.toString()));
            }
            if (content.isEmpty()) {
                continue;
            }
            Map<String, Object> spec = new LinkedHashMap<>();
            spec.put("type", "network");
            spec.put("content", List.copyOf(content));
            spec.put("description", description);
            c.addSupport(ALIAS, aliasName(alias, family), spec);
        }
    }
}
