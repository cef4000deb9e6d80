package org.opensase.upo.adapter.opnsense;

import org.opensase.upo.adapter.NativeObject;
import org.opensase.upo.util.Cidr;

import java.util.Comparator;
import java.util.List;

/**
 * Renders compiled firewall objects as an {@code nft -f} script. Output is a pure function
 * of the objects, so two compiles of the same graph render byte-identical scripts.
 */
final class NftablesRenderer {

    /** Suricata listens on this NFQUEUE in inline (IPS) mode. */
    static final int IPS_QUEUE = 0;
    /** Packet mark the IDS mirror port picks up. */
    static final String IDS_MARK = "0x1";

    private NftablesRenderer() {}

    static String render(String policyName, String policyVersion, List<NativeObject> objects) {
        StringBuilder sb = new StringBuilder();
        sb.append("#!/usr/sbin/nft -f\n");
        sb.append("# Generated from policy: ").append(policyName);
        if (policyVersion != null) {
            sb.append(" v").append(policyVersion);
        }
        sb.append("\n\n");
        sb.append("table inet upo {\n");

        for (NativeObject alias : ofKind(objects, OpnsenseAdapter.ALIAS)) {
            @SuppressWarnings("unchecked")
            List<String> content = (List<String>) alias.get("content");
            boolean v6 = Cidr.parse(content.get(0)).map(Cidr::ipv6).orElse(false);
            sb.append("    # ").append(alias.get("description")).append('\n');
            sb.append("    set ").append(alias.name()).append(" {\n");
            sb.append("        type ").append(v6 ? "ipv6_addr" : "ipv4_addr").append("; flags interval;\n");
            sb.append("        elements = { ").append(String.join(", ", content)).append(" }\n");
            sb.append("    }\n\n");
        }

        sb.append("    chain forward {\n");
        sb.append("        type filter hook forward priority 0; policy drop;\n");
        sb.append("        ct state established,related accept\n");
        List<NativeObject> rules = ofKind(objects, OpnsenseAdapter.FILTER_RULE).stream()
                .sorted(Comparator.comparingInt(r -> (Integer) r.get("sequence")))
                .toList();
        for (NativeObject rule : rules) {
            sb.append("        # ").append(rule.get("description")).append(" (").append(rule.name()).append(")\n");
            for (OpnsenseAdapter.Family family : families(rule)) {
                sb.append("        ").append(match(rule, family)).append(verdict(rule)).append('\n');
            }
        }
        sb.append("    }\n");

        List<NativeObject> nat = ofKind(objects, OpnsenseAdapter.NAT_RULE);
        if (!nat.isEmpty()) {
            sb.append("\n    chain postrouting {\n");
            sb.append("        type nat hook postrouting priority 100;\n");
            for (NativeObject n : nat) {
                for (OpnsenseAdapter.Family family : families(n)) {
                    sb.append("        ").append(keyword(family)).append(" saddr @")
                            .append(OpnsenseAdapter.aliasName((String) n.get("sourceAlias"), family))
                            .append(" oifname \"").append(n.get("interface")).append("\" masquerade\n");
                }
            }
            sb.append("    }\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String match(NativeObject rule, OpnsenseAdapter.Family family) {
        String ip = keyword(family);
        StringBuilder m = new StringBuilder();
        if (rule.get("sourceInterface") != null) {
            m.append("iifname \"").append(rule.get("sourceInterface")).append("\" ");
        } else {
            m.append(ip).append(" saddr @")
                    .append(OpnsenseAdapter.aliasName((String) rule.get("sourceAlias"), family)).append(' ');
        }
        if (rule.get("destinationAlias") != null) {
            m.append(ip).append(" daddr @")
                    .append(OpnsenseAdapter.aliasName((String) rule.get("destinationAlias"), family)).append(' ');
        } else {
            m.append(ip).append(" daddr ").append(rule.get("destinationAddress")).append(' ');
        }
        Object protocol = rule.get("protocol");
        if (protocol != null) {
            if ("any".equals(protocol)) {
                m.append("th dport ").append(rule.get("port")).append(' ');
            } else {
                m.append(protocol).append(" dport ").append(rule.get("port")).append(' ');
            }
        }
        return m.toString();
    }

    private static String verdict(NativeObject rule) {
        if ("block".equals(rule.get("action"))) {
            return "drop";
        }
        switch (String.valueOf(rule.get("ips"))) {
            case "ips":
                return "queue num " + IPS_QUEUE + " bypass";
            case "ids":
                return "meta mark set " + IDS_MARK + " accept";
            default:
                return "accept";
        }
    }

    private static List<OpnsenseAdapter.Family> families(NativeObject object) {
        return OpnsenseAdapter.protocolFamilies(String.valueOf(object.get("ipprotocol")));
    }

    private static String keyword(OpnsenseAdapter.Family family) {
        return family == OpnsenseAdapter.Family.INET6 ? "ip6" : "ip";
    }

    private static List<NativeObject> ofKind(List<NativeObject> objects, String kind) {
        return objects.stream().filter(o -> o.kind().equals(kind)).toList();
    }
}
