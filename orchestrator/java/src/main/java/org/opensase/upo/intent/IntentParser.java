package org.opensase.upo.intent;

import org.opensase.upo.model.Action;
import org.opensase.upo.model.Application;
import org.opensase.upo.model.EgressRule;
import org.opensase.upo.model.Identity;
import org.opensase.upo.model.InspectionLevel;
import org.opensase.upo.model.IntentPolicy;
import org.opensase.upo.model.PolicyMetadata;
import org.opensase.upo.model.Segment;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads intent documents (YAML) into raw maps and turns schema-checked maps into an
 * {@link IntentPolicy}.
 *
 * <p>{@link #fromMap(Map)} trusts its input: callers go through {@link IntentValidator},
 * which runs the schema checks before building the typed policy.
 */
public final class IntentParser {

    // SafeConstructor disables arbitrary Java type instantiation via YAML tags.
    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    static final String DEFAULT_PROTOCOL = "tcp";
    static final int DEFAULT_PORT = 80;

    private IntentParser() {}

    public static Map<String, Object> load(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        }
    }

    public static Map<String, Object> load(InputStream is) {
        try {
            return asDocument(YAML.load(is));
        } catch (YAMLException e) {
            throw new ValidationException(new ValidationIssue("$", "malformed YAML: " + e.getMessage()), e);
        }
    }

    public static Map<String, Object> load(String yaml) {
        try {
            return asDocument(YAML.load(yaml));
        } catch (YAMLException e) {
            throw new ValidationException(new ValidationIssue("$", "malformed YAML: " + e.getMessage()), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asDocument(Object loaded) {
        if (loaded == null) {
            throw new ValidationException(List.of(new ValidationIssue("$", "document is empty")));
        }
        if (!(loaded instanceof Map)) {
            throw new ValidationException(List.of(new ValidationIssue("$", "document root must be a mapping")));
        }
        return (Map<String, Object>) loaded;
    }

    /** Key under which applications are declared; the short form {@code apps} is accepted too. */
    static String applicationsKey(Map<String, Object> data) {
        return data.containsKey("applications") || !data.containsKey("apps") ? "applications" : "apps";
    }

    /** Segment VRF key; {@code vrf_id} is accepted as an alias. */
    static String vrfKey(Map<String, Object> segment) {
        return segment.containsKey("vrfId") || !segment.containsKey("vrf_id") ? "vrfId" : "vrf_id";
    }

    @SuppressWarnings("unchecked")
    public static IntentPolicy fromMap(Map<String, Object> data) {
        Map<String, Object> meta = (Map<String, Object>) data.getOrDefault("metadata", Map.of());
        PolicyMetadata metadata = new PolicyMetadata(
                (String) meta.get("version"),
                (String) meta.get("author"),
                parseTimestamp(meta.get("timestamp")));

        List<Identity> identities = new ArrayList<>();
        for (Map<String, Object> u : maps(data.get("users"))) {
            identities.add(parseIdentity(u, Identity.IdentityType.USER));
        }
        for (Map<String, Object> g : maps(data.get("groups"))) {
            identities.add(parseIdentity(g, Identity.IdentityType.GROUP));
        }

        List<Application> applications = maps(data.get(applicationsKey(data))).stream()
                .map(IntentParser::parseApplication).toList();
        List<Segment> segments = maps(data.get("segments")).stream()
                .map(IntentParser::parseSegment).toList();
        List<EgressRule> rules = new ArrayList<>();
        List<Map<String, Object>> ruleMaps = maps(data.get("egressRules"));
        for (int i = 0; i < ruleMaps.size(); i++) {
            rules.add(parseRule(ruleMaps.get(i), i));
        }

        return new IntentPolicy(
                (String) data.get("name"),
                (String) data.get("description"),
                metadata,
                identities,
                applications,
                segments,
                rules);
    }

    @SuppressWarnings("unchecked")
    private static Identity parseIdentity(Map<String, Object> m, Identity.IdentityType defaultType) {
        Identity.IdentityType type = defaultType;
        if (defaultType == Identity.IdentityType.USER && "group".equals(m.get("type"))) {
            type = Identity.IdentityType.GROUP;
        }
        return new Identity(
                (String) m.get("name"),
                type,
                attributes(m.get("attributes")),
                (List<String>) m.getOrDefault("members", List.of()),
                (List<String>) m.getOrDefault("cidrs", List.of()));
    }

    /** Attributes may be a mapping or, as older documents wrote them, a list of single-entry mappings. */
    @SuppressWarnings("unchecked")
    static Map<String, String> attributes(Object value) {
        Map<String, String> out = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> out.put(String.valueOf(k), String.valueOf(v)));
        } else if (value instanceof List<?> list) {
            for (Object entry : list) {
                ((Map<Object, Object>) entry).forEach((k, v) -> out.put(String.valueOf(k), String.valueOf(v)));
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Application parseApplication(Map<String, Object> m) {
        List<Integer> ports;
        if (m.get("ports") instanceof List<?>) {
            ports = (List<Integer>) m.get("ports");
        } else if (m.get("port") instanceof Integer port) {
            ports = List.of(port);
        } else {
            ports = List.of(DEFAULT_PORT);
        }
        return new Application(
                (String) m.get("name"),
                (String) m.get("address"),
                (String) m.getOrDefault("protocol", DEFAULT_PROTOCOL),
                ports,
                (String) m.get("segment"),
                level(m.get("inspection")));
    }

    @SuppressWarnings("unchecked")
    private static Segment parseSegment(Map<String, Object> m) {
        return new Segment(
                (String) m.get("name"),
                (Integer) m.get("vlan"),
                (Integer) m.get(vrfKey(m)),
                (List<String>) m.getOrDefault("cidrs", List.of()),
                (String) m.get("description"),
                (String) m.get("edgeRouter"),
                Boolean.TRUE.equals(m.get("nat")));
    }

    private static EgressRule parseRule(Map<String, Object> m, int index) {
        Object name = m.get("name");
        Object priority = m.get("priority");
        return new EgressRule(
                name != null ? (String) name : "egressRules[" + index + "]",
                refs(m.get("source")),
                refs(m.get("destination")),
                Action.fromValue((String) m.get("action")).orElse(null),
                level(m.get("inspectionLevel")),
                priority != null ? (Integer) priority : EgressRule.DEFAULT_PRIORITY,
                (String) m.get("preferredWan"));
    }

    @SuppressWarnings("unchecked")
    static List<String> refs(Object value) {
        if (value == null) return List.of();
        if (value instanceof List<?>) return (List<String>) value;
        return List.of((String) value);
    }

    private static InspectionLevel level(Object value) {
        if (value == null) return InspectionLevel.NONE;
        return InspectionLevel.fromValue((String) value).orElse(InspectionLevel.NONE);
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> maps(Object value) {
        if (value == null) return List.of();
        return (List<Map<String, Object>>) value;
    }

    static Instant parseTimestamp(Object value) {
        if (value == null) return null;
        if (value instanceof Date d) return d.toInstant();
        String s = value.toString();
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            return LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
    }
}
