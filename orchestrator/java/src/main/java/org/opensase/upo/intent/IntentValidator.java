package org.opensase.upo.intent;

import org.opensase.upo.model.Action;
import org.opensase.upo.model.EgressRule;
import org.opensase.upo.model.Identity;
import org.opensase.upo.model.InspectionLevel;
import org.opensase.upo.model.IntentPolicy;
import org.opensase.upo.model.Segment;
import org.opensase.upo.util.Cidr;

import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.IntFunction;

/**
 * Validates a raw intent document and, when it is valid, returns the typed {@link IntentPolicy}.
 *
 * <p>Checks run in three phases: schema (required fields, primitive types, enumerations,
 * ranges), referential integrity (every reference is declared and of an allowed kind) and
 * semantics (ambiguous self-referencing segments, inspect without inspection). Errors are
 * batched within a phase; a failing phase stops validation. No side effects.
 */
public final class IntentValidator {

    private static final Set<String> PROTOCOLS = Set.of("tcp", "udp", "any");
    private static final Set<String> IDENTITY_TYPES = Set.of("user", "group");
    private static final int MAX_VLAN = 4094;
    private static final int MAX_VRF = 4096;
    private static final int MAX_PORT = 65535;

    private IntentValidator() {}

    /**
     * Validates a document and throws on the first failing phase.
     *
     * @throws ValidationException carrying every error of the failing phase
     */
    public static IntentPolicy requireValid(Map<String, Object> raw) {
        ValidationResult result = validate(raw);
        if (!result.isValid()) {
            throw new ValidationException(result.errors());
        }
        return result.policy();
    }

    public static ValidationResult validate(Map<String, Object> raw) {
        List<ValidationIssue> warnings = new ArrayList<>();
        if (raw == null) {
            return ValidationResult.failed(List.of(new ValidationIssue("$", "document is empty")), warnings);
        }

        List<ValidationIssue> errors = checkSchema(raw);
        if (!errors.isEmpty()) {
            return ValidationResult.failed(errors, warnings);
        }

        IntentPolicy policy = IntentParser.fromMap(raw);
        Paths paths = new Paths(raw);

        errors = checkReferences(policy, paths);
        if (!errors.isEmpty()) {
            return ValidationResult.failed(errors, warnings);
        }

        errors = checkSemantics(policy, paths, warnings);
        if (!errors.isEmpty()) {
            return ValidationResult.failed(errors, warnings);
        }
        return new ValidationResult(List.of(), warnings, policy);
    }

    // ── schema ────────────────────────────────────────────────────────────────────

    private static List<ValidationIssue> checkSchema(Map<String, Object> raw) {
        Schema s = new Schema();
        s.requireString(raw, "name", "name");
        s.optionalString(raw, "description", "description");

        Object meta = raw.get("metadata");
        if (meta == null) {
            s.error("metadata", "'metadata' is required");
        } else if (s.isMap(meta, "metadata")) {
            Map<?, ?> m = (Map<?, ?>) meta;
            s.requireString(m, "version", "metadata.version");
            s.optionalString(m, "author", "metadata.author");
            Object ts = m.get("timestamp");
            if (ts != null && !(ts instanceof Date)) {
                try {
                    IntentParser.parseTimestamp(ts);
                } catch (DateTimeParseException e) {
                    s.error("metadata.timestamp", "must be an ISO-8601 instant or date, got '" + ts + "'");
                }
            }
        }

        s.eachMap(raw, "users", "users", (u, p) -> checkIdentity(s, u, p, false));
        s.eachMap(raw, "groups", "groups", (g, p) -> checkIdentity(s, g, p, true));

        String appsKey = IntentParser.applicationsKey(raw);
        s.eachMap(raw, appsKey, appsKey, (a, p) -> {
            s.requireString(a, "name", p + ".name");
            s.requireString(a, "address", p + ".address");
            s.optionalEnum(a, "protocol", p + ".protocol", PROTOCOLS);
            if (a.containsKey("port") && a.containsKey("ports")) {
                s.error(p + ".ports", "declare either 'port' or 'ports', not both");
            }
            s.optionalInt(a, "port", p + ".port", 1, MAX_PORT);
            if (a.containsKey("ports") && s.isNonEmptyList(a.get("ports"), p + ".ports")) {
                List<?> ports = (List<?>) a.get("ports");
                for (int i = 0; i < ports.size(); i++) {
                    s.checkInt(ports.get(i), p + ".ports[" + i + "]", 1, MAX_PORT);
                }
            }
            s.optionalString(a, "segment", p + ".segment");
            s.optionalLevel(a, "inspection", p + ".inspection");
        });

        s.eachMap(raw, "segments", "segments", (seg, p) -> {
            s.requireString(seg, "name", p + ".name");
            s.optionalInt(seg, "vlan", p + ".vlan", 1, MAX_VLAN);
            String vrf = IntentParser.vrfKey(castMap(seg));
            s.optionalInt(seg, vrf, p + "." + vrf, 1, MAX_VRF);
            s.optionalCidrs(seg, p);
            s.optionalString(seg, "description", p + ".description");
            s.optionalString(seg, "edgeRouter", p + ".edgeRouter");
            Object nat = seg.get("nat");
            if (nat != null && !(nat instanceof Boolean)) {
                s.error(p + ".nat", "must be a boolean");
            }
            if (seg.get("vlan") == null && seg.get("cidrs") == null) {
                s.error(p, "segment needs at least one of 'vlan' or 'cidrs' to define its members");
            }
        });

        if (raw.get("egressRules") == null) {
            s.error("egressRules", "'egressRules' is required");
        }
        s.eachMap(raw, "egressRules", "egressRules", (r, p) -> {
            s.optionalString(r, "name", p + ".name");
            s.requireRefs(r, "source", p + ".source");
            s.requireRefs(r, "destination", p + ".destination");
            Object action = r.get("action");
            if (action == null) {
                s.error(p + ".action", "'action' is required");
            } else if (!(action instanceof String a) || Action.fromValue(a).isEmpty()) {
                s.error(p + ".action", "must be one of [allow, deny, inspect], got '" + action + "'");
            }
            s.optionalLevel(r, "inspectionLevel", p + ".inspectionLevel");
            s.optionalInt(r, "priority", p + ".priority", Integer.MIN_VALUE, Integer.MAX_VALUE);
            s.optionalString(r, "preferredWan", p + ".preferredWan");
        });
        return s.errors;
    }

    private static void checkIdentity(Schema s, Map<?, ?> m, String p, boolean group) {
        s.requireString(m, "name", p + ".name");
        if (!group) {
            s.optionalEnum(m, "type", p + ".type", IDENTITY_TYPES);
        }
        Object attrs = m.get("attributes");
        if (attrs != null && !(attrs instanceof Map)) {
            boolean listOfMaps = attrs instanceof List<?> list && list.stream().allMatch(e -> e instanceof Map);
            if (!listOfMaps) {
                s.error(p + ".attributes", "must be a mapping");
            }
        }
        if (m.containsKey("members")) {
            s.stringList(m.get("members"), p + ".members");
        }
        s.optionalCidrs(m, p);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Map<?, ?> m) {
        return (Map<String, Object>) m;
    }

    // ── references ────────────────────────────────────────────────────────────────

    private static List<ValidationIssue> checkReferences(IntentPolicy policy, Paths paths) {
        List<ValidationIssue> errors = new ArrayList<>();
        Map<String, String> namespace = new HashMap<>();

        for (int i = 0; i < policy.identities().size(); i++) {
            Identity id = policy.identities().get(i);
            declare(namespace, id.name(), id.type().value(), paths.identity(i) + ".name", errors);
        }
        for (int i = 0; i < policy.segments().size(); i++) {
            declare(namespace, policy.segments().get(i).name(), "segment", "segments[" + i + "].name", errors);
        }
        for (int i = 0; i < policy.applications().size(); i++) {
            declare(namespace, policy.applications().get(i).name(), "app", paths.application(i) + ".name", errors);
        }

        for (int i = 0; i < policy.identities().size(); i++) {
            Identity id = policy.identities().get(i);
            if (id.type() == Identity.IdentityType.USER && !id.members().isEmpty()) {
                errors.add(new ValidationIssue(paths.identity(i) + ".members", "only groups can have members"));
            }
            for (int j = 0; j < id.members().size(); j++) {
                String member = id.members().get(j);
                if (!"user".equals(namespace.get(member))) {
                    errors.add(new ValidationIssue(paths.identity(i) + ".members[" + j + "]",
                            "references unknown user '" + member + "'"));
                }
            }
        }

        for (int i = 0; i < policy.applications().size(); i++) {
            String seg = policy.applications().get(i).segment();
            if (seg != null && !"segment".equals(namespace.get(seg))) {
                errors.add(new ValidationIssue(paths.application(i) + ".segment",
                        "references unknown segment '" + seg + "'"));
            }
        }

        for (int i = 0; i < policy.egressRules().size(); i++) {
            EgressRule rule = policy.egressRules().get(i);
            checkRefs(rule.sources(), paths.refPath(i, "source"), namespace, true, errors);
            checkRefs(rule.destinations(), paths.refPath(i, "destination"), namespace, false, errors);
        }
        return errors;
    }

    private static void declare(Map<String, String> namespace, String name, String kind, String path,
                                List<ValidationIssue> errors) {
        String previous = namespace.putIfAbsent(name, kind);
        if (previous != null) {
            errors.add(new ValidationIssue(path, "name '" + name + "' is already declared as " + previous));
        }
    }

    private static void checkRefs(List<String> refs, IntFunction<String> pathOf,
                                  Map<String, String> namespace, boolean source, List<ValidationIssue> errors) {
        for (int j = 0; j < refs.size(); j++) {
            String path = pathOf.apply(j);
            Reference ref = Reference.parse(refs.get(j));
            Optional<String> kind = resolveKind(ref, namespace);
            if (kind.isEmpty()) {
                errors.add(new ValidationIssue(path, describeMissing(ref)));
                continue;
            }
            String k = kind.get();
            if (source && ("app".equals(k) || "cidr".equals(k))) {
                errors.add(new ValidationIssue(path,
                        "source must be a user, group or segment, got " + k + " '" + ref.name() + "'"));
            } else if (!source && ("user".equals(k) || "group".equals(k))) {
                errors.add(new ValidationIssue(path,
                        "destination must be an application, segment or CIDR, got " + k + " '" + ref.name() + "'"));
            }
        }
    }

    /** Kind a reference resolves to in the namespace ("cidr" for literals), or empty when undeclared. */
    static Optional<String> resolveKind(Reference ref, Map<String, String> namespace) {
        switch (ref.kind()) {
            case CIDR:
                return Cidr.isValid(ref.name()) ? Optional.of("cidr") : Optional.empty();
            case NAME:
                return Optional.ofNullable(namespace.get(ref.name()));
            default:
                String declared = namespace.get(ref.name());
                return ref.kind().prefix().equals(declared) ? Optional.of(declared) : Optional.empty();
        }
    }

    private static String describeMissing(Reference ref) {
        switch (ref.kind()) {
            case CIDR:
                return "invalid CIDR '" + ref.name() + "'";
            case NAME:
                return "references undeclared name '" + ref.name() + "'";
            default:
                return "references unknown " + ref.kind().prefix() + " '" + ref.name() + "'";
        }
    }

    // ── semantics ─────────────────────────────────────────────────────────────────

    private static List<ValidationIssue> checkSemantics(IntentPolicy policy, Paths paths,
                                                        List<ValidationIssue> warnings) {
        List<ValidationIssue> errors = new ArrayList<>();
        // segment -> priority -> first rule index per action polarity
        Map<String, Map<Integer, int[]>> selfRefs = new LinkedHashMap<>();

        for (int i = 0; i < policy.egressRules().size(); i++) {
            EgressRule rule = policy.egressRules().get(i);
            String p = "egressRules[" + i + "]";
            if (rule.action() == Action.INSPECT && rule.inspectionLevel() == InspectionLevel.NONE) {
                errors.add(new ValidationIssue(p + ".inspectionLevel",
                        "'inspect' requires inspectionLevel basic or deep"));
            }
            if (rule.action() == Action.DENY && rule.inspectionLevel() != InspectionLevel.NONE) {
                warnings.add(new ValidationIssue(p + ".inspectionLevel",
                        "inspection level is ignored for 'deny' rules"));
            }
            for (String segment : selfReferencedSegments(rule, policy)) {
                int[] seen = selfRefs.computeIfAbsent(segment, k -> new HashMap<>())
                        .computeIfAbsent(rule.priority(), k -> new int[] {-1, -1});
                int polarity = rule.action().permits() ? 0 : 1;
                int other = seen[1 - polarity];
                if (other >= 0) {
                    errors.add(new ValidationIssue(p,
                            "segment '" + segment + "' is both source and destination of allow and deny rules at priority "
                                    + rule.priority() + " (conflicts with egressRules[" + other + "])"));
                }
                if (seen[polarity] < 0) {
                    seen[polarity] = i;
                }
            }
        }

        if (policy.egressRules().isEmpty()) {
            warnings.add(new ValidationIssue("egressRules", "no egress rules declared; targets receive no rules"));
        } else if (policy.egressRules().stream().allMatch(r -> r.inspectionLevel() == InspectionLevel.NONE)
                && policy.applications().stream().allMatch(a -> a.inspection() == InspectionLevel.NONE)) {
            warnings.add(new ValidationIssue("egressRules", "no traffic inspection enabled"));
        }
        for (int i = 0; i < policy.segments().size(); i++) {
            Segment segment = policy.segments().get(i);
            if (segment.cidrs().isEmpty()) {
                warnings.add(new ValidationIssue("segments[" + i + "].cidrs",
                        "segment '" + segment.name() + "' has no CIDRs; address-based targets match it by VLAN only"));
            }
        }
        return errors;
    }

    private static List<String> selfReferencedSegments(EgressRule rule, IntentPolicy policy) {
        List<String> out = new ArrayList<>();
        for (String src : rule.sources()) {
            String name = segmentName(Reference.parse(src), policy);
            if (name == null) continue;
            for (String dst : rule.destinations()) {
                if (name.equals(segmentName(Reference.parse(dst), policy)) && !out.contains(name)) {
                    out.add(name);
                }
            }
        }
        return out;
    }

    private static String segmentName(Reference ref, IntentPolicy policy) {
        if (ref.kind() == Reference.Kind.SEGMENT
                || (ref.kind() == Reference.Kind.NAME && policy.segment(ref.name()).isPresent())) {
            return ref.name();
        }
        return null;
    }

    // ── helpers ───────────────────────────────────────────────────────────────────

    /** Maps positions in the typed policy back to paths in the raw document. */
    private static final class Paths {
        private final int userCount;
        private final String appsKey;
        private final List<Map<String, Object>> rules;

        Paths(Map<String, Object> raw) {
            this.userCount = IntentParser.maps(raw.get("users")).size();
            this.appsKey = IntentParser.applicationsKey(raw);
            this.rules = IntentParser.maps(raw.get("egressRules"));
        }

        String identity(int index) {
            return index < userCount ? "users[" + index + "]" : "groups[" + (index - userCount) + "]";
        }

        String application(int index) {
            return appsKey + "[" + index + "]";
        }

        IntFunction<String> refPath(int rule, String key) {
            boolean list = rules.get(rule).get(key) instanceof List;
            String base = "egressRules[" + rule + "]." + key;
            return j -> list ? base + "[" + j + "]" : base;
        }
    }

    /** Accumulates schema errors with their paths. */
    private static final class Schema {
        final List<ValidationIssue> errors = new ArrayList<>();

        void error(String path, String message) {
            errors.add(new ValidationIssue(path, message));
        }

        boolean isMap(Object value, String path) {
            if (value instanceof Map) return true;
            error(path, "must be a mapping");
            return false;
        }

        void requireString(Map<?, ?> m, String key, String path) {
            Object v = m.get(key);
            if (v == null) {
                error(path, "'" + key + "' is required");
            } else if (!(v instanceof String str)) {
                error(path, "must be a string, got " + typeName(v) + " (quote the value)");
            } else if (str.isBlank()) {
                error(path, "'" + key + "' must not be blank");
            }
        }

        void optionalString(Map<?, ?> m, String key, String path) {
            Object v = m.get(key);
            if (v != null && !(v instanceof String)) {
                error(path, "must be a string, got " + typeName(v));
            }
        }

        void optionalEnum(Map<?, ?> m, String key, String path, Set<String> allowed) {
            Object v = m.get(key);
            if (v != null && !(v instanceof String s && allowed.contains(s))) {
                error(path, "must be one of " + allowed.stream().sorted().toList() + ", got '" + v + "'");
            }
        }

        void optionalLevel(Map<?, ?> m, String key, String path) {
            Object v = m.get(key);
            if (v != null && !(v instanceof String s && InspectionLevel.fromValue(s).isPresent())) {
                error(path, "must be one of [none, basic, deep], got '" + v + "'");
            }
        }

        void optionalInt(Map<?, ?> m, String key, String path, int min, int max) {
            Object v = m.get(key);
            if (v != null) {
                checkInt(v, path, min, max);
            }
        }

        void checkInt(Object v, String path, int min, int max) {
            if (!(v instanceof Integer i)) {
                error(path, "must be an integer, got " + typeName(v));
            } else if (i < min || i > max) {
                error(path, i + " out of range (" + min + "-" + max + ")");
            }
        }

        boolean isNonEmptyList(Object v, String path) {
            if (!(v instanceof List<?> list)) {
                error(path, "must be a list");
                return false;
            }
            if (list.isEmpty()) {
                error(path, "must not be empty");
                return false;
            }
            return true;
        }

        boolean stringList(Object v, String path) {
            if (!(v instanceof List<?> list)) {
                error(path, "must be a list of strings");
                return false;
            }
            boolean ok = true;
            for (int i = 0; i < list.size(); i++) {
                if (!(list.get(i) instanceof String)) {
                    error(path + "[" + i + "]", "must be a string, got " + typeName(list.get(i)));
                    ok = false;
                }
            }
            return ok;
        }

        void optionalCidrs(Map<?, ?> m, String p) {
            Object v = m.get("cidrs");
            if (v == null || !stringList(v, p + ".cidrs")) return;
            List<?> cidrs = (List<?>) v;
            for (int i = 0; i < cidrs.size(); i++) {
                if (!Cidr.isValid((String) cidrs.get(i))) {
                    error(p + ".cidrs[" + i + "]", "invalid CIDR '" + cidrs.get(i) + "'");
                }
            }
        }

        void requireRefs(Map<?, ?> m, String key, String path) {
            Object v = m.get(key);
            if (v == null) {
                error(path, "'" + key + "' is required");
            } else if (v instanceof String s) {
                if (s.isBlank()) error(path, "'" + key + "' must not be blank");
            } else if (isNonEmptyList(v, path)) {
                stringList(v, path);
            }
        }

        void eachMap(Map<?, ?> parent, String key, String path, BiConsumer<Map<?, ?>, String> check) {
            Object v = parent.get(key);
            if (v == null) return;
            if (!(v instanceof List<?> list)) {
                error(path, "must be a list");
                return;
            }
            for (int i = 0; i < list.size(); i++) {
                String p = path + "[" + i + "]";
                if (isMap(list.get(i), p)) {
                    check.accept((Map<?, ?>) list.get(i), p);
                }
            }
        }

        private static String typeName(Object v) {
            if (v instanceof Integer || v instanceof Long || v instanceof Double) return "number";
            if (v instanceof Boolean) return "boolean";
            if (v instanceof List) return "list";
            if (v instanceof Map) return "mapping";
            return v.getClass().getSimpleName().toLowerCase();
        }
    }
}
