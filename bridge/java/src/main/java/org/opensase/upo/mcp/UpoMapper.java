package org.opensase.upo.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.opensase.upo.adapter.CapabilityError;
import org.opensase.upo.adapter.CapabilityGap;
import org.opensase.upo.adapter.CompiledConfig;
import org.opensase.upo.adapter.NativeObject;
import org.opensase.upo.adapter.TargetKind;
import org.opensase.upo.apply.ApplyPlan;
import org.opensase.upo.apply.PlanOperation;
import org.opensase.upo.graph.NormalizedPolicyGraph;
import org.opensase.upo.graph.ResolvedRule;
import org.opensase.upo.graph.ShadowedRule;
import org.opensase.upo.intent.ValidationIssue;
import org.opensase.upo.intent.ValidationResult;
import org.opensase.upo.util.JsonCodec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure mapping functions: UPO pipeline results → MCP schema types and JSON bodies.
 * No I/O.
 */
public final class UpoMapper {

    private UpoMapper() {}

    static final String JSON = "application/json";

    // ── Slug ──────────────────────────────────────────────────────────────────────

    public static String policySlug(String policyName) {
        String s = policyName.toLowerCase();
        s = s.replaceAll("\\s+", "-");
        s = s.replaceAll("[^a-z0-9\\-]", "");
        return s.isEmpty() ? "policy" : s;
    }

    // ── URIs ──────────────────────────────────────────────────────────────────────

    public static String indexUri(String slug) {
        return "upo://" + slug + "/index";
    }

    public static String validationUri(String slug) {
        return "upo://" + slug + "/validation";
    }

    public static String graphUri(String slug) {
        return "upo://" + slug + "/graph";
    }

    public static String compiledUri(String slug, TargetKind target) {
        return "upo://" + slug + "/compiled/" + target.id();
    }

    public static String planUri(String slug, TargetKind target) {
        return "upo://" + slug + "/plan/" + target.id();
    }

    // ── Resource building ─────────────────────────────────────────────────────────

    public static McpSchema.Resource indexResource(String slug) {
        return resource(indexUri(slug), "index", "Policy index",
                "Policy summary and the URIs of every other resource", 1.0);
    }

    public static McpSchema.Resource validationResource(String slug) {
        return resource(validationUri(slug), "validation", "Validation report",
                "Errors and warnings from validating the intent document", 1.0);
    }

    public static McpSchema.Resource graphResource(String slug) {
        return resource(graphUri(slug), "graph", "Normalized policy graph",
                "Resolved (source, destination) rules in precedence order, plus shadowed candidates", 0.7);
    }

    public static McpSchema.Resource compiledResource(String slug, TargetKind target) {
        return resource(compiledUri(slug, target), "compiled-" + target.id(), "Compiled config: " + target.id(),
                target.description() + ". Native objects, capability gaps and errors", 0.5);
    }

    public static McpSchema.Resource planResource(String slug, TargetKind target) {
        return resource(planUri(slug, target), "plan-" + target.id(), "Dry-run plan: " + target.id(),
                "Operations an apply would run against the emulated " + target.id() + " state", 0.5);
    }

    private static McpSchema.Resource resource(String uri, String name, String title, String description,
                                               double priority) {
        McpSchema.Annotations annotations = new McpSchema.Annotations(
                List.of(McpSchema.Role.ASSISTANT, McpSchema.Role.USER), priority, null);
        return new McpSchema.Resource(
                uri,
                name,
                title,
                description,
                JSON,
                null,           // size
                annotations,
                null            // meta
        );
    }

    // ── JSON bodies ───────────────────────────────────────────────────────────────

    public static String indexJson(String policyName, String version, ValidationResult validation,
                                   List<McpSchema.Resource> resources) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("policy", policyName);
        body.put("version", version);
        body.put("valid", validation.isValid());
        if (validation.policy() != null) {
            body.put("identity_count", validation.policy().identities().size());
            body.put("application_count", validation.policy().applications().size());
            body.put("segment_count", validation.policy().segments().size());
            body.put("rule_count", validation.policy().egressRules().size());
        }
        List<Map<String, Object>> entries = new ArrayList<>();
        for (McpSchema.Resource r : resources) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", r.name());
            entry.put("uri", r.uri());
            entry.put("title", r.title());
            entries.add(entry);
        }
        body.put("resources", entries);
        return JsonCodec.writePretty(body);
    }

    public static String validationJson(ValidationResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("valid", result.isValid());
        body.put("errors", issues(result.errors()));
        body.put("warnings", issues(result.warnings()));
        return JsonCodec.writePretty(body);
    }

    public static String graphJson(NormalizedPolicyGraph graph) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("policy", graph.policyName());
        body.put("version", graph.policyVersion());
        List<Map<String, Object>> rules = new ArrayList<>();
        for (ResolvedRule rule : graph.rules()) {
            rules.add(rule(rule));
        }
        body.put("rules", rules);
        List<Map<String, Object>> shadowed = new ArrayList<>();
        for (ShadowedRule s : graph.shadowed()) {
            Map<String, Object> entry = rule(s.rule());
            entry.put("shadowedBy", s.shadowedBy());
            shadowed.add(entry);
        }
        body.put("shadowed", shadowed);
        return JsonCodec.writePretty(body);
    }

    /** Body for a resource that could not be produced, e.g. an ambiguous policy's graph. */
    public static String errorJson(String error, String location) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("location", location);
        return JsonCodec.writePretty(body);
    }

    public static String compiledJson(CompiledConfig config) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("target", config.target().id());
        body.put("policy", config.policyName());
        body.put("ruleKind", config.ruleKind());
        body.put("objects", objects(config.objects()));
        List<Map<String, Object>> gaps = new ArrayList<>();
        for (CapabilityGap gap : config.capabilityGaps()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("rule", gap.ruleId());
            entry.put("kind", gap.kind().name());
            entry.put("requested", gap.requested().value());
            entry.put("applied", gap.applied().value());
            entry.put("detail", gap.detail());
            gaps.add(entry);
        }
        body.put("capabilityGaps", gaps);
        List<Map<String, Object>> errors = new ArrayList<>();
        for (CapabilityError error : config.capabilityErrors()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("rule", error.ruleId());
            entry.put("construct", error.construct());
            entry.put("message", error.message());
            errors.add(entry);
        }
        body.put("capabilityErrors", errors);
        body.put("rendered", config.rendered());
        return JsonCodec.writePretty(body);
    }

    public static String planJson(ApplyPlan plan) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("target", plan.target().id());
        body.put("executable", plan.isExecutable());
        List<Map<String, Object>> ops = new ArrayList<>();
        for (PlanOperation op : plan.operations()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("index", op.index());
            entry.put("type", op.type().name().toLowerCase());
            entry.put("kind", op.object().kind());
            entry.put("name", op.object().name());
            entry.put("spec", op.object().spec());
            ops.add(entry);
        }
        body.put("operations", ops);
        return JsonCodec.writePretty(body);
    }

    // ── helpers ───────────────────────────────────────────────────────────────────

    private static List<Map<String, Object>> issues(List<ValidationIssue> issues) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (ValidationIssue issue : issues) {
            out.add(Map.of("path", issue.path(), "message", issue.message()));
        }
        return out;
    }

    private static Map<String, Object> rule(ResolvedRule rule) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("source", rule.source().key());
        entry.put("destination", rule.destination().key());
        entry.put("action", rule.action().value());
        entry.put("inspectionLevel", rule.inspectionLevel().value());
        entry.put("priority", rule.priority());
        entry.put("origin", rule.origin());
        return entry;
    }

    private static List<Map<String, Object>> objects(List<NativeObject> objects) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (NativeObject object : objects) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("kind", object.kind());
            entry.put("name", object.name());
            entry.put("spec", object.spec());
            out.add(entry);
        }
        return out;
    }
}
