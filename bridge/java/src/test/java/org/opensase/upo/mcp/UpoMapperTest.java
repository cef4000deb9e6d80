package org.opensase.upo.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.Test;
import org.opensase.upo.adapter.CapabilityError;
import org.opensase.upo.adapter.CapabilityGap;
import org.opensase.upo.adapter.CompiledConfig;
import org.opensase.upo.adapter.NativeObject;
import org.opensase.upo.adapter.TargetKind;
import org.opensase.upo.apply.ApplyPlan;
import org.opensase.upo.apply.OperationType;
import org.opensase.upo.apply.PlanOperation;
import org.opensase.upo.graph.NormalizedPolicyGraph;
import org.opensase.upo.graph.PolicyGraphResolver;
import org.opensase.upo.intent.IntentParser;
import org.opensase.upo.intent.IntentValidator;
import org.opensase.upo.intent.ValidationIssue;
import org.opensase.upo.intent.ValidationResult;
import org.opensase.upo.model.InspectionLevel;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/** Pure unit tests for UpoMapper: no I/O, no MCP transport. */
class UpoMapperTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String POLICY = String.join("\n",
            "name: shadow-test",
            "metadata:",
            "  version: \"1.0\"",
            "applications:",
            "  - name: crm",
            "    address: crm.example.com",
            "    port: 443",
            "segments:",
            "  - name: hq",
            "    cidrs: [10.10.0.0/16]",
            "egressRules:",
            "  - name: broad",
            "    source: hq",
            "    destination: crm",
            "    action: allow",
            "  - name: strict",
            "    source: hq",
            "    destination: crm",
            "    action: inspect",
            "    inspectionLevel: deep",
            "    priority: 500",
            "");

    // ── policySlug ────────────────────────────────────────────────────────────────

    @Test void slugLowercasesAndHyphenates() {
        assertEquals("corp-policy", UpoMapper.policySlug("Corp Policy"));
    }

    @Test void slugRemovesSpecialChars() {
        assertEquals("branchv2", UpoMapper.policySlug("branch.v2!"));
    }

    @Test void slugNeverEmpty() {
        assertEquals("policy", UpoMapper.policySlug("???"));
    }

    // ── URIs and resources ────────────────────────────────────────────────────────

    @Test void urisUseUpoScheme() {
        assertEquals("upo://corp/index", UpoMapper.indexUri("corp"));
        assertEquals("upo://corp/validation", UpoMapper.validationUri("corp"));
        assertEquals("upo://corp/graph", UpoMapper.graphUri("corp"));
        assertEquals("upo://corp/compiled/openziti", UpoMapper.compiledUri("corp", TargetKind.OPENZITI));
        assertEquals("upo://corp/plan/flexiwan", UpoMapper.planUri("corp", TargetKind.FLEXIWAN));
    }

    @Test void indexAndValidationComeFirstInPriority() {
        McpSchema.Resource index = UpoMapper.indexResource("corp");
        McpSchema.Resource compiled = UpoMapper.compiledResource("corp", TargetKind.OPNSENSE);
        assertEquals(1.0, index.annotations().priority());
        assertEquals(1.0, UpoMapper.validationResource("corp").annotations().priority());
        assertEquals(0.7, UpoMapper.graphResource("corp").annotations().priority());
        assertEquals(0.5, compiled.annotations().priority());
        assertEquals("application/json", compiled.mimeType());
        assertEquals("compiled-opnsense", compiled.name());
        assertTrue(compiled.description().startsWith(TargetKind.OPNSENSE.description()));
        assertEquals(List.of(McpSchema.Role.ASSISTANT, McpSchema.Role.USER), index.annotations().audience());
    }

    // ── JSON bodies ───────────────────────────────────────────────────────────────

    @Test void validationJsonListsIssues() throws Exception {
        ValidationResult result = new ValidationResult(
                List.of(new ValidationIssue("egressRules[0].action", "'action' is required")),
                List.of(new ValidationIssue("segments[0].cidrs", "no cidrs")),
                null);
        JsonNode json = MAPPER.readTree(UpoMapper.validationJson(result));
        assertFalse(json.get("valid").asBoolean());
        assertEquals("egressRules[0].action", json.get("errors").get(0).get("path").asText());
        assertEquals("no cidrs", json.get("warnings").get(0).get("message").asText());
    }

    @Test void graphJsonIncludesShadowedRules() throws Exception {
        NormalizedPolicyGraph graph = PolicyGraphResolver.resolve(
                IntentValidator.requireValid(IntentParser.load(POLICY)));
        JsonNode json = MAPPER.readTree(UpoMapper.graphJson(graph));
        assertEquals("shadow-test", json.get("policy").asText());
        assertEquals(1, json.get("rules").size());
        assertEquals("strict", json.get("rules").get(0).get("origin").asText());
        assertEquals("deep", json.get("rules").get(0).get("inspectionLevel").asText());
        assertEquals("broad", json.get("shadowed").get(0).get("origin").asText());
        assertEquals("strict", json.get("shadowed").get(0).get("shadowedBy").asText());
    }

    @Test void compiledJsonCarriesGapsAndErrors() throws Exception {
        CompiledConfig config = new CompiledConfig(TargetKind.OPENZITI, "corp", "1.0", "dial-policy",
                List.of(new NativeObject("service", "crm", Map.of("terminatorStrategy", "smartrouting"))),
                List.of(new CapabilityGap("deny-guests [segment:guest -> segment:hq]", CapabilityGap.Kind.IMPLICIT_DENY,
                        InspectionLevel.NONE, InspectionLevel.NONE, "default deny")),
                List.of(new CapabilityError("deep [segment:hq -> app:crm/tcp/443]", "inspection:deep", "unsupported")),
                "{}");
        JsonNode json = MAPPER.readTree(UpoMapper.compiledJson(config));
        assertEquals("openziti", json.get("target").asText());
        assertEquals("smartrouting", json.get("objects").get(0).get("spec").get("terminatorStrategy").asText());
        assertEquals("IMPLICIT_DENY", json.get("capabilityGaps").get(0).get("kind").asText());
        assertEquals("none", json.get("capabilityGaps").get(0).get("applied").asText());
        assertEquals("inspection:deep", json.get("capabilityErrors").get(0).get("construct").asText());
        assertEquals("{}", json.get("rendered").asText());
    }

    @Test void planJsonListsOperationsInOrder() throws Exception {
        ApplyPlan plan = new ApplyPlan(TargetKind.FLEXIWAN, "corp", List.of(
                new PlanOperation(0, OperationType.ADD, new NativeObject("segment", "hq", Map.of("segmentId", 1)), null),
                new PlanOperation(1, OperationType.REMOVE, new NativeObject("path-policy", "old", Map.of()), null)),
                List.of());
        JsonNode json = MAPPER.readTree(UpoMapper.planJson(plan));
        assertTrue(json.get("executable").asBoolean());
        assertEquals("add", json.get("operations").get(0).get("type").asText());
        assertEquals(1, json.get("operations").get(0).get("spec").get("segmentId").asInt());
        assertEquals("remove", json.get("operations").get(1).get("type").asText());
        assertEquals("old", json.get("operations").get(1).get("name").asText());
    }

    @Test void errorJsonHasLocation() throws Exception {
        JsonNode json = MAPPER.readTree(UpoMapper.errorJson("AMBIGUOUS_POLICY: boom", "a, b"));
        assertEquals("a, b", json.get("location").asText());
    }
}
