package org.opensase.upo.mcp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opensase.upo.UpoSettings;
import org.opensase.upo.adapter.NativeObject;
import org.opensase.upo.adapter.TargetKind;
import org.opensase.upo.apply.JsonFileTargetClient;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for UpoServer: invoke buildResources() and read handlers
 * directly, without a real MCP transport.
 */
class UpoServerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> SPEC = new TypeReference<>() {};

    @TempDir
    Path stateDir;

    private static Path fixture(String name) {
        URL url = UpoServerTest.class.getClassLoader().getResource("fixtures/" + name + "/intent.yaml");
        assertNotNull(url, "fixture not found: " + name);
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    private static UpoServer.ResourceSet build(String fixture, Path stateDir) throws Exception {
        return UpoServer.buildResources(fixture(fixture), stateDir, UpoSettings.defaults());
    }

    private static JsonNode read(UpoServer.ResourceSet rs, String uri) throws Exception {
        UpoServer.ResourceHandler handler = rs.handlers().get(uri);
        assertNotNull(handler, "no handler for " + uri);
        McpSchema.ReadResourceResult result = handler.handle(uri);
        assertEquals(1, result.contents().size());
        McpSchema.TextResourceContents text = (McpSchema.TextResourceContents) result.contents().get(0);
        assertEquals(uri, text.uri());
        assertEquals("application/json", text.mimeType());
        return MAPPER.readTree(text.text());
    }

    private static List<String> names(UpoServer.ResourceSet rs) {
        return rs.resources().stream().map(McpSchema.Resource::name).toList();
    }

    // ── list_resources ────────────────────────────────────────────────────────────

    @Test void validPolicyListsGraphAndCompiledConfigs() throws Exception {
        UpoServer.ResourceSet rs = build("scenario", null);
        assertEquals("hq-saas", rs.policyName());
        assertEquals(List.of("index", "validation", "graph",
                "compiled-opnsense", "compiled-openziti", "compiled-flexiwan"), names(rs));
    }

    @Test void stateDirAddsPlanResources() throws Exception {
        UpoServer.ResourceSet rs = build("scenario", stateDir);
        assertEquals(9, rs.resources().size());
        assertTrue(names(rs).contains("plan-openziti"));
    }

    @Test void everyResourceHasAHandler() throws Exception {
        UpoServer.ResourceSet rs = build("scenario", stateDir);
        for (McpSchema.Resource r : rs.resources()) {
            assertTrue(rs.handlers().containsKey(r.uri()), r.uri());
        }
    }

    @Test void invalidPolicyListsOnlyIndexAndValidation() throws Exception {
        UpoServer.ResourceSet rs = build("invalid", stateDir);
        // no typed policy to take the name from, so the file stem names it
        assertEquals("intent", rs.policyName());
        assertEquals(List.of("index", "validation"), names(rs));
    }

    @Test void missingPolicyFileThrows() {
        assertThrows(Exception.class,
            () -> UpoServer.buildResources(Path.of("/nonexistent/intent.yaml"), null, UpoSettings.defaults()));
    }

    // ── read_resource ─────────────────────────────────────────────────────────────

    @Test void indexSummarisesPolicy() throws Exception {
        UpoServer.ResourceSet rs = build("scenario", null);
        JsonNode index = read(rs, "upo://hq-saas/index");
        assertEquals("hq-saas", index.get("policy").asText());
        assertEquals("1.0", index.get("version").asText());
        assertTrue(index.get("valid").asBoolean());
        assertEquals(1, index.get("rule_count").asInt());
        assertEquals(6, index.get("resources").size());
        assertEquals("upo://hq-saas/graph", index.get("resources").get(2).get("uri").asText());
    }

    @Test void validationReportListsErrors() throws Exception {
        UpoServer.ResourceSet rs = build("invalid", null);
        JsonNode report = read(rs, "upo://intent/validation");
        assertFalse(report.get("valid").asBoolean());
        assertTrue(report.get("errors").size() >= 1);
        assertTrue(report.get("errors").get(0).get("path").asText().startsWith("egressRules[0].destination"));
        JsonNode index = read(rs, "upo://intent/index");
        assertFalse(index.get("valid").asBoolean());
        assertNull(index.get("rule_count"));
    }

    @Test void graphListsResolvedRules() throws Exception {
        UpoServer.ResourceSet rs = build("scenario", null);
        JsonNode graph = read(rs, "upo://hq-saas/graph");
        assertEquals(1, graph.get("rules").size());
        JsonNode rule = graph.get("rules").get(0);
        assertEquals("segment:hq", rule.get("source").asText());
        assertEquals("app:saas-crm/tcp/443", rule.get("destination").asText());
        assertEquals("basic", rule.get("inspectionLevel").asText());
        assertEquals(0, graph.get("shadowed").size());
    }

    @Test void ambiguousPolicyServesConflictInsteadOfGraph() throws Exception {
        UpoServer.ResourceSet rs = build("ambiguous", null);
        assertEquals(List.of("index", "validation", "graph"), names(rs));
        JsonNode graph = read(rs, "upo://conflicting-policy/graph");
        assertTrue(graph.get("error").asText().startsWith("AMBIGUOUS_POLICY: "));
        assertEquals("let-in, keep-out", graph.get("location").asText());
    }

    @Test void compiledConfigCarriesObjectsAndRendering() throws Exception {
        UpoServer.ResourceSet rs = build("scenario", null);
        JsonNode compiled = read(rs, "upo://hq-saas/compiled/opnsense");
        assertEquals("opnsense", compiled.get("target").asText());
        assertEquals("filter-rule", compiled.get("ruleKind").asText());
        assertEquals(3, compiled.get("objects").size());
        assertEquals(0, compiled.get("capabilityErrors").size());
        assertTrue(compiled.get("rendered").asText().contains("table inet upo"));
    }

    @Test void planFollowsEmulatedState() throws Exception {
        UpoServer.ResourceSet rs = build("scenario", stateDir);
        String uri = "upo://hq-saas/plan/flexiwan";
        JsonNode before = read(rs, uri);
        assertTrue(before.get("executable").asBoolean());
        assertEquals(3, before.get("operations").size());
        assertEquals("add", before.get("operations").get(0).get("type").asText());

        JsonFileTargetClient client = new JsonFileTargetClient(TargetKind.FLEXIWAN, stateDir);
        for (JsonNode op : before.get("operations")) {
            client.add(new NativeObject(op.get("kind").asText(), op.get("name").asText(),
                    MAPPER.convertValue(op.get("spec"), SPEC)));
        }
        assertEquals(0, read(rs, uri).get("operations").size());
    }
}
