package org.opensase.upo.intent;

import org.opensase.upo.PolicyFixtures;
import org.opensase.upo.model.Action;
import org.opensase.upo.model.Application;
import org.opensase.upo.model.EgressRule;
import org.opensase.upo.model.Identity;
import org.opensase.upo.model.InspectionLevel;
import org.opensase.upo.model.IntentPolicy;
import org.opensase.upo.model.Segment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntentParserTest {

    private static final String MINIMAL = String.join("\n",
            "name: minimal",
            "metadata: {version: \"1\"}",
            "apps:",
            "  - name: web",
            "    address: web.example.com",
            "segments:",
            "  - name: hq",
            "    vlan: 10",
            "    vrf_id: 7",
            "egressRules:",
            "  - source: hq",
            "    destination: web",
            "    action: allow",
            "");

    // ── load ──────────────────────────────────────────────────────────────────────

    @Test
    void loadsYamlIntoRawMap() {
        Map<String, Object> raw = IntentParser.load(MINIMAL);
        assertEquals("minimal", raw.get("name"));
        assertTrue(raw.get("egressRules") instanceof List);
    }

    @Test
    void malformedYamlIsAValidationErrorAtRoot() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> IntentParser.load("name: [unclosed"));
        assertEquals("$", e.location());
        assertTrue(e.issues().get(0).message().startsWith("malformed YAML"));
    }

    @Test
    void emptyDocumentIsRejected() {
        ValidationException e = assertThrows(ValidationException.class, () -> IntentParser.load(""));
        assertEquals("document is empty", e.issues().get(0).message());
    }

    @Test
    void scalarRootIsRejected() {
        ValidationException e = assertThrows(ValidationException.class, () -> IntentParser.load("just a string"));
        assertEquals("$", e.location());
    }

    @Test
    void yamlTagsDoNotInstantiateJavaTypes() {
        assertThrows(ValidationException.class,
                () -> IntentParser.load("name: !!java.io.File [/tmp/x]\n"));
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("intent.yaml");
        Files.writeString(file, MINIMAL);
        assertEquals("minimal", IntentParser.load(file).get("name"));
    }

    // ── fromMap ───────────────────────────────────────────────────────────────────

    @Test
    void appliesDefaults() {
        IntentPolicy policy = IntentParser.fromMap(IntentParser.load(MINIMAL));

        Application web = policy.application("web").orElseThrow();
        assertEquals("tcp", web.protocol());
        assertEquals(List.of(80), web.ports());
        assertEquals(InspectionLevel.NONE, web.inspection());

        EgressRule rule = policy.egressRules().get(0);
        assertEquals("egressRules[0]", rule.name());
        assertEquals(EgressRule.DEFAULT_PRIORITY, rule.priority());
        assertEquals(InspectionLevel.NONE, rule.inspectionLevel());
        assertEquals(Action.ALLOW, rule.action());
        assertEquals(List.of("hq"), rule.sources());
    }

    @Test
    void acceptsAliasKeys() {
        IntentPolicy policy = IntentParser.fromMap(IntentParser.load(MINIMAL));
        assertEquals(1, policy.applications().size());
        Segment hq = policy.segment("hq").orElseThrow();
        assertEquals(7, hq.vrfId());
        assertEquals(10, hq.vlan());
        assertFalse(hq.nat());
    }

    @Test
    void parsesFullFixture() throws IOException {
        IntentPolicy policy = IntentParser.fromMap(IntentParser.load(PolicyFixtures.fixture("full")));

        assertEquals("corp-policy", policy.name());
        assertEquals("2.3", policy.metadata().version());
        assertEquals(Instant.parse("2026-03-01T12:00:00Z"), policy.metadata().timestamp());

        assertEquals(3, policy.identities().size());
        Identity engineering = policy.identity("engineering").orElseThrow();
        assertEquals(Identity.IdentityType.GROUP, engineering.type());
        assertEquals(List.of("alice"), engineering.members());

        assertEquals(List.of(22, 443), policy.application("git").orElseThrow().ports());
        assertEquals(InspectionLevel.BASIC, policy.application("git").orElseThrow().inspection());
        assertTrue(policy.segment("hq").orElseThrow().nat());
        assertEquals(List.of("segment:hq", "segment:dc"), policy.egressRules().get(2).destinations());
        assertEquals(200, policy.egressRules().get(2).priority());
        assertEquals("wan1", policy.egressRules().get(0).preferredWan());
    }

    @Test
    void attributesAcceptMappingAndListForms() throws IOException {
        IntentPolicy policy = IntentParser.fromMap(IntentParser.load(PolicyFixtures.fixture("full")));
        assertEquals(Map.of("department", "engineering", "role", "employee"),
                policy.identity("alice").orElseThrow().attributes());
        assertEquals(Map.of("role", "contractor"), policy.identity("bob").orElseThrow().attributes());
    }

    @Test
    void userEntryWithGroupTypeBecomesGroup() {
        IntentPolicy policy = IntentParser.fromMap(IntentParser.load(String.join("\n",
                "name: p",
                "metadata: {version: \"1\"}",
                "users:",
                "  - name: ops",
                "    type: group",
                "egressRules: []",
                "")));
        assertEquals(Identity.IdentityType.GROUP, policy.identity("ops").orElseThrow().type());
    }

    @Test
    void dateTimestampIsReadAsStartOfDayUtc() {
        assertEquals(Instant.parse("2026-01-15T00:00:00Z"), IntentParser.parseTimestamp("2026-01-15"));
    }

    // ── references ────────────────────────────────────────────────────────────────

    @Test
    void parsesReferenceForms() {
        assertEquals(new Reference(Reference.Kind.SEGMENT, "hq"), Reference.parse("segment:hq"));
        assertEquals(new Reference(Reference.Kind.APPLICATION, "crm"), Reference.parse("app:crm"));
        assertEquals(new Reference(Reference.Kind.CIDR, "10.0.0.0/8"), Reference.parse("10.0.0.0/8"));
        assertEquals(new Reference(Reference.Kind.CIDR, "10.0.0.0/8"), Reference.parse("cidr:10.0.0.0/8"));
        assertEquals(new Reference(Reference.Kind.NAME, "crm"), Reference.parse("crm"));
        assertEquals("group:eng", Reference.parse("group: eng").toString());
    }
}
