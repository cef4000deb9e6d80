package org.opensase.upo.apply;

import org.opensase.upo.PolicyFixtures;
import org.opensase.upo.adapter.CompiledConfig;
import org.opensase.upo.adapter.NativeObject;
import org.opensase.upo.adapter.opnsense.OpnsenseAdapter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ApplyPlannerTest {

    private static final String RULES =
            "  - name: hq-to-crm\n"
            + "    source: hq\n"
            + "    destination: saas-crm\n"
            + "    action: allow\n"
            + "  - name: no-guests\n"
            + "    source: guest\n"
            + "    destination: segment:hq\n"
            + "    action: deny\n"
            + "    priority: 200\n";

    private final OpnsenseAdapter adapter = new OpnsenseAdapter();
    private final CompiledConfig config = adapter.compile(PolicyFixtures.graph(PolicyFixtures.withRules(RULES)));

    @Test
    void freshTargetGetsOneAddPerObject() {
        ApplyPlan plan = ApplyPlanner.plan(config, List.of(), adapter);
        assertEquals(config.objects().size(), plan.operations().size());
        assertEquals(plan.operations().size(), plan.count(OperationType.ADD));
        for (int i = 0; i < plan.operations().size(); i++) {
            assertEquals(i, plan.operations().get(i).index());
        }
        assertTrue(plan.isExecutable());
    }

    @Test
    void supportObjectsThenBlockingRulesThenPermissiveRules() {
        List<String> order = ApplyPlanner.plan(config, List.of(), adapter).operations().stream()
                .map(op -> op.object().kind() + "/" + op.object().name())
                .toList();
        int lastInterface = order.lastIndexOf("interface/lab");
        int firstAlias = order.indexOf("alias/seg_hq");
        int block = order.indexOf("filter-rule/guest-to-seg-hq");
        int pass = order.indexOf("filter-rule/hq-to-saas-crm-tcp-443");
        assertTrue(lastInterface < firstAlias, order.toString());
        assertTrue(firstAlias < block, order.toString());
        assertTrue(block < pass, order.toString());
        assertEquals(order.size() - 1, pass);
    }

    @Test
    void unchangedStateGivesEmptyPlan() {
        ApplyPlan plan = ApplyPlanner.plan(config, config.objects(), adapter);
        assertTrue(plan.isEmpty());
    }

    @Test
    void changedSpecBecomesModify() {
        List<NativeObject> live = new ArrayList<>(config.objects());
        NativeObject rule = config.rules().stream()
                .filter(o -> o.name().equals("hq-to-saas-crm-tcp-443")).findFirst().orElseThrow();
        NativeObject stale = new NativeObject(rule.kind(), rule.name(), Map.of("action", "pass", "ips", "ips"));
        live.set(live.indexOf(rule), stale);

        ApplyPlan plan = ApplyPlanner.plan(config, live, adapter);
        assertEquals(1, plan.operations().size());
        PlanOperation op = plan.operations().get(0);
        assertEquals(OperationType.MODIFY, op.type());
        assertEquals(rule, op.object());
        assertEquals(stale, op.current());
        assertEquals("modify filter-rule/hq-to-saas-crm-tcp-443", op.describe());
    }

    @Test
    void removalsUnwindInReverse() {
        List<NativeObject> live = new ArrayList<>(config.objects());
        live.add(new NativeObject(OpnsenseAdapter.INTERFACE, "old-if", Map.of("vlan", 900)));
        live.add(new NativeObject(OpnsenseAdapter.ALIAS, "old_alias", Map.of("content", List.of("10.9.0.0/16"))));
        live.add(new NativeObject(OpnsenseAdapter.FILTER_RULE, "old-block", Map.of("action", "block")));
        live.add(new NativeObject(OpnsenseAdapter.FILTER_RULE, "old-pass", Map.of("action", "pass")));

        ApplyPlan plan = ApplyPlanner.plan(config, live, adapter);
        assertEquals(List.of(
                        "remove filter-rule/old-pass",
                        "remove filter-rule/old-block",
                        "remove alias/old_alias",
                        "remove interface/old-if"),
                plan.operations().stream().map(PlanOperation::describe).toList());
    }

    @Test
    void unmanagedKindsAreLeftAlone() {
        List<NativeObject> live = new ArrayList<>(config.objects());
        live.add(new NativeObject("route", "default", Map.of("gateway", "192.0.2.1")));
        assertTrue(ApplyPlanner.plan(config, live, adapter).isEmpty());
    }

    @Test
    void capabilityErrorsMakeThePlanNonExecutable() {
        CompiledConfig broken = adapter.compile(PolicyFixtures.graph(PolicyFixtures.withRules(
                "  - source: carol\n    destination: saas-crm\n    action: allow\n")));
        ApplyPlan plan = ApplyPlanner.plan(broken, List.of(), adapter);
        assertFalse(plan.isExecutable());
        assertEquals(1, plan.capabilityErrors().size());
        assertFalse(plan.isEmpty());
    }
}
