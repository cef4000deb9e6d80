package org.opensase.upo.apply;

import org.opensase.upo.PolicyFixtures;
import org.opensase.upo.adapter.CapabilityError;
import org.opensase.upo.adapter.CompiledConfig;
import org.opensase.upo.adapter.NativeObject;
import org.opensase.upo.adapter.TargetKind;
import org.opensase.upo.adapter.flexiwan.FlexiWanAdapter;
import org.opensase.upo.adapter.opnsense.OpnsenseAdapter;
import org.opensase.upo.graph.NormalizedPolicyGraph;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class ApplyOrchestratorTest {

    private static final NormalizedPolicyGraph GRAPH = PolicyFixtures.graph(PolicyFixtures.withRules(
            "  - source: hq\n    destination: saas-crm\n    action: allow\n"));

    private final ApplyOrchestrator orchestrator = new ApplyOrchestrator(Runnable::run);

    private static ApplyPlan threeAdds(List<CapabilityError> errors) {
        List<PlanOperation> ops = List.of(
                new PlanOperation(0, OperationType.ADD, new NativeObject("alias", "a", Map.of()), null),
                new PlanOperation(1, OperationType.ADD, new NativeObject("alias", "b", Map.of()), null),
                new PlanOperation(2, OperationType.ADD, new NativeObject("alias", "c", Map.of()), null));
        return new ApplyPlan(TargetKind.OPNSENSE, "test-policy", ops, errors);
    }

    @Test
    void appliesAndConverges() {
        OpnsenseAdapter adapter = new OpnsenseAdapter();
        CompiledConfig config = adapter.compile(GRAPH);
        InMemoryTargetClient client = new InMemoryTargetClient(TargetKind.OPNSENSE);
        ApplyOrchestrator.Target target = new ApplyOrchestrator.Target(config, adapter, client);

        ApplyResult first = orchestrator.apply(target, false, new CancellationSignal());
        assertEquals(ApplyStatus.APPLIED, first.status());
        assertEquals(config.objects().size(), first.applied().size());
        assertEquals(config.objects().size(), client.readState().size());

        ApplyResult second = orchestrator.apply(target, false, new CancellationSignal());
        assertEquals(ApplyStatus.APPLIED, second.status());
        assertTrue(second.planned().isEmpty());
    }

    @Test
    void stopsAtFirstFailureWithoutRollback() {
        InMemoryTargetClient client = new InMemoryTargetClient(TargetKind.OPNSENSE).failOnMutation(2);
        ApplyResult result = orchestrator.apply(threeAdds(List.of()), false, client, new CancellationSignal());

        assertEquals(ApplyStatus.FAILED, result.status());
        assertEquals(1, result.applied().size());
        assertEquals(1, result.failed().index());
        assertEquals(1, result.notAttempted());
        assertEquals(1, result.error().operationIndex());
        assertTrue(result.error().message().contains("add alias/b rejected"));
        assertEquals(List.of("add alias/a", "add alias/b"), client.calls());
        assertEquals(List.of("alias/a"), client.readState().stream().map(NativeObject::id).toList());
    }

    @Test
    void uncheckedClientFailureKeepsAppliedPrefix() {
        InMemoryTargetClient client = new InMemoryTargetClient(TargetKind.OPNSENSE) {
            @Override
            public synchronized void add(NativeObject object) throws TargetException {
                if (object.name().equals("b")) {
                    throw new IllegalStateException("connection reset");
                }
                super.add(object);
            }
        };
        ApplyResult result = orchestrator.apply(threeAdds(List.of()), false, client, new CancellationSignal());

        assertEquals(ApplyStatus.FAILED, result.status());
        assertEquals(List.of("alias/a"), result.applied().stream().map(op -> op.object().id()).toList());
        assertEquals(1, result.failed().index());
        assertEquals(1, result.notAttempted());
        assertEquals(new ApplyError(1, "connection reset"), result.error());
        assertEquals(List.of("alias/a"), client.readState().stream().map(NativeObject::id).toList());
    }

    @Test
    void uncheckedFailureInsideApplyAllIsReportedPerOperation() {
        OpnsenseAdapter adapter = new OpnsenseAdapter();
        CompiledConfig config = adapter.compile(GRAPH);
        int[] adds = {0};
        InMemoryTargetClient client = new InMemoryTargetClient(TargetKind.OPNSENSE) {
            @Override
            public synchronized void add(NativeObject object) throws TargetException {
                if (++adds[0] == 2) {
                    throw new IllegalStateException("connection reset");
                }
                super.add(object);
            }
        };
        ApplyReport report = orchestrator.applyAll(
                List.of(new ApplyOrchestrator.Target(config, adapter, client)), false, new CancellationSignal());

        ApplyResult result = report.results().get(0);
        assertEquals(ApplyStatus.FAILED, result.status());
        assertEquals(1, result.applied().size());
        assertNotNull(result.failed());
        assertEquals(config.objects().size() - 2, result.notAttempted());
        assertEquals("connection reset", result.error().message());
        assertEquals(1, client.readState().size());
    }

    @Test
    void dryRunTouchesNothing() {
        InMemoryTargetClient client = new InMemoryTargetClient(TargetKind.OPNSENSE);
        ApplyResult result = orchestrator.apply(
                threeAdds(List.of(new CapabilityError("r", "source:user", "no"))), true, client, new CancellationSignal());
        assertEquals(ApplyStatus.DRY_RUN_ONLY, result.status());
        assertEquals(3, result.planned().size());
        assertTrue(result.isSuccess());
        assertTrue(client.calls().isEmpty());
    }

    @Test
    void refusesPlanWithCapabilityErrors() {
        InMemoryTargetClient client = new InMemoryTargetClient(TargetKind.OPNSENSE);
        ApplyResult result = orchestrator.apply(
                threeAdds(List.of(new CapabilityError("r", "source:user", "no"))), false, client, new CancellationSignal());
        assertEquals(ApplyStatus.FAILED, result.status());
        assertEquals(3, result.notAttempted());
        assertEquals(-1, result.error().operationIndex());
        assertTrue(client.calls().isEmpty());
    }

    @Test
    void cancellationStopsBetweenOperations() {
        CancellationSignal signal = new CancellationSignal();
        InMemoryTargetClient client = new InMemoryTargetClient(TargetKind.OPNSENSE).failWhen(o -> {
            signal.cancel();
            return false;
        });
        ApplyResult result = orchestrator.apply(threeAdds(List.of()), false, client, signal);
        assertEquals(ApplyStatus.FAILED, result.status());
        assertEquals(1, result.applied().size());
        assertNull(result.failed());
        assertEquals(2, result.notAttempted());
        assertEquals(new ApplyError(1, "cancelled"), result.error());
    }

    @Test
    void unreadableStateFailsBeforeStart() {
        OpnsenseAdapter adapter = new OpnsenseAdapter();
        TargetClient broken = new InMemoryTargetClient(TargetKind.OPNSENSE) {
            @Override
            public synchronized List<NativeObject> readState() {
                throw new IllegalStateException("unreachable");
            }
        };
        TargetClient unreachable = new TargetClient() {
            @Override
            public TargetKind target() {
                return TargetKind.OPNSENSE;
            }

            @Override
            public List<NativeObject> readState() throws TargetException {
                throw new TargetException(TargetKind.OPNSENSE, "connection refused");
            }

            @Override
            public void add(NativeObject object) {
                fail("no mutation expected");
            }

            @Override
            public void modify(NativeObject object) {
                fail("no mutation expected");
            }

            @Override
            public void remove(NativeObject object) {
                fail("no mutation expected");
            }
        };
        ApplyResult result = orchestrator.apply(
                new ApplyOrchestrator.Target(adapter.compile(GRAPH), adapter, unreachable), false, new CancellationSignal());
        assertEquals(ApplyStatus.FAILED, result.status());
        assertTrue(result.planned().isEmpty());
        assertEquals("reading live state failed: opnsense: connection refused", result.error().message());

        ApplyReport report = orchestrator.applyAll(
                List.of(new ApplyOrchestrator.Target(adapter.compile(GRAPH), adapter, broken)), false, new CancellationSignal());
        assertTrue(report.results().get(0).error().message().startsWith("apply aborted"));
    }

    @Test
    void failingTargetDoesNotAffectOthers() {
        OpnsenseAdapter opnsense = new OpnsenseAdapter();
        FlexiWanAdapter flexiwan = new FlexiWanAdapter();
        InMemoryTargetClient failing = new InMemoryTargetClient(TargetKind.OPNSENSE).failWhen(o -> true);
        InMemoryTargetClient healthy = new InMemoryTargetClient(TargetKind.FLEXIWAN);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            ApplyReport report = new ApplyOrchestrator(pool).applyAll(List.of(
                    new ApplyOrchestrator.Target(opnsense.compile(GRAPH), opnsense, failing),
                    new ApplyOrchestrator.Target(flexiwan.compile(GRAPH), flexiwan, healthy)), false, new CancellationSignal());

            assertFalse(report.isSuccess());
            assertEquals(ApplyStatus.FAILED, report.result(TargetKind.OPNSENSE).orElseThrow().status());
            assertEquals(ApplyStatus.APPLIED, report.result(TargetKind.FLEXIWAN).orElseThrow().status());
            assertFalse(healthy.readState().isEmpty());
        } finally {
            pool.shutdownNow();
        }
    }
}
