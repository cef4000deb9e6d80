package org.opensase.upo.apply;

import org.opensase.upo.adapter.CompiledConfig;
import org.opensase.upo.adapter.TargetAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Plans and applies compiled configs to live targets.
 *
 * <p>Operations against one target run strictly in plan order and stop at the first failure,
 * checked or not; there is no rollback. Different targets run concurrently, one task each, and never affect
 * each other: a failing target does not cancel the others.
 */
public class ApplyOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ApplyOrchestrator.class);

    private final Executor executor;

    public ApplyOrchestrator(Executor executor) {
        this.executor = executor;
    }

    /** One target of an {@link #applyAll} call. */
    public record Target(CompiledConfig config, TargetAdapter adapter, TargetClient client) {}

    /**
     * Reads the live state, plans and applies. A state read failure is reported as a failed
     * result with nothing attempted.
     */
    public ApplyResult apply(Target target, boolean dryRun, CancellationSignal signal) {
        ApplyPlan plan;
        try {
            plan = ApplyPlanner.plan(target.config(), target.client().readState(), target.adapter());
        } catch (TargetException e) {
            log.warn("{}: reading live state failed: {}", target.config().target(), e.getMessage());
            return ApplyResult.failedBeforeStart(target.config().target(), List.of(),
                    "reading live state failed: " + e.getMessage());
        }
        return apply(plan, dryRun, target.client(), signal);
    }

    public ApplyResult apply(ApplyPlan plan, boolean dryRun, TargetClient client, CancellationSignal signal) {
        if (dryRun) {
            log.info("{}: dry run, {} operation(s) planned", plan.target(), plan.operations().size());
            return ApplyResult.dryRun(plan);
        }
        if (!plan.isExecutable()) {
            log.warn("{}: refusing to apply, {} capability error(s)", plan.target(), plan.capabilityErrors().size());
            return ApplyResult.failedBeforeStart(plan.target(), plan.operations(),
                    plan.capabilityErrors().size() + " capability error(s); config is not applied");
        }

        List<PlanOperation> ops = plan.operations();
        List<PlanOperation> applied = new ArrayList<>();
        for (PlanOperation op : ops) {
            if (signal.isCancelled()) {
                log.info("{}: cancelled before operation {}", plan.target(), op.index());
                return new ApplyResult(plan.target(), ApplyStatus.FAILED, ops, applied, null,
                        ops.size() - applied.size(), new ApplyError(op.index(), "cancelled"));
            }
            try {
                execute(op, client);
                applied.add(op);
                log.debug("{}: {} done", plan.target(), op.describe());
            } catch (TargetException | RuntimeException e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.warn("{}: {} failed: {}", plan.target(), op.describe(), message);
                return new ApplyResult(plan.target(), ApplyStatus.FAILED, ops, applied, op,
                        ops.size() - applied.size() - 1, new ApplyError(op.index(), message));
            }
        }
        log.info("{}: applied {} operation(s)", plan.target(), applied.size());
        return new ApplyResult(plan.target(), ApplyStatus.APPLIED, ops, applied, null, 0, null);
    }

    /** Applies every target concurrently and waits for all of them. */
    public ApplyReport applyAll(List<Target> targets, boolean dryRun, CancellationSignal signal) {
        List<CompletableFuture<ApplyResult>> futures = new ArrayList<>();
        for (Target target : targets) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> apply(target, dryRun, signal), executor)
                    .exceptionally(e -> {
                        log.error("{}: apply aborted", target.config().target(), e);
                        return ApplyResult.failedBeforeStart(target.config().target(), List.of(),
                                "apply aborted: " + e.getMessage());
                    }));
        }
        List<ApplyResult> results = new ArrayList<>();
        for (CompletableFuture<ApplyResult> future : futures) {
            results.add(future.join());
        }
        return new ApplyReport(dryRun, results);
    }

    private static void execute(PlanOperation op, TargetClient client) throws TargetException {
        switch (op.type()) {
            case ADD:
                client.add(op.object());
                break;
            case MODIFY:
                client.modify(op.object());
                break;
            case REMOVE:
                client.remove(op.object());
                break;
            default:
                throw new IllegalStateException("Unknown operation type: " + op.type());
        }
    }
}
