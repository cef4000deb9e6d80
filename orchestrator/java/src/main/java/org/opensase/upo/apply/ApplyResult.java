package org.opensase.upo.apply;

import org.opensase.upo.adapter.TargetKind;

import java.util.List;

/**
 * Outcome of one apply against one target. Nothing is rolled back: the target holds exactly
 * the {@code applied} operations.
 *
 * @param planned         every operation of the plan, in execution order
 * @param applied         operations that completed, a prefix of {@code planned}
 * @param failed          the operation that failed, or {@code null}
 * @param notAttempted    operations after the failure or cancellation point
 */
public record ApplyResult(
        TargetKind target,
        ApplyStatus status,
        List<PlanOperation> planned,
        List<PlanOperation> applied,
        PlanOperation failed,
        int notAttempted,
        ApplyError error
) {
    public ApplyResult {
        planned = List.copyOf(planned);
        applied = List.copyOf(applied);
    }

    static ApplyResult dryRun(ApplyPlan plan) {
        return new ApplyResult(plan.target(), ApplyStatus.DRY_RUN_ONLY, plan.operations(), List.of(), null, 0, null);
    }

    static ApplyResult failedBeforeStart(TargetKind target, List<PlanOperation> planned, String message) {
        return new ApplyResult(target, ApplyStatus.FAILED, planned, List.of(), null, planned.size(),
                ApplyError.beforeOperations(message));
    }

    public boolean isSuccess() {
        return status != ApplyStatus.FAILED;
    }
}
