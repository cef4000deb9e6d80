package org.opensase.upo.apply;

import org.opensase.upo.adapter.TargetKind;

import java.util.List;
import java.util.Optional;

/** Per-target results of one {@link ApplyOrchestrator#applyAll} call. */
public record ApplyReport(boolean dryRun, List<ApplyResult> results) {

    public ApplyReport {
        results = List.copyOf(results);
    }

    public Optional<ApplyResult> result(TargetKind target) {
        return results.stream().filter(r -> r.target() == target).findFirst();
    }

    public boolean isSuccess() {
        return results.stream().allMatch(ApplyResult::isSuccess);
    }
}
