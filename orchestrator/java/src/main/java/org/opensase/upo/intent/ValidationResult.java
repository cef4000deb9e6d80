package org.opensase.upo.intent;

import org.opensase.upo.model.IntentPolicy;

import java.util.List;

/**
 * Immutable result of validating an intent document.
 *
 * @param errors   conditions that make the document invalid (must fix)
 * @param warnings conditions that are permitted but suspicious (should fix)
 * @param policy   the typed policy, present only when {@code errors} is empty
 */
public record ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings, IntentPolicy policy) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        if (!errors.isEmpty()) {
            policy = null;
        }
    }

    static ValidationResult failed(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        return new ValidationResult(errors, warnings, null);
    }

    public boolean isValid() { return errors.isEmpty(); }
    public boolean hasWarnings() { return !warnings.isEmpty(); }

    /** The first error, which is what callers report when they stop at the first failure. */
    public ValidationIssue firstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }
}
