package org.opensase.upo.intent;

import org.opensase.upo.PolicyException;

import java.util.List;

/**
 * Thrown when an intent document is malformed, incomplete or semantically invalid.
 * Always recoverable by correcting the input; never retried.
 */
public class ValidationException extends PolicyException {

    private final List<ValidationIssue> issues;

    public ValidationException(List<ValidationIssue> issues) {
        super(describe(issues));
        this.issues = List.copyOf(issues);
    }

    public ValidationException(ValidationIssue issue, Throwable cause) {
        super(issue.toString(), cause);
        this.issues = List.of(issue);
    }

    public List<ValidationIssue> issues() {
        return issues;
    }

    @Override
    public String location() {
        return issues.isEmpty() ? "$" : issues.get(0).path();
    }

    private static String describe(List<ValidationIssue> issues) {
        if (issues.isEmpty()) {
            return "invalid intent document";
        }
        String first = issues.get(0).toString();
        return issues.size() == 1 ? first : first + " (and " + (issues.size() - 1) + " more)";
    }
}
