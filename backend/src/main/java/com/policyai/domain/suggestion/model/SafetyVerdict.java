package com.policyai.domain.suggestion.model;

import java.util.List;

/**
 * Result of content-safety validation.
 *
 * @param safe       true if no ERROR-level issues were found
 * @param confidence validator confidence in its own verdict, in [0, 1]
 * @param issues     all issues (both ERROR and WARNING)
 */
public record SafetyVerdict(
        boolean safe,
        double confidence,
        List<SafetyIssue> issues
) {
    public List<SafetyIssue> errors() {
        return issues.stream().filter(i -> i.severity() == SafetyIssue.Severity.ERROR).toList();
    }

    public List<SafetyIssue> warnings() {
        return issues.stream().filter(i -> i.severity() == SafetyIssue.Severity.WARNING).toList();
    }
}
