package org.taml.frontend.validator;

import java.util.List;

/**
 * Closure-only validation result.
 *
 * @param valid Whether no issue was found.
 * @param issues The issues; mismatches and extras in source order, then unclosed tags outermost first.
 */
public record ClosureReport(boolean valid, List<ClosureIssue> issues) {

    public ClosureReport {
        issues = List.copyOf(issues);
    }
}
