package org.taml.frontend.validator;

import java.util.List;

/**
 * Nesting validity with the raw tag names involved, without positions.
 *
 * @param valid Whether nothing is unclosed or mismatched.
 * @param unclosedTags The names still open at the end, outermost first.
 * @param mismatchedTags The mismatched closing tags in source order.
 */
public record NestingReport(boolean valid, List<String> unclosedTags, List<TagMismatch> mismatchedTags) {

    public NestingReport {
        unclosedTags = List.copyOf(unclosedTags);
        mismatchedTags = List.copyOf(mismatchedTags);
    }
}
