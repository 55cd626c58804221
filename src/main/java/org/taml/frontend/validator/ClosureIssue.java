package org.taml.frontend.validator;

/**
 * A tag closure problem found by {@link Validator#validateTagClosure(java.util.List)}.
 *
 * @param kind The kind of problem.
 * @param tagName The tag involved.
 * @param position The offset of the offending tag.
 */
public record ClosureIssue(Kind kind, String tagName, int position) {

    /**
     * The kinds of closure problems.
     */
    public enum Kind {
        /** An opening tag without a closing tag. */
        UNCLOSED,
        /** A closing tag while no tag is open. */
        EXTRA,
        /** A closing tag that differs from the innermost open tag. */
        MISMATCHED
    }
}
