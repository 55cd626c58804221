package org.taml.diagnostics;

/**
 * Defines unique, testable error codes for all positioned errors the parser can report.
 * This decouples callers and tests from the wording of the messages.
 */
public enum TamlErrorCode {
    // region Lexical errors
    /** A tag name is well formed but not one of the 37 TAML tags. */
    INVALID_TAG,
    /** A tag violates the delimiter syntax, e.g. an empty name or non-letter characters. */
    MALFORMED_TAG,
    /** The input ended in the middle of a tag. */
    UNEXPECTED_END_OF_INPUT,
    /** A character was found where a different one was required. */
    UNEXPECTED_CHARACTER,
    // endregion

    // region Structural errors
    /** A tag was still open at the end of the input. */
    UNCLOSED_TAG,
    /** A closing tag does not match the innermost open tag, or nothing is open. */
    MISMATCHED_TAG
    // endregion
}
