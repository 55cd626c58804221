package org.taml.frontend.validator;

/**
 * A closing tag that did not match the innermost open tag.
 *
 * @param expected The innermost open tag name, or "(none)" if nothing was open.
 * @param actual The name in the closing tag.
 */
public record TagMismatch(String expected, String actual) {
}
