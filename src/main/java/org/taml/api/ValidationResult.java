package org.taml.api;

import org.taml.diagnostics.TamlParseException;

import java.util.List;

/**
 * The outcome of a syntax check.
 *
 * @param valid Whether no error was found.
 * @param errors The errors in the order they were found.
 */
public record ValidationResult(boolean valid, List<TamlParseException> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    /**
     * Creates a result from a list of errors; the result is valid iff the list is empty.
     * @param errors The errors found.
     * @return The result.
     */
    public static ValidationResult of(List<TamlParseException> errors) {
        return new ValidationResult(errors.isEmpty(), errors);
    }
}
