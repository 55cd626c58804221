package org.taml.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting positioned errors when a pass keeps going after a fault,
 * as the token validator does.
 * <p>
 * This decouples error reporting from the validation logic itself.
 */
public class DiagnosticsEngine {

    private final List<TamlParseException> errors = new ArrayList<>();

    /**
     * Reports an error.
     * @param error The error to record.
     */
    public void report(TamlParseException error) {
        errors.add(error);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Returns an unmodifiable list of all collected errors in reporting order.
     *
     * @return An unmodifiable list of errors.
     */
    public List<TamlParseException> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Returns all collected errors as a single string of detailed messages,
     * separated by blank lines.
     *
     * @return A formatted summary of all errors.
     */
    public String summary() {
        return errors.stream()
                .map(TamlParseException::getDetailedMessage)
                .collect(Collectors.joining("\n\n"));
    }
}
