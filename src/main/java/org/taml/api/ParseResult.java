package org.taml.api;

import org.taml.ast.DocumentNode;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of a parse that does not throw: either a tree or the failure that prevented it.
 *
 * @param success Whether parsing succeeded.
 * @param ast The tree on success, otherwise null.
 * @param error The failure, otherwise null. Either a
 *              {@link org.taml.diagnostics.TamlParseException} or a
 *              {@link org.taml.frontend.parser.NestingDepthExceededException}.
 */
public record ParseResult(boolean success, DocumentNode ast, Exception error) {

    public static ParseResult success(DocumentNode ast) {
        return new ParseResult(true, Objects.requireNonNull(ast, "ast"), null);
    }

    public static ParseResult failure(Exception error) {
        return new ParseResult(false, null, Objects.requireNonNull(error, "error"));
    }

    public Optional<DocumentNode> getAst() {
        return Optional.ofNullable(ast);
    }

    public Optional<Exception> getError() {
        return Optional.ofNullable(error);
    }
}
