package org.pyken.parser;

import org.pyken.diagnostic.SourceLocation;
import org.pyken.parser.ast.Expr;

/**
 * @param annotation declared type expression, or {@code null}
 */
public record Parameter(String name, Expr annotation, SourceLocation location) {
}
