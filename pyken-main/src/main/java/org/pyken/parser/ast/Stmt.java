package org.pyken.parser.ast;

import org.pyken.diagnostic.SourceLocation;

import java.util.List;

public sealed interface Stmt {

    SourceLocation location();

    /** Plain or annotated assignment to a single name; {@code annotation} may be null. */
    record Assign(String target, Expr annotation, Expr value, SourceLocation location) implements Stmt {}

    /** {@code operator} is the binary operator without the trailing {@code =}. */
    record AugAssign(String target, String operator, Expr value, SourceLocation location) implements Stmt {}

    /** {@code elif} clauses are nested as a single {@code If} in {@code orElse}. */
    record If(Expr test, List<Stmt> body, List<Stmt> orElse, SourceLocation location) implements Stmt {}

    record Return(Expr value, SourceLocation location) implements Stmt {}

    record Raise(Expr exception, SourceLocation location) implements Stmt {}

    record Assert(Expr test, Expr message, SourceLocation location) implements Stmt {}

    record Pass(SourceLocation location) implements Stmt {}

    /** A {@code print(...)} call in statement position. */
    record Print(List<Expr> arguments, SourceLocation location) implements Stmt {}
}
