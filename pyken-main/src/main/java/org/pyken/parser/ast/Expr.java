package org.pyken.parser.ast;

import org.pyken.diagnostic.SourceLocation;

import java.math.BigInteger;
import java.util.List;

/**
 * Expressions of the supported Python subset. Anything outside the subset is
 * rejected while the tree is built, so translators only ever see these shapes.
 */
public sealed interface Expr {

    SourceLocation location();

    record IntLiteral(BigInteger value, SourceLocation location) implements Expr {}

    record StringLiteral(String value, SourceLocation location) implements Expr {}

    record BytesLiteral(String value, SourceLocation location) implements Expr {}

    record BoolLiteral(boolean value, SourceLocation location) implements Expr {}

    record NoneLiteral(SourceLocation location) implements Expr {}

    record Name(String id, SourceLocation location) implements Expr {}

    record Attribute(Expr value, String attribute, SourceLocation location) implements Expr {}

    record Subscript(Expr value, Expr index, SourceLocation location) implements Expr {}

    /** {@code operator} is the Python spelling: {@code -}, {@code +}, {@code ~} or {@code not}. */
    record UnaryOp(String operator, Expr operand, SourceLocation location) implements Expr {}

    record BinOp(String operator, Expr left, Expr right, SourceLocation location) implements Expr {}

    /** {@code and} / {@code or} over two or more operands. */
    record BoolOp(String operator, List<Expr> values, SourceLocation location) implements Expr {}

    /** A possibly chained comparison; {@code operators.size() == comparators.size()}. */
    record Compare(Expr left, List<String> operators, List<Expr> comparators, SourceLocation location) implements Expr {}

    record Call(Expr function, List<Expr> arguments, List<Keyword> keywords, SourceLocation location) implements Expr {}

    record Keyword(String name, Expr value) {}

    record ListDisplay(List<Expr> elements, SourceLocation location) implements Expr {}

    record TupleDisplay(List<Expr> elements, SourceLocation location) implements Expr {}

    record IfExp(Expr test, Expr body, Expr orElse, SourceLocation location) implements Expr {}
}
