package org.pyken.ir;

/**
 * A node of the expression-oriented intermediate representation. Every node
 * yields a value; statement sequencing is expressed through the continuation
 * carried by {@link Let}, {@link Guard} and {@link Trace}.
 */
public sealed interface IrNode
        permits Literal, NameRef, BinaryOp, UnaryOp, Call, FieldAccess, ListLiteral, TupleLiteral,
                Let, Conditional, Match, Guard, Fail, TailValue, Trace, Lambda {

    <R, A> R accept(IrVisitor<R, A> visitor, A arg);
}
