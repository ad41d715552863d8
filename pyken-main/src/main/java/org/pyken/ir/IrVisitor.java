package org.pyken.ir;

public interface IrVisitor<R, A> {

    R visit(Literal n, A arg);

    R visit(NameRef n, A arg);

    R visit(BinaryOp n, A arg);

    R visit(UnaryOp n, A arg);

    R visit(Call n, A arg);

    R visit(FieldAccess n, A arg);

    R visit(ListLiteral n, A arg);

    R visit(TupleLiteral n, A arg);

    R visit(Let n, A arg);

    R visit(Conditional n, A arg);

    R visit(Match n, A arg);

    R visit(Guard n, A arg);

    R visit(Fail n, A arg);

    R visit(TailValue n, A arg);

    R visit(Trace n, A arg);

    R visit(Lambda n, A arg);
}
