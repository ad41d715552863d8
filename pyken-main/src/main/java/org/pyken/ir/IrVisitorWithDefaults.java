package org.pyken.ir;

/**
 * A visitor that walks every child and returns {@link #defaultAction} for each
 * node. Subclasses override the nodes they care about and call {@code super}
 * to keep descending.
 */
public abstract class IrVisitorWithDefaults<R, A> implements IrVisitor<R, A> {

    public R defaultAction(IrNode n, A arg) {
        return null;
    }

    protected void visitChildren(Iterable<IrNode> children, A arg) {
        for (IrNode child : children) {
            if (child != null) {
                child.accept(this, arg);
            }
        }
    }

    @Override
    public R visit(Literal n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(NameRef n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(BinaryOp n, A arg) {
        n.left().accept(this, arg);
        n.right().accept(this, arg);
        return defaultAction(n, arg);
    }

    @Override
    public R visit(UnaryOp n, A arg) {
        n.operand().accept(this, arg);
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Call n, A arg) {
        n.callee().accept(this, arg);
        for (Call.Argument argument : n.arguments()) {
            argument.value().accept(this, arg);
        }
        return defaultAction(n, arg);
    }

    @Override
    public R visit(FieldAccess n, A arg) {
        n.target().accept(this, arg);
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ListLiteral n, A arg) {
        visitChildren(n.elements(), arg);
        return defaultAction(n, arg);
    }

    @Override
    public R visit(TupleLiteral n, A arg) {
        visitChildren(n.elements(), arg);
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Let n, A arg) {
        n.value().accept(this, arg);
        n.body().accept(this, arg);
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Conditional n, A arg) {
        n.condition().accept(this, arg);
        n.then().accept(this, arg);
        n.otherwise().accept(this, arg);
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Match n, A arg) {
        n.subject().accept(this, arg);
        for (Match.Arm arm : n.arms()) {
            visitChildren(arm.patterns(), arg);
            arm.body().accept(this, arg);
        }
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Guard n, A arg) {
        n.condition().accept(this, arg);
        if (n.message() != null) {
            n.message().accept(this, arg);
        }
        n.continuation().accept(this, arg);
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Fail n, A arg) {
        if (n.message() != null) {
            n.message().accept(this, arg);
        }
        return defaultAction(n, arg);
    }

    @Override
    public R visit(TailValue n, A arg) {
        n.value().accept(this, arg);
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Trace n, A arg) {
        n.label().accept(this, arg);
        visitChildren(n.arguments(), arg);
        n.continuation().accept(this, arg);
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Lambda n, A arg) {
        n.body().accept(this, arg);
        return defaultAction(n, arg);
    }
}
