package org.pyken.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.pyken.diagnostic.SourceLocation;
import org.pyken.parser.antlr4.PyKenParser;
import org.pyken.parser.antlr4.PyKenParserBaseVisitor;
import org.pyken.parser.ast.Expr;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns expression parse trees into {@link Expr} nodes.
 * <p>
 * Value expressions only allow single-level attribute access and integer
 * subscripts. Type annotations additionally allow generic subscripts such as
 * {@code Dict[str, int]} and string forward references.
 */
final class ExpressionBuilder extends PyKenParserBaseVisitor<Expr> {

    private final boolean annotation;

    private ExpressionBuilder(boolean annotation) {
        this.annotation = annotation;
    }

    static ExpressionBuilder forValues() {
        return new ExpressionBuilder(false);
    }

    static ExpressionBuilder forAnnotations() {
        return new ExpressionBuilder(true);
    }

    Expr build(PyKenParser.TestContext ctx) {
        return visit(ctx);
    }

    /** A comma-separated list becomes a tuple; a single element is returned as is. */
    Expr build(PyKenParser.TestListContext ctx) {
        if (ctx.test().size() == 1 && ctx.COMMA().isEmpty()) {
            return visit(ctx.test(0));
        }
        return new Expr.TupleDisplay(visitAll(ctx.test()), at(ctx));
    }

    // ── Boolean and comparison layers ──

    @Override
    public Expr visitConditionalTest(PyKenParser.ConditionalTestContext ctx) {
        Expr body = visit(ctx.orTest(0));
        if (ctx.IF() == null) {
            return body;
        }
        return new Expr.IfExp(visit(ctx.orTest(1)), body, visit(ctx.test()), at(ctx));
    }

    @Override
    public Expr visitLambdaTest(PyKenParser.LambdaTestContext ctx) {
        throw unsupported("lambda expression", ctx);
    }

    @Override
    public Expr visitOrTest(PyKenParser.OrTestContext ctx) {
        if (ctx.andTest().size() == 1) {
            return visit(ctx.andTest(0));
        }
        return new Expr.BoolOp("or", visitAll(ctx.andTest()), at(ctx));
    }

    @Override
    public Expr visitAndTest(PyKenParser.AndTestContext ctx) {
        if (ctx.notTest().size() == 1) {
            return visit(ctx.notTest(0));
        }
        return new Expr.BoolOp("and", visitAll(ctx.notTest()), at(ctx));
    }

    @Override
    public Expr visitNegation(PyKenParser.NegationContext ctx) {
        return new Expr.UnaryOp("not", visit(ctx.notTest()), at(ctx));
    }

    @Override
    public Expr visitComparisonTest(PyKenParser.ComparisonTestContext ctx) {
        return visit(ctx.comparison());
    }

    @Override
    public Expr visitComparison(PyKenParser.ComparisonContext ctx) {
        Expr left = visit(ctx.expr(0));
        if (ctx.compOp().isEmpty()) {
            return left;
        }
        List<String> operators = new ArrayList<>();
        for (PyKenParser.CompOpContext op : ctx.compOp()) {
            operators.add(comparisonOperator(op));
        }
        List<Expr> comparators = visitAll(ctx.expr().subList(1, ctx.expr().size()));
        return new Expr.Compare(left, operators, comparators, at(ctx));
    }

    private static String comparisonOperator(PyKenParser.CompOpContext op) {
        if (op.NOT() != null && op.IN() != null) {
            return "not in";
        }
        if (op.IS() != null && op.NOT() != null) {
            return "is not";
        }
        return op.getText();
    }

    // ── Arithmetic ──

    @Override
    public Expr visitAtomExpression(PyKenParser.AtomExpressionContext ctx) {
        if (ctx.AWAIT() != null) {
            throw unsupported("await expression", ctx);
        }
        return visit(ctx.atomExpr());
    }

    @Override
    public Expr visitPowerExpression(PyKenParser.PowerExpressionContext ctx) {
        return new Expr.BinOp("**", visit(ctx.expr(0)), visit(ctx.expr(1)), at(ctx.POWER().getSymbol()));
    }

    @Override
    public Expr visitUnaryExpression(PyKenParser.UnaryExpressionContext ctx) {
        return new Expr.UnaryOp(ctx.op.getText(), visit(ctx.expr()), at(ctx.op));
    }

    @Override
    public Expr visitMultiplicativeExpression(PyKenParser.MultiplicativeExpressionContext ctx) {
        return binary(ctx.op, ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expr visitAdditiveExpression(PyKenParser.AdditiveExpressionContext ctx) {
        return binary(ctx.op, ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expr visitShiftExpression(PyKenParser.ShiftExpressionContext ctx) {
        return binary(ctx.op, ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expr visitBitAndExpression(PyKenParser.BitAndExpressionContext ctx) {
        return binary(ctx.op, ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expr visitBitXorExpression(PyKenParser.BitXorExpressionContext ctx) {
        return binary(ctx.op, ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expr visitBitOrExpression(PyKenParser.BitOrExpressionContext ctx) {
        return binary(ctx.op, ctx.expr(0), ctx.expr(1));
    }

    private Expr binary(Token op, PyKenParser.ExprContext left, PyKenParser.ExprContext right) {
        return new Expr.BinOp(op.getText(), visit(left), visit(right), at(op));
    }

    // ── Trailers ──

    @Override
    public Expr visitAtomExpr(PyKenParser.AtomExprContext ctx) {
        Expr current = visit(ctx.atom());
        for (PyKenParser.TrailerContext trailer : ctx.trailer()) {
            current = applyTrailer(current, trailer);
        }
        return current;
    }

    private Expr applyTrailer(Expr target, PyKenParser.TrailerContext trailer) {
        if (trailer instanceof PyKenParser.CallTrailerContext call) {
            if (!(target instanceof Expr.Name) && !(target instanceof Expr.Attribute)) {
                throw unsupported("call on a computed value", trailer);
            }
            return call(target, call.arguments(), at(trailer));
        }
        if (trailer instanceof PyKenParser.AttributeTrailerContext attribute) {
            if (!(target instanceof Expr.Name) && !(annotation && target instanceof Expr.Attribute)) {
                throw unsupported("multi-level access chain", trailer);
            }
            return new Expr.Attribute(target, attribute.NAME().getText(), target.location());
        }
        PyKenParser.SubscriptTrailerContext subscript = (PyKenParser.SubscriptTrailerContext) trailer;
        return subscript(target, subscript);
    }

    private Expr subscript(Expr target, PyKenParser.SubscriptTrailerContext ctx) {
        List<Expr> indices = new ArrayList<>();
        for (PyKenParser.SubscriptContext subscript : ctx.subscriptList().subscript()) {
            if (subscript instanceof PyKenParser.SliceSubscriptContext) {
                throw unsupported("slice", subscript);
            }
            indices.add(visit(((PyKenParser.IndexSubscriptContext) subscript).test()));
        }
        if (annotation) {
            Expr index = indices.size() == 1 && ctx.subscriptList().COMMA().isEmpty()
                    ? indices.get(0)
                    : new Expr.TupleDisplay(indices, at(ctx.subscriptList()));
            return new Expr.Subscript(target, index, target.location());
        }
        if (!(target instanceof Expr.Name)) {
            throw unsupported("multi-level access chain", ctx);
        }
        if (indices.size() != 1 || !(indices.get(0) instanceof Expr.IntLiteral)) {
            throw unsupported("subscript with a non-literal index", ctx);
        }
        return new Expr.Subscript(target, indices.get(0), target.location());
    }

    private Expr call(Expr function, PyKenParser.ArgumentsContext arguments, SourceLocation location) {
        if (function instanceof Expr.Name name && name.id().equals("isinstance")) {
            // declared classes are single-constructor types in Aiken; there is nothing to test
            throw new UnsupportedConstructException("isinstance check", location);
        }
        List<Expr> positional = new ArrayList<>();
        List<Expr.Keyword> keywords = new ArrayList<>();
        if (arguments != null) {
            for (PyKenParser.ArgumentContext argument : arguments.argument()) {
                if (argument instanceof PyKenParser.PositionalArgumentContext p) {
                    if (p.compFor() != null) {
                        throw unsupported("generator expression", p);
                    }
                    positional.add(visit(p.test()));
                } else if (argument instanceof PyKenParser.KeywordArgumentContext k) {
                    keywords.add(new Expr.Keyword(k.NAME().getText(), visit(k.test())));
                } else if (argument instanceof PyKenParser.KwargsArgumentContext) {
                    throw unsupported("keyword argument unpacking", argument);
                } else {
                    throw unsupported("argument unpacking", argument);
                }
            }
        }
        return new Expr.Call(function, positional, keywords, function.location());
    }

    // ── Atoms ──

    @Override
    public Expr visitParenAtom(PyKenParser.ParenAtomContext ctx) {
        PyKenParser.TestListCompContext contents = ctx.testListComp();
        if (contents == null) {
            return new Expr.TupleDisplay(List.of(), at(ctx));
        }
        if (contents.compFor() != null) {
            throw unsupported("generator expression", ctx);
        }
        if (contents.test().size() == 1 && contents.COMMA().isEmpty()) {
            return visit(contents.test(0));
        }
        return new Expr.TupleDisplay(visitAll(contents.test()), at(ctx));
    }

    @Override
    public Expr visitListAtom(PyKenParser.ListAtomContext ctx) {
        PyKenParser.TestListCompContext contents = ctx.testListComp();
        if (contents == null) {
            return new Expr.ListDisplay(List.of(), at(ctx));
        }
        if (contents.compFor() != null) {
            throw unsupported("list comprehension", ctx);
        }
        return new Expr.ListDisplay(visitAll(contents.test()), at(ctx));
    }

    @Override
    public Expr visitDictAtom(PyKenParser.DictAtomContext ctx) {
        throw unsupported("dict or set display", ctx);
    }

    @Override
    public Expr visitNameAtom(PyKenParser.NameAtomContext ctx) {
        return new Expr.Name(ctx.NAME().getText(), at(ctx));
    }

    @Override
    public Expr visitNumberAtom(PyKenParser.NumberAtomContext ctx) {
        if (ctx.FLOAT_NUMBER() != null) {
            throw unsupported("float literal", ctx);
        }
        return new Expr.IntLiteral(parseInteger(ctx.INTEGER().getText()), at(ctx));
    }

    @Override
    public Expr visitStringAtom(PyKenParser.StringAtomContext ctx) {
        StringBuilder value = new StringBuilder();
        Boolean bytes = null;
        for (TerminalNode token : ctx.STRING()) {
            StringLiterals.Decoded decoded = StringLiterals.decode(token.getText());
            if (decoded.formatted()) {
                throw unsupported("f-string", ctx);
            }
            if (bytes != null && bytes != decoded.bytes()) {
                throw unsupported("concatenation of str and bytes literals", ctx);
            }
            bytes = decoded.bytes();
            value.append(decoded.value());
        }
        if (Boolean.TRUE.equals(bytes)) {
            return new Expr.BytesLiteral(value.toString(), at(ctx));
        }
        return new Expr.StringLiteral(value.toString(), at(ctx));
    }

    @Override
    public Expr visitEllipsisAtom(PyKenParser.EllipsisAtomContext ctx) {
        throw unsupported("ellipsis", ctx);
    }

    @Override
    public Expr visitNoneAtom(PyKenParser.NoneAtomContext ctx) {
        return new Expr.NoneLiteral(at(ctx));
    }

    @Override
    public Expr visitBooleanAtom(PyKenParser.BooleanAtomContext ctx) {
        return new Expr.BoolLiteral(ctx.TRUE() != null, at(ctx));
    }

    // ── Helpers ──

    private List<Expr> visitAll(List<? extends ParserRuleContext> contexts) {
        List<Expr> result = new ArrayList<>(contexts.size());
        for (ParserRuleContext context : contexts) {
            result.add(visit(context));
        }
        return result;
    }

    static BigInteger parseInteger(String text) {
        String digits = text.replace("_", "").toLowerCase();
        if (digits.startsWith("0x")) {
            return new BigInteger(digits.substring(2), 16);
        }
        if (digits.startsWith("0o")) {
            return new BigInteger(digits.substring(2), 8);
        }
        if (digits.startsWith("0b")) {
            return new BigInteger(digits.substring(2), 2);
        }
        return new BigInteger(digits);
    }

    static SourceLocation at(ParserRuleContext ctx) {
        return at(ctx.getStart());
    }

    static SourceLocation at(Token token) {
        return new SourceLocation(token.getLine(), token.getCharPositionInLine() + 1);
    }

    static UnsupportedConstructException unsupported(String description, ParserRuleContext ctx) {
        return new UnsupportedConstructException(description, at(ctx));
    }
}
