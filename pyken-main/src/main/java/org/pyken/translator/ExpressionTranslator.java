package org.pyken.translator;

import org.pyken.TranslationException;
import org.pyken.diagnostic.DiagnosticKind;
import org.pyken.diagnostic.DiagnosticSink;
import org.pyken.diagnostic.SourceLocation;
import org.pyken.ir.BinaryOp;
import org.pyken.ir.Call;
import org.pyken.ir.Conditional;
import org.pyken.ir.FieldAccess;
import org.pyken.ir.IrNode;
import org.pyken.ir.ListLiteral;
import org.pyken.ir.Literal;
import org.pyken.ir.NameRef;
import org.pyken.ir.TupleLiteral;
import org.pyken.ir.UnaryOp;
import org.pyken.parser.ImportDecl;
import org.pyken.parser.SourceModule;
import org.pyken.parser.ast.Expr;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Translates side-effect free Python expressions to IR and infers their coarse type.
 * <p>
 * Aiken modules the translated code relies on (for {@code list.has} and
 * {@code list.length}) are added to the {@code modules} set given at construction.
 */
public final class ExpressionTranslator {

    private static final String[] ORDINAL_SUFFIXES = {"th", "st", "nd", "rd", "th", "th", "th", "th", "th", "th"};

    private final SourceModule module;
    private final Set<String> modules;
    private final DiagnosticSink sink;
    private final String function;

    /**
     * @param function qualified name of the function whose body is translated, for diagnostics
     */
    public ExpressionTranslator(SourceModule module, Set<String> modules, DiagnosticSink sink, String function) {
        this.module = module;
        this.modules = modules;
        this.sink = sink;
        this.function = function;
    }

    public IrNode translate(Expr expr, BindingTable scope) {
        if (expr instanceof Expr.IntLiteral literal) {
            return Literal.integer(literal.value());
        }
        if (expr instanceof Expr.StringLiteral literal) {
            return Literal.string(literal.value());
        }
        if (expr instanceof Expr.BytesLiteral literal) {
            return Literal.bytes(literal.value());
        }
        if (expr instanceof Expr.BoolLiteral literal) {
            return Literal.bool(literal.value());
        }
        if (expr instanceof Expr.NoneLiteral) {
            return Literal.NONE;
        }
        if (expr instanceof Expr.Name name) {
            return name(name.id(), scope);
        }
        if (expr instanceof Expr.Attribute attribute) {
            return attribute(attribute, scope);
        }
        if (expr instanceof Expr.Subscript subscript) {
            return index(subscript, scope);
        }
        if (expr instanceof Expr.UnaryOp unary) {
            return new UnaryOp(OperatorTable.unary(unary.operator(), unary.location()),
                               translate(unary.operand(), scope));
        }
        if (expr instanceof Expr.BinOp binary) {
            return new BinaryOp(OperatorTable.binary(binary.operator(), binary.location()),
                                translate(binary.left(), scope), translate(binary.right(), scope));
        }
        if (expr instanceof Expr.BoolOp bool) {
            String operator = OperatorTable.binary(bool.operator(), bool.location());
            IrNode result = translate(bool.values().get(0), scope);
            for (Expr value : bool.values().subList(1, bool.values().size())) {
                result = new BinaryOp(operator, result, translate(value, scope));
            }
            return result;
        }
        if (expr instanceof Expr.Compare compare) {
            return compare(compare, scope);
        }
        if (expr instanceof Expr.Call call) {
            return call(call, scope);
        }
        if (expr instanceof Expr.ListDisplay list) {
            return new ListLiteral(translateAll(list.elements(), scope));
        }
        if (expr instanceof Expr.TupleDisplay tuple) {
            return new TupleLiteral(translateAll(tuple.elements(), scope));
        }
        Expr.IfExp conditional = (Expr.IfExp) expr;
        return new Conditional(translate(conditional.test(), scope),
                               translate(conditional.body(), scope),
                               translate(conditional.orElse(), scope));
    }

    /**
     * Coarse static type of {@code expr}; {@link InferredType#UNKNOWN} when it cannot be told.
     */
    public InferredType infer(Expr expr, BindingTable scope) {
        if (expr instanceof Expr.IntLiteral) {
            return InferredType.INT;
        }
        if (expr instanceof Expr.StringLiteral) {
            return InferredType.STRING;
        }
        if (expr instanceof Expr.BytesLiteral) {
            return InferredType.BYTES;
        }
        if (expr instanceof Expr.BoolLiteral || expr instanceof Expr.Compare || expr instanceof Expr.BoolOp) {
            return InferredType.BOOL;
        }
        if (expr instanceof Expr.NoneLiteral) {
            return InferredType.OPTION;
        }
        if (expr instanceof Expr.Name name) {
            return scope.typeOrUnknown(name.id());
        }
        if (expr instanceof Expr.Attribute attribute && attribute.value() instanceof Expr.Name owner
                && module.sumType(owner.id()).map(t -> t.hasMember(attribute.attribute())).orElse(false)) {
            return InferredType.named(owner.id());
        }
        if (expr instanceof Expr.UnaryOp unary) {
            return unary.operator().equals("not") ? InferredType.BOOL : InferredType.INT;
        }
        if (expr instanceof Expr.BinOp binary) {
            return infer(binary.left(), scope).join(infer(binary.right(), scope));
        }
        if (expr instanceof Expr.Call call) {
            if (isLen(call)) {
                return InferredType.INT;
            }
            if (isFromHex(call)) {
                return InferredType.BYTES;
            }
            if (call.function() instanceof Expr.Name name && module.type(name.id()).isPresent()) {
                return InferredType.named(name.id());
            }
            return InferredType.UNKNOWN;
        }
        if (expr instanceof Expr.ListDisplay) {
            return InferredType.LIST;
        }
        if (expr instanceof Expr.TupleDisplay tuple) {
            return InferredType.tuple(tuple.elements().size());
        }
        if (expr instanceof Expr.IfExp conditional) {
            return infer(conditional.body(), scope).join(infer(conditional.orElse(), scope));
        }
        return InferredType.UNKNOWN;
    }

    private IrNode name(String id, BindingTable scope) {
        if (scope.contains(id)) {
            return NameRef.value(id);
        }
        if (module.isFunction(id) || module.isValidatorGroup(id)) {
            return NameRef.function(id);
        }
        if (module.type(id).isPresent()) {
            return NameRef.constructor(id, id);
        }
        if (Character.isUpperCase(id.charAt(0))) {
            return NameRef.constructor(id, null);
        }
        return NameRef.value(id);
    }

    private IrNode index(Expr.Subscript subscript, BindingTable scope) {
        BigInteger index = ((Expr.IntLiteral) subscript.index()).value();
        int arity = infer(subscript.value(), scope).arity();
        int position;
        try {
            position = index.intValueExact();
        } catch (ArithmeticException e) {
            throw unsupported("tuple index " + index, subscript.location());
        }
        if (arity >= 0 && position >= arity) {
            throw unsupported("tuple index " + index + " on a " + arity + "-element tuple", subscript.location());
        }
        return new FieldAccess(translate(subscript.value(), scope), ordinal(position + 1));
    }

    private TranslationException unsupported(String construct, SourceLocation location) {
        return sink.fatal(DiagnosticKind.UNSUPPORTED_CONSTRUCT, location, function, "Unsupported construct: " + construct);
    }

    private IrNode attribute(Expr.Attribute attribute, BindingTable scope) {
        Expr base = attribute.value();
        if (base instanceof Expr.Name owner && !scope.contains(owner.id())) {
            String id = owner.id();
            if (module.sumType(id).map(t -> t.hasMember(attribute.attribute())).orElse(false)) {
                return NameRef.constructor(attribute.attribute(), id);
            }
            if (module.isValidatorGroup(id)) {
                String handler = attribute.attribute().equals("else_") ? "else" : attribute.attribute();
                return new FieldAccess(NameRef.function(id), handler);
            }
            if (isModuleAlias(id)) {
                return new FieldAccess(NameRef.module(id), attribute.attribute());
            }
        }
        return new FieldAccess(translate(base, scope), attribute.attribute());
    }

    private IrNode call(Expr.Call call, BindingTable scope) {
        if (isLen(call)) {
            modules.add(OperatorTable.LIST_MODULE);
            return Call.of(new FieldAccess(NameRef.module("list"), "length"), translate(call.arguments().get(0), scope));
        }
        if (isFromHex(call)) {
            return Literal.hex(((Expr.StringLiteral) call.arguments().get(0)).value());
        }

        List<Call.Argument> arguments = new ArrayList<>();
        for (Expr argument : call.arguments()) {
            arguments.add(Call.Argument.positional(translate(argument, scope)));
        }
        for (Expr.Keyword keyword : call.keywords()) {
            arguments.add(new Call.Argument(keyword.name(), translate(keyword.value(), scope)));
        }

        if (call.function() instanceof Expr.Name name && !scope.contains(name.id())
                && Character.isUpperCase(name.id().charAt(0))) {
            String typeName = module.type(name.id()).isPresent() ? name.id() : null;
            boolean record = call.arguments().isEmpty() && !call.keywords().isEmpty();
            return new Call(NameRef.constructor(name.id(), typeName), arguments, record);
        }
        return new Call(translate(call.function(), scope), arguments, false);
    }

    private IrNode compare(Expr.Compare compare, BindingTable scope) {
        IrNode result = null;
        Expr left = compare.left();
        for (int i = 0; i < compare.operators().size(); i++) {
            Expr right = compare.comparators().get(i);
            IrNode pair = comparison(left, compare.operators().get(i), right, compare.location(), scope);
            result = result == null ? pair : new BinaryOp("&&", result, pair);
            left = right;
        }
        return result;
    }

    private IrNode comparison(Expr left, String operator, Expr right, SourceLocation location, BindingTable scope) {
        if (OperatorTable.isMembership(operator)) {
            modules.add(OperatorTable.LIST_MODULE);
            IrNode container = right instanceof Expr.TupleDisplay tuple
                    ? new ListLiteral(translateAll(tuple.elements(), scope))
                    : translate(right, scope);
            IrNode has = Call.of(new FieldAccess(NameRef.module("list"), "has"), container, translate(left, scope));
            return operator.equals("in") ? has : new UnaryOp("!", has);
        }
        return new BinaryOp(OperatorTable.binary(operator, location), translate(left, scope), translate(right, scope));
    }

    private List<IrNode> translateAll(List<Expr> exprs, BindingTable scope) {
        List<IrNode> result = new ArrayList<>(exprs.size());
        for (Expr expr : exprs) {
            result.add(translate(expr, scope));
        }
        return result;
    }

    private boolean isModuleAlias(String id) {
        for (ImportDecl decl : module.imports()) {
            if (decl.isPlain() && decl.boundName().equals(id)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isLen(Expr.Call call) {
        return call.function() instanceof Expr.Name name && name.id().equals("len")
                && call.arguments().size() == 1 && call.keywords().isEmpty();
    }

    private static boolean isFromHex(Expr.Call call) {
        return call.function() instanceof Expr.Attribute attribute
                && attribute.value() instanceof Expr.Name owner && owner.id().equals("bytes")
                && attribute.attribute().equals("fromhex")
                && call.arguments().size() == 1 && call.arguments().get(0) instanceof Expr.StringLiteral;
    }

    /** Aiken tuple accessor for a one-based position: {@code 1st}, {@code 2nd}, {@code 11th}. */
    static String ordinal(int position) {
        int lastTwo = position % 100;
        String suffix = lastTwo >= 11 && lastTwo <= 13 ? "th" : ORDINAL_SUFFIXES[position % 10];
        return position + suffix;
    }
}
