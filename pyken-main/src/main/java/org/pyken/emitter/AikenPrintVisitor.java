package org.pyken.emitter;

import org.pyken.ir.BinaryOp;
import org.pyken.ir.Call;
import org.pyken.ir.Conditional;
import org.pyken.ir.Fail;
import org.pyken.ir.FieldAccess;
import org.pyken.ir.Guard;
import org.pyken.ir.IrNode;
import org.pyken.ir.IrVisitor;
import org.pyken.ir.Lambda;
import org.pyken.ir.Let;
import org.pyken.ir.ListLiteral;
import org.pyken.ir.Literal;
import org.pyken.ir.Match;
import org.pyken.ir.NameRef;
import org.pyken.ir.TailValue;
import org.pyken.ir.Trace;
import org.pyken.ir.TupleLiteral;
import org.pyken.ir.UnaryOp;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Prints IR as Aiken source.
 * <p>
 * Sequencing nodes ({@link Let}, {@link Guard}, {@link Trace}, {@link TailValue},
 * {@link Fail}, {@link Match}) print whole lines. Everything else prints inline
 * at the current position; a {@link Lambda} starts inline and ends on its own line.
 */
public class AikenPrintVisitor implements IrVisitor<Void, Void> {

    private static final Map<String, Integer> PRECEDENCE = Map.ofEntries(
            Map.entry("||", 1),
            Map.entry("&&", 2),
            Map.entry("==", 4),
            Map.entry("!=", 4),
            Map.entry("<", 4),
            Map.entry("<=", 4),
            Map.entry(">", 4),
            Map.entry(">=", 4),
            Map.entry("+", 6),
            Map.entry("-", 6),
            Map.entry("*", 7),
            Map.entry("/", 7),
            Map.entry("%", 7));

    private static final int COMPARISON = 4;

    protected final SourceWriter printer;
    private final IdentifierSanitizer functions;
    private final IdentifierSanitizer locals;

    /**
     * @param functions names of top-level functions and validators
     * @param locals    names of the parameters and bindings of the function being printed
     */
    public AikenPrintVisitor(SourceWriter printer, IdentifierSanitizer functions, IdentifierSanitizer locals) {
        this.printer = printer;
        this.functions = functions;
        this.locals = locals;
    }

    /**
     * Print a function body: one or more full lines.
     */
    public void printBody(IrNode body) {
        if (isBlock(body)) {
            body.accept(this, null);
        } else {
            body.accept(this, null);
            printer.println();
        }
    }

    // ── Sequencing ──

    @Override
    public Void visit(Let n, Void arg) {
        printer.print("let ").print(locals.name(n.name()));
        if (n.type() != null) {
            printer.print(": ").print(n.type());
        }
        printer.print(" = ");
        n.value().accept(this, arg);
        printer.println();
        printBody(n.body());
        return null;
    }

    @Override
    public Void visit(Guard n, Void arg) {
        printer.print("expect ");
        if (n.message() != null) {
            operand(n.condition(), PRECEDENCE.get("||"), false);
            printer.print(" || fail ");
            n.message().accept(this, arg);
        } else {
            n.condition().accept(this, arg);
        }
        printer.println();
        printBody(n.continuation());
        return null;
    }

    @Override
    public Void visit(Trace n, Void arg) {
        printer.print("trace ");
        n.label().accept(this, arg);
        if (!n.arguments().isEmpty()) {
            printer.print(": ");
            list(n.arguments());
        }
        printer.println();
        printBody(n.continuation());
        return null;
    }

    @Override
    public Void visit(TailValue n, Void arg) {
        n.value().accept(this, arg);
        printer.println();
        return null;
    }

    @Override
    public Void visit(Fail n, Void arg) {
        printer.print("fail");
        if (n.message() != null) {
            printer.print(" ");
            n.message().accept(this, arg);
        }
        printer.println();
        return null;
    }

    @Override
    public Void visit(Match n, Void arg) {
        printer.print("when ");
        n.subject().accept(this, arg);
        printer.println(" is {");
        printer.indent();
        for (Match.Arm arm : n.arms()) {
            if (arm.isWildcard()) {
                printer.print("_");
            } else {
                Iterator<IrNode> patterns = arm.patterns().iterator();
                while (patterns.hasNext()) {
                    patterns.next().accept(this, arg);
                    if (patterns.hasNext()) {
                        printer.print(" | ");
                    }
                }
            }
            printer.println(" -> {");
            printer.indent();
            printBody(arm.body());
            printer.unindent();
            printer.println("}");
        }
        printer.unindent();
        printer.println("}");
        return null;
    }

    @Override
    public Void visit(Conditional n, Void arg) {
        if (!isBlock(n)) {
            printer.print("if ");
            n.condition().accept(this, arg);
            printer.print(" { ");
            n.then().accept(this, arg);
            printer.print(" } else { ");
            n.otherwise().accept(this, arg);
            printer.print(" }");
            return null;
        }
        printer.print("if ");
        n.condition().accept(this, arg);
        printer.println(" {");
        printer.indent();
        printBody(n.then());
        printer.unindent();
        if (n.otherwise() instanceof Conditional elseIf && isBlock(elseIf)) {
            printer.print("} else ");
            elseIf.accept(this, arg);
            return null;
        }
        printer.println("} else {");
        printer.indent();
        printBody(n.otherwise());
        printer.unindent();
        printer.println("}");
        return null;
    }

    @Override
    public Void visit(Lambda n, Void arg) {
        printer.print("fn(");
        Iterator<String> it = n.parameters().iterator();
        while (it.hasNext()) {
            printer.print(locals.name(it.next()));
            if (it.hasNext()) {
                printer.print(", ");
            }
        }
        printer.println(") {");
        printer.indent();
        printBody(n.body());
        printer.unindent();
        printer.print("}");
        return null;
    }

    // ── Expressions ──

    @Override
    public Void visit(Literal n, Void arg) {
        switch (n.kind()) {
            case STRING:
                printer.print("@\"").print(escape(n.value())).print("\"");
                break;
            case BYTES:
                if (isPrintableAscii(n.value())) {
                    printer.print("\"").print(escape(n.value())).print("\"");
                } else {
                    printer.print("#\"").print(toHex(n.value())).print("\"");
                }
                break;
            case HEX:
                printer.print("#\"").print(n.value().toLowerCase()).print("\"");
                break;
            default:
                printer.print(n.value());
        }
        return null;
    }

    @Override
    public Void visit(NameRef n, Void arg) {
        switch (n.kind()) {
            case VALUE:
                printer.print(locals.name(n.name()));
                break;
            case FUNCTION:
                printer.print(functions.name(n.name()));
                break;
            default:
                printer.print(n.name());
        }
        return null;
    }

    @Override
    public Void visit(BinaryOp n, Void arg) {
        int precedence = PRECEDENCE.getOrDefault(n.operator(), 4);
        operand(n.left(), precedence, false);
        printer.print(" ").print(n.operator()).print(" ");
        operand(n.right(), precedence, true);
        return null;
    }

    @Override
    public Void visit(UnaryOp n, Void arg) {
        printer.print(n.operator());
        boolean parens = n.operand() instanceof BinaryOp || n.operand() instanceof Conditional;
        if (parens) {
            printer.print("(");
        }
        n.operand().accept(this, arg);
        if (parens) {
            printer.print(")");
        }
        return null;
    }

    @Override
    public Void visit(Call n, Void arg) {
        n.callee().accept(this, arg);
        if (n.record()) {
            printer.print(" { ");
            arguments(n.arguments());
            printer.print(" }");
            return null;
        }
        if (n.arguments().isEmpty() && n.callee() instanceof NameRef ref && ref.kind() == NameRef.Kind.CONSTRUCTOR) {
            return null;
        }
        printer.print("(");
        arguments(n.arguments());
        printer.print(")");
        return null;
    }

    @Override
    public Void visit(FieldAccess n, Void arg) {
        boolean parens = n.target() instanceof BinaryOp || n.target() instanceof UnaryOp
                || n.target() instanceof Conditional;
        if (parens) {
            printer.print("(");
        }
        n.target().accept(this, arg);
        if (parens) {
            printer.print(")");
        }
        printer.print(".").print(IdentifierSanitizer.field(n.field()));
        return null;
    }

    @Override
    public Void visit(ListLiteral n, Void arg) {
        printer.print("[");
        list(n.elements());
        printer.print("]");
        return null;
    }

    @Override
    public Void visit(TupleLiteral n, Void arg) {
        printer.print("(");
        list(n.elements());
        printer.print(")");
        return null;
    }

    private void operand(IrNode operand, int parent, boolean right) {
        boolean parens = false;
        if (operand instanceof BinaryOp child) {
            int precedence = PRECEDENCE.getOrDefault(child.operator(), 4);
            // comparisons do not chain in Aiken
            parens = precedence < parent || (right && precedence == parent)
                    || (precedence == COMPARISON && parent == COMPARISON);
        } else if (operand instanceof Conditional) {
            parens = true;
        }
        if (parens) {
            printer.print("(");
        }
        operand.accept(this, null);
        if (parens) {
            printer.print(")");
        }
    }

    private void arguments(List<Call.Argument> arguments) {
        Iterator<Call.Argument> it = arguments.iterator();
        while (it.hasNext()) {
            Call.Argument argument = it.next();
            if (argument.label() != null) {
                printer.print(IdentifierSanitizer.field(argument.label())).print(": ");
            }
            argument.value().accept(this, null);
            if (it.hasNext()) {
                printer.print(", ");
            }
        }
    }

    private void list(List<IrNode> nodes) {
        Iterator<IrNode> it = nodes.iterator();
        while (it.hasNext()) {
            it.next().accept(this, null);
            if (it.hasNext()) {
                printer.print(", ");
            }
        }
    }

    /** Whether {@code node} prints as whole lines. */
    static boolean isBlock(IrNode node) {
        if (node instanceof Let || node instanceof Guard || node instanceof Trace || node instanceof TailValue
                || node instanceof Fail || node instanceof Match) {
            return true;
        }
        return node instanceof Conditional conditional && (isBlock(conditional.then()) || isBlock(conditional.otherwise()));
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean isPrintableAscii(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if ((c < 0x20 || c > 0x7e) && c != '\n' && c != '\t' && c != '\r') {
                return false;
            }
        }
        return true;
    }

    private static String toHex(String value) {
        StringBuilder sb = new StringBuilder(value.length() * 2);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c <= 0xff) {
                sb.append(String.format("%02x", (int) c));
            } else {
                for (byte b : String.valueOf(c).getBytes(StandardCharsets.UTF_8)) {
                    sb.append(String.format("%02x", b & 0xff));
                }
            }
        }
        return sb.toString();
    }
}
