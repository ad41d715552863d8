package org.pyken.translator;

import org.pyken.TranslationException;
import org.pyken.UnsupportedOperatorException;
import org.pyken.diagnostic.DiagnosticKind;
import org.pyken.diagnostic.DiagnosticSink;
import org.pyken.diagnostic.SourceLocation;
import org.pyken.ir.Call;
import org.pyken.ir.Fail;
import org.pyken.ir.Guard;
import org.pyken.ir.IrNode;
import org.pyken.ir.Lambda;
import org.pyken.ir.Let;
import org.pyken.ir.Literal;
import org.pyken.ir.Match;
import org.pyken.ir.NameRef;
import org.pyken.ir.TailValue;
import org.pyken.ir.Trace;
import org.pyken.ir.Conditional;
import org.pyken.model.FunctionRole;
import org.pyken.model.FunctionSpec;
import org.pyken.model.MappedParameter;
import org.pyken.model.TranslationUnit;
import org.pyken.model.TypeImport;
import org.pyken.model.TypeMapping;
import org.pyken.parser.FunctionMetadata;
import org.pyken.parser.SourceModule;
import org.pyken.parser.ast.Expr;
import org.pyken.parser.ast.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Rewrites an imperative function body into a single IR expression.
 * <p>
 * Statements are translated front to back. Each statement receives the rest of
 * its list plus a chain of continuations: what runs after the enclosing
 * {@code if} when a branch falls through. A branch that falls through has that
 * continuation appended, so every path ends in a value or a failure.
 * <p>
 * Straight-line code after an {@code if} is copied into each branch that falls
 * through. When more branching follows, the rest of the body is bound once as a
 * local function instead and every such branch ends with a call to it, which
 * keeps the output linear in the number of {@code if} statements.
 */
public final class StatementTranslator {

    private static final Logger log = LoggerFactory.getLogger(StatementTranslator.class);

    /**
     * Statements that run once a branch list is exhausted: {@code statements}
     * from {@code index} on, then {@code parent}. {@code owner} is the {@code if}
     * whose branches flow into it. A continuation with an {@code exit} ends
     * there instead of in {@code parent}.
     */
    private record Continuation(List<Stmt> statements, int index, Continuation parent, Stmt.If owner, IrNode exit) {

        Continuation(List<Stmt> statements, int index, Continuation parent, Stmt.If owner) {
            this(statements, index, parent, owner, null);
        }

        static Continuation exit(Stmt.If owner, IrNode exit) {
            return new Continuation(List.of(), 0, null, owner, exit);
        }

        /** Whether an {@code if} statement remains to be translated before the end or an exit. */
        boolean hasBranches() {
            for (Continuation c = this; c != null && c.exit() == null; c = c.parent()) {
                for (int i = c.index(); i < c.statements().size(); i++) {
                    if (c.statements().get(i) instanceof Stmt.If) {
                        return true;
                    }
                }
            }
            return false;
        }
    }

    private final SourceModule module;
    private final TypeMapping types;
    private final TagDispatch dispatch;
    private final DiagnosticSink sink;

    public StatementTranslator(SourceModule module, TypeMapping types, DiagnosticSink sink) {
        this.module = module;
        this.types = types;
        this.dispatch = new TagDispatch(module);
        this.sink = sink;
    }

    /**
     * @throws TranslationException when the body cannot be expressed; the diagnostic names the function
     */
    public TranslatedFunction translate(TranslationUnit unit) {
        FunctionMetadata function = unit.function();
        Set<String> modules = new TreeSet<>();
        Set<TypeImport> imports = new TreeSet<>();
        Body body = new Body(unit, new ExpressionTranslator(module, modules, sink, function.qualifiedName()), imports);

        BindingTable scope = BindingTable.empty();
        for (MappedParameter parameter : unit.parameters()) {
            InferredType type = parameter.type() == null ? InferredType.UNKNOWN : InferredType.named(parameter.type());
            scope = scope.parameter(parameter.name(), type);
        }

        IrNode ir;
        try {
            ir = body.sequence(function.body(), 0, null, scope);
        } catch (UnsupportedOperatorException e) {
            throw sink.fatal(DiagnosticKind.UNSUPPORTED_OPERATOR, new SourceLocation(e.getLine(), e.getColumn()),
                             function.qualifiedName(), e.getMessage());
        }
        log.debug("Translated {} ({} bindings in scope)", function.qualifiedName(), scope.size());
        return new TranslatedFunction(unit.withBody(ir), modules, imports);
    }

    /** Translation state of one function body. */
    private final class Body {

        private final TranslationUnit unit;
        private final FunctionMetadata function;
        private final ExpressionTranslator expressions;
        private final Set<TypeImport> imports;

        Body(TranslationUnit unit, ExpressionTranslator expressions, Set<TypeImport> imports) {
            this.unit = unit;
            this.function = unit.function();
            this.expressions = expressions;
            this.imports = imports;
        }

        IrNode sequence(List<Stmt> statements, int index, Continuation next, BindingTable scope) {
            if (index >= statements.size()) {
                return fallThrough(next, null, scope);
            }
            Stmt statement = statements.get(index);

            if (statement instanceof Stmt.Assign assign) {
                String annotation = null;
                InferredType type;
                if (assign.annotation() != null) {
                    TypeMapping.ResolvedType resolved = types.resolve(assign.annotation());
                    for (String unknown : resolved.unknown()) {
                        sink.report(DiagnosticKind.UNKNOWN_TYPE, assign.location(), function.qualifiedName(),
                                    "Unknown type '" + unknown + "' for local '" + assign.target()
                                    + "'; using " + TypeMapping.PLACEHOLDER);
                    }
                    imports.addAll(resolved.imports());
                    annotation = resolved.text();
                    type = InferredType.named(annotation);
                } else {
                    type = expressions.infer(assign.value(), scope);
                }
                IrNode value = expressions.translate(assign.value(), scope);
                BindingTable inner = rebind(scope, assign.target(), type, assign.location());
                return new Let(assign.target(), annotation, value, sequence(statements, index + 1, next, inner));
            }

            if (statement instanceof Stmt.AugAssign augmented) {
                Expr.BinOp combined = new Expr.BinOp(augmented.operator(),
                                                     new Expr.Name(augmented.target(), augmented.location()),
                                                     augmented.value(), augmented.location());
                InferredType type = expressions.infer(combined, scope);
                IrNode value = expressions.translate(combined, scope);
                BindingTable inner = rebind(scope, augmented.target(), type, augmented.location());
                return new Let(augmented.target(), null, value, sequence(statements, index + 1, next, inner));
            }

            if (statement instanceof Stmt.Return ret) {
                warnUnreachable(statements, index, "return");
                IrNode value = ret.value() == null ? Literal.VOID : expressions.translate(ret.value(), scope);
                return new TailValue(value);
            }

            if (statement instanceof Stmt.Raise raise) {
                warnUnreachable(statements, index, "raise");
                return new Fail(failureMessage(raise.exception()));
            }

            if (statement instanceof Stmt.Assert assertion) {
                IrNode condition = expressions.translate(assertion.test(), scope);
                IrNode message = assertion.message() == null ? null : expressions.translate(assertion.message(), scope);
                return new Guard(condition, message, sequence(statements, index + 1, next, scope));
            }

            if (statement instanceof Stmt.Print print) {
                List<Expr> arguments = print.arguments();
                IrNode label = Literal.string("print");
                if (!arguments.isEmpty() && arguments.get(0) instanceof Expr.StringLiteral first) {
                    label = Literal.string(first.value());
                    arguments = arguments.subList(1, arguments.size());
                }
                List<IrNode> values = new ArrayList<>();
                for (Expr argument : arguments) {
                    values.add(expressions.translate(argument, scope));
                }
                return new Trace(label, values, sequence(statements, index + 1, next, scope));
            }

            if (statement instanceof Stmt.If branch) {
                int exits = exits(branch, scope);
                if (exits == 0) {
                    warnUnreachable(statements, index, "an if statement whose branches all exit");
                }
                Continuation after = new Continuation(statements, index + 1, next, branch);
                if (exits > 1 && after.hasBranches()) {
                    return joined(branch, after, scope);
                }
                return branches(branch, after, scope);
            }

            // pass
            return sequence(statements, index + 1, next, scope);
        }

        private IrNode branches(Stmt.If branch, Continuation after, BindingTable scope) {
            Optional<TagDispatch.Plan> plan = dispatch.analyze(branch, scope);
            if (plan.isPresent()) {
                return match(plan.get(), after, scope);
            }
            return new Conditional(expressions.translate(branch.test(), scope),
                                   sequence(branch.body(), 0, after, scope),
                                   sequence(branch.orElse(), 0, after, scope));
        }

        /**
         * Translate what follows {@code branch} once, as a local function of the
         * names the branches may change, and end every falling-through branch
         * with a call to it.
         */
        private IrNode joined(Stmt.If branch, Continuation after, BindingTable scope) {
            Set<String> assigned = new LinkedHashSet<>();
            assignments(List.of(branch), assigned);
            Set<String> definite = definiteAssignments(branch);
            List<String> carried = new ArrayList<>();
            BindingTable joinedScope = scope;
            for (String name : assigned) {
                if (scope.contains(name)) {
                    carried.add(name);
                } else if (definite != null && definite.contains(name)) {
                    carried.add(name);
                    joinedScope = joinedScope.bind(name, InferredType.UNKNOWN);
                }
            }

            String join = NameRef.SYNTHETIC_PREFIX + "after_" + branch.location().line();
            List<IrNode> arguments = new ArrayList<>(carried.size());
            for (String name : carried) {
                arguments.add(NameRef.value(name));
            }
            IrNode call = new TailValue(Call.of(NameRef.value(join), arguments.toArray(new IrNode[0])));

            IrNode dispatched = branches(branch, Continuation.exit(branch, call), scope);
            IrNode rest = fallThrough(after, null, joinedScope);
            log.trace("Joined the branches of the if at line {} over {}", branch.location().line(), carried);
            return new Let(join, null, new Lambda(carried, rest), dispatched);
        }

        private IrNode match(TagDispatch.Plan plan, Continuation after, BindingTable scope) {
            List<Match.Arm> arms = new ArrayList<>();
            for (TagDispatch.Arm arm : plan.arms()) {
                List<IrNode> patterns = new ArrayList<>();
                for (TagDispatch.Tag tag : arm.tags()) {
                    patterns.add(tag.isConstructor()
                                         ? NameRef.constructor(tag.member(), tag.typeName())
                                         : Literal.integer(tag.value()));
                }
                arms.add(new Match.Arm(patterns, sequence(arm.body(), 0, after, scope)));
            }
            if (plan.hasWildcard()) {
                arms.add(Match.Arm.wildcard(sequence(plan.wildcard(), 0, after, scope)));
            }
            return new Match(NameRef.value(plan.subject()), arms);
        }

        /**
         * Continue with whatever follows an exhausted statement list. {@code owner}
         * is the innermost {@code if} the path fell out of without more statements.
         */
        private IrNode fallThrough(Continuation next, Stmt.If owner, BindingTable scope) {
            if (next == null) {
                return endOfBody(owner);
            }
            if (next.index() < next.statements().size()) {
                return sequence(next.statements(), next.index(), next.parent(), scope);
            }
            if (next.exit() != null) {
                return next.exit();
            }
            return fallThrough(next.parent(), owner != null ? owner : next.owner(), scope);
        }

        private IrNode endOfBody(Stmt.If owner) {
            if (function.returnsNone()) {
                return new TailValue(Literal.VOID);
            }
            if (unit instanceof FunctionSpec spec && spec.role() == FunctionRole.TEST) {
                return new TailValue(Literal.TRUE);
            }
            if (owner != null) {
                throw sink.fatal(DiagnosticKind.NON_EXHAUSTIVE_BRANCHES, owner.location(), function.qualifiedName(),
                                 "Not every branch of this if statement produces a value in '"
                                 + function.qualifiedName() + "'");
            }
            throw sink.fatal(DiagnosticKind.NON_EXHAUSTIVE_BRANCHES, function.location(), function.qualifiedName(),
                             "Function '" + function.qualifiedName() + "' can finish without returning a value");
        }

        private BindingTable rebind(BindingTable scope, String name, InferredType type, SourceLocation location) {
            if (!scope.contains(name)) {
                return scope.bind(name, type);
            }
            InferredType previous = scope.typeOrUnknown(name);
            if (!previous.isCompatibleWith(type)) {
                throw sink.fatal(DiagnosticKind.REASSIGNMENT_TYPE_CONFLICT, location, function.qualifiedName(),
                                 "'" + name + "' holds " + previous + " and cannot be rebound to " + type);
            }
            return scope.bind(name, type.isKnown() ? type : previous);
        }

        private void warnUnreachable(List<Stmt> statements, int index, String after) {
            if (index + 1 < statements.size()) {
                sink.report(DiagnosticKind.UNREACHABLE_CODE, statements.get(index + 1).location(),
                            function.qualifiedName(), "Unreachable code after " + after);
            }
        }

        private IrNode failureMessage(Expr exception) {
            if (exception instanceof Expr.StringLiteral literal) {
                return Literal.string(literal.value());
            }
            if (exception instanceof Expr.Call call && call.arguments().size() == 1
                    && call.arguments().get(0) instanceof Expr.StringLiteral literal) {
                return Literal.string(literal.value());
            }
            return null;
        }

        /**
         * How many paths through {@code statements} reach its end: zero or one,
         * since an inner {@code if} with several such paths either copies only
         * straight-line code or is joined.
         */
        private int exits(List<Stmt> statements, BindingTable scope) {
            for (Stmt statement : statements) {
                if (statement instanceof Stmt.Return || statement instanceof Stmt.Raise) {
                    return 0;
                }
                if (statement instanceof Stmt.If branch && exits(branch, scope) == 0) {
                    return 0;
                }
            }
            return 1;
        }

        /** How many branches of {@code branch} fall through to the statement after it. */
        private int exits(Stmt.If branch, BindingTable scope) {
            Optional<TagDispatch.Plan> plan = dispatch.analyze(branch, scope);
            if (plan.isPresent()) {
                int exits = plan.get().hasWildcard() ? exits(plan.get().wildcard(), scope) : 0;
                for (TagDispatch.Arm arm : plan.get().arms()) {
                    exits += exits(arm.body(), scope);
                }
                return exits;
            }
            return exits(branch.body(), scope) + exits(branch.orElse(), scope);
        }

        /** Targets of every assignment in {@code statements}, nested branches included. */
        private void assignments(List<Stmt> statements, Set<String> into) {
            for (Stmt statement : statements) {
                if (statement instanceof Stmt.Assign assign) {
                    into.add(assign.target());
                } else if (statement instanceof Stmt.AugAssign augmented) {
                    into.add(augmented.target());
                } else if (statement instanceof Stmt.If branch) {
                    assignments(branch.body(), into);
                    assignments(branch.orElse(), into);
                }
            }
        }

        /**
         * Names assigned on every path that reaches the end of {@code statements},
         * or {@code null} when no path does.
         */
        private Set<String> definiteAssignments(List<Stmt> statements) {
            Set<String> names = new LinkedHashSet<>();
            for (Stmt statement : statements) {
                if (statement instanceof Stmt.Return || statement instanceof Stmt.Raise) {
                    return null;
                }
                if (statement instanceof Stmt.Assign assign) {
                    names.add(assign.target());
                } else if (statement instanceof Stmt.AugAssign augmented) {
                    names.add(augmented.target());
                } else if (statement instanceof Stmt.If branch) {
                    Set<String> inner = definiteAssignments(branch);
                    if (inner == null) {
                        return null;
                    }
                    names.addAll(inner);
                }
            }
            return names;
        }

        private Set<String> definiteAssignments(Stmt.If branch) {
            Set<String> body = definiteAssignments(branch.body());
            Set<String> orElse = definiteAssignments(branch.orElse());
            if (body == null) {
                return orElse;
            }
            if (orElse != null) {
                body.retainAll(orElse);
            }
            return body;
        }
    }
}
