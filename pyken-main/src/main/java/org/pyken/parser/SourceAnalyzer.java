package org.pyken.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.pyken.diagnostic.SourceLocation;
import org.pyken.parser.antlr4.PyKenAntlrParser;
import org.pyken.parser.antlr4.PyKenParser;
import org.pyken.parser.ast.Expr;
import org.pyken.parser.ast.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses one Python file and extracts the functions, data types and imports
 * the rest of the pipeline works on.
 * <p>
 * Statements outside the supported subset do not stop the analysis: they are
 * recorded on the owning {@link FunctionMetadata} and every one of them is
 * reported later. Only a syntax error fails the whole file.
 */
public final class SourceAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SourceAnalyzer.class);

    /** Method names that turn a class into a validator group. */
    public static final Set<String> HANDLER_NAMES = Set.of("spend", "mint", "withdraw", "publish", "else_");

    private static final Set<String> IMPORT_ROOTS = Set.of("aiken", "cardano");

    private final ExpressionBuilder values = ExpressionBuilder.forValues();
    private final ExpressionBuilder annotations = ExpressionBuilder.forAnnotations();

    /**
     * @throws org.pyken.SourceParseException if the text is not valid Python
     */
    public SourceModule analyze(String fileName, String source) {
        PyKenParser.FileInputContext file = PyKenAntlrParser.parseFile(source, fileName);

        List<ImportDecl> imports = new ArrayList<>();
        List<TypeDecl> types = new ArrayList<>();
        List<FunctionMetadata> functions = new ArrayList<>();
        List<String> groups = new ArrayList<>();

        for (PyKenParser.StatementContext statement : file.statement()) {
            if (statement.simpleStatements() != null) {
                for (PyKenParser.SmallStatementContext small : statement.simpleStatements().smallStatement()) {
                    collectImport(small, imports);
                }
                continue;
            }
            PyKenParser.CompoundStatementContext compound = statement.compoundStatement();
            List<String> decorators = List.of();
            PyKenParser.FunctionDefinitionContext function = compound.functionDefinition();
            PyKenParser.ClassDefinitionContext classDefinition = compound.classDefinition();
            boolean async = false;
            if (compound.decorated() != null) {
                PyKenParser.DecoratedContext decorated = compound.decorated();
                decorators = decoratorNames(decorated.decorator());
                function = decorated.functionDefinition();
                classDefinition = decorated.classDefinition();
                if (decorated.asyncStatement() != null) {
                    function = decorated.asyncStatement().functionDefinition();
                    async = true;
                }
            } else if (compound.asyncStatement() != null) {
                function = compound.asyncStatement().functionDefinition();
                async = true;
            }

            if (function != null) {
                functions.add(function(function, decorators, null, async));
            } else if (classDefinition != null) {
                collectClass(classDefinition, types, functions, groups);
            } else {
                log.debug("{}: ignoring module-level statement at line {}", fileName, compound.getStart().getLine());
            }
        }

        log.debug("Analyzed {}: {} functions, {} types, {} imports",
                  fileName, functions.size(), types.size(), imports.size());
        return new SourceModule(fileName, imports, types, functions, groups);
    }

    /**
     * Parse a standalone type annotation such as {@code Optional[int]}.
     */
    public static Expr parseAnnotation(String text) {
        return ExpressionBuilder.forAnnotations().build(PyKenAntlrParser.parseExpression(text));
    }

    // ── Module level ──

    private static void collectImport(PyKenParser.SmallStatementContext small, List<ImportDecl> imports) {
        if (small instanceof PyKenParser.ImportStatementContext plain) {
            for (PyKenParser.DottedAsNameContext name : plain.importName().dottedAsName()) {
                List<String> segments = segments(name.dottedName());
                if (IMPORT_ROOTS.contains(segments.get(0))) {
                    String alias = name.NAME() != null ? name.NAME().getText() : null;
                    imports.add(new ImportDecl(String.join("/", segments), alias, List.of()));
                }
            }
        } else if (small instanceof PyKenParser.ImportFromStatementContext from) {
            PyKenParser.ImportFromContext ctx = from.importFrom();
            if (ctx.dottedName() == null || !ctx.DOT().isEmpty() || ctx.STAR() != null) {
                return;
            }
            List<String> segments = segments(ctx.dottedName());
            if (!IMPORT_ROOTS.contains(segments.get(0))) {
                return;
            }
            List<ImportDecl.ImportedName> names = new ArrayList<>();
            for (PyKenParser.ImportAsNameContext name : ctx.importAsNames().importAsName()) {
                String alias = name.NAME().size() > 1 ? name.NAME(1).getText() : null;
                names.add(new ImportDecl.ImportedName(name.NAME(0).getText(), alias));
            }
            imports.add(new ImportDecl(String.join("/", segments), null, names));
        }
    }

    private void collectClass(PyKenParser.ClassDefinitionContext ctx,
                              List<TypeDecl> types,
                              List<FunctionMetadata> functions,
                              List<String> groups) {
        String className = ctx.NAME().getText();
        List<ParserRuleContext> body = blockStatements(ctx.block());

        List<PyKenParser.FunctionDefinitionContext> methods = new ArrayList<>();
        List<List<String>> methodDecorators = new ArrayList<>();
        for (ParserRuleContext statement : body) {
            if (statement instanceof PyKenParser.CompoundStatementContext compound) {
                if (compound.functionDefinition() != null) {
                    methods.add(compound.functionDefinition());
                    methodDecorators.add(List.of());
                } else if (compound.decorated() != null && compound.decorated().functionDefinition() != null) {
                    methods.add(compound.decorated().functionDefinition());
                    methodDecorators.add(decoratorNames(compound.decorated().decorator()));
                }
            }
        }

        boolean validator = methods.stream().anyMatch(m -> HANDLER_NAMES.contains(m.NAME().getText()));
        if (validator) {
            groups.add(className);
            for (int i = 0; i < methods.size(); i++) {
                PyKenParser.FunctionDefinitionContext method = methods.get(i);
                String group = HANDLER_NAMES.contains(method.NAME().getText()) ? className : null;
                functions.add(function(method, methodDecorators.get(i), group, false));
            }
            return;
        }

        TypeDecl.SumType sumType = sumType(className, body, ctx);
        if (sumType != null) {
            types.add(sumType);
            return;
        }
        TypeDecl.RecordType record = recordType(className, body, methods, ctx);
        if (record != null) {
            types.add(record);
        } else {
            log.debug("Class {} declares no fields, skipping", className);
        }
    }

    private TypeDecl.SumType sumType(String className, List<ParserRuleContext> body, ParserRuleContext ctx) {
        List<TypeDecl.Member> members = new ArrayList<>();
        for (ParserRuleContext statement : body) {
            if (statement instanceof PyKenParser.PassStatementContext || isDocstring(statement)) {
                continue;
            }
            if (!(statement instanceof PyKenParser.AssignmentContext assignment) || assignment.testList().size() != 2) {
                return null;
            }
            try {
                Expr target = values.build(assignment.testList(0));
                Expr value = values.build(assignment.testList(1));
                if (!(target instanceof Expr.Name name) || !isLiteral(value)) {
                    return null;
                }
                members.add(new TypeDecl.Member(name.id(), value));
            } catch (UnsupportedConstructException e) {
                return null;
            }
        }
        return members.isEmpty() ? null : new TypeDecl.SumType(className, members, ExpressionBuilder.at(ctx));
    }

    private TypeDecl.RecordType recordType(String className,
                                           List<ParserRuleContext> body,
                                           List<PyKenParser.FunctionDefinitionContext> methods,
                                           ParserRuleContext ctx) {
        List<TypeDecl.Field> fields = new ArrayList<>();
        for (ParserRuleContext statement : body) {
            if (statement instanceof PyKenParser.AnnotatedAssignmentContext annotated) {
                try {
                    Expr target = values.build(annotated.testList(0));
                    if (target instanceof Expr.Name name) {
                        fields.add(new TypeDecl.Field(name.id(), annotations.build(annotated.test())));
                    }
                } catch (UnsupportedConstructException e) {
                    log.debug("Skipping field of {}: {}", className, e.getMessage());
                }
            }
        }
        if (fields.isEmpty()) {
            for (PyKenParser.FunctionDefinitionContext method : methods) {
                if (method.NAME().getText().equals("__init__") && method.parameters() != null) {
                    List<PyKenParser.ParameterContext> parameters = method.parameters().parameter();
                    for (PyKenParser.ParameterContext parameter : parameters.subList(1, parameters.size())) {
                        if (parameter instanceof PyKenParser.NamedParameterContext named) {
                            Expr type = named.COLON() != null ? annotations.build(named.test(0)) : null;
                            fields.add(new TypeDecl.Field(named.NAME().getText(), type));
                        }
                    }
                }
            }
        }
        return fields.isEmpty() ? null : new TypeDecl.RecordType(className, fields, ExpressionBuilder.at(ctx));
    }

    // ── Functions ──

    private FunctionMetadata function(PyKenParser.FunctionDefinitionContext ctx,
                                      List<String> decorators,
                                      String group,
                                      boolean async) {
        FunctionScope scope = new FunctionScope();
        SourceLocation location = ExpressionBuilder.at(ctx.DEF().getSymbol());
        if (async) {
            scope.unsupported(new UnsupportedConstruct("async function", location));
        }

        List<Parameter> parameters = new ArrayList<>();
        if (ctx.parameters() != null) {
            for (PyKenParser.ParameterContext parameter : ctx.parameters().parameter()) {
                try {
                    parameters.add(parameter(parameter));
                } catch (UnsupportedConstructException e) {
                    scope.unsupported(e.construct());
                }
            }
        }

        Expr returnType = null;
        if (ctx.test() != null) {
            try {
                returnType = annotations.build(ctx.test());
            } catch (UnsupportedConstructException e) {
                scope.unsupported(e.construct());
            }
        }

        List<Stmt> body = block(ctx.block(), scope);
        return new FunctionMetadata(ctx.NAME().getText(), parameters, decorators, body, returnType,
                                    location, group, scope.unsupported);
    }

    private Parameter parameter(PyKenParser.ParameterContext ctx) {
        if (ctx instanceof PyKenParser.NamedParameterContext named) {
            if (named.ASSIGN() != null) {
                // Aiken functions have no optional parameters
                throw ExpressionBuilder.unsupported("parameter default value", named);
            }
            Expr annotation = named.COLON() != null ? annotations.build(named.test(0)) : null;
            return new Parameter(named.NAME().getText(), annotation, ExpressionBuilder.at(named));
        }
        if (ctx instanceof PyKenParser.VarargsParameterContext) {
            throw ExpressionBuilder.unsupported("variadic parameter", ctx);
        }
        if (ctx instanceof PyKenParser.KwargsParameterContext) {
            throw ExpressionBuilder.unsupported("keyword parameter unpacking", ctx);
        }
        throw ExpressionBuilder.unsupported("parameter marker", ctx);
    }

    // ── Statements ──

    private List<Stmt> block(PyKenParser.BlockContext ctx, FunctionScope scope) {
        List<Stmt> statements = new ArrayList<>();
        if (ctx.simpleStatements() != null) {
            simpleStatements(ctx.simpleStatements(), scope, statements);
        } else {
            for (PyKenParser.StatementContext statement : ctx.statement()) {
                if (statement.simpleStatements() != null) {
                    simpleStatements(statement.simpleStatements(), scope, statements);
                } else {
                    compoundStatement(statement.compoundStatement(), scope, statements);
                }
            }
        }
        return statements;
    }

    private void simpleStatements(PyKenParser.SimpleStatementsContext ctx, FunctionScope scope, List<Stmt> out) {
        for (PyKenParser.SmallStatementContext small : ctx.smallStatement()) {
            try {
                Stmt statement = smallStatement(small);
                if (statement != null) {
                    out.add(statement);
                }
            } catch (UnsupportedConstructException e) {
                scope.unsupported(e.construct());
            }
        }
    }

    private Stmt smallStatement(PyKenParser.SmallStatementContext ctx) {
        SourceLocation location = ExpressionBuilder.at(ctx);
        if (ctx instanceof PyKenParser.ReturnStatementContext ret) {
            return new Stmt.Return(ret.testList() == null ? null : values.build(ret.testList()), location);
        }
        if (ctx instanceof PyKenParser.RaiseStatementContext raise) {
            return new Stmt.Raise(raise.test().isEmpty() ? null : values.build(raise.test(0)), location);
        }
        if (ctx instanceof PyKenParser.AssertStatementContext assertion) {
            Expr message = assertion.test().size() > 1 ? values.build(assertion.test(1)) : null;
            return new Stmt.Assert(values.build(assertion.test(0)), message, location);
        }
        if (ctx instanceof PyKenParser.PassStatementContext) {
            return new Stmt.Pass(location);
        }
        if (ctx instanceof PyKenParser.AnnotatedAssignmentContext annotated) {
            String target = assignmentTarget(annotated.testList(0));
            if (annotated.ASSIGN() == null) {
                throw ExpressionBuilder.unsupported("annotation without a value", ctx);
            }
            return new Stmt.Assign(target, annotations.build(annotated.test()),
                                   values.build(annotated.testList(1)), location);
        }
        if (ctx instanceof PyKenParser.AugmentedAssignmentContext augmented) {
            String target = assignmentTarget(augmented.testList(0));
            String operator = augmented.augAssign().getText();
            return new Stmt.AugAssign(target, operator.substring(0, operator.length() - 1),
                                      values.build(augmented.testList(1)), location);
        }
        if (ctx instanceof PyKenParser.AssignmentContext assignment) {
            if (assignment.testList().size() > 2) {
                throw ExpressionBuilder.unsupported("chained assignment", ctx);
            }
            String target = assignmentTarget(assignment.testList(0));
            return new Stmt.Assign(target, null, values.build(assignment.testList(1)), location);
        }
        if (ctx instanceof PyKenParser.ExpressionStatementContext expression) {
            Expr value = values.build(expression.testList());
            if (value instanceof Expr.StringLiteral) {
                // docstring
                return null;
            }
            if (value instanceof Expr.Call call && call.function() instanceof Expr.Name name
                    && name.id().equals("print") && call.keywords().isEmpty()) {
                return new Stmt.Print(call.arguments(), location);
            }
            throw ExpressionBuilder.unsupported("expression statement", ctx);
        }
        throw ExpressionBuilder.unsupported(describe(ctx), ctx);
    }

    private String assignmentTarget(PyKenParser.TestListContext ctx) {
        if (ctx.test().size() != 1 || !ctx.COMMA().isEmpty()) {
            throw ExpressionBuilder.unsupported("tuple assignment target", ctx);
        }
        Expr target = values.build(ctx);
        if (target instanceof Expr.Name name) {
            return name.id();
        }
        if (target instanceof Expr.Attribute) {
            throw ExpressionBuilder.unsupported("attribute assignment target", ctx);
        }
        if (target instanceof Expr.Subscript) {
            throw ExpressionBuilder.unsupported("subscript assignment target", ctx);
        }
        throw ExpressionBuilder.unsupported("assignment target", ctx);
    }

    private void compoundStatement(PyKenParser.CompoundStatementContext ctx, FunctionScope scope, List<Stmt> out) {
        if (ctx.ifStatement() != null) {
            Stmt statement = ifStatement(ctx.ifStatement(), scope);
            if (statement != null) {
                out.add(statement);
            }
            return;
        }
        scope.unsupported(new UnsupportedConstruct(describe(ctx), ExpressionBuilder.at(ctx)));
    }

    private Stmt ifStatement(PyKenParser.IfStatementContext ctx, FunctionScope scope) {
        List<Stmt> orElse = ctx.elseClause() != null ? block(ctx.elseClause().block(), scope) : List.of();
        // fold elif clauses from the innermost outwards
        List<PyKenParser.ElifClauseContext> elifs = ctx.elifClause();
        for (int i = elifs.size() - 1; i >= 0; i--) {
            PyKenParser.ElifClauseContext elif = elifs.get(i);
            Expr test = condition(elif.test(), scope);
            List<Stmt> body = block(elif.block(), scope);
            orElse = List.of(new Stmt.If(test, body, orElse, ExpressionBuilder.at(elif)));
        }
        Expr test = condition(ctx.test(), scope);
        List<Stmt> body = block(ctx.block(), scope);
        return new Stmt.If(test, body, orElse, ExpressionBuilder.at(ctx));
    }

    private Expr condition(PyKenParser.TestContext ctx, FunctionScope scope) {
        try {
            return values.build(ctx);
        } catch (UnsupportedConstructException e) {
            scope.unsupported(e.construct());
            return new Expr.BoolLiteral(false, e.construct().location());
        }
    }

    // ── Helpers ──

    private static String describe(ParserRuleContext ctx) {
        if (ctx instanceof PyKenParser.CompoundStatementContext compound) {
            if (compound.whileStatement() != null) {
                return "while loop";
            }
            if (compound.forStatement() != null) {
                return "for loop";
            }
            if (compound.tryStatement() != null) {
                return "try statement";
            }
            if (compound.withStatement() != null) {
                return "with statement";
            }
            if (compound.classDefinition() != null) {
                return "nested class definition";
            }
            if (compound.asyncStatement() != null) {
                return "async statement";
            }
            if (compound.decorated() != null && compound.decorated().classDefinition() != null) {
                return "nested class definition";
            }
            return "nested function definition";
        }
        if (ctx instanceof PyKenParser.LoopControlStatementContext loop) {
            return loop.BREAK() != null ? "break statement" : "continue statement";
        }
        if (ctx instanceof PyKenParser.DelStatementContext) {
            return "del statement";
        }
        if (ctx instanceof PyKenParser.YieldStatementContext) {
            return "yield statement";
        }
        if (ctx instanceof PyKenParser.ScopeStatementContext scope) {
            return scope.GLOBAL() != null ? "global declaration" : "nonlocal declaration";
        }
        if (ctx instanceof PyKenParser.ImportStatementContext || ctx instanceof PyKenParser.ImportFromStatementContext) {
            return "import inside a function";
        }
        return "statement";
    }

    private static List<ParserRuleContext> blockStatements(PyKenParser.BlockContext block) {
        List<ParserRuleContext> statements = new ArrayList<>();
        if (block.simpleStatements() != null) {
            statements.addAll(block.simpleStatements().smallStatement());
            return statements;
        }
        for (PyKenParser.StatementContext statement : block.statement()) {
            if (statement.simpleStatements() != null) {
                statements.addAll(statement.simpleStatements().smallStatement());
            } else {
                statements.add(statement.compoundStatement());
            }
        }
        return statements;
    }

    private static boolean isDocstring(ParserRuleContext statement) {
        return statement instanceof PyKenParser.ExpressionStatementContext expression
                && expression.testList().getText().matches("(?s)[rRuU]?(\"|').*");
    }

    private static boolean isLiteral(Expr value) {
        return value instanceof Expr.StringLiteral
                || value instanceof Expr.IntLiteral
                || value instanceof Expr.BytesLiteral
                || value instanceof Expr.BoolLiteral;
    }

    private static List<String> decoratorNames(List<PyKenParser.DecoratorContext> decorators) {
        List<String> names = new ArrayList<>();
        for (PyKenParser.DecoratorContext decorator : decorators) {
            names.add(String.join(".", segments(decorator.dottedName())));
        }
        return names;
    }

    private static List<String> segments(PyKenParser.DottedNameContext ctx) {
        List<String> segments = new ArrayList<>();
        ctx.NAME().forEach(name -> segments.add(name.getText()));
        return segments;
    }

    private static final class FunctionScope {

        private final List<UnsupportedConstruct> unsupported = new ArrayList<>();

        void unsupported(UnsupportedConstruct construct) {
            unsupported.add(construct);
        }
    }
}
