package org.pyken.parser;

import org.junit.jupiter.api.Test;
import org.pyken.parser.ast.Expr;
import org.pyken.parser.ast.Stmt;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SourceAnalyzerTest {

    private static SourceModule analyze(String source) {
        return new SourceAnalyzer().analyze("test.py", source);
    }

    // ── Imports ──────────────────────────────────────────────────────────

    @Test
    void keepsOnlyAikenAndCardanoImports() {
        SourceModule module = analyze("""
                import os
                import aiken.collection.list as lst
                from typing import Optional
                from cardano.script_context import ScriptContext, Transaction as Tx
                """);

        assertThat(module.imports()).hasSize(2);
        ImportDecl plain = module.imports().get(0);
        assertThat(plain.module()).isEqualTo("aiken/collection/list");
        assertThat(plain.isPlain()).isTrue();
        assertThat(plain.boundName()).isEqualTo("lst");

        ImportDecl from = module.imports().get(1);
        assertThat(from.module()).isEqualTo("cardano/script_context");
        assertThat(from.names()).extracting(ImportDecl.ImportedName::boundName)
                                .containsExactly("ScriptContext", "Tx");
    }

    // ── Functions ────────────────────────────────────────────────────────

    @Test
    void functionMetadata_keepsParameterOrderAndDecorators() {
        SourceModule module = analyze("""
                @spend
                def lock(datum, redeemer: int, context) -> bool:
                    \"\"\"Always succeeds.\"\"\"
                    return True
                """);

        FunctionMetadata lock = module.functions().get(0);
        assertThat(lock.name()).isEqualTo("lock");
        assertThat(lock.decorators()).containsExactly("spend");
        assertThat(lock.parameters()).extracting(Parameter::name).containsExactly("datum", "redeemer", "context");
        assertThat(lock.parameters().get(0).annotation()).isNull();
        assertThat(lock.parameters().get(1).annotation()).isInstanceOfSatisfying(Expr.Name.class,
                name -> assertThat(name.id()).isEqualTo("int"));
        assertThat(lock.location().line()).isEqualTo(2);
        assertThat(lock.group()).isNull();
        assertThat(lock.isSupported()).isTrue();
        // the docstring is dropped
        assertThat(lock.body()).singleElement().isInstanceOf(Stmt.Return.class);
    }

    @Test
    void elifChainsNestAsSingleIfInOrElse() {
        SourceModule module = analyze("""
                def pick(x: int) -> int:
                    if x == 1:
                        return 10
                    elif x == 2:
                        return 20
                    else:
                        return 30
                """);

        Stmt.If outer = (Stmt.If) module.functions().get(0).body().get(0);
        assertThat(outer.orElse()).singleElement().isInstanceOf(Stmt.If.class);
        Stmt.If inner = (Stmt.If) outer.orElse().get(0);
        assertThat(inner.location().line()).isEqualTo(4);
        assertThat(inner.orElse()).singleElement().isInstanceOf(Stmt.Return.class);
    }

    @Test
    void printCallBecomesPrintStatement() {
        SourceModule module = analyze("""
                def log_it(x: int) -> None:
                    print("value", x)
                """);

        FunctionMetadata function = module.functions().get(0);
        assertThat(function.returnsNone()).isTrue();
        assertThat(function.body()).singleElement().isInstanceOfSatisfying(Stmt.Print.class,
                print -> assertThat(print.arguments()).hasSize(2));
    }

    @Test
    void augmentedAssignmentKeepsOperatorWithoutEquals() {
        SourceModule module = analyze("""
                def inc(x: int) -> int:
                    x += 2
                    return x
                """);

        assertThat(module.functions().get(0).body().get(0)).isInstanceOfSatisfying(Stmt.AugAssign.class, aug -> {
            assertThat(aug.target()).isEqualTo("x");
            assertThat(aug.operator()).isEqualTo("+");
        });
    }

    // ── Unsupported constructs ───────────────────────────────────────────

    @Test
    void loopsAreRecordedAndTheFunctionIsKept() {
        SourceModule module = analyze("""
                def total(xs: list) -> int:
                    n = 0
                    for x in xs:
                        n = n + x
                    return n
                """);

        FunctionMetadata function = module.functions().get(0);
        assertThat(function.isSupported()).isFalse();
        assertThat(function.unsupported()).singleElement().satisfies(u -> {
            assertThat(u.description()).isEqualTo("for loop");
            assertThat(u.location().line()).isEqualTo(3);
        });
    }

    @Test
    void unsupportedExpressionsAreRecordedPerStatement() {
        SourceModule module = analyze("""
                def f(xs: list) -> int:
                    g = [y for y in xs]
                    h = xs[1:2]
                    while True:
                        pass
                    return 0
                """);

        assertThat(module.functions().get(0).unsupported())
                .extracting(UnsupportedConstruct::description)
                .containsExactly("list comprehension", "slice", "while loop");
    }

    @Test
    void asyncFunctionIsUnsupported() {
        SourceModule module = analyze("""
                async def f() -> int:
                    return 1
                """);

        assertThat(module.functions().get(0).unsupported())
                .extracting(UnsupportedConstruct::description)
                .contains("async function");
    }

    @Test
    void parameterDefaultsAndIsinstanceAreUnsupported() {
        SourceModule module = analyze("""
                def f(r, n: int = 1) -> bool:
                    return isinstance(r, int)
                """);

        FunctionMetadata function = module.functions().get(0);
        assertThat(function.parameters()).extracting(Parameter::name).containsExactly("r");
        assertThat(function.unsupported())
                .extracting(UnsupportedConstruct::description)
                .containsExactly("parameter default value", "isinstance check");
    }

    // ── Classes ──────────────────────────────────────────────────────────

    @Test
    void literalOnlyClassIsSumType() {
        SourceModule module = analyze("""
                class Action:
                    MINT = 0
                    BURN = 1
                """);

        assertThat(module.types()).singleElement().isInstanceOfSatisfying(TypeDecl.SumType.class, sum -> {
            assertThat(sum.name()).isEqualTo("Action");
            assertThat(sum.members()).extracting(TypeDecl.Member::name).containsExactly("MINT", "BURN");
            assertThat(sum.hasMember("BURN")).isTrue();
            assertThat(((Expr.IntLiteral) sum.members().get(1).value()).value()).isEqualTo(BigInteger.ONE);
        });
    }

    @Test
    void sumTypeResolvesStringTagsByValue() {
        SourceModule module = analyze("""
                class Kind:
                    Open = "open"
                    Closed = "closed"
                """);

        TypeDecl.SumType kind = module.sumType("Kind").orElseThrow();
        assertThat(kind.memberFor("closed")).contains("Closed");
        assertThat(kind.memberFor("Open")).contains("Open");
        assertThat(kind.memberFor("other")).isEmpty();
    }

    @Test
    void annotatedFieldsOrInitMakeRecordType() {
        SourceModule module = analyze("""
                class Datum:
                    owner: bytes
                    amount: int


                class Order:
                    def __init__(self, price: int, buyer: bytes):
                        self.price = price
                """);

        assertThat(module.types()).hasSize(2);
        TypeDecl.RecordType datum = (TypeDecl.RecordType) module.type("Datum").orElseThrow();
        assertThat(datum.fields()).extracting(TypeDecl.Field::name).containsExactly("owner", "amount");
        TypeDecl.RecordType order = (TypeDecl.RecordType) module.type("Order").orElseThrow();
        assertThat(order.fields()).extracting(TypeDecl.Field::name).containsExactly("price", "buyer");
        // __init__ of a data class is not a function of the module
        assertThat(module.functions()).isEmpty();
    }

    @Test
    void validatorClassGroupsHandlersAndKeepsOtherMethodsAsHelpers() {
        SourceModule module = analyze("""
                class Vault:
                    @staticmethod
                    def spend(datum, redeemer, context) -> bool:
                        return True

                    @staticmethod
                    def else_(context) -> bool:
                        return False

                    @staticmethod
                    def is_owner(key: bytes) -> bool:
                        return True
                """);

        assertThat(module.validatorGroups()).containsExactly("Vault");
        assertThat(module.isValidatorGroup("Vault")).isTrue();
        assertThat(module.functions()).extracting(FunctionMetadata::qualifiedName)
                                      .containsExactly("Vault.spend", "Vault.else_", "is_owner");
        assertThat(module.isFunction("is_owner")).isTrue();
        assertThat(module.functions().get(0).decorators()).containsExactly("staticmethod");
    }

    // ── Annotations ──────────────────────────────────────────────────────

    @Test
    void parseAnnotation_readsSubscriptsAsGenericArguments() {
        Expr annotation = SourceAnalyzer.parseAnnotation("Dict[str, int]");

        assertThat(annotation).isInstanceOfSatisfying(Expr.Subscript.class, subscript -> {
            assertThat(subscript.value()).isInstanceOf(Expr.Name.class);
            assertThat(subscript.index()).isInstanceOfSatisfying(Expr.TupleDisplay.class,
                    tuple -> assertThat(tuple.elements()).hasSize(2));
        });
    }
}
