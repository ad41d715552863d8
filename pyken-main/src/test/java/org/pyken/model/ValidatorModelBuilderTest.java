package org.pyken.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pyken.TranslationException;
import org.pyken.diagnostic.DiagnosticKind;
import org.pyken.diagnostic.DiagnosticSink;
import org.pyken.parser.FunctionMetadata;
import org.pyken.parser.SourceAnalyzer;
import org.pyken.parser.SourceModule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidatorModelBuilderTest {

    private DiagnosticSink sink;

    @BeforeEach
    void setUp() {
        sink = new DiagnosticSink("v.py");
    }

    private TranslationUnit build(String source) {
        SourceModule module = new SourceAnalyzer().analyze("v.py", source);
        FunctionMetadata function = module.functions().get(0);
        return new ValidatorModelBuilder(TypeMapping.forModule(module), sink).build(function);
    }

    // ── Validator kinds ──────────────────────────────────────────────────

    @Test
    void spendHandlerGetsRoleDefaults() {
        TranslationUnit unit = build("""
                @spend
                def lock(datum, redeemer, context):
                    return True
                """);

        assertThat(unit).isInstanceOfSatisfying(ValidatorSpec.class, spec -> {
            assertThat(spec.kind()).isEqualTo(ValidatorKind.SPEND);
            assertThat(spec.validatorName()).isEqualTo("lock");
            assertThat(spec.parameters()).extracting(MappedParameter::type)
                                         .containsExactly("Option<Data>", "Data", "ScriptContext");
            assertThat(spec.parameters()).extracting(MappedParameter::role)
                                         .containsExactly(ParameterRole.DATUM, ParameterRole.REDEEMER,
                                                          ParameterRole.CONTEXT);
            assertThat(spec.imports()).containsExactly(new TypeImport("cardano/script_context", "ScriptContext"));
        });
        assertThat(sink.diagnostics()).isEmpty();
    }

    @Test
    void datumIsWrappedInOptionOnce() {
        TranslationUnit plain = build("""
                @spend
                def lock(datum: int, redeemer: bytes, context):
                    return True
                """);
        TranslationUnit optional = build("""
                @spend
                def lock(datum: Optional[int], redeemer: bytes, context):
                    return True
                """);

        assertThat(plain.parameters().get(0).type()).isEqualTo("Option<Int>");
        assertThat(plain.parameters().get(1).type()).isEqualTo("ByteArray");
        assertThat(optional.parameters().get(0).type()).isEqualTo("Option<Int>");
    }

    @Test
    void dottedDecoratorSelectsKindByLastSegment() {
        TranslationUnit unit = build("""
                @pyken.mint
                def policy(redeemer, context):
                    return True
                """);

        assertThat(((ValidatorSpec) unit).kind()).isEqualTo(ValidatorKind.MINT);
    }

    @Test
    void unrecognisedDecoratorIsFallbackHandler() {
        TranslationUnit unit = build("""
                @validator
                def anything(context):
                    return False
                """);

        assertThat(((ValidatorSpec) unit).kind()).isEqualTo(ValidatorKind.FALLBACK);
        assertThat(ValidatorKind.FALLBACK.handlerName()).isEqualTo("else");
    }

    @Test
    void groupedMethodsTakeTheirKindFromTheMethodName() {
        SourceModule module = new SourceAnalyzer().analyze("v.py", """
                class Vault:
                    def withdraw(redeemer, context) -> bool:
                        return True

                    def else_(context) -> bool:
                        return False
                """);
        assertThat(module.functions()).extracting(ValidatorModelBuilder::kindOf)
                                      .containsExactly(ValidatorKind.WITHDRAW, ValidatorKind.FALLBACK);

        ValidatorSpec spec = (ValidatorSpec) new ValidatorModelBuilder(TypeMapping.forModule(module), sink)
                .build(module.functions().get(0));
        assertThat(spec.validatorName()).isEqualTo("Vault");
    }

    // ── Arity ────────────────────────────────────────────────────────────

    @Test
    void spendWithTwoParametersIsArityMismatch() {
        assertThatThrownBy(() -> build("""
                @spend
                def lock(redeemer, context):
                    return True
                """))
            .isInstanceOf(TranslationException.class)
            .satisfies(e -> {
                TranslationException te = (TranslationException) e;
                assertThat(te.getDiagnostic().kind()).isEqualTo(DiagnosticKind.ARITY_MISMATCH);
                assertThat(te.getDiagnostic().function()).isEqualTo("lock");
                assertThat(te.getDiagnostic().line()).isEqualTo(2);
                assertThat(te.getMessage()).contains("takes 3 parameters").contains("declares 2");
            });
    }

    @Test
    void contextTypeInRedeemerPositionIsArityMismatch() {
        assertThatThrownBy(() -> build("""
                @mint
                def policy(context: ScriptContext, redeemer):
                    return True
                """))
            .isInstanceOf(TranslationException.class)
            .satisfies(e -> assertThat(((TranslationException) e).getDiagnostic().kind())
                    .isEqualTo(DiagnosticKind.ARITY_MISMATCH));
    }

    @Test
    void everyKindHasItsArity() {
        assertThat(ValidatorKind.SPEND.arity()).isEqualTo(3);
        assertThat(ValidatorKind.MINT.arity()).isEqualTo(2);
        assertThat(ValidatorKind.WITHDRAW.arity()).isEqualTo(2);
        assertThat(ValidatorKind.PUBLISH.arity()).isEqualTo(2);
        assertThat(ValidatorKind.FALLBACK.arity()).isEqualTo(1);
    }

    // ── Helpers and tests ────────────────────────────────────────────────

    @Test
    void undecoratedFunctionIsHelperWithMappedSignature() {
        TranslationUnit unit = build("""
                def add(a: int, b) -> int:
                    return a + b
                """);

        assertThat(unit).isInstanceOfSatisfying(FunctionSpec.class, spec -> {
            assertThat(spec.role()).isEqualTo(FunctionRole.HELPER);
            assertThat(spec.returnType()).isEqualTo("Int");
            assertThat(spec.parameters()).extracting(MappedParameter::type).containsExactly("Int", null);
        });
    }

    @Test
    void testPrefixMakesAikenTest() {
        TranslationUnit unit = build("""
                def test_addition():
                    assert 1 + 1 == 2
                """);

        assertThat(((FunctionSpec) unit).role()).isEqualTo(FunctionRole.TEST);
        assertThat(((FunctionSpec) unit).returnType()).isNull();
    }

    @Test
    void unknownParameterTypeWarnsAndFallsBackToData() {
        TranslationUnit unit = build("""
                def check(x: Mystery) -> bool:
                    return True
                """);

        assertThat(unit.parameters().get(0).type()).isEqualTo("Data");
        assertThat(sink.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.UNKNOWN_TYPE);
            assertThat(d.function()).isEqualTo("check");
            assertThat(d.message()).isEqualTo("Unknown type 'Mystery' for parameter 'x'; using Data");
        });
    }
}
