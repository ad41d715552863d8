package org.pyken.model;

import org.junit.jupiter.api.Test;
import org.pyken.parser.SourceAnalyzer;
import org.pyken.parser.SourceModule;

import static org.assertj.core.api.Assertions.assertThat;

class TypeMappingTest {

    private static TypeMapping.ResolvedType resolve(String annotation) {
        return TypeMapping.builtin().resolve(SourceAnalyzer.parseAnnotation(annotation));
    }

    @Test
    void builtinScalarsMapByIdentity() {
        assertThat(resolve("int").text()).isEqualTo("Int");
        assertThat(resolve("bool").text()).isEqualTo("Bool");
        assertThat(resolve("str").text()).isEqualTo("String");
        assertThat(resolve("bytes").text()).isEqualTo("ByteArray");
        assertThat(resolve("None").text()).isEqualTo("Void");

        TypeMapping.ResolvedType integer = resolve("int");
        assertThat(integer.rule()).isEqualTo(ConversionRule.IDENTITY);
        assertThat(integer.imports()).isEmpty();
        assertThat(integer.isKnown()).isTrue();
    }

    @Test
    void floatNarrowsToInt() {
        TypeMapping.ResolvedType resolved = resolve("float");
        assertThat(resolved.text()).isEqualTo("Int");
        assertThat(resolved.rule()).isEqualTo(ConversionRule.NARROWING);
    }

    @Test
    void genericsMapTheirArguments() {
        assertThat(resolve("List[bytes]").text()).isEqualTo("List<ByteArray>");
        assertThat(resolve("List[bytes]").rule()).isEqualTo(ConversionRule.GENERIC);
        assertThat(resolve("list").text()).isEqualTo("List<Data>");
        assertThat(resolve("Optional[List[int]]").text()).isEqualTo("Option<List<Int>>");
        assertThat(resolve("Optional[int]").rule()).isEqualTo(ConversionRule.OPTIONAL);
    }

    @Test
    void tuplesMapToAikenTuples() {
        assertThat(resolve("Tuple[int, int]").text()).isEqualTo("(Int, Int)");
        assertThat(resolve("tuple[bytes, int]").text()).isEqualTo("(ByteArray, Int)");
        assertThat(resolve("Tuple[int, int, bytes]").text()).isEqualTo("(Int, Int, ByteArray)");
        assertThat(resolve("tuple").text()).isEqualTo("(Data, Data)");
    }

    @Test
    void dictImportsItsModule() {
        TypeMapping.ResolvedType resolved = resolve("Dict[str, int]");
        assertThat(resolved.text()).isEqualTo("Dict<String, Int>");
        assertThat(resolved.imports()).containsExactly(new TypeImport("aiken/collection/dict", "Dict"));
    }

    @Test
    void ledgerTypesImportTheirModules() {
        TypeMapping.ResolvedType resolved = resolve("ScriptContext");
        assertThat(resolved.text()).isEqualTo("ScriptContext");
        assertThat(resolved.imports()).containsExactly(new TypeImport("cardano/script_context", "ScriptContext"));

        assertThat(resolve("Context").text()).isEqualTo("ScriptContext");
        assertThat(resolve("VerificationKeyHash").imports())
                .containsExactly(new TypeImport("aiken/crypto", "VerificationKeyHash"));
    }

    @Test
    void unknownNamesBecomeDataAndAreListed() {
        TypeMapping.ResolvedType resolved = resolve("Foo");
        assertThat(resolved.text()).isEqualTo(TypeMapping.PLACEHOLDER);
        assertThat(resolved.rule()).isEqualTo(ConversionRule.OPAQUE);
        assertThat(resolved.unknown()).containsExactly("Foo");
        assertThat(resolved.isKnown()).isFalse();

        TypeMapping.ResolvedType nested = resolve("List[Foo]");
        assertThat(nested.text()).isEqualTo("List<Data>");
        assertThat(nested.rule()).isEqualTo(ConversionRule.GENERIC);
        assertThat(nested.unknown()).containsExactly("Foo");
    }

    @Test
    void unionIsOpaqueWithoutWarning() {
        TypeMapping.ResolvedType resolved = resolve("Union[int, str]");
        assertThat(resolved.text()).isEqualTo("Data");
        assertThat(resolved.rule()).isEqualTo(ConversionRule.OPAQUE);
        assertThat(resolved.isKnown()).isTrue();
    }

    @Test
    void forwardReferenceResolvesLikeTheName() {
        assertThat(resolve("\"int\"").text()).isEqualTo("Int");
        assertThat(resolve("'cardano.Transaction'").text()).isEqualTo("Transaction");
    }

    @Test
    void declaredAndImportedNamesWinOverTheTable() {
        SourceModule module = new SourceAnalyzer().analyze("m.py", """
                from cardano.transaction import Transaction as Tx
                from aiken.crypto import Signature


                class Datum:
                    owner: bytes
                """);
        TypeMapping types = TypeMapping.forModule(module);

        // the table maps Datum to Option<Data>; the local class shadows it
        TypeMapping.ResolvedType datum = types.resolve(SourceAnalyzer.parseAnnotation("Datum"));
        assertThat(datum.text()).isEqualTo("Datum");
        assertThat(datum.imports()).isEmpty();
        assertThat(types.isDeclared("Datum")).isTrue();

        TypeMapping.ResolvedType signature = types.resolve(SourceAnalyzer.parseAnnotation("Signature"));
        assertThat(signature.text()).isEqualTo("Signature");
        assertThat(signature.imports()).containsExactly(new TypeImport("aiken/crypto", "Signature"));

        assertThat(types.resolve(SourceAnalyzer.parseAnnotation("Tx")).imports())
                .containsExactly(new TypeImport("cardano/transaction", "Transaction as Tx"));
    }

    @Test
    void tableHasNoDuplicateEntries() {
        assertThat(TypeMapping.entries()).containsKeys("int", "Optional", "Dict", "ScriptContext");
        assertThat(TypeMapping.lookup("Datum"))
                .hasValueSatisfying(e -> assertThat(e.rule()).isEqualTo(ConversionRule.OPTIONAL));
        assertThat(TypeMapping.lookup("Nope")).isEmpty();
    }
}
