package org.pyken.emitter;

import org.junit.jupiter.api.Test;
import org.pyken.FileTranslation;
import org.pyken.PyKen;
import org.pyken.diagnostic.DiagnosticKind;

import static org.assertj.core.api.Assertions.assertThat;

class AikenEmitterTest {

    private static FileTranslation translate(String fileName, String source) {
        return new PyKen().translate(fileName, source);
    }

    private static String emit(String fileName, String source) {
        FileTranslation result = translate(fileName, source);
        assertThat(result.hasOutput()).as("output of %s, diagnostics %s", fileName, result.diagnostics()).isTrue();
        return result.output();
    }

    // ── Functions and validators ─────────────────────────────────────────

    @Test
    void helperWithGuard() {
        String output = emit("check.py", """
                def check(a: int, b: int) -> bool:
                    assert a > b
                    return True
                """);

        assertThat(output).isEqualTo("""
                // Generated by pyken from check.py. Do not edit.

                fn check(a: Int, b: Int) -> Bool {
                  expect a > b
                  True
                }
                """);
    }

    @Test
    void spendValidatorWithImportedContext() {
        String output = emit("lock.py", """
                from cardano.script_context import ScriptContext


                @spend
                def lock(datum, redeemer, context: ScriptContext) -> bool:
                    return True
                """);

        assertThat(output).isEqualTo("""
                // Generated by pyken from lock.py. Do not edit.

                use cardano/script_context.{ScriptContext}

                validator lock {
                  spend(datum: Option<Data>, redeemer: Data, context: ScriptContext) {
                    True
                  }
                }
                """);
    }

    @Test
    void validatorClassSharesOneBlockAndEmitsItsSumType() {
        String output = emit("policy.py", """
                class Action:
                    Mint = 0
                    Burn = 1


                class Policy:
                    @staticmethod
                    def mint(redeemer: Action, context) -> bool:
                        if redeemer == Action.Mint:
                            return True
                        elif redeemer == Action.Burn:
                            return False

                    @staticmethod
                    def else_(context) -> bool:
                        return False
                """);

        assertThat(output).isEqualTo("""
                // Generated by pyken from policy.py. Do not edit.

                use cardano/script_context.{ScriptContext}

                pub type Action {
                  Mint
                  Burn
                }

                validator policy {
                  mint(redeemer: Action, context: ScriptContext) {
                    when redeemer is {
                      Mint -> {
                        True
                      }
                      Burn -> {
                        False
                      }
                    }
                  }

                  else(context: ScriptContext) {
                    False
                  }
                }
                """);
    }

    @Test
    void testFunctionHasNoReturnType() {
        String output = emit("t.py", """
                def test_sum():
                    assert 1 + 2 == 3, "math"
                """);

        assertThat(output).endsWith("""
                test test_sum() {
                  expect 1 + 2 == 3 || fail @"math"
                  True
                }
                """);
    }

    // ── Bodies ───────────────────────────────────────────────────────────

    @Test
    void elifChainPrintsAsElseIf() {
        String output = emit("f.py", """
                def f(x: int) -> int:
                    if x > 10:
                        return 1
                    elif x > 5:
                        return 2
                    return 3
                """);

        assertThat(output).endsWith("""
                fn f(x: Int) -> Int {
                  if x > 10 {
                    1
                  } else if x > 5 {
                    2
                  } else {
                    3
                  }
                }
                """);
    }

    @Test
    void integerDispatchPrintsWhenWithWildcard() {
        String output = emit("pick.py", """
                def pick(x: int) -> int:
                    if x == 1:
                        return 10
                    elif x == 2:
                        return 20
                    else:
                        return 0
                """);

        assertThat(output).endsWith("""
                fn pick(x: Int) -> Int {
                  when x is {
                    1 -> {
                      10
                    }
                    2 -> {
                      20
                    }
                    _ -> {
                      0
                    }
                  }
                }
                """);
    }

    @Test
    void localsPrintAsLetBindings() {
        String output = emit("f.py", """
                def f(x: int) -> int:
                    total: int = x * 2
                    total = total + 1
                    return total
                """);

        assertThat(output).endsWith("""
                fn f(x: Int) -> Int {
                  let total: Int = x * 2
                  let total = total + 1
                  total
                }
                """);
    }

    @Test
    void printAndLiterals() {
        String output = emit("greet.py", """
                def greet(userName: str) -> None:
                    print("hello", userName)


                def tag() -> bytes:
                    return b"abc"


                def key() -> bytes:
                    return bytes.fromhex("DEADbeef")
                """);

        assertThat(output).contains("""
                fn greet(user_name: String) -> Void {
                  trace @"hello": user_name
                  Void
                }
                """);
        assertThat(output).contains("""
                fn tag() -> ByteArray {
                  "abc"
                }
                """);
        assertThat(output).contains("  #\"deadbeef\"\n");
    }

    @Test
    void precedenceIsKeptWithParentheses() {
        String output = emit("p.py", """
                def p(a: int, b: int) -> int:
                    return (a + b) * (a - b) - (a - b)
                """);

        assertThat(output).contains("  (a + b) * (a - b) - (a - b)\n");
    }

    @Test
    void nestedComparisonKeepsItsParentheses() {
        String output = emit("c.py", """
                def same(a: int, b: int, c: bool) -> bool:
                    return (a == b) == c
                """);

        assertThat(output).contains("  (a == b) == c\n");
    }

    @Test
    void joinedBranchesPrintAsLocalFunction() {
        String output = emit("j.py", """
                def f(x: int) -> int:
                    y = 0
                    if x > 1:
                        y = 1
                    if x > 2:
                        y = y + 2
                    return y
                """);

        assertThat(output).endsWith("""
                fn f(x: Int) -> Int {
                  let y = 0
                  let after_3 = fn(y) {
                    if x > 2 {
                      let y = y + 2
                      y
                    } else {
                      y
                    }
                  }
                  if x > 1 {
                    let y = 1
                    after_3(y)
                  } else {
                    after_3(y)
                  }
                }
                """);
    }

    @Test
    void tupleAnnotationsMatchTupleValues() {
        String output = emit("s.py", """
                def swap(pair: Tuple[int, bytes]) -> Tuple[bytes, int]:
                    return (pair[1], pair[0])
                """);

        assertThat(output).endsWith("""
                fn swap(pair: (Int, ByteArray)) -> (ByteArray, Int) {
                  (pair.2nd, pair.1st)
                }
                """);
    }

    @Test
    void membershipUsesListModule() {
        String output = emit("m.py", """
                def allowed(x: int) -> bool:
                    return x in [1, 2]
                """);

        assertThat(output).contains("use aiken/collection/list\n");
        assertThat(output).contains("  list.has([1, 2], x)\n");
    }

    @Test
    void recordTypeIsEmittedWhenUsed() {
        String output = emit("d.py", """
                class Datum:
                    owner: bytes
                    amount: int


                def make(key: bytes) -> Datum:
                    return Datum(owner=key, amount=1)
                """);

        assertThat(output).isEqualTo("""
                // Generated by pyken from d.py. Do not edit.

                pub type Datum {
                  owner: ByteArray,
                  amount: Int,
                }

                fn make(key: ByteArray) -> Datum {
                  Datum { owner: key, amount: 1 }
                }
                """);
    }

    @Test
    void unusedTypesAndImportsAreLeftOut() {
        String output = emit("u.py", """
                from cardano.transaction import Transaction
                import aiken.math


                class Unused:
                    A = 0
                    B = 1


                def one() -> int:
                    return 1
                """);

        assertThat(output).doesNotContain("use ").doesNotContain("pub type");
    }

    // ── Identifiers ──────────────────────────────────────────────────────

    @Test
    void reservedParameterNameIsSuffixed() {
        String output = emit("r.py", """
                def f(type: int) -> int:
                    return type
                """);

        assertThat(output).endsWith("""
                fn f(type_: Int) -> Int {
                  type_
                }
                """);
    }

    @Test
    void collidingFunctionNamesAreRenamedAndReported() {
        FileTranslation result = translate("c.py", """
                def checkOwner(x: int) -> int:
                    return x


                def check_owner(x: int) -> int:
                    return checkOwner(x)
                """);

        assertThat(result.output()).contains("fn check_owner(x: Int) -> Int {")
                                   .contains("fn check_owner_1(x: Int) -> Int {")
                                   .contains("  check_owner(x)\n");
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.IDENTIFIER_COLLISION);
            assertThat(d.line()).isEqualTo(5);
        });
    }

    @Test
    void localNamedLikeAHelperIsRenamed() {
        FileTranslation result = translate("h.py", """
                def check(x: int) -> bool:
                    return x > 0


                def run(x: int) -> bool:
                    check = x + 1
                    return check > 1
                """);

        assertThat(result.output()).contains("""
                fn run(x: Int) -> Bool {
                  let check_1 = x + 1
                  check_1 > 1
                }
                """);
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.IDENTIFIER_COLLISION);
            assertThat(d.function()).isEqualTo("run");
        });
    }

    @Test
    void parameterNamedLikeAModuleQualifierIsRenamed() {
        FileTranslation result = translate("l.py", """
                def f(list: List[int], x: int) -> bool:
                    return x in list
                """);

        assertThat(result.output()).contains("fn f(list_1: List<Int>, x: Int) -> Bool {")
                                   .contains("  list.has(list_1, x)\n");
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.IDENTIFIER_COLLISION);
            assertThat(d.line()).isEqualTo(1);
        });
    }
}
