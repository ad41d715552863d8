package org.pyken.translator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pyken.UnsupportedOperatorException;
import org.pyken.diagnostic.SourceLocation;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperatorTableTest {

    private static final SourceLocation AT = new SourceLocation(7, 3);

    /** Every binary operator the parser can produce. */
    private static final List<String> PYTHON_BINARY = List.of(
            "+", "-", "*", "/", "//", "%", "**", "@", "<<", ">>", "&", "|", "^",
            "==", "!=", "<", "<=", ">", ">=", "is", "is not", "in", "not in", "and", "or");

    @Test
    void everyBinaryOperatorIsMappedMembershipOrRejected() {
        for (String operator : PYTHON_BINARY) {
            if (OperatorTable.isMembership(operator)) {
                continue;
            }
            if (OperatorTable.binaryOperators().containsKey(operator)) {
                assertThat(OperatorTable.binary(operator, AT)).isNotBlank();
            } else {
                assertThatThrownBy(() -> OperatorTable.binary(operator, AT))
                        .isInstanceOf(UnsupportedOperatorException.class);
            }
        }
    }

    @Test
    void arithmeticAndComparisonKeepTheirSpelling() {
        assertThat(OperatorTable.binary("+", AT)).isEqualTo("+");
        assertThat(OperatorTable.binary("%", AT)).isEqualTo("%");
        assertThat(OperatorTable.binary("<=", AT)).isEqualTo("<=");
        assertThat(OperatorTable.binary("!=", AT)).isEqualTo("!=");
    }

    @Test
    void pythonSpellingsAreTranslated() {
        assertThat(OperatorTable.binary("//", AT)).isEqualTo("/");
        assertThat(OperatorTable.binary("and", AT)).isEqualTo("&&");
        assertThat(OperatorTable.binary("or", AT)).isEqualTo("||");
        assertThat(OperatorTable.binary("is", AT)).isEqualTo("==");
        assertThat(OperatorTable.binary("is not", AT)).isEqualTo("!=");
        assertThat(OperatorTable.unary("not", AT)).isEqualTo("!");
        assertThat(OperatorTable.unary("-", AT)).isEqualTo("-");
    }

    @ParameterizedTest
    @ValueSource(strings = {"**", "@", "<<", ">>", "&", "|", "^"})
    void unsupportedBinaryOperatorCarriesPosition(String operator) {
        assertThatThrownBy(() -> OperatorTable.binary(operator, AT))
                .isInstanceOf(UnsupportedOperatorException.class)
                .satisfies(e -> {
                    UnsupportedOperatorException uoe = (UnsupportedOperatorException) e;
                    assertThat(uoe.getOperator()).isEqualTo(operator);
                    assertThat(uoe.getLine()).isEqualTo(7);
                    assertThat(uoe.getColumn()).isEqualTo(3);
                });
    }

    @ParameterizedTest
    @ValueSource(strings = {"~", "+"})
    void unsupportedUnaryOperator(String operator) {
        assertThatThrownBy(() -> OperatorTable.unary(operator, AT))
                .isInstanceOf(UnsupportedOperatorException.class)
                .satisfies(e -> assertThat(((UnsupportedOperatorException) e).getOperator())
                        .isEqualTo("unary " + operator));
    }

    @Test
    void membershipIsHandledOutsideTheTable() {
        assertThat(OperatorTable.isMembership("in")).isTrue();
        assertThat(OperatorTable.isMembership("not in")).isTrue();
        assertThat(OperatorTable.binaryOperators()).doesNotContainKeys("in", "not in");
    }
}
