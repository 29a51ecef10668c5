// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.grammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.stream.Stream;
import org.hiero.metrics.exposition.GrammarRule;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

public class ValueGrammarTest {

    @Nested
    class SpecialLiterals {

        @Test
        void testNaN() throws GrammarMismatch {
            Parsed<Double> parsed = ValueGrammar.value(TextInput.of("NaN\n"));

            assertThat(parsed.value()).isNaN();
            assertThat(parsed.rest().remaining()).isEqualTo("\n");
        }

        @Test
        void testPositiveInfinity() throws GrammarMismatch {
            assertThat(ValueGrammar.value(TextInput.of("+Inf")).value()).isEqualTo(Double.POSITIVE_INFINITY);
        }

        @Test
        void testNegativeInfinity() throws GrammarMismatch {
            assertThat(ValueGrammar.value(TextInput.of("-Inf 123")).value()).isEqualTo(Double.NEGATIVE_INFINITY);
        }

        @ParameterizedTest
        @ValueSource(strings = {"inf", "Inf", "+inf", "INFINITY", "+Infinity"})
        void testSpelledOutPositiveInfinity(String literal) throws GrammarMismatch {
            assertThat(ValueGrammar.value(TextInput.of(literal)).value()).isEqualTo(Double.POSITIVE_INFINITY);
        }

        @ParameterizedTest
        @ValueSource(strings = {"-inf", "-INF", "-infinity"})
        void testSpelledOutNegativeInfinity(String literal) throws GrammarMismatch {
            assertThat(ValueGrammar.value(TextInput.of(literal)).value()).isEqualTo(Double.NEGATIVE_INFINITY);
        }

        @ParameterizedTest
        @ValueSource(strings = {"nan", "NAN", "-nan", "+NaN"})
        void testOtherNaNSpellings(String literal) throws GrammarMismatch {
            assertThat(ValueGrammar.value(TextInput.of(literal)).value()).isNaN();
        }
    }

    static Stream<Arguments> decimalLiterals() {
        return Stream.of(
                Arguments.of("1027", 1027.0),
                Arguments.of("2.00", 2.0),
                Arguments.of("1e-3", 0.001),
                Arguments.of("1.458255915e9", 1.458255915e9),
                Arguments.of("1.7560473e+07", 1.7560473e7),
                Arguments.of("-12.5", -12.5),
                Arguments.of("+3", 3.0),
                Arguments.of(".5", 0.5),
                Arguments.of("5.", 5.0),
                Arguments.of("0", 0.0),
                Arguments.of("1E10", 1e10));
    }

    @ParameterizedTest
    @MethodSource("decimalLiterals")
    void testDecimalLiteral(String literal, double expected) throws GrammarMismatch {
        Parsed<Double> parsed = ValueGrammar.value(TextInput.of(literal + " 1395066363000\n"));

        assertThat(parsed.value()).isEqualTo(expected);
        assertThat(parsed.rest().offset()).isEqualTo(literal.length());
    }

    @Test
    void testFieldEndsAtCarriageReturn() throws GrammarMismatch {
        Parsed<Double> parsed = ValueGrammar.value(TextInput.of("42\r\n"));

        assertThat(parsed.value()).isEqualTo(42.0);
        assertThat(parsed.rest().remaining()).isEqualTo("\r\n");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "\n", " 1", "abc", "1.2.3", "0x10", "10x27", "1e", "e5", "+", "-", ".", "1,5", "Infinit"})
    void testInvalidValueFails(String text) {
        TextInput input = TextInput.of(text);

        assertThatThrownBy(() -> ValueGrammar.value(input))
                .isInstanceOf(GrammarMismatch.class)
                .satisfies(e -> {
                    assertThat(((GrammarMismatch) e).rule()).isEqualTo(GrammarRule.VALUE);
                    assertThat(((GrammarMismatch) e).position()).isSameAs(input);
                });
    }
}
