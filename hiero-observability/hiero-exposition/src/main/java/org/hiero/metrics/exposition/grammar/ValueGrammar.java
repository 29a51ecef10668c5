// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.grammar;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Locale;
import java.util.regex.Pattern;
import org.hiero.metrics.exposition.GrammarRule;

/**
 * Recognizes sample values.
 * <p>
 * The literals {@code NaN}, {@code +Inf} and {@code -Inf} are tried first. Otherwise the field up to the next
 * whitespace or line terminator must be a decimal floating point literal, similar to Go's {@code strconv.ParseFloat}
 * which the exposition format refers to. Spelled out infinities and {@code nan} are accepted regardless of case.
 */
public final class ValueGrammar {

    private static final String NAN = "NaN";
    private static final String POSITIVE_INF = "+Inf";
    private static final String NEGATIVE_INF = "-Inf";

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern SPECIAL = Pattern.compile("[+-]?(inf|infinity|nan)");

    private ValueGrammar() {}

    /**
     * @throws GrammarMismatch with {@link GrammarRule#VALUE} if no valid value starts at the input
     */
    @NonNull
    public static Parsed<Double> value(@NonNull TextInput input) throws GrammarMismatch {
        if (input.startsWith(NAN)) {
            return new Parsed<>(Double.NaN, input.advance(NAN.length()));
        }
        if (input.startsWith(POSITIVE_INF)) {
            return new Parsed<>(Double.POSITIVE_INFINITY, input.advance(POSITIVE_INF.length()));
        }
        if (input.startsWith(NEGATIVE_INF)) {
            return new Parsed<>(Double.NEGATIVE_INFINITY, input.advance(NEGATIVE_INF.length()));
        }

        Parsed<String> field = Terminals.field(input);
        String literal = field.value();
        if (DECIMAL.matcher(literal).matches()) {
            return new Parsed<>(Double.parseDouble(literal), field.rest());
        }

        String lowerCase = literal.toLowerCase(Locale.ROOT);
        if (SPECIAL.matcher(lowerCase).matches()) {
            return new Parsed<>(parseSpecial(lowerCase), field.rest());
        }
        throw new GrammarMismatch(GrammarRule.VALUE, input);
    }

    private static double parseSpecial(String lowerCase) {
        if (lowerCase.endsWith("nan")) {
            return Double.NaN;
        }
        return lowerCase.charAt(0) == '-' ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
}
