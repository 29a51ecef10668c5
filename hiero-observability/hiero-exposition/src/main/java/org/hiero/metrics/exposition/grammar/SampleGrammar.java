// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.grammar;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Map;
import org.hiero.metrics.exposition.GrammarRule;

/**
 * Recognizes a complete sample line.
 * <pre>
 *   sample    = token [ labelset ] 1*WS value [ 1*WS timestamp ] NEWLINE
 *   timestamp = [ "+" / "-" ] 1*DIGIT
 * </pre>
 * Whitespace between the metric name and an opening {@code &#123;} is tolerated.
 * See the <a href="https://prometheus.io/docs/instrumenting/exposition_formats/#text-format-example">exposition format</a>.
 */
public final class SampleGrammar {

    private SampleGrammar() {}

    /**
     * @throws GrammarMismatch if the input does not start with a complete sample line
     */
    @NonNull
    public static Parsed<ParsedLine.SampleLine> sample(@NonNull TextInput input) throws GrammarMismatch {
        Parsed<String> name = TokenGrammar.token(input);

        TextInput current = name.rest();
        TextInput afterWhitespace = Terminals.skipWhitespace(current);
        if (afterWhitespace.peek() == '{') {
            current = afterWhitespace;
        }
        Parsed<Map<String, String>> labels = LabelSetGrammar.labelSet(current);

        Parsed<Double> value = ValueGrammar.value(Terminals.whitespace(labels.rest()));
        current = value.rest();

        Long timestamp = null;
        if (Terminals.isHorizontalWhitespace(current.peek())) {
            TextInput timestampStart = Terminals.skipWhitespace(current);
            if (Terminals.atLineEnd(timestampStart) || timestampStart.atEnd()) {
                // trailing whitespace is not part of the grammar
                throw new GrammarMismatch(GrammarRule.LINE_END, current);
            }
            Parsed<Long> parsedTimestamp = timestamp(timestampStart);
            timestamp = parsedTimestamp.value();
            current = parsedTimestamp.rest();
        }

        TextInput rest = Terminals.lineEnd(current);
        return new Parsed<>(
                new ParsedLine.SampleLine(name.value(), labels.value(), value.value(), timestamp), rest);
    }

    /**
     * Consumes a signed 64-bit decimal timestamp in milliseconds.
     *
     * @throws GrammarMismatch with {@link GrammarRule#TIMESTAMP} if the field is not a valid integer
     */
    @NonNull
    public static Parsed<Long> timestamp(@NonNull TextInput input) throws GrammarMismatch {
        Parsed<String> field = Terminals.field(input);
        try {
            return new Parsed<>(Long.parseLong(field.value()), field.rest());
        } catch (NumberFormatException e) {
            throw new GrammarMismatch(GrammarRule.TIMESTAMP, input);
        }
    }
}
