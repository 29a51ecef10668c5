// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.grammar;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.hiero.metrics.exposition.GrammarRule;

/**
 * Recognizes the optional label block of a sample line.
 * <pre>
 *   labelset = "{" [ pair *( "," pair ) [ "," ] ] "}"
 *   pair     = token "=" quoted-string
 * </pre>
 * Inside a quoted string only {@code \\}, {@code \"} and {@code \n} are valid escape sequences.
 * Pairs are folded into a map in order of appearance, so a repeated label name keeps its first position
 * and takes the last value.
 */
public final class LabelSetGrammar {

    private static final char OPEN_BRACKET = '{';
    private static final char CLOSE_BRACKET = '}';
    private static final char COMMA = ',';
    private static final char EQUALS = '=';
    private static final char QUOTE = '"';
    private static final char BACKSLASH = '\\';

    private LabelSetGrammar() {}

    /**
     * Consumes a label block if the input starts with one.
     *
     * @return the labels, an empty map without consuming anything if there is no block
     * @throws GrammarMismatch if a block is opened but malformed
     */
    @NonNull
    public static Parsed<Map<String, String>> labelSet(@NonNull TextInput input) throws GrammarMismatch {
        if (input.peek() != OPEN_BRACKET) {
            return new Parsed<>(Map.of(), input);
        }

        Map<String, String> labels = new LinkedHashMap<>();
        TextInput current = input.advance(1);
        while (current.peek() != CLOSE_BRACKET) {
            Parsed<String> name = TokenGrammar.token(current);
            if (name.rest().peek() != EQUALS) {
                throw new GrammarMismatch(GrammarRule.LABEL_SET, name.rest());
            }
            Parsed<String> value = labelValue(name.rest().advance(1));
            labels.put(name.value(), value.value());

            current = value.rest();
            if (current.peek() == COMMA) {
                current = current.advance(1);
            } else if (current.peek() != CLOSE_BRACKET) {
                throw new GrammarMismatch(GrammarRule.LABEL_SET, current);
            }
        }
        return new Parsed<>(Collections.unmodifiableMap(labels), current.advance(1));
    }

    /**
     * Consumes a double-quoted label value and resolves its escape sequences.
     *
     * @throws GrammarMismatch with {@link GrammarRule#LABEL_VALUE} on a missing quote, a raw line break
     *                         or an unknown escape sequence
     */
    @NonNull
    public static Parsed<String> labelValue(@NonNull TextInput input) throws GrammarMismatch {
        if (input.peek() != QUOTE) {
            throw new GrammarMismatch(GrammarRule.LABEL_VALUE, input);
        }

        String text = input.text();
        StringBuilder value = new StringBuilder();
        int index = input.offset() + 1;
        while (index < text.length()) {
            char c = text.charAt(index);
            if (c == QUOTE) {
                return new Parsed<>(value.toString(), input.moveTo(index + 1));
            } else if (c == '\n') {
                break;
            } else if (c == BACKSLASH) {
                int escaped = index + 1 < text.length() ? text.charAt(index + 1) : TextInput.END;
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case QUOTE -> value.append(QUOTE);
                    case BACKSLASH -> value.append(BACKSLASH);
                    default -> throw new GrammarMismatch(GrammarRule.LABEL_VALUE, input.moveTo(index));
                }
                index += 2;
            } else {
                value.append(c);
                index++;
            }
        }
        throw new GrammarMismatch(GrammarRule.LABEL_VALUE, input.moveTo(index));
    }
}
