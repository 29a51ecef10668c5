// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.grammar;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.metrics.exposition.GrammarRule;
import org.hiero.metrics.exposition.core.ExpositionUtils;

/**
 * Recognizes metric and label names.
 * <pre>
 *   token = [A-Za-z_:][A-Za-z0-9_:]*
 * </pre>
 * See <a href="https://prometheus.io/docs/concepts/data_model/#metric-names-and-labels">metric names and labels</a>.
 */
public final class TokenGrammar {

    private TokenGrammar() {}

    /**
     * Consumes the longest prefix of the input that is a valid name.
     *
     * @throws GrammarMismatch with {@link GrammarRule#TOKEN} if the first character cannot start a name
     */
    @NonNull
    public static Parsed<String> token(@NonNull TextInput input) throws GrammarMismatch {
        if (!ExpositionUtils.isNameStart(input.peek())) {
            throw new GrammarMismatch(GrammarRule.TOKEN, input);
        }
        String text = input.text();
        int end = input.offset() + 1;
        while (end < text.length() && ExpositionUtils.isNameChar(text.charAt(end))) {
            end++;
        }
        TextInput rest = input.moveTo(end);
        return new Parsed<>(input.until(rest), rest);
    }
}
