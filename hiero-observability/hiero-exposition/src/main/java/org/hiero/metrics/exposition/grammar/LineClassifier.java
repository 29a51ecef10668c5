// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.grammar;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.metrics.exposition.GrammarRule;

/**
 * Classifies the next line of input as a comment, a sample or a blank line, tried in that order.
 */
public final class LineClassifier {

    private static final ParsedLine.BlankLine BLANK_LINE = new ParsedLine.BlankLine();

    private LineClassifier() {}

    /**
     * Consumes the next line.
     *
     * @throws GrammarMismatch if no line shape matches. This is the committed mismatch of a malformed declaration
     *                         if there is one, otherwise the mismatch that got furthest into the line,
     *                         preferring the sample mismatch on a tie.
     */
    @NonNull
    public static Parsed<ParsedLine> classify(@NonNull TextInput input) throws GrammarMismatch {
        GrammarMismatch failure;
        try {
            return CommentGrammar.comment(input);
        } catch (GrammarMismatch e) {
            if (e.committed()) {
                throw e;
            }
            failure = e;
        }

        try {
            Parsed<ParsedLine.SampleLine> sample = SampleGrammar.sample(input);
            return new Parsed<>(sample.value(), sample.rest());
        } catch (GrammarMismatch e) {
            // a line that is neither a comment nor blank is most likely a broken sample
            failure = GrammarMismatch.furthest(e, failure);
        }

        try {
            return blankLine(input);
        } catch (GrammarMismatch e) {
            throw GrammarMismatch.furthest(failure, e);
        }
    }

    /**
     * Consumes a line holding only horizontal whitespace.
     *
     * @throws GrammarMismatch with {@link GrammarRule#BLANK_LINE} if the line holds anything else
     */
    @NonNull
    public static Parsed<ParsedLine> blankLine(@NonNull TextInput input) throws GrammarMismatch {
        TextInput current = Terminals.skipWhitespace(input);
        if (!Terminals.atLineEnd(current)) {
            throw new GrammarMismatch(GrammarRule.BLANK_LINE, current);
        }
        return new Parsed<>(BLANK_LINE, Terminals.lineEnd(current));
    }
}
