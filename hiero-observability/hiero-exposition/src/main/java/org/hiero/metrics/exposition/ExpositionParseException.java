// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * Exception to indicate that exposition text could not be parsed.
 * <p>
 * Carries the grammar rule that rejected the input, the 1-based position of the failure
 * and the unconsumed remainder of the input starting at that position.
 */
public class ExpositionParseException extends Exception {

    private final GrammarRule rule;
    private final int line;
    private final int column;
    private final String remainder;

    /**
     * @param rule          the rule that rejected the input
     * @param line          1-based line of the failure
     * @param column        1-based column of the failure
     * @param remainder     the unconsumed input, starting at the failure position
     * @param snippetLength max number of remainder characters quoted in the message
     */
    public ExpositionParseException(
            @NonNull GrammarRule rule, int line, int column, @NonNull String remainder, int snippetLength) {
        super(formatMessage(rule, line, column, remainder, snippetLength));
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
        this.line = line;
        this.column = column;
        this.remainder = remainder;
    }

    /**
     * @return the grammar rule that rejected the input
     */
    @NonNull
    public GrammarRule rule() {
        return rule;
    }

    /**
     * @return 1-based line number of the failure
     */
    public int line() {
        return line;
    }

    /**
     * @return 1-based column of the failure
     */
    public int column() {
        return column;
    }

    /**
     * @return the input that was not consumed, starting at the failure position
     */
    @NonNull
    public String remainder() {
        return remainder;
    }

    private static String formatMessage(
            GrammarRule rule, int line, int column, String remainder, int snippetLength) {
        Objects.requireNonNull(remainder, "remainder must not be null");
        String snippet = remainder.length() > snippetLength
                ? remainder.substring(0, snippetLength) + "..."
                : remainder;
        snippet = snippet.replace("\r", "\\r").replace("\n", "\\n");
        return "Expected " + rule.description() + " at line " + line + ", column " + column + ", found: '"
                + snippet + "'";
    }
}
