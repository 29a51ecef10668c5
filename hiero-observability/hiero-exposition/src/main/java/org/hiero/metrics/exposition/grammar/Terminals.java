// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.grammar;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.metrics.exposition.GrammarRule;

/**
 * Terminal symbols shared by the grammar rules: horizontal whitespace, line terminators and literals.
 * A line terminator is either {@code \n} or {@code \r\n}.
 */
public final class Terminals {

    private Terminals() {}

    public static boolean isHorizontalWhitespace(int c) {
        return c == ' ' || c == '\t';
    }

    /**
     * @return {@code true} if the input is positioned at {@code \n} or {@code \r\n}
     */
    public static boolean atLineEnd(@NonNull TextInput input) {
        int c = input.peek();
        return c == '\n' || (c == '\r' && input.peek(1) == '\n');
    }

    /**
     * Consumes zero or more spaces and tabs.
     */
    @NonNull
    public static TextInput skipWhitespace(@NonNull TextInput input) {
        int end = input.offset();
        String text = input.text();
        while (end < text.length() && isHorizontalWhitespace(text.charAt(end))) {
            end++;
        }
        return input.moveTo(end);
    }

    /**
     * Consumes one or more spaces and tabs.
     *
     * @throws GrammarMismatch with {@link GrammarRule#WHITESPACE} if the input does not start with whitespace
     */
    @NonNull
    public static TextInput whitespace(@NonNull TextInput input) throws GrammarMismatch {
        if (!isHorizontalWhitespace(input.peek())) {
            throw new GrammarMismatch(GrammarRule.WHITESPACE, input);
        }
        return skipWhitespace(input);
    }

    /**
     * Consumes a line terminator.
     *
     * @throws GrammarMismatch with {@link GrammarRule#LINE_END} if the input is not at a line terminator
     */
    @NonNull
    public static TextInput lineEnd(@NonNull TextInput input) throws GrammarMismatch {
        if (input.peek() == '\n') {
            return input.advance(1);
        }
        if (input.peek() == '\r' && input.peek(1) == '\n') {
            return input.advance(2);
        }
        throw new GrammarMismatch(GrammarRule.LINE_END, input);
    }

    /**
     * Consumes everything up to, but excluding, the next line terminator or the end of input.
     */
    @NonNull
    public static Parsed<String> restOfLine(@NonNull TextInput input) {
        String text = input.text();
        int newline = text.indexOf('\n', input.offset());
        int end = newline < 0 ? text.length() : newline;
        if (newline > input.offset() && text.charAt(newline - 1) == '\r') {
            end--;
        }
        TextInput rest = input.moveTo(end);
        return new Parsed<>(input.until(rest), rest);
    }

    /**
     * Consumes characters up to the next whitespace, line terminator or end of input.
     * Used for the value and timestamp fields.
     */
    @NonNull
    public static Parsed<String> field(@NonNull TextInput input) {
        String text = input.text();
        int end = input.offset();
        while (end < text.length()) {
            char c = text.charAt(end);
            if (isHorizontalWhitespace(c) || c == '\n' || c == '\r') {
                break;
            }
            end++;
        }
        TextInput rest = input.moveTo(end);
        return new Parsed<>(input.until(rest), rest);
    }
}
