// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.grammar;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * Immutable view of the remaining input: the whole text and the offset of the first unconsumed character.
 * Grammar rules never modify a view, they return a new one positioned after what they consumed.
 *
 * @param text   the whole input text
 * @param offset offset of the first unconsumed character
 */
public record TextInput(@NonNull String text, int offset) {

    /** Returned by {@link #peek()} at end of input. */
    public static final int END = -1;

    /**
     * @throws NullPointerException if text is {@code null}
     * @throws IllegalArgumentException if offset is outside the text
     */
    public TextInput {
        Objects.requireNonNull(text, "text must not be null");
        if (offset < 0 || offset > text.length()) {
            throw new IllegalArgumentException("offset " + offset + " outside of text of length " + text.length());
        }
    }

    /**
     * @return a view over the whole text
     */
    @NonNull
    public static TextInput of(@NonNull String text) {
        return new TextInput(text, 0);
    }

    public boolean atEnd() {
        return offset == text.length();
    }

    /**
     * @return the next character or {@link #END}
     */
    public int peek() {
        return peek(0);
    }

    /**
     * @param ahead number of characters to look past the next one
     * @return the character at {@code offset + ahead} or {@link #END}
     */
    public int peek(int ahead) {
        int index = offset + ahead;
        return index < text.length() ? text.charAt(index) : END;
    }

    public boolean startsWith(@NonNull String prefix) {
        return text.startsWith(prefix, offset);
    }

    @NonNull
    public TextInput advance(int count) {
        return count == 0 ? this : new TextInput(text, offset + count);
    }

    @NonNull
    public TextInput moveTo(int newOffset) {
        return newOffset == offset ? this : new TextInput(text, newOffset);
    }

    /**
     * @return the text between this view and the given later view of the same text
     */
    @NonNull
    public String until(@NonNull TextInput end) {
        return text.substring(offset, end.offset);
    }

    /**
     * @return the unconsumed input
     */
    @NonNull
    public String remaining() {
        return text.substring(offset);
    }

    /**
     * @return 1-based line number of the offset
     */
    public int line() {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * @return 1-based column of the offset within its line
     */
    public int column() {
        return offset - (text.lastIndexOf('\n', offset - 1) + 1) + 1;
    }

    @Override
    public String toString() {
        return "TextInput[offset=" + offset + ", length=" + text.length() + "]";
    }
}
