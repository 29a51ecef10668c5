// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.internal;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.hiero.metrics.exposition.ExpositionParseException;
import org.hiero.metrics.exposition.grammar.GrammarMismatch;
import org.hiero.metrics.exposition.grammar.LineClassifier;
import org.hiero.metrics.exposition.grammar.Parsed;
import org.hiero.metrics.exposition.grammar.ParsedLine;
import org.hiero.metrics.exposition.grammar.TextInput;

/**
 * Walks the input line by line, classifying each one with {@link LineClassifier}.
 * <p>
 * The first line that cannot be classified ends the walk with an {@link ExpositionParseException};
 * there is no recovery. This class is not thread-safe.
 */
public final class InputDriver {

    private final int errorSnippetLength;

    private TextInput remaining;
    private int linesRead;
    private boolean failed;

    /**
     * @param text               the whole exposition text
     * @param errorSnippetLength max number of input characters quoted in error messages
     */
    public InputDriver(@NonNull String text, int errorSnippetLength) {
        this.remaining = TextInput.of(Objects.requireNonNull(text, "text must not be null"));
        this.errorSnippetLength = errorSnippetLength;
    }

    /**
     * @return {@code true} if input remains and no line has failed
     */
    public boolean hasNext() {
        return !failed && !remaining.atEnd();
    }

    /**
     * Classifies and consumes the next line.
     *
     * @throws ExpositionParseException if the line matches no line shape
     * @throws NoSuchElementException if there is no more input or a previous line failed
     */
    @NonNull
    public ParsedLine next() throws ExpositionParseException {
        if (!hasNext()) {
            throw new NoSuchElementException("No more lines to classify");
        }
        try {
            Parsed<ParsedLine> line = LineClassifier.classify(remaining);
            remaining = line.rest();
            linesRead++;
            return line.value();
        } catch (GrammarMismatch e) {
            failed = true;
            TextInput position = e.position();
            throw new ExpositionParseException(
                    e.rule(), position.line(), position.column(), position.remaining(), errorSnippetLength);
        }
    }

    /**
     * @return number of lines successfully classified so far
     */
    public int linesRead() {
        return linesRead;
    }
}
