// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.grammar;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import org.hiero.metrics.exposition.GrammarRule;
import org.hiero.metrics.exposition.core.ExpositionUtils;
import org.hiero.metrics.exposition.core.MetricType;

/**
 * Recognizes lines starting with {@code #}. Three shapes are tried in order:
 * <pre>
 *   type-decl = "#" 1*WS "TYPE" 1*WS token [ 1*WS type-keyword ] *WS NEWLINE
 *   help-decl = "#" 1*WS "HELP" 1*WS [ token WS ] help-text NEWLINE
 *   comment   = "#" rest-of-line NEWLINE
 * </pre>
 * In help text {@code \\} and {@code \n} are unescaped, other backslash sequences are kept as they are.
 * Once the {@code # TYPE } or {@code # HELP } prefix is recognized the line is committed to that shape,
 * so a malformed declaration fails instead of being read as a plain comment.
 */
public final class CommentGrammar {

    private static final char HASH = '#';
    private static final String TYPE = "TYPE";
    private static final String HELP = "HELP";

    private CommentGrammar() {}

    /**
     * @throws GrammarMismatch if the input is not a comment line; committed if a declaration is malformed
     */
    @NonNull
    public static Parsed<ParsedLine> comment(@NonNull TextInput input) throws GrammarMismatch {
        if (input.peek() != HASH) {
            throw new GrammarMismatch(GrammarRule.COMMENT, input);
        }

        TextInput typeBody = declarationBody(input, TYPE);
        if (typeBody != null) {
            try {
                return typeDeclaration(typeBody);
            } catch (GrammarMismatch e) {
                throw e.commit();
            }
        }

        TextInput helpBody = declarationBody(input, HELP);
        if (helpBody != null) {
            try {
                return helpDeclaration(helpBody);
            } catch (GrammarMismatch e) {
                throw e.commit();
            }
        }

        Parsed<String> text = Terminals.restOfLine(input.advance(1));
        return new Parsed<>(new ParsedLine.CommentLine(text.value()), Terminals.lineEnd(text.rest()));
    }

    private static Parsed<ParsedLine> typeDeclaration(TextInput body) throws GrammarMismatch {
        Parsed<String> name = TokenGrammar.token(body);

        TextInput current = name.rest();
        MetricType type = MetricType.UNTYPED;
        TextInput keywordStart = Terminals.skipWhitespace(current);
        if (keywordStart.offset() > current.offset() && !keywordStart.atEnd() && !Terminals.atLineEnd(keywordStart)) {
            Parsed<MetricType> keyword = typeKeyword(keywordStart);
            type = keyword.value();
            current = keyword.rest();
        }

        TextInput rest = Terminals.lineEnd(Terminals.skipWhitespace(current));
        return new Parsed<>(new ParsedLine.TypeLine(name.value(), type), rest);
    }

    private static Parsed<MetricType> typeKeyword(TextInput input) throws GrammarMismatch {
        Parsed<String> word = Terminals.field(input);
        MetricType type = MetricType.fromKeyword(word.value());
        if (type == null) {
            throw new GrammarMismatch(GrammarRule.TYPE_KEYWORD, input);
        }
        return new Parsed<>(type, word.rest());
    }

    private static Parsed<ParsedLine> helpDeclaration(TextInput body) throws GrammarMismatch {
        Parsed<String> text = Terminals.restOfLine(body);
        TextInput rest = Terminals.lineEnd(text.rest());

        String metricName = null;
        String helpText = text.value();
        TextInput textInput = TextInput.of(helpText);
        if (ExpositionUtils.isNameStart(textInput.peek())) {
            Parsed<String> name = TokenGrammar.token(textInput);
            if (name.rest().atEnd()) {
                metricName = name.value();
                helpText = "";
            } else if (Terminals.isHorizontalWhitespace(name.rest().peek())) {
                // exactly one separator, further whitespace belongs to the text
                metricName = name.value();
                helpText = name.rest().advance(1).remaining();
            }
        }
        return new Parsed<>(new ParsedLine.HelpLine(metricName, ExpositionUtils.unescapeHelpText(helpText)), rest);
    }

    /**
     * Matches {@code "#" 1*WS keyword 1*WS}.
     *
     * @return the input after the trailing whitespace, or {@code null} if the prefix does not match
     */
    @Nullable
    private static TextInput declarationBody(TextInput input, String keyword) {
        TextInput current = input.advance(1);
        if (!Terminals.isHorizontalWhitespace(current.peek())) {
            return null;
        }
        current = Terminals.skipWhitespace(current);
        if (!current.startsWith(keyword)) {
            return null;
        }
        current = current.advance(keyword.length());
        if (!Terminals.isHorizontalWhitespace(current.peek())) {
            return null;
        }
        return Terminals.skipWhitespace(current);
    }
}
