// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.config;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Configuration for the exposition parser.
 *
 * @param helpTextEnabled    whether {@code # HELP} text is attached to the parsed metrics (default: false)
 * @param errorSnippetLength max number of input characters quoted in parse error messages
 *                           (default: 64, range: 8-4096)
 */
public record ParserConfig(boolean helpTextEnabled, int errorSnippetLength) {

    public static final boolean DEFAULT_HELP_TEXT_ENABLED = false;
    public static final int DEFAULT_ERROR_SNIPPET_LENGTH = 64;
    public static final int MIN_ERROR_SNIPPET_LENGTH = 8;
    public static final int MAX_ERROR_SNIPPET_LENGTH = 4096;

    /** Configuration with all default values. */
    public static final ParserConfig DEFAULT =
            new ParserConfig(DEFAULT_HELP_TEXT_ENABLED, DEFAULT_ERROR_SNIPPET_LENGTH);

    /**
     * @throws IllegalArgumentException if error snippet length is out of range
     */
    public ParserConfig {
        if (errorSnippetLength < MIN_ERROR_SNIPPET_LENGTH || errorSnippetLength > MAX_ERROR_SNIPPET_LENGTH) {
            throw new IllegalArgumentException("errorSnippetLength must be in range [" + MIN_ERROR_SNIPPET_LENGTH
                    + ", " + MAX_ERROR_SNIPPET_LENGTH + "], but was " + errorSnippetLength);
        }
    }

    @NonNull
    public ParserConfig withHelpTextEnabled(boolean enabled) {
        return new ParserConfig(enabled, errorSnippetLength);
    }

    @NonNull
    public ParserConfig withErrorSnippetLength(int length) {
        return new ParserConfig(helpTextEnabled, length);
    }
}
