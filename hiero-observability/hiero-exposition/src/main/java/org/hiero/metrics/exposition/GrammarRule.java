// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Rules of the exposition format grammar. Used to report which rule rejected the input.
 */
public enum GrammarRule {
    TOKEN("metric or label name"),
    VALUE("sample value"),
    LABEL_SET("label set"),
    LABEL_VALUE("quoted label value"),
    TIMESTAMP("timestamp"),
    WHITESPACE("whitespace"),
    LINE_END("line break"),
    TYPE_KEYWORD("metric type keyword"),
    COMMENT("comment"),
    BLANK_LINE("blank line");

    private final String description;

    GrammarRule(String description) {
        this.description = description;
    }

    /**
     * @return human-readable name of what the rule expects
     */
    @NonNull
    public String description() {
        return description;
    }
}
