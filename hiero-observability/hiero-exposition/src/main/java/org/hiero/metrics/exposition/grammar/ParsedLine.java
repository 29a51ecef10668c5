// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.grammar;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Map;
import org.hiero.metrics.exposition.core.MetricType;

/**
 * One classified line of exposition text.
 */
public sealed interface ParsedLine
        permits ParsedLine.TypeLine,
                ParsedLine.HelpLine,
                ParsedLine.CommentLine,
                ParsedLine.SampleLine,
                ParsedLine.BlankLine {

    /**
     * {@code # TYPE <name> [<keyword>]}
     */
    record TypeLine(@NonNull String metricName, @NonNull MetricType type) implements ParsedLine {}

    /**
     * {@code # HELP <text>}. The metric name is the leading token of the text, {@code null} if there is none.
     */
    record HelpLine(@Nullable String metricName, @NonNull String text) implements ParsedLine {}

    /**
     * Any other line starting with {@code #}.
     */
    record CommentLine(@NonNull String text) implements ParsedLine {}

    /**
     * {@code <name>[{labels}] <value> [<timestamp>]}
     */
    record SampleLine(
            @NonNull String metricName,
            @NonNull Map<String, String> labels,
            double value,
            @Nullable Long timestamp)
            implements ParsedLine {}

    /**
     * A line holding nothing but horizontal whitespace.
     */
    record BlankLine() implements ParsedLine {}
}
