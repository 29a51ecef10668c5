// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.grammar;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.hiero.metrics.exposition.GrammarRule;

/**
 * Signals that a grammar rule did not match at a position of the input.
 * <p>
 * A mismatch is <em>committed</em> when it happened after a line was positively identified
 * (e.g. after {@code # TYPE }), in which case no other line shape may be tried.
 * Mismatches are part of normal alternation, so no stack trace is captured.
 */
public final class GrammarMismatch extends Exception {

    private final GrammarRule rule;
    private final TextInput position;
    private final boolean committed;

    public GrammarMismatch(@NonNull GrammarRule rule, @NonNull TextInput position) {
        this(rule, position, false);
    }

    private GrammarMismatch(GrammarRule rule, TextInput position, boolean committed) {
        super(rule.description() + " expected at offset " + position.offset(), null, false, false);
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
        this.position = Objects.requireNonNull(position, "position must not be null");
        this.committed = committed;
    }

    /**
     * @return a committed copy of this mismatch
     */
    @NonNull
    public GrammarMismatch commit() {
        return committed ? this : new GrammarMismatch(rule, position, true);
    }

    @NonNull
    public GrammarRule rule() {
        return rule;
    }

    /**
     * @return the input position where the rule failed
     */
    @NonNull
    public TextInput position() {
        return position;
    }

    public boolean committed() {
        return committed;
    }

    /**
     * @return whichever mismatch got further into the input, {@code first} on a tie
     */
    @NonNull
    static GrammarMismatch furthest(@NonNull GrammarMismatch first, @NonNull GrammarMismatch second) {
        return second.position.offset() > first.position.offset() ? second : first;
    }
}
