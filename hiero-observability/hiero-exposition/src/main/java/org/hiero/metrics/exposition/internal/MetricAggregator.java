// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.internal;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.hiero.metrics.exposition.core.Metric;
import org.hiero.metrics.exposition.core.MetricType;
import org.hiero.metrics.exposition.core.Sample;
import org.hiero.metrics.exposition.grammar.ParsedLine;

/**
 * Folds classified lines into one entry per metric name.
 * <ul>
 *     <li>a type line sets the type of its metric, the last one wins</li>
 *     <li>a sample line appends to its metric, creating an untyped metric on first sight</li>
 *     <li>a help line sets the help text of its metric if help text is enabled, otherwise it is dropped</li>
 *     <li>comments and blank lines are dropped</li>
 * </ul>
 * {@link #finish()} freezes the entries into {@link Metric} records ordered by name.
 * This class is not thread-safe.
 */
public final class MetricAggregator {

    private static final Comparator<Metric> BY_NAME = Comparator.comparing(Metric::name);

    private final boolean helpTextEnabled;
    private final Map<String, MetricEntry> entries = new HashMap<>();

    public MetricAggregator(boolean helpTextEnabled) {
        this.helpTextEnabled = helpTextEnabled;
    }

    public void accept(@NonNull ParsedLine line) {
        Objects.requireNonNull(line, "line must not be null");
        if (line instanceof ParsedLine.TypeLine typeLine) {
            entry(typeLine.metricName()).applyType(typeLine.metricName(), typeLine.type());
        } else if (line instanceof ParsedLine.SampleLine sampleLine) {
            entry(sampleLine.metricName()).appendSample(sampleLine);
        } else if (line instanceof ParsedLine.HelpLine helpLine) {
            if (helpTextEnabled && helpLine.metricName() != null) {
                entry(helpLine.metricName()).applyHelp(helpLine.metricName(), helpLine.text());
            }
        }
    }

    /**
     * @return number of distinct metric names seen so far
     */
    public int size() {
        return entries.size();
    }

    /**
     * @return immutable list of all metrics, ordered by name
     */
    @NonNull
    public List<Metric> finish() {
        return entries.values().stream().map(MetricEntry::toMetric).sorted(BY_NAME).toList();
    }

    private MetricEntry entry(String metricName) {
        return entries.computeIfAbsent(metricName, MetricEntry::new);
    }

    private static final class MetricEntry {

        private final String name;
        private final List<Sample> samples = new ArrayList<>();
        private MetricType type = MetricType.UNTYPED;

        @Nullable
        private String help;

        MetricEntry(String name) {
            this.name = name;
        }

        void applyType(String metricName, MetricType newType) {
            checkName(metricName);
            type = newType;
        }

        void applyHelp(String metricName, String text) {
            checkName(metricName);
            help = text;
        }

        void appendSample(ParsedLine.SampleLine line) {
            checkName(line.metricName());
            samples.add(new Sample(line.labels(), line.value(), line.timestamp()));
        }

        Metric toMetric() {
            return new Metric(name, type, samples, help);
        }

        private void checkName(String metricName) {
            if (!name.equals(metricName)) {
                throw new IllegalStateException(
                        "Cannot merge line of metric " + metricName + " into metric " + name);
            }
        }
    }
}
