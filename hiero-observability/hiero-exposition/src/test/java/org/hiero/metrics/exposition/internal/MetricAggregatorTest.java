// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.internal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.hiero.metrics.exposition.core.Metric;
import org.hiero.metrics.exposition.core.MetricType;
import org.hiero.metrics.exposition.core.Sample;
import org.hiero.metrics.exposition.grammar.ParsedLine;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

public class MetricAggregatorTest {

    private static ParsedLine.TypeLine type(String name, MetricType type) {
        return new ParsedLine.TypeLine(name, type);
    }

    private static ParsedLine.SampleLine sample(String name, double value, String... namesAndValues) {
        return new ParsedLine.SampleLine(name, Sample.of(value, namesAndValues).labels(), value, null);
    }

    @Test
    void testEmptyAggregatorFinishesEmpty() {
        MetricAggregator aggregator = new MetricAggregator(false);

        assertThat(aggregator.finish()).isEmpty();
        assertThat(aggregator.size()).isZero();
    }

    @Test
    void testTypeThenSamples() {
        MetricAggregator aggregator = new MetricAggregator(false);
        aggregator.accept(type("requests", MetricType.COUNTER));
        aggregator.accept(sample("requests", 1, "code", "200"));
        aggregator.accept(sample("requests", 2, "code", "400"));

        assertThat(aggregator.finish())
                .containsExactly(new Metric(
                        "requests",
                        MetricType.COUNTER,
                        List.of(Sample.of(1, "code", "200"), Sample.of(2, "code", "400"))));
    }

    @Test
    void testSampleWithoutDeclarationIsUntyped() {
        MetricAggregator aggregator = new MetricAggregator(false);
        aggregator.accept(sample("rpc_duration_seconds_count", 2693));

        assertThat(aggregator.finish())
                .containsExactly(
                        new Metric("rpc_duration_seconds_count", MetricType.UNTYPED, List.of(Sample.of(2693))));
    }

    @Test
    void testTypeWithoutSamplesCreatesEmptyMetric() {
        MetricAggregator aggregator = new MetricAggregator(false);
        aggregator.accept(type("declared_only", MetricType.GAUGE));

        assertThat(aggregator.finish()).containsExactly(new Metric("declared_only", MetricType.GAUGE, List.of()));
    }

    @Test
    void testTypeAfterSamplesKeepsSamples() {
        MetricAggregator aggregator = new MetricAggregator(false);
        aggregator.accept(sample("late", 1));
        aggregator.accept(type("late", MetricType.GAUGE));
        aggregator.accept(sample("late", 2));

        assertThat(aggregator.finish())
                .containsExactly(new Metric("late", MetricType.GAUGE, List.of(Sample.of(1), Sample.of(2))));
    }

    @Test
    void testRepeatedTypeIsIdempotent() {
        MetricAggregator once = new MetricAggregator(false);
        once.accept(type("x", MetricType.COUNTER));

        MetricAggregator twice = new MetricAggregator(false);
        twice.accept(type("x", MetricType.COUNTER));
        twice.accept(type("x", MetricType.COUNTER));

        assertThat(twice.finish()).isEqualTo(once.finish());
    }

    @Test
    void testConflictingTypeLastWins() {
        MetricAggregator aggregator = new MetricAggregator(false);
        aggregator.accept(type("x", MetricType.COUNTER));
        aggregator.accept(sample("x", 1));
        aggregator.accept(type("x", MetricType.GAUGE));

        Metric metric = aggregator.finish().get(0);
        assertThat(metric.type()).isEqualTo(MetricType.GAUGE);
        assertThat(metric.samples()).containsExactly(Sample.of(1));
    }

    @Test
    void testOrderedByName() {
        MetricAggregator aggregator = new MetricAggregator(false);
        aggregator.accept(sample("b", 1));
        aggregator.accept(type("a", MetricType.GAUGE));
        aggregator.accept(sample("c", 3));
        aggregator.accept(sample("a", 2));

        assertThat(aggregator.finish()).extracting(Metric::name).containsExactly("a", "b", "c");
        assertThat(aggregator.size()).isEqualTo(3);
    }

    @Test
    void testOrderIsByteWise() {
        MetricAggregator aggregator = new MetricAggregator(false);
        aggregator.accept(sample("b", 1));
        aggregator.accept(sample("_a", 1));
        aggregator.accept(sample("B", 1));
        aggregator.accept(sample(":x", 1));
        aggregator.accept(sample("a", 1));

        assertThat(aggregator.finish()).extracting(Metric::name).containsExactly(":x", "B", "_a", "a", "b");
    }

    @Test
    void testCommentsAndBlankLinesIgnored() {
        MetricAggregator aggregator = new MetricAggregator(true);
        aggregator.accept(new ParsedLine.CommentLine(" just a comment"));
        aggregator.accept(new ParsedLine.BlankLine());

        assertThat(aggregator.finish()).isEmpty();
    }

    @Test
    void testFinishedListIsImmutable() {
        MetricAggregator aggregator = new MetricAggregator(false);
        aggregator.accept(sample("a", 1));
        List<Metric> metrics = aggregator.finish();

        assertThatThrownBy(metrics::clear).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> metrics.get(0).samples().add(Sample.of(2)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testNullLineThrows() {
        assertThatThrownBy(() -> new MetricAggregator(false).accept(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("line must not be null");
    }

    @Nested
    class HelpText {

        @Test
        void testDiscardedWhenDisabled() {
            MetricAggregator aggregator = new MetricAggregator(false);
            aggregator.accept(new ParsedLine.HelpLine("a", "help of a"));
            aggregator.accept(sample("a", 1));

            Metric metric = aggregator.finish().get(0);
            assertThat(metric.help()).isNull();
        }

        @Test
        void testHelpOnlyLineCreatesNothingWhenDisabled() {
            MetricAggregator aggregator = new MetricAggregator(false);
            aggregator.accept(new ParsedLine.HelpLine("a", "help of a"));

            assertThat(aggregator.finish()).isEmpty();
        }

        @Test
        void testAttachedWhenEnabled() {
            MetricAggregator aggregator = new MetricAggregator(true);
            aggregator.accept(new ParsedLine.HelpLine("a", "help of a"));
            aggregator.accept(type("a", MetricType.COUNTER));
            aggregator.accept(sample("a", 1));

            assertThat(aggregator.finish())
                    .containsExactly(new Metric("a", MetricType.COUNTER, List.of(Sample.of(1)), "help of a"));
        }

        @Test
        void testLastHelpWins() {
            MetricAggregator aggregator = new MetricAggregator(true);
            aggregator.accept(new ParsedLine.HelpLine("a", "first"));
            aggregator.accept(new ParsedLine.HelpLine("a", "second"));

            assertThat(aggregator.finish().get(0).help()).isEqualTo("second");
        }

        @Test
        void testHelpWithoutNameIgnored() {
            MetricAggregator aggregator = new MetricAggregator(true);
            aggregator.accept(new ParsedLine.HelpLine(null, "42 is the answer"));

            assertThat(aggregator.finish()).isEmpty();
        }

        @Test
        void testHelpOnlyLineCreatesUntypedMetricWhenEnabled() {
            MetricAggregator aggregator = new MetricAggregator(true);
            aggregator.accept(new ParsedLine.HelpLine("a", "help"));

            assertThat(aggregator.finish())
                    .containsExactly(new Metric("a", MetricType.UNTYPED, List.of(), "help"));
        }
    }

    @Test
    void testLabelsKeptPerSample() {
        MetricAggregator aggregator = new MetricAggregator(false);
        aggregator.accept(new ParsedLine.SampleLine("a", Map.of("quantile", "0.5"), 0, 1L));

        Sample sample = aggregator.finish().get(0).samples().get(0);
        assertThat(sample.labels()).containsExactly(Map.entry("quantile", "0.5"));
        assertThat(sample.timestamp()).isEqualTo(1L);
    }
}
