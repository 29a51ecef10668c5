// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * A metric read from exposition text: all samples seen for one metric name together with its declared type.
 *
 * @param name    the metric name, matches {@value ExpositionUtils#NAME_REGEX}
 * @param type    the last declared type, {@link MetricType#UNTYPED} if never declared
 * @param samples immutable list of samples in the order they appeared in the input
 * @param help    the help text, {@code null} if not captured
 */
public record Metric(
        @NonNull String name,
        @NonNull MetricType type,
        @NonNull List<Sample> samples,
        @Nullable String help) {

    /**
     * @throws NullPointerException if name, type, samples or any sample is {@code null}
     * @throws IllegalArgumentException if name doesn't match regex {@value ExpositionUtils#NAME_REGEX}
     */
    public Metric {
        ExpositionUtils.validateName(name);
        Objects.requireNonNull(type, "metric type must not be null");
        samples = List.copyOf(samples);
    }

    /**
     * Creates a metric without help text.
     */
    public Metric(@NonNull String name, @NonNull MetricType type, @NonNull List<Sample> samples) {
        this(name, type, samples, null);
    }
}
