// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single observation of a metric: its labels, its value and an optional timestamp.
 * <p>
 * Labels keep the order they had on the sample line. Two samples are equal when their labels contain
 * the same pairs, their values are equal as defined by {@link Double#compare(double, double)}
 * (so {@code NaN} equals {@code NaN}) and their timestamps are equal.
 *
 * @param labels    immutable label name to label value mapping, never {@code null}
 * @param value     the sample value, may be {@code NaN} or infinite
 * @param timestamp milliseconds since epoch, or {@code null} if the sample line had no timestamp
 */
public record Sample(
        @NonNull Map<String, String> labels, double value, @Nullable Long timestamp) {

    /**
     * @throws NullPointerException if labels, any label name or any label value is {@code null}
     * @throws IllegalArgumentException if a label name doesn't match {@value ExpositionUtils#NAME_REGEX}
     */
    public Sample {
        Objects.requireNonNull(labels, "labels must not be null");
        Map<String, String> copy = new LinkedHashMap<>(labels.size() * 2);
        labels.forEach((name, labelValue) -> {
            ExpositionUtils.validateName(name);
            copy.put(name, Objects.requireNonNull(labelValue, "label value must not be null"));
        });
        labels = Collections.unmodifiableMap(copy);
    }

    /**
     * Convenient factory for a sample without timestamp.
     *
     * @param value          the sample value
     * @param namesAndValues label names and values as alternating pairs
     * @return a new sample
     * @throws IllegalArgumentException if an odd number of names and values is provided
     */
    @NonNull
    public static Sample of(double value, @NonNull String... namesAndValues) {
        return of(value, null, namesAndValues);
    }

    /**
     * Convenient factory for a sample with optional timestamp.
     *
     * @param value          the sample value
     * @param timestamp      the timestamp in milliseconds, may be {@code null}
     * @param namesAndValues label names and values as alternating pairs
     * @return a new sample
     * @throws IllegalArgumentException if an odd number of names and values is provided
     */
    @NonNull
    public static Sample of(double value, @Nullable Long timestamp, @NonNull String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Label names and values must be provided in pairs");
        }
        Map<String, String> labels = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            labels.put(namesAndValues[i], namesAndValues[i + 1]);
        }
        return new Sample(labels, value, timestamp);
    }

    /**
     * @return {@code true} if the sample carries a timestamp
     */
    public boolean hasTimestamp() {
        return timestamp != null;
    }
}
