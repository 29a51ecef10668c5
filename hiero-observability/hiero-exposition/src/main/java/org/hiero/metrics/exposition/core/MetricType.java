// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The type of metric as declared by a {@code # TYPE} line of the Prometheus text exposition format.
 */
public enum MetricType {
    /**
     * No type information available. Used when a declaration omits the keyword
     * or when a metric is only seen through its samples.
     */
    UNTYPED("untyped"),
    /**
     * A cumulative metric that represents a single monotonically increasing counter value.
     */
    COUNTER("counter"),
    /**
     * A metric that represents a single numerical value that can arbitrarily go up and down.
     */
    GAUGE("gauge"),
    /**
     * Samples observations and counts them in configurable buckets.
     */
    HISTOGRAM("histogram"),
    /**
     * Samples observations and exposes configurable quantiles over a sliding time window.
     */
    SUMMARY("summary");

    private final String keyword;

    MetricType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return the lowercase keyword used for this type in the exposition format
     */
    @NonNull
    public String keyword() {
        return keyword;
    }

    /**
     * Finds the metric type for an exposition keyword. Matching is case-sensitive.
     *
     * @param keyword the keyword, e.g. {@code counter}
     * @return the matching type or {@code null} if the keyword is unknown
     */
    @Nullable
    public static MetricType fromKeyword(@Nullable String keyword) {
        for (MetricType type : values()) {
            if (type.keyword.equals(keyword)) {
                return type;
            }
        }
        return null;
    }
}
