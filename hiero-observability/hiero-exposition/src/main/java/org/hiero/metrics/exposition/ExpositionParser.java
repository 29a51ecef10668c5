// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.metrics.exposition.config.ParserConfig;
import org.hiero.metrics.exposition.config.ParserConfigLoader;
import org.hiero.metrics.exposition.core.Metric;
import org.hiero.metrics.exposition.internal.InputDriver;
import org.hiero.metrics.exposition.internal.MetricAggregator;

/**
 * Parses the Prometheus text exposition format into a list of {@link Metric}s.
 * <p>
 * Sample and {@code # TYPE} lines of the same metric may be scattered over the input; they are merged
 * into one metric per name. Samples keep their order of appearance, the last type declaration wins and
 * metrics are returned sorted by name. Parsing stops at the first malformed line and nothing is returned
 * in that case.
 * <p>
 * Instances only hold immutable configuration and can be shared between threads.
 *
 * <p>See <a href="https://prometheus.io/docs/instrumenting/exposition_formats/">Exposition formats</a> for details.
 */
public final class ExpositionParser {

    private static final Logger logger = LogManager.getLogger(ExpositionParser.class);

    private final ParserConfig config;

    /**
     * Creates a parser with {@link ParserConfig#DEFAULT default} configuration.
     */
    public ExpositionParser() {
        this(ParserConfig.DEFAULT);
    }

    public ExpositionParser(@NonNull ParserConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Creates a parser configured from the {@value ParserConfigLoader#DEFAULT_RESOURCE} classpath resource.
     */
    @NonNull
    public static ExpositionParser fromClasspathConfig() {
        return new ExpositionParser(ParserConfigLoader.loadFromClasspath());
    }

    @NonNull
    public ParserConfig config() {
        return config;
    }

    /**
     * Parses complete exposition text. Every line, including the last one, must be terminated by a line break.
     *
     * @param text the exposition text
     * @return immutable list of metrics ordered by name, empty for empty input
     * @throws ExpositionParseException if any line is malformed
     * @throws NullPointerException if text is {@code null}
     */
    @NonNull
    public List<Metric> parse(@NonNull String text) throws ExpositionParseException {
        Objects.requireNonNull(text, "text must not be null");

        InputDriver driver = new InputDriver(text, config.errorSnippetLength());
        MetricAggregator aggregator = new MetricAggregator(config.helpTextEnabled());
        try {
            while (driver.hasNext()) {
                aggregator.accept(driver.next());
            }
        } catch (ExpositionParseException e) {
            logger.debug("Rejected exposition text after {} lines: {}", driver.linesRead(), e.getMessage());
            throw e;
        }

        List<Metric> metrics = aggregator.finish();
        logger.debug("Parsed {} metrics from {} lines", metrics.size(), driver.linesRead());
        return metrics;
    }
}
