// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.hiero.metrics.exposition.core.ExpositionUtils;
import org.hiero.metrics.exposition.core.Metric;
import org.hiero.metrics.exposition.core.Sample;

/**
 * A writer that writes metrics in the Prometheus text exposition format, readable by {@link ExpositionParser}.
 * <p>
 * For every metric an optional {@code # HELP} line and a {@code # TYPE} line are written, followed by its samples
 * in the order they were added. Backslashes and line breaks in help text are written as {@code \\} and {@code \n}.
 */
public final class ExpositionWriter {

    private static final byte COMMA = ',';
    private static final byte QUOTE = '"';
    private static final byte SPACE = ' ';
    private static final byte NEW_LINE = '\n';
    private static final byte OPEN_BRACKET = '{';
    private static final byte CLOSE_BRACKET = '}';
    private static final byte[] EQUALS_QUOTE = "=\"".getBytes(StandardCharsets.UTF_8);

    private static final byte[] TYPE = "# TYPE ".getBytes(StandardCharsets.UTF_8);
    private static final byte[] HELP = "# HELP ".getBytes(StandardCharsets.UTF_8);

    private static final byte[] POSITIVE_INF = "+Inf".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NEGATIVE_INF = "-Inf".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NAN = "NaN".getBytes(StandardCharsets.UTF_8);

    // doubles up to 2^53 are written without fraction when integral
    private static final double MAX_EXACT_INTEGER = 9007199254740992.0;
    // -0.0 is integral too, but the long conversion drops its sign
    private static final long NEGATIVE_ZERO_BITS = Double.doubleToRawLongBits(-0.0);

    public void write(@NonNull List<Metric> metrics, @NonNull OutputStream output) throws IOException {
        for (Metric metric : metrics) {
            writeMetric(metric, output);
        }
        output.flush();
    }

    /**
     * @return the metrics in exposition format
     */
    @NonNull
    public String writeToString(@NonNull List<Metric> metrics) {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try {
            write(metrics, output);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return output.toString(StandardCharsets.UTF_8);
    }

    private void writeMetric(Metric metric, OutputStream output) throws IOException {
        byte[] metricNameBytes = metric.name().getBytes(StandardCharsets.UTF_8);

        String help = metric.help();
        if (help != null) {
            output.write(HELP);
            output.write(metricNameBytes);
            output.write(SPACE);
            output.write(ExpositionUtils.escapeHelpText(help).getBytes(StandardCharsets.UTF_8));
            output.write(NEW_LINE);
        }

        output.write(TYPE);
        output.write(metricNameBytes);
        output.write(SPACE);
        output.write(metric.type().keyword().getBytes(StandardCharsets.UTF_8));
        output.write(NEW_LINE);

        for (Sample sample : metric.samples()) {
            output.write(metricNameBytes);
            writeLabels(sample.labels(), output);
            output.write(SPACE);
            output.write(convertValue(sample.value()));
            if (sample.timestamp() != null) {
                output.write(SPACE);
                output.write(Long.toString(sample.timestamp()).getBytes(StandardCharsets.UTF_8));
            }
            output.write(NEW_LINE);
        }
    }

    private void writeLabels(Map<String, String> labels, OutputStream output) throws IOException {
        if (labels.isEmpty()) {
            return;
        }
        output.write(OPEN_BRACKET);
        Iterator<Map.Entry<String, String>> iterator = labels.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, String> label = iterator.next();
            output.write(label.getKey().getBytes(StandardCharsets.UTF_8));
            output.write(EQUALS_QUOTE);
            output.write(ExpositionUtils.escapeLabelValue(label.getValue()).getBytes(StandardCharsets.UTF_8));
            output.write(QUOTE);
            if (iterator.hasNext()) {
                output.write(COMMA);
            }
        }
        output.write(CLOSE_BRACKET);
    }

    private byte[] convertValue(double value) {
        if (value == Double.POSITIVE_INFINITY) {
            return POSITIVE_INF;
        } else if (value == Double.NEGATIVE_INFINITY) {
            return NEGATIVE_INF;
        } else if (Double.isNaN(value)) {
            return NAN;
        } else if (value == Math.rint(value)
                && Math.abs(value) <= MAX_EXACT_INTEGER
                && Double.doubleToRawLongBits(value) != NEGATIVE_ZERO_BITS) {
            return Long.toString((long) value).getBytes(StandardCharsets.UTF_8);
        } else {
            return Double.toString(value).getBytes(StandardCharsets.UTF_8);
        }
    }
}
