// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads {@link ParserConfig} from YAML. Properties live under {@value #CONFIG_PREFIX}:
 * <pre>
 * metrics:
 *   exposition:
 *     parser:
 *       helpTextEnabled: true
 *       errorSnippetLength: 128
 * </pre>
 * Missing properties keep their defaults, unknown properties are ignored.
 */
public final class ParserConfigLoader {

    private static final Logger logger = LogManager.getLogger(ParserConfigLoader.class);

    /** Classpath resource read by {@link #loadFromClasspath()}. */
    public static final String DEFAULT_RESOURCE = "exposition-parser.yaml";

    /** Dot separated path of the parser section. */
    public static final String CONFIG_PREFIX = "metrics.exposition.parser";

    private static final String CONFIG_POINTER = "/" + CONFIG_PREFIX.replace('.', '/');

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory());

    private ParserConfigLoader() {}

    /**
     * Reads configuration from a YAML stream. The stream is not closed.
     *
     * @throws IOException if the stream cannot be read or is not valid YAML
     * @throws IllegalArgumentException if a property value is out of range
     */
    @NonNull
    public static ParserConfig load(@NonNull InputStream yaml) throws IOException {
        Objects.requireNonNull(yaml, "yaml must not be null");
        JsonNode root = MAPPER.readTree(yaml);
        if (root == null || root.at(CONFIG_POINTER).isMissingNode()) {
            return ParserConfig.DEFAULT;
        }
        ParserProperties properties = MAPPER.treeToValue(root.at(CONFIG_POINTER), ParserProperties.class);
        return properties.toConfig();
    }

    /**
     * Reads configuration from {@value #DEFAULT_RESOURCE} on the classpath, see {@link #loadFromClasspath(String)}.
     */
    @NonNull
    public static ParserConfig loadFromClasspath() {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Reads configuration from a classpath resource, falling back to {@link ParserConfig#DEFAULT}
     * if the resource does not exist.
     *
     * @throws UncheckedIOException if the resource exists but cannot be read
     * @throws IllegalArgumentException if a property value is out of range
     */
    @NonNull
    public static ParserConfig loadFromClasspath(@NonNull String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        try (InputStream yaml = ParserConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (yaml == null) {
                logger.info("No parser configuration found at {}. Using defaults.", resource);
                return ParserConfig.DEFAULT;
            }
            ParserConfig config = load(yaml);
            logger.info("Loaded parser configuration from {}: {}", resource, config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Error loading parser configuration from " + resource, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class ParserProperties {
        public Boolean helpTextEnabled;
        public Integer errorSnippetLength;

        ParserConfig toConfig() {
            return new ParserConfig(
                    helpTextEnabled != null ? helpTextEnabled : ParserConfig.DEFAULT_HELP_TEXT_ENABLED,
                    errorSnippetLength != null ? errorSnippetLength : ParserConfig.DEFAULT_ERROR_SNIPPET_LENGTH);
        }
    }
}
