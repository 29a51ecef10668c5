// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Utility class for names and values of the Prometheus text exposition format.
 */
public final class ExpositionUtils {

    /** Regex for metric and label names. */
    public static final String NAME_REGEX = "^[a-zA-Z_:][a-zA-Z0-9_:]*$";

    private static final Pattern NAME_PATTERN = Pattern.compile(NAME_REGEX);

    private ExpositionUtils() {}

    /**
     * Checks if the character may start a metric or label name.
     * <pre>
     *   name-initial-char = ALPHA / "_" / ":"
     * </pre>
     *
     * @param c the character, or {@code -1} for end of input
     * @return {@code true} if the character is an ASCII letter, underscore or colon
     */
    public static boolean isNameStart(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == ':';
    }

    /**
     * Checks if the character may appear after the first character of a metric or label name.
     * <pre>
     *   name-char = name-initial-char / DIGIT
     * </pre>
     *
     * @param c the character, or {@code -1} for end of input
     * @return {@code true} if the character is a name start character or an ASCII digit
     */
    public static boolean isNameChar(int c) {
        return isNameStart(c) || (c >= '0' && c <= '9');
    }

    /**
     * Validates that the provided metric or label name adheres to the required character set. <br>
     * Pattern to validate is: {@value #NAME_REGEX}
     *
     * @param name the name to validate
     * @return the validated name
     * @throws NullPointerException if name is {@code null}
     * @throws IllegalArgumentException if name is empty or contains invalid characters
     */
    @NonNull
    public static String validateName(@NonNull String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException(
                    "Name contains illegal character: " + name + ". Required pattern is " + NAME_REGEX);
        }
        return name;
    }

    /**
     * Escape backslash {@code \}, double quote {@code "} and newline {@code \n} characters in label values.
     *
     * @param value the label value to escape
     * @return the escaped value
     */
    @NonNull
    public static String escapeLabelValue(@NonNull String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    /**
     * Escape backslash {@code \} and newline {@code \n} characters in help text.
     *
     * @param help the help text to escape
     * @return the escaped help text
     */
    @NonNull
    public static String escapeHelpText(@NonNull String help) {
        return help.replace("\\", "\\\\").replace("\n", "\\n");
    }

    /**
     * Reverses {@link #escapeHelpText(String)}. Any other backslash sequence is kept verbatim.
     *
     * @param help the escaped help text as found on a {@code # HELP} line
     * @return the unescaped help text
     */
    @NonNull
    public static String unescapeHelpText(@NonNull String help) {
        if (help.indexOf('\\') < 0) {
            return help;
        }
        StringBuilder unescaped = new StringBuilder(help.length());
        for (int i = 0; i < help.length(); i++) {
            char c = help.charAt(i);
            if (c == '\\' && i + 1 < help.length()) {
                char next = help.charAt(i + 1);
                if (next == '\\') {
                    unescaped.append('\\');
                    i++;
                    continue;
                } else if (next == 'n') {
                    unescaped.append('\n');
                    i++;
                    continue;
                }
            }
            unescaped.append(c);
        }
        return unescaped.toString();
    }
}
