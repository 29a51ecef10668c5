// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.exposition.grammar;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Result of a grammar rule that matched: the recognized value and the input left after it.
 *
 * @param value the recognized value
 * @param rest  the input following the consumed prefix
 * @param <T>   type of the recognized value
 */
public record Parsed<T>(@NonNull T value, @NonNull TextInput rest) {}
