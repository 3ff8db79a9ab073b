/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank;

/**
 * Tunables read from system properties.
 * <p>
 * Properties are read on every call, so they can be changed at runtime:
 * <ul>
 *   <li>{@value #HEAD_ROWS_PROPERTY} - rows printed by {@code DataFrame.head()}, default {@value #DEFAULT_HEAD_ROWS}</li>
 *   <li>{@value #SORT_PARALLEL_THRESHOLD_PROPERTY} - minimum column count for reordering
 *       columns in parallel when sorting a table, {@code 0} (the default) disables it</li>
 * </ul>
 * </p>
 */
public final class PlankSettings {

    public static final String HEAD_ROWS_PROPERTY = "plank.head.rows";
    public static final String SORT_PARALLEL_THRESHOLD_PROPERTY = "plank.sort.parallelThreshold";

    public static final int DEFAULT_HEAD_ROWS = 5;
    public static final int DEFAULT_SORT_PARALLEL_THRESHOLD = 0;

    private static final System.Logger LOG = System.getLogger(PlankSettings.class.getName());

    private PlankSettings() {
    }

    public static int headRows() {
        return nonNegativeInt(HEAD_ROWS_PROPERTY, DEFAULT_HEAD_ROWS);
    }

    public static int sortParallelThreshold() {
        return nonNegativeInt(SORT_PARALLEL_THRESHOLD_PROPERTY, DEFAULT_SORT_PARALLEL_THRESHOLD);
    }

    private static int nonNegativeInt(String property, int defaultValue) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            LOG.log(System.Logger.Level.WARNING, "Ignoring non-numeric value of property " + property, e);
            return defaultValue;
        }
        if (parsed >= 0) {
            return parsed;
        }
        LOG.log(System.Logger.Level.WARNING, "Ignoring negative value {0} of property {1}, using {2}",
                parsed, property, defaultValue);
        return defaultValue;
    }
}
