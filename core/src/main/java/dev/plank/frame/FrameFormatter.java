/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.frame;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import dev.plank.series.Series;
import dev.plank.series.SeriesData;

/**
 * Tab-separated text rendering of a table.
 * <p>
 * The header line is a tab followed by each column name and a tab. Each row line is the
 * row position and a tab, followed by each cell's text and a tab. Every line ends with a
 * newline.
 * </p>
 *
 * <pre>
 * \tA\tB\t
 * 0\t1\t1.5\t
 * 1\t2\t2.0\t
 * </pre>
 */
public final class FrameFormatter {

    private FrameFormatter() {
    }

    /**
     * Renders all rows of the table.
     */
    public static String render(DataFrame frame) {
        return render(frame, frame.rowCount());
    }

    /**
     * Writes the first {@code min(rows, rowCount)} rows of the table to {@code out}.
     */
    public static void head(DataFrame frame, int rows, PrintStream out) {
        out.print(render(frame, Math.max(0, Math.min(rows, frame.rowCount()))));
        out.flush();
    }

    private static String render(DataFrame frame, int rows) {
        List<Series> columns = frame.columns();
        List<SeriesData> data = new ArrayList<>(columns.size());

        StringBuilder sb = new StringBuilder();
        sb.append('\t');
        for (Series column : columns) {
            sb.append(column.name()).append('\t');
            data.add(column.data());
        }
        sb.append('\n');

        for (int row = 0; row < rows; row++) {
            sb.append(row).append('\t');
            for (SeriesData values : data) {
                sb.append(values.text(row)).append('\t');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
