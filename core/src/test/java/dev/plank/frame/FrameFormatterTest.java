/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.frame;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.plank.PlankSettings;
import dev.plank.series.Series;

import static org.assertj.core.api.Assertions.assertThat;

public class FrameFormatterTest {

    private DataFrame df;

    @BeforeEach
    void setUp() throws Exception {
        df = DataFrame.of(
                Series.ofLongs("A", 1, 2, 3, 4, 5, 6),
                Series.ofDoubles("B", 1.5, 2.0, 3.5, 4.0, 5.5, 6.0),
                Series.ofBooleans("C", true, false, true, false, true, false),
                Series.ofStrings("D", "a b", "c", "d", "e", "f", "g"));
    }

    @AfterEach
    void clearProperties() {
        System.clearProperty(PlankSettings.HEAD_ROWS_PROPERTY);
    }

    @Test
    void testRender() throws Exception {
        String rendered = FrameFormatter.render(df.limit(2));

        assertThat(rendered).isEqualTo(
                "\tA\tB\tC\tD\t\n"
                        + "0\t1\t1.5\ttrue\ta b\t\n"
                        + "1\t2\t2.0\tfalse\tc\t\n");
        assertThat(df.limit(2)).hasToString(rendered);
    }

    @Test
    void testRenderEmptyTable() {
        assertThat(FrameFormatter.render(DataFrame.empty())).isEqualTo("\t\n");
    }

    @Test
    void testHeadTruncates() {
        String head = head(3);

        assertThat(head.split("\n")).hasSize(4);
        assertThat(head).endsWith("2\t3\t3.5\ttrue\td\t\n");
    }

    @Test
    void testHeadBeyondRowCount() {
        assertThat(head(100)).isEqualTo(FrameFormatter.render(df));
    }

    @Test
    void testHeadUsesConfiguredDefault() {
        System.setProperty(PlankSettings.HEAD_ROWS_PROPERTY, "1");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream original = System.out;
        System.setOut(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        try {
            df.head();
        }
        finally {
            System.setOut(original);
        }

        assertThat(bytes.toString(StandardCharsets.UTF_8)).isEqualTo(FrameFormatter.render(df.limit(1)));
    }

    private String head(int rows) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        df.head(rows, new PrintStream(bytes, true, StandardCharsets.UTF_8));
        return bytes.toString(StandardCharsets.UTF_8);
    }
}
