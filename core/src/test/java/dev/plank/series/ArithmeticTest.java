/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.series;

import org.junit.jupiter.api.Test;

import dev.plank.exception.InvalidTypeException;
import dev.plank.exception.UnsupportedKindException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for arithmetic, promotion and concatenation between column storages.
 */
public class ArithmeticTest {

    // ==================== Same Kind ====================

    @Test
    void testIntegerOperations() {
        SeriesData a = SeriesData.ofLongs(7, 8, -9);
        SeriesData b = SeriesData.ofLongs(2, 4, 2);

        assertThat(Arithmetic.add(a, b)).isEqualTo(SeriesData.ofLongs(9, 12, -7));
        assertThat(Arithmetic.sub(a, b)).isEqualTo(SeriesData.ofLongs(5, 4, -11));
        assertThat(Arithmetic.mul(a, b)).isEqualTo(SeriesData.ofLongs(14, 32, -18));
        // Integer division truncates towards zero
        assertThat(Arithmetic.div(a, b)).isEqualTo(SeriesData.ofLongs(3, 2, -4));
    }

    @Test
    void testFloatOperations() {
        SeriesData a = SeriesData.ofDoubles(1.5, 3.0);
        SeriesData b = SeriesData.ofDoubles(0.5, 2.0);

        assertThat(Arithmetic.add(a, b)).isEqualTo(SeriesData.ofDoubles(2.0, 5.0));
        assertThat(Arithmetic.sub(a, b)).isEqualTo(SeriesData.ofDoubles(1.0, 1.0));
        assertThat(Arithmetic.mul(a, b)).isEqualTo(SeriesData.ofDoubles(0.75, 6.0));
        assertThat(Arithmetic.div(a, b)).isEqualTo(SeriesData.ofDoubles(3.0, 1.5));
    }

    @Test
    void testIntegerDivisionByZero() {
        assertThatThrownBy(() -> Arithmetic.div(SeriesData.ofLongs(1), SeriesData.ofLongs(0)))
                .isInstanceOf(ArithmeticException.class);
    }

    @Test
    void testFloatDivisionByZero() {
        SeriesData result = Arithmetic.div(SeriesData.ofDoubles(1.0), SeriesData.ofDoubles(0.0));

        assertThat(result.get(0)).isEqualTo(DType.of(Double.POSITIVE_INFINITY));
    }

    // ==================== Promotion ====================

    @Test
    void testIntegerPromotedWhenOnTheLeft() {
        SeriesData result = Arithmetic.sub(SeriesData.ofLongs(5, 6), SeriesData.ofDoubles(0.5, 1.5));

        assertThat(result.kind()).isEqualTo(Kind.FLOAT);
        assertThat(result).isEqualTo(SeriesData.ofDoubles(4.5, 4.5));
    }

    @Test
    void testIntegerPromotedWhenOnTheRight() {
        SeriesData result = Arithmetic.div(SeriesData.ofDoubles(3.0, 1.0), SeriesData.ofLongs(2, 4));

        assertThat(result).isEqualTo(SeriesData.ofDoubles(1.5, 0.25));
    }

    // ==================== Text ====================

    @Test
    void testStringAddConcatenatesSequences() {
        SeriesData result = Arithmetic.add(SeriesData.ofStrings("a", "b"), SeriesData.ofStrings("c"));

        assertThat(result).isEqualTo(SeriesData.ofStrings("a", "b", "c"));
        assertThat(result.length()).isEqualTo(3);
    }

    @Test
    void testStringSubIsUnsupported() {
        assertThatThrownBy(() -> Arithmetic.sub(SeriesData.ofStrings("a"), SeriesData.ofStrings("b")))
                .isInstanceOf(UnsupportedKindException.class)
                .hasMessageContaining("-");
    }

    // ==================== Unsupported ====================

    @Test
    void testBooleanOperandsAreUnsupported() {
        for (Arithmetic.Op op : Arithmetic.Op.values()) {
            assertThatThrownBy(() -> Arithmetic.apply(op, SeriesData.ofBooleans(true), SeriesData.ofLongs(1)))
                    .isInstanceOf(UnsupportedKindException.class)
                    .hasMessageContaining("BOOL");
        }
    }

    @Test
    void testStringWithNumberIsUnsupported() {
        assertThatThrownBy(() -> Arithmetic.add(SeriesData.ofStrings("1"), SeriesData.ofLongs(1)))
                .isInstanceOfSatisfying(UnsupportedKindException.class, e -> {
                    assertThat(e.left()).isEqualTo(Kind.STR);
                    assertThat(e.right()).isEqualTo(Kind.INT);
                });
    }

    @Test
    void testLengthMismatchFails() {
        assertThatThrownBy(() -> Arithmetic.mul(SeriesData.ofLongs(1, 2), SeriesData.ofDoubles(1.0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lengths differ");
    }

    // ==================== Merge ====================

    @Test
    void testMergeConcatenatesEveryKind() throws Exception {
        assertThat(Arithmetic.merge(SeriesData.ofLongs(1), SeriesData.ofLongs(2, 3)))
                .isEqualTo(SeriesData.ofLongs(1, 2, 3));
        assertThat(Arithmetic.merge(SeriesData.ofDoubles(1.0), SeriesData.ofDoubles(2.0)))
                .isEqualTo(SeriesData.ofDoubles(1.0, 2.0));
        assertThat(Arithmetic.merge(SeriesData.ofBooleans(true), SeriesData.ofBooleans()))
                .isEqualTo(SeriesData.ofBooleans(true));
        assertThat(Arithmetic.merge(SeriesData.ofStrings(), SeriesData.ofStrings("z")))
                .isEqualTo(SeriesData.ofStrings("z"));
    }

    @Test
    void testMergeOfDifferentKindsIsRecoverable() {
        assertThatThrownBy(() -> Arithmetic.merge(SeriesData.ofLongs(1), SeriesData.ofBooleans(true)))
                .isInstanceOf(InvalidTypeException.class);
    }
}
