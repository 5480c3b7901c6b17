/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.colmerge.merge;

import org.apache.colmerge.data.Column;
import org.apache.colmerge.data.categorical.StringInterner;
import org.apache.colmerge.types.CategoricalOrdering;
import org.apache.colmerge.types.DataTypes;
import org.apache.colmerge.types.RowType;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

import static org.apache.colmerge.data.DataFormatTestUtil.column;
import static org.apache.colmerge.data.DataFormatTestUtil.intColumn;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link MergeIndicatorGenerator}. */
public class MergeIndicatorGeneratorTest {

    private static Stream<Arguments> examples() {
        int[] a = {1, 2, 4, 6, 9};
        int[] b = {2, 3, 4, 5, 10};
        int[] c = {5, 6, 7, 10};
        int[] d = {1, 2, 5};
        return Stream.of(
                Arguments.of(a, b, "TTFFTFFTTF"),
                Arguments.of(b, a, "FTFTTFTFFT"),
                Arguments.of(c, d, "FFTFTTT"),
                Arguments.of(d, c, "TTTFFFF"),
                Arguments.of(new int[0], d, "FFF"),
                Arguments.of(c, new int[0], "TTTT"),
                Arguments.of(new int[0], new int[0], ""));
    }

    @ParameterizedTest
    @MethodSource("examples")
    public void testExamples(int[] left, int[] right, String expected) {
        MergeIndicator indicator = MergeIndicatorGenerator.generate(left, right);
        assertThat(indicator.toString()).isEqualTo(expected);
        assertThat(indicator.size()).isEqualTo(left.length + right.length);
        assertThat(indicator.leftCount()).isEqualTo(left.length);
        assertThat(indicator.rightCount()).isEqualTo(right.length);
    }

    @Test
    public void testDecodedSequenceIsAStableMerge() {
        Random random = new Random(20240229L);
        for (int round = 0; round < 200; round++) {
            int[] left = sortedRandom(random, random.nextInt(30));
            int[] right = sortedRandom(random, random.nextInt(30));

            MergeIndicator indicator = MergeIndicatorGenerator.generate(left, right);

            // tag = side * 1000 + index; a stable sort of left-then-right prefers the left on ties
            List<int[]> expected = new ArrayList<>();
            for (int i = 0; i < left.length; i++) {
                expected.add(new int[] {left[i], i});
            }
            for (int j = 0; j < right.length; j++) {
                expected.add(new int[] {right[j], 1000 + j});
            }
            expected.sort(Comparator.comparingInt(e -> e[0]));

            int i = 0;
            int j = 0;
            for (int k = 0; k < indicator.size(); k++) {
                int tag = indicator.isLeft(k) ? i++ : 1000 + j++;
                assertThat(tag).isEqualTo(expected.get(k)[1]);
            }
            assertThat(i).isEqualTo(left.length);
            assertThat(j).isEqualTo(right.length);
        }
    }

    @Test
    public void testNaNFollowsComparisonOperator() {
        // NaN <= x never holds, so a NaN head on the left yields to every right value
        MergeIndicator indicator =
                MergeIndicatorGenerator.generate(
                        new double[] {1.0, Double.NaN}, new double[] {2.0, 3.0});
        assertThat(indicator.toString()).isEqualTo("TFFT");
    }

    @Test
    public void testComparables() {
        MergeIndicator indicator =
                MergeIndicatorGenerator.generate(
                        Arrays.asList("apple", "banana"), Collections.singletonList("apricot"));
        assertThat(indicator.toString()).isEqualTo("TFT");
    }

    @Test
    public void testNullsComeFirst() {
        MergeIndicator indicator =
                MergeIndicatorGenerator.generate(
                        intColumn("k", null, 1, 3), intColumn("k", null, 2));
        assertThat(indicator.toString()).isEqualTo("TFTFT");
    }

    @Test
    public void testTextComparesBytes() {
        MergeIndicator indicator =
                MergeIndicatorGenerator.generate(
                        column("k", DataTypes.STRING(), "Zed", "apple", "é"),
                        column("k", DataTypes.STRING(), "apricot", "z"));
        assertThat(indicator.toString()).isEqualTo("TTFFT");
    }

    @Test
    public void testStructKeysUseRowEncoding() {
        RowType type =
                RowType.builder()
                        .field("a", DataTypes.INT())
                        .field("b", DataTypes.STRING())
                        .build();
        MergeIndicator indicator =
                MergeIndicatorGenerator.generate(
                        Column.of(
                                "k",
                                type,
                                Arrays.asList(Arrays.asList(1, "a"), Arrays.asList(2, "a"))),
                        Column.of("k", type, Collections.singletonList(Arrays.asList(1, "b"))));
        assertThat(indicator.toString()).isEqualTo("TFT");
    }

    @Test
    public void testLexicalCategoricalsCompareDecodedStrings() {
        StringInterner interner = new StringInterner();
        interner.intern("zebra");
        interner.intern("apple");
        interner.intern("mango");

        MergeIndicator lexical =
                MergeIndicatorGenerator.generate(
                        Column.ofGlobal(
                                "k",
                                DataTypes.CATEGORICAL(CategoricalOrdering.LEXICAL),
                                interner,
                                Arrays.asList("apple", "zebra")),
                        Column.ofGlobal(
                                "k",
                                DataTypes.CATEGORICAL(CategoricalOrdering.LEXICAL),
                                interner,
                                Collections.singletonList("mango")));
        assertThat(lexical.toString()).isEqualTo("TFT");

        MergeIndicator physical =
                MergeIndicatorGenerator.generate(
                        Column.ofGlobal(
                                "k",
                                DataTypes.CATEGORICAL(),
                                interner,
                                Arrays.asList("apple", "zebra")),
                        Column.ofGlobal(
                                "k",
                                DataTypes.CATEGORICAL(),
                                interner,
                                Collections.singletonList("mango")));
        assertThat(physical.toString()).isEqualTo("TTF");
    }

    @Test
    public void testKeyTypesMustMatch() {
        assertThatThrownBy(
                        () ->
                                MergeIndicatorGenerator.generate(
                                        intColumn("k", 1), column("k", DataTypes.BIGINT(), 1L)))
                .isInstanceOf(DataTypeMismatchException.class)
                .hasMessage("merge-sort datatype mismatch: INT != BIGINT");
    }

    @Test
    public void testFirstUnsortedRow() {
        assertThat(MergeIndicatorGenerator.firstUnsortedRow(intColumn("k", null, 1, 1, 2)))
                .isEqualTo(-1);
        assertThat(MergeIndicatorGenerator.firstUnsortedRow(intColumn("k", 1, 3, 2))).isEqualTo(2);
        assertThat(MergeIndicatorGenerator.firstUnsortedRow(intColumn("k", 1, null))).isEqualTo(1);
        assertThat(MergeIndicatorGenerator.firstUnsortedRow(intColumn("k"))).isEqualTo(-1);
    }

    private static int[] sortedRandom(Random random, int length) {
        int[] values = new int[length];
        for (int i = 0; i < length; i++) {
            values[i] = random.nextInt(20) - 10;
        }
        Arrays.sort(values);
        return values;
    }
}
