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

package org.apache.colmerge.sort;

import org.apache.colmerge.data.Column;
import org.apache.colmerge.types.CategoricalOrdering;
import org.apache.colmerge.types.DataType;
import org.apache.colmerge.types.DataTypes;
import org.apache.colmerge.types.RowType;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link RowEncoder} and {@link OrderedBytes}. */
public class RowEncoderTest {

    @Test
    public void testIntegersKeepOrder() {
        assertAscending(
                DataTypes.INT(), null, Integer.MIN_VALUE, -7, -1, 0, 1, 42, Integer.MAX_VALUE);
        assertAscending(DataTypes.TINYINT(), null, (byte) -128, (byte) -1, (byte) 0, (byte) 127);
        assertAscending(DataTypes.SMALLINT(), (short) -32768, (short) -1, (short) 0, (short) 300);
        assertAscending(DataTypes.BIGINT(), Long.MIN_VALUE, -1L, 0L, 1L << 40, Long.MAX_VALUE);
    }

    @Test
    public void testFloatingPointKeepsOrder() {
        assertAscending(
                DataTypes.DOUBLE(),
                null,
                Double.NEGATIVE_INFINITY,
                -1.5,
                -0.0,
                0.0,
                Double.MIN_VALUE,
                2.25,
                Double.POSITIVE_INFINITY);
        assertAscending(DataTypes.FLOAT(), -3.5f, -0.25f, 0.0f, 1.0f, Float.MAX_VALUE);
    }

    @Test
    public void testBytesKeepOrder() {
        assertAscending(DataTypes.STRING(), null, "", "a", "a\u0000", "a\u0000b", "ab", "b", "é");
        assertAscending(
                DataTypes.BYTES(),
                new byte[0],
                new byte[] {0},
                new byte[] {0, 0},
                new byte[] {1},
                new byte[] {(byte) 0x80});
    }

    @Test
    public void testArraysCompareElementWise() {
        DataType type = DataTypes.ARRAY(DataTypes.INT());
        assertAscending(
                type,
                null,
                Arrays.asList(),
                Arrays.asList((Integer) null),
                Arrays.asList(-1),
                Arrays.asList(1),
                Arrays.asList(1, 2),
                Arrays.asList(1, 3),
                Arrays.asList(2));
    }

    @Test
    public void testRowsCompareFieldByField() {
        RowType type =
                RowType.builder()
                        .field("name", DataTypes.STRING())
                        .field("rank", DataTypes.INT())
                        .build();
        assertAscending(
                type,
                null,
                Arrays.asList(null, 5),
                Arrays.asList("a", null),
                Arrays.asList("a", 1),
                Arrays.asList("a", 2),
                Arrays.asList("ab", 0),
                Arrays.asList("b", -10));
    }

    @Test
    public void testCategoricalEncoding() {
        // codes follow first appearance: zebra=0, apple=1, mango=2
        List<String> values = Arrays.asList("zebra", "apple", "mango");

        byte[][] physical =
                RowEncoder.encode(Column.of("c", DataTypes.CATEGORICAL(), values));
        assertThat(OrderedBytes.compareUnsigned(physical[0], physical[1])).isNegative();

        byte[][] lexical =
                RowEncoder.encode(
                        Column.of(
                                "c", DataTypes.CATEGORICAL(CategoricalOrdering.LEXICAL), values));
        assertThat(OrderedBytes.compareUnsigned(lexical[1], lexical[2])).isNegative();
        assertThat(OrderedBytes.compareUnsigned(lexical[2], lexical[0])).isNegative();
    }

    @Test
    public void testCompareUnsigned() {
        assertThat(OrderedBytes.compareUnsigned(new byte[] {1}, new byte[] {(byte) 0xFF}))
                .isNegative();
        assertThat(OrderedBytes.compareUnsigned(new byte[] {1}, new byte[] {1, 0})).isNegative();
        assertThat(OrderedBytes.compareUnsigned(new byte[] {7, 7}, new byte[] {7, 7})).isZero();
    }

    private static void assertAscending(DataType type, Object... values) {
        byte[][] encoded = RowEncoder.encode(Column.of("k", type, Arrays.asList(values)));
        for (int i = 1; i < encoded.length; i++) {
            assertThat(OrderedBytes.compareUnsigned(encoded[i - 1], encoded[i]))
                    .as("%s should sort before %s", values[i - 1], values[i])
                    .isNegative();
        }
    }
}
