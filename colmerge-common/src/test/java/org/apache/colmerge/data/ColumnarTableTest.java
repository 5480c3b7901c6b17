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

package org.apache.colmerge.data;

import org.apache.colmerge.data.categorical.GlobalDictionary;
import org.apache.colmerge.data.categorical.StringInterner;
import org.apache.colmerge.data.columnar.CategoricalColumnVector;
import org.apache.colmerge.data.columnar.heap.HeapIntVector;
import org.apache.colmerge.types.DataTypes;
import org.apache.colmerge.types.RowType;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;

import static org.apache.colmerge.data.DataFormatTestUtil.column;
import static org.apache.colmerge.data.DataFormatTestUtil.intColumn;
import static org.apache.colmerge.data.DataFormatTestUtil.toStrings;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Column} and {@link ColumnarTable}. */
public class ColumnarTableTest {

    @Test
    public void testValuesRoundTrip() {
        LocalDateTime noon = LocalDateTime.of(2024, 2, 29, 12, 0, 0, 123_456_000);
        ColumnarTable table =
                ColumnarTable.of(
                        intColumn("id", 1, null, 3),
                        column("flag", DataTypes.BOOLEAN(), true, false, null),
                        column("ratio", DataTypes.DOUBLE(), 0.5, null, -2.0),
                        column("name", DataTypes.STRING(), "x", "", null),
                        column("day", DataTypes.DATE(), LocalDate.of(1969, 12, 31), null, 0),
                        column("at", DataTypes.TIMESTAMP(), noon, -1L, null),
                        column("cat", DataTypes.CATEGORICAL(), "b", "a", "b"));

        assertThat(table.numRows()).isEqualTo(3);
        assertThat(table.numColumns()).isEqualTo(7);
        assertThat(toStrings(table))
                .containsExactly(
                        "1, true, 0.5, x, 1969-12-31, 2024-02-29T12:00:00.123456, b",
                        "NULL, false, NULL, , NULL, 1969-12-31T23:59:59.999999, a",
                        "3, NULL, -2.0, NULL, 1970-01-01, NULL, b");
    }

    @Test
    public void testNestedValuesRoundTrip() {
        RowType point =
                RowType.builder().field("x", DataTypes.INT()).field("y", DataTypes.INT()).build();
        Column points =
                Column.of(
                        "p",
                        point,
                        Arrays.asList(Arrays.asList(1, 2), null, Arrays.asList(null, 4)));
        Column lists =
                Column.of(
                        "l",
                        DataTypes.ARRAY(DataTypes.STRING()),
                        Arrays.asList(Arrays.asList("a", "b"), Arrays.asList(), null));

        assertThat(toStrings(ColumnarTable.of(points, lists)))
                .containsExactly("[1, 2], [a, b]", "NULL, []", "[NULL, 4], NULL");
    }

    @Test
    public void testColumnAccess() {
        ColumnarTable table = ColumnarTable.of(intColumn("a", 1), intColumn("b", 2));
        assertThat(table.getColumn("b").getObject(0)).isEqualTo(2);
        assertThat(table.getColumn(0).name()).isEqualTo("a");
        assertThat(table.rowType().getFieldNames()).containsExactly("a", "b");
        assertThatThrownBy(() -> table.getColumn("c"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Column 'c' does not exist.");
    }

    @Test
    public void testColumnsMustHaveTheSameLength() {
        assertThatThrownBy(() -> ColumnarTable.of(intColumn("a", 1, 2), intColumn("b", 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Column 'b' has 1 rows, expected 2.");
    }

    @Test
    public void testSchemaEquals() {
        ColumnarTable ints = ColumnarTable.of(intColumn("a", 1));
        ColumnarTable otherInts = ColumnarTable.of(intColumn("a", 5, 6));
        ColumnarTable renamed = ColumnarTable.of(intColumn("b", 1));
        ColumnarTable longs = ColumnarTable.of(column("a", DataTypes.BIGINT(), 1L));

        assertThat(ints.schemaEquals(otherInts)).isTrue();
        assertThat(ints.schemaEquals(renamed)).isFalse();
        assertThat(ints.schemaEquals(longs)).isFalse();
    }

    @Test
    public void testPhysicalViewSharesData() {
        Column text = column("s", DataTypes.STRING(), "hi", null);
        Column physical = text.toPhysical();

        assertThat(physical.type()).isEqualTo(DataTypes.BYTES());
        assertThat(physical.vector()).isSameAs(text.vector());
        assertThat(physical.getObject(0)).isEqualTo("hi".getBytes());

        Column back = physical.fromPhysicalUnchecked(DataTypes.STRING());
        assertThat(back.toObjectList()).containsExactly("hi", null);
        assertThat(column("i", DataTypes.INT(), 1).toPhysical().type())
                .isEqualTo(DataTypes.INT());
    }

    @Test
    public void testGlobalCategoricalColumn() {
        StringInterner interner = new StringInterner();
        Column column =
                Column.ofGlobal(
                        "c", DataTypes.CATEGORICAL(), interner, Arrays.asList("u", null, "v"));
        CategoricalColumnVector vector = (CategoricalColumnVector) column.vector();

        assertThat(vector.getDictionary()).isInstanceOf(GlobalDictionary.class);
        assertThat(vector.getInt(2)).isEqualTo(interner.intern("v"));
        assertThat(column.toObjectList()).containsExactly("u", null, "v");
    }

    @Test
    public void testHeapVectorGrows() {
        HeapIntVector vector = new HeapIntVector(1);
        for (int i = 0; i < 100; i++) {
            vector.appendInt(i);
        }
        vector.appendNull();
        assertThat(vector.getElementsAppended()).isEqualTo(101);
        assertThat(vector.getInt(99)).isEqualTo(99);
        assertThat(vector.isNullAt(100)).isTrue();
        assertThat(vector.isNullAt(0)).isFalse();
    }
}
