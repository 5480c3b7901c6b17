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
import org.apache.colmerge.data.ColumnarTable;
import org.apache.colmerge.data.categorical.Dictionary;
import org.apache.colmerge.data.categorical.StringInterner;
import org.apache.colmerge.data.columnar.CategoricalColumnVector;
import org.apache.colmerge.options.Options;
import org.apache.colmerge.types.DataTypes;
import org.apache.colmerge.types.RowType;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.apache.colmerge.data.DataFormatTestUtil.column;
import static org.apache.colmerge.data.DataFormatTestUtil.intColumn;
import static org.apache.colmerge.data.DataFormatTestUtil.toStrings;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link SortedTableMerger}. */
public class SortedTableMergerTest {

    private static final StringInterner SHARED_INTERNER = new StringInterner();

    private final SortedTableMerger merger = new SortedTableMerger();

    @Test
    public void testMergeIsStableAndLeftBiased() {
        ColumnarTable left =
                ColumnarTable.of(
                        intColumn("k", 1, 2, 4, 6, 9),
                        column("v", DataTypes.STRING(), "l1", "l2", "l3", "l4", "l5"));
        ColumnarTable right =
                ColumnarTable.of(
                        intColumn("k", 2, 3, 4, 5, 10),
                        column("v", DataTypes.STRING(), "r1", "r2", "r3", "r4", "r5"));

        ColumnarTable merged = merger.mergeSorted(left, right, "k");

        assertThat(merged.numRows()).isEqualTo(10);
        assertThat(merged.rowType().getFieldNames()).containsExactly("k", "v");
        assertThat(toStrings(merged))
                .containsExactly(
                        "1, l1", "2, l2", "2, r1", "3, r2", "4, l3", "4, r3", "5, r4", "6, l4",
                        "9, l5", "10, r5");
    }

    @Test
    public void testExplicitKeysAndColumnNamesFromLeft() {
        ColumnarTable left = ColumnarTable.of(intColumn("a", 5, 6, 7, 10));
        ColumnarTable right = ColumnarTable.of(intColumn("b", 1, 2, 5));

        ColumnarTable merged =
                merger.mergeSorted(left, right, left.getColumn(0), right.getColumn(0), false);

        assertThat(merged.getColumn(0).name()).isEqualTo("a");
        assertThat(merged.getColumn(0).toObjectList()).containsExactly(1, 2, 5, 5, 6, 7, 10);
    }

    @Test
    public void testEmptySidesShortCircuit() {
        StringInterner interner = new StringInterner();
        ColumnarTable full =
                ColumnarTable.of(
                        intColumn("k", 1, 2),
                        Column.ofGlobal(
                                "c", DataTypes.CATEGORICAL(), interner, Arrays.asList("a", "b")));
        ColumnarTable empty =
                ColumnarTable.of(
                        intColumn("k"),
                        Column.ofGlobal(
                                "c", DataTypes.CATEGORICAL(), interner, Collections.emptyList()));
        Dictionary dictionary = dictionaryOf(full.getColumn("c"));

        ColumnarTable rightEmpty = merger.mergeSorted(full, empty, "k");
        ColumnarTable leftEmpty = merger.mergeSorted(empty, full, "k");

        assertThat(rightEmpty).isSameAs(full);
        assertThat(leftEmpty).isSameAs(full);
        assertThat(dictionaryOf(rightEmpty.getColumn("c"))).isSameAs(dictionary);
        assertThat(merger.mergeSorted(empty, empty, "k")).isSameAs(empty);
    }

    @Test
    public void testGlobalCategoricalUnion() {
        StringInterner interner = new StringInterner();
        ColumnarTable left =
                ColumnarTable.of(
                        intColumn("k", 1, 3, 5),
                        Column.ofGlobal(
                                "c",
                                DataTypes.CATEGORICAL(),
                                interner,
                                Arrays.asList("red", "green", "red")));
        ColumnarTable right =
                ColumnarTable.of(
                        intColumn("k", 2, 4),
                        Column.ofGlobal(
                                "c",
                                DataTypes.CATEGORICAL(),
                                interner,
                                Arrays.asList("blue", "green")));

        ColumnarTable merged = merger.mergeSorted(left, right, "k");

        Column categories = merged.getColumn("c");
        assertThat(categories.toObjectList())
                .containsExactly("red", "blue", "green", "green", "red");
        Dictionary dictionary = dictionaryOf(categories);
        assertThat(dictionary.size()).isEqualTo(3);
        assertThat(dictionary).isNotSameAs(dictionaryOf(left.getColumn("c")));
        assertThat(dictionaryOf(left.getColumn("c")).size()).isEqualTo(2);
    }

    @Test
    public void testCategoricalKeyWithSharedLocalDictionary() {
        ColumnarTable left =
                ColumnarTable.of(column("k", DataTypes.CATEGORICAL(), "a", "b"));
        ColumnarTable right =
                ColumnarTable.of(column("k", DataTypes.CATEGORICAL(), "a", "b", "b"));

        ColumnarTable merged = merger.mergeSorted(left, right, "k");

        assertThat(merged.getColumn("k").toObjectList()).containsExactly("a", "a", "b", "b", "b");
        assertThat(dictionaryOf(merged.getColumn("k")))
                .isSameAs(dictionaryOf(left.getColumn("k")));
    }

    @Test
    public void testLocalCategoricalMismatch() {
        ColumnarTable left = ColumnarTable.of(column("k", DataTypes.CATEGORICAL(), "a", "b"));
        ColumnarTable right = ColumnarTable.of(column("k", DataTypes.CATEGORICAL(), "b", "c"));

        assertThatThrownBy(() -> merger.mergeSorted(left, right, "k"))
                .isInstanceOf(IncompatibleCategoricalsException.class);
    }

    @Test
    public void testNestedCategoricalKeyMismatch() {
        RowType keyType = RowType.builder().field("tag", DataTypes.CATEGORICAL()).build();
        Column leftKey =
                Column.of(
                        "k",
                        keyType,
                        Arrays.asList(
                                Collections.singletonList("a"), Collections.singletonList("b")));
        Column rightKey =
                Column.of("k", keyType, Collections.singletonList(Collections.singletonList("b")));
        ColumnarTable left = ColumnarTable.of(intColumn("v", 1, 2));
        ColumnarTable right = ColumnarTable.of(intColumn("v", 3));

        assertThatThrownBy(() -> merger.mergeSorted(left, right, leftKey, rightKey, false))
                .isInstanceOf(IncompatibleCategoricalsException.class)
                .hasMessageContaining("'k'")
                .hasMessageContaining("local dictionaries differ");
    }

    @Test
    public void testCategoricalValueColumnMismatchAbortsMerge() {
        ColumnarTable left =
                ColumnarTable.of(intColumn("k", 1), column("c", DataTypes.CATEGORICAL(), "x"));
        ColumnarTable right =
                ColumnarTable.of(intColumn("k", 2), column("c", DataTypes.CATEGORICAL(), "y"));

        assertThatThrownBy(() -> merger.mergeSorted(left, right, "k"))
                .isInstanceOf(IncompatibleCategoricalsException.class)
                .hasMessageContaining("'c'");
    }

    @Test
    public void testSchemaMismatch() {
        ColumnarTable left = ColumnarTable.of(intColumn("k", 1), intColumn("v", 1));
        ColumnarTable right =
                ColumnarTable.of(intColumn("k", 2), column("v", DataTypes.STRING(), "x"));

        assertThatThrownBy(() -> merger.mergeSorted(left, right, "k"))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessage(
                        "Cannot merge tables with different schemas: column 1 is `v` INT on the "
                                + "left but `v` STRING on the right.");

        ColumnarTable wider =
                ColumnarTable.of(intColumn("k", 2), intColumn("v", 2), intColumn("w", 2));
        assertThatThrownBy(() -> merger.mergeSorted(left, wider, "k"))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("left has 2 columns, right has 3");
    }

    @Test
    public void testSchemaCheckCanBeDisabled() {
        ColumnarTable left = ColumnarTable.of(intColumn("k", 1), intColumn("x", 10));
        ColumnarTable right = ColumnarTable.of(intColumn("k", 0), intColumn("y", 20));

        ColumnarTable merged =
                new SortedTableMerger(
                                new Options().set(MergeSortedOptions.CHECK_SCHEMA, false))
                        .mergeSorted(left, right, "k");

        assertThat(merged.rowType().getFieldNames()).containsExactly("k", "x");
        assertThat(toStrings(merged)).containsExactly("0, 20", "1, 10");
    }

    @Test
    public void testKeyTypeMismatch() {
        ColumnarTable left = ColumnarTable.of(intColumn("k", 1));
        ColumnarTable right = ColumnarTable.of(column("k", DataTypes.BIGINT(), 1L));

        assertThatThrownBy(
                        () ->
                                merger.mergeSorted(
                                        left, right, left.getColumn(0), right.getColumn(0), false))
                .isInstanceOf(DataTypeMismatchException.class)
                .hasMessage("merge-sort datatype mismatch: INT != BIGINT");
    }

    @Test
    public void testStructColumnWithOuterNull() {
        RowType point = RowType.builder().field("x", DataTypes.INT()).build();
        ColumnarTable left =
                ColumnarTable.of(
                        intColumn("k", 1, 2),
                        Column.of(
                                "p", point, Arrays.asList(Collections.singletonList(1), null)));
        ColumnarTable right =
                ColumnarTable.of(
                        intColumn("k", 3),
                        Column.of(
                                "p",
                                point,
                                Collections.singletonList(Collections.singletonList(3))));

        assertThatThrownBy(() -> merger.mergeSorted(left, right, "k"))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessageContaining("'p'");
    }

    @Test
    public void testStructKey() {
        RowType key =
                RowType.builder()
                        .field("a", DataTypes.INT())
                        .field("b", DataTypes.STRING())
                        .build();
        ColumnarTable left =
                ColumnarTable.of(
                        Column.of(
                                "k",
                                key,
                                Arrays.asList(Arrays.asList(1, "a"), Arrays.asList(2, "a"))),
                        intColumn("v", 10, 20));
        ColumnarTable right =
                ColumnarTable.of(
                        Column.of("k", key, Collections.singletonList(Arrays.asList(1, "b"))),
                        intColumn("v", 30));

        ColumnarTable merged = merger.mergeSorted(left, right, "k");

        assertThat(merged.getColumn("v").toObjectList()).containsExactly(10, 30, 20);
    }

    @Test
    public void testParallelMergeMatchesSequential() {
        ColumnarTable left = wideTable(0);
        ColumnarTable right = wideTable(1);
        Options options = new Options();
        options.set(MergeSortedOptions.PARALLELISM, 4);

        ColumnarTable parallel = new SortedTableMerger(options).mergeSorted(left, right, "k");
        ColumnarTable sequential = merger.mergeSorted(left, right, "k");

        assertThat(toStrings(parallel)).isEqualTo(toStrings(sequential));
        assertThat(parallel.numRows()).isEqualTo(left.numRows() + right.numRows());
    }

    @Test
    public void testParallelFailureIsRethrownUnchanged() {
        ColumnarTable left =
                ColumnarTable.of(
                        intColumn("k", 1), intColumn("a", 1), column("b", DataTypes.STRING(), "x"));
        ColumnarTable right =
                ColumnarTable.of(
                        intColumn("k", 2),
                        intColumn("a", 2),
                        column("b", DataTypes.BYTES(), new byte[0]));
        Options options = new Options();
        options.set(MergeSortedOptions.PARALLELISM, 3);

        assertThatThrownBy(
                        () ->
                                new SortedTableMerger(options)
                                        .mergeSorted(
                                                left,
                                                right,
                                                left.getColumn(0),
                                                right.getColumn(0),
                                                false))
                .isInstanceOf(DataTypeMismatchException.class)
                .hasMessage("merge-sort datatype mismatch: STRING != BYTES");
    }

    @Test
    public void testValidateSorted() {
        Options options = new Options();
        options.set(MergeSortedOptions.VALIDATE_SORTED, true);
        SortedTableMerger validating = new SortedTableMerger(options);
        ColumnarTable sorted = ColumnarTable.of(intColumn("k", 1, 2));
        ColumnarTable unsorted = ColumnarTable.of(intColumn("k", 1, 3, 2));

        assertThat(validating.mergeSorted(sorted, sorted, "k").numRows()).isEqualTo(4);
        assertThatThrownBy(() -> validating.mergeSorted(sorted, unsorted, "k"))
                .isInstanceOf(MergeSortedException.class)
                .hasMessage("The right key column 'k' is not sorted ascending at row 2.");
        // without validation unsorted input is merged as is
        assertThat(merger.mergeSorted(sorted, unsorted, "k").getColumn(0).toObjectList())
                .containsExactly(1, 1, 2, 3, 2);
    }

    @Test
    public void testInvalidArguments() {
        ColumnarTable table = ColumnarTable.of(intColumn("k", 1));

        assertThatThrownBy(() -> merger.mergeSorted(table, table, "missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Column 'missing' does not exist.");
        assertThatThrownBy(
                        () ->
                                merger.mergeSorted(
                                        table,
                                        table,
                                        intColumn("k", 1, 2),
                                        table.getColumn(0),
                                        true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(
                        () ->
                                new SortedTableMerger(
                                        new Options().set(MergeSortedOptions.PARALLELISM, 0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("merge-sorted.parallelism");
    }

    private static Dictionary dictionaryOf(Column column) {
        return ((CategoricalColumnVector) column.vector()).getDictionary();
    }

    private static ColumnarTable wideTable(int offset) {
        List<Integer> keys = Arrays.asList(offset, offset + 2, offset + 4, offset + 6);
        return ColumnarTable.of(
                Column.of("k", DataTypes.INT(), keys),
                column("b", DataTypes.BOOLEAN(), true, false, null, true),
                column("d", DataTypes.DOUBLE(), 0.5 + offset, null, 1.5, 2.5),
                column("s", DataTypes.STRING(), "s" + offset, "t", null, "u"),
                Column.of(
                        "l",
                        DataTypes.ARRAY(DataTypes.BIGINT()),
                        Arrays.asList(
                                Arrays.asList(1L, 2L),
                                null,
                                Collections.emptyList(),
                                Collections.singletonList((long) offset))),
                Column.ofGlobal(
                        "c",
                        DataTypes.CATEGORICAL(),
                        SHARED_INTERNER,
                        Arrays.asList("a", "b", null, "c" + offset)));
    }
}
