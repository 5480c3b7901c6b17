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
import org.apache.colmerge.data.categorical.Dictionary;
import org.apache.colmerge.data.columnar.ArrayColumnVector;
import org.apache.colmerge.data.columnar.BooleanColumnVector;
import org.apache.colmerge.data.columnar.ByteColumnVector;
import org.apache.colmerge.data.columnar.BytesColumnVector;
import org.apache.colmerge.data.columnar.CategoricalColumnVector;
import org.apache.colmerge.data.columnar.ColumnVector;
import org.apache.colmerge.data.columnar.DoubleColumnVector;
import org.apache.colmerge.data.columnar.FloatColumnVector;
import org.apache.colmerge.data.columnar.IntColumnVector;
import org.apache.colmerge.data.columnar.LongColumnVector;
import org.apache.colmerge.data.columnar.RowColumnVector;
import org.apache.colmerge.data.columnar.ShortColumnVector;
import org.apache.colmerge.data.columnar.heap.HeapArrayVector;
import org.apache.colmerge.data.columnar.heap.HeapBooleanVector;
import org.apache.colmerge.data.columnar.heap.HeapByteVector;
import org.apache.colmerge.data.columnar.heap.HeapBytesVector;
import org.apache.colmerge.data.columnar.heap.HeapCategoricalVector;
import org.apache.colmerge.data.columnar.heap.HeapDoubleVector;
import org.apache.colmerge.data.columnar.heap.HeapFloatVector;
import org.apache.colmerge.data.columnar.heap.HeapIntVector;
import org.apache.colmerge.data.columnar.heap.HeapLongVector;
import org.apache.colmerge.data.columnar.heap.HeapRowVector;
import org.apache.colmerge.data.columnar.heap.HeapShortVector;
import org.apache.colmerge.types.ArrayType;
import org.apache.colmerge.types.BigIntType;
import org.apache.colmerge.types.BooleanType;
import org.apache.colmerge.types.CategoricalType;
import org.apache.colmerge.types.DataType;
import org.apache.colmerge.types.DataTypeVisitor;
import org.apache.colmerge.types.DateType;
import org.apache.colmerge.types.DoubleType;
import org.apache.colmerge.types.FloatType;
import org.apache.colmerge.types.IntType;
import org.apache.colmerge.types.RowType;
import org.apache.colmerge.types.SmallIntType;
import org.apache.colmerge.types.TimestampType;
import org.apache.colmerge.types.TinyIntType;
import org.apache.colmerge.types.VarBinaryType;
import org.apache.colmerge.types.VarCharType;
import org.apache.colmerge.utils.Preconditions;

/**
 * 按 {@link MergeIndicator} 交错两列,生成新分配的合并列。
 *
 * <p>沿指示序列逐位从指定一侧取下一个未消费的值(连同空值标记)。每种物理布局一个交错例程:
 * 布尔与各宽度数值逐值复制;STRING 与 BYTES 共用字节例程;DATE 与 TIMESTAMP 共用 INT 与 BIGINT
 * 例程;数组整体搬移,子向量按被选中数组的偏移区间收集,空数组行不带入元素;结构体用同一来源序列逐字段
 * 递归,任一侧外层存在空值时拒绝合并。
 *
 * <p>分类列的编码按 INT 交错,再挂上 {@link DictionaryReconciler} 给出的字典。嵌套在数组或结构体中的
 * 分类字段按同一规则处理,因此分派沿逻辑类型递归。
 *
 * <p>合并结果的列名取左侧列名。
 */
public final class TypedMergeDispatcher {

    private TypedMergeDispatcher() {}

    public static Column merge(Column left, Column right, MergeIndicator indicator) {
        if (!left.type().equalsIgnoreNullable(right.type())) {
            throw new DataTypeMismatchException(left.type(), right.type());
        }
        Preconditions.checkArgument(
                left.size() == indicator.leftCount() && right.size() == indicator.rightCount(),
                "Indicator for %s + %s rows does not fit columns of %s and %s rows.",
                indicator.leftCount(),
                indicator.rightCount(),
                left.size(),
                right.size());

        DataType logicalType = left.type();
        Column physicalLeft = left.toPhysical();
        ColumnVector merged =
                logicalType.accept(
                        new VectorMerger(
                                left.name(),
                                physicalLeft.vector(),
                                right.vector(),
                                RowSelection.of(indicator)));
        return new Column(left.name(), physicalLeft.type(), merged, indicator.size())
                .fromPhysicalUnchecked(logicalType);
    }

    /** 一次交错中对单个值的复制动作。 */
    @FunctionalInterface
    private interface RowCopier {
        void copy(boolean fromLeft, int row);
    }

    private static void interleave(RowSelection selection, RowCopier copier) {
        for (int k = 0; k < selection.size(); k++) {
            copier.copy(selection.isLeft(k), selection.position(k));
        }
    }

    // ------------------------------------------------------------------------

    private static class VectorMerger implements DataTypeVisitor<ColumnVector> {

        private final String column;

        private final ColumnVector left;

        private final ColumnVector right;

        private final RowSelection selection;

        private VectorMerger(
                String column, ColumnVector left, ColumnVector right, RowSelection selection) {
            this.column = column;
            this.left = left;
            this.right = right;
            this.selection = selection;
        }

        @Override
        public ColumnVector visit(BooleanType booleanType) {
            BooleanColumnVector l = (BooleanColumnVector) left;
            BooleanColumnVector r = (BooleanColumnVector) right;
            HeapBooleanVector out = new HeapBooleanVector(selection.size());
            interleave(
                    selection,
                    (fromLeft, row) -> {
                        BooleanColumnVector src = fromLeft ? l : r;
                        if (src.isNullAt(row)) {
                            out.appendNull();
                        } else {
                            out.appendBoolean(src.getBoolean(row));
                        }
                    });
            return out;
        }

        @Override
        public ColumnVector visit(TinyIntType tinyIntType) {
            ByteColumnVector l = (ByteColumnVector) left;
            ByteColumnVector r = (ByteColumnVector) right;
            HeapByteVector out = new HeapByteVector(selection.size());
            interleave(
                    selection,
                    (fromLeft, row) -> {
                        ByteColumnVector src = fromLeft ? l : r;
                        if (src.isNullAt(row)) {
                            out.appendNull();
                        } else {
                            out.appendByte(src.getByte(row));
                        }
                    });
            return out;
        }

        @Override
        public ColumnVector visit(SmallIntType smallIntType) {
            ShortColumnVector l = (ShortColumnVector) left;
            ShortColumnVector r = (ShortColumnVector) right;
            HeapShortVector out = new HeapShortVector(selection.size());
            interleave(
                    selection,
                    (fromLeft, row) -> {
                        ShortColumnVector src = fromLeft ? l : r;
                        if (src.isNullAt(row)) {
                            out.appendNull();
                        } else {
                            out.appendShort(src.getShort(row));
                        }
                    });
            return out;
        }

        @Override
        public ColumnVector visit(IntType intType) {
            return mergeInts();
        }

        @Override
        public ColumnVector visit(BigIntType bigIntType) {
            return mergeLongs();
        }

        @Override
        public ColumnVector visit(FloatType floatType) {
            FloatColumnVector l = (FloatColumnVector) left;
            FloatColumnVector r = (FloatColumnVector) right;
            HeapFloatVector out = new HeapFloatVector(selection.size());
            interleave(
                    selection,
                    (fromLeft, row) -> {
                        FloatColumnVector src = fromLeft ? l : r;
                        if (src.isNullAt(row)) {
                            out.appendNull();
                        } else {
                            out.appendFloat(src.getFloat(row));
                        }
                    });
            return out;
        }

        @Override
        public ColumnVector visit(DoubleType doubleType) {
            DoubleColumnVector l = (DoubleColumnVector) left;
            DoubleColumnVector r = (DoubleColumnVector) right;
            HeapDoubleVector out = new HeapDoubleVector(selection.size());
            interleave(
                    selection,
                    (fromLeft, row) -> {
                        DoubleColumnVector src = fromLeft ? l : r;
                        if (src.isNullAt(row)) {
                            out.appendNull();
                        } else {
                            out.appendDouble(src.getDouble(row));
                        }
                    });
            return out;
        }

        @Override
        public ColumnVector visit(DateType dateType) {
            return mergeInts();
        }

        @Override
        public ColumnVector visit(TimestampType timestampType) {
            return mergeLongs();
        }

        @Override
        public ColumnVector visit(VarCharType varCharType) {
            return mergeBytes();
        }

        @Override
        public ColumnVector visit(VarBinaryType varBinaryType) {
            return mergeBytes();
        }

        @Override
        public ColumnVector visit(CategoricalType categoricalType) {
            Dictionary dictionary =
                    DictionaryReconciler.reconcile(
                            ((CategoricalColumnVector) left).getDictionary(),
                            ((CategoricalColumnVector) right).getDictionary(),
                            column);
            return HeapCategoricalVector.retag(mergeInts(), dictionary);
        }

        @Override
        public ColumnVector visit(ArrayType arrayType) {
            ArrayColumnVector l = (ArrayColumnVector) left;
            ArrayColumnVector r = (ArrayColumnVector) right;

            // every list moves as a whole, its elements are gathered from its own offset range
            RowSelection.Builder elements = new RowSelection.Builder(selection.size());
            HeapArrayVector out = new HeapArrayVector(selection.size(), null);
            interleave(
                    selection,
                    (fromLeft, row) -> {
                        ArrayColumnVector src = fromLeft ? l : r;
                        if (src.isNullAt(row)) {
                            out.appendNull();
                        } else {
                            int length = src.getLength(row);
                            elements.addRange(fromLeft, src.getOffset(row), length);
                            out.appendArray(length);
                        }
                    });
            out.setChild(
                    arrayType
                            .getElementType()
                            .accept(
                                    new VectorMerger(
                                            column,
                                            l.getColumnVector(),
                                            r.getColumnVector(),
                                            elements.build())));
            return out;
        }

        @Override
        public ColumnVector visit(RowType rowType) {
            RowColumnVector l = (RowColumnVector) left;
            RowColumnVector r = (RowColumnVector) right;
            checkNoOuterNulls(l, r);

            ColumnVector[] fields = new ColumnVector[rowType.getFieldCount()];
            for (int f = 0; f < fields.length; f++) {
                fields[f] =
                        rowType.getTypeAt(f)
                                .accept(
                                        new VectorMerger(
                                                column, l.getField(f), r.getField(f), selection));
            }
            HeapRowVector out = new HeapRowVector(selection.size(), fields);
            for (int k = 0; k < selection.size(); k++) {
                out.appendRow();
            }
            return out;
        }

        private HeapIntVector mergeInts() {
            IntColumnVector l = (IntColumnVector) left;
            IntColumnVector r = (IntColumnVector) right;
            HeapIntVector out = new HeapIntVector(selection.size());
            interleave(
                    selection,
                    (fromLeft, row) -> {
                        IntColumnVector src = fromLeft ? l : r;
                        if (src.isNullAt(row)) {
                            out.appendNull();
                        } else {
                            out.appendInt(src.getInt(row));
                        }
                    });
            return out;
        }

        private HeapLongVector mergeLongs() {
            LongColumnVector l = (LongColumnVector) left;
            LongColumnVector r = (LongColumnVector) right;
            HeapLongVector out = new HeapLongVector(selection.size());
            interleave(
                    selection,
                    (fromLeft, row) -> {
                        LongColumnVector src = fromLeft ? l : r;
                        if (src.isNullAt(row)) {
                            out.appendNull();
                        } else {
                            out.appendLong(src.getLong(row));
                        }
                    });
            return out;
        }

        private HeapBytesVector mergeBytes() {
            BytesColumnVector l = (BytesColumnVector) left;
            BytesColumnVector r = (BytesColumnVector) right;
            HeapBytesVector out = new HeapBytesVector(selection.size());
            interleave(
                    selection,
                    (fromLeft, row) -> {
                        BytesColumnVector src = fromLeft ? l : r;
                        if (src.isNullAt(row)) {
                            out.appendNull();
                        } else {
                            out.appendBytes(src.getBytes(row));
                        }
                    });
            return out;
        }

        private void checkNoOuterNulls(RowColumnVector l, RowColumnVector r) {
            for (int k = 0; k < selection.size(); k++) {
                RowColumnVector src = selection.isLeft(k) ? l : r;
                int row = selection.position(k);
                if (src.isNullAt(row)) {
                    throw new UnsupportedOperationException(
                            String.format(
                                    "Merging struct column '%s' with an outer-level null "
                                            + "(row %s) is not supported.",
                                    column, row));
                }
            }
        }
    }
}
