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
import org.apache.colmerge.data.columnar.BooleanColumnVector;
import org.apache.colmerge.data.columnar.ByteColumnVector;
import org.apache.colmerge.data.columnar.BytesColumnVector;
import org.apache.colmerge.data.columnar.CategoricalColumnVector;
import org.apache.colmerge.data.columnar.ColumnVector;
import org.apache.colmerge.data.columnar.DoubleColumnVector;
import org.apache.colmerge.data.columnar.FloatColumnVector;
import org.apache.colmerge.data.columnar.IntColumnVector;
import org.apache.colmerge.data.columnar.LongColumnVector;
import org.apache.colmerge.data.columnar.ShortColumnVector;
import org.apache.colmerge.sort.OrderedBytes;
import org.apache.colmerge.sort.RowEncoder;
import org.apache.colmerge.types.CategoricalType;
import org.apache.colmerge.types.DataType;
import org.apache.colmerge.utils.BooleanArrayList;
import org.apache.colmerge.utils.Preconditions;

import java.util.List;

/**
 * 用双指针比较两个升序键序列,生成 {@link MergeIndicator}。
 *
 * <p>两侧都有剩余元素时,若 {@code left <= right} 则输出 {@code true} 并推进左侧,否则输出
 * {@code false} 并推进右侧;相等时总是先取左侧。一侧耗尽后,另一侧剩余元素全部输出。
 *
 * <h2>比较语义</h2>
 * <ul>
 *   <li>空值小于任何非空值
 *   <li>数值用 {@code <=} 运算符比较,NaN 不做归一化,与任何值比较都不成立
 *   <li>字符串与二进制按无符号字节序比较
 *   <li>字典序分类键比较解码后的字符串,否则直接比较编码
 *   <li>结构体与数组键先经 {@link RowEncoder} 编码为保序字节串再比较
 * </ul>
 *
 * <p>时间复杂度 O(n+m),只为指示序列分配空间,输入不被复制。
 */
public final class MergeIndicatorGenerator {

    private MergeIndicatorGenerator() {}

    /** 判断左侧第 i 个键是否应排在右侧第 j 个键之前(或与之相等)。 */
    @FunctionalInterface
    public interface HeadComparator {
        boolean leftFirst(int leftIndex, int rightIndex);
    }

    public static MergeIndicator generate(int leftLen, int rightLen, HeadComparator comparator) {
        Preconditions.checkArgument(leftLen >= 0 && rightLen >= 0, "Lengths must not be negative.");
        if (rightLen == 0) {
            return MergeIndicator.allLeft(leftLen);
        }
        if (leftLen == 0) {
            return MergeIndicator.allRight(rightLen);
        }

        BooleanArrayList bits = new BooleanArrayList(leftLen + rightLen);
        int i = 0;
        int j = 0;
        while (i < leftLen && j < rightLen) {
            if (comparator.leftFirst(i, j)) {
                bits.add(true);
                i++;
            } else {
                bits.add(false);
                j++;
            }
        }
        bits.addRepeated(true, leftLen - i);
        bits.addRepeated(false, rightLen - j);
        return MergeIndicator.of(bits, leftLen);
    }

    /** 为两个同类型的键列生成指示序列。 */
    public static MergeIndicator generate(Column leftKey, Column rightKey) {
        return generate(leftKey.size(), rightKey.size(), comparator(leftKey, rightKey));
    }

    public static MergeIndicator generate(int[] left, int[] right) {
        return generate(left.length, right.length, (i, j) -> left[i] <= right[j]);
    }

    public static MergeIndicator generate(long[] left, long[] right) {
        return generate(left.length, right.length, (i, j) -> left[i] <= right[j]);
    }

    public static MergeIndicator generate(double[] left, double[] right) {
        return generate(left.length, right.length, (i, j) -> left[i] <= right[j]);
    }

    public static <T extends Comparable<? super T>> MergeIndicator generate(
            List<T> left, List<T> right) {
        return generate(
                left.size(), right.size(), (i, j) -> left.get(i).compareTo(right.get(j)) <= 0);
    }

    /**
     * 返回键列中第一个比前一行小的行号,整列升序时返回 -1。
     *
     * <p>使用与合并相同的比较语义,因此含 NaN 的浮点键会被判为无序。
     */
    public static int firstUnsortedRow(Column key) {
        HeadComparator comparator = comparator(key, key);
        for (int row = 1; row < key.size(); row++) {
            if (!comparator.leftFirst(row - 1, row)) {
                return row;
            }
        }
        return -1;
    }

    static HeadComparator comparator(Column leftKey, Column rightKey) {
        if (!leftKey.type().equalsIgnoreNullable(rightKey.type())) {
            throw new DataTypeMismatchException(leftKey.type(), rightKey.type());
        }
        ColumnVector left = leftKey.vector();
        ColumnVector right = rightKey.vector();
        HeadComparator values = valueComparator(leftKey, rightKey);
        return (i, j) -> left.isNullAt(i) || (!right.isNullAt(j) && values.leftFirst(i, j));
    }

    private static HeadComparator valueComparator(Column leftKey, Column rightKey) {
        DataType type = leftKey.type();
        ColumnVector left = leftKey.vector();
        ColumnVector right = rightKey.vector();
        switch (type.getTypeRoot()) {
            case BOOLEAN:
                {
                    BooleanColumnVector l = (BooleanColumnVector) left;
                    BooleanColumnVector r = (BooleanColumnVector) right;
                    return (i, j) -> !l.getBoolean(i) || r.getBoolean(j);
                }
            case TINYINT:
                {
                    ByteColumnVector l = (ByteColumnVector) left;
                    ByteColumnVector r = (ByteColumnVector) right;
                    return (i, j) -> l.getByte(i) <= r.getByte(j);
                }
            case SMALLINT:
                {
                    ShortColumnVector l = (ShortColumnVector) left;
                    ShortColumnVector r = (ShortColumnVector) right;
                    return (i, j) -> l.getShort(i) <= r.getShort(j);
                }
            case INTEGER:
            case DATE:
                {
                    IntColumnVector l = (IntColumnVector) left;
                    IntColumnVector r = (IntColumnVector) right;
                    return (i, j) -> l.getInt(i) <= r.getInt(j);
                }
            case BIGINT:
            case TIMESTAMP_WITHOUT_TIME_ZONE:
                {
                    LongColumnVector l = (LongColumnVector) left;
                    LongColumnVector r = (LongColumnVector) right;
                    return (i, j) -> l.getLong(i) <= r.getLong(j);
                }
            case FLOAT:
                {
                    FloatColumnVector l = (FloatColumnVector) left;
                    FloatColumnVector r = (FloatColumnVector) right;
                    return (i, j) -> l.getFloat(i) <= r.getFloat(j);
                }
            case DOUBLE:
                {
                    DoubleColumnVector l = (DoubleColumnVector) left;
                    DoubleColumnVector r = (DoubleColumnVector) right;
                    return (i, j) -> l.getDouble(i) <= r.getDouble(j);
                }
            case VARCHAR:
            case VARBINARY:
                {
                    BytesColumnVector l = (BytesColumnVector) left;
                    BytesColumnVector r = (BytesColumnVector) right;
                    return (i, j) ->
                            BytesColumnVector.Bytes.compare(l.getBytes(i), r.getBytes(j)) <= 0;
                }
            case CATEGORICAL:
                {
                    CategoricalColumnVector l = (CategoricalColumnVector) left;
                    CategoricalColumnVector r = (CategoricalColumnVector) right;
                    if (((CategoricalType) type).usesLexicalOrdering()) {
                        return (i, j) ->
                                OrderedBytes.compareUnsigned(
                                                l.getDictionary().decodeToBinary(l.getInt(i)),
                                                r.getDictionary().decodeToBinary(r.getInt(j)))
                                        <= 0;
                    }
                    return (i, j) -> l.getInt(i) <= r.getInt(j);
                }
            case ARRAY:
            case ROW:
                {
                    byte[][] l = RowEncoder.encode(leftKey);
                    byte[][] r = leftKey == rightKey ? l : RowEncoder.encode(rightKey);
                    return (i, j) -> OrderedBytes.compareUnsigned(l[i], r[j]) <= 0;
                }
            default:
                throw new UnsupportedOperationException("Unsupported merge key type: " + type);
        }
    }
}
