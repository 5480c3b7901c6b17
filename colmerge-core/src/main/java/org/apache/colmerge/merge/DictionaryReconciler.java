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
import org.apache.colmerge.data.categorical.GlobalDictionary;
import org.apache.colmerge.data.categorical.GlobalDictionaryMerger;
import org.apache.colmerge.data.categorical.LocalDictionary;
import org.apache.colmerge.data.columnar.ArrayColumnVector;
import org.apache.colmerge.data.columnar.CategoricalColumnVector;
import org.apache.colmerge.data.columnar.ColumnVector;
import org.apache.colmerge.data.columnar.RowColumnVector;
import org.apache.colmerge.types.ArrayType;
import org.apache.colmerge.types.CategoricalType;
import org.apache.colmerge.types.DataType;
import org.apache.colmerge.types.DataTypeDefaultVisitor;
import org.apache.colmerge.types.RowType;
import org.apache.colmerge.utils.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 校验并合并两个分类列的字典。
 *
 * <ul>
 *   <li>本地 × 本地: 内容哈希必须相同,编码本就共享,不产生新字典
 *   <li>全局 × 全局: 命名空间必须相同,合并为覆盖并集的字典;右侧没有新类别时沿用左侧实例
 *   <li>本地 × 全局: 类型已经一致的前提下不可能出现,视为内部一致性错误
 * </ul>
 */
public final class DictionaryReconciler {

    private static final Logger LOG = LoggerFactory.getLogger(DictionaryReconciler.class);

    private DictionaryReconciler() {}

    /**
     * 校验两个同类型列中所有分类值的字典来源相同,包括嵌套在结构体字段与数组元素中的分类值。
     *
     * @throws IncompatibleCategoricalsException 任一处字典的本地哈希或全局命名空间不同
     */
    public static void checkCompatible(Column left, Column right) {
        left.type().accept(new CompatibilityChecker(left.name(), left.vector(), right.vector()));
    }

    /**
     * 校验两个字典来源相同。
     *
     * @throws IncompatibleCategoricalsException 本地哈希或全局命名空间不同
     * @throws IllegalStateException 一侧为本地字典而另一侧为全局字典
     */
    public static void checkCompatible(Dictionary left, Dictionary right, String column) {
        Preconditions.checkState(
                left.isGlobal() == right.isGlobal(),
                "Column '%s' pairs a %s dictionary with a %s dictionary.",
                column,
                kind(left),
                kind(right));
        if (left.sameSource(right)) {
            return;
        }
        if (left.isGlobal()) {
            throw new IncompatibleCategoricalsException(
                    "Cannot merge categorical column '%s': global dictionaries come from "
                            + "different string interners (namespace %s != %s).",
                    column,
                    ((GlobalDictionary) left).namespaceId(),
                    ((GlobalDictionary) right).namespaceId());
        }
        throw new IncompatibleCategoricalsException(
                "Cannot merge categorical column '%s': local dictionaries differ "
                        + "(hash %s != %s).",
                column,
                Long.toHexString(((LocalDictionary) left).contentHash()),
                Long.toHexString(((LocalDictionary) right).contentHash()));
    }

    /** 校验后返回合并结果应使用的字典。 */
    public static Dictionary reconcile(Dictionary left, Dictionary right, String column) {
        checkCompatible(left, right, column);
        if (!left.isGlobal()) {
            return left;
        }
        GlobalDictionary merged =
                new GlobalDictionaryMerger((GlobalDictionary) left)
                        .merge((GlobalDictionary) right)
                        .finish();
        if (merged != left) {
            LOG.debug(
                    "Categorical column '{}' now carries {} categories after merging {} and {}.",
                    column,
                    merged.size(),
                    left.size(),
                    right.size());
        }
        return merged;
    }

    private static String kind(Dictionary dictionary) {
        return dictionary.isGlobal() ? "global" : "local";
    }

    private static class CompatibilityChecker extends DataTypeDefaultVisitor<Void> {

        private final String column;

        private final ColumnVector left;

        private final ColumnVector right;

        private CompatibilityChecker(String column, ColumnVector left, ColumnVector right) {
            this.column = column;
            this.left = left;
            this.right = right;
        }

        @Override
        public Void visit(CategoricalType categoricalType) {
            checkCompatible(
                    ((CategoricalColumnVector) left).getDictionary(),
                    ((CategoricalColumnVector) right).getDictionary(),
                    column);
            return null;
        }

        @Override
        public Void visit(ArrayType arrayType) {
            return arrayType
                    .getElementType()
                    .accept(
                            new CompatibilityChecker(
                                    column,
                                    ((ArrayColumnVector) left).getColumnVector(),
                                    ((ArrayColumnVector) right).getColumnVector()));
        }

        @Override
        public Void visit(RowType rowType) {
            RowColumnVector l = (RowColumnVector) left;
            RowColumnVector r = (RowColumnVector) right;
            for (int f = 0; f < rowType.getFieldCount(); f++) {
                rowType.getTypeAt(f)
                        .accept(new CompatibilityChecker(column, l.getField(f), r.getField(f)));
            }
            return null;
        }

        @Override
        protected Void defaultMethod(DataType dataType) {
            return null;
        }
    }
}
