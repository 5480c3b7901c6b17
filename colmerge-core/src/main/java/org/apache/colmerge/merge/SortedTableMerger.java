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
import org.apache.colmerge.options.Options;
import org.apache.colmerge.types.DataField;
import org.apache.colmerge.utils.ExecutorThreadFactory;
import org.apache.colmerge.utils.ExecutorUtils;
import org.apache.colmerge.utils.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 把两张已按同一键升序排列的表合并为一张升序表,不重新排序。
 *
 * <h2>执行顺序</h2>
 * <ol>
 *   <li>要求校验 schema 时,两表的列名与列类型必须逐列相同
 *   <li>两侧键列类型必须相同
 *   <li>键中的分类值(包括嵌套在结构体或数组中的)两侧字典必须同源
 *   <li>右侧键为空时原样返回左表,左侧键为空时原样返回右表
 *   <li>计算一次合并指示序列,再按位置逐列交错
 *   <li>组装为行数等于两侧之和的新表,列顺序与列名沿用左表
 * </ol>
 *
 * <p>指示序列计算完成后不可变,各列之间没有数据依赖。{@link MergeSortedOptions#PARALLELISM} 大于 1
 * 时逐列合并在固定大小的守护线程池上执行,第一个失败会中止整个合并并原样抛出。
 */
public class SortedTableMerger {

    private static final Logger LOG = LoggerFactory.getLogger(SortedTableMerger.class);

    private static final long SHUTDOWN_TIMEOUT_MS = 10_000L;

    private final boolean checkSchema;

    private final int parallelism;

    private final boolean validateSorted;

    public SortedTableMerger() {
        this(new Options());
    }

    public SortedTableMerger(Options options) {
        this.checkSchema = options.get(MergeSortedOptions.CHECK_SCHEMA);
        this.parallelism = options.get(MergeSortedOptions.PARALLELISM);
        this.validateSorted = options.get(MergeSortedOptions.VALIDATE_SORTED);
        Preconditions.checkArgument(
                parallelism >= 1,
                "%s must be at least 1, but is %s.",
                MergeSortedOptions.PARALLELISM.key(),
                parallelism);
    }

    /**
     * 按列名取出两侧键列后合并,schema 校验由 {@link MergeSortedOptions#CHECK_SCHEMA} 决定。
     *
     * @throws IllegalArgumentException 任一表中不存在该列
     */
    public ColumnarTable mergeSorted(ColumnarTable left, ColumnarTable right, String keyName) {
        Preconditions.checkNotNull(left, "Left table must not be null.");
        Preconditions.checkNotNull(right, "Right table must not be null.");
        return mergeSorted(
                left, right, left.getColumn(keyName), right.getColumn(keyName), checkSchema);
    }

    /**
     * 合并两张已排序的表。
     *
     * @param leftKey 左表的合并键,行数须与左表一致
     * @param rightKey 右表的合并键,行数须与右表一致
     * @param checkSchema 是否要求两表 schema 完全一致
     * @return 新表;一侧为空时直接返回另一侧的原表
     */
    public ColumnarTable mergeSorted(
            ColumnarTable left,
            ColumnarTable right,
            Column leftKey,
            Column rightKey,
            boolean checkSchema) {
        Preconditions.checkNotNull(left, "Left table must not be null.");
        Preconditions.checkNotNull(right, "Right table must not be null.");
        Preconditions.checkNotNull(leftKey, "Left key must not be null.");
        Preconditions.checkNotNull(rightKey, "Right key must not be null.");
        Preconditions.checkArgument(
                leftKey.size() == left.numRows(),
                "Left key has %s rows but the left table has %s.",
                leftKey.size(),
                left.numRows());
        Preconditions.checkArgument(
                rightKey.size() == right.numRows(),
                "Right key has %s rows but the right table has %s.",
                rightKey.size(),
                right.numRows());

        if (checkSchema) {
            checkSchemaEquals(left, right);
        }
        if (!leftKey.type().equalsIgnoreNullable(rightKey.type())) {
            throw new DataTypeMismatchException(leftKey.type(), rightKey.type());
        }
        DictionaryReconciler.checkCompatible(leftKey, rightKey);

        if (rightKey.isEmpty()) {
            LOG.debug("Right side is empty, returning the left table unchanged.");
            return left;
        }
        if (leftKey.isEmpty()) {
            LOG.debug("Left side is empty, returning the right table unchanged.");
            return right;
        }

        if (left.numColumns() != right.numColumns()) {
            throw new SchemaMismatchException(
                    "Cannot merge a table of %s columns with a table of %s columns.",
                    left.numColumns(),
                    right.numColumns());
        }
        if (validateSorted) {
            checkSorted(leftKey, "left");
            checkSorted(rightKey, "right");
        }

        MergeIndicator indicator = MergeIndicatorGenerator.generate(leftKey, rightKey);
        Preconditions.checkState(
                indicator.size() == left.numRows() + right.numRows(),
                "Merge indicator has %s entries for %s + %s rows.",
                indicator.size(),
                left.numRows(),
                right.numRows());
        LOG.debug(
                "Merging {} left rows and {} right rows over {} columns on key '{}'.",
                left.numRows(),
                right.numRows(),
                left.numColumns(),
                leftKey.name());

        List<Column> merged =
                parallelism > 1 && left.numColumns() > 1
                        ? mergeColumnsInParallel(left, right, indicator)
                        : mergeColumns(left, right, indicator);
        return new ColumnarTable(merged);
    }

    private List<Column> mergeColumns(
            ColumnarTable left, ColumnarTable right, MergeIndicator indicator) {
        List<Column> merged = new ArrayList<>(left.numColumns());
        for (int i = 0; i < left.numColumns(); i++) {
            merged.add(
                    TypedMergeDispatcher.merge(left.getColumn(i), right.getColumn(i), indicator));
        }
        return merged;
    }

    private List<Column> mergeColumnsInParallel(
            ColumnarTable left, ColumnarTable right, MergeIndicator indicator) {
        int threads = Math.min(parallelism, left.numColumns());
        ExecutorService executor =
                Executors.newFixedThreadPool(threads, new ExecutorThreadFactory("merge-sorted"));
        try {
            List<Future<Column>> futures = new ArrayList<>(left.numColumns());
            for (int i = 0; i < left.numColumns(); i++) {
                Column leftColumn = left.getColumn(i);
                Column rightColumn = right.getColumn(i);
                futures.add(
                        executor.submit(
                                () ->
                                        TypedMergeDispatcher.merge(
                                                leftColumn, rightColumn, indicator)));
            }
            return ExecutorUtils.awaitAllOrCancel(futures);
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MergeSortedException(e, "Interrupted while merging columns.");
        } finally {
            ExecutorUtils.shutdownAndAwait(executor, SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        }
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new MergeSortedException(cause, "Failed to merge columns.");
    }

    private static void checkSchemaEquals(ColumnarTable left, ColumnarTable right) {
        if (left.schemaEquals(right)) {
            return;
        }
        List<DataField> leftFields = left.rowType().getFields();
        List<DataField> rightFields = right.rowType().getFields();
        int common = Math.min(leftFields.size(), rightFields.size());
        for (int i = 0; i < common; i++) {
            DataField l = leftFields.get(i);
            DataField r = rightFields.get(i);
            if (!l.equalsIgnoreNullable(r)) {
                throw new SchemaMismatchException(
                        "Cannot merge tables with different schemas: column %s is %s on the left "
                                + "but %s on the right.",
                        i,
                        l.asSQLString(),
                        r.asSQLString());
            }
        }
        throw new SchemaMismatchException(
                "Cannot merge tables with different schemas: left has %s columns, right has %s.",
                leftFields.size(),
                rightFields.size());
    }

    private static void checkSorted(Column key, String side) {
        int row = MergeIndicatorGenerator.firstUnsortedRow(key);
        if (row >= 0) {
            throw new MergeSortedException(
                    "The %s key column '%s' is not sorted ascending at row %s.",
                    side, key.name(), row);
        }
    }
}
