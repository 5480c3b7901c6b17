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

import org.apache.colmerge.utils.BooleanArrayList;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * 合并输出中每个值的来源:取自哪一侧,以及该侧的第几个位置。
 *
 * <p>顶层列由 {@link MergeIndicator} 顺序展开,两侧各自按行号递增消费。数组列的子向量则按每个
 * 被选中数组的 {@code [offset, offset + length)} 逐段收集,因此不要求子向量紧凑,空数组行也不会
 * 带入任何元素。
 */
final class RowSelection {

    private final boolean[] fromLeft;

    private final int[] positions;

    private RowSelection(boolean[] fromLeft, int[] positions) {
        this.fromLeft = fromLeft;
        this.positions = positions;
    }

    static RowSelection of(MergeIndicator indicator) {
        boolean[] fromLeft = indicator.toArray();
        int[] positions = new int[fromLeft.length];
        int leftRow = 0;
        int rightRow = 0;
        for (int k = 0; k < fromLeft.length; k++) {
            positions[k] = fromLeft[k] ? leftRow++ : rightRow++;
        }
        return new RowSelection(fromLeft, positions);
    }

    int size() {
        return positions.length;
    }

    boolean isLeft(int k) {
        return fromLeft[k];
    }

    int position(int k) {
        return positions[k];
    }

    /** 按输出顺序追加来源区间。 */
    static final class Builder {

        private final BooleanArrayList sides;

        private final IntArrayList positions;

        Builder(int expectedSize) {
            this.sides = new BooleanArrayList(expectedSize);
            this.positions = new IntArrayList(expectedSize);
        }

        void addRange(boolean fromLeft, int offset, int length) {
            sides.addRepeated(fromLeft, length);
            for (int i = 0; i < length; i++) {
                positions.add(offset + i);
            }
        }

        RowSelection build() {
            return new RowSelection(sides.toArray(), positions.toIntArray());
        }
    }
}
