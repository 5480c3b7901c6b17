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

package org.apache.colmerge.data.columnar.heap;

import org.apache.colmerge.data.columnar.ArrayColumnVector;
import org.apache.colmerge.data.columnar.ColumnVector;

import java.util.Arrays;

/**
 * 堆数组列向量,以偏移量和长度数组引用单个子向量中的元素。
 *
 * <p>通过 {@link #appendArray(int)} 顺序追加时,偏移量紧密递增,即第 i 个数组紧跟在第 i-1 个之后。
 * 直接写 {@link #offsets} 与 {@link #lengths} 时可以引用子向量中的任意区间,空数组行的区间被忽略。
 */
public class HeapArrayVector extends AbstractHeapVector implements ArrayColumnVector {

    private static final long serialVersionUID = 1L;

    public int[] offsets;

    public int[] lengths;

    private ColumnVector child;

    /** 已引用的子元素数量,即下一个数组的起始偏移量。 */
    private int childCount;

    public HeapArrayVector(int len, ColumnVector child) {
        super(len);
        this.offsets = new int[len];
        this.lengths = new int[len];
        this.child = child;
    }

    public void setChild(ColumnVector child) {
        this.child = child;
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (offsets.length < newCapacity) {
            offsets = Arrays.copyOf(offsets, newCapacity);
            lengths = Arrays.copyOf(lengths, newCapacity);
        }
    }

    /** 追加一个包含 {@code length} 个元素的数组,元素需已按顺序写入子向量。 */
    public void appendArray(int length) {
        reserve(elementsAppended + 1);
        offsets[elementsAppended] = childCount;
        lengths[elementsAppended] = length;
        childCount += length;
        elementsAppended++;
    }

    @Override
    public void appendNull() {
        reserve(elementsAppended + 1);
        offsets[elementsAppended] = childCount;
        lengths[elementsAppended] = 0;
        setNullAt(elementsAppended);
        elementsAppended++;
    }

    @Override
    public int getOffset(int i) {
        return offsets[i];
    }

    @Override
    public int getLength(int i) {
        return lengths[i];
    }

    @Override
    public ColumnVector getColumnVector() {
        return child;
    }

    @Override
    public ColumnVector[] getChildren() {
        return new ColumnVector[] {child};
    }
}
