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

import org.apache.colmerge.data.columnar.ColumnVector;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 堆向量抽象基类,为所有堆内存实现的列向量提供通用功能。
 *
 * <h2>NULL 值处理</h2>
 * <ul>
 *   <li>noNulls=true: 该列没有 NULL 值,可跳过 NULL 检查
 *   <li>isNull[i]=true: 第 i 个位置是 NULL
 * </ul>
 *
 * <h2>写入方式</h2>
 * <p>既可以按位置 set,也可以通过 append 系列方法顺序追加;追加时容量不足会按 2 倍扩容。
 * 归并产生的新向量总是预先按输出行数分配,然后顺序追加。
 */
public abstract class AbstractHeapVector implements ColumnVector, Serializable {

    private static final long serialVersionUID = 1L;

    /*
     * If noNulls is false, then this array contains true if the value
     * is null, otherwise false. The array is always allocated.
     */
    protected boolean[] isNull;

    /** 如果整个列向量没有NULL值,此标志为true。 */
    protected boolean noNulls = true;

    /** 追加数据时的当前写入游标(行索引)。 */
    protected int elementsAppended;

    /** 向量的当前容量。 */
    protected int capacity;

    public AbstractHeapVector(int capacity) {
        this.capacity = capacity;
        this.isNull = new boolean[capacity];
    }

    public void setNullAt(int i) {
        isNull[i] = true;
        noNulls = false;
    }

    @Override
    public boolean isNullAt(int i) {
        return !noNulls && isNull[i];
    }

    /** 如果向量中存在 NULL 返回 true。 */
    public boolean hasNulls() {
        return !noNulls;
    }

    /** 追加一个 NULL 值。 */
    public void appendNull() {
        reserve(elementsAppended + 1);
        setNullAt(elementsAppended);
        elementsAppended++;
    }

    public int getElementsAppended() {
        return elementsAppended;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * 预留指定容量的空间。
     *
     * <p>请求容量大于当前容量时,新容量为请求容量的2倍(不超过Integer.MAX_VALUE)。
     *
     * @param requiredCapacity 需要的容量
     * @throws IllegalArgumentException 如果请求容量为负数
     */
    public void reserve(int requiredCapacity) {
        if (requiredCapacity < 0) {
            throw new IllegalArgumentException("Invalid capacity: " + requiredCapacity);
        } else if (requiredCapacity > capacity) {
            int newCapacity = (int) Math.min(Integer.MAX_VALUE, requiredCapacity * 2L);
            try {
                if (isNull.length < newCapacity) {
                    isNull = Arrays.copyOf(isNull, newCapacity);
                }
                reserveForHeapVector(newCapacity);
            } catch (OutOfMemoryError outOfMemoryError) {
                throw new RuntimeException(
                        "Failed to allocate memory for vector", outOfMemoryError);
            }
            capacity = newCapacity;
        }
    }

    /** 子类扩容各自的底层数组。 */
    abstract void reserveForHeapVector(int newCapacity);
}
