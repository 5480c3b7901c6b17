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

import org.apache.colmerge.data.columnar.IntColumnVector;

import java.util.Arrays;

/**
 * 堆整数列向量实现类。
 *
 * <p>使用 32 位 int 数组作为底层存储,承载 INT、DATE 以及分类编码的物理值。
 *
 * <pre>{@code
 * HeapIntVector vector = new HeapIntVector(16);
 * vector.appendInt(42);
 * vector.appendNull();
 * int value = vector.getInt(0);
 * }</pre>
 */
public class HeapIntVector extends AbstractHeapVector implements IntColumnVector {

    private static final long serialVersionUID = 1L;

    /** 存储整数值的数组。 */
    public int[] vector;

    public HeapIntVector(int len) {
        super(len);
        vector = new int[len];
    }

    /** 与 {@code other} 共享底层数组,供物理/逻辑表示之间的零拷贝转换使用。 */
    protected HeapIntVector(HeapIntVector other) {
        super(0);
        this.vector = other.vector;
        this.isNull = other.isNull;
        this.noNulls = other.noNulls;
        this.capacity = other.capacity;
        this.elementsAppended = other.elementsAppended;
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (vector.length < newCapacity) {
            vector = Arrays.copyOf(vector, newCapacity);
        }
    }

    @Override
    public int getInt(int i) {
        return vector[i];
    }

    public void setInt(int i, int value) {
        vector[i] = value;
    }

    public void appendInt(int v) {
        reserve(elementsAppended + 1);
        setInt(elementsAppended, v);
        elementsAppended++;
    }
}
