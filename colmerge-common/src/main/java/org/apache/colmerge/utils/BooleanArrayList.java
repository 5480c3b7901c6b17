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

package org.apache.colmerge.utils;

import java.util.Arrays;

/** 基于 boolean[] 的可增长列表,用于逐位追加合并指示位,避免装箱开销。 */
public class BooleanArrayList {

    private int size;

    private boolean[] array;

    public BooleanArrayList(int capacity) {
        this.size = 0;
        this.array = new boolean[capacity];
    }

    public int size() {
        return size;
    }

    public boolean add(boolean element) {
        grow(size + 1);
        array[size++] = element;
        return true;
    }

    /** 连续追加 {@code count} 个相同的值。 */
    public void addRepeated(boolean element, int count) {
        Preconditions.checkArgument(count >= 0, "count must not be negative: %s", count);
        grow(size + count);
        Arrays.fill(array, size, size + count, element);
        size += count;
    }

    public boolean get(int index) {
        Preconditions.checkElementIndex(index, size);
        return array[index];
    }

    public void clear() {
        size = 0;
    }

    public boolean isEmpty() {
        return (size == 0);
    }

    public boolean[] toArray() {
        return Arrays.copyOf(array, size);
    }

    private void grow(int length) {
        if (length > array.length) {
            final int newLength =
                    (int) Math.max(Math.min(2L * array.length, Integer.MAX_VALUE - 8), length);
            final boolean[] t = new boolean[newLength];
            System.arraycopy(array, 0, t, 0, size);
            array = t;
        }
    }
}
