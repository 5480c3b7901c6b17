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

import org.apache.colmerge.data.columnar.BooleanColumnVector;

import java.util.Arrays;

/** 堆布尔列向量,每个值占用一个 boolean。 */
public class HeapBooleanVector extends AbstractHeapVector implements BooleanColumnVector {

    private static final long serialVersionUID = 1L;

    public boolean[] vector;

    public HeapBooleanVector(int len) {
        super(len);
        vector = new boolean[len];
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (vector.length < newCapacity) {
            vector = Arrays.copyOf(vector, newCapacity);
        }
    }

    @Override
    public boolean getBoolean(int i) {
        return vector[i];
    }

    public void setBoolean(int i, boolean value) {
        vector[i] = value;
    }

    public void appendBoolean(boolean v) {
        reserve(elementsAppended + 1);
        setBoolean(elementsAppended, v);
        elementsAppended++;
    }
}
