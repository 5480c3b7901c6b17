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

import org.apache.colmerge.data.columnar.ShortColumnVector;

import java.util.Arrays;

/** 堆 SMALLINT 列向量。 */
public class HeapShortVector extends AbstractHeapVector implements ShortColumnVector {

    private static final long serialVersionUID = 1L;

    public short[] vector;

    public HeapShortVector(int len) {
        super(len);
        vector = new short[len];
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (vector.length < newCapacity) {
            vector = Arrays.copyOf(vector, newCapacity);
        }
    }

    @Override
    public short getShort(int i) {
        return vector[i];
    }

    public void setShort(int i, short value) {
        vector[i] = value;
    }

    public void appendShort(short v) {
        reserve(elementsAppended + 1);
        setShort(elementsAppended, v);
        elementsAppended++;
    }
}
