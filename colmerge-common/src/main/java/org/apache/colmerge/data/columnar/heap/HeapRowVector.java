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
import org.apache.colmerge.data.columnar.RowColumnVector;

/**
 * 堆Row列向量实现类。
 *
 * <pre>
 * HeapRowVector 结构:
 * ┌─────────────────────┐
 * │ Null Bitmap (外层)  │  每行是否整体为 null
 * ├─────────────────────┤
 * │ Field 1 Vector      │  第1个字段的列向量
 * ├─────────────────────┤
 * │ Field 2 Vector      │  第2个字段的列向量
 * └─────────────────────┘
 * </pre>
 *
 * <p>行向量本身只保存外层 NULL,字段值全部存放在与之等长的字段向量中。
 */
public class HeapRowVector extends AbstractHeapVector implements RowColumnVector {

    private static final long serialVersionUID = 1L;

    private final ColumnVector[] fields;

    public HeapRowVector(int len, ColumnVector... fields) {
        super(len);
        this.fields = fields;
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        // Nothing to store.
    }

    /** 追加一行。字段值需要通过各字段列向量分别写入。 */
    public void appendRow() {
        reserve(elementsAppended + 1);
        elementsAppended++;
    }

    @Override
    public int getFieldCount() {
        return fields.length;
    }

    @Override
    public ColumnVector getField(int pos) {
        return fields[pos];
    }

    @Override
    public ColumnVector[] getChildren() {
        return fields;
    }
}
