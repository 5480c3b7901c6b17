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

import org.apache.colmerge.data.columnar.BytesColumnVector;

import java.util.Arrays;

/**
 * 堆字节数组列向量,STRING 与 BYTES 共用。
 *
 * <p>所有值连续存放在一个 buffer 中,第 i 个值位于 {@code buffer[start[i], start[i] + length[i])}。
 */
public class HeapBytesVector extends AbstractHeapVector implements BytesColumnVector {

    private static final long serialVersionUID = 1L;

    /** 每个字段的起始偏移量。 */
    public int[] start;

    /** 每个字段的长度。 */
    public int[] length;

    /** 实际复制数据时使用的缓冲区。 */
    public byte[] buffer;

    /** 已追加的字节数。 */
    private int bytesAppended;

    /**
     * 构造一个堆字节数组列向量,初始缓冲区大小为 capacity * 16 字节。
     *
     * @param capacity 向量的容量
     */
    public HeapBytesVector(int capacity) {
        super(capacity);
        buffer = new byte[capacity * 16];
        start = new int[capacity];
        length = new int[capacity];
    }

    /**
     * 将字节数组复制到内部缓冲区并设置元数据。
     *
     * @param elementNum 元素编号(行号)
     * @param sourceBuf 源字节数组
     * @param start 源数组中的起始位置
     * @param length 要复制的长度
     */
    public void putByteArray(int elementNum, byte[] sourceBuf, int start, int length) {
        reserveBytes(bytesAppended + length);
        System.arraycopy(sourceBuf, start, buffer, bytesAppended, length);
        this.start[elementNum] = bytesAppended;
        this.length[elementNum] = length;
        bytesAppended += length;
    }

    public void appendByteArray(byte[] value, int offset, int length) {
        reserve(elementsAppended + 1);
        putByteArray(elementsAppended, value, offset, length);
        elementsAppended++;
    }

    public void appendBytes(Bytes bytes) {
        appendByteArray(bytes.data, bytes.offset, bytes.len);
    }

    private void reserveBytes(int newCapacity) {
        if (newCapacity > buffer.length) {
            int newBytesCapacity = (int) Math.min(Integer.MAX_VALUE, newCapacity * 2L);
            if (newBytesCapacity < newCapacity) {
                throw new RuntimeException(
                        String.format(
                                "The new claimed capacity %s is too large for a single byte buffer.",
                                newCapacity));
            }
            buffer = Arrays.copyOf(buffer, newBytesCapacity);
        }
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (start.length < newCapacity) {
            start = Arrays.copyOf(start, newCapacity);
            length = Arrays.copyOf(length, newCapacity);
        }
    }

    @Override
    public Bytes getBytes(int i) {
        return new Bytes(buffer, start[i], length[i]);
    }
}
