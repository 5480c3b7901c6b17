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

package org.apache.colmerge.data.columnar;

import org.apache.colmerge.annotation.Public;

import java.nio.charset.StandardCharsets;

/**
 * 变长字节列向量,STRING 与 BYTES 共用此物理表示。
 *
 * <p>STRING 的值是 UTF-8 字节,读取为字符串时使用 {@link Bytes#toUtf8String()}。
 */
@Public
public interface BytesColumnVector extends ColumnVector {

    /**
     * 获取指定位置的字节数组引用。
     *
     * <p>返回的 {@link Bytes} 可能指向共享缓冲区,如需独立副本请调用 {@link Bytes#getBytes()}。
     *
     * @param i 行索引(从0开始)
     */
    Bytes getBytes(int i);

    /** 字节数组数据的包装类,包含数据引用、偏移量和长度。 */
    class Bytes {
        /** 底层字节数组(可能包含多个值的数据) */
        public final byte[] data;
        /** 此值在数组中的起始偏移量 */
        public final int offset;
        /** 此值的字节长度 */
        public final int len;

        public Bytes(byte[] data, int offset, int len) {
            this.data = data;
            this.offset = offset;
            this.len = len;
        }

        /**
         * 获取此值的独立字节数组副本。
         *
         * <p>如果 offset 为 0 且 len 等于 data 长度,直接返回 data 数组。
         */
        public byte[] getBytes() {
            if (offset == 0 && len == data.length) {
                return data;
            }
            byte[] res = new byte[len];
            System.arraycopy(data, offset, res, 0, len);
            return res;
        }

        public String toUtf8String() {
            return new String(data, offset, len, StandardCharsets.UTF_8);
        }

        /** 按无符号字节字典序比较两个值。 */
        public static int compare(Bytes a, Bytes b) {
            int n = Math.min(a.len, b.len);
            for (int i = 0; i < n; i++) {
                int cmp = (a.data[a.offset + i] & 0xFF) - (b.data[b.offset + i] & 0xFF);
                if (cmp != 0) {
                    return cmp;
                }
            }
            return a.len - b.len;
        }
    }
}
