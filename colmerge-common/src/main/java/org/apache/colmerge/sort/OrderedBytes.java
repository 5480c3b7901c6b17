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

package org.apache.colmerge.sort;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;

/**
 * 把各类型的值写成按无符号字典序可比较的字节。
 *
 * <h2>转换规则</h2>
 * <ul>
 *   <li>有符号整数: 大端序写出,翻转符号位,使负数排在正数之前
 *   <li>浮点数: IEEE 754 位模式按符号-幅度整数解释后转换为可比较字节,负数翻转全部位,
 *       非负数只翻转符号位
 *   <li>变长字节: 0x00 转义为 0x00 0xFF,以 0x00 0x00 结尾,保证前缀小于更长的值
 * </ul>
 *
 * <p>所有输出应按无符号字节、大端序比较,见 {@link #compareUnsigned}。
 */
public final class OrderedBytes {

    public static final byte NULL_MARKER = 0x00;

    public static final byte VALID_MARKER = 0x01;

    private static final byte ESCAPE = (byte) 0xFF;

    private OrderedBytes() {}

    public static void writeTinyInt(byte val, ByteArrayList out) {
        out.add((byte) (val ^ 0x80));
    }

    public static void writeSmallInt(short val, ByteArrayList out) {
        int flipped = val ^ 0x8000;
        out.add((byte) (flipped >>> 8));
        out.add((byte) flipped);
    }

    public static void writeInt(int val, ByteArrayList out) {
        writeRawInt(val ^ Integer.MIN_VALUE, out);
    }

    public static void writeLong(long val, ByteArrayList out) {
        writeRawLong(val ^ Long.MIN_VALUE, out);
    }

    /**
     * IEEE 754 : “If two floating-point numbers in the same format are ordered (say, x {@literal <}
     * y), they are ordered the same way when their bits are reinterpreted as sign-magnitude
     * integers.”
     */
    public static void writeFloat(float val, ByteArrayList out) {
        int bits = Float.floatToIntBits(val);
        bits ^= ((bits >> (Integer.SIZE - 1)) | Integer.MIN_VALUE);
        writeRawInt(bits, out);
    }

    /** Doubles are treated the same as floats in {@link #writeFloat(float, ByteArrayList)}. */
    public static void writeDouble(double val, ByteArrayList out) {
        long bits = Double.doubleToLongBits(val);
        bits ^= ((bits >> (Long.SIZE - 1)) | Long.MIN_VALUE);
        writeRawLong(bits, out);
    }

    public static void writeBoolean(boolean val, ByteArrayList out) {
        out.add(val ? (byte) 1 : (byte) 0);
    }

    public static void writeBytes(byte[] data, int offset, int length, ByteArrayList out) {
        for (int i = offset; i < offset + length; i++) {
            byte b = data[i];
            out.add(b);
            if (b == 0x00) {
                out.add(ESCAPE);
            }
        }
        out.add((byte) 0x00);
        out.add((byte) 0x00);
    }

    /** 按无符号字节的字典序比较。 */
    public static int compareUnsigned(byte[] a, byte[] b) {
        int n = Math.min(a.length, b.length);
        for (int i = 0; i < n; i++) {
            int cmp = (a[i] & 0xFF) - (b[i] & 0xFF);
            if (cmp != 0) {
                return cmp;
            }
        }
        return a.length - b.length;
    }

    private static void writeRawInt(int val, ByteArrayList out) {
        out.add((byte) (val >>> 24));
        out.add((byte) (val >>> 16));
        out.add((byte) (val >>> 8));
        out.add((byte) val);
    }

    private static void writeRawLong(long val, ByteArrayList out) {
        writeRawInt((int) (val >>> 32), out);
        writeRawInt((int) val, out);
    }
}
