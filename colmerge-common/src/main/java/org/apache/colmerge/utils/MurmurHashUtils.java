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

/**
 * Murmur3 32 位哈希工具类,直接作用于 byte[]。
 *
 * <p>字节按小端序每 4 字节组成一个字,不足 4 字节的尾部逐字节混合。
 */
public final class MurmurHashUtils {

    private static final int C1 = 0xcc9e2d51;

    private static final int C2 = 0x1b873593;

    public static final int DEFAULT_SEED = 42;

    private MurmurHashUtils() {
        // do not instantiate
    }

    public static int hashBytes(byte[] bytes) {
        return hashBytes(bytes, 0, bytes.length, DEFAULT_SEED);
    }

    public static int hashBytesPositive(byte[] bytes) {
        return hashBytes(bytes) & 0x7fffffff;
    }

    public static int hashBytes(byte[] bytes, int offset, int lengthInBytes, int seed) {
        assert (lengthInBytes >= 0) : "lengthInBytes cannot be negative";
        int lengthAligned = lengthInBytes - lengthInBytes % 4;
        int h1 = seed;
        for (int i = 0; i < lengthAligned; i += 4) {
            int word =
                    (bytes[offset + i] & 0xFF)
                            | (bytes[offset + i + 1] & 0xFF) << 8
                            | (bytes[offset + i + 2] & 0xFF) << 16
                            | (bytes[offset + i + 3] & 0xFF) << 24;
            h1 = mixH1(h1, mixK1(word));
        }
        for (int i = lengthAligned; i < lengthInBytes; i++) {
            h1 = mixH1(h1, mixK1(bytes[offset + i]));
        }
        return fmix(h1, lengthInBytes);
    }

    private static int mixK1(int k1) {
        k1 *= C1;
        k1 = Integer.rotateLeft(k1, 15);
        k1 *= C2;
        return k1;
    }

    private static int mixH1(int h1, int k1) {
        h1 ^= k1;
        h1 = Integer.rotateLeft(h1, 13);
        h1 = h1 * 5 + 0xe6546b64;
        return h1;
    }

    // Finalization mix - force all bits of a hash block to avalanche
    private static int fmix(int h1, int length) {
        h1 ^= length;
        return fmix(h1);
    }

    public static int fmix(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }

    public static long fmix(long h) {
        h ^= (h >>> 33);
        h *= 0xff51afd7ed558ccdL;
        h ^= (h >>> 33);
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= (h >>> 33);
        return h;
    }
}
