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

package org.apache.colmerge.data.categorical;

import org.apache.colmerge.annotation.Public;
import org.apache.colmerge.utils.Preconditions;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Arrays;

/**
 * 全局字典:列中存放的编码就是 {@link StringInterner} 分配的全局编码。
 *
 * <p>字典记录命名空间 id,以及列用到的全局编码及其字符串(按加入顺序)。全局编码到槽位的哈希索引
 * 用于解码。
 */
@Public
public final class GlobalDictionary implements Dictionary {

    private final long namespaceId;

    private final int[] globalCodes;

    private final String[] categories;

    private final Int2IntOpenHashMap globalToLocal;

    GlobalDictionary(long namespaceId, int[] globalCodes, String[] categories) {
        Preconditions.checkArgument(
                globalCodes.length == categories.length,
                "Codes and categories must have the same length.");
        this.namespaceId = namespaceId;
        this.globalCodes = globalCodes;
        this.categories = categories;
        this.globalToLocal = new Int2IntOpenHashMap(globalCodes.length);
        this.globalToLocal.defaultReturnValue(-1);
        for (int i = 0; i < globalCodes.length; i++) {
            globalToLocal.put(globalCodes[i], i);
        }
    }

    public long namespaceId() {
        return namespaceId;
    }

    /** 是否包含给定全局编码。 */
    public boolean contains(int globalCode) {
        return globalToLocal.containsKey(globalCode);
    }

    /** 第 {@code slot} 个类别的全局编码。 */
    public int globalCodeAt(int slot) {
        return globalCodes[slot];
    }

    public String categoryAt(int slot) {
        return categories[slot];
    }

    @Override
    public int size() {
        return globalCodes.length;
    }

    @Override
    public String decodeToString(int code) {
        int slot = globalToLocal.get(code);
        Preconditions.checkArgument(
                slot >= 0, "Global code %s is not part of this dictionary.", code);
        return categories[slot];
    }

    @Override
    public boolean isGlobal() {
        return true;
    }

    @Override
    public boolean sameSource(Dictionary other) {
        return other instanceof GlobalDictionary
                && ((GlobalDictionary) other).namespaceId == namespaceId;
    }

    @Override
    public String toString() {
        return "GlobalDictionary{namespace="
                + namespaceId
                + ", codes="
                + Arrays.toString(globalCodes)
                + "}";
    }

    // ------------------------------------------------------------------------

    /** 通过驻留器编码字符串,并记录本列用到的全局编码。 */
    public static class Builder {

        private final StringInterner interner;

        private final IntArrayList codes = new IntArrayList();

        private final ObjectArrayList<String> categories = new ObjectArrayList<>();

        private final Int2IntOpenHashMap seen = new Int2IntOpenHashMap();

        Builder(StringInterner interner) {
            this.interner = interner;
        }

        /** 返回字符串的全局编码。 */
        public int encode(String value) {
            int code = interner.intern(value);
            if (!seen.containsKey(code)) {
                seen.put(code, codes.size());
                codes.add(code);
                categories.add(value);
            }
            return code;
        }

        public GlobalDictionary build() {
            return new GlobalDictionary(
                    interner.namespaceId(),
                    codes.toIntArray(),
                    categories.toArray(new String[0]));
        }
    }
}
