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
import org.apache.colmerge.utils.MurmurHashUtils;
import org.apache.colmerge.utils.Preconditions;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 本地字典:编码 {@code 0..n-1} 依次对应类别列表中的字符串。
 *
 * <p>身份由构造时计算的 64 位内容哈希表示。两个内容与顺序完全相同的本地字典哈希相同,
 * 因此被视为同源,编码可以直接比较。
 */
@Public
public final class LocalDictionary implements Dictionary {

    private final List<String> categories;

    private final long contentHash;

    private LocalDictionary(List<String> categories) {
        this.categories = Collections.unmodifiableList(new ArrayList<>(categories));
        this.contentHash = hashCategories(this.categories);
    }

    public static LocalDictionary of(String... categories) {
        return of(Arrays.asList(categories));
    }

    public static LocalDictionary of(List<String> categories) {
        Preconditions.checkNotNull(categories, "Categories must not be null.");
        Object2IntOpenHashMap<String> seen = new Object2IntOpenHashMap<>();
        seen.defaultReturnValue(-1);
        for (String category : categories) {
            Preconditions.checkArgument(category != null, "Categories must not contain null.");
            Preconditions.checkArgument(
                    seen.put(category, seen.size()) == seen.defaultReturnValue(),
                    "Duplicate category: %s",
                    category);
        }
        return new LocalDictionary(categories);
    }

    public long contentHash() {
        return contentHash;
    }

    public List<String> categories() {
        return categories;
    }

    @Override
    public int size() {
        return categories.size();
    }

    @Override
    public String decodeToString(int code) {
        Preconditions.checkArgument(
                code >= 0 && code < categories.size(),
                "Code %s is out of range for a local dictionary of size %s.",
                code,
                categories.size());
        return categories.get(code);
    }

    @Override
    public boolean isGlobal() {
        return false;
    }

    @Override
    public boolean sameSource(Dictionary other) {
        return other instanceof LocalDictionary
                && ((LocalDictionary) other).contentHash == contentHash;
    }

    @Override
    public String toString() {
        return "LocalDictionary{hash=" + Long.toHexString(contentHash) + ", " + categories + "}";
    }

    private static long hashCategories(List<String> categories) {
        long hash = categories.size();
        for (String category : categories) {
            byte[] bytes = category.getBytes(StandardCharsets.UTF_8);
            int h = MurmurHashUtils.hashBytes(bytes, 0, bytes.length, MurmurHashUtils.DEFAULT_SEED);
            hash = MurmurHashUtils.fmix(hash * 31 + (h & 0xFFFFFFFFL));
        }
        return hash;
    }

    // ------------------------------------------------------------------------

    /** 按首次出现的顺序为字符串分配编码,构建本地字典。 */
    public static class Builder {

        private final Object2IntMap<String> codes = new Object2IntOpenHashMap<>();

        private final List<String> categories = new ArrayList<>();

        public Builder() {
            codes.defaultReturnValue(-1);
        }

        /** 返回字符串的编码,首次出现时分配新编码。 */
        public int encode(String value) {
            Preconditions.checkNotNull(value, "Categories must not contain null.");
            int code = codes.getInt(value);
            if (code < 0) {
                code = categories.size();
                codes.put(value, code);
                categories.add(value);
            }
            return code;
        }

        public LocalDictionary build() {
            return new LocalDictionary(categories);
        }
    }
}
