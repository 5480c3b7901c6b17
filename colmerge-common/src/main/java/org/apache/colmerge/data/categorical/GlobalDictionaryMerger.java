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

import org.apache.colmerge.utils.Preconditions;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 合并同一命名空间下的多个 {@link GlobalDictionary}。
 *
 * <p>以左侧字典为起点,{@link #merge} 追加其中尚未出现的全局编码。由于编码本身是全局的,
 * 列数据无需重写,只有字典需要覆盖并集。右侧没有新增类别时,{@link #finish()} 原样返回左侧实例。
 */
public class GlobalDictionaryMerger {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalDictionaryMerger.class);

    private final GlobalDictionary base;

    private final IntArrayList addedCodes = new IntArrayList();

    private final ObjectArrayList<String> addedCategories = new ObjectArrayList<>();

    private final IntOpenHashSet addedSet = new IntOpenHashSet();

    public GlobalDictionaryMerger(GlobalDictionary base) {
        this.base = Preconditions.checkNotNull(base);
    }

    /**
     * 将另一个字典的类别并入。
     *
     * @throws IllegalArgumentException 两个字典不在同一命名空间
     */
    public GlobalDictionaryMerger merge(GlobalDictionary other) {
        Preconditions.checkArgument(
                base.sameSource(other),
                "Cannot merge global dictionaries from namespaces %s and %s.",
                base.namespaceId(),
                other.namespaceId());
        for (int slot = 0; slot < other.size(); slot++) {
            int code = other.globalCodeAt(slot);
            if (!base.contains(code) && addedSet.add(code)) {
                addedCodes.add(code);
                addedCategories.add(other.categoryAt(slot));
            }
        }
        return this;
    }

    public GlobalDictionary finish() {
        if (addedCodes.isEmpty()) {
            return base;
        }
        int size = base.size() + addedCodes.size();
        int[] codes = new int[size];
        String[] categories = new String[size];
        for (int i = 0; i < base.size(); i++) {
            codes[i] = base.globalCodeAt(i);
            categories[i] = base.categoryAt(i);
        }
        for (int i = 0; i < addedCodes.size(); i++) {
            codes[base.size() + i] = addedCodes.getInt(i);
            categories[base.size() + i] = addedCategories.get(i);
        }
        LOG.debug(
                "Merged {} new categories into global dictionary of namespace {}.",
                addedCodes.size(),
                base.namespaceId());
        return new GlobalDictionary(base.namespaceId(), codes, categories);
    }
}
