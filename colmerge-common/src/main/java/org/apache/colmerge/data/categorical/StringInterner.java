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

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import javax.annotation.concurrent.ThreadSafe;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 字符串驻留器,为字符串分配在同一命名空间内稳定的全局编码。
 *
 * <p>每个驻留器拥有唯一的命名空间 id。来自同一驻留器的 {@link GlobalDictionary} 编码可以直接比较,
 * 并且可以合并;不同驻留器之间的编码毫无关系。{@link #global()} 返回进程级共享的默认命名空间。
 */
@Public
@ThreadSafe
public final class StringInterner {

    private static final AtomicLong NAMESPACE_COUNTER = new AtomicLong();

    private static final StringInterner GLOBAL = new StringInterner();

    private final long namespaceId;

    private final Object2IntOpenHashMap<String> codes;

    private final ObjectArrayList<String> strings;

    public StringInterner() {
        this.namespaceId = NAMESPACE_COUNTER.incrementAndGet();
        this.codes = new Object2IntOpenHashMap<>();
        this.codes.defaultReturnValue(-1);
        this.strings = new ObjectArrayList<>();
    }

    /** 进程级共享的驻留器。 */
    public static StringInterner global() {
        return GLOBAL;
    }

    public long namespaceId() {
        return namespaceId;
    }

    /** 返回字符串的全局编码,首次出现时分配新编码。 */
    public synchronized int intern(String value) {
        Preconditions.checkNotNull(value, "Interned strings must not be null.");
        int code = codes.getInt(value);
        if (code < 0) {
            code = strings.size();
            codes.put(value, code);
            strings.add(value);
        }
        return code;
    }

    /** 根据全局编码取回字符串。 */
    public synchronized String lookup(int code) {
        Preconditions.checkArgument(
                code >= 0 && code < strings.size(),
                "Global code %s is unknown to namespace %s.",
                code,
                namespaceId);
        return strings.get(code);
    }

    public synchronized int size() {
        return strings.size();
    }

    /** 在当前命名空间中构建一个新的全局字典。 */
    public GlobalDictionary.Builder newDictionaryBuilder() {
        return new GlobalDictionary.Builder(this);
    }

    @Override
    public String toString() {
        return "StringInterner{namespace=" + namespaceId + "}";
    }
}
