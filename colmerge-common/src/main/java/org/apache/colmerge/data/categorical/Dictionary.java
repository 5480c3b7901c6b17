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

import java.nio.charset.StandardCharsets;

/**
 * 分类列的字典接口,把整数编码解码为字符串。
 *
 * <h2>两种来源</h2>
 * <ul>
 *   <li>{@link LocalDictionary}: 编码只在一个列实例内有意义,以内容哈希标识身份
 *   <li>{@link GlobalDictionary}: 编码来自共享的 {@link StringInterner},以命名空间 id 标识来源,
 *       同一命名空间的字典可以合并
 * </ul>
 *
 * <p>字典是不可变值对象,可以被多个列共享;兼容性比较只看身份标识,不做逐项内容比较。
 */
@Public
public interface Dictionary {

    /** 字典中的类别数量。 */
    int size();

    /**
     * 将编码解码为字符串。
     *
     * @throws IllegalArgumentException 编码不在字典中
     */
    String decodeToString(int code);

    /** 将编码解码为 UTF-8 字节。 */
    default byte[] decodeToBinary(int code) {
        return decodeToString(code).getBytes(StandardCharsets.UTF_8);
    }

    /** 是否为全局字典。 */
    boolean isGlobal();

    /**
     * 判断两个字典是否来源相同,即编码可以直接互相比较。
     *
     * <p>本地字典要求内容哈希相同,全局字典要求命名空间相同,本地与全局之间永远不同源。
     */
    boolean sameSource(Dictionary other);
}
