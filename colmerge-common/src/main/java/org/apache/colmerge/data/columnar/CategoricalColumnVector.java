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
import org.apache.colmerge.data.categorical.Dictionary;

/**
 * 分类列向量:物理上是 {@link IntColumnVector} 编码,同时携带解码用的 {@link Dictionary}。
 *
 * <p>字典由多列共享且不可变,列向量只持有引用。
 */
@Public
public interface CategoricalColumnVector extends IntColumnVector {

    Dictionary getDictionary();

    /** 返回第 i 行解码后的字符串,调用方需先确认该行不为 NULL。 */
    default String getCategory(int i) {
        return getDictionary().decodeToString(getInt(i));
    }
}
