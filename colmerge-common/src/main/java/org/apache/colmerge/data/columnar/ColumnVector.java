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

/**
 * 列向量的基础接口,表示一列可为空的数据。
 *
 * <p>列向量只保存物理表示,不记录自身长度与逻辑类型;这两者由 {@link Column} 持有。
 * 具体的数据访问通过类型特定的子接口完成。
 *
 * <ul>
 *   <li>定长数值: {@link BooleanColumnVector}, {@link IntColumnVector} 等
 *   <li>变长字节: {@link BytesColumnVector}(文本与二进制共用)
 *   <li>嵌套结构: {@link ArrayColumnVector}, {@link RowColumnVector}
 *   <li>分类编码: {@link CategoricalColumnVector}
 * </ul>
 */
@Public
public interface ColumnVector {

    /**
     * 检查指定位置的值是否为 NULL。
     *
     * @param i 行索引(从0开始)
     */
    boolean isNullAt(int i);

    /**
     * 获取此列向量的子向量数组(用于数组与行类型)。
     *
     * @return 子向量数组,简单类型返回 null
     */
    default ColumnVector[] getChildren() {
        return null;
    }
}
