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
 * 数组列向量接口。
 *
 * <p>第 i 行的数组由子向量中 {@code [getOffset(i), getOffset(i) + getLength(i))} 范围内的元素组成,
 * 为 NULL 的行长度为 0。
 */
@Public
public interface ArrayColumnVector extends ColumnVector {

    int getOffset(int i);

    int getLength(int i);

    /** 返回存储所有元素的子向量。 */
    ColumnVector getColumnVector();
}
