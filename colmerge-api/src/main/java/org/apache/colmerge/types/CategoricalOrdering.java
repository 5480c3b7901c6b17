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

package org.apache.colmerge.types;

import org.apache.colmerge.annotation.Public;

/** 分类类型的排序语义。 */
@Public
public enum CategoricalOrdering {

    /** 按物理编码(整数)排序。 */
    PHYSICAL,

    /**
     * 按解码后的字符串字典序排序。
     *
     * <p>不同字典的编码互相不可比较,因此以此语义作为归并键时,比较在字符串视图上进行。
     */
    LEXICAL
}
