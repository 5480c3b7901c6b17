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

/**
 * 数据类型根枚举,是对逻辑类型的基本分类。
 *
 * <p>类型根与 {@link DataType} 子类一一对应,用于快速判断类型而不需要 instanceof。
 * 参数化信息(如数组元素类型、行字段、分类排序方式)保存在具体的 {@link DataType} 中。
 */
@Public
public enum DataTypeRoot {
    /** 布尔类型,取值为 true 或 false。 */
    BOOLEAN,

    /** 1 字节有符号整数类型。 */
    TINYINT,

    /** 2 字节有符号整数类型。 */
    SMALLINT,

    /** 4 字节有符号整数类型。 */
    INTEGER,

    /** 8 字节有符号整数类型。 */
    BIGINT,

    /** 单精度浮点数类型(4 字节,IEEE 754)。 */
    FLOAT,

    /** 双精度浮点数类型(8 字节,IEEE 754)。 */
    DOUBLE,

    /** 日期类型,物理表示为自 1970-01-01 起的天数(INT)。 */
    DATE,

    /** 不带时区的时间戳类型,物理表示为自 epoch 起的微秒数(BIGINT)。 */
    TIMESTAMP_WITHOUT_TIME_ZONE,

    /** UTF-8 编码的变长文本类型。 */
    VARCHAR,

    /** 变长二进制类型。 */
    VARBINARY,

    /** 分类类型,物理表示为 INT 编码,配合字典解码为字符串。 */
    CATEGORICAL,

    /** 数组类型,表示相同类型元素的有序集合。 */
    ARRAY,

    /** 行类型(结构体),表示命名字段的有序集合。 */
    ROW
}
