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

package org.apache.colmerge.merge;

/**
 * 有序合并失败的基类异常。
 *
 * <p>任何失败都会中止整个合并,不会返回部分结果。调用方只能修正输入后重新调用。
 *
 * <ul>
 *   <li>{@link SchemaMismatchException}: 两张表的列名或列类型不一致
 *   <li>{@link DataTypeMismatchException}: 两侧合并键或同位置列的类型不一致
 *   <li>{@link IncompatibleCategoricalsException}: 分类列的字典来源不同
 * </ul>
 */
public class MergeSortedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message 错误消息模板,使用 {@link String#format(String, Object...)} 语法
     * @param args 格式化参数
     */
    public MergeSortedException(String message, Object... args) {
        super(String.format(message, args));
    }

    public MergeSortedException(Throwable cause, String message, Object... args) {
        super(String.format(message, args), cause);
    }
}
