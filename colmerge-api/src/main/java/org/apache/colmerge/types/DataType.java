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
import org.apache.colmerge.utils.Preconditions;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * 逻辑数据类型的抽象基类。
 *
 * <p>逻辑类型描述一列值的语义,由 {@link DataTypeRoot} 与可空标志组成,具体子类再补充参数化信息。
 * 列向量只保存物理表示,两者之间的映射见 {@link DataTypes#toPhysical(DataType)}。
 *
 * <p>类型之间的分派统一通过 {@link #accept(DataTypeVisitor)} 完成,避免在热点路径上使用反射。
 */
@Public
public abstract class DataType implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 标识该类型的值是否可以为 null */
    private final boolean isNullable;

    /** 该类型的根分类 */
    private final DataTypeRoot typeRoot;

    public DataType(boolean isNullable, DataTypeRoot typeRoot) {
        this.isNullable = isNullable;
        this.typeRoot = Preconditions.checkNotNull(typeRoot);
    }

    public boolean isNullable() {
        return isNullable;
    }

    public DataTypeRoot getTypeRoot() {
        return typeRoot;
    }

    /** 判断类型根是否为给定值。 */
    public boolean is(DataTypeRoot typeRoot) {
        return this.typeRoot == typeRoot;
    }

    public boolean isAnyOf(DataTypeRoot... typeRoots) {
        return Arrays.stream(typeRoots).anyMatch(tr -> this.typeRoot == tr);
    }

    /**
     * 以新的可空标志复制此类型。
     *
     * @param isNullable 新类型是否可空
     * @return 类型副本
     */
    public abstract DataType copy(boolean isNullable);

    public final DataType copy() {
        return copy(isNullable);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataType that = (DataType) o;
        return isNullable == that.isNullable && typeRoot == that.typeRoot;
    }

    /**
     * 忽略可空标志比较两个类型(嵌套类型递归忽略)。
     *
     * <p>归并时的类型一致性检查使用此方法:可空只是约束,不改变物理表示。
     */
    public boolean equalsIgnoreNullable(DataType o) {
        return o != null && Objects.equals(this.copy(true), o.copy(true));
    }

    @Override
    public int hashCode() {
        return Objects.hash(isNullable, typeRoot);
    }

    /** 返回类型的 SQL 风格字符串表示,例如 {@code INT NOT NULL}。 */
    public abstract String asSQLString();

    protected String withNullability(String format, Object... params) {
        if (!isNullable) {
            return String.format(format + " NOT NULL", params);
        }
        return String.format(format, params);
    }

    @Override
    public String toString() {
        return asSQLString();
    }

    public abstract <R> R accept(DataTypeVisitor<R> visitor);
}
