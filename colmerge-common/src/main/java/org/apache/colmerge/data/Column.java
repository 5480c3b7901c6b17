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

package org.apache.colmerge.data;

import org.apache.colmerge.annotation.Public;
import org.apache.colmerge.data.categorical.StringInterner;
import org.apache.colmerge.data.columnar.CategoricalColumnVector;
import org.apache.colmerge.data.columnar.ColumnVector;
import org.apache.colmerge.data.columnar.ColumnVectors;
import org.apache.colmerge.types.DataType;
import org.apache.colmerge.types.DataTypeRoot;
import org.apache.colmerge.types.DataTypes;
import org.apache.colmerge.utils.Preconditions;

import javax.annotation.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * 带名称与逻辑类型的列,底层数据由 {@link ColumnVector} 持有。
 *
 * <p>列不可变:重命名或转换类型都返回共享同一向量的新实例。
 */
@Public
public final class Column {

    private final String name;

    private final DataType type;

    private final ColumnVector vector;

    private final int size;

    public Column(String name, DataType type, ColumnVector vector, int size) {
        this.name = Preconditions.checkNotNull(name, "Column name must not be null.");
        this.type = Preconditions.checkNotNull(type, "Column type must not be null.");
        this.vector = Preconditions.checkNotNull(vector, "Column vector must not be null.");
        Preconditions.checkArgument(size >= 0, "Column size must not be negative: %s", size);
        this.size = size;
    }

    public static Column of(String name, DataType type, List<?> values) {
        return new Column(name, type, ColumnVectors.fromObjects(type, values), values.size());
    }

    public static Column of(String name, DataType type, Object... values) {
        return of(name, type, Arrays.asList(values));
    }

    /** 构建列,其中的分类值通过 {@code interner} 编码为全局字典。 */
    public static Column ofGlobal(
            String name, DataType type, StringInterner interner, List<?> values) {
        return new Column(
                name, type, ColumnVectors.fromObjects(type, values, interner), values.size());
    }

    public String name() {
        return name;
    }

    public DataType type() {
        return type;
    }

    public ColumnVector vector() {
        return vector;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isNullAt(int i) {
        return vector.isNullAt(i);
    }

    public Column rename(String newName) {
        return new Column(newName, type, vector, size);
    }

    @Nullable
    public Object getObject(int i) {
        Preconditions.checkElementIndex(i, size);
        return ColumnVectors.getObject(type, vector, i);
    }

    public List<Object> toObjectList() {
        return ColumnVectors.toObjectList(type, vector, size);
    }

    /** 返回物理表示视图:类型换成物理类型,数据不复制。 */
    public Column toPhysical() {
        DataType physical = DataTypes.toPhysical(type);
        return physical.equals(type) ? this : new Column(name, physical, vector, size);
    }

    /**
     * 把物理表示的列重新解释为 {@code logicalType},不做转换。
     *
     * <p>调用方需保证物理类型与逻辑类型对应;该前提只在启用断言时检查。
     */
    public Column fromPhysicalUnchecked(DataType logicalType) {
        assert DataTypes.toPhysical(logicalType).equalsIgnoreNullable(DataTypes.toPhysical(type))
                : "Physical type " + type + " does not represent " + logicalType;
        assert !logicalType.is(DataTypeRoot.CATEGORICAL)
                        || vector instanceof CategoricalColumnVector
                : "Categorical column requires a dictionary-tagged vector";
        return new Column(name, logicalType, vector, size);
    }

    @Override
    public String toString() {
        return name + ": " + type.asSQLString() + " " + toObjectList();
    }
}
