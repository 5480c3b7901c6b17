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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 行类型(结构体),由有序的命名字段组成。
 *
 * <p>既用于描述结构体列的类型,也用作 {@code ColumnarTable} 的 schema。字段名在同一行类型内必须唯一。
 */
@Public
public final class RowType extends DataType {

    private static final long serialVersionUID = 1L;

    public static final String FORMAT = "ROW<%s>";

    private final List<DataField> fields;

    // 延迟初始化的名称索引
    private transient volatile Map<String, Integer> laziedNameToIndex;

    public RowType(boolean isNullable, List<DataField> fields) {
        super(isNullable, DataTypeRoot.ROW);
        this.fields =
                Collections.unmodifiableList(
                        new ArrayList<>(
                                Preconditions.checkNotNull(fields, "Fields must not be null.")));

        validateFields(fields);
    }

    public RowType(List<DataField> fields) {
        this(true, fields);
    }

    public List<DataField> getFields() {
        return fields;
    }

    public List<String> getFieldNames() {
        return fields.stream().map(DataField::name).collect(Collectors.toList());
    }

    public List<DataType> getFieldTypes() {
        return fields.stream().map(DataField::type).collect(Collectors.toList());
    }

    public DataType getTypeAt(int i) {
        return fields.get(i).type();
    }

    public int getFieldCount() {
        return fields.size();
    }

    /** 返回字段位置,不存在时返回 -1。 */
    public int getFieldIndex(String fieldName) {
        return nameToIndex().getOrDefault(fieldName, -1);
    }

    public boolean containsField(String fieldName) {
        return nameToIndex().containsKey(fieldName);
    }

    @Override
    public RowType copy(boolean isNullable) {
        return new RowType(
                isNullable, fields.stream().map(DataField::copy).collect(Collectors.toList()));
    }

    @Override
    public String asSQLString() {
        return withNullability(
                FORMAT,
                fields.stream().map(DataField::asSQLString).collect(Collectors.joining(", ")));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        if (!super.equals(o)) {
            return false;
        }
        RowType rowType = (RowType) o;
        return fields.equals(rowType.fields);
    }

    /** 逐字段比较名称与类型,忽略字段 id 与所有层级的可空标志。 */
    @Override
    public boolean equalsIgnoreNullable(DataType o) {
        if (!(o instanceof RowType)) {
            return false;
        }
        RowType other = (RowType) o;
        if (fields.size() != other.fields.size()) {
            return false;
        }
        for (int i = 0; i < fields.size(); i++) {
            if (!fields.get(i).equalsIgnoreNullable(other.fields.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), fields);
    }

    @Override
    public <R> R accept(DataTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    private Map<String, Integer> nameToIndex() {
        if (laziedNameToIndex == null) {
            Map<String, Integer> nameToIndex = new HashMap<>();
            for (int i = 0; i < fields.size(); i++) {
                nameToIndex.put(fields.get(i).name(), i);
            }
            laziedNameToIndex = nameToIndex;
        }
        return laziedNameToIndex;
    }

    private static void validateFields(List<DataField> fields) {
        Set<String> names = new HashSet<>();
        for (DataField field : fields) {
            Preconditions.checkArgument(
                    names.add(field.name()),
                    "Field names must be unique. Found duplicates: %s",
                    field.name());
        }
    }

    public static RowType of(DataType... types) {
        List<DataField> fields = new ArrayList<>();
        for (int i = 0; i < types.length; i++) {
            fields.add(new DataField(i, "f" + i, types[i]));
        }
        return new RowType(true, fields);
    }

    public static RowType of(DataType[] types, String[] names) {
        Preconditions.checkArgument(
                types.length == names.length, "Types and names must have the same length.");
        List<DataField> fields = new ArrayList<>();
        for (int i = 0; i < types.length; i++) {
            fields.add(new DataField(i, names[i], types[i]));
        }
        return new RowType(true, fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** {@link RowType} 的构建器,字段 id 按添加顺序递增。 */
    public static class Builder {

        private final List<DataField> fields = new ArrayList<>();

        private boolean isNullable = true;

        public Builder field(String name, DataType type) {
            fields.add(new DataField(fields.size(), name, type));
            return this;
        }

        public Builder notNull() {
            this.isNullable = false;
            return this;
        }

        public RowType build() {
            return new RowType(isNullable, fields);
        }
    }
}
