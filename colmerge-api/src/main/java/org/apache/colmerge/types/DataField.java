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
import java.util.Objects;

/**
 * 行类型中的一个命名字段。
 *
 * <p>字段由位置 id、名称和类型组成,是不可变对象。
 */
@Public
public final class DataField implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int id;

    private final String name;

    private final DataType type;

    public DataField(int id, String name, DataType type) {
        this.id = id;
        this.name = Preconditions.checkNotNull(name, "Field name must not be null.");
        this.type = Preconditions.checkNotNull(type, "Field type must not be null.");
    }

    public int id() {
        return id;
    }

    public String name() {
        return name;
    }

    public DataType type() {
        return type;
    }

    public DataField newName(String newName) {
        return new DataField(id, newName, type);
    }

    public DataField newType(DataType newType) {
        return new DataField(id, name, newType);
    }

    public DataField copy() {
        return new DataField(id, name, type.copy());
    }

    public String asSQLString() {
        return "`" + name.replace("`", "``") + "` " + type.asSQLString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataField field = (DataField) o;
        return id == field.id && name.equals(field.name) && type.equals(field.type);
    }

    /** 比较名称与类型(忽略 id 与可空标志)。 */
    public boolean equalsIgnoreNullable(DataField other) {
        return other != null && name.equals(other.name) && type.equalsIgnoreNullable(other.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type);
    }

    @Override
    public String toString() {
        return asSQLString();
    }
}
