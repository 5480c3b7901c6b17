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

import java.util.Objects;

/**
 * 分类类型:整数编码加字典。
 *
 * <p>类型本身只携带排序语义 {@link CategoricalOrdering},字典随列向量保存。因此两个分类列即使
 * 类型相等,字典也可能来源不同,归并前需要单独做来源校验。
 *
 * <p>物理表示为 {@link IntType}。
 */
@Public
public class CategoricalType extends DataType {

    private static final long serialVersionUID = 1L;

    private static final String FORMAT = "CATEGORICAL(%s)";

    private final CategoricalOrdering ordering;

    public CategoricalType(boolean isNullable, CategoricalOrdering ordering) {
        super(isNullable, DataTypeRoot.CATEGORICAL);
        this.ordering = Preconditions.checkNotNull(ordering, "Ordering must not be null.");
    }

    public CategoricalType(CategoricalOrdering ordering) {
        this(true, ordering);
    }

    public CategoricalType() {
        this(true, CategoricalOrdering.PHYSICAL);
    }

    public CategoricalOrdering getOrdering() {
        return ordering;
    }

    public boolean usesLexicalOrdering() {
        return ordering == CategoricalOrdering.LEXICAL;
    }

    @Override
    public DataType copy(boolean isNullable) {
        return new CategoricalType(isNullable, ordering);
    }

    @Override
    public String asSQLString() {
        return withNullability(FORMAT, ordering);
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        return ordering == ((CategoricalType) o).ordering;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), ordering);
    }

    @Override
    public <R> R accept(DataTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
