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

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 创建 {@link DataType} 的工具类,以及逻辑类型到物理表示的映射。
 *
 * <h2>物理表示</h2>
 *
 * <pre>
 * DATE              -> INT      (epoch 天数)
 * TIMESTAMP         -> BIGINT   (epoch 微秒)
 * CATEGORICAL       -> INT      (字典编码)
 * STRING            -> BYTES    (UTF-8 字节)
 * ARRAY&lt;T&gt;          -> ARRAY&lt;physical(T)&gt;
 * ROW&lt;f: T, ...&gt;     -> ROW&lt;f: physical(T), ...&gt;
 * 其余类型          -> 自身
 * </pre>
 */
@Public
public class DataTypes {

    public static BooleanType BOOLEAN() {
        return new BooleanType();
    }

    public static TinyIntType TINYINT() {
        return new TinyIntType();
    }

    public static SmallIntType SMALLINT() {
        return new SmallIntType();
    }

    public static IntType INT() {
        return new IntType();
    }

    public static BigIntType BIGINT() {
        return new BigIntType();
    }

    public static FloatType FLOAT() {
        return new FloatType();
    }

    public static DoubleType DOUBLE() {
        return new DoubleType();
    }

    public static DateType DATE() {
        return new DateType();
    }

    public static TimestampType TIMESTAMP() {
        return new TimestampType();
    }

    public static VarCharType STRING() {
        return new VarCharType();
    }

    public static VarBinaryType BYTES() {
        return new VarBinaryType();
    }

    public static CategoricalType CATEGORICAL() {
        return new CategoricalType(CategoricalOrdering.PHYSICAL);
    }

    public static CategoricalType CATEGORICAL(CategoricalOrdering ordering) {
        return new CategoricalType(ordering);
    }

    public static ArrayType ARRAY(DataType element) {
        return new ArrayType(element);
    }

    public static DataField FIELD(int id, String name, DataType type) {
        return new DataField(id, name, type);
    }

    public static RowType ROW(DataField... fields) {
        return new RowType(Arrays.asList(fields));
    }

    public static RowType ROW(DataType... fieldTypes) {
        return RowType.of(fieldTypes);
    }

    /** 返回逻辑类型对应的物理表示类型,可空标志保持不变。 */
    public static DataType toPhysical(DataType logicalType) {
        return logicalType.accept(PhysicalTypeVisitor.INSTANCE);
    }

    /** 判断逻辑类型与其物理表示是否为同一类型。 */
    public static boolean isPhysical(DataType type) {
        return toPhysical(type).equals(type);
    }

    private static class PhysicalTypeVisitor extends DataTypeDefaultVisitor<DataType> {

        private static final PhysicalTypeVisitor INSTANCE = new PhysicalTypeVisitor();

        @Override
        public DataType visit(DateType dateType) {
            return new IntType(dateType.isNullable());
        }

        @Override
        public DataType visit(TimestampType timestampType) {
            return new BigIntType(timestampType.isNullable());
        }

        @Override
        public DataType visit(CategoricalType categoricalType) {
            return new IntType(categoricalType.isNullable());
        }

        @Override
        public DataType visit(VarCharType varCharType) {
            return new VarBinaryType(varCharType.isNullable());
        }

        @Override
        public DataType visit(ArrayType arrayType) {
            return new ArrayType(arrayType.isNullable(), arrayType.getElementType().accept(this));
        }

        @Override
        public DataType visit(RowType rowType) {
            List<DataField> fields =
                    rowType.getFields().stream()
                            .map(f -> f.newType(f.type().accept(this)))
                            .collect(Collectors.toList());
            return new RowType(rowType.isNullable(), fields);
        }

        @Override
        protected DataType defaultMethod(DataType dataType) {
            return dataType;
        }
    }

    private DataTypes() {}
}
