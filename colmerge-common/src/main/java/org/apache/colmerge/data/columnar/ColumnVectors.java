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

import org.apache.colmerge.data.categorical.Dictionary;
import org.apache.colmerge.data.categorical.GlobalDictionary;
import org.apache.colmerge.data.categorical.LocalDictionary;
import org.apache.colmerge.data.categorical.StringInterner;
import org.apache.colmerge.data.columnar.heap.HeapArrayVector;
import org.apache.colmerge.data.columnar.heap.HeapBooleanVector;
import org.apache.colmerge.data.columnar.heap.HeapByteVector;
import org.apache.colmerge.data.columnar.heap.HeapBytesVector;
import org.apache.colmerge.data.columnar.heap.HeapCategoricalVector;
import org.apache.colmerge.data.columnar.heap.HeapDoubleVector;
import org.apache.colmerge.data.columnar.heap.HeapFloatVector;
import org.apache.colmerge.data.columnar.heap.HeapIntVector;
import org.apache.colmerge.data.columnar.heap.HeapLongVector;
import org.apache.colmerge.data.columnar.heap.HeapRowVector;
import org.apache.colmerge.data.columnar.heap.HeapShortVector;
import org.apache.colmerge.types.ArrayType;
import org.apache.colmerge.types.BigIntType;
import org.apache.colmerge.types.BooleanType;
import org.apache.colmerge.types.CategoricalType;
import org.apache.colmerge.types.DataType;
import org.apache.colmerge.types.DataTypeVisitor;
import org.apache.colmerge.types.DateType;
import org.apache.colmerge.types.DoubleType;
import org.apache.colmerge.types.FloatType;
import org.apache.colmerge.types.IntType;
import org.apache.colmerge.types.RowType;
import org.apache.colmerge.types.SmallIntType;
import org.apache.colmerge.types.TimestampType;
import org.apache.colmerge.types.TinyIntType;
import org.apache.colmerge.types.VarBinaryType;
import org.apache.colmerge.types.VarCharType;

import javax.annotation.Nullable;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 在 Java 对象与堆列向量之间转换的工具方法。
 *
 * <p>对象表示: BOOLEAN/TINYINT/SMALLINT/INT/BIGINT/FLOAT/DOUBLE 对应各自的包装类型;
 * DATE 对应 {@link LocalDate}(也接受表示纪元天数的 Integer);TIMESTAMP 对应 UTC 下的
 * {@link LocalDateTime}(也接受表示纪元微秒的 Long);STRING 与 CATEGORICAL 对应 String;
 * BYTES 对应 byte[];ARRAY 与 ROW 对应 {@link List}。{@code null} 表示空值。
 */
public final class ColumnVectors {

    private ColumnVectors() {}

    /** 从对象列表构建列向量,分类值使用按首次出现顺序编码的本地字典。 */
    public static ColumnVector fromObjects(DataType type, List<?> values) {
        return type.accept(new VectorBuilder(values, null));
    }

    /** 从对象列表构建列向量,分类值(包括嵌套的)通过给定驻留器编码为全局字典。 */
    public static ColumnVector fromObjects(
            DataType type, List<?> values, @Nullable StringInterner interner) {
        return type.accept(new VectorBuilder(values, interner));
    }

    /** 用已知字典构建分类列向量,{@code codes} 中的 {@code null} 表示空值。 */
    public static HeapCategoricalVector categorical(Dictionary dictionary, List<Integer> codes) {
        HeapCategoricalVector vector = new HeapCategoricalVector(codes.size(), dictionary);
        for (Integer code : codes) {
            if (code == null) {
                vector.appendNull();
            } else {
                vector.appendInt(code);
            }
        }
        return vector;
    }

    /** 读取第 {@code i} 行的值,空值返回 {@code null}。 */
    @Nullable
    public static Object getObject(DataType type, ColumnVector vector, int i) {
        if (vector.isNullAt(i)) {
            return null;
        }
        return type.accept(new ObjectReader(vector, i));
    }

    public static List<Object> toObjectList(DataType type, ColumnVector vector, int size) {
        List<Object> result = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            result.add(getObject(type, vector, i));
        }
        return result;
    }

    static int toEpochDay(Object value) {
        if (value instanceof LocalDate) {
            return (int) ((LocalDate) value).toEpochDay();
        }
        return ((Number) value).intValue();
    }

    static long toEpochMicros(Object value) {
        if (value instanceof LocalDateTime) {
            LocalDateTime dateTime = (LocalDateTime) value;
            long seconds = dateTime.toEpochSecond(ZoneOffset.UTC);
            return seconds * 1_000_000L + dateTime.getNano() / 1_000;
        }
        return ((Number) value).longValue();
    }

    static LocalDateTime fromEpochMicros(long micros) {
        long seconds = Math.floorDiv(micros, 1_000_000L);
        int nanos = (int) Math.floorMod(micros, 1_000_000L) * 1_000;
        return LocalDateTime.ofEpochSecond(seconds, nanos, ZoneOffset.UTC);
    }

    // ------------------------------------------------------------------------

    private static class VectorBuilder implements DataTypeVisitor<ColumnVector> {

        private final List<?> values;

        @Nullable private final StringInterner interner;

        private VectorBuilder(List<?> values, @Nullable StringInterner interner) {
            this.values = values;
            this.interner = interner;
        }

        @Override
        public ColumnVector visit(BooleanType booleanType) {
            HeapBooleanVector vector = new HeapBooleanVector(values.size());
            for (Object value : values) {
                if (value == null) {
                    vector.appendNull();
                } else {
                    vector.appendBoolean((Boolean) value);
                }
            }
            return vector;
        }

        @Override
        public ColumnVector visit(TinyIntType tinyIntType) {
            HeapByteVector vector = new HeapByteVector(values.size());
            for (Object value : values) {
                if (value == null) {
                    vector.appendNull();
                } else {
                    vector.appendByte(((Number) value).byteValue());
                }
            }
            return vector;
        }

        @Override
        public ColumnVector visit(SmallIntType smallIntType) {
            HeapShortVector vector = new HeapShortVector(values.size());
            for (Object value : values) {
                if (value == null) {
                    vector.appendNull();
                } else {
                    vector.appendShort(((Number) value).shortValue());
                }
            }
            return vector;
        }

        @Override
        public ColumnVector visit(IntType intType) {
            HeapIntVector vector = new HeapIntVector(values.size());
            for (Object value : values) {
                if (value == null) {
                    vector.appendNull();
                } else {
                    vector.appendInt(((Number) value).intValue());
                }
            }
            return vector;
        }

        @Override
        public ColumnVector visit(BigIntType bigIntType) {
            HeapLongVector vector = new HeapLongVector(values.size());
            for (Object value : values) {
                if (value == null) {
                    vector.appendNull();
                } else {
                    vector.appendLong(((Number) value).longValue());
                }
            }
            return vector;
        }

        @Override
        public ColumnVector visit(FloatType floatType) {
            HeapFloatVector vector = new HeapFloatVector(values.size());
            for (Object value : values) {
                if (value == null) {
                    vector.appendNull();
                } else {
                    vector.appendFloat(((Number) value).floatValue());
                }
            }
            return vector;
        }

        @Override
        public ColumnVector visit(DoubleType doubleType) {
            HeapDoubleVector vector = new HeapDoubleVector(values.size());
            for (Object value : values) {
                if (value == null) {
                    vector.appendNull();
                } else {
                    vector.appendDouble(((Number) value).doubleValue());
                }
            }
            return vector;
        }

        @Override
        public ColumnVector visit(DateType dateType) {
            HeapIntVector vector = new HeapIntVector(values.size());
            for (Object value : values) {
                if (value == null) {
                    vector.appendNull();
                } else {
                    vector.appendInt(toEpochDay(value));
                }
            }
            return vector;
        }

        @Override
        public ColumnVector visit(TimestampType timestampType) {
            HeapLongVector vector = new HeapLongVector(values.size());
            for (Object value : values) {
                if (value == null) {
                    vector.appendNull();
                } else {
                    vector.appendLong(toEpochMicros(value));
                }
            }
            return vector;
        }

        @Override
        public ColumnVector visit(VarCharType varCharType) {
            HeapBytesVector vector = new HeapBytesVector(values.size());
            for (Object value : values) {
                if (value == null) {
                    vector.appendNull();
                } else {
                    byte[] bytes = ((String) value).getBytes(StandardCharsets.UTF_8);
                    vector.appendByteArray(bytes, 0, bytes.length);
                }
            }
            return vector;
        }

        @Override
        public ColumnVector visit(VarBinaryType varBinaryType) {
            HeapBytesVector vector = new HeapBytesVector(values.size());
            for (Object value : values) {
                if (value == null) {
                    vector.appendNull();
                } else {
                    byte[] bytes = (byte[]) value;
                    vector.appendByteArray(bytes, 0, bytes.length);
                }
            }
            return vector;
        }

        @Override
        public ColumnVector visit(CategoricalType categoricalType) {
            List<Integer> codes = new ArrayList<>(values.size());
            Dictionary dictionary;
            if (interner == null) {
                LocalDictionary.Builder builder = new LocalDictionary.Builder();
                for (Object value : values) {
                    codes.add(value == null ? null : builder.encode((String) value));
                }
                dictionary = builder.build();
            } else {
                GlobalDictionary.Builder builder = interner.newDictionaryBuilder();
                for (Object value : values) {
                    codes.add(value == null ? null : builder.encode((String) value));
                }
                dictionary = builder.build();
            }
            return categorical(dictionary, codes);
        }

        @Override
        public ColumnVector visit(ArrayType arrayType) {
            List<Object> elements = new ArrayList<>();
            for (Object value : values) {
                if (value != null) {
                    elements.addAll((List<?>) value);
                }
            }
            ColumnVector child =
                    arrayType.getElementType().accept(new VectorBuilder(elements, interner));
            HeapArrayVector vector = new HeapArrayVector(values.size(), child);
            for (Object value : values) {
                if (value == null) {
                    vector.appendNull();
                } else {
                    vector.appendArray(((List<?>) value).size());
                }
            }
            return vector;
        }

        @Override
        public ColumnVector visit(RowType rowType) {
            int fieldCount = rowType.getFieldCount();
            ColumnVector[] fields = new ColumnVector[fieldCount];
            for (int f = 0; f < fieldCount; f++) {
                List<Object> fieldValues = new ArrayList<>(values.size());
                for (Object value : values) {
                    fieldValues.add(value == null ? null : ((List<?>) value).get(f));
                }
                fields[f] = rowType.getTypeAt(f).accept(new VectorBuilder(fieldValues, interner));
            }
            HeapRowVector vector = new HeapRowVector(values.size(), fields);
            for (Object value : values) {
                if (value == null) {
                    vector.appendNull();
                } else {
                    vector.appendRow();
                }
            }
            return vector;
        }
    }

    private static class ObjectReader implements DataTypeVisitor<Object> {

        private final ColumnVector vector;

        private final int row;

        private ObjectReader(ColumnVector vector, int row) {
            this.vector = vector;
            this.row = row;
        }

        @Override
        public Object visit(BooleanType booleanType) {
            return ((BooleanColumnVector) vector).getBoolean(row);
        }

        @Override
        public Object visit(TinyIntType tinyIntType) {
            return ((ByteColumnVector) vector).getByte(row);
        }

        @Override
        public Object visit(SmallIntType smallIntType) {
            return ((ShortColumnVector) vector).getShort(row);
        }

        @Override
        public Object visit(IntType intType) {
            return ((IntColumnVector) vector).getInt(row);
        }

        @Override
        public Object visit(BigIntType bigIntType) {
            return ((LongColumnVector) vector).getLong(row);
        }

        @Override
        public Object visit(FloatType floatType) {
            return ((FloatColumnVector) vector).getFloat(row);
        }

        @Override
        public Object visit(DoubleType doubleType) {
            return ((DoubleColumnVector) vector).getDouble(row);
        }

        @Override
        public Object visit(DateType dateType) {
            return LocalDate.ofEpochDay(((IntColumnVector) vector).getInt(row));
        }

        @Override
        public Object visit(TimestampType timestampType) {
            return fromEpochMicros(((LongColumnVector) vector).getLong(row));
        }

        @Override
        public Object visit(VarCharType varCharType) {
            return ((BytesColumnVector) vector).getBytes(row).toUtf8String();
        }

        @Override
        public Object visit(VarBinaryType varBinaryType) {
            BytesColumnVector.Bytes bytes = ((BytesColumnVector) vector).getBytes(row);
            byte[] copy = new byte[bytes.len];
            System.arraycopy(bytes.data, bytes.offset, copy, 0, bytes.len);
            return copy;
        }

        @Override
        public Object visit(CategoricalType categoricalType) {
            return ((CategoricalColumnVector) vector).getCategory(row);
        }

        @Override
        public Object visit(ArrayType arrayType) {
            ArrayColumnVector array = (ArrayColumnVector) vector;
            int offset = array.getOffset(row);
            int length = array.getLength(row);
            List<Object> elements = new ArrayList<>(length);
            for (int k = offset; k < offset + length; k++) {
                elements.add(getObject(arrayType.getElementType(), array.getColumnVector(), k));
            }
            return elements;
        }

        @Override
        public Object visit(RowType rowType) {
            RowColumnVector struct = (RowColumnVector) vector;
            List<Object> fields = new ArrayList<>(struct.getFieldCount());
            for (int f = 0; f < struct.getFieldCount(); f++) {
                fields.add(getObject(rowType.getTypeAt(f), struct.getField(f), row));
            }
            return Collections.unmodifiableList(fields);
        }
    }
}
