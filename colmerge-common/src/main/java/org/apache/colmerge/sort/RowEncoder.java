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

package org.apache.colmerge.sort;

import org.apache.colmerge.data.Column;
import org.apache.colmerge.data.columnar.ArrayColumnVector;
import org.apache.colmerge.data.columnar.BooleanColumnVector;
import org.apache.colmerge.data.columnar.ByteColumnVector;
import org.apache.colmerge.data.columnar.BytesColumnVector;
import org.apache.colmerge.data.columnar.CategoricalColumnVector;
import org.apache.colmerge.data.columnar.ColumnVector;
import org.apache.colmerge.data.columnar.DoubleColumnVector;
import org.apache.colmerge.data.columnar.FloatColumnVector;
import org.apache.colmerge.data.columnar.IntColumnVector;
import org.apache.colmerge.data.columnar.LongColumnVector;
import org.apache.colmerge.data.columnar.RowColumnVector;
import org.apache.colmerge.data.columnar.ShortColumnVector;
import org.apache.colmerge.types.ArrayType;
import org.apache.colmerge.types.CategoricalType;
import org.apache.colmerge.types.DataType;
import org.apache.colmerge.types.RowType;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;

/**
 * 把一列编码为逐行的保序字节串,升序,空值在前。
 *
 * <p>每个值先写一个有效性字节(0x00 为空,0x01 为有效),再写 {@link OrderedBytes} 给出的值编码。
 * 数组的每个元素前写续接字节 0x01,末尾写 0x00;结构体逐字段递归。分类值在字典序模式下编码解码后的
 * 字符串,否则编码其整数编码。
 *
 * <p>两行编码的无符号字节序与按字段逐个比较的结果一致,因此结构体与数组键可以复用字节比较。
 */
public final class RowEncoder {

    private static final byte CONTINUATION = 0x01;

    private static final byte END = 0x00;

    private RowEncoder() {}

    public static byte[][] encode(Column column) {
        return encode(column.type(), column.vector(), column.size());
    }

    public static byte[][] encode(DataType type, ColumnVector vector, int size) {
        byte[][] rows = new byte[size][];
        ByteArrayList buffer = new ByteArrayList();
        for (int i = 0; i < size; i++) {
            buffer.clear();
            encodeValue(type, vector, i, buffer);
            rows[i] = buffer.toByteArray();
        }
        return rows;
    }

    private static void encodeValue(DataType type, ColumnVector vector, int i, ByteArrayList out) {
        if (vector.isNullAt(i)) {
            out.add(OrderedBytes.NULL_MARKER);
            return;
        }
        out.add(OrderedBytes.VALID_MARKER);
        switch (type.getTypeRoot()) {
            case BOOLEAN:
                OrderedBytes.writeBoolean(((BooleanColumnVector) vector).getBoolean(i), out);
                break;
            case TINYINT:
                OrderedBytes.writeTinyInt(((ByteColumnVector) vector).getByte(i), out);
                break;
            case SMALLINT:
                OrderedBytes.writeSmallInt(((ShortColumnVector) vector).getShort(i), out);
                break;
            case INTEGER:
            case DATE:
                OrderedBytes.writeInt(((IntColumnVector) vector).getInt(i), out);
                break;
            case BIGINT:
            case TIMESTAMP_WITHOUT_TIME_ZONE:
                OrderedBytes.writeLong(((LongColumnVector) vector).getLong(i), out);
                break;
            case FLOAT:
                OrderedBytes.writeFloat(((FloatColumnVector) vector).getFloat(i), out);
                break;
            case DOUBLE:
                OrderedBytes.writeDouble(((DoubleColumnVector) vector).getDouble(i), out);
                break;
            case VARCHAR:
            case VARBINARY:
                BytesColumnVector.Bytes bytes = ((BytesColumnVector) vector).getBytes(i);
                OrderedBytes.writeBytes(bytes.data, bytes.offset, bytes.len, out);
                break;
            case CATEGORICAL:
                CategoricalColumnVector categorical = (CategoricalColumnVector) vector;
                int code = categorical.getInt(i);
                if (((CategoricalType) type).usesLexicalOrdering()) {
                    byte[] decoded = categorical.getDictionary().decodeToBinary(code);
                    OrderedBytes.writeBytes(decoded, 0, decoded.length, out);
                } else {
                    OrderedBytes.writeInt(code, out);
                }
                break;
            case ARRAY:
                ArrayColumnVector array = (ArrayColumnVector) vector;
                DataType elementType = ((ArrayType) type).getElementType();
                int offset = array.getOffset(i);
                int length = array.getLength(i);
                for (int k = offset; k < offset + length; k++) {
                    out.add(CONTINUATION);
                    encodeValue(elementType, array.getColumnVector(), k, out);
                }
                out.add(END);
                break;
            case ROW:
                RowColumnVector row = (RowColumnVector) vector;
                RowType rowType = (RowType) type;
                for (int f = 0; f < row.getFieldCount(); f++) {
                    encodeValue(rowType.getTypeAt(f), row.getField(f), i, out);
                }
                break;
            default:
                throw new UnsupportedOperationException("Unsupported type: " + type);
        }
    }
}
