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
import org.apache.colmerge.types.DataField;
import org.apache.colmerge.types.RowType;
import org.apache.colmerge.utils.Preconditions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 由等长列组成的不可变表。
 *
 * <p>表的 schema 是列名与列类型组成的 {@link RowType},列名必须唯一。
 */
@Public
public final class ColumnarTable {

    private final RowType rowType;

    private final List<Column> columns;

    private final int numRows;

    public ColumnarTable(List<Column> columns) {
        Preconditions.checkNotNull(columns, "Columns must not be null.");
        List<DataField> fields = new ArrayList<>(columns.size());
        int rows = columns.isEmpty() ? 0 : columns.get(0).size();
        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            Preconditions.checkArgument(
                    column.size() == rows,
                    "Column '%s' has %s rows, expected %s.",
                    column.name(),
                    column.size(),
                    rows);
            fields.add(new DataField(i, column.name(), column.type()));
        }
        this.rowType = new RowType(fields);
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.numRows = rows;
    }

    public static ColumnarTable of(Column... columns) {
        return new ColumnarTable(Arrays.asList(columns));
    }

    public RowType rowType() {
        return rowType;
    }

    public List<Column> columns() {
        return columns;
    }

    public int numRows() {
        return numRows;
    }

    public int numColumns() {
        return columns.size();
    }

    public boolean isEmpty() {
        return numRows == 0;
    }

    public Column getColumn(int index) {
        Preconditions.checkElementIndex(index, columns.size());
        return columns.get(index);
    }

    /**
     * 按名称查找列。
     *
     * @throws IllegalArgumentException 不存在该列
     */
    public Column getColumn(String name) {
        int index = rowType.getFieldIndex(name);
        Preconditions.checkArgument(index >= 0, "Column '%s' does not exist.", name);
        return columns.get(index);
    }

    /** 列数、列名与列类型逐一相同(忽略可空标志)。 */
    public boolean schemaEquals(ColumnarTable other) {
        return rowType.equalsIgnoreNullable(other.rowType);
    }

    /** 逐行读取所有值,主要用于测试与调试。 */
    public List<List<Object>> toRows() {
        List<List<Object>> rows = new ArrayList<>(numRows);
        for (int r = 0; r < numRows; r++) {
            List<Object> row = new ArrayList<>(columns.size());
            for (Column column : columns) {
                row.add(column.getObject(r));
            }
            rows.add(row);
        }
        return rows;
    }

    @Override
    public String toString() {
        return "ColumnarTable{" + rowType.asSQLString() + ", rows=" + numRows + "}";
    }
}
