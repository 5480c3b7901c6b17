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

import org.apache.colmerge.types.DataType;
import org.apache.colmerge.types.DataTypes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 数据格式测试工具类。
 *
 * <p>把列与表转换为可读字符串,便于断言;并提供构造常用测试表的便捷方法。
 */
public class DataFormatTestUtil {

    /** 将第 {@code row} 行转换为 "field1, field2, ..." 形式,空值写作 NULL。 */
    public static String rowToString(ColumnarTable table, int row) {
        StringBuilder build = new StringBuilder();
        for (int i = 0; i < table.numColumns(); i++) {
            if (i != 0) {
                build.append(", ");
            }
            build.append(getDataFieldString(table.getColumn(i).getObject(row)));
        }
        return build.toString();
    }

    public static List<String> toStrings(ColumnarTable table) {
        List<String> rows = new ArrayList<>(table.numRows());
        for (int r = 0; r < table.numRows(); r++) {
            rows.add(rowToString(table, r));
        }
        return rows;
    }

    /** 递归转换字段值,byte[] 与嵌套列表展开为数组形式。 */
    public static String getDataFieldString(Object field) {
        if (field == null) {
            return "NULL";
        }
        if (field instanceof byte[]) {
            return Arrays.toString((byte[]) field);
        }
        if (field instanceof List) {
            List<?> list = (List<?>) field;
            String[] result = new String[list.size()];
            for (int i = 0; i < list.size(); i++) {
                result[i] = getDataFieldString(list.get(i));
            }
            return Arrays.toString(result);
        }
        return field.toString();
    }

    public static Column intColumn(String name, Integer... values) {
        return Column.of(name, DataTypes.INT(), Arrays.asList(values));
    }

    public static Column column(String name, DataType type, Object... values) {
        return Column.of(name, type, Arrays.asList(values));
    }
}
