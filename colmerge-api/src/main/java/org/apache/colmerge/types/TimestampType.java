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

/**
 * 不带时区的时间戳类型,精度固定为微秒。
 *
 * <p>物理表示为 {@link BigIntType}:自 1970-01-01T00:00:00 起的微秒数。
 */
@Public
public class TimestampType extends DataType {

    private static final long serialVersionUID = 1L;

    public static final int PRECISION = 6;

    private static final String FORMAT = "TIMESTAMP(%d)";

    public TimestampType(boolean isNullable) {
        super(isNullable, DataTypeRoot.TIMESTAMP_WITHOUT_TIME_ZONE);
    }

    public TimestampType() {
        this(true);
    }

    public int getPrecision() {
        return PRECISION;
    }

    @Override
    public DataType copy(boolean isNullable) {
        return new TimestampType(isNullable);
    }

    @Override
    public String asSQLString() {
        return withNullability(FORMAT, PRECISION);
    }

    @Override
    public <R> R accept(DataTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
