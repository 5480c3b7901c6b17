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
 * UTF-8 编码的变长文本类型。
 *
 * <p>值以 UTF-8 字节存储,物理表示为 {@link VarBinaryType}。按字节比较等价于按 Unicode 码点比较。
 */
@Public
public class VarCharType extends DataType {

    private static final long serialVersionUID = 1L;

    private static final String FORMAT = "STRING";

    public VarCharType(boolean isNullable) {
        super(isNullable, DataTypeRoot.VARCHAR);
    }

    public VarCharType() {
        this(true);
    }

    @Override
    public DataType copy(boolean isNullable) {
        return new VarCharType(isNullable);
    }

    @Override
    public String asSQLString() {
        return withNullability(FORMAT);
    }

    @Override
    public <R> R accept(DataTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
