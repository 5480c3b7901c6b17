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
 * 变长二进制类型,值为任意字节序列,按无符号字节字典序比较。
 *
 * <p>{@link VarCharType} 在归并内部也以此类型的物理形式处理。
 */
@Public
public class VarBinaryType extends DataType {

    private static final long serialVersionUID = 1L;

    private static final String FORMAT = "BYTES";

    public VarBinaryType(boolean isNullable) {
        super(isNullable, DataTypeRoot.VARBINARY);
    }

    public VarBinaryType() {
        this(true);
    }

    @Override
    public DataType copy(boolean isNullable) {
        return new VarBinaryType(isNullable);
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
