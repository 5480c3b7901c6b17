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
 * {@link DataType} 的访问者,实现对封闭类型集合的逐类型分派。
 *
 * <p>新增类型时编译器会强制所有访问者补齐对应分支,这是对类型集合做穷举分派的方式。
 *
 * @param <R> 访问结果类型
 */
@Public
public interface DataTypeVisitor<R> {

    R visit(BooleanType booleanType);

    R visit(TinyIntType tinyIntType);

    R visit(SmallIntType smallIntType);

    R visit(IntType intType);

    R visit(BigIntType bigIntType);

    R visit(FloatType floatType);

    R visit(DoubleType doubleType);

    R visit(DateType dateType);

    R visit(TimestampType timestampType);

    R visit(VarCharType varCharType);

    R visit(VarBinaryType varBinaryType);

    R visit(CategoricalType categoricalType);

    R visit(ArrayType arrayType);

    R visit(RowType rowType);
}
