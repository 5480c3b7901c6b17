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

import org.apache.colmerge.annotation.Public;

/**
 * 行(结构体)列向量接口,每个字段对应一个与父向量等长的子向量。
 *
 * <p>{@link #isNullAt(int)} 描述的是外层 NULL,即整行缺失;字段级的 NULL 由各子向量描述。
 */
@Public
public interface RowColumnVector extends ColumnVector {

    int getFieldCount();

    ColumnVector getField(int pos);
}
