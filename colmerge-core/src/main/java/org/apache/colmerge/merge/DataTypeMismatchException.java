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

package org.apache.colmerge.merge;

import org.apache.colmerge.types.DataType;

/** 参与合并的两列类型不同,消息中同时给出两侧类型。 */
public class DataTypeMismatchException extends MergeSortedException {

    private static final long serialVersionUID = 1L;

    public DataTypeMismatchException(DataType left, DataType right) {
        super("merge-sort datatype mismatch: %s != %s", left.asSQLString(), right.asSQLString());
    }
}
