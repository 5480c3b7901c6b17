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

import org.apache.colmerge.options.ConfigOption;

import static org.apache.colmerge.options.ConfigOptions.key;

/** 有序合并的配置项。 */
public class MergeSortedOptions {

    public static final ConfigOption<Boolean> CHECK_SCHEMA =
            key("merge-sorted.check-schema")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription(
                            "Whether merging by key name requires both tables to have identical "
                                    + "column names and types in identical order.");

    public static final ConfigOption<Integer> PARALLELISM =
            key("merge-sorted.parallelism")
                    .intType()
                    .defaultValue(1)
                    .withDescription(
                            "Number of worker threads used to interleave columns. "
                                    + "1 merges all columns on the calling thread.");

    public static final ConfigOption<Boolean> VALIDATE_SORTED =
            key("merge-sorted.validate-sorted")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether to verify that both key columns are ascending before merging. "
                                    + "Unsorted input is reported, never sorted.");

    private MergeSortedOptions() {}
}
