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

package org.apache.colmerge.data.columnar.heap;

import org.apache.colmerge.data.categorical.Dictionary;
import org.apache.colmerge.data.columnar.CategoricalColumnVector;

import static org.apache.colmerge.utils.Preconditions.checkNotNull;

/**
 * 堆分类列向量:{@link HeapIntVector} 编码加上一个共享的 {@link Dictionary}。
 *
 * <p>{@link #retag(HeapIntVector, Dictionary)} 把一段物理编码重新标记为分类列,与原编码向量共享数组,
 * 不做逐元素校验;编码是否落在字典范围内由调用方保证。
 */
public class HeapCategoricalVector extends HeapIntVector implements CategoricalColumnVector {

    private static final long serialVersionUID = 1L;

    private final Dictionary dictionary;

    public HeapCategoricalVector(int len, Dictionary dictionary) {
        super(len);
        this.dictionary = checkNotNull(dictionary, "Dictionary must not be null.");
    }

    private HeapCategoricalVector(HeapIntVector codes, Dictionary dictionary) {
        super(codes);
        this.dictionary = checkNotNull(dictionary, "Dictionary must not be null.");
    }

    public static HeapCategoricalVector retag(HeapIntVector codes, Dictionary dictionary) {
        return new HeapCategoricalVector(codes, dictionary);
    }

    @Override
    public Dictionary getDictionary() {
        return dictionary;
    }
}
