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

import org.apache.colmerge.utils.BooleanArrayList;
import org.apache.colmerge.utils.Preconditions;

import java.util.Arrays;

/**
 * 合并指示序列:每个输出行一位,{@code true} 表示下一行取自左侧输入,{@code false} 表示取自右侧。
 *
 * <p>序列长度等于左右行数之和,其中恰好有左侧行数个 {@code true}。构造后不可变,可以在并行合并列时
 * 被多个线程共享。
 */
public final class MergeIndicator {

    private final boolean[] bits;

    private final int leftCount;

    private MergeIndicator(boolean[] bits, int leftCount) {
        this.bits = bits;
        this.leftCount = leftCount;
    }

    static MergeIndicator of(BooleanArrayList bits, int leftCount) {
        MergeIndicator indicator = new MergeIndicator(bits.toArray(), leftCount);
        Preconditions.checkState(
                indicator.countLeft() == leftCount,
                "Merge indicator takes %s left rows, expected %s.",
                indicator.countLeft(),
                leftCount);
        return indicator;
    }

    public static MergeIndicator allLeft(int leftLen) {
        boolean[] bits = new boolean[leftLen];
        Arrays.fill(bits, true);
        return new MergeIndicator(bits, leftLen);
    }

    public static MergeIndicator allRight(int rightLen) {
        return new MergeIndicator(new boolean[rightLen], 0);
    }

    /** 第 {@code i} 个输出行是否取自左侧。 */
    public boolean isLeft(int i) {
        return bits[i];
    }

    public int size() {
        return bits.length;
    }

    public int leftCount() {
        return leftCount;
    }

    public int rightCount() {
        return bits.length - leftCount;
    }

    public boolean[] toArray() {
        return Arrays.copyOf(bits, bits.length);
    }

    private int countLeft() {
        int count = 0;
        for (boolean bit : bits) {
            if (bit) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(bits.length);
        for (boolean bit : bits) {
            sb.append(bit ? 'T' : 'F');
        }
        return sb.toString();
    }
}
