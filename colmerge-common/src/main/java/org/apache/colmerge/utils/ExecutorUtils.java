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

package org.apache.colmerge.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/** 收集并行任务结果以及关闭线程池的工具方法。 */
public class ExecutorUtils {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutorUtils.class);

    private ExecutorUtils() {}

    /**
     * 按提交顺序等待全部任务并返回结果。
     *
     * <p>任一任务失败或等待被中断时,先取消其余任务再抛出原异常,不会返回部分结果。
     *
     * @throws ExecutionException 某个任务失败,原因即任务抛出的异常
     * @throws InterruptedException 等待期间当前线程被中断
     */
    public static <T> List<T> awaitAllOrCancel(List<? extends Future<T>> futures)
            throws ExecutionException, InterruptedException {
        List<T> results = new ArrayList<>(futures.size());
        try {
            for (Future<T> future : futures) {
                results.add(future.get());
            }
        } catch (ExecutionException | InterruptedException e) {
            int cancelled = cancelAll(futures);
            LOG.debug(
                    "Cancelled {} pending tasks after {}.",
                    cancelled,
                    e.getClass().getSimpleName());
            throw e;
        }
        return results;
    }

    /** 取消所有尚未结束的任务,返回实际被取消的数量。 */
    public static int cancelAll(Collection<? extends Future<?>> futures) {
        int cancelled = 0;
        for (Future<?> future : futures) {
            if (future.cancel(true)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    /**
     * 关闭线程池并在超时时间内等待其结束。
     *
     * <p>超时或等待被中断时强制关闭,正在执行的任务会收到中断;被中断时恢复当前线程的中断标志。
     */
    public static void shutdownAndAwait(ExecutorService executor, long timeout, TimeUnit unit) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout, unit)) {
                List<Runnable> dropped = executor.shutdownNow();
                LOG.warn(
                        "Executor did not terminate within {} {}, forced shutdown dropped {} "
                                + "queued tasks.",
                        timeout,
                        unit,
                        dropped.size());
            }
        } catch (InterruptedException e) {
            LOG.warn("Interrupted while waiting for the executor to terminate.", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
