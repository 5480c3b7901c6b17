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

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link ExecutorUtils}. */
public class ExecutorUtilsTest {

    @Test
    public void testAwaitAllKeepsSubmissionOrder() throws Exception {
        List<CompletableFuture<Integer>> futures =
                Arrays.asList(
                        CompletableFuture.completedFuture(3),
                        CompletableFuture.completedFuture(1),
                        CompletableFuture.completedFuture(2));

        assertThat(ExecutorUtils.awaitAllOrCancel(futures)).containsExactly(3, 1, 2);
    }

    @Test
    public void testFirstFailureCancelsPendingTasks() {
        CompletableFuture<Integer> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("boom"));
        CompletableFuture<Integer> pending = new CompletableFuture<>();

        assertThatThrownBy(() -> ExecutorUtils.awaitAllOrCancel(Arrays.asList(failed, pending)))
                .isInstanceOf(ExecutionException.class)
                .hasRootCauseInstanceOf(IllegalStateException.class)
                .hasRootCauseMessage("boom");
        assertThat(pending.isCancelled()).isTrue();
    }

    @Test
    public void testShutdownWaitsForRunningTasks() throws Exception {
        ExecutorService executor =
                Executors.newSingleThreadExecutor(new ExecutorThreadFactory("utils-test"));
        Future<String> future = executor.submit(() -> "done");

        ExecutorUtils.shutdownAndAwait(executor, 10, TimeUnit.SECONDS);

        assertThat(executor.isTerminated()).isTrue();
        assertThat(future.get()).isEqualTo("done");
    }

    @Test
    public void testShutdownForcesBlockedTasks() throws Exception {
        ExecutorService executor =
                Executors.newSingleThreadExecutor(new ExecutorThreadFactory("utils-test"));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        executor.submit(
                () -> {
                    started.countDown();
                    never.await();
                    return null;
                });
        started.await();

        ExecutorUtils.shutdownAndAwait(executor, 10, TimeUnit.MILLISECONDS);

        assertThat(executor.isShutdown()).isTrue();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
    }
}
