/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of SpyGen.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.xilinx.spygen.util;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.ListIterator;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Utilities to aid in parallel processing
 *
 * A class that abstracts away single-threaded and multi-threaded execution.
 * Single-threaded mode means that all tasks submitted will be executed
 * immediately (on the submitting thread).
 */
public class ParallelismTools {

    /** A fixed-size thread pool with as many threads as there are processors
     * minus one, fed by a single task queue */
    private static final ThreadPoolExecutor pool = new ThreadPoolExecutor(
            Math.max(1, Runtime.getRuntime().availableProcessors() - 1),
            Math.max(1, Runtime.getRuntime().availableProcessors() - 1),
            0, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            (r) -> {
                Thread t = Executors.defaultThreadFactory().newThread(r);
                t.setDaemon(true);
                return t;
            });

    private static boolean parallel = true;

    static {
        String value = Params.getParamValue(Params.SPYGEN_PARALLEL_NAME);
        setParallel(value == null || Params.isSet(value));
    }

    /**
     * Global setter to control parallel processing.
     * @param parallel Enable parallel processing.
     */
    public static void setParallel(boolean parallel) {
        ParallelismTools.parallel = parallel;
        if (parallel) {
            pool.prestartAllCoreThreads();
        }
    }

    /**
     * Global getter for current parallel processing state.
     * @return Current parallel processing state.
     */
    public static boolean getParallel() {
        return parallel;
    }

    /**
     * Number of tasks that can usefully run at the same time.
     * @return 1 if parallel processing is disabled, otherwise the pool size plus the calling thread.
     */
    public static int maxParallelism() {
        return getParallel() ? pool.getMaximumPoolSize() + 1 : 1;
    }

    /**
     * Submit a task-with-return-value to the thread pool.
     * @param task Task to be performed.
     * @param <T> Type returned by task.
     * @return A Future object holding the value returned by task.
     */
    public static <T> Future<T> submit(Callable<T> task) {
        if (!getParallel()) {
            try {
                return CompletableFuture.completedFuture(task.call());
            } catch (Exception e) {
                CompletableFuture<T> f = new CompletableFuture<>();
                f.completeExceptionally(e);
                return f;
            }
        }
        return pool.submit(task);
    }

    /**
     * Block until the task behind the given Future is complete.
     * If necessary, steal the task from the job queue for immediate execution
     * on the current thread. Exceptions thrown by the task are rethrown unwrapped
     * if they are unchecked.
     * @param future Future representing previously submitted task.
     * @return Value returned by task.
     */
    public static <T> T get(Future<T> future) {
        trySteal(future);

        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            if (e.getCause() instanceof Error) {
                throw (Error) e.getCause();
            }
            throw new RuntimeException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        }
    }

    private static <T> boolean trySteal(Future<T> future) {
        boolean doneOrStolen = future.isDone();
        if (!doneOrStolen && (future instanceof Runnable)) {
            doneOrStolen = pool.remove((Runnable) future);
            if (doneOrStolen) {
                ((Runnable) future).run();
            }
        }
        return doneOrStolen;
    }

    /**
     * Apply a function to every item of a collection, using the thread pool. The
     * first item is processed on the calling thread.
     * @param items Items to process.
     * @param function Function to apply to each item.
     * @param <T> Type of the items.
     * @param <R> Type of the result.
     * @return One Future per item, in the iteration order of items. All futures are done
     * when this method returns. If a task threw, its exception is rethrown as by
     * {@link #get(Future)}.
     */
    public static <T, R> List<Future<R>> invokeAll(@NotNull Collection<T> items, Function<T, R> function) {
        List<Future<R>> futures = new ArrayList<>(items.size());
        if (items.isEmpty()) {
            return futures;
        }

        if (!getParallel()) {
            for (T item : items) {
                Future<R> f = completed(() -> function.apply(item));
                futures.add(f);
                get(f);
            }
            return futures;
        }

        boolean first = true;
        Callable<R> firstTask = null;
        for (T item : items) {
            Callable<R> task = () -> function.apply(item);
            if (first) {
                firstTask = task;
                futures.add(null);
                first = false;
            } else {
                futures.add(submit(task));
            }
        }
        futures.set(0, completed(firstTask));

        // Now walk backwards and try and steal those not done
        ListIterator<Future<R>> it = futures.listIterator(futures.size());
        while (it.hasPrevious()) {
            trySteal(it.previous());
        }

        // Now block, failing on the first task that threw
        for (Future<R> f : futures) {
            get(f);
        }
        return futures;
    }

    private static <R> CompletableFuture<R> completed(Callable<R> task) {
        CompletableFuture<R> f = new CompletableFuture<>();
        try {
            f.complete(task.call());
        } catch (Exception e) {
            f.completeExceptionally(e);
        }
        return f;
    }
}
