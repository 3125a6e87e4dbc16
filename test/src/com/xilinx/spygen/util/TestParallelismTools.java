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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Future;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TestParallelismTools {

    @AfterEach
    public void restoreParallel() {
        ParallelismTools.setParallel(true);
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    public void testInvokeAllKeepsOrder(boolean parallel) {
        ParallelismTools.setParallel(parallel);
        List<Integer> items = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            items.add(i);
        }
        List<Future<Integer>> futures = ParallelismTools.invokeAll(items, i -> i * i);
        for (int i = 0; i < items.size(); i++) {
            Assertions.assertEquals(i * i, ParallelismTools.get(futures.get(i)));
        }
        if (!parallel) {
            Assertions.assertEquals(1, ParallelismTools.maxParallelism());
        }
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    public void testInvokeAllRethrows(boolean parallel) {
        ParallelismTools.setParallel(parallel);
        IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
                () -> ParallelismTools.invokeAll(Arrays.asList(1, 2, 3), i -> {
                    if (i == 2) throw new IllegalStateException("item " + i);
                    return i;
                }));
        Assertions.assertEquals("item 2", e.getMessage());
    }
}
