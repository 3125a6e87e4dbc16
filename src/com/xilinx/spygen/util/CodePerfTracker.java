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
import java.util.List;

/**
 * Simple tool for measuring the runtime of the stages of a SpyGen run and reporting it.
 */
public class CodePerfTracker {

    private final String name;

    private final List<Long> runtimes = new ArrayList<>();

    private final List<String> segmentNames = new ArrayList<>();

    private final int maxRuntimeSize = 9;
    private final int maxSegmentNameSize = 24;

    private boolean verbose;

    public static final CodePerfTracker SILENT = new CodePerfTracker(null, false);

    public CodePerfTracker(String name) {
        this(name, true);
    }

    public CodePerfTracker(String name, boolean verbose) {
        this.name = name;
        this.verbose = verbose;
        if (isVerbose() && name != null) {
            MessageGenerator.printHeader(name);
        }
    }

    public boolean isVerbose() {
        return verbose && !Params.SPYGEN_QUIET;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public String getName() {
        return name;
    }

    public synchronized CodePerfTracker start(String segmentName) {
        if (this == SILENT) return this;
        segmentNames.add(segmentName);
        runtimes.add(System.nanoTime());
        return this;
    }

    public synchronized CodePerfTracker stop() {
        if (this == SILENT) return this;
        int idx = runtimes.size()-1;
        if (idx < 0) {
            throw new IllegalStateException("stop() called before start()");
        }
        long start = runtimes.get(idx);
        runtimes.set(idx, System.nanoTime()-start);
        if (isVerbose()) {
            print(idx);
        }
        return this;
    }

    /**
     * Gets the measured runtime of a stopped segment.
     * @param segmentName Name of the segment
     * @return Runtime in nanoseconds, or null if no segment of that name exists.
     */
    public synchronized Long getRuntime(String segmentName) {
        int i = segmentNames.indexOf(segmentName);
        return i == -1 ? null : runtimes.get(i);
    }

    private void print(int idx) {
        System.out.printf("%" + maxSegmentNameSize + "s: %" + maxRuntimeSize + ".3fs%n",
                segmentNames.get(idx), runtimes.get(idx) / 1000000000.0);
    }

    public synchronized void printSummary() {
        if (!isVerbose() || segmentNames.isEmpty()) return;
        long total = 0;
        for (Long runtime : runtimes) {
            total += runtime;
        }
        System.out.println("------------------------------------------------------------------------------");
        System.out.printf("%" + maxSegmentNameSize + "s: %" + maxRuntimeSize + ".3fs%n",
                "*Total*", total / 1000000000.0);
    }
}
