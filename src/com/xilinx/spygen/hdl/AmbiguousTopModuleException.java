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

package com.xilinx.spygen.hdl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when more than one module is never instantiated.
 */
public class AmbiguousTopModuleException extends HDLDesignException {

    private final List<String> candidates;

    public AmbiguousTopModuleException(Collection<String> candidates) {
        super("ERROR: More than one potential top module detected: " + String.join(", ", sorted(candidates))
                + ". Try to specify it explicitly");
        this.candidates = Collections.unmodifiableList(sorted(candidates));
    }

    private static List<String> sorted(Collection<String> candidates) {
        List<String> list = new ArrayList<>(candidates);
        Collections.sort(list);
        return list;
    }

    /**
     * @return All top module candidates, sorted by name.
     */
    public List<String> getCandidates() {
        return candidates;
    }

    @Override
    public List<String> getOffendingNames() {
        return candidates;
    }
}
