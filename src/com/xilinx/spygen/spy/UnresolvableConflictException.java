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
package com.xilinx.spygen.spy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.xilinx.spygen.hdl.HDLDesignException;

/**
 * Thrown when spied objects keep the same interface name even after every
 * enclosing instance name has been used to tell them apart.
 */
public class UnresolvableConflictException extends HDLDesignException {

    private final List<String> conflictingPaths;

    public UnresolvableConflictException(String name, List<String> conflictingPaths) {
        super("ERROR: Cannot find unique spy names, " + conflictingPaths.size() + " signals end up as "
                + name + ": " + String.join(", ", conflictingPaths));
        this.conflictingPaths = Collections.unmodifiableList(new ArrayList<>(conflictingPaths));
    }

    /**
     * @return The fully qualified references of the colliding objects.
     */
    public List<String> getConflictingPaths() {
        return conflictingPaths;
    }

    @Override
    public List<String> getOffendingNames() {
        return conflictingPaths;
    }
}
