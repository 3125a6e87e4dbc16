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

import java.util.Arrays;
import java.util.List;

/**
 * Thrown when a module (transitively) instantiates itself, so the hierarchy below
 * it would never end.
 */
public class CyclicHierarchyException extends HDLDesignException {

    private final String moduleName;

    private final String path;

    public CyclicHierarchyException(String moduleName, HDLHierInst path) {
        super("ERROR: Module " + moduleName + " instantiates itself, cycle detected at "
                + path.getModuleTypePath() + " -> " + moduleName);
        this.moduleName = moduleName;
        this.path = path.getModuleTypePath();
    }

    /**
     * @return Name of the module type that appears twice on the path.
     */
    public String getModuleName() {
        return moduleName;
    }

    /**
     * @return The path at which the cycle was detected, written as
     * "top/inst(type)/inst(type)...".
     */
    public String getPath() {
        return path;
    }

    @Override
    public List<String> getOffendingNames() {
        return Arrays.asList(moduleName, path);
    }
}
