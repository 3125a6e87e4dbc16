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
 * Thrown when no module qualifies as top module: every module is instantiated by
 * another one (the instantiation graph has no root), the registry is empty, or an
 * explicitly requested top module does not exist.
 */
public class NoTopModuleException extends HDLDesignException {

    private final String requestedTop;

    private final List<String> modulesOnCycles;

    public NoTopModuleException(int moduleCount) {
        this(moduleCount, Collections.emptyList());
    }

    /**
     * @param moduleCount Number of modules in the registry
     * @param modulesOnCycles Modules instantiating themselves through other modules
     */
    public NoTopModuleException(int moduleCount, Collection<String> modulesOnCycles) {
        super(moduleCount == 0
                ? "ERROR: Top module wasn't found, no modules were parsed."
                : "ERROR: Top module wasn't found, all " + moduleCount + " modules are instantiated "
                    + "by another module" + (modulesOnCycles.isEmpty() ? ""
                    : " (instantiation cycle through " + String.join(", ", modulesOnCycles) + ")")
                    + ". Try to specify it explicitly");
        this.requestedTop = null;
        this.modulesOnCycles = Collections.unmodifiableList(new ArrayList<>(modulesOnCycles));
    }

    public NoTopModuleException(String requestedTop) {
        super("ERROR: Requested top module " + requestedTop + " is not defined in any of the analyzed files");
        this.requestedTop = requestedTop;
        this.modulesOnCycles = Collections.emptyList();
    }

    /**
     * @return The explicitly requested top module name that was not found, or null.
     */
    public String getRequestedTop() {
        return requestedTop;
    }

    /**
     * @return The modules on instantiation cycles when every module is instantiated, else empty.
     */
    public List<String> getModulesOnCycles() {
        return modulesOnCycles;
    }

    @Override
    public List<String> getOffendingNames() {
        return requestedTop == null ? modulesOnCycles : Collections.singletonList(requestedTop);
    }
}
