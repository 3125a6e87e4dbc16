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
 * Thrown when two module definitions share the same name.
 */
public class DuplicateModuleException extends HDLDesignException {

    private final String moduleName;

    private final String firstLocation;

    private final String secondLocation;

    public DuplicateModuleException(HDLModule existing, HDLModule duplicate) {
        super("ERROR: Module " + duplicate.getName() + " is defined twice: first in "
                + existing.getLocation() + ", again in " + duplicate.getLocation());
        this.moduleName = duplicate.getName();
        this.firstLocation = existing.getLocation();
        this.secondLocation = duplicate.getLocation();
    }

    public String getModuleName() {
        return moduleName;
    }

    public String getFirstLocation() {
        return firstLocation;
    }

    public String getSecondLocation() {
        return secondLocation;
    }

    @Override
    public List<String> getOffendingNames() {
        return Arrays.asList(moduleName, firstLocation, secondLocation);
    }
}
