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
 * Thrown when an instance refers to a module type that no analyzed file defines.
 */
public class UnresolvedInstanceException extends HDLDesignException {

    private final String missingModuleName;

    private final String parentModuleName;

    private final String instanceName;

    private final String location;

    public UnresolvedInstanceException(HDLModule parent, HDLInstance inst) {
        super("ERROR: Module " + inst.getModuleTypeName() + " instantiated as "
                + parent.getName() + "." + inst.getName() + " (" + parent.getFileName() + ":"
                + inst.getLine() + ") is not defined in any of the analyzed files");
        this.missingModuleName = inst.getModuleTypeName();
        this.parentModuleName = parent.getName();
        this.instanceName = inst.getName();
        this.location = parent.getFileName() + ":" + inst.getLine();
    }

    public String getMissingModuleName() {
        return missingModuleName;
    }

    public String getParentModuleName() {
        return parentModuleName;
    }

    public String getInstanceName() {
        return instanceName;
    }

    /**
     * @return Qualified location of the referencing instance, "parent.instance".
     */
    public String getQualifiedInstanceName() {
        return parentModuleName + "." + instanceName;
    }

    public String getLocation() {
        return location;
    }

    @Override
    public List<String> getOffendingNames() {
        return Arrays.asList(missingModuleName, getQualifiedInstanceName());
    }
}
