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

import java.util.Arrays;
import java.util.List;

import com.xilinx.spygen.hdl.HDLDesignException;
import com.xilinx.spygen.hdl.HDLHierInst;
import com.xilinx.spygen.hdl.HDLInstance;
import com.xilinx.spygen.hdl.HDLSignal;

/**
 * Thrown when a register or an instance cannot be referenced hierarchically
 * without elaborating the design: it sits in a loop or unnamed generate block, or
 * the instance is an instance array. Leaving it out would silently drop spy
 * signals, so the run stops unless skipping was requested.
 */
public class UnobservableObjectException extends HDLDesignException {

    private final String moduleName;

    private final String objectName;

    private final String reference;

    private final String location;

    private UnobservableObjectException(String message, HDLHierInst path, String objectName, int line) {
        super(message);
        this.moduleName = path.getModule().getName();
        this.objectName = objectName;
        this.reference = path.getHierarchicalReference(objectName);
        this.location = path.getModule().getFileName() + ":" + line;
    }

    public static UnobservableObjectException forRegister(HDLHierInst path, HDLSignal signal) {
        return new UnobservableObjectException("ERROR: Register " + signal.getScopedName() + " of module "
                + path.getModule().getName() + " (" + path.getModule().getFileName() + ":" + signal.getLine()
                + ") sits in a loop or unnamed generate block and has no hierarchical name without "
                + "elaboration. Use --skip-unobservable to leave such objects out",
                path, signal.getScopedName(), signal.getLine());
    }

    public static UnobservableObjectException forInstance(HDLHierInst path, HDLInstance inst) {
        return new UnobservableObjectException("ERROR: Instance " + inst.getScopedName() + inst.getArrayDims()
                + " of module " + inst.getModuleTypeName() + " in module " + path.getModule().getName()
                + " (" + path.getModule().getFileName() + ":" + inst.getLine() + ") is an instance array or "
                + "sits in a generate block that has no hierarchical name without elaboration. "
                + "Use --skip-unobservable to leave such objects out",
                path, inst.getScopedName(), inst.getLine());
    }

    /**
     * @return Name of the module declaring the object.
     */
    public String getModuleName() {
        return moduleName;
    }

    /**
     * @return Name of the object inside its module, generate scope included.
     */
    public String getObjectName() {
        return objectName;
    }

    /**
     * @return Reference to the object as it would be written from the top, e.g. "top.i_rx.cnt_s".
     */
    public String getReference() {
        return reference;
    }

    /**
     * @return "file:line" of the declaration.
     */
    public String getLocation() {
        return location;
    }

    @Override
    public List<String> getOffendingNames() {
        return Arrays.asList(moduleName, objectName, location);
    }
}
