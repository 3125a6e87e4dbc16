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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A path of {@link HDLInstance}s from the top module down to some module in the
 * design, together with the {@link HDLModule}s resolved along the way.
 *
 * Instances of this class are immutable: Once created, it cannot be changed. The
 * path without any instance denotes the top module itself.
 */
public class HDLHierInst {

    /** Separator of hierarchical references in SystemVerilog */
    public static final String HIER_SEP = ".";

    private final HDLInstance[] insts;

    /** modules[0] is the top, modules[i+1] the module of insts[i] */
    private final HDLModule[] modules;

    private HDLHierInst(HDLInstance[] insts, HDLModule[] modules) {
        this.insts = insts;
        this.modules = modules;
    }

    /**
     * Create the hierarchy node of the top module (empty instance path).
     * @param top The top module
     * @return a new instance
     */
    public static HDLHierInst createTop(HDLModule top) {
        return new HDLHierInst(new HDLInstance[0], new HDLModule[]{top});
    }

    /**
     * Extends this path by one instance.
     * @param inst An instance of {@link #getModule()}
     * @param instModule The module inst refers to
     * @return The path of the child
     */
    public HDLHierInst getChild(HDLInstance inst, HDLModule instModule) {
        if (!inst.getModuleTypeName().equals(instModule.getName())) {
            throw new IllegalArgumentException("Instance " + inst.getName() + " is of type "
                    + inst.getModuleTypeName() + ", not " + instModule.getName());
        }
        HDLInstance[] childInsts = Arrays.copyOf(insts, insts.length+1);
        childInsts[insts.length] = inst;
        HDLModule[] childModules = Arrays.copyOf(modules, modules.length+1);
        childModules[modules.length] = instModule;
        return new HDLHierInst(childInsts, childModules);
    }

    public HDLHierInst getParent() {
        if (insts.length == 0) {
            return null;
        }
        return new HDLHierInst(Arrays.copyOf(insts, insts.length-1), Arrays.copyOf(modules, modules.length-1));
    }

    public boolean isTop() {
        return insts.length == 0;
    }

    /**
     * @return Number of instances on the path, 0 for the top module.
     */
    public int getDepth() {
        return insts.length;
    }

    public HDLModule getTopModule() {
        return modules[0];
    }

    /**
     * @return The module at the end of the path.
     */
    public HDLModule getModule() {
        return modules[modules.length-1];
    }

    /**
     * @return The last instance of the path, or null for the top module.
     */
    public HDLInstance getInst() {
        return insts.length == 0 ? null : insts[insts.length-1];
    }

    public List<HDLInstance> getInstances() {
        return Collections.unmodifiableList(Arrays.asList(insts));
    }

    /**
     * Checks if a module of the given type already occurs on this path.
     * @param moduleName Name of the module type
     * @return True if the top module or any module along the path has that name.
     */
    public boolean containsModuleType(String moduleName) {
        for (HDLModule m : modules) {
            if (m.getName().equals(moduleName)) return true;
        }
        return false;
    }

    /**
     * Gets the name segments of this path, outermost first. Generate block labels
     * an instance is nested in precede the instance name.
     * @return The segments, e.g. [i_core, g_fast, i_alu].
     */
    public List<String> getPathSegments() {
        List<String> segments = new ArrayList<>();
        for (HDLInstance inst : insts) {
            if (!inst.getScope().isEmpty()) {
                segments.addAll(Arrays.asList(inst.getScope().split("\\.")));
            }
            segments.add(inst.getName());
        }
        return segments;
    }

    /**
     * @return The instance path below the top, e.g. "i_core.i_alu", or an empty string.
     */
    public String getFullHierarchicalInstName() {
        return String.join(HIER_SEP, getPathSegments());
    }

    /**
     * Builds a hierarchical reference to an object of the module at the end of the
     * path, rooted at the top module name, e.g. "top.i_core.cnt_s".
     * @param scopedName Name of the object inside the module, including its generate scope
     * @return The upward reference.
     */
    public String getHierarchicalReference(String scopedName) {
        StringBuilder sb = new StringBuilder(getTopModule().getName());
        for (String segment : getPathSegments()) {
            sb.append(HIER_SEP).append(segment);
        }
        sb.append(HIER_SEP).append(scopedName);
        return sb.toString();
    }

    /**
     * @return The path with the module types, "top/i_a(mod_a)/i_b(mod_b)".
     */
    public String getModuleTypePath() {
        StringBuilder sb = new StringBuilder(modules[0].getName());
        for (int i = 0; i < insts.length; i++) {
            sb.append('/').append(insts[i].getScopedName()).append('(').append(modules[i+1].getName()).append(')');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HDLHierInst that = (HDLHierInst) o;
        return Arrays.equals(insts, that.insts) && modules[0].equals(that.modules[0]);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(insts) + modules[0].hashCode();
    }

    @Override
    public String toString() {
        return isTop() ? getTopModule().getName() : getTopModule().getName() + HIER_SEP + getFullHierarchicalInstName();
    }
}
