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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.xilinx.spygen.hdl.CyclicHierarchyException;
import com.xilinx.spygen.hdl.HDLHierInst;
import com.xilinx.spygen.hdl.HDLInstance;
import com.xilinx.spygen.hdl.HDLModule;
import com.xilinx.spygen.hdl.HDLModuleRegistry;
import com.xilinx.spygen.hdl.HDLPort;
import com.xilinx.spygen.hdl.HDLSignal;
import com.xilinx.spygen.hdl.UnresolvedInstanceException;
import com.xilinx.spygen.util.MessageGenerator;

/**
 * Walks the instance hierarchy below the top module depth-first and collects the
 * ports and registers to spy on. At every module its ports come first, then its
 * registers, then the objects of its instances in declaration order.
 */
public class SignalFlattener {

    private final HDLModuleRegistry registry;

    private final SpyMode mode;

    private final SpyNaming naming;

    private final boolean skipUnobservable;

    private final List<SpyEntry> entries = new ArrayList<>();

    private final Set<String> seen = new HashSet<>();

    private SignalFlattener(HDLModuleRegistry registry, SpyMode mode, SpyNaming naming,
                            boolean skipUnobservable) {
        this.registry = registry;
        this.mode = mode;
        this.naming = naming;
        this.skipUnobservable = skipUnobservable;
    }

    public static List<SpyEntry> flatten(HDLModule top, HDLModuleRegistry registry, SpyMode mode) {
        return flatten(top, registry, mode, new SpyNaming());
    }

    /**
     * Collects the spy entries of a design. Output names are the bare object names.
     * @param top The top module
     * @param registry All modules of the design
     * @param mode Which objects to collect
     * @param naming Decides which internal signals are registers
     * @return The entries in traversal order.
     * @throws CyclicHierarchyException if a module type occurs twice on one path
     * @throws UnresolvedInstanceException if an instance refers to an unknown module
     * @throws UnobservableObjectException for the first register or instance that has
     * no hierarchical name without elaboration
     */
    public static List<SpyEntry> flatten(HDLModule top, HDLModuleRegistry registry, SpyMode mode,
                                         SpyNaming naming) {
        return flatten(top, registry, mode, naming, false);
    }

    /**
     * Collects the spy entries of a design.
     * @param skipUnobservable If true, registers and instances without a hierarchical
     * name are left out with a warning instead of failing
     * @see #flatten(HDLModule, HDLModuleRegistry, SpyMode, SpyNaming)
     */
    public static List<SpyEntry> flatten(HDLModule top, HDLModuleRegistry registry, SpyMode mode,
                                         SpyNaming naming, boolean skipUnobservable) {
        SignalFlattener flattener = new SignalFlattener(registry, mode, naming, skipUnobservable);
        flattener.visit(HDLHierInst.createTop(top));
        return flattener.entries;
    }

    private void add(HDLHierInst path, SpyEntry entry) {
        if (seen.add(path.toString() + HDLHierInst.HIER_SEP + entry.getScopedName())) {
            entries.add(entry);
        }
    }

    /**
     * @return True if the module or anything instantiated below it holds an object
     * the current mode would collect.
     */
    private boolean hasSpyTargets(HDLModule module, Set<String> visited) {
        if (!visited.add(module.getName())) {
            return false;
        }
        if (mode.includesPorts() && !module.getPorts().isEmpty()) {
            return true;
        }
        if (mode.includesRegisters()) {
            for (HDLSignal signal : module.getSignals()) {
                if (naming.isRegisterName(signal.getName())) {
                    return true;
                }
            }
        }
        for (HDLInstance inst : registry.getModuleInstances(module)) {
            HDLModule child = registry.getModule(inst.getModuleTypeName());
            if (child != null && hasSpyTargets(child, visited)) {
                return true;
            }
        }
        return false;
    }

    private void visit(HDLHierInst path) {
        HDLModule module = path.getModule();
        if (mode.includesPorts()) {
            for (HDLPort port : module.getPorts()) {
                add(path, new SpyEntry(path, port, SpyKind.PORT));
            }
        }
        if (mode.includesRegisters()) {
            for (HDLSignal signal : module.getSignals()) {
                if (!naming.isRegisterName(signal.getName())) continue;
                if (!signal.isObservable()) {
                    if (!skipUnobservable) {
                        throw UnobservableObjectException.forRegister(path, signal);
                    }
                    MessageGenerator.warning("Skipping register " + signal.getScopedName() + " of module "
                            + module.getName() + " (line " + signal.getLine() + "), it sits in a loop or unnamed "
                            + "generate block and has no hierarchical name without elaboration");
                    continue;
                }
                add(path, new SpyEntry(path, signal, SpyKind.REGISTER));
            }
        }
        for (HDLInstance inst : registry.getModuleInstances(module)) {
            HDLModule child = registry.getModule(inst.getModuleTypeName());
            if (child == null) {
                throw new UnresolvedInstanceException(module, inst);
            }
            if (path.containsModuleType(child.getName())) {
                throw new CyclicHierarchyException(child.getName(), path);
            }
            if (!inst.isObservable()) {
                if (!hasSpyTargets(child, new HashSet<>())) {
                    continue;
                }
                if (!skipUnobservable) {
                    throw UnobservableObjectException.forInstance(path, inst);
                }
                MessageGenerator.warning("Not descending into instance " + inst.getScopedName() + " of module "
                        + module.getName() + " (line " + inst.getLine() + "), it is an instance array or sits "
                        + "in a loop or unnamed generate block");
                continue;
            }
            visit(path.getChild(inst, child));
        }
    }
}
