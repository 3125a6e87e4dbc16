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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds all modules of a design, keyed by module name. Module names are unique:
 * adding a second module of the same name fails with a
 * {@link DuplicateModuleException}. Once hierarchy resolution starts the registry
 * is locked and does not accept new modules.
 * <p>
 * The registry also remembers the names of the interfaces, programs and
 * primitives found next to the modules. Instantiating one of those inside a
 * module is legal but does not create a module instance.
 */
public class HDLModuleRegistry {

    private final Map<String, HDLModule> modules = new LinkedHashMap<>();

    /** Interface, program and primitive names to their keyword */
    private final Map<String, String> otherUnits = new LinkedHashMap<>();

    private boolean locked;

    public HDLModuleRegistry() {
    }

    public HDLModuleRegistry(Collection<HDLModule> modules) {
        addModules(modules);
    }

    /**
     * Adds a module to the registry.
     * @param module The module to add
     * @return The added module
     * @throws DuplicateModuleException if a different module of the same name is present
     * @throws IllegalStateException if the registry is locked
     */
    public HDLModule addModule(HDLModule module) {
        if (locked) {
            throw new IllegalStateException("ERROR: Failed to add module " + module.getName()
                    + ", the module registry is locked once hierarchy resolution has started.");
        }
        return modules.compute(module.getName(), (k,v) -> {
            if (v == null || v == module) {
                return module;
            }
            throw new DuplicateModuleException(v, module);
        });
    }

    public void addModules(Collection<HDLModule> list) {
        for (HDLModule m : list) {
            addModule(m);
        }
    }

    /**
     * Records an instantiable design unit that is not a module.
     * @param keyword The unit keyword, e.g. "interface"
     * @param name Name of the unit
     * @throws IllegalStateException if the registry is locked
     */
    public void addOtherDesignUnit(String keyword, String name) {
        if (locked) {
            throw new IllegalStateException("ERROR: Failed to add " + keyword + " " + name
                    + ", the module registry is locked once hierarchy resolution has started.");
        }
        otherUnits.putIfAbsent(name, keyword);
    }

    public void addOtherDesignUnits(Map<String, String> units) {
        for (Map.Entry<String, String> e : units.entrySet()) {
            addOtherDesignUnit(e.getValue(), e.getKey());
        }
    }

    /**
     * @return Names of the recorded interfaces, programs and primitives to their keyword.
     */
    public Map<String, String> getOtherDesignUnits() {
        return Collections.unmodifiableMap(otherUnits);
    }

    /**
     * @param name A type name used in an instantiation
     * @return True if the name is an interface, program or primitive and no module has that name.
     */
    public boolean isOtherDesignUnit(String name) {
        return otherUnits.containsKey(name) && !modules.containsKey(name);
    }

    /**
     * Gets the instances of a module that instantiate modules, leaving out instances
     * of recorded interfaces, programs and primitives.
     * @param module A module of the design
     * @return The module instances in declaration order.
     */
    public List<HDLInstance> getModuleInstances(HDLModule module) {
        List<HDLInstance> result = new ArrayList<>(module.getInstances().size());
        for (HDLInstance inst : module.getInstances()) {
            if (!isOtherDesignUnit(inst.getModuleTypeName())) {
                result.add(inst);
            }
        }
        return result;
    }

    public HDLModule getModule(String name) {
        return modules.get(name);
    }

    public boolean contains(String name) {
        return modules.containsKey(name);
    }

    /**
     * @return All modules in the order they were added.
     */
    public List<HDLModule> getModules() {
        return new ArrayList<>(modules.values());
    }

    public Map<String, HDLModule> getModuleMap() {
        return Collections.unmodifiableMap(modules);
    }

    public int size() {
        return modules.size();
    }

    public boolean isEmpty() {
        return modules.isEmpty();
    }

    /**
     * Freezes the registry. Later calls to {@link #addModule(HDLModule)} fail.
     */
    public void lock() {
        locked = true;
    }

    public boolean isLocked() {
        return locked;
    }
}
