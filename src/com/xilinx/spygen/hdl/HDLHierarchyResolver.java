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

import java.util.List;

/**
 * Determines the top module of a design: the single module of the registry that
 * no other module instantiates.
 */
public class HDLHierarchyResolver {

    /**
     * Checks that every instance refers to a module of the registry. Instances of
     * interfaces, programs and primitives defined in the analyzed files are not
     * module instances and are left out. Modules are visited in registry order and
     * their instances in declaration order.
     * @param registry The modules of the design
     * @throws UnresolvedInstanceException for the first instance of an unknown module type
     */
    public static void validateInstances(HDLModuleRegistry registry) {
        for (HDLModule m : registry.getModules()) {
            for (HDLInstance inst : registry.getModuleInstances(m)) {
                if (!registry.contains(inst.getModuleTypeName())) {
                    throw new UnresolvedInstanceException(m, inst);
                }
            }
        }
    }

    /**
     * Finds the top module of the design. Locks the registry.
     * @param registry The modules of the design
     * @return The unique module not instantiated by any other module.
     * @throws UnresolvedInstanceException if an instance refers to an unknown module
     * @throws NoTopModuleException if every module is instantiated (or there is none)
     * @throws AmbiguousTopModuleException if more than one module is never instantiated
     */
    public static HDLModule resolveTop(HDLModuleRegistry registry) {
        return resolveTop(registry, null);
    }

    /**
     * Finds the top module of the design, or checks an explicitly requested one.
     * Locks the registry.
     * @param registry The modules of the design
     * @param explicitTop Name of the top module to use, or null to detect it
     * @return The top module.
     */
    public static HDLModule resolveTop(HDLModuleRegistry registry, String explicitTop) {
        registry.lock();
        validateInstances(registry);
        if (explicitTop != null) {
            HDLModule top = registry.getModule(explicitTop);
            if (top == null) {
                throw new NoTopModuleException(explicitTop);
            }
            return top;
        }
        HDLInstanceGraph graph = new HDLInstanceGraph(registry);
        List<String> candidates = graph.getTopCandidates();
        if (candidates.isEmpty()) {
            throw new NoTopModuleException(registry.size(), graph.getModulesOnCycles());
        }
        if (candidates.size() > 1) {
            throw new AmbiguousTopModuleException(candidates);
        }
        return registry.getModule(candidates.get(0));
    }
}
