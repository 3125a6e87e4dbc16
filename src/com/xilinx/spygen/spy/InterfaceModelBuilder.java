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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.xilinx.spygen.hdl.HDLModule;
import com.xilinx.spygen.hdl.HDLParameter;

/**
 * Groups resolved spy entries by the module that declares them and attaches the
 * assignments from the design to the interface signals.
 */
public class InterfaceModelBuilder {

    /**
     * @param top The top module
     * @param resolved Entries with resolved output names, in traversal order
     * @param mode The mode the entries were collected with
     * @return The model of the interface.
     */
    public static InterfaceModel build(HDLModule top, List<SpyEntry> resolved, SpyMode mode) {
        Map<String, List<SpyEntry>> byModule = new LinkedHashMap<>();
        Map<String, HDLModule> modules = new LinkedHashMap<>();
        // top first, even when it contributes nothing
        byModule.put(top.getName(), new ArrayList<>());
        modules.put(top.getName(), top);
        for (SpyEntry e : resolved) {
            byModule.computeIfAbsent(e.getModule().getName(), k -> new ArrayList<>()).add(e);
            modules.putIfAbsent(e.getModule().getName(), e.getModule());
        }

        List<ModuleSection> sections = new ArrayList<>();
        for (Map.Entry<String, List<SpyEntry>> me : byModule.entrySet()) {
            List<SpyEntry> entries = me.getValue();
            if (entries.isEmpty()) continue;
            List<SpyAssignment> assignments = new ArrayList<>();
            for (SpyEntry e : entries) {
                if (!e.isTopLevelPort()) {
                    assignments.add(new SpyAssignment(e.getOutputName(), e.getHierarchicalReference()));
                }
            }
            sections.add(new ModuleSection(modules.get(me.getKey()), entries, assignments));
        }
        return new InterfaceModel(top, mode, sections, top.getPorts(), getOverridableParameters(top));
    }

    /**
     * Parameters of the header parameter port list if there is one, otherwise the
     * body parameters, which are overridable in that case only.
     */
    static List<HDLParameter> getOverridableParameters(HDLModule module) {
        List<HDLParameter> header = module.getHeaderParameters();
        return header.isEmpty() ? module.getParameters() : header;
    }
}
