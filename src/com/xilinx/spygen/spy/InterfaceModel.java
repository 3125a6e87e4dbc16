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
import java.util.Collections;
import java.util.List;

import com.xilinx.spygen.hdl.HDLModule;
import com.xilinx.spygen.hdl.HDLParameter;
import com.xilinx.spygen.hdl.HDLPort;

/**
 * Everything needed to write the spy interface and its bind statement, without
 * any text formatting.
 */
public class InterfaceModel {

    private final HDLModule topModule;

    private final SpyMode mode;

    private final List<ModuleSection> sections;

    private final List<HDLPort> topPorts;

    private final List<HDLParameter> topParameters;

    public InterfaceModel(HDLModule topModule, SpyMode mode, List<ModuleSection> sections,
                          List<HDLPort> topPorts, List<HDLParameter> topParameters) {
        this.topModule = topModule;
        this.mode = mode;
        this.sections = Collections.unmodifiableList(new ArrayList<>(sections));
        this.topPorts = Collections.unmodifiableList(new ArrayList<>(topPorts));
        this.topParameters = Collections.unmodifiableList(new ArrayList<>(topParameters));
    }

    public HDLModule getTopModule() {
        return topModule;
    }

    public String getTopModuleName() {
        return topModule.getName();
    }

    public SpyMode getMode() {
        return mode;
    }

    /**
     * @return The sections in order of first appearance in the hierarchy, top first.
     */
    public List<ModuleSection> getSections() {
        return sections;
    }

    public ModuleSection getSection(String moduleName) {
        for (ModuleSection s : sections) {
            if (s.getModuleName().equals(moduleName)) return s;
        }
        return null;
    }

    /**
     * @return The ports of the top module, which become the ports of the interface.
     */
    public List<HDLPort> getTopPorts() {
        return topPorts;
    }

    /**
     * @return The overridable parameters of the top module, passed through by the bind.
     */
    public List<HDLParameter> getTopParameters() {
        return topParameters;
    }

    /**
     * @return All entries, section by section.
     */
    public List<SpyEntry> getEntries() {
        List<SpyEntry> list = new ArrayList<>();
        for (ModuleSection s : sections) {
            list.addAll(s.getEntries());
        }
        return list;
    }

    /**
     * @return All assignments of all sections.
     */
    public List<SpyAssignment> getAssignments() {
        List<SpyAssignment> list = new ArrayList<>();
        for (ModuleSection s : sections) {
            list.addAll(s.getAssignments());
        }
        return list;
    }
}
