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

/**
 * The spy entries contributed by one module type, over all of its instances.
 */
public class ModuleSection {

    private final HDLModule module;

    private final List<SpyEntry> entries;

    private final List<SpyAssignment> assignments;

    public ModuleSection(HDLModule module, List<SpyEntry> entries, List<SpyAssignment> assignments) {
        this.module = module;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.assignments = Collections.unmodifiableList(new ArrayList<>(assignments));
    }

    public HDLModule getModule() {
        return module;
    }

    public String getModuleName() {
        return module.getName();
    }

    public List<SpyEntry> getEntries() {
        return entries;
    }

    /**
     * @return One assignment per entry, except for ports of the top module.
     */
    public List<SpyAssignment> getAssignments() {
        return assignments;
    }

    /**
     * @return The entries that need a signal declaration in the interface body.
     */
    public List<SpyEntry> getDeclaredEntries() {
        List<SpyEntry> list = new ArrayList<>();
        for (SpyEntry e : entries) {
            if (!e.isTopLevelPort()) list.add(e);
        }
        return list;
    }
}
