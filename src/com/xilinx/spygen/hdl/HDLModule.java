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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A module definition extracted from source. Created once per textual module
 * definition by {@link HDLParser}; immutable afterwards.
 */
public class HDLModule extends HDLName {

    private final String fileName;

    private final int line;

    private final List<HDLParameter> parameters;

    private final Map<String, HDLPort> ports;

    private final List<HDLSignal> signals;

    private final List<HDLInstance> instances;

    public HDLModule(String name, String fileName, int line, List<HDLParameter> parameters,
                     List<HDLPort> ports, List<HDLSignal> signals, List<HDLInstance> instances) {
        super(name);
        this.fileName = fileName;
        this.line = line;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        Map<String, HDLPort> portMap = new LinkedHashMap<>();
        for (HDLPort p : ports) {
            if (portMap.put(p.getName(), p) != null) {
                throw new IllegalArgumentException("Module " + name + " has two ports named " + p.getName());
            }
        }
        this.ports = Collections.unmodifiableMap(portMap);
        this.signals = Collections.unmodifiableList(new ArrayList<>(signals));
        this.instances = Collections.unmodifiableList(new ArrayList<>(instances));
    }

    /**
     * @return The file this module was read from, or null if unknown.
     */
    public String getFileName() {
        return fileName;
    }

    /**
     * @return The line of the module keyword, 0 if unknown.
     */
    public int getLine() {
        return line;
    }

    /**
     * @return "file:line" of the module header, used in error messages.
     */
    public String getLocation() {
        return (fileName == null ? "<unknown>" : fileName) + ":" + line;
    }

    public List<HDLParameter> getParameters() {
        return parameters;
    }

    /**
     * @return The parameters declared in the module header parameter port list.
     */
    public List<HDLParameter> getHeaderParameters() {
        List<HDLParameter> list = new ArrayList<>();
        for (HDLParameter p : parameters) {
            if (p.isHeaderParameter()) list.add(p);
        }
        return list;
    }

    public List<HDLPort> getPorts() {
        return new ArrayList<>(ports.values());
    }

    public HDLPort getPort(String name) {
        return ports.get(name);
    }

    public boolean hasPort(String name) {
        return ports.containsKey(name);
    }

    public List<HDLSignal> getSignals() {
        return signals;
    }

    /**
     * Gets a module-scope signal by name.
     * @param name Name of the signal
     * @return The signal, or null if this module has no signal of that name outside generate blocks.
     */
    public HDLSignal getSignal(String name) {
        for (HDLSignal s : signals) {
            if (s.getScope().isEmpty() && s.getName().equals(name)) return s;
        }
        return null;
    }

    public List<HDLInstance> getInstances() {
        return instances;
    }

    public HDLInstance getInstance(String name) {
        for (HDLInstance i : instances) {
            if (i.getName().equals(name)) return i;
        }
        return null;
    }

    /**
     * @return True if this module does not instantiate any other module.
     */
    public boolean isLeaf() {
        return instances.isEmpty();
    }
}
