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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An instantiation of a module inside another module. The instantiated module is
 * referenced by name only; it is looked up in an {@link HDLModuleRegistry} when the
 * hierarchy is resolved.
 */
public class HDLInstance extends HDLName {

    private final String moduleTypeName;

    private final Map<String, String> parameterOverrides;

    private final String arrayDims;

    private final String scope;

    private final boolean observable;

    private final int line;

    /**
     * @param name Instance name
     * @param moduleTypeName Name of the instantiated module
     * @param parameterOverrides Parameter name to value text. Positional overrides are keyed
     * by their zero-based position ("0", "1", ...)
     * @param arrayDims Instance array dimensions, or empty
     * @param scope Labels of the enclosing generate blocks, separated by '.', empty for module scope
     * @param observable False if the instance sits in a generate block that can only be named after
     * elaboration (loop generate or unnamed block)
     * @param line Line of the instantiation
     */
    public HDLInstance(String name, String moduleTypeName, Map<String, String> parameterOverrides,
                       String arrayDims, String scope, boolean observable, int line) {
        super(name);
        this.moduleTypeName = moduleTypeName;
        this.parameterOverrides = parameterOverrides == null || parameterOverrides.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameterOverrides));
        this.arrayDims = arrayDims == null ? "" : arrayDims;
        this.scope = scope == null ? "" : scope;
        this.observable = observable;
        this.line = line;
    }

    public HDLInstance(String name, String moduleTypeName) {
        this(name, moduleTypeName, null, "", "", true, 0);
    }

    public String getModuleTypeName() {
        return moduleTypeName;
    }

    /**
     * @return The parameter overrides in the order written, unmodifiable.
     */
    public Map<String, String> getParameterOverrides() {
        return parameterOverrides;
    }

    public String getArrayDims() {
        return arrayDims;
    }

    public String getScope() {
        return scope;
    }

    /**
     * @return The name as seen from the parent module, scope included, e.g. "g_fifo.i_fifo".
     */
    public String getScopedName() {
        return scope.isEmpty() ? getName() : scope + "." + getName();
    }

    /**
     * @return True if the instance can be referenced hierarchically without elaborating the
     * design. Instance arrays and instances in loop or unnamed generate blocks cannot.
     */
    public boolean isObservable() {
        return observable && arrayDims.isEmpty();
    }

    public int getLine() {
        return line;
    }
}
