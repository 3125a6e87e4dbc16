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
import java.util.Arrays;
import java.util.List;

import com.xilinx.spygen.hdl.HDLDeclaration;
import com.xilinx.spygen.hdl.HDLHierInst;
import com.xilinx.spygen.hdl.HDLModule;
import com.xilinx.spygen.hdl.HDLSignal;

/**
 * One port or register of the design hierarchy to be exposed by the spy interface.
 * Immutable; the conflict resolver creates a renamed copy with
 * {@link #withOutputName(String)}.
 */
public class SpyEntry {

    private final HDLHierInst path;

    private final HDLDeclaration source;

    private final SpyKind kind;

    private final String outputName;

    public SpyEntry(HDLHierInst path, HDLDeclaration source, SpyKind kind) {
        this(path, source, kind, source.getName());
    }

    private SpyEntry(HDLHierInst path, HDLDeclaration source, SpyKind kind, String outputName) {
        this.path = path;
        this.source = source;
        this.kind = kind;
        this.outputName = outputName;
    }

    public SpyEntry withOutputName(String name) {
        return new SpyEntry(path, source, kind, name);
    }

    public HDLHierInst getPath() {
        return path;
    }

    public HDLDeclaration getSource() {
        return source;
    }

    public SpyKind getKind() {
        return kind;
    }

    /**
     * @return The module that declares the spied object.
     */
    public HDLModule getModule() {
        return path.getModule();
    }

    public String getBareName() {
        return source.getName();
    }

    /**
     * @return The name of the spy signal in the interface.
     */
    public String getOutputName() {
        return outputName;
    }

    /**
     * @return The name inside the declaring module, generate scope included.
     */
    public String getScopedName() {
        return source instanceof HDLSignal ? ((HDLSignal) source).getScopedName() : source.getName();
    }

    /**
     * Gets the names available to disambiguate this entry, outermost first: the
     * instance path followed by the generate scope of the signal.
     * @return The qualifier segments, empty for an object of the top module scope.
     */
    public List<String> getQualifiers() {
        List<String> qualifiers = new ArrayList<>(path.getPathSegments());
        if (source instanceof HDLSignal && !((HDLSignal) source).getScope().isEmpty()) {
            qualifiers.addAll(Arrays.asList(((HDLSignal) source).getScope().split("\\.")));
        }
        return qualifiers;
    }

    /**
     * @return The upward reference to the spied object, e.g. "top.i_rx.data_s".
     */
    public String getHierarchicalReference() {
        return path.getHierarchicalReference(getScopedName());
    }

    /**
     * @return True for a port of the top module, which the interface observes through
     * its own port list.
     */
    public boolean isTopLevelPort() {
        return kind == SpyKind.PORT && path.isTop();
    }

    @Override
    public String toString() {
        return getHierarchicalReference() + " -> " + outputName;
    }
}
