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

/**
 * An internal signal (net or variable) declared in the body of an {@link HDLModule}.
 */
public class HDLSignal extends HDLDeclaration {

    private final String scope;

    private final boolean observable;

    private final int line;

    /**
     * @param name Signal name
     * @param type Type text
     * @param width Packed dimension text
     * @param arrayDims Unpacked dimension text
     * @param scope Labels of the enclosing generate blocks, separated by '.', empty for module scope
     * @param observable False if the signal sits in a generate block that can only be named after
     * elaboration (loop generate or unnamed block)
     * @param line Line of the declaration
     */
    public HDLSignal(String name, String type, String width, String arrayDims, String scope,
                     boolean observable, int line) {
        super(name, type, width, arrayDims);
        this.scope = scope == null ? "" : scope;
        this.observable = observable;
        this.line = line;
    }

    public HDLSignal(String name, String type, String width, String arrayDims) {
        this(name, type, width, arrayDims, "", true, 0);
    }

    /**
     * @return The generate scope the signal is declared in, e.g. "g_fast", or an empty string.
     */
    public String getScope() {
        return scope;
    }

    /**
     * @return The name as seen from the module, scope included, e.g. "g_fast.cnt_s".
     */
    public String getScopedName() {
        return scope.isEmpty() ? getName() : scope + "." + getName();
    }

    /**
     * @return True if the signal can be referenced hierarchically without elaborating the design.
     */
    public boolean isObservable() {
        return observable;
    }

    public int getLine() {
        return line;
    }
}
