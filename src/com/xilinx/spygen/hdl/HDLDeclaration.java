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
 * A named, typed data object declared in a module: a port or an internal signal.
 * Type, width and array dimensions are opaque text, preserved as written in
 * source (runs of whitespace and comments between tokens become a single space).
 */
public abstract class HDLDeclaration extends HDLName {

    private final String type;

    private final String width;

    private final String arrayDims;

    protected HDLDeclaration(String name, String type, String width, String arrayDims) {
        super(name);
        this.type = type == null ? "" : type;
        this.width = width == null ? "" : width;
        this.arrayDims = arrayDims == null ? "" : arrayDims;
    }

    /**
     * @return The data/net type text, e.g. "logic", "wire", "state_t", or an empty string.
     */
    public String getType() {
        return type;
    }

    /**
     * @return The packed dimensions, e.g. "[WIDTH-1:0]", or an empty string for scalars.
     */
    public String getWidth() {
        return width;
    }

    /**
     * @return The unpacked (array) dimensions following the name, e.g. "[DEPTH]",
     * or an empty string.
     */
    public String getArrayDims() {
        return arrayDims;
    }

    public boolean isPort() {
        return false;
    }
}
